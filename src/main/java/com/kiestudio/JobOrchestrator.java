package com.kiestudio;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Submits confirmed generations and polls them to a terminal state on a scheduler, away from chat handling.
 * A success is charged exactly once, and only while the session that submitted it is still the user's session.
 */
public class JobOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(JobOrchestrator.class);
    static final int PROGRESS_EVERY = 6;

    private final Database db;
    private final KieClient kieClient;
    private final SessionStore sessions;
    private final Replies replies;
    private final ResultDelivery delivery;
    private final ScheduledExecutorService scheduler;
    private final long pollIntervalMillis;
    private final int maxAttempts;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Map<String, GenerationJob> jobs = new ConcurrentHashMap<>();

    public JobOrchestrator(Config config,
                           Database db,
                           KieClient kieClient,
                           SessionStore sessions,
                           Messenger messenger,
                           ResultDelivery delivery,
                           ScheduledExecutorService scheduler) {
        this.db = db;
        this.kieClient = kieClient;
        this.sessions = sessions;
        this.replies = new Replies(messenger);
        this.delivery = delivery;
        this.scheduler = scheduler;
        this.pollIntervalMillis = config.pollIntervalMillis;
        this.maxAttempts = config.pollMaxAttempts;
    }

    /**
     * Handles the confirm button. Must be called under the user's session lock with the user's current session.
     * Returns the registered job, or empty when nothing was submitted.
     */
    public Optional<GenerationJob> confirm(Inbound in, Session session) {
        if (session.isGenerating()) {
            replies.send(in.chatId, "⏳ Генерация уже запущена. Дождитесь результата.");
            return Optional.empty();
        }
        if (session.state != Session.State.CONFIRMING_GENERATION) {
            replies.send(in.chatId, "⚠️ Сначала заполните все параметры.");
            return Optional.empty();
        }
        if (!kieClient.isConfigured()) {
            sessions.clear(in.userId);
            replies.send(in.chatId, Texts.KIE_DISABLED, Keyboards.backToMenu());
            return Optional.empty();
        }
        if (db.isBlocked(in.userId)) {
            sessions.clear(in.userId);
            replies.send(in.chatId, Texts.BLOCKED);
            return Optional.empty();
        }

        Role role = db.roleOf(in.userId);
        BigDecimal price = Pricing.price(session.model.id, session.params, role);
        if (!canAfford(in, role, price)) {
            sessions.clear(in.userId);
            return Optional.empty();
        }

        String taskId;
        try {
            taskId = kieClient.createTask(session.model.id, buildInput(session.params));
        } catch (IOException e) {
            log.warn("createTask failed for user {} model {}: {}", in.userId, session.model.id, e.getMessage());
            sessions.clear(in.userId);
            replies.send(in.chatId, "❌ <b>Не удалось создать задачу:</b>\n" + Texts.escape(e.getMessage())
                    + "\n\nСредства не списаны. Попробуйте ещё раз позже.", Keyboards.backToMenu());
            return Optional.empty();
        }

        session.taskId = taskId;
        session.pollAttempts = 0;
        GenerationJob job = new GenerationJob(in.chatId, taskId, session, role, price);
        jobs.put(job.key(), job);

        String text = "✅ <b>Задача создана!</b>\n\n"
                + (role.isAdmin() ? "Task ID: <code>" + Texts.escape(taskId) + "</code>\n\n" : "")
                + "⏳ Ожидаю завершения генерации...";
        job.progressMessageId = replies.reply(in, text, List.of()).orElse(null);
        log.info("Job {} submitted: model={} role={} price={}", job.key(), job.model.id, role, price);
        schedule(job);
        return Optional.of(job);
    }

    private boolean canAfford(Inbound in, Role role, BigDecimal price) {
        switch (role) {
            case PRIMARY_ADMIN:
                return true;
            case LIMITED_ADMIN: {
                BigDecimal remaining = db.remainingFor(in.userId).orElse(price);
                if (remaining.compareTo(price) >= 0) {
                    return true;
                }
                replies.send(in.chatId, "❌ <b>Лимит исчерпан</b>\n\n"
                        + "Стоимость: " + Texts.rub(price) + "\n"
                        + "Осталось лимита: " + Texts.rub(remaining) + "\n\n"
                        + "Обратитесь к главному администратору для увеличения лимита.", Keyboards.backToMenu());
                return false;
            }
            default: {
                BigDecimal balance = db.getBalance(in.userId);
                if (balance.compareTo(price) >= 0) {
                    return true;
                }
                replies.send(in.chatId, "❌ <b>Недостаточно средств</b>\n\n"
                        + "Стоимость: " + Texts.rub(price) + "\n"
                        + "Ваш баланс: " + Texts.rub(balance) + "\n"
                        + "Не хватает: " + Texts.rub(price.subtract(balance)) + "\n\n"
                        + "Пополните баланс и повторите генерацию.", Keyboards.topUpOffer());
                return false;
            }
        }
    }

    ObjectNode buildInput(Map<String, Object> params) {
        ObjectNode input = mapper.createObjectNode();
        for (Map.Entry<String, Object> e : params.entrySet()) {
            Object value = e.getValue();
            if (value instanceof Boolean) {
                input.put(e.getKey(), (Boolean) value);
            } else if (value instanceof List) {
                ArrayNode arr = input.putArray(e.getKey());
                for (Object item : (List<?>) value) {
                    arr.add(String.valueOf(item));
                }
            } else if (value != null) {
                input.put(e.getKey(), value.toString());
            }
        }
        return input;
    }

    private void schedule(GenerationJob job) {
        try {
            job.nextPoll = scheduler.schedule(() -> poll(job), pollIntervalMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Scheduler rejected poll of job {}, dropping it", job.key());
            finish(job, GenerationJob.Outcome.ERROR);
        }
    }

    void poll(GenerationJob job) {
        if (job.isDone()) {
            return;
        }
        try {
            int attempt = job.nextAttempt();
            sessions.runLocked(job.userId, () -> {
                if (isCurrent(job)) {
                    job.session.pollAttempts = attempt;
                }
            });

            KieClient.TaskInfo info;
            try {
                info = kieClient.getTaskStatus(job.taskId);
            } catch (KieClient.KieApiException e) {
                log.warn("Status check of job {} failed: {}", job.key(), e.getMessage());
                endWithoutCharge(job, GenerationJob.Outcome.ERROR, "❌ <b>Ошибка проверки статуса:</b>\n"
                        + Texts.escape(e.getMessage()) + "\n\nСредства не списаны. Попробуйте ещё раз.");
                return;
            } catch (IOException e) {
                log.warn("Status check of job {} attempt {} hit a network error: {}", job.key(), attempt, e.getMessage());
                continueOrTimeout(job, attempt);
                return;
            }

            String state = info.state == null ? "" : info.state.toLowerCase(Locale.ROOT);
            switch (state) {
                case "success" -> onSuccess(job, info);
                case "fail" -> {
                    log.info("Job {} failed remotely: code={} msg={}", job.key(), info.failCode, info.failMsg);
                    endWithoutCharge(job, GenerationJob.Outcome.FAILED, "❌ <b>Генерация не удалась</b>\n\n"
                            + "Код: " + Texts.escape(info.failCode) + "\n"
                            + "Причина: " + Texts.escape(info.failMsg)
                            + "\n\nСредства не списаны. Измените запрос и попробуйте снова.");
                }
                case "waiting", "queuing", "generating" -> {
                    if (attempt % PROGRESS_EVERY == 0 && attempt < maxAttempts) {
                        notifyProgress(job, attempt);
                    }
                    continueOrTimeout(job, attempt);
                }
                default -> {
                    log.warn("Job {} reported unknown state '{}'", job.key(), info.state);
                    continueOrTimeout(job, attempt);
                }
            }
        } catch (RuntimeException e) {
            log.error("Polling of job {} crashed", job.key(), e);
            endWithoutCharge(job, GenerationJob.Outcome.ERROR,
                    "❌ Внутренняя ошибка при отслеживании задачи. Средства не списаны. Обратитесь в поддержку.");
        }
    }

    private void continueOrTimeout(GenerationJob job, int attempt) {
        if (attempt >= maxAttempts) {
            log.info("Job {} timed out after {} polls", job.key(), attempt);
            endWithoutCharge(job, GenerationJob.Outcome.TIMED_OUT, "⏱ <b>Время ожидания истекло</b>\n\n"
                    + "Генерация заняла слишком много времени. Средства не списаны, попробуйте ещё раз.");
            return;
        }
        schedule(job);
    }

    private void notifyProgress(GenerationJob job, int attempt) {
        long elapsedSeconds = attempt * pollIntervalMillis / 1000;
        String text = "⏳ Генерация продолжается... (" + elapsedSeconds + " сек.)";
        job.progressMessageId = replies.editOrSend(job.chatId, job.progressMessageId, text, List.of()).orElse(null);
    }

    private void onSuccess(GenerationJob job, KieClient.TaskInfo info) {
        Boolean charged = sessions.withLock(job.userId, () -> {
            if (!isCurrent(job)) {
                return null;
            }
            boolean ok = charge(job);
            sessions.save(job.userId, new Session.SavedGeneration(job.model, job.session.required));
            sessions.clear(job.userId);
            return ok;
        });
        if (charged == null) {
            log.warn("Job {} succeeded after its session was closed; result dropped without charge", job.key());
            finish(job, GenerationJob.Outcome.ORPHANED);
            return;
        }

        List<String> urls = delivery.extractUrls(job.model, job.params, info.resultJson);
        if (urls.isEmpty()) {
            log.warn("Job {} succeeded without result URLs", job.key());
            replies.send(job.chatId, "⚠️ Генерация завершена, но результат пуст. Обратитесь в поддержку.",
                    Keyboards.afterResult());
        } else {
            int delivered = delivery.deliver(job.chatId, job.model.output, urls, Keyboards.afterResult());
            log.info("Job {} delivered {}/{} artifacts", job.key(), delivered, urls.size());
        }
        finish(job, GenerationJob.Outcome.SUCCEEDED);
    }

    /** Returns false when the ledger refused the charge; the result is still delivered. */
    private boolean charge(GenerationJob job) {
        try {
            boolean ok = switch (job.role) {
                case PRIMARY_ADMIN -> true;
                case LIMITED_ADMIN -> db.addSpent(job.userId, job.price);
                case USER -> db.debit(job.userId, job.price);
            };
            if (!ok) {
                log.warn("Charge of {} for job {} refused by ledger (role {}); delivering anyway",
                        job.price, job.key(), job.role);
            }
            return ok;
        } catch (StorageException e) {
            log.error("Charge of {} for job {} failed", job.price, job.key(), e);
            replies.send(job.chatId, Texts.STORAGE_ERROR);
            return false;
        }
    }

    private void endWithoutCharge(GenerationJob job, GenerationJob.Outcome outcome, String message) {
        boolean current = sessions.withLock(job.userId, () -> isCurrent(job) && sessions.clearIfCurrent(job.userId, job.session));
        if (current) {
            replies.send(job.chatId, message, Keyboards.backToMenu());
        } else {
            log.info("Job {} ended as {} after its session was closed", job.key(), outcome);
        }
        finish(job, outcome);
    }

    private boolean isCurrent(GenerationJob job) {
        return sessions.get(job.userId)
                .map(s -> s == job.session && job.taskId.equals(s.taskId))
                .orElse(false);
    }

    private void finish(GenerationJob job, GenerationJob.Outcome outcome) {
        jobs.remove(job.key(), job);
        job.complete(outcome);
    }

    public Collection<GenerationJob> activeJobs() {
        return Collections.unmodifiableCollection(jobs.values());
    }

    public Optional<GenerationJob> find(long userId, String taskId) {
        return Optional.ofNullable(jobs.get(GenerationJob.key(userId, taskId)));
    }

    /** Stops tracking every job. Remote tasks keep running and are never charged. */
    public void cancelAll() {
        for (GenerationJob job : new ArrayList<>(jobs.values())) {
            log.info("Cancelling job {}", job.key());
            job.cancel();
            jobs.remove(job.key(), job);
        }
    }
}
