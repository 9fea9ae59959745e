package com.kiestudio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Drives each user through model selection and parameter collection, and routes the top-up and admin flows.
 * Every inbound event runs under the user's lock in {@link SessionStore}.
 */
public class SessionStateMachine {
    private static final Logger log = LoggerFactory.getLogger(SessionStateMachine.class);
    private static final int SUMMARY_VALUE_MAX = 200;

    private final Config config;
    private final ModelCatalog catalog;
    private final Database db;
    private final KieClient kieClient;
    private final SessionStore sessions;
    private final MediaFiles files;
    private final Replies replies;
    private final JobOrchestrator orchestrator;
    private final TopUpFlow topUp;
    private final AdminCommands admin;

    public SessionStateMachine(Config config,
                               ModelCatalog catalog,
                               Database db,
                               KieClient kieClient,
                               SessionStore sessions,
                               MediaFiles files,
                               Messenger messenger,
                               JobOrchestrator orchestrator,
                               TopUpFlow topUp,
                               AdminCommands admin) {
        this.config = config;
        this.catalog = catalog;
        this.db = db;
        this.kieClient = kieClient;
        this.sessions = sessions;
        this.files = files;
        this.replies = new Replies(messenger);
        this.orchestrator = orchestrator;
        this.topUp = topUp;
        this.admin = admin;
    }

    // Entry points

    public void onCommand(Inbound in, String command, String args) {
        handle(in, () -> {
            switch (command) {
                case "/start" -> replies.send(in.chatId, Texts.WELCOME, mainMenu(in));
                case "/help" -> replies.send(in.chatId, Texts.HELP + "\n\n" + Texts.support(config), Keyboards.backToMenu());
                case "/models" -> showCategories(in);
                case "/generate" -> {
                    sessions.put(new Session(in.userId, Session.State.SELECTING_MODEL));
                    showCategories(in);
                }
                case "/balance" -> showBalance(in);
                case "/cancel" -> cancel(in);
                default -> {
                    if (AdminCommands.isAdminCommand(command)) {
                        admin.handle(in, command, args);
                    } else {
                        replies.send(in.chatId, "❓ Неизвестная команда. Список команд: /help");
                    }
                }
            }
        });
    }

    public void onCallback(Inbound in, Command command) {
        handle(in, () -> {
            switch (command.type) {
                case SHOW_MODELS -> showCategories(in);
                case CATEGORY -> showModels(in, command.arg);
                case SELECT_MODEL -> selectModel(in, command.arg);
                case SET_PARAM -> withSession(in, s -> onParamButton(in, s, command.arg, command.value));
                case ADD_IMAGE -> withSession(in, s -> requestImage(in, s));
                case IMAGE_DONE -> withSession(in, s -> finishImages(in, s));
                case SKIP_IMAGE -> withSession(in, s -> skipImages(in, s));
                case CANCEL -> cancel(in);
                case CONFIRM_GENERATE -> withSession(in, s -> orchestrator.confirm(in, s));
                case GENERATE_AGAIN -> generateAgain(in);
                case CHECK_BALANCE -> showBalance(in);
                case TOPUP_BALANCE -> topUp.start(in);
                case TOPUP_AMOUNT -> withSession(in, s -> topUp.onPresetAmount(in, s, command.arg));
                case TOPUP_CUSTOM -> withSession(in, s -> topUp.onCustomRequested(in, s));
                case BACK_TO_MENU -> replies.reply(in, Texts.WELCOME, mainMenu(in));
                case HELP_MENU -> replies.reply(in, Texts.HELP + "\n\n" + Texts.support(config), Keyboards.backToMenu());
                case ADMIN_TEST_OCR -> admin.startOcrTest(in);
                case ADMIN_USER_MODE -> admin.toggleUserMode(in);
            }
        });
    }

    public void onText(Inbound in, String text) {
        handle(in, () -> withSession(in, s -> {
            switch (s.state) {
                case SELECTING_AMOUNT, WAITING_PAYMENT_SCREENSHOT -> topUp.onText(in, s, text);
                case INPUTTING_PARAMS -> onParamText(in, s, text);
                case SELECTING_MODEL -> replies.send(in.chatId, "👆 Выберите модель кнопками выше или /models.");
                case CONFIRMING_GENERATION -> replies.send(in.chatId,
                        s.isGenerating() ? "⏳ Генерация уже идёт. Дождитесь результата."
                                : "👆 Подтвердите генерацию или отмените её.", s.isGenerating() ? List.of() : Keyboards.confirm());
                case ADMIN_TEST_OCR -> replies.send(in.chatId, "📷 Отправьте скриншот фото.", Keyboards.cancelOnly());
            }
        }));
    }

    public void onPhoto(Inbound in, String fileRef) {
        handle(in, () -> withSession(in, s -> {
            switch (s.state) {
                case WAITING_PAYMENT_SCREENSHOT -> topUp.onScreenshot(in, s, fileRef);
                case ADMIN_TEST_OCR -> admin.onOcrScreenshot(in, fileRef);
                case INPUTTING_PARAMS -> {
                    if (s.waitingFor == Session.Waiting.IMAGE || s.waitingFor == Session.Waiting.IMAGE_CHOICE) {
                        addImage(in, s, fileRef);
                    } else {
                        replies.send(in.chatId, "⚠️ Сейчас изображение не ожидается. Следуйте подсказкам выше.");
                    }
                }
                default -> replies.send(in.chatId, "⚠️ Сейчас изображение не ожидается. Следуйте подсказкам выше.");
            }
        }));
    }

    private void handle(Inbound in, Runnable action) {
        sessions.runLocked(in.userId, () -> {
            try {
                action.run();
            } catch (StorageException e) {
                log.error("Ledger failure while handling user {}", in.userId, e);
                replies.send(in.chatId, Texts.STORAGE_ERROR);
            } catch (RuntimeException e) {
                log.error("Unexpected error while handling user {}", in.userId, e);
                replies.send(in.chatId, "⚠️ Произошла ошибка. Попробуйте ещё раз или обратитесь в поддержку.");
            }
        });
    }

    private void withSession(Inbound in, SessionAction action) {
        Optional<Session> session = sessions.get(in.userId);
        if (session.isEmpty()) {
            replies.send(in.chatId, Texts.NO_SESSION, Keyboards.backToMenu());
            return;
        }
        action.run(session.get());
    }

    // Menus

    private List<List<Messenger.Button>> mainMenu(Inbound in) {
        return Keyboards.mainMenu(in.userId == config.primaryAdminId, db.isInUserMode(in.userId));
    }

    private void cancel(Inbound in) {
        sessions.clear(in.userId);
        replies.reply(in, Texts.CANCELLED, mainMenu(in));
    }

    private void showCategories(Inbound in) {
        replies.reply(in, "🎨 <b>Выберите категорию:</b>", Keyboards.categories(catalog.categories()));
    }

    private void showModels(Inbound in, String category) {
        List<ModelSchema> models = catalog.byCategory(category);
        if (models.isEmpty()) {
            showCategories(in);
            return;
        }
        StringBuilder sb = new StringBuilder("📂 <b>").append(Texts.escape(category)).append("</b>\n\n");
        for (ModelSchema m : models) {
            sb.append(m.title()).append(" — ").append(Texts.escape(m.pricingText)).append("\n");
        }
        replies.reply(in, sb.toString(), Keyboards.models(models));
    }

    private void showBalance(Inbound in) {
        Role role = db.roleOf(in.userId);
        BigDecimal balance = db.getBalance(in.userId);
        switch (role) {
            case LIMITED_ADMIN -> replies.reply(in, "👑 <b>Админ с лимитом</b>\n\n"
                    + admin.limitSummary(in.userId) + "\n\n"
                    + "💰 <b>Баланс пользователя:</b> " + Texts.rub(balance), Keyboards.balance(false));
            case PRIMARY_ADMIN -> replies.reply(in, "💳 <b>Ваш баланс:</b> " + Texts.rub(balance) + "\n\n"
                    + apiCreditsLine(), Keyboards.balance(true));
            default -> replies.reply(in, "💰 <b>Ваш баланс:</b> " + Texts.rub(balance), Keyboards.balance(true));
        }
    }

    private String apiCreditsLine() {
        if (!kieClient.isConfigured()) {
            return "⚠️ API ключ не настроен";
        }
        try {
            BigDecimal credits = kieClient.getCredits();
            return "🔧 <b>API баланс:</b> " + Texts.rub(Pricing.creditsToRub(credits))
                    + "\n<i>(" + credits.toPlainString() + " кредитов)</i>";
        } catch (IOException e) {
            log.warn("Could not read API credits: {}", e.getMessage());
            return "⚠️ API баланс недоступен";
        }
    }

    // Model selection

    private void selectModel(Inbound in, String modelId) {
        Optional<ModelSchema> found = catalog.find(modelId);
        if (found.isEmpty()) {
            log.debug("Unknown model {} selected by {}", modelId, in.userId);
            replies.reply(in, "⚠️ Модель не найдена.", Keyboards.categories(catalog.categories()));
            return;
        }
        if (db.isBlocked(in.userId)) {
            replies.send(in.chatId, Texts.BLOCKED);
            return;
        }
        if (!kieClient.isConfigured()) {
            replies.reply(in, Texts.KIE_DISABLED, Keyboards.backToMenu());
            return;
        }
        ModelSchema model = found.get();
        Role role = db.roleOf(in.userId);
        BigDecimal minPrice = Pricing.minimumPrice(model, role);

        StringBuilder card = new StringBuilder();
        card.append(model.title()).append(" <b>").append(Texts.escape(model.name)).append("</b>\n\n");
        card.append(Texts.escape(model.description)).append("\n\n");
        switch (role) {
            case PRIMARY_ADMIN -> card.append("💰 Стоимость: от ").append(Texts.rub(minPrice)).append(" (без списания)");
            case LIMITED_ADMIN -> {
                BigDecimal remaining = db.remainingFor(in.userId).orElse(BigDecimal.ZERO);
                card.append("💰 Стоимость: от ").append(Texts.rub(minPrice)).append("\n");
                card.append("💳 Осталось лимита: ").append(Texts.rub(remaining))
                        .append(" (≈ ").append(generationsFor(remaining, minPrice)).append(" генераций)");
            }
            default -> {
                BigDecimal balance = db.getBalance(in.userId);
                card.append("💰 Стоимость: от ").append(Texts.rub(minPrice)).append("\n");
                card.append("💳 Баланс: ").append(Texts.rub(balance))
                        .append(" (≈ ").append(generationsFor(balance, minPrice)).append(" генераций)");
                if (balance.compareTo(minPrice) < 0) {
                    card.append("\n\n❌ Недостаточно средств. Пополните баланс, чтобы начать.");
                    replies.reply(in, card.toString(), Keyboards.topUpOffer());
                    return;
                }
            }
        }

        Session session = Session.forModel(in.userId, model);
        sessions.put(session);
        replies.reply(in, card.toString(), List.of());
        log.info("User {} selected model {}", in.userId, model.id);
        advance(in, session);
    }

    private static long generationsFor(BigDecimal funds, BigDecimal price) {
        if (price.signum() <= 0) {
            return 0;
        }
        return funds.divide(price, 0, RoundingMode.FLOOR).longValue();
    }

    private void generateAgain(Inbound in) {
        Optional<Session.SavedGeneration> saved = sessions.saved(in.userId);
        if (saved.isEmpty()) {
            replies.send(in.chatId, "⚠️ Нет предыдущей генерации. Выберите модель.",
                    Keyboards.categories(catalog.categories()));
            return;
        }
        if (db.isBlocked(in.userId)) {
            replies.send(in.chatId, Texts.BLOCKED);
            return;
        }
        Session session = saved.get().reseed(in.userId);
        sessions.put(session);
        replies.send(in.chatId, "🔄 " + session.model.title() + ": новая генерация с теми же настройками модели.");
        advance(in, session);
    }

    // Parameter collection

    /**
     * Asks for the next missing input: the prompt first, then the image step, then the remaining required
     * parameters in schema order. Moves to confirmation once nothing is missing.
     */
    void advance(Inbound in, Session s) {
        ModelSchema model = s.model;
        Optional<ParamSpec.Text> prompt = model.prompt();
        if (prompt.isPresent() && !s.params.containsKey(ModelSchema.PROMPT)) {
            ask(in, s, prompt.get());
            return;
        }
        Optional<ParamSpec.ImageList> images = model.imageParam();
        if (images.isPresent() && !s.imageStepDone) {
            offerImages(in, s, images.get());
            return;
        }
        for (String name : s.required) {
            if (s.params.containsKey(name) || isPromptOrImage(model, name)) {
                continue;
            }
            Optional<ParamSpec> spec = model.param(name);
            if (spec.isPresent()) {
                ask(in, s, spec.get());
                return;
            }
        }
        s.state = Session.State.CONFIRMING_GENERATION;
        s.currentParam = null;
        s.waitingFor = Session.Waiting.NOTHING;
        replies.send(in.chatId, summary(in, s), Keyboards.confirm());
    }

    private static boolean isPromptOrImage(ModelSchema model, String name) {
        if (ModelSchema.PROMPT.equals(name) && model.prompt().isPresent()) {
            return true;
        }
        return model.imageParam().map(p -> p.name.equals(name)).orElse(false);
    }

    private void ask(Inbound in, Session s, ParamSpec spec) {
        s.state = Session.State.INPUTTING_PARAMS;
        s.currentParam = spec.name;
        s.waitingFor = Session.Waiting.PARAM;
        String header = "📝 <b>" + Texts.escape(label(spec)) + "</b>\n\n" + Texts.escape(spec.description);
        switch (spec.kind()) {
            case TEXT -> {
                ParamSpec.Text text = (ParamSpec.Text) spec;
                String limit = text.maxLength > 0 ? "\n\nМаксимум " + text.maxLength + " символов." : "";
                replies.send(in.chatId, header + limit + "\n\nОтправьте текст сообщением.", Keyboards.cancelOnly());
            }
            case CHOICE -> replies.send(in.chatId, header + defaultHint(spec), Keyboards.choices((ParamSpec.Choice) spec));
            case FLAG -> replies.send(in.chatId, header + "\n\nПо умолчанию: "
                    + (Boolean.TRUE.equals(spec.defaultValue()) ? "Да" : "Нет"), Keyboards.yesNo((ParamSpec.Flag) spec));
            case IMAGES -> log.warn("Image parameter {} asked as a regular parameter", spec.name);
        }
    }

    private static String defaultHint(ParamSpec spec) {
        return spec.defaultValue() == null ? "" : "\n\nПо умолчанию: " + spec.defaultValue();
    }

    private static String label(ParamSpec spec) {
        return ModelSchema.PROMPT.equals(spec.name) ? "Промпт" : spec.name;
    }

    private void onParamText(Inbound in, Session s, String text) {
        if (s.waitingFor != Session.Waiting.PARAM || s.currentParam == null) {
            String hint = s.waitingFor == Session.Waiting.IMAGE
                    ? "📷 Отправьте изображение фото или нажмите «Готово»."
                    : "👆 Воспользуйтесь кнопками выше.";
            replies.send(in.chatId, hint);
            return;
        }
        Optional<ParamSpec> spec = s.model.param(s.currentParam);
        if (spec.isEmpty()) {
            log.warn("Session of {} points at unknown parameter {}", in.userId, s.currentParam);
            s.currentParam = null;
            advance(in, s);
            return;
        }
        accept(in, s, spec.get(), text == null ? "" : text.trim());
    }

    private void onParamButton(Inbound in, Session s, String name, String value) {
        if (s.state != Session.State.INPUTTING_PARAMS || s.waitingFor != Session.Waiting.PARAM
                || !name.equals(s.currentParam)) {
            log.debug("Ignoring stale set_param:{} from {}", name, in.userId);
            return;
        }
        s.model.param(name).ifPresent(spec -> accept(in, s, spec, value));
    }

    private void accept(Inbound in, Session s, ParamSpec spec, String raw) {
        switch (spec.kind()) {
            case TEXT -> {
                ParamSpec.Text text = (ParamSpec.Text) spec;
                if (!text.accepts(raw)) {
                    String reason = raw.isBlank() ? "Текст не может быть пустым."
                            : "Слишком длинный текст: " + raw.length() + " из " + text.maxLength + " символов.";
                    replies.send(in.chatId, "⚠️ " + reason + " Отправьте текст ещё раз.", Keyboards.cancelOnly());
                    return;
                }
                s.params.put(spec.name, raw);
            }
            case CHOICE -> {
                ParamSpec.Choice choice = (ParamSpec.Choice) spec;
                if (!choice.accepts(raw)) {
                    replies.send(in.chatId, "⚠️ Выберите одно из значений: " + String.join(", ", choice.values),
                            Keyboards.choices(choice));
                    return;
                }
                s.params.put(spec.name, raw);
            }
            case FLAG -> s.params.put(spec.name, ((ParamSpec.Flag) spec).parse(raw));
            case IMAGES -> {
                return;
            }
        }
        s.currentParam = null;
        s.waitingFor = Session.Waiting.NOTHING;
        advance(in, s);
    }

    // Images

    private void offerImages(Inbound in, Session s, ParamSpec.ImageList images) {
        s.state = Session.State.INPUTTING_PARAMS;
        s.currentParam = images.name;
        s.waitingFor = Session.Waiting.IMAGE_CHOICE;
        String text = "🖼 <b>Изображения</b>\n\n" + Texts.escape(images.description) + "\n\n"
                + (images.required ? "Добавьте хотя бы одно изображение." : "Можно добавить до "
                + ParamSpec.ImageList.MAX_IMAGES + " изображений или пропустить этот шаг.");
        replies.send(in.chatId, text, Keyboards.imageOffer(!images.required));
    }

    private void requestImage(Inbound in, Session s) {
        if (!isImageStep(s)) {
            log.debug("Ignoring add_image from {} outside the image step", in.userId);
            return;
        }
        s.waitingFor = Session.Waiting.IMAGE;
        replies.send(in.chatId, "📷 Отправьте изображение одним фото ("
                + s.pendingImages.size() + "/" + ParamSpec.ImageList.MAX_IMAGES + ").", Keyboards.cancelOnly());
    }

    private void addImage(Inbound in, Session s, String fileRef) {
        ParamSpec.ImageList images = s.model.imageParam().orElseThrow();
        if (s.pendingImages.size() >= ParamSpec.ImageList.MAX_IMAGES) {
            completeImages(in, s, images);
            return;
        }
        String url;
        try {
            url = files.publish(fileRef, "tg_" + in.userId + "_" + (s.pendingImages.size() + 1));
        } catch (IOException e) {
            log.warn("Publishing image {} of user {} failed: {}", fileRef, in.userId, e.getMessage());
            replies.send(in.chatId, "⚠️ Не удалось загрузить изображение. Отправьте его ещё раз.", Keyboards.imageMore());
            return;
        }
        s.pendingImages.add(url);
        if (s.pendingImages.size() >= ParamSpec.ImageList.MAX_IMAGES) {
            replies.send(in.chatId, "✅ Добавлено " + ParamSpec.ImageList.MAX_IMAGES + " изображений, это максимум.");
            completeImages(in, s, images);
            return;
        }
        s.waitingFor = Session.Waiting.IMAGE_CHOICE;
        replies.send(in.chatId, "✅ Изображение добавлено (" + s.pendingImages.size() + "/"
                + ParamSpec.ImageList.MAX_IMAGES + ").", Keyboards.imageMore());
    }

    private void finishImages(Inbound in, Session s) {
        if (!isImageStep(s)) {
            log.debug("Ignoring image_done from {} outside the image step", in.userId);
            return;
        }
        ParamSpec.ImageList images = s.model.imageParam().orElseThrow();
        if (s.pendingImages.isEmpty()) {
            if (images.required) {
                replies.send(in.chatId, "⚠️ Нужно добавить хотя бы одно изображение.", Keyboards.imageOffer(false));
                return;
            }
            skipImages(in, s);
            return;
        }
        completeImages(in, s, images);
    }

    private void skipImages(Inbound in, Session s) {
        if (!isImageStep(s)) {
            log.debug("Ignoring skip_image from {} outside the image step", in.userId);
            return;
        }
        ParamSpec.ImageList images = s.model.imageParam().orElseThrow();
        if (images.required) {
            replies.send(in.chatId, "⚠️ Для этой модели изображение обязательно.", Keyboards.imageOffer(false));
            return;
        }
        s.pendingImages.clear();
        s.imageStepDone = true;
        s.currentParam = null;
        s.waitingFor = Session.Waiting.NOTHING;
        advance(in, s);
    }

    private void completeImages(Inbound in, Session s, ParamSpec.ImageList images) {
        s.params.put(images.name, List.copyOf(s.pendingImages));
        s.imageStepDone = true;
        s.currentParam = null;
        s.waitingFor = Session.Waiting.NOTHING;
        advance(in, s);
    }

    private static boolean isImageStep(Session s) {
        return s.state == Session.State.INPUTTING_PARAMS
                && s.model != null
                && s.model.imageParam().isPresent()
                && !s.imageStepDone
                && (s.waitingFor == Session.Waiting.IMAGE_CHOICE || s.waitingFor == Session.Waiting.IMAGE);
    }

    // Confirmation

    private String summary(Inbound in, Session s) {
        Role role = db.roleOf(in.userId);
        BigDecimal price = Pricing.price(s.model.id, s.params, role);
        StringBuilder sb = new StringBuilder("📋 <b>Проверьте параметры</b>\n\n");
        sb.append("🤖 Модель: ").append(s.model.title()).append("\n");
        for (Map.Entry<String, Object> e : s.params.entrySet()) {
            sb.append("• ").append(Texts.escape(label(e.getKey()))).append(": ")
                    .append(Texts.escape(display(e.getValue()))).append("\n");
        }
        sb.append("\n💰 Стоимость: ").append(Texts.rub(price));
        if (role == Role.PRIMARY_ADMIN) {
            sb.append(" (без списания)");
        }
        return sb.toString();
    }

    private static String label(String name) {
        return ModelSchema.PROMPT.equals(name) ? "Промпт" : name;
    }

    private static String display(Object value) {
        if (value instanceof List) {
            return ((List<?>) value).size() + " шт.";
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? "Да" : "Нет";
        }
        String text = String.valueOf(value);
        return text.length() > SUMMARY_VALUE_MAX ? text.substring(0, SUMMARY_VALUE_MAX) + "…" : text;
    }

    @FunctionalInterface
    private interface SessionAction {
        void run(Session session);
    }
}
