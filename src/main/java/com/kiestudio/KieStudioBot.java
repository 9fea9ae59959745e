package com.kiestudio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.GetFile;
import org.telegram.telegrambots.meta.api.methods.ParseMode;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.send.SendPhoto;
import org.telegram.telegrambots.meta.api.methods.send.SendVideo;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Document;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.PhotoSize;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Telegram long-polling transport. Decodes updates into {@link SessionStateMachine} calls and implements
 * {@link Messenger} on top of the Bot API.
 */
public class KieStudioBot extends TelegramLongPollingBot implements Messenger {
    private static final Logger log = LoggerFactory.getLogger(KieStudioBot.class);
    private static final int SEND_ATTEMPTS = 3;

    private final Config config;
    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final UpdateQueue updates = new UpdateQueue(executor);
    private volatile SessionStateMachine machine;

    public KieStudioBot(Config config) {
        super(config.botToken);
        this.config = config;
    }

    /** Must be called before the bot is registered. */
    public void bind(SessionStateMachine machine) {
        this.machine = machine;
    }

    @Override
    public String getBotUsername() {
        return config.botUsername;
    }

    @Override
    public void onUpdateReceived(Update update) {
        updates.submit(senderOf(update), () -> dispatch(update));
    }

    private static long senderOf(Update update) {
        if (update.hasCallbackQuery() && update.getCallbackQuery().getFrom() != null) {
            return update.getCallbackQuery().getFrom().getId();
        }
        if (update.hasMessage() && update.getMessage().getFrom() != null) {
            return update.getMessage().getFrom().getId();
        }
        return 0L;
    }

    private void dispatch(Update update) {
        try {
            if (update.hasCallbackQuery()) {
                handleCallback(update.getCallbackQuery());
                return;
            }
            if (update.hasMessage()) {
                handleMessage(update.getMessage());
            }
        } catch (RuntimeException e) {
            log.error("Failed to handle update {}", update.getUpdateId(), e);
        }
    }

    private void handleMessage(Message message) {
        if (message.getFrom() == null) {
            return;
        }
        Inbound in = Inbound.message(message.getFrom().getId(), message.getChatId());

        if (message.hasPhoto()) {
            largestPhoto(message.getPhoto()).ifPresent(fileId -> machine.onPhoto(in, fileId));
            return;
        }
        if (message.hasDocument() && isImage(message.getDocument())) {
            machine.onPhoto(in, message.getDocument().getFileId());
            return;
        }
        if (!message.hasText()) {
            return;
        }
        String text = message.getText().trim();
        if (text.startsWith("/")) {
            String[] parts = text.split("\\s+", 2);
            String command = parts[0];
            int at = command.indexOf('@');
            if (at > 0) {
                command = command.substring(0, at);
            }
            machine.onCommand(in, command.toLowerCase(Locale.ROOT), parts.length > 1 ? parts[1] : "");
            return;
        }
        machine.onText(in, text);
    }

    private void handleCallback(CallbackQuery query) {
        acknowledge(query);
        var message = query.getMessage();
        if (message == null) {
            return;
        }
        Optional<Command> command = Command.decode(query.getData());
        if (command.isEmpty()) {
            log.debug("Ignoring unknown callback data '{}' from {}", query.getData(), query.getFrom().getId());
            return;
        }
        Inbound in = new Inbound(query.getFrom().getId(), message.getChatId(), message.getMessageId());
        machine.onCallback(in, command.get());
    }

    private void acknowledge(CallbackQuery query) {
        try {
            execute(AnswerCallbackQuery.builder().callbackQueryId(query.getId()).build());
        } catch (TelegramApiException e) {
            log.debug("Callback acknowledgement failed: {}", e.getMessage());
        }
    }

    private static Optional<String> largestPhoto(List<PhotoSize> sizes) {
        return sizes.stream()
                .max(Comparator.comparingLong(p -> (long) p.getWidth() * p.getHeight()))
                .map(PhotoSize::getFileId);
    }

    private static boolean isImage(Document document) {
        String mime = document.getMimeType();
        return mime != null && mime.startsWith("image/");
    }

    /** Resolves an uploaded file's path on the Telegram file server. */
    public String resolveFilePath(String fileId) throws IOException {
        try {
            return execute(new GetFile(fileId)).getFilePath();
        } catch (TelegramApiException e) {
            throw new IOException("getFile failed for " + fileId + ": " + e.getMessage(), e);
        }
    }

    // Messenger

    @Override
    public int send(long chatId, String html, List<List<Button>> keyboard) throws TransportException {
        SendMessage msg = new SendMessage(String.valueOf(chatId), html);
        msg.setParseMode(ParseMode.HTML);
        msg.setDisableWebPagePreview(true);
        if (!keyboard.isEmpty()) {
            msg.setReplyMarkup(markup(keyboard));
        }
        Message sent = executeWithRetry(() -> execute(msg), "sendMessage");
        return sent.getMessageId();
    }

    @Override
    public void edit(long chatId, int messageId, String html, List<List<Button>> keyboard) throws TransportException {
        EditMessageText edit = new EditMessageText();
        edit.setChatId(String.valueOf(chatId));
        edit.setMessageId(messageId);
        edit.setText(html);
        edit.setParseMode(ParseMode.HTML);
        edit.setDisableWebPagePreview(true);
        if (!keyboard.isEmpty()) {
            edit.setReplyMarkup(markup(keyboard));
        }
        executeWithRetry(() -> execute(edit), "editMessageText");
    }

    @Override
    public void sendMedia(long chatId, MediaKind kind, byte[] content, String fileName, String caption,
                          List<List<Button>> keyboard) throws TransportException {
        sendMedia(chatId, kind, new InputFile(new ByteArrayInputStream(content), fileName), caption, keyboard);
    }

    @Override
    public void sendMediaUrl(long chatId, MediaKind kind, String url, String caption,
                             List<List<Button>> keyboard) throws TransportException {
        sendMedia(chatId, kind, new InputFile(url), caption, keyboard);
    }

    private void sendMedia(long chatId, MediaKind kind, InputFile file, String caption,
                           List<List<Button>> keyboard) throws TransportException {
        InlineKeyboardMarkup markup = keyboard.isEmpty() ? null : markup(keyboard);
        if (kind == MediaKind.VIDEO) {
            SendVideo video = new SendVideo();
            video.setChatId(String.valueOf(chatId));
            video.setVideo(file);
            video.setCaption(caption);
            video.setParseMode(ParseMode.HTML);
            video.setReplyMarkup(markup);
            executeWithRetry(() -> execute(video), "sendVideo");
        } else {
            SendPhoto photo = new SendPhoto();
            photo.setChatId(String.valueOf(chatId));
            photo.setPhoto(file);
            photo.setCaption(caption);
            photo.setParseMode(ParseMode.HTML);
            photo.setReplyMarkup(markup);
            executeWithRetry(() -> execute(photo), "sendPhoto");
        }
    }

    private static InlineKeyboardMarkup markup(List<List<Button>> keyboard) {
        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        for (List<Button> row : keyboard) {
            List<InlineKeyboardButton> buttons = new ArrayList<>();
            for (Button b : row) {
                buttons.add(button(b.text, b.command.encode()));
            }
            rows.add(buttons);
        }
        return new InlineKeyboardMarkup(rows);
    }

    private static InlineKeyboardButton button(String text, String data) {
        InlineKeyboardButton btn = new InlineKeyboardButton(text);
        btn.setCallbackData(data);
        return btn;
    }

    private <T> T executeWithRetry(ThrowingCall<T> call, String operation) throws TransportException {
        for (int i = 0; ; i++) {
            try {
                return call.run();
            } catch (TelegramApiException e) {
                String msg = e.getMessage();
                if (msg != null && msg.contains("message is not modified")) {
                    return null;
                }
                if (!isRetryable(e) || i == SEND_ATTEMPTS - 1) {
                    throw new TransportException(operation + " failed: " + msg, e);
                }
                log.debug("{} attempt {} failed, retrying: {}", operation, i + 1, msg);
                if (!sleep(500)) {
                    throw new TransportException(operation + " interrupted", e);
                }
            }
        }
    }

    private boolean isRetryable(TelegramApiException e) {
        Throwable cause = e.getCause();
        if (cause instanceof java.net.SocketException
                || cause instanceof java.net.UnknownHostException
                || cause instanceof java.net.SocketTimeoutException) {
            return true;
        }
        String msg = e.getMessage();
        return msg != null && (msg.contains("Connection reset") || msg.contains("NoHttpResponse"));
    }

    private boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /** Stops accepting updates and waits briefly for in-flight handlers. */
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @FunctionalInterface
    private interface ThrowingCall<T> {
        T run() throws TelegramApiException;
    }
}
