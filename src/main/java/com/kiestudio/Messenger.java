package com.kiestudio;

import java.util.List;

/**
 * Outbound side of the chat transport. Texts are HTML; keyboards are rows of buttons carrying encoded {@link Command}s.
 */
public interface Messenger {

    enum MediaKind {
        IMAGE,
        VIDEO
    }

    /** Returns the id of the sent message. */
    int send(long chatId, String html, List<List<Button>> keyboard) throws TransportException;

    void edit(long chatId, int messageId, String html, List<List<Button>> keyboard) throws TransportException;

    void sendMedia(long chatId, MediaKind kind, byte[] content, String fileName, String caption,
                   List<List<Button>> keyboard) throws TransportException;

    /** Lets the transport fetch the media itself. */
    void sendMediaUrl(long chatId, MediaKind kind, String url, String caption,
                      List<List<Button>> keyboard) throws TransportException;

    default int send(long chatId, String html) throws TransportException {
        return send(chatId, html, List.of());
    }

    class Button {
        public final String text;
        public final Command command;

        public Button(String text, Command command) {
            this.text = text;
            this.command = command;
        }
    }

    class TransportException extends Exception {
        public TransportException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
