package com.kiestudio;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * {@link Messenger} wrapper for replies whose delivery failure must not abort the caller. Failures are logged.
 */
public class Replies {
    private static final Logger log = LoggerFactory.getLogger(Replies.class);

    private final Messenger messenger;

    public Replies(Messenger messenger) {
        this.messenger = messenger;
    }

    public Messenger messenger() {
        return messenger;
    }

    public Optional<Integer> send(long chatId, String html) {
        return send(chatId, html, List.of());
    }

    public Optional<Integer> send(long chatId, String html, List<List<Messenger.Button>> keyboard) {
        try {
            return Optional.of(messenger.send(chatId, html, keyboard));
        } catch (Messenger.TransportException e) {
            log.warn("Failed to send message to {}: {}", chatId, e.getMessage());
            return Optional.empty();
        }
    }

    /** Edits {@code messageId} in place when given, otherwise (or when the edit fails) sends a new message. */
    public Optional<Integer> editOrSend(long chatId, Integer messageId, String html, List<List<Messenger.Button>> keyboard) {
        if (messageId != null) {
            try {
                messenger.edit(chatId, messageId, html, keyboard);
                return Optional.of(messageId);
            } catch (Messenger.TransportException e) {
                log.debug("Edit of message {} in {} failed, sending instead: {}", messageId, chatId, e.getMessage());
            }
        }
        return send(chatId, html, keyboard);
    }

    public Optional<Integer> reply(Inbound in, String html, List<List<Messenger.Button>> keyboard) {
        return editOrSend(in.chatId, in.messageId, html, keyboard);
    }
}
