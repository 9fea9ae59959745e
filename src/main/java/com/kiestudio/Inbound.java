package com.kiestudio;

/**
 * Who sent an inbound event and where to answer. {@code messageId} is the message that carried the button, if any.
 */
public final class Inbound {
    public final long userId;
    public final long chatId;
    public final Integer messageId;

    public Inbound(long userId, long chatId, Integer messageId) {
        this.userId = userId;
        this.chatId = chatId;
        this.messageId = messageId;
    }

    public static Inbound message(long userId, long chatId) {
        return new Inbound(userId, chatId, null);
    }
}
