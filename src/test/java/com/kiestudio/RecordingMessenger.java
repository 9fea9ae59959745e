package com.kiestudio;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In-memory {@link Messenger} that records everything sent. Media uploads can be made to fail.
 */
class RecordingMessenger implements Messenger {

    static final class Sent {
        final String method;
        final long chatId;
        final String body;
        final List<List<Button>> keyboard;

        Sent(String method, long chatId, String body, List<List<Button>> keyboard) {
            this.method = method;
            this.chatId = chatId;
            this.body = body;
            this.keyboard = keyboard;
        }

        List<Command> commands() {
            return keyboard.stream().flatMap(List::stream).map(b -> b.command).collect(Collectors.toList());
        }

        @Override
        public String toString() {
            return method + "(" + chatId + "): " + body;
        }
    }

    final List<Sent> sent = new CopyOnWriteArrayList<>();
    private final AtomicInteger ids = new AtomicInteger(100);
    volatile boolean failUploads;
    volatile boolean failUrlMedia;
    volatile boolean failEdits;

    @Override
    public int send(long chatId, String html, List<List<Button>> keyboard) {
        sent.add(new Sent("send", chatId, html, keyboard));
        return ids.incrementAndGet();
    }

    @Override
    public void edit(long chatId, int messageId, String html, List<List<Button>> keyboard) throws TransportException {
        if (failEdits) {
            throw new TransportException("edit disabled", null);
        }
        sent.add(new Sent("edit", chatId, html, keyboard));
    }

    @Override
    public void sendMedia(long chatId, MediaKind kind, byte[] content, String fileName, String caption,
                          List<List<Button>> keyboard) throws TransportException {
        if (failUploads) {
            throw new TransportException("upload disabled", null);
        }
        sent.add(new Sent("media:" + kind, chatId, caption + "|" + fileName + "|" + content.length, keyboard));
    }

    @Override
    public void sendMediaUrl(long chatId, MediaKind kind, String url, String caption,
                             List<List<Button>> keyboard) throws TransportException {
        if (failUrlMedia) {
            throw new TransportException("url media disabled", null);
        }
        sent.add(new Sent("url:" + kind, chatId, caption + "|" + url, keyboard));
    }

    Sent last() {
        if (sent.isEmpty()) {
            throw new AssertionError("nothing was sent");
        }
        return sent.get(sent.size() - 1);
    }

    List<String> bodies() {
        return sent.stream().map(s -> s.body).collect(Collectors.toList());
    }

    boolean anyContains(String fragment) {
        return sent.stream().anyMatch(s -> s.body.contains(fragment));
    }

    void clear() {
        sent.clear();
    }
}
