package com.kiestudio;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Sends finished artifacts to the user. Each artifact goes out as uploaded media, then as a URL the transport
 * fetches itself, then as a plain link, whichever works first.
 */
public class ResultDelivery {
    private static final Logger log = LoggerFactory.getLogger(ResultDelivery.class);
    static final int MAX_ARTIFACTS = 5;

    private final Messenger messenger;
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public ResultDelivery(Messenger messenger) {
        this(messenger, new OkHttpClient.Builder().callTimeout(60, TimeUnit.SECONDS).build());
    }

    ResultDelivery(Messenger messenger, OkHttpClient httpClient) {
        this.messenger = messenger;
        this.httpClient = httpClient;
    }

    /**
     * Picks result URLs from the task's {@code resultJson}. For models with a watermark toggle the clean set is
     * preferred when the toggle is on, the watermarked one otherwise; an empty preferred set falls back to the other.
     */
    public List<String> extractUrls(ModelSchema model, Map<String, Object> params, String resultJson) {
        if (resultJson == null || resultJson.isBlank()) {
            return List.of();
        }
        JsonNode node;
        try {
            node = mapper.readTree(resultJson);
        } catch (IOException e) {
            log.warn("Unparsable resultJson for {}: {}", model.id, e.getMessage());
            return List.of();
        }
        if (model.watermarkParam == null) {
            return urls(node, "resultUrls");
        }
        boolean removeWatermark = model.param(model.watermarkParam)
                .map(spec -> {
                    Object value = params.get(spec.name);
                    return value instanceof Boolean ? (Boolean) value : (Boolean) spec.defaultValue();
                })
                .orElse(true);
        String preferred = removeWatermark ? "resultUrls" : "resultWaterMarkUrls";
        String fallback = removeWatermark ? "resultWaterMarkUrls" : "resultUrls";
        List<String> urls = urls(node, preferred);
        return urls.isEmpty() ? urls(node, fallback) : urls;
    }

    private List<String> urls(JsonNode node, String field) {
        List<String> urls = new ArrayList<>();
        JsonNode arr = node.path(field);
        if (arr.isArray()) {
            for (JsonNode n : arr) {
                if (!n.asText().isBlank()) {
                    urls.add(n.asText());
                }
            }
        } else if (arr.isTextual() && !arr.asText().isBlank()) {
            urls.add(arr.asText());
        }
        return urls;
    }

    /** Returns how many artifacts reached the user in any form. The last one carries {@code keyboard}. */
    public int deliver(long chatId, Messenger.MediaKind kind, List<String> urls, List<List<Messenger.Button>> keyboard) {
        List<String> batch = urls.size() > MAX_ARTIFACTS ? urls.subList(0, MAX_ARTIFACTS) : urls;
        if (urls.size() > MAX_ARTIFACTS) {
            log.info("Delivering first {} of {} artifacts to {}", MAX_ARTIFACTS, urls.size(), chatId);
        }
        int delivered = 0;
        for (int i = 0; i < batch.size(); i++) {
            boolean last = i == batch.size() - 1;
            String caption = batch.size() > 1 ? "Результат " + (i + 1) + "/" + batch.size() : "✅ Готово!";
            if (deliverOne(chatId, kind, batch.get(i), caption, last ? keyboard : List.of())) {
                delivered++;
            }
        }
        return delivered;
    }

    private boolean deliverOne(long chatId, Messenger.MediaKind kind, String url, String caption,
                               List<List<Messenger.Button>> keyboard) {
        try {
            byte[] content = fetch(url);
            messenger.sendMedia(chatId, kind, content, fileName(url, kind), caption, keyboard);
            return true;
        } catch (IOException | Messenger.TransportException | IllegalArgumentException e) {
            log.warn("Upload of {} to {} failed, trying URL send: {}", url, chatId, e.getMessage());
        }
        try {
            messenger.sendMediaUrl(chatId, kind, url, caption, keyboard);
            return true;
        } catch (Messenger.TransportException e) {
            log.warn("URL send of {} to {} failed, sending link: {}", url, chatId, e.getMessage());
        }
        try {
            messenger.send(chatId, caption + "\n" + Texts.escape(url), keyboard);
            return true;
        } catch (Messenger.TransportException e) {
            log.error("Could not deliver {} to {} in any form", url, chatId, e);
            return false;
        }
    }

    private byte[] fetch(String url) throws IOException {
        Request request = new Request.Builder()
                .url(url)
                .header("User-Agent", "kie-studio-bot/1.0")
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful() || response.body() == null) {
                throw new IOException("Fetch failed: " + response.code());
            }
            return response.body().bytes();
        }
    }

    private static String fileName(String url, Messenger.MediaKind kind) {
        String path = url.contains("?") ? url.substring(0, url.indexOf('?')) : url;
        String name = path.substring(path.lastIndexOf('/') + 1);
        if (name.isBlank() || !name.contains(".")) {
            return kind == Messenger.MediaKind.VIDEO ? "result.mp4" : "result.png";
        }
        return name;
    }
}
