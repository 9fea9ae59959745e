package com.kiestudio;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * {@link MediaFiles} backed by the Telegram file server. Publishing asks the KIE upload service to fetch
 * the file by URL and re-host it.
 */
public class TelegramFiles implements MediaFiles {
    private final String fileBaseUrl;
    private final PathResolver resolver;
    private final KieClient kieClient;
    private final OkHttpClient http;

    public TelegramFiles(Config config, PathResolver resolver, KieClient kieClient) {
        this("https://api.telegram.org/file/bot" + config.botToken, resolver, kieClient,
                new OkHttpClient.Builder().callTimeout(60, TimeUnit.SECONDS).build());
    }

    TelegramFiles(String fileBaseUrl, PathResolver resolver, KieClient kieClient, OkHttpClient http) {
        this.fileBaseUrl = fileBaseUrl;
        this.resolver = resolver;
        this.kieClient = kieClient;
        this.http = http;
    }

    @Override
    public byte[] download(String fileRef) throws IOException {
        Request request = new Request.Builder().url(fileUrl(fileRef)).get().build();
        try (Response response = http.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new IOException("File download failed: HTTP " + response.code());
            }
            return body.bytes();
        }
    }

    @Override
    public String publish(String fileRef, String fileName) throws IOException {
        return kieClient.uploadFileUrl(fileUrl(fileRef), fileName);
    }

    private String fileUrl(String fileRef) throws IOException {
        return fileBaseUrl + "/" + resolver.resolve(fileRef);
    }

    @FunctionalInterface
    public interface PathResolver {
        String resolve(String fileId) throws IOException;
    }
}
