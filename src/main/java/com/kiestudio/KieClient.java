package com.kiestudio;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.concurrent.TimeUnit;

/**
 * HTTP client for the KIE jobs API. Every response carries a {@code {code, msg, data}} envelope;
 * a code other than 200 is raised as {@link KieApiException}, transport problems as plain {@link IOException}.
 */
public class KieClient {
    private static final Logger log = LoggerFactory.getLogger(KieClient.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final Config config;
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public KieClient(Config config) {
        this.config = config;
        this.httpClient = new OkHttpClient.Builder()
                .callTimeout(config.kieTimeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    public boolean isConfigured() {
        return config.isKieConfigured();
    }

    public String uploadFileUrl(String fileUrl, String fileName) throws IOException {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("fileUrl", fileUrl);
        payload.put("uploadPath", "telegram");
        payload.put("fileName", fileName);

        Request request = new Request.Builder()
                .url(config.kieUploadBase + "/api/file-url-upload")
                .addHeader("Authorization", "Bearer " + config.kieApiKey)
                .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
                .build();

        JsonNode data = execute(request, "upload");
        String downloadUrl = data.path("downloadUrl").asText();
        return downloadUrl.isBlank() ? data.path("fileUrl").asText() : downloadUrl;
    }

    public String createTask(String modelId, ObjectNode input) throws IOException {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", modelId);
        payload.set("input", input);

        Request request = new Request.Builder()
                .url(config.kieApiBase + "/api/v1/jobs/createTask")
                .addHeader("Authorization", "Bearer " + config.kieApiKey)
                .post(RequestBody.create(mapper.writeValueAsString(payload), JSON))
                .build();

        JsonNode data = execute(request, "createTask");
        String taskId = data.path("taskId").asText();
        if (taskId.isBlank()) {
            throw new KieApiException("createTask", 200, "response has no taskId");
        }
        log.info("Kie task created model={} taskId={}", modelId, taskId);
        return taskId;
    }

    public TaskInfo getTaskStatus(String taskId) throws IOException {
        HttpUrl url = HttpUrl.parse(config.kieApiBase + "/api/v1/jobs/recordInfo")
                .newBuilder()
                .addQueryParameter("taskId", taskId)
                .build();

        Request request = new Request.Builder()
                .url(url)
                .addHeader("Authorization", "Bearer " + config.kieApiKey)
                .get()
                .build();

        JsonNode data = execute(request, "recordInfo");
        TaskInfo info = new TaskInfo();
        info.taskId = data.path("taskId").asText(taskId);
        info.state = data.path("state").asText();
        info.resultJson = data.path("resultJson").asText();
        info.failCode = data.path("failCode").asText();
        info.failMsg = data.path("failMsg").asText();
        return info;
    }

    public BigDecimal getCredits() throws IOException {
        Request request = new Request.Builder()
                .url(config.kieApiBase + "/api/v1/chat/credit")
                .addHeader("Authorization", "Bearer " + config.kieApiKey)
                .get()
                .build();

        JsonNode data = execute(request, "credit");
        if (!data.isNumber() && !data.isTextual()) {
            throw new KieApiException("credit", 200, "unexpected credit payload");
        }
        return new BigDecimal(data.asText());
    }

    private JsonNode execute(Request request, String operation) throws IOException {
        try (Response response = httpClient.newCall(request).execute()) {
            String respBody = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                throw new KieApiException(operation, response.code(), respBody);
            }
            JsonNode json = mapper.readTree(respBody.isBlank() ? "{}" : respBody);
            int code = json.path("code").asInt(-1);
            if (code != 200) {
                throw new KieApiException(operation, code, json.path("msg").asText("unknown error"));
            }
            return json.path("data");
        }
    }

    public static class TaskInfo {
        public String taskId;
        public String state;
        public String resultJson;
        public String failCode;
        public String failMsg;
    }

    /** The API answered, but with a non-success status. */
    public static class KieApiException extends IOException {
        public final int code;

        public KieApiException(String operation, int code, String message) {
            super("Kie " + operation + " failed: " + code + " " + message);
            this.code = code;
        }
    }
}
