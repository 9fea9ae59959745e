package com.kiestudio;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("KIE API client")
class KieClientTest {
    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;
    private KieClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        String base = server.url("/").toString().replaceAll("/$", "");
        Config config = Config.from(Map.of(
                "BOT_TOKEN", "t",
                "BOT_USERNAME", "bot",
                "KIE_API_KEY", "secret",
                "KIE_API_BASE", base,
                "KIE_UPLOAD_BASE", base));
        client = new KieClient(config);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void createTaskSendsModelAndInput() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"code\":200,\"msg\":\"success\",\"data\":{\"taskId\":\"task-1\"}}"));
        ObjectNode input = mapper.createObjectNode().put("prompt", "a cat").put("aspect_ratio", "1:1");

        String taskId = client.createTask("z-image", input);

        assertThat(taskId).isEqualTo("task-1");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/api/v1/jobs/createTask");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer secret");
        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("model").asText()).isEqualTo("z-image");
        assertThat(body.path("input").path("prompt").asText()).isEqualTo("a cat");
    }

    @Test
    void envelopeErrorBecomesApiException() {
        server.enqueue(new MockResponse().setBody("{\"code\":402,\"msg\":\"Credits insufficient\"}"));

        assertThatThrownBy(() -> client.createTask("z-image", mapper.createObjectNode()))
                .isInstanceOf(KieClient.KieApiException.class)
                .hasMessageContaining("Credits insufficient")
                .satisfies(e -> assertThat(((KieClient.KieApiException) e).code).isEqualTo(402));
    }

    @Test
    void httpErrorBecomesApiException() {
        server.enqueue(new MockResponse().setResponseCode(500).setBody("oops"));

        assertThatThrownBy(() -> client.getTaskStatus("task-1"))
                .isInstanceOf(KieClient.KieApiException.class)
                .satisfies(e -> assertThat(((KieClient.KieApiException) e).code).isEqualTo(500));
    }

    @Test
    void missingTaskIdIsAnError() {
        server.enqueue(new MockResponse().setBody("{\"code\":200,\"data\":{}}"));

        assertThatThrownBy(() -> client.createTask("z-image", mapper.createObjectNode()))
                .isInstanceOf(KieClient.KieApiException.class)
                .hasMessageContaining("no taskId");
    }

    @Test
    void taskStatusIsParsed() throws Exception {
        server.enqueue(new MockResponse().setBody("""
                {"code":200,"data":{"taskId":"task-1","state":"success",
                 "resultJson":"{\\"resultUrls\\":[\\"https://cdn/x.png\\"]}","failCode":"","failMsg":""}}
                """));

        KieClient.TaskInfo info = client.getTaskStatus("task-1");

        assertThat(info.state).isEqualTo("success");
        assertThat(info.resultJson).contains("https://cdn/x.png");
        assertThat(server.takeRequest().getPath()).isEqualTo("/api/v1/jobs/recordInfo?taskId=task-1");
    }

    @Test
    void creditsAreDecimal() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"code\":200,\"data\":1234.5}"));

        assertThat(client.getCredits()).isEqualByComparingTo("1234.5");
    }

    @Test
    void uploadReturnsHostedUrl() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"code\":200,\"data\":{\"downloadUrl\":\"https://files/u.jpg\"}}"));

        assertThat(client.uploadFileUrl("https://api.telegram.org/file/x.jpg", "tg_1_1")).isEqualTo("https://files/u.jpg");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/api/file-url-upload");
        assertThat(mapper.readTree(request.getBody().readUtf8()).path("fileName").asText()).isEqualTo("tg_1_1");
    }
}
