package com.kiestudio;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("Telegram file access")
class TelegramFilesTest {
    private MockWebServer server;
    private KieClient kieClient;
    private TelegramFiles files;
    private String base;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        base = server.url("/file/botTOKEN").toString();
        kieClient = mock(KieClient.class);
        TelegramFiles.PathResolver resolver = fileId -> {
            if (fileId.equals("missing")) {
                throw new IOException("file not found");
            }
            return "photos/" + fileId + ".jpg";
        };
        files = new TelegramFiles(base, resolver, kieClient, new OkHttpClient());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void downloadsResolvedPath() throws Exception {
        server.enqueue(new MockResponse().setBody("JPEG"));

        byte[] bytes = files.download("abc");

        assertThat(new String(bytes)).isEqualTo("JPEG");
        assertThat(server.takeRequest().getPath()).isEqualTo("/file/botTOKEN/photos/abc.jpg");
    }

    @Test
    void httpErrorIsIoException() {
        server.enqueue(new MockResponse().setResponseCode(404));

        assertThatThrownBy(() -> files.download("abc"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("HTTP 404");
    }

    @Test
    void resolverFailurePropagates() {
        assertThatThrownBy(() -> files.download("missing")).hasMessage("file not found");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void publishHandsFileUrlToUploadService() throws Exception {
        when(kieClient.uploadFileUrl(base + "/photos/abc.jpg", "tg_5_1")).thenReturn("https://files/abc.jpg");

        assertThat(files.publish("abc", "tg_5_1")).isEqualTo("https://files/abc.jpg");
        verify(kieClient).uploadFileUrl(base + "/photos/abc.jpg", "tg_5_1");
    }
}
