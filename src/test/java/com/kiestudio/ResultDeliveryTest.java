package com.kiestudio;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Result delivery")
class ResultDeliveryTest {
    private final RecordingMessenger messenger = new RecordingMessenger();
    private final ResultDelivery delivery = new ResultDelivery(messenger, new OkHttpClient());
    private final ModelCatalog catalog = ModelCatalog.loadDefault();

    @Nested
    @DisplayName("URL extraction")
    class Extraction {
        private static final String BOTH = "{\"resultUrls\":[\"https://cdn/clean.mp4\"],"
                + "\"resultWaterMarkUrls\":[\"https://cdn/wm.mp4\"]}";

        @Test
        void plainModelReadsResultUrls() {
            ModelSchema z = catalog.find("z-image").orElseThrow();

            assertThat(delivery.extractUrls(z, Map.of(), "{\"resultUrls\":[\"https://cdn/a.png\",\"\"]}"))
                    .containsExactly("https://cdn/a.png");
        }

        @Test
        void watermarkRemovalDefaultsToCleanUrls() {
            ModelSchema sora = catalog.find("sora-2-text-to-video").orElseThrow();

            assertThat(delivery.extractUrls(sora, Map.of(), BOTH)).containsExactly("https://cdn/clean.mp4");
        }

        @Test
        void watermarkKeptWhenFlagOff() {
            ModelSchema sora = catalog.find("sora-2-text-to-video").orElseThrow();

            assertThat(delivery.extractUrls(sora, Map.of("remove_watermark", false), BOTH))
                    .containsExactly("https://cdn/wm.mp4");
        }

        @Test
        void fallsBackToTheOtherSet() {
            ModelSchema sora = catalog.find("sora-2-text-to-video").orElseThrow();

            assertThat(delivery.extractUrls(sora, Map.of("remove_watermark", true),
                    "{\"resultUrls\":[],\"resultWaterMarkUrls\":[\"https://cdn/wm.mp4\"]}"))
                    .containsExactly("https://cdn/wm.mp4");
        }

        @Test
        void garbageYieldsNothing() {
            ModelSchema z = catalog.find("z-image").orElseThrow();

            assertThat(delivery.extractUrls(z, Map.of(), "not json")).isEmpty();
            assertThat(delivery.extractUrls(z, Map.of(), "")).isEmpty();
        }
    }

    @Nested
    @DisplayName("sending")
    class Sending {
        private MockWebServer server;

        @BeforeEach
        void setUp() throws IOException {
            server = new MockWebServer();
            server.start();
        }

        @AfterEach
        void tearDown() throws IOException {
            server.shutdown();
        }

        @Test
        void uploadsFetchedBytes() {
            server.enqueue(new MockResponse().setBody("PNGDATA"));
            String url = server.url("/out/result.png").toString();

            int delivered = delivery.deliver(10, Messenger.MediaKind.IMAGE, List.of(url), Keyboards.afterResult());

            assertThat(delivered).isEqualTo(1);
            RecordingMessenger.Sent sent = messenger.last();
            assertThat(sent.method).isEqualTo("media:IMAGE");
            assertThat(sent.body).isEqualTo("✅ Готово!|result.png|7");
            assertThat(sent.commands()).contains(Command.of(Command.Type.GENERATE_AGAIN));
        }

        @Test
        void fallsBackToUrlSendWhenFetchFails() {
            server.enqueue(new MockResponse().setResponseCode(404));
            String url = server.url("/gone.mp4").toString();

            delivery.deliver(10, Messenger.MediaKind.VIDEO, List.of(url), List.of());

            assertThat(messenger.last().method).isEqualTo("url:VIDEO");
        }

        @Test
        void fallsBackToPlainLink() {
            messenger.failUploads = true;
            messenger.failUrlMedia = true;
            server.enqueue(new MockResponse().setBody("x"));
            String url = server.url("/a.png").toString();

            int delivered = delivery.deliver(10, Messenger.MediaKind.IMAGE, List.of(url), List.of());

            assertThat(delivered).isEqualTo(1);
            assertThat(messenger.last().method).isEqualTo("send");
            assertThat(messenger.last().body).contains(url);
        }

        @Test
        @DisplayName("at most five artifacts, keyboard only on the last")
        void capsArtifactsAndKeyboard() {
            List<String> urls = new ArrayList<>();
            for (int i = 0; i < 7; i++) {
                server.enqueue(new MockResponse().setBody("img" + i));
                urls.add(server.url("/" + i + ".png").toString());
            }

            int delivered = delivery.deliver(10, Messenger.MediaKind.IMAGE, urls, Keyboards.afterResult());

            assertThat(delivered).isEqualTo(ResultDelivery.MAX_ARTIFACTS);
            assertThat(messenger.sent).hasSize(5);
            assertThat(server.getRequestCount()).isEqualTo(5);
            assertThat(messenger.sent.get(0).body).startsWith("Результат 1/5");
            assertThat(messenger.sent.subList(0, 4)).allMatch(s -> s.keyboard.isEmpty());
            assertThat(messenger.last().keyboard).isNotEmpty();
        }
    }
}
