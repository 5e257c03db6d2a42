package com.prospect.leadengine.qualify.http;

import com.prospect.leadengine.config.LeadEngineProperties;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class PoliteHttpClientRetryTest {
    private MockWebServer server;
    private ExecutorService executor;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void retriesServerErrorThenSucceeds() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(new MockResponse().setResponseCode(200).setHeader("X-Amz-Cf-Id", "abc").setBody("ok"));
        server.start();

        PoliteHttpClient client = newClient(1);
        HttpFetchResult result = client.get(server.url("/page").toString(), "text/html");

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).isEqualTo("ok");
        assertThat(result.headerText()).contains("x-amz-cf-id: abc");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void doesNotRetryClientErrors() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(404));
        server.start();

        HttpFetchResult result = newClient(3).get(server.url("/gone").toString(), null);

        assertThat(result.statusCode()).isEqualTo(404);
        assertThat(result.isSuccessful()).isFalse();
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void malformedUrlBecomesErrorCode() {
        HttpFetchResult result = newClient(0).get("http://", "text/html");

        assertThat(result.errorCode()).isEqualTo("invalid_url");
        assertThat(result.statusCode()).isZero();
    }

    @Test
    void schemeIsAddedWhenMissing() {
        assertThat(PoliteHttpClient.normalizeUri("example.com/about").toString()).isEqualTo("https://example.com/about");
        assertThat(PoliteHttpClient.normalizeUri(" ")).isNull();
    }

    private PoliteHttpClient newClient(int retries) {
        LeadEngineProperties properties = new LeadEngineProperties();
        properties.setGlobalConcurrency(1);
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutSeconds(5);
        properties.setRequestMaxRetries(retries);
        properties.setRequestRetryBaseDelayMs(1);
        properties.setRequestRetryMaxDelayMs(5);
        executor = Executors.newFixedThreadPool(1);
        return new PoliteHttpClient(properties, executor);
    }
}
