package com.prospect.leadengine.qualify.techno;

import com.prospect.leadengine.config.LeadEngineProperties;
import com.prospect.leadengine.qualify.http.PoliteHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class WebsiteTechInspectorTest {
    private static final String HOMEPAGE = """
        <html>
          <head>
            <meta name="generator" content="WordPress 6.4.2">
            <script src="https://code.jquery.com/jquery-3.7.1.min.js"></script>
            <script async src="https://www.googletagmanager.com/gtag/js?id=G-1"></script>
          </head>
          <body>
            <div id="root" data-reactroot=""></div>
            <img src="https://assets.s3.amazonaws.com/logo.png">
            <link href="https://cdn.shopify.com/s/files/theme.css" rel="stylesheet">
          </body>
        </html>
        """;

    private MockWebServer server;
    private ExecutorService executor;
    private WebsiteTechInspector inspector;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        LeadEngineProperties properties = new LeadEngineProperties();
        properties.setPerHostDelayMs(1);
        properties.setRequestTimeoutSeconds(2);
        properties.setRequestMaxRetries(0);
        executor = Executors.newFixedThreadPool(2);
        inspector = new WebsiteTechInspector(new PoliteHttpClient(properties, executor));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void detectsTechnologiesFromHeadersMarkupAndScripts() {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "text/html")
            .setHeader("CF-RAY", "8a1b2c3d4e-GRU")
            .setBody(HOMEPAGE));

        TechnologyProfile profile = inspector.inspect(server.url("/").toString());

        assertThat(profile.namesIn(TechCategory.CLOUD_PROVIDER)).containsExactly("aws");
        assertThat(profile.namesIn(TechCategory.CDN)).containsExactly("cloudflare");
        assertThat(profile.namesIn(TechCategory.ECOMMERCE)).containsExactly("shopify");
        assertThat(profile.namesIn(TechCategory.ANALYTICS)).containsExactly("google_analytics");
        assertThat(profile.namesIn(TechCategory.CMS)).containsExactly("wordpress");
        assertThat(profile.namesIn(TechCategory.LIBRARY)).containsExactly("jquery");
        assertThat(profile.hasModernFrontend()).isTrue();
        assertThat(profile.targetCloudServices()).containsExactly("s3");
    }

    @Test
    void nonSuccessStatusYieldsEmptyProfile() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("<html>cdn.shopify.com</html>"));

        assertThat(inspector.inspect(server.url("/missing").toString()).isEmpty()).isTrue();
    }

    @Test
    void unreachableHostYieldsEmptyProfile() throws Exception {
        String url = server.url("/").toString();
        server.shutdown();

        assertThat(inspector.inspect(url).isEmpty()).isTrue();
        assertThat(inspector.inspect("   ").isEmpty()).isTrue();
    }
}
