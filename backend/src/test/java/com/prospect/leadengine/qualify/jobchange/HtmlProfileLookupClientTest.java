package com.prospect.leadengine.qualify.jobchange;

import com.prospect.leadengine.config.LeadEngineProperties;
import com.prospect.leadengine.qualify.http.PoliteHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlProfileLookupClientTest {
    private static final String PROFILE = """
        <html><body>
          <h2 class="top-card-layout__headline">Engineering leader</h2>
          <section data-section="experience">
            <ul>
              <li>
                <h3>VP of Engineering</h3>
                <h4><a href="/company/nimbus">Nimbus Cloud</a></h4>
              </li>
              <li>
                <h3>Software Engineer</h3>
                <h4><a href="/company/acme">Acme Foods</a></h4>
              </li>
            </ul>
          </section>
        </body></html>
        """;

    private MockWebServer server;
    private ExecutorService executor;
    private HtmlProfileLookupClient client;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        LeadEngineProperties properties = new LeadEngineProperties();
        properties.setPerHostDelayMs(1);
        properties.setRequestMaxRetries(0);
        executor = Executors.newFixedThreadPool(1);
        client = new HtmlProfileLookupClient(new PoliteHttpClient(properties, executor));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void readsFirstExperienceEntry() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(PROFILE));

        Optional<ProfileSnapshot> snapshot = client.lookup(server.url("/in/ana").toString());

        assertThat(snapshot).contains(new ProfileSnapshot("Nimbus Cloud", "VP of Engineering"));
    }

    @Test
    void fallsBackToHeadlineWithoutExperience() {
        ProfileSnapshot snapshot = client.parse(
            "<html><body><h2 class=\"top-card-layout__headline\">Head of Data</h2></body></html>",
            "https://profiles.example/in/bruno"
        );

        assertThat(snapshot.company()).isNull();
        assertThat(snapshot.role()).isEqualTo("Head of Data");
    }

    @Test
    void blockedOrEmptyPagesReturnNothing() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("denied"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html><body>nothing here</body></html>"));

        assertThat(client.lookup(server.url("/in/blocked").toString())).isEmpty();
        assertThat(client.lookup(server.url("/in/empty").toString())).isEmpty();
        assertThat(client.lookup(null)).isEmpty();
    }
}
