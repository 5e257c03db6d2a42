package com.prospect.leadengine.qualify.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class LeadEngineApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void scoreEndpointRanksLeadsAndReportsFailures() throws Exception {
        String body = """
            [
              {"companyName": "Small Shop", "companySize": "micro"},
              {"companyName": ""},
              {"companyName": "Banco Azul", "sector": "banking", "companySize": "enterprise",
               "website": "https://bancoazul.example", "usesTargetCloud": true}
            ]
            """;

        mockMvc.perform(post("/api/leads/score").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.leads.length()").value(3))
            .andExpect(jsonPath("$.leads[0].companyName").value("Banco Azul"))
            .andExpect(jsonPath("$.leads[0].score").value(80.0))
            .andExpect(jsonPath("$.leads[0].priority").value("HOT"))
            .andExpect(jsonPath("$.failures.length()").value(1))
            .andExpect(jsonPath("$.failures[0].inputIndex").value(1));
    }

    @Test
    void importedCsvIsQualifiedAndListed() throws Exception {
        String csv = """
            company_name,sector,company_size,uses_aws
            Api Import Co,retail,large,yes
            ,retail,large,yes
            """;

        mockMvc.perform(post("/api/leads/import")
                .contentType("text/csv")
                .param("source", "smoke")
                .content(csv))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.parsed").value(1))
            .andExpect(jsonPath("$.rejectedRows.length()").value(1))
            .andExpect(jsonPath("$.qualification.saved").value(1))
            .andExpect(jsonPath("$.qualification.leads[0].source").value("smoke"));

        mockMvc.perform(get("/api/leads").param("minScore", "60"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(greaterThanOrEqualTo(1)));
    }

    @Test
    void missingLeadIsNotFound() throws Exception {
        mockMvc.perform(get("/api/leads/{id}", 987654321L))
            .andExpect(status().isNotFound());
    }

    @Test
    void missingPlaylistReturnsErrorBody() throws Exception {
        mockMvc.perform(get("/api/playlists/{id}", 987654321L))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("playlist_not_found"));
    }

    @Test
    void engagementNeedsAnActionAndAnExistingPlaylist() throws Exception {
        mockMvc.perform(post("/api/playlists/{id}/members/{leadId}/engagement", 987654321L, 1L)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"actionType\": \"email\", \"outcome\": \"positive\"}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("playlist_not_found"));
        mockMvc.perform(post("/api/playlists/{id}/members/{leadId}/engagement", 987654321L, 1L)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"userId\": \"ana\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));
    }

    @Test
    void unknownStatusValuesAreRejected() throws Exception {
        mockMvc.perform(post("/api/playlists/1/members/1/status").param("status", "maybe"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(post("/api/job-changes/1/status").param("status", "maybe"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void daemonsAreStoppedInTestProfile() throws Exception {
        mockMvc.perform(get("/api/daemon/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.jobChangeRunning").value(false))
            .andExpect(jsonPath("$.playlistRefreshRunning").value(false));
    }
}
