package com.golfdata.clubtracker.crawl.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class PipelineControllerTest {

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private ObjectMapper objectMapper;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void statusReportsCountsAndSources() throws Exception {
        mockMvc.perform(get("/api/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.dbConnectivity").value(true))
            .andExpect(jsonPath("$.counts.club_types").value(greaterThanOrEqualTo(6)))
            .andExpect(jsonPath("$.sources").value(hasItem("globalgolf")));
    }

    @Test
    void crawlEndpointsArePostOnly() throws Exception {
        mockMvc.perform(get("/api/crawl/full"))
            .andExpect(status().isMethodNotAllowed());
        mockMvc.perform(get("/api/crawl/refresh"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void unknownSourceIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/crawl/full")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source\":\"nowhere\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("unknown_source"));
    }

    @Test
    void unknownCategoryIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/crawl/full")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source\":\"globalgolf\",\"category\":\"balls\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("bad_request"));
    }

    @Test
    void unreachableRetailerYieldsFailedRunThatCanBeReadBack() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/crawl/full")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source\":\"globalgolf\",\"category\":\"drivers\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("FAILED"))
            .andExpect(jsonPath("$.scrapeType").value("filtered_drivers"))
            .andExpect(jsonPath("$.errors").value(1))
            .andReturn();

        JsonNode summary = objectMapper.readTree(result.getResponse().getContentAsString());
        long runId = summary.get("runId").asLong();

        mockMvc.perform(get("/api/runs/" + runId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("FAILED"))
            .andExpect(jsonPath("$.sourceName").value("Global Golf"));
        mockMvc.perform(get("/api/runs").param("source", "Global Golf").param("limit", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray());
    }

    @Test
    void refreshWithNothingStaleSucceeds() throws Exception {
        mockMvc.perform(post("/api/crawl/refresh").param("source", "globalgolf").param("batchSize", "10"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.scrapeType").value("update_prices"))
            .andExpect(jsonPath("$.status").value("SUCCESS"))
            .andExpect(jsonPath("$.recordsUpdated").value(0));
    }

    @Test
    void missingRunIsNotFound() throws Exception {
        mockMvc.perform(get("/api/runs/987654321"))
            .andExpect(status().isNotFound());
    }
}
