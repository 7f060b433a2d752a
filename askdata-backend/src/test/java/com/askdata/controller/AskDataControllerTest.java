package com.askdata.controller;

import com.askdata.TestDatasets;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class AskDataControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void testCreateSessionWithUpload() throws Exception {
        mockMvc.perform(multipart("/v1/sessions").file(salesUpload()))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$.session_id").isNotEmpty())
                .andExpect(jsonPath("$.trace_id").isNotEmpty())
                .andExpect(jsonPath("$.dataset.source_name").value("sales.csv"))
                .andExpect(jsonPath("$.dataset.rows").value(10))
                .andExpect(jsonPath("$.dataset.columns").value(5));
    }

    @Test
    void testTraceIdIsEchoed() throws Exception {
        mockMvc.perform(get("/v1/sessions/validate").param("session_id", "missing")
                        .header("X-Request-Id", "trace-123"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("X-Request-Id", "trace-123"))
                .andExpect(jsonPath("$.code").value("SESSION_EXPIRED"))
                .andExpect(jsonPath("$.trace_id").value("trace-123"));
    }

    @Test
    void testValidateAndDisconnect() throws Exception {
        String sessionId = openSession();

        mockMvc.perform(get("/v1/sessions/validate").param("session_id", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value("true"));

        mockMvc.perform(post("/v1/disconnect").param("session_id", sessionId))
                .andExpect(status().isOk());

        mockMvc.perform(get("/v1/history").param("session_id", sessionId))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("SESSION_EXPIRED"));
    }

    @Test
    void testCatalogAndDataInfo() throws Exception {
        String sessionId = openSession();

        mockMvc.perform(get("/v1/catalog").param("session_id", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dataset_version").isNotEmpty())
                .andExpect(jsonPath("$.columns.sales").value("float"))
                .andExpect(jsonPath("$.columns.region").value("categorical"))
                .andExpect(jsonPath("$.numeric_columns", containsInAnyOrder("sales", "quantity")));

        mockMvc.perform(get("/v1/data/info").param("session_id", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rows").value(10))
                .andExpect(jsonPath("$.sample_rows", hasSize(5)))
                .andExpect(jsonPath("$.sample_rows[0].region").value("north"))
                .andExpect(jsonPath("$.missing_values.sales").value(0));
    }

    @Test
    void testCatalogWithoutDataset() throws Exception {
        String sessionId = objectMapper.readTree(mockMvc.perform(post("/v1/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dataset").value(nullValue()))
                .andReturn().getResponse().getContentAsString()).get("session_id").asText();

        mockMvc.perform(get("/v1/catalog").param("session_id", sessionId))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void testAnalyzeAndHistory() throws Exception {
        String sessionId = openSession();

        String jobId = submit(sessionId, "  total sales  ");
        JsonNode job = awaitJob(sessionId, jobId);

        assertEquals("completed", job.get("status").asText());
        assertEquals("total sales", job.get("query").asText());
        assertEquals("scalar", job.get("result").get("type").asText());
        assertEquals(1110.75, job.get("result").get("value").asDouble(), 1e-9);
        assertEquals("Sum of sales: 1110.75", job.get("response").get("summary").asText());
        assertEquals(5, job.get("steps").size());

        MvcResult history = mockMvc.perform(get("/v1/history").param("session_id", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.max_entries").value(20))
                .andExpect(jsonPath("$.entries", hasSize(1)))
                .andExpect(jsonPath("$.entries[0].query").value("total sales"))
                .andReturn();
        String entryId = objectMapper.readTree(history.getResponse().getContentAsString())
                .get("entries").get(0).get("entry_id").asText();

        MvcResult replay = mockMvc.perform(post("/v1/history/replay")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_id\":\"" + sessionId + "\",\"entry_id\":\"" + entryId + "\"}"))
                .andExpect(status().isAccepted())
                .andReturn();
        String replayJobId = objectMapper.readTree(replay.getResponse().getContentAsString()).get("job_id").asText();
        assertEquals("completed", awaitJob(sessionId, replayJobId).get("status").asText());

        mockMvc.perform(delete("/v1/history").param("session_id", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("cleared"));
        mockMvc.perform(get("/v1/history").param("session_id", sessionId))
                .andExpect(jsonPath("$.entries", hasSize(0)));
    }

    @Test
    void testAnalyzeValidation() throws Exception {
        String sessionId = openSession();

        mockMvc.perform(post("/v1/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_id\":\"" + sessionId + "\",\"query\":\"   \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));

        mockMvc.perform(post("/v1/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_id\":\"missing\",\"query\":\"total sales\"}"))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(get("/v1/history"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
    }

    @Test
    void testUnknownJob() throws Exception {
        String sessionId = openSession();

        mockMvc.perform(get("/v1/jobs/missing").param("session_id", sessionId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("JOB_NOT_FOUND"));

        mockMvc.perform(post("/v1/history/replay")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"session_id\":\"" + sessionId + "\",\"entry_id\":\"missing\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("HISTORY_ENTRY_NOT_FOUND"));
    }

    @Test
    void testReloadDataset() throws Exception {
        String sessionId = openSession();
        String csv = "city,temperature\nOslo,3.5\nRome,18.0\n";

        mockMvc.perform(multipart("/v1/sessions/" + sessionId + "/dataset")
                        .file(new MockMultipartFile("file", "weather.csv", "text/csv",
                                csv.getBytes(StandardCharsets.UTF_8))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dataset.source_name").value("weather.csv"))
                .andExpect(jsonPath("$.dataset.rows").value(2));

        mockMvc.perform(get("/v1/catalog").param("session_id", sessionId))
                .andExpect(jsonPath("$.numeric_columns", containsInAnyOrder("temperature")));
    }

    @Test
    void testMalformedUpload() throws Exception {
        String sessionId = openSession();

        mockMvc.perform(multipart("/v1/sessions/" + sessionId + "/dataset")
                        .file(new MockMultipartFile("file", "bad.csv", "text/csv",
                                "a,b\n1,2,3\n".getBytes(StandardCharsets.UTF_8))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("DATASET_LOAD_FAILED"));

        mockMvc.perform(get("/v1/data/info").param("session_id", sessionId))
                .andExpect(jsonPath("$.source_name").value("sales.csv"));
    }

    private String openSession() throws Exception {
        MvcResult result = mockMvc.perform(multipart("/v1/sessions").file(salesUpload()))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("session_id").asText();
    }

    private String submit(String sessionId, String query) throws Exception {
        MvcResult result = mockMvc.perform(post("/v1/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "session_id", sessionId, "query", query, "enable_visualization", true))))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.job_id").isNotEmpty())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("job_id").asText();
    }

    private JsonNode awaitJob(String sessionId, String jobId) throws Exception {
        long deadline = System.currentTimeMillis() + 10_000;
        JsonNode job;
        do {
            String body = mockMvc.perform(get("/v1/jobs/" + jobId).param("session_id", sessionId))
                    .andExpect(status().isOk())
                    .andReturn().getResponse().getContentAsString();
            job = objectMapper.readTree(body);
            String status = job.get("status").asText();
            if ("completed".equals(status) || "error".equals(status)) {
                return job;
            }
            Thread.sleep(10);
        } while (System.currentTimeMillis() < deadline);
        fail("job did not finish: " + job);
        return job;
    }

    private static MockMultipartFile salesUpload() {
        return new MockMultipartFile("file", "sales.csv", "text/csv",
                TestDatasets.SALES_CSV.getBytes(StandardCharsets.UTF_8));
    }
}
