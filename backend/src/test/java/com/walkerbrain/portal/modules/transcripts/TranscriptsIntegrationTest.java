package com.walkerbrain.portal.modules.transcripts;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Map;

import com.walkerbrain.portal.modules.query.application.CachedQueryExecutor;
import com.walkerbrain.portal.support.AbstractPostgresIntegrationTest;
import com.walkerbrain.portal.support.TestUserFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class TranscriptsIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final String EMAIL = "coordinator@walkeradvertising.com";
    private static final String PASSWORD = "secret-pass1";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private CachedQueryExecutor executor;

    @Autowired
    private TestUserFactory testUserFactory;

    private String token;

    @BeforeEach
    void setUp() throws Exception {
        executor.invalidateAll();
        testUserFactory.ensureUser(EMAIL, PASSWORD, false);
        insertCall("call-1", "Auto Accident", 92, "They called me back the same day.", "'Spanish'");
        insertCall("call-2", "Auto Accident", 71, "I felt heard.", "English");
        insertCall("call-3", "Slip and Fall", 55, null, "English");
        jdbcTemplate.update("""
                INSERT INTO testimonial_pipeline (source_transcript_id, case_type, testimonial_type, quality_score, key_quote)
                VALUES ('call-1', 'Auto Accident', 'video', 92, 'They called me back the same day.')
                """);
        token = login();
    }

    @Test
    void repeatedQuoteReadIsServedFromCache() throws Exception {
        mockMvc.perform(get("/quotes").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Cache", "MISS"))
                .andExpect(jsonPath("$.items.length()").value(2))
                .andExpect(jsonPath("$.items[0].sourceTranscriptId").value("call-1"))
                .andExpect(jsonPath("$.page.totalCount").value(2));

        mockMvc.perform(get("/quotes").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Cache", "HIT"));
    }

    @Test
    void emptyCaseTypeSelectionReturnsNothing() throws Exception {
        mockMvc.perform(get("/quotes").param("caseType", "").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items.length()").value(0));
    }

    @Test
    void filterOptionsAreDistinctAndCleaned() throws Exception {
        mockMvc.perform(get("/filters/options").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.caseTypes[0]").value("Auto Accident"))
                .andExpect(jsonPath("$.caseTypes[1]").value("Slip and Fall"))
                .andExpect(jsonPath("$.languages[0]").value("English"))
                .andExpect(jsonPath("$.languages[1]").value("Spanish"));
    }

    @Test
    void testimonialUpdateIsVisibleOnNextRead() throws Exception {
        mockMvc.perform(get("/testimonials").header("Authorization", "Bearer " + token))
                .andExpect(header().string("X-Cache", "MISS"))
                .andExpect(jsonPath("$[0].status").value("flagged"))
                .andExpect(jsonPath("$[0].nextStatus").value("contacted"));

        mockMvc.perform(patch("/testimonials/call-1/status")
                        .header("Authorization", "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("status", "contacted", "notes", "left voicemail"))))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/testimonials").header("Authorization", "Bearer " + token))
                .andExpect(header().string("X-Cache", "MISS"))
                .andExpect(jsonPath("$[0].status").value("contacted"))
                .andExpect(jsonPath("$[0].statusUpdatedBy").value(EMAIL))
                .andExpect(jsonPath("$[0].notes").value("left voicemail"));
    }

    @Test
    void unknownCallIsNotFound() throws Exception {
        mockMvc.perform(get("/calls/nope").header("Authorization", "Bearer " + token))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("CALL_NOT_FOUND"));
    }

    @Test
    void invalidPageSizeIsRejected() throws Exception {
        mockMvc.perform(get("/calls").param("size", "0").header("Authorization", "Bearer " + token))
                .andExpect(status().isBadRequest());
    }

    @Test
    void explorerShowsCoreColumnsByDefaultAndRejectsEmptyGroupSelection() throws Exception {
        mockMvc.perform(get("/explorer").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.groups[0]").value("CORE"))
                .andExpect(jsonPath("$.columns[0]").value("source_transcript_id"))
                .andExpect(jsonPath("$.rows.length()").value(3))
                .andExpect(jsonPath("$.page.pageSize").value(50))
                .andExpect(jsonPath("$.zeroQualityRows").value(0));

        mockMvc.perform(get("/explorer").param("group", "metadata").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.columns[0]").value("prompt_version_used"));

        mockMvc.perform(get("/explorer").param("group", "").header("Authorization", "Bearer " + token))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("NO_COLUMN_GROUP"));
    }

    @Test
    void tagsAndObjectionsAreMinedFromAnalyses() throws Exception {
        jdbcTemplate.update("""
                UPDATE analysis_results
                SET suggested_tags = '["surgery", "rear-end"]'::jsonb,
                    objection_categories = '["price_too_high", "n/a"]'::jsonb
                WHERE source_transcript_id = 'call-1'
                """);

        mockMvc.perform(get("/signals/tags/surgery/calls").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].sourceTranscriptId").value("call-1"));
        mockMvc.perform(get("/signals/tags/surg/calls").header("Authorization", "Bearer " + token))
                .andExpect(jsonPath("$.length()").value(0));

        mockMvc.perform(get("/signals/tags").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("analysis"))
                .andExpect(jsonPath("$.tags[0].tag").value("rear-end"))
                .andExpect(jsonPath("$.tags[1].tag").value("surgery"));

        mockMvc.perform(get("/signals/objections").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("weekly"))
                .andExpect(jsonPath("$.hasBaseline").value(false))
                .andExpect(jsonPath("$.categories.length()").value(1))
                .andExpect(jsonPath("$.categories[0].label").value("Price Too High"))
                .andExpect(jsonPath("$.categories[0].thisWeek").value(1));
    }

    @Test
    void curatedTaxonomyTakesPrecedenceOverMinedTags() throws Exception {
        jdbcTemplate.update("INSERT INTO master_taxonomy (tag_id, tag_name, usage_count) VALUES (1, 'Injury', 0)");
        jdbcTemplate.update("""
                INSERT INTO master_taxonomy (tag_id, tag_name, parent_tag_id, usage_count)
                VALUES (2, 'whiplash', 1, 12)
                """);

        mockMvc.perform(get("/signals/tags").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("taxonomy"))
                .andExpect(jsonPath("$.categories[0].name").value("Injury"))
                .andExpect(jsonPath("$.categories[0].tags[0].tag").value("whiplash"))
                .andExpect(jsonPath("$.categories[0].tags[0].count").value(12))
                .andExpect(jsonPath("$.tags[0].tag").value("Injury"));
    }

    private void insertCall(String id, String caseType, int quality, String quote, String language) {
        jdbcTemplate.update("""
                INSERT INTO analysis_results
                    (source_transcript_id, case_type, quality_score, key_quote, original_language, analyzed_at,
                     transcript_original)
                VALUES (?, ?, ?, ?, ?, NOW() - INTERVAL '1 day', 'caller described the accident')
                """, id, caseType, quality, quote, language);
    }

    private String login() throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("email", EMAIL, "password", PASSWORD))))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode json = objectMapper.readTree(result.getResponse().getContentAsString());
        assertThat(json.path("sessionToken").asText()).isNotBlank();
        return json.path("sessionToken").asText();
    }
}
