package com.decisionfacts.api;

import com.decisionfacts.taxonomy.DefaultTaxonomy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "decision-facts.concurrency.max-batch-size=2")
@AutoConfigureMockMvc
class DecisionControllerTest {

    @Autowired MockMvc mvc;

    @Nested
    @DisplayName("POST /v1/decisions/summary")
    class Summary {

        @Test
        void summary_isSerializedInSnakeCase() throws Exception {
            mvc.perform(post("/v1/decisions/summary")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("""
                        {"document_id": "doc-1",
                         "text": "Julgo procedente o pedido. Concedido o pagamento de horas extras.",
                         "references_hint": "Artigo 7, CLT"}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome.outcome").value("favorable_to_claimant"))
                .andExpect(jsonPath("$.legal_references", hasSize(1)))
                .andExpect(jsonPath("$.legal_references[0].normalized_citation").value("Art. 7º CLT"))
                .andExpect(jsonPath("$.legal_references[0].provenance").value("pre_existing"))
                .andExpect(jsonPath("$.pipeline_version", startsWith(DefaultTaxonomy.VERSION + "+")))
                .andExpect(jsonPath("$.parties.claimant").doesNotExist())
                .andExpect(jsonPath("$.right_outcomes[0].right").value("horas extras"))
                .andExpect(jsonPath("$.right_outcomes[0].verdict").value("granted"))
                .andExpect(jsonPath("$.main_reasoning").value(""));
        }

        @Test
        void missingText_isReadAsEmpty() throws Exception {
            mvc.perform(post("/v1/decisions/summary")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"document_id\": \"doc-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome.outcome").value("undetermined"))
                .andExpect(jsonPath("$.overall_confidence").value(0.0))
                .andExpect(jsonPath("$.decision_excerpt").value(""));
        }

        @Test
        void malformedBody_isBadRequest() throws Exception {
            mvc.perform(post("/v1/decisions/summary")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("BAD_REQUEST"));
        }
    }

    @Nested
    @DisplayName("Other endpoints")
    class Other {

        @Test
        void outcome_returnsClassificationOnly() throws Exception {
            mvc.perform(post("/v1/decisions/outcome")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"text\": \"Julgo improcedente o pedido. Não comprovado o direito alegado.\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("favorable_to_defendant"))
                .andExpect(jsonPath("$.methods_used").isArray());
        }

        @Test
        void batch_returnsOneResultPerDocument() throws Exception {
            mvc.perform(post("/v1/decisions/batch")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("""
                        [{"document_id": "a", "text": "Julgo procedente o pedido."},
                         {"document_id": "b", "text": ""}]
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].document_id").value("a"))
                .andExpect(jsonPath("$[1].summary.outcome.outcome").value("undetermined"));
        }

        @Test
        void oversizedBatch_isRejected() throws Exception {
            mvc.perform(post("/v1/decisions/batch")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("[{\"text\": \"a\"}, {\"text\": \"b\"}, {\"text\": \"c\"}]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"));
        }

        @Test
        void taxonomy_reportsVersions() throws Exception {
            mvc.perform(get("/v1/taxonomy"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.taxonomy_version").value(DefaultTaxonomy.VERSION))
                .andExpect(jsonPath("$.pattern_count").isNumber());
        }
    }
}
