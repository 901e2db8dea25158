package com.fedquery.controller;

import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class MappingControllerTest extends ControllerTestSupport {

    private static final String ORDER_TOTALS = "{\"id\": \"totals\", \"source_id\": \"b\","
        + " \"source_collection\": \"orders\", \"target_collection\": \"totals\","
        + " \"mapping_rules\": [{\"source_field\": \"amount\", \"target_field\": \"total\", \"type\": \"direct\"}]}";

    @Test
    void createdMappingIsQueryable() throws Exception {
        mockMvc.perform(post("/api/v1/mappings").contentType(MediaType.APPLICATION_JSON).content(ORDER_TOTALS))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.id").value("totals"));

        mockMvc.perform(post("/api/v1/query/execute").contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"SELECT total FROM totals ORDER BY total DESC\", \"data_sources\": [\"b\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.rows", hasSize(2)))
            .andExpect(jsonPath("$.data.rows[0].total").value(20));

        mockMvc.perform(post("/api/v1/mappings").contentType(MediaType.APPLICATION_JSON).content(ORDER_TOTALS))
            .andExpect(status().isConflict());
    }

    @Test
    void readsUpdatesAndDeletesMappings() throws Exception {
        mockMvc.perform(get("/api/v1/mappings"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data", hasSize(1)));
        mockMvc.perform(get("/api/v1/mappings/acct"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.target_collection").value("balances"));
        mockMvc.perform(get("/api/v1/mappings/zzz"))
            .andExpect(status().isNotFound());

        mockMvc.perform(put("/api/v1/mappings/acct").contentType(MediaType.APPLICATION_JSON)
                .content("{\"source_id\": \"a\", \"source_collection\": \"accounts\","
                    + " \"target_collection\": \"balances\", \"status\": \"inactive\"}"))
            .andExpect(status().isOk());
        mockMvc.perform(post("/api/v1/query/execute").contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"SELECT * FROM balances\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.rows", hasSize(0)));

        mockMvc.perform(delete("/api/v1/mappings/acct"))
            .andExpect(status().isOk());
        mockMvc.perform(delete("/api/v1/mappings/acct"))
            .andExpect(status().isNotFound());
    }

    @Test
    void invalidMappingIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/mappings").contentType(MediaType.APPLICATION_JSON)
                .content("{\"id\": \"bad\", \"source_id\": \"erp\", \"source_collection\": \"x\", \"target_collection\": \"y\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("schema_mappings[bad]: source_id 'erp' does not exist"));
    }
}
