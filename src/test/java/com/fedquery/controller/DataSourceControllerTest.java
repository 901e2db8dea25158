package com.fedquery.controller;

import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;

import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class DataSourceControllerTest extends ControllerTestSupport {

    @Test
    void listsConnectedSources() throws Exception {
        mockMvc.perform(get("/api/v1/data-sources"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data", hasSize(2)))
            .andExpect(jsonPath("$.data[0].id").value("a"))
            .andExpect(jsonPath("$.data[0].connected").value(true))
            .andExpect(jsonPath("$.data[1].collections", hasItem("orders")));

        mockMvc.perform(get("/api/v1/data-sources/b"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.type").value("memory"));

        mockMvc.perform(get("/api/v1/data-sources/zzz"))
            .andExpect(status().isNotFound());
    }

    @Test
    void createsUpdatesAndDeletesSources() throws Exception {
        String body = "{\"id\": \"c\", \"type\": \"memory\","
            + " \"config\": {\"documents\": {\"tags\": [{\"tag\": \"vip\", \"uid\": \"1\"}]}}}";

        mockMvc.perform(post("/api/v1/data-sources").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.connected").value(true))
            .andExpect(jsonPath("$.data.collections", hasItem("tags")));

        mockMvc.perform(post("/api/v1/data-sources").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isConflict());

        mockMvc.perform(put("/api/v1/data-sources/c").contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\": \"memory\", \"config\": {\"documents\": {\"labels\": []}}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.collections", hasItem("labels")));

        mockMvc.perform(delete("/api/v1/data-sources/c"))
            .andExpect(status().isOk());
        mockMvc.perform(get("/api/v1/data-sources"))
            .andExpect(jsonPath("$.data", hasSize(2)));
    }

    @Test
    void rejectsInvalidChanges() throws Exception {
        mockMvc.perform(post("/api/v1/data-sources").contentType(MediaType.APPLICATION_JSON)
                .content("{\"id\": \"x\"}"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(put("/api/v1/data-sources/zzz").contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\": \"memory\"}"))
            .andExpect(status().isNotFound());

        // 仍被映射 acct 引用
        mockMvc.perform(delete("/api/v1/data-sources/a"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(delete("/api/v1/data-sources/zzz"))
            .andExpect(status().isNotFound());
    }

    @Test
    void servesLogicalSchemas() throws Exception {
        mockMvc.perform(get("/api/v1/data-sources/a/collections/users/schema"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[*].name", hasItem("uid")));

        mockMvc.perform(get("/api/v1/data-sources/a/collections/balances/schema"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[*].name", hasItem("amount")));

        mockMvc.perform(get("/api/v1/data-sources/a/collections/nothing/schema"))
            .andExpect(status().isNotFound());
    }
}
