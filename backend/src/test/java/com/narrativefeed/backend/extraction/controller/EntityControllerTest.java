package com.narrativefeed.backend.extraction.controller;

import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.narrativefeed.backend.extraction.EntityExtractionService;
import com.narrativefeed.backend.extraction.dto.ExtractedEntity;
import com.narrativefeed.backend.extraction.entity.EntityType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(EntityController.class)
class EntityControllerTest {

    @Autowired
    MockMvc mockMvc;

    @MockBean
    EntityExtractionService extractionService;

    @Test
    @DisplayName("ad-hoc extraction returns the entities and their count")
    void extract() throws Exception {
        when(extractionService.preview("$NVDA rallies", null, 5))
                .thenReturn(List.of(ExtractedEntity.of("$NVDA", EntityType.TICKER)));

        mockMvc.perform(post("/api/entities/extract")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"$NVDA rallies\",\"maxKeywords\":5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.entities[0].text").value("$NVDA"));
    }

    @Test
    @DisplayName("a negative keyword limit is rejected before extraction")
    void negativeKeywordLimit() throws Exception {
        mockMvc.perform(post("/api/entities/extract")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"$NVDA rallies\",\"maxKeywords\":-1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("ERR-VAL-002"))
                .andExpect(jsonPath("$.message").value(startsWith("maxKeywords:")));

        verify(extractionService, never()).preview(anyString(), any(), anyInt());
    }
}
