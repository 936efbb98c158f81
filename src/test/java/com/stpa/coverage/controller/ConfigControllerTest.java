package com.stpa.coverage.controller;

import com.stpa.coverage.config.AnalysisConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ConfigController.class)
class ConfigControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private AnalysisConfig analysisConfig;

    @BeforeEach
    void setUp() {
        when(analysisConfig.getMaxCombinationSize()).thenReturn(3);
        when(analysisConfig.getMinRiskScore()).thenReturn(25);
        when(analysisConfig.isIncludeSameTeamAbstraction()).thenReturn(true);
        when(analysisConfig.isIncludeCrossControllerAbstraction()).thenReturn(true);
        when(analysisConfig.isIncludeCoOccurrenceType()).thenReturn(true);
        when(analysisConfig.isIncludeTemporalOrderingType()).thenReturn(true);
        when(analysisConfig.getAnalysisTypes()).thenReturn(List.of("NOT_PROVIDED", "TOO_LATE"));
        when(analysisConfig.getExcludedSignatures()).thenReturn(new ArrayList<>());
    }

    // ── Analysis ──

    @Test
    void getAnalysisConfig_success() throws Exception {
        mockMvc.perform(get("/api/v1/config/analysis"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.maxCombinationSize").value(3))
                .andExpect(jsonPath("$.minRiskScore").value(25))
                .andExpect(jsonPath("$.includeCoOccurrenceType").value(true))
                .andExpect(jsonPath("$.analysisTypes[1]").value("TOO_LATE"))
                .andExpect(jsonPath("$.excludedSignatures").isEmpty());
    }

    @Test
    void updateAnalysisConfig_success() throws Exception {
        mockMvc.perform(put("/api/v1/config/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "maxCombinationSize", 4,
                                "includeTemporalOrderingType", false,
                                "analysisTypes", List.of("NOT_PROVIDED", " too_early ", "NOT_PROVIDED")))))
                .andExpect(status().isOk());

        verify(analysisConfig).setMaxCombinationSize(4);
        verify(analysisConfig).setIncludeTemporalOrderingType(false);
        verify(analysisConfig).setIncludeCoOccurrenceType(true);
        verify(analysisConfig).setAnalysisTypes(List.of("NOT_PROVIDED", "too_early"));
        verify(analysisConfig, never()).setExcludedSignatures(any());
    }

    @Test
    void updateAnalysisConfig_keepsCustomAnalysisTypeIdsAsGiven() throws Exception {
        mockMvc.perform(put("/api/v1/config/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "analysisTypes", List.of("UCA-Type-Custom", "wrong_duration", "UCA-Type-Custom")))))
                .andExpect(status().isOk());

        verify(analysisConfig).setAnalysisTypes(List.of("UCA-Type-Custom", "wrong_duration"));
    }

    @Test
    void updateAnalysisConfig_setsMinRiskScore() throws Exception {
        mockMvc.perform(put("/api/v1/config/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("minRiskScore", 40))))
                .andExpect(status().isOk());

        verify(analysisConfig).setMinRiskScore(40);
    }

    @Test
    void updateAnalysisConfig_minRiskScoreOutOfRange_returns400() throws Exception {
        mockMvc.perform(put("/api/v1/config/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("minRiskScore", 101))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("minRiskScore"));

        verify(analysisConfig, never()).setMinRiskScore(anyInt());
    }

    @Test
    void updateAnalysisConfig_replacesExcludedSignatures() throws Exception {
        mockMvc.perform(put("/api/v1/config/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "excludedSignatures", List.of("A|B|CO_OCCURRENCE|SAME_TEAM")))))
                .andExpect(status().isOk());

        verify(analysisConfig).setExcludedSignatures(List.of("A|B|CO_OCCURRENCE|SAME_TEAM"));
    }

    @Test
    void updateAnalysisConfig_maxSizeBelowTwo_returns400() throws Exception {
        mockMvc.perform(put("/api/v1/config/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("maxCombinationSize", 1))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("maxCombinationSize"));

        verify(analysisConfig, never()).setMaxCombinationSize(anyInt());
    }

    @Test
    void updateAnalysisConfig_bothTypesDisabled_returns400() throws Exception {
        mockMvc.perform(put("/api/v1/config/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "includeCoOccurrenceType", false,
                                "includeTemporalOrderingType", false))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("includeCoOccurrenceType"));
    }

    @Test
    void updateAnalysisConfig_emptyAnalysisTypes_returns400() throws Exception {
        mockMvc.perform(put("/api/v1/config/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("analysisTypes", List.of()))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("analysisTypes"));
    }

    // ── Scoring ──

    @Test
    void getScoringWeights_success() throws Exception {
        when(analysisConfig.getScoring()).thenReturn(new AnalysisConfig.ScoringWeights());

        mockMvc.perform(get("/api/v1/config/scoring"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value("v1"))
                .andExpect(jsonPath("$.perExtraController").value(10))
                .andExpect(jsonPath("$.organizationPresent").value(20));
    }
}
