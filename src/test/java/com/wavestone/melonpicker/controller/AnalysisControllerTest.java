package com.wavestone.melonpicker.controller;

import com.wavestone.melonpicker.model.AnalysisReport;
import com.wavestone.melonpicker.model.KnowledgeBase;
import com.wavestone.melonpicker.model.Recommendation;
import com.wavestone.melonpicker.model.SubmittedAnalysis;
import com.wavestone.melonpicker.model.UserInputs;
import com.wavestone.melonpicker.service.WatermelonAnalysisService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest({AnalysisController.class, HealthController.class})
class AnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private WatermelonAnalysisService analysisService;

    @Test
    void analyze_WithFormFieldsOnly_ReturnsRecommendation() throws Exception {
        UserInputs inputs = UserInputs.builder().fieldSpot("creamy-yellow").stem("dry-brown").build();
        Recommendation recommendation = Recommendation.builder()
                .quality("Excellent Choice!")
                .qualityClass("excellent")
                .recommendation("This watermelon shows all the signs of being perfectly ripe and delicious. Go for it!")
                .percentage(100)
                .score(55)
                .maxScore(55)
                .feedback(List.of("✅ Excellent field spot! The creamy yellow indicates perfect ripeness."))
                .tips(List.of("The stem should be dry and brown, not green"))
                .build();
        when(analysisService.analyze(any(UserInputs.class), isNull()))
                .thenReturn(new AnalysisReport(new SubmittedAnalysis(inputs, null), recommendation, Instant.now()));

        mockMvc.perform(multipart("/api/analyze")
                        .param("fieldSpot", "creamy-yellow")
                        .param("stem", "dry-brown"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.analysis.fieldSpot").value("creamy-yellow"))
                .andExpect(jsonPath("$.analysis.hasImage").value(false))
                .andExpect(jsonPath("$.recommendation.qualityClass").value("excellent"))
                .andExpect(jsonPath("$.recommendation.score").value(55))
                .andExpect(content().string(containsString("\"score\":55,")))
                .andExpect(jsonPath("$.recommendation.maxScore").value(55))
                .andExpect(jsonPath("$.timestamp").exists());

        verify(analysisService).analyze(argThat(submitted ->
                "creamy-yellow".equals(submitted.getFieldSpot()) && submitted.getSize() == null), isNull());
    }

    @Test
    void analyze_WithImage_PassesBytesToService() throws Exception {
        byte[] bytes = {1, 2, 3};
        MockMultipartFile image = new MockMultipartFile("image", "melon.png", "image/png", bytes);
        when(analysisService.analyze(any(UserInputs.class), eq(bytes)))
                .thenReturn(new AnalysisReport(new SubmittedAnalysis(), new Recommendation(), Instant.now()));

        mockMvc.perform(multipart("/api/analyze").file(image))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        verify(analysisService).analyze(any(UserInputs.class), eq(bytes));
    }

    @Test
    void analyze_WithNonImageUpload_ReturnsBadRequest() throws Exception {
        MockMultipartFile text = new MockMultipartFile("image", "notes.txt", "text/plain", "hello".getBytes());

        mockMvc.perform(multipart("/api/analyze").file(text))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Only image files are allowed"));

        verify(analysisService, never()).analyze(any(), any());
    }

    @Test
    void analyze_WhenServiceFails_ReturnsServerError() throws Exception {
        when(analysisService.analyze(any(UserInputs.class), isNull())).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(multipart("/api/analyze").param("size", "large"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Failed to analyze watermelon"))
                .andExpect(jsonPath("$.message").value("boom"));
    }

    @Test
    void tips_ReturnsGeneralTips() throws Exception {
        when(analysisService.getGeneralTips()).thenReturn(List.of("tip one", "tip two"));

        mockMvc.perform(get("/api/tips"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.tips.length()").value(2));
    }

    @Test
    void knowledge_UsesSnakeCaseKeys() throws Exception {
        KnowledgeBase knowledge = new KnowledgeBase(
                new KnowledgeBase.RipenessIndicators(
                        Map.of("creamy_yellow", new KnowledgeBase.Indicator(10, "Perfect ripeness")),
                        Map.of()),
                Map.of("sugar_baby", new KnowledgeBase.Variety("small", "round", 9)));
        when(analysisService.getKnowledgeBase()).thenReturn(knowledge);

        mockMvc.perform(get("/api/knowledge"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.knowledge.ripeness_indicators.field_spot.creamy_yellow.score").value(10))
                .andExpect(jsonPath("$.knowledge.varieties.sugar_baby.sweetness").value(9));
    }

    @Test
    void health_ReportsHealthy() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
    }

    @Test
    void unknownRoute_ReturnsJsonNotFound() throws Exception {
        mockMvc.perform(get("/api/does-not-exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Route not found"));
    }
}
