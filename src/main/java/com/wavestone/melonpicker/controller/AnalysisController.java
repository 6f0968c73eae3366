package com.wavestone.melonpicker.controller;

import com.wavestone.melonpicker.model.AnalysisReport;
import com.wavestone.melonpicker.model.UserInputs;
import com.wavestone.melonpicker.service.WatermelonAnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
@CrossOrigin(originPatterns = "*")
public class AnalysisController {

    private final WatermelonAnalysisService analysisService;

    @Value("${app.upload.allowed-content-prefix:image/}")
    private String allowedContentPrefix;

    @PostMapping(value = "/analyze", consumes = {MediaType.MULTIPART_FORM_DATA_VALUE, MediaType.APPLICATION_FORM_URLENCODED_VALUE})
    public ResponseEntity<Map<String, Object>> analyze(
            @RequestParam(value = "image", required = false) MultipartFile image,
            @RequestParam(value = "size", required = false) String size,
            @RequestParam(value = "shape", required = false) String shape,
            @RequestParam(value = "stripes", required = false) String stripes,
            @RequestParam(value = "fieldSpot", required = false) String fieldSpot,
            @RequestParam(value = "stem", required = false) String stem) {

        Map<String, Object> response = new LinkedHashMap<>();

        try {
            byte[] imageBytes = null;
            if (image != null && !image.isEmpty()) {
                if (!isImageContentType(image.getContentType())) {
                    log.warn("Rejected upload {} with content type {}", image.getOriginalFilename(), image.getContentType());
                    response.put("success", false);
                    response.put("error", "Only image files are allowed");
                    return ResponseEntity.badRequest().body(response);
                }
                imageBytes = image.getBytes();
            }

            UserInputs inputs = UserInputs.builder()
                    .size(size)
                    .shape(shape)
                    .stripes(stripes)
                    .fieldSpot(fieldSpot)
                    .stem(stem)
                    .build();

            AnalysisReport report = analysisService.analyze(inputs, imageBytes);

            response.put("success", true);
            response.put("analysis", report.getAnalysis());
            response.put("recommendation", report.getRecommendation());
            response.put("timestamp", report.getTimestamp());

            return ResponseEntity.ok(response);

        } catch (Exception e) {
            log.error("Error analyzing watermelon", e);
            response.clear();
            response.put("success", false);
            response.put("error", "Failed to analyze watermelon");
            response.put("message", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
        }
    }

    @GetMapping("/tips")
    public ResponseEntity<Map<String, Object>> getTips() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("tips", analysisService.getGeneralTips());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/knowledge")
    public ResponseEntity<Map<String, Object>> getKnowledge() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("knowledge", analysisService.getKnowledgeBase());
        return ResponseEntity.ok(response);
    }

    private boolean isImageContentType(String contentType) {
        return contentType != null && contentType.startsWith(allowedContentPrefix);
    }
}
