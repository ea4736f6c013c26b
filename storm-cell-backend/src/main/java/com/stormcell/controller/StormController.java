package com.stormcell.controller;

import com.stormcell.model.StormAnalysisInput;
import com.stormcell.model.StormAnalysisResult;
import com.stormcell.service.StormAnalysisService;
import com.stormcell.service.imaging.PixelClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.awt.image.BufferedImage;
import java.io.IOException;

@RestController
@RequestMapping("/api/storms")
@CrossOrigin(origins = "*")
public class StormController {

    private static final Logger LOG = LoggerFactory.getLogger(StormController.class);

    private final StormAnalysisService analysisService;

    public StormController(StormAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping("/analyze")
    public StormAnalysisResult analyze(@RequestBody StormAnalysisInput input) {
        if (input.getPixels() == null) {
            throw new IllegalArgumentException("Pixels are required");
        }
        LOG.debug("Analyzing {} submitted pixels", input.getPixels().size());
        return analysisService.analyzePixels(input.getPixels());
    }

    @PostMapping(value = "/analyze-image", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public StormAnalysisResult analyzeImage(@RequestParam("image") MultipartFile image) throws IOException {
        return analysisService.analyzeImage(decode(image));
    }

    @PostMapping(value = "/render", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.IMAGE_PNG_VALUE)
    public ResponseEntity<byte[]> render(@RequestParam("image") MultipartFile image) throws IOException {
        return ResponseEntity.ok()
                .contentType(MediaType.IMAGE_PNG)
                .body(analysisService.renderPng(decode(image)));
    }

    @PostMapping(value = "/report", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.TEXT_PLAIN_VALUE)
    public String report(@RequestParam("image") MultipartFile image) throws IOException {
        return analysisService.report(analysisService.analyzeImage(decode(image)));
    }

    @GetMapping("/latest")
    public StormAnalysisResult latest() {
        return analysisService.analyzeLatest();
    }

    private static BufferedImage decode(MultipartFile image) throws IOException {
        if (image.isEmpty()) {
            throw new IllegalArgumentException("Image is required");
        }
        return PixelClassifier.decode(image.getBytes());
    }
}
