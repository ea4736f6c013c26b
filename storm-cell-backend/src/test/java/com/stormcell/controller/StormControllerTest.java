package com.stormcell.controller;

import com.stormcell.model.StormAnalysisResult;
import com.stormcell.service.StormAnalysisException;
import com.stormcell.service.StormAnalysisService;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.junit4.SpringRunner;
import org.springframework.test.web.servlet.MockMvc;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDateTime;
import java.util.Collections;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@RunWith(SpringRunner.class)
@WebMvcTest(StormController.class)
public class StormControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private StormAnalysisService analysisService;

    private static StormAnalysisResult emptyResult() {
        StormAnalysisResult result = new StormAnalysisResult();
        result.setStationName("GuangZhou");
        result.setProcessedAt(LocalDateTime.of(2024, 4, 24, 13, 48));
        result.setStorms(Collections.emptyList());
        return result;
    }

    private static byte[] png() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(new BufferedImage(4, 4, BufferedImage.TYPE_INT_ARGB), "png", out);
        return out.toByteArray();
    }

    @Test
    public void testAnalyzePixels() throws Exception {
        when(analysisService.analyzePixels(anyCollection())).thenReturn(emptyResult());

        mockMvc.perform(post("/api/storms/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pixels\": [{\"x\": 10, \"y\": 12, \"color\": -65536, \"intensity\": 50}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.stationName").value("GuangZhou"))
                .andExpect(jsonPath("$.stormCount").value(0));

        verify(analysisService).analyzePixels(anyCollection());
    }

    @Test
    public void testPixelWithoutColorIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/storms/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pixels\": [{\"x\": 10, \"y\": 12, \"intensity\": 50}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request body"));

        verify(analysisService, never()).analyzePixels(anyCollection());
    }

    @Test
    public void testAnalyzeWithoutPixelsIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/storms/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Pixels are required"));

        verify(analysisService, never()).analyzePixels(anyCollection());
    }

    @Test
    public void testReportFromUploadedImage() throws Exception {
        StormAnalysisResult result = emptyResult();
        when(analysisService.analyzeImage(any(BufferedImage.class))).thenReturn(result);
        when(analysisService.report(result)).thenReturn("Storm number in active: 0");

        mockMvc.perform(multipart("/api/storms/report")
                        .file(new MockMultipartFile("image", "radar.png", MediaType.IMAGE_PNG_VALUE, png())))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("Storm number in active: 0")));
    }

    @Test
    public void testRenderReturnsPng() throws Exception {
        byte[] rendered = png();
        when(analysisService.renderPng(any(BufferedImage.class))).thenReturn(rendered);

        mockMvc.perform(multipart("/api/storms/render")
                        .file(new MockMultipartFile("image", "radar.png", MediaType.IMAGE_PNG_VALUE, png())))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.IMAGE_PNG))
                .andExpect(content().bytes(rendered));
    }

    @Test
    public void testUndecodableUploadIsUnprocessable() throws Exception {
        mockMvc.perform(multipart("/api/storms/analyze-image")
                        .file(new MockMultipartFile("image", "radar.png", MediaType.IMAGE_PNG_VALUE,
                                new byte[] { 1, 2, 3 })))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    public void testUnavailableLatestFrameIsBadGateway() throws Exception {
        when(analysisService.analyzeLatest())
                .thenThrow(StormAnalysisException.upstream("Failed to download radar image", null));

        mockMvc.perform(get("/api/storms/latest"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("Failed to download radar image"));
    }
}
