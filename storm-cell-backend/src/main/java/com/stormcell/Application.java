package com.stormcell;

import com.stormcell.config.StormAnalysisProperties;
import com.stormcell.model.StormAnalysisResult;
import com.stormcell.service.StormAnalysisException;
import com.stormcell.service.StormAnalysisService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.time.Clock;

@SpringBootApplication
@EnableConfigurationProperties(StormAnalysisProperties.class)
public class Application {

    private static final Logger LOG = LoggerFactory.getLogger(Application.class);

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

    @Bean
    Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * One-shot analysis of a local radar image when storm.batch.input-image is set.
     */
    @Bean
    CommandLineRunner analyzeBatchImage(StormAnalysisService analysisService, StormAnalysisProperties properties) {
        return args -> {
            StormAnalysisProperties.Batch batch = properties.getBatch();
            if (batch.getInputImage() == null || batch.getInputImage().isBlank()) {
                return;
            }
            BufferedImage radarImage = readImage(batch.getInputImage());
            BufferedImage baseImage = batch.getBaseImage() != null && !batch.getBaseImage().isBlank()
                    ? readImage(batch.getBaseImage())
                    : null;

            StormAnalysisResult result = analysisService.analyzeImage(radarImage);
            BufferedImage rendered = analysisService.renderImage(radarImage, baseImage, result);
            File output = new File(batch.getOutputImage());
            ImageIO.write(rendered, "png", output);

            LOG.info("Wrote {} storms to {}", result.getStormCount(), output.getAbsolutePath());
            LOG.info("Storm report:{}{}", System.lineSeparator(), analysisService.report(result));
        };
    }

    private static BufferedImage readImage(String path) throws IOException {
        BufferedImage image = ImageIO.read(new File(path));
        if (image == null) {
            throw new StormAnalysisException("Not a readable image: " + path);
        }
        return image;
    }
}
