package com.stormcell.service.source.impl;

import com.stormcell.config.StormAnalysisProperties;
import com.stormcell.service.StormAnalysisException;
import com.stormcell.service.imaging.PixelClassifier;
import com.stormcell.service.source.RadarImageSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.awt.image.BufferedImage;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Fetches PPI frames from the meteorological bureau's web archive, where each
 * frame is filed under a date directory and named by its scan time (UTC).
 */
@Component
public class HttpRadarImageSource implements RadarImageSource {

    private static final Logger LOG = LoggerFactory.getLogger(HttpRadarImageSource.class);
    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter SCAN_FORMAT = DateTimeFormatter.ofPattern("yyyyMMddHHmm");

    private final StormAnalysisProperties.Source settings;
    private final RestTemplate restTemplate;
    private final Clock clock;

    public HttpRadarImageSource(StormAnalysisProperties properties, RestTemplateBuilder restTemplateBuilder,
                                Clock clock) {
        this.settings = properties.getSource();
        this.restTemplate = restTemplateBuilder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(15))
                .build();
        this.clock = clock;
    }

    @Override
    public String latestFrameUrl() {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(ZoneOffset.UTC)).truncatedTo(ChronoUnit.MINUTES);
        int step = settings.getStepMinutes();
        ZonedDateTime scanTime = now
                .withMinute((now.getMinute() / step) * step)
                .minusMinutes(settings.getLagMinutes());

        return settings.getUrlHead()
                + DAY_FORMAT.format(scanTime)
                + settings.getUrlMiddle()
                + SCAN_FORMAT.format(scanTime)
                + settings.getUrlEnd();
    }

    @Override
    public BufferedImage fetchLatest() {
        String url = latestFrameUrl();
        LOG.info("Fetching latest radar frame {}", url);
        byte[] body;
        try {
            body = restTemplate.getForObject(url, byte[].class);
        } catch (RestClientException e) {
            throw StormAnalysisException.upstream("Failed to download radar image " + url, e);
        }
        if (body == null || body.length == 0) {
            throw StormAnalysisException.upstream("Empty response for radar image " + url, null);
        }
        return PixelClassifier.decode(body);
    }
}
