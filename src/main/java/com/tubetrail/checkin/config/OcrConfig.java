package com.tubetrail.checkin.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tubetrail.checkin.service.StationDirectory;
import com.tubetrail.checkin.service.ocr.OcrAdapter;
import com.tubetrail.checkin.service.ocr.OpenAiVisionOcrAdapter;
import com.tubetrail.checkin.service.ocr.StationNameMatcher;
import com.tubetrail.checkin.service.ocr.UnavailableOcrAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Wires the photo reader.
 *
 * With checkin.ocr.api-key set, photos go to the vision model through a
 * RestTemplate with bounded connect/read timeouts. Without a key the
 * UnavailableOcrAdapter is used and every read ends as ocr_failed.
 */
@Configuration
@Slf4j
public class OcrConfig {

    @Bean
    @Qualifier("ocrRestTemplate")
    public RestTemplate ocrRestTemplate(RestTemplateBuilder builder, CheckinProperties properties) {
        CheckinProperties.Ocr ocr = properties.getOcr();
        return builder
                .setConnectTimeout(Duration.ofMillis(ocr.getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(ocr.getTimeoutMs()))
                .build();
    }

    @Bean
    public OcrAdapter ocrAdapter(@Qualifier("ocrRestTemplate") RestTemplate ocrRestTemplate,
                                 ObjectMapper objectMapper,
                                 StationDirectory stationDirectory,
                                 StationNameMatcher stationNameMatcher,
                                 CheckinProperties properties) {
        if (!properties.getOcr().isConfigured()) {
            log.warn("OCR: checkin.ocr.api-key not set - photo verification disabled, reads will be ocr_failed");
            return new UnavailableOcrAdapter();
        }
        log.info("OCR: vision adapter enabled - model: {}, base: {}",
                properties.getOcr().getModel(), properties.getOcr().getApiBase());
        return new OpenAiVisionOcrAdapter(ocrRestTemplate, objectMapper, stationDirectory,
                stationNameMatcher, properties.getOcr());
    }
}
