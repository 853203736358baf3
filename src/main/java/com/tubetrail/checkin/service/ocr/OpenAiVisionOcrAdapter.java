package com.tubetrail.checkin.service.ocr;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tubetrail.checkin.config.CheckinProperties;
import com.tubetrail.checkin.dto.OcrResult;
import com.tubetrail.checkin.entity.Station;
import com.tubetrail.checkin.exception.OcrUnavailableException;
import com.tubetrail.checkin.service.StationDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Photo reader backed by an OpenAI-compatible chat completions endpoint with
 * image input.
 *
 * The model is asked for {has_roundel, station_name, confidence}; the first
 * JSON object in its reply is parsed and the name is matched against the
 * station catalogue.
 */
@Slf4j
public class OpenAiVisionOcrAdapter implements OcrAdapter {

    static final double DEFAULT_MATCH_CONFIDENCE = 0.9;
    static final int MAX_SUGGESTIONS = 3;

    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*\\}");

    private static final String SYSTEM_PROMPT =
            "You are an expert at detecting London Underground roundels and extracting station names from them.\n\n"
            + "A London Underground roundel is a circular red logo with a blue horizontal bar across the middle "
            + "containing white text with the station name.\n\n"
            + "Analyze the image and respond with a JSON object containing:\n"
            + "- \"has_roundel\": true/false (whether you can clearly see a London Underground roundel)\n"
            + "- \"station_name\": string or null (the exact station name text from the blue bar, or null if unreadable)\n"
            + "- \"confidence\": 0.0-1.0 (your confidence in the station name reading)\n\n"
            + "Be strict about roundel detection. For station_name, extract the exact text as it appears.";

    private static final String USER_PROMPT =
            "Please analyze this image for a London Underground roundel and extract the station name.";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final StationDirectory stationDirectory;
    private final StationNameMatcher stationNameMatcher;
    private final CheckinProperties.Ocr settings;

    public OpenAiVisionOcrAdapter(RestTemplate restTemplate,
                                  ObjectMapper objectMapper,
                                  StationDirectory stationDirectory,
                                  StationNameMatcher stationNameMatcher,
                                  CheckinProperties.Ocr settings) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.stationDirectory = stationDirectory;
        this.stationNameMatcher = stationNameMatcher;
        this.settings = settings;
    }

    @Override
    public OcrResult verifyImage(String imageData) {
        JsonNode reading = readRoundel(imageData);

        JsonNode hasRoundel = reading.get("has_roundel");
        if (hasRoundel == null || !hasRoundel.isBoolean()) {
            throw new OcrUnavailableException("malformed_response", "Vision reply has no boolean has_roundel");
        }
        if (!hasRoundel.asBoolean()) {
            log.info("OCR: no roundel detected");
            return OcrResult.rejected("no_roundel", "", 0.0);
        }

        String extracted = reading.path("station_name").isTextual()
                ? reading.get("station_name").asText().trim()
                : "";
        if (extracted.isEmpty()) {
            log.info("OCR: roundel detected but name not readable");
            return OcrResult.rejected("name_not_readable", "", 0.0);
        }

        double reported = clampConfidence(reading.path("confidence").asDouble(0.0));
        List<Station> catalogue = stationDirectory.catalogue();
        Optional<Station> matched = stationNameMatcher.match(extracted, catalogue);

        if (matched.isEmpty()) {
            List<Station> suggestions = stationNameMatcher.suggest(extracted, catalogue, MAX_SUGGESTIONS);
            log.info("OCR: read '{}' but no catalogue station matched ({} suggestion(s))",
                    extracted, suggestions.size());
            OcrResult.OcrResultBuilder rejected = OcrResult.rejected("name_not_recognized", extracted, reported)
                    .toBuilder();
            suggestions.forEach(s -> rejected.suggestion(s.getName()));
            return rejected.build();
        }

        Station station = matched.get();
        log.info("OCR: read '{}' matched station {} ({})", extracted, station.getName(), station.getId());
        return OcrResult.builder()
                .success(true)
                .confidence(reported > 0 ? reported : DEFAULT_MATCH_CONFIDENCE)
                .stationTextRaw(extracted)
                .matchedStationId(station.getId())
                .matchedStationName(station.getName())
                .build();
    }

    /** Model-reported confidence folded into 0.0 to 1.0; NaN reads as 0.0. */
    static double clampConfidence(double reported) {
        if (Double.isNaN(reported)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, reported));
    }

    private JsonNode readRoundel(String imageData) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(settings.getApiKey());

        Map<String, Object> body = Map.of(
                "model", settings.getModel(),
                "max_tokens", 500,
                "temperature", 0.1,
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", List.of(
                                Map.of("type", "text", "text", USER_PROMPT),
                                Map.of("type", "image_url", "image_url", Map.of("url", imageData))))));

        String response;
        try {
            response = restTemplate.postForObject(settings.getApiBase() + "/chat/completions",
                    new HttpEntity<>(body, headers), String.class);
        } catch (RestClientResponseException e) {
            log.error("OCR: vision API returned HTTP {}", e.getStatusCode().value());
            throw new OcrUnavailableException("api_error", "Vision API returned HTTP " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            log.error("OCR: vision API unreachable: {}", e.getMessage());
            throw new OcrUnavailableException("network_error", "Vision API unreachable", e);
        } catch (RestClientException e) {
            throw new OcrUnavailableException("api_error", "Vision API call failed", e);
        }

        try {
            JsonNode root = objectMapper.readTree(response == null ? "" : response);
            String content = root.path("choices").path(0).path("message").path("content").asText("");
            log.debug("OCR: raw model reply: {}", content);

            Matcher json = JSON_OBJECT.matcher(content);
            if (!json.find()) {
                throw new OcrUnavailableException("malformed_response", "No JSON object in vision reply");
            }
            return objectMapper.readTree(json.group());
        } catch (JsonProcessingException e) {
            throw new OcrUnavailableException("malformed_response", "Vision reply is not valid JSON", e);
        }
    }
}
