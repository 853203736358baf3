package com.tubetrail.checkin.service.ocr;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tubetrail.checkin.config.CheckinProperties;
import com.tubetrail.checkin.dto.OcrResult;
import com.tubetrail.checkin.entity.Station;
import com.tubetrail.checkin.exception.OcrUnavailableException;
import com.tubetrail.checkin.service.StationDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

/**
 * Unit tests for OpenAiVisionOcrAdapter against a mocked chat completions endpoint.
 */
@ExtendWith(MockitoExtension.class)
class OpenAiVisionOcrAdapterTest {

    private static final String API_BASE = "https://vision.test/v1";
    private static final String ENDPOINT = API_BASE + "/chat/completions";
    private static final String IMAGE    = "data:image/jpeg;base64,/9j/4AAQSkZJRg==";

    @Mock private StationDirectory stationDirectory;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockRestServiceServer server;
    private OpenAiVisionOcrAdapter adapter;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();

        CheckinProperties.Ocr settings = new CheckinProperties.Ocr();
        settings.setApiKey("test-key");
        settings.setApiBase(API_BASE);
        settings.setModel("gpt-4o");

        adapter = new OpenAiVisionOcrAdapter(restTemplate, objectMapper, stationDirectory,
                new CatalogueStationNameMatcher(), settings);
    }

    // ── Helper builders ───────────────────────────────────────────────────────

    private void catalogue() {
        when(stationDirectory.catalogue()).thenReturn(List.of(
                Station.builder().id("940GZZLUKSX").name("King's Cross St. Pancras").latitude(51.5308).longitude(-0.1238).build(),
                Station.builder().id("940GZZLUBND").name("Bond Street").latitude(51.5142).longitude(-0.1494).build()));
    }

    private String completion(String content) throws Exception {
        return objectMapper.writeValueAsString(Map.of(
                "choices", List.of(Map.of("message", Map.of("role", "assistant", "content", content)))));
    }

    private void respondWith(String content) throws Exception {
        server.expect(requestTo(ENDPOINT))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer test-key"))
                .andExpect(jsonPath("$.model").value("gpt-4o"))
                .andExpect(jsonPath("$.messages[1].content[1].image_url.url").value(IMAGE))
                .andRespond(withSuccess(completion(content), MediaType.APPLICATION_JSON));
    }

    // ════════════════════════════════════════════════════════════════════════
    // Reads
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Readable roundel is matched to the catalogue")
    void readableRoundel_matched() throws Exception {
        catalogue();
        respondWith("Sure! {\"has_roundel\": true, \"station_name\": \"KING'S CROSS ST. PANCRAS\", \"confidence\": 0.88}");

        OcrResult result = adapter.verifyImage(IMAGE);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getMatchedStationId()).isEqualTo("940GZZLUKSX");
        assertThat(result.getMatchedStationName()).isEqualTo("King's Cross St. Pancras");
        assertThat(result.getStationTextRaw()).isEqualTo("KING'S CROSS ST. PANCRAS");
        assertThat(result.getConfidence()).isEqualTo(0.88);
        server.verify();
    }

    @Test
    @DisplayName("Matched read without a confidence gets the default")
    void missingConfidence_defaulted() throws Exception {
        catalogue();
        respondWith("{\"has_roundel\": true, \"station_name\": \"Bond Street\"}");

        OcrResult result = adapter.verifyImage(IMAGE);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getConfidence()).isEqualTo(OpenAiVisionOcrAdapter.DEFAULT_MATCH_CONFIDENCE);
    }

    @Test
    @DisplayName("Reported confidence above 1.0 is capped at 1.0")
    void confidenceAboveOne_capped() throws Exception {
        catalogue();
        respondWith("{\"has_roundel\": true, \"station_name\": \"Bond Street\", \"confidence\": 42}");

        OcrResult result = adapter.verifyImage(IMAGE);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getConfidence()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Negative reported confidence on an unmatched name reads as 0.0")
    void negativeConfidence_floored() throws Exception {
        catalogue();
        respondWith("{\"has_roundel\": true, \"station_name\": \"Atlantis Central\", \"confidence\": -3.5}");

        OcrResult result = adapter.verifyImage(IMAGE);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorCode()).isEqualTo("name_not_recognized");
        assertThat(result.getConfidence()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("No roundel in the photo")
    void noRoundel() throws Exception {
        respondWith("{\"has_roundel\": false, \"station_name\": null, \"confidence\": 0.0}");

        OcrResult result = adapter.verifyImage(IMAGE);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.isUnavailable()).isFalse();
        assertThat(result.getErrorCode()).isEqualTo("no_roundel");
        verifyNoInteractions(stationDirectory);
    }

    @Test
    @DisplayName("Roundel with an unreadable name")
    void nameNotReadable() throws Exception {
        respondWith("{\"has_roundel\": true, \"station_name\": \"  \", \"confidence\": 0.2}");

        assertThat(adapter.verifyImage(IMAGE).getErrorCode()).isEqualTo("name_not_readable");
    }

    @Test
    @DisplayName("Readable name that is not in the catalogue comes with suggestions")
    void nameNotRecognized_withSuggestions() throws Exception {
        catalogue();
        respondWith("{\"has_roundel\": true, \"station_name\": \"Bnd Stret\", \"confidence\": 0.4}");

        OcrResult result = adapter.verifyImage(IMAGE);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorCode()).isEqualTo("name_not_recognized");
        assertThat(result.getStationTextRaw()).isEqualTo("Bnd Stret");
        assertThat(result.getConfidence()).isEqualTo(0.4);
        assertThat(result.getSuggestions()).containsExactly("Bond Street");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Failures
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Upstream 5xx is api_error")
    void serverError_apiError() {
        server.expect(requestTo(ENDPOINT)).andRespond(withServerError());

        assertThatThrownBy(() -> adapter.verifyImage(IMAGE))
                .isInstanceOf(OcrUnavailableException.class)
                .extracting(e -> ((OcrUnavailableException) e).getErrorCode())
                .isEqualTo("api_error");
    }

    @Test
    @DisplayName("Reply without JSON is malformed_response")
    void noJson_malformed() throws Exception {
        respondWith("I cannot help with that.");

        assertThatThrownBy(() -> adapter.verifyImage(IMAGE))
                .isInstanceOf(OcrUnavailableException.class)
                .extracting(e -> ((OcrUnavailableException) e).getErrorCode())
                .isEqualTo("malformed_response");
    }

    @Test
    @DisplayName("JSON without a boolean has_roundel is malformed_response")
    void missingHasRoundel_malformed() throws Exception {
        respondWith("{\"station_name\": \"Euston\"}");

        assertThatThrownBy(() -> adapter.verifyImage(IMAGE))
                .isInstanceOf(OcrUnavailableException.class)
                .extracting(e -> ((OcrUnavailableException) e).getErrorCode())
                .isEqualTo("malformed_response");
    }
}
