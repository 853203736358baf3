package com.tubetrail.checkin.service;

import com.tubetrail.checkin.config.CheckinProperties;
import com.tubetrail.checkin.dto.OcrResult;
import com.tubetrail.checkin.exception.OcrUnavailableException;
import com.tubetrail.checkin.service.ocr.OcrAdapter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a photo read on the ocrTaskExecutor pool under a hard timeout.
 *
 * Never throws: an unreachable, slow or broken reader comes back as
 * OcrResult.unavailable(...), which the status decision turns into ocr_failed.
 */
@Service
@Slf4j
public class OcrService {

    public static final String ERROR_TIMEOUT = "timeout";
    public static final String ERROR_STATION_MISMATCH = "station_mismatch";

    private final OcrAdapter ocrAdapter;
    private final Executor ocrTaskExecutor;
    private final CheckinProperties properties;

    public OcrService(OcrAdapter ocrAdapter,
                      @Qualifier("ocrTaskExecutor") Executor ocrTaskExecutor,
                      CheckinProperties properties) {
        this.ocrAdapter = ocrAdapter;
        this.ocrTaskExecutor = ocrTaskExecutor;
        this.properties = properties;
    }

    /**
     * Reads the photo and, when it names a different station than the one
     * being checked in, downgrades the read to a station_mismatch failure.
     */
    public OcrResult verifyForStation(String imageData, String expectedStationId) {
        OcrResult result = read(imageData);
        if (result.isSuccess() && result.getMatchedStationId() != null
                && !result.getMatchedStationId().equals(expectedStationId)) {
            log.info("OCR: photo shows {} ({}) but check-in is for {}",
                    result.getMatchedStationName(), result.getMatchedStationId(), expectedStationId);
            return result.toBuilder()
                    .success(false)
                    .errorCode(ERROR_STATION_MISMATCH)
                    .build();
        }
        return result;
    }

    /**
     * Plain read with no station expectation, for the stand-alone roundel endpoint.
     */
    public OcrResult read(String imageData) {
        long timeoutMs = properties.getOcr().getTimeoutMs();
        CompletableFuture<OcrResult> future;
        try {
            future = CompletableFuture.supplyAsync(() -> ocrAdapter.verifyImage(imageData), ocrTaskExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("OCR: executor saturated, read rejected");
            return OcrResult.unavailable("network_error");
        }

        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("OCR: read exceeded {} ms, giving up", timeoutMs);
            return OcrResult.unavailable(ERROR_TIMEOUT);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof OcrUnavailableException) {
                OcrUnavailableException unavailable = (OcrUnavailableException) cause;
                log.warn("OCR: reader unavailable [{}]: {}", unavailable.getErrorCode(), unavailable.getMessage());
                return OcrResult.unavailable(unavailable.getErrorCode());
            }
            log.error("OCR: unexpected reader failure", cause);
            return OcrResult.unavailable("api_error");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return OcrResult.unavailable(ERROR_TIMEOUT);
        }
    }
}
