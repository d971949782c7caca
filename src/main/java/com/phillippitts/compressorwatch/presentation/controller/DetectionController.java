package com.phillippitts.compressorwatch.presentation.controller;

import com.phillippitts.compressorwatch.domain.DetectionSample;
import com.phillippitts.compressorwatch.domain.SystemStatus;
import com.phillippitts.compressorwatch.exception.ValidationException;
import com.phillippitts.compressorwatch.presentation.dto.DetectionResponse;
import com.phillippitts.compressorwatch.presentation.dto.ParamsUpdateResponse;
import com.phillippitts.compressorwatch.service.detector.AdaptiveDetector;
import com.phillippitts.compressorwatch.service.detector.AdaptiveDetectorStats;
import com.phillippitts.compressorwatch.service.detector.AdaptiveStats;
import com.phillippitts.compressorwatch.service.detector.BaselineDetector;
import com.phillippitts.compressorwatch.service.detector.BaselineStats;
import com.phillippitts.compressorwatch.service.detector.ConsensusEngine;
import com.phillippitts.compressorwatch.service.detector.DetectorStatus;
import com.phillippitts.compressorwatch.service.detector.IntegratedStats;
import com.phillippitts.compressorwatch.service.monitoring.MonitoringSnapshot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * REST surface of the detector chain: setup, detection, parameter and query operations.
 *
 * <p>Audio is posted as {@code application/octet-stream} with an optional {@code sampleRate}
 * query parameter. Detection endpoints always return 200 with a (possibly soft-failure) result;
 * setup endpoints map failures through {@code GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/detectors")
class DetectionController {

    private static final Logger LOG = LogManager.getLogger(DetectionController.class);

    private static final String DEFAULT_SAMPLE_RATE = "16000";

    private final BaselineDetector baseline;
    private final AdaptiveDetector adaptive;
    private final ConsensusEngine consensus;
    private final Executor detectionExecutor;

    DetectionController(BaselineDetector baseline,
                        AdaptiveDetector adaptive,
                        ConsensusEngine consensus,
                        @Qualifier("detectionExecutor") Executor detectionExecutor) {
        this.baseline = baseline;
        this.adaptive = adaptive;
        this.consensus = consensus;
        this.detectionExecutor = detectionExecutor;
    }

    // Baseline

    @PostMapping(value = "/baseline/train", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<Map<String, Object>> trainBaseline(
            @RequestPart(value = "files", required = false) List<MultipartFile> files,
            @RequestParam(defaultValue = DEFAULT_SAMPLE_RATE) int sampleRate) throws IOException {
        if (files == null || files.isEmpty()) {
            throw new ValidationException("files", "training requires at least one normal sample");
        }
        List<DetectionSample> samples = new ArrayList<>(files.size());
        for (MultipartFile file : files) {
            samples.add(new DetectionSample(file.getBytes(), sampleRate));
        }
        LOG.info("Baseline training requested with {} samples", samples.size());
        baseline.train(samples);
        return ResponseEntity.ok(Map.of("status", baseline.getState().name(), "samples", samples.size()));
    }

    @PostMapping(value = "/baseline/detect", consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    DetectionResponse detectBaseline(@RequestBody byte[] audio,
                                     @RequestParam(defaultValue = DEFAULT_SAMPLE_RATE) int sampleRate) {
        return DetectionResponse.from(baseline.detect(new DetectionSample(audio, sampleRate)));
    }

    @GetMapping("/baseline/stats")
    BaselineStats baselineStats() {
        return baseline.getStats();
    }

    @GetMapping("/baseline/status")
    DetectorStatus baselineStatus() {
        return baseline.getStatus();
    }

    @PostMapping("/baseline/reset")
    ResponseEntity<Void> resetBaseline() {
        baseline.resetStats();
        return ResponseEntity.noContent().build();
    }

    // Adaptive

    @PostMapping("/adaptive/initialize")
    DetectorStatus initializeAdaptive() {
        adaptive.initialize(baseline);
        return adaptive.getStatus();
    }

    @PostMapping(value = "/adaptive/detect", consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    DetectionResponse detectAdaptive(@RequestBody byte[] audio,
                                     @RequestParam(defaultValue = DEFAULT_SAMPLE_RATE) int sampleRate,
                                     @RequestParam(required = false) Boolean groundTruth) {
        return DetectionResponse.from(adaptive.detectAdaptive(new DetectionSample(audio, sampleRate), groundTruth));
    }

    @PutMapping("/adaptive/params")
    ParamsUpdateResponse updateAdaptiveParams(@RequestBody Map<String, Double> partial) {
        Map<String, Double> applied = adaptive.updateParams(partial);
        return new ParamsUpdateResponse(applied, adaptive.currentParams().asMap());
    }

    @PostMapping("/adaptive/force-update")
    CompletableFuture<AdaptiveStats> forceAdaptiveUpdate() {
        return CompletableFuture.supplyAsync(adaptive::forceAdaptiveUpdate, detectionExecutor);
    }

    @GetMapping("/adaptive/stats")
    AdaptiveDetectorStats adaptiveStats() {
        return adaptive.getAdaptiveStats();
    }

    @GetMapping("/adaptive/status")
    DetectorStatus adaptiveStatus() {
        return adaptive.getStatus();
    }

    @PostMapping("/adaptive/save")
    ResponseEntity<Void> saveAdaptive() {
        adaptive.save();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/adaptive/reset")
    ResponseEntity<Void> resetAdaptive() {
        adaptive.resetStats();
        return ResponseEntity.noContent().build();
    }

    // Consensus

    @PostMapping("/consensus/initialize")
    SystemStatus initializeConsensus() {
        consensus.initialize(baseline, adaptive);
        return consensus.getSystemStatus();
    }

    @PostMapping(value = "/consensus/detect", consumes = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    DetectionResponse detectConsensus(@RequestBody byte[] audio,
                                      @RequestParam(defaultValue = DEFAULT_SAMPLE_RATE) int sampleRate,
                                      @RequestParam(required = false) Boolean groundTruth) {
        return DetectionResponse.from(consensus.detectIntegrated(new DetectionSample(audio, sampleRate), groundTruth));
    }

    @PutMapping("/consensus/params")
    ParamsUpdateResponse updateIntegrationParams(@RequestBody Map<String, Double> partial) {
        Map<String, Double> applied = consensus.updateIntegrationParams(partial);
        return new ParamsUpdateResponse(applied, consensus.currentParams().asMap());
    }

    @GetMapping("/consensus/stats")
    IntegratedStats consensusStats() {
        return consensus.getIntegratedStats();
    }

    @GetMapping("/consensus/monitoring")
    MonitoringSnapshot monitoring(@RequestParam(defaultValue = "100") int limit) {
        return consensus.getMonitoringData(limit);
    }

    @GetMapping("/consensus/status")
    SystemStatus consensusStatus() {
        return consensus.getSystemStatus();
    }

    @PostMapping("/consensus/save")
    ResponseEntity<Void> saveConsensus() {
        consensus.save();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/consensus/reset")
    ResponseEntity<Void> resetConsensus() {
        consensus.reset();
        return ResponseEntity.noContent().build();
    }
}
