package com.phillippitts.compressorwatch.presentation.controller;

import com.phillippitts.compressorwatch.service.alert.AlertDispatcher;
import com.phillippitts.compressorwatch.service.detector.AdaptiveDetector;
import com.phillippitts.compressorwatch.service.detector.BaselineDetector;
import com.phillippitts.compressorwatch.service.detector.ConsensusEngine;
import com.phillippitts.compressorwatch.service.monitoring.MonitoringHistory;
import com.phillippitts.compressorwatch.service.scorer.SampleFileStager;
import com.phillippitts.compressorwatch.testutil.FakeScorerClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;
import java.util.List;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class DetectionControllerTest {

    @TempDir
    Path workDir;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        SampleFileStager stager = new SampleFileStager(workDir);
        BaselineDetector baseline = new BaselineDetector(new FakeScorerClient("baseline"), stager, "m1/", null, null);
        AdaptiveDetector adaptive = new AdaptiveDetector(new FakeScorerClient("adaptive"), stager, "m2/", null, null);
        ConsensusEngine consensus = new ConsensusEngine(new FakeScorerClient("consensus"), stager, "m3/",
                new MonitoringHistory(10, 10, 10, 10), new AlertDispatcher(false, List.of(), List.of(), null),
                null, null);
        mvc = MockMvcBuilders.standaloneSetup(new DetectionController(baseline, adaptive, consensus, Runnable::run))
                .build();
    }

    @Test
    void detectBeforeTrainingReturnsSoftFailure() throws Exception {
        mvc.perform(post("/api/detectors/baseline/detect")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(new byte[]{1, 2, 3}))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isAnomaly").value(false))
                .andExpect(jsonPath("$.anomalyType").value("model_not_initialized"))
                .andExpect(jsonPath("$.phase").value(1))
                .andExpect(jsonPath("$.reliability").doesNotExist());
    }

    @Test
    void trainThenDetectOnBaseline() throws Exception {
        mvc.perform(multipart("/api/detectors/baseline/train")
                        .file(new MockMultipartFile("files", "a.wav", "audio/wav", new byte[]{1, 2}))
                        .file(new MockMultipartFile("files", "b.wav", "audio/wav", new byte[]{3, 4})))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("READY"))
                .andExpect(jsonPath("$.samples").value(2));

        mvc.perform(post("/api/detectors/baseline/detect")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(new byte[]{5}))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.anomalyType").value("normal"))
                .andExpect(jsonPath("$.confidence").value(0.6));
    }

    @Test
    void paramsUpdateReportsAppliedSubset() throws Exception {
        mvc.perform(put("/api/detectors/adaptive/params")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sensitivity\":0.4,\"learningRate\":2.0}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.applied.sensitivity").value(0.4))
                .andExpect(jsonPath("$.applied.learningRate").doesNotExist())
                .andExpect(jsonPath("$.params.learningRate").value(0.01));
    }

    @Test
    void statusEndpointsReportUninitialized() throws Exception {
        mvc.perform(get("/api/detectors/adaptive/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("UNINITIALIZED"));
        mvc.perform(get("/api/detectors/consensus/monitoring").param("limit", "5"))
                .andExpect(status().isOk());
    }
}
