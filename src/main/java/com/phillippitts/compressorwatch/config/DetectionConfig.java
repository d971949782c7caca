package com.phillippitts.compressorwatch.config;

import com.phillippitts.compressorwatch.config.properties.AlertProperties;
import com.phillippitts.compressorwatch.config.properties.MonitoringProperties;
import com.phillippitts.compressorwatch.config.properties.ScorerProperties;
import com.phillippitts.compressorwatch.service.alert.AccuracyDropRule;
import com.phillippitts.compressorwatch.service.alert.AlertDispatcher;
import com.phillippitts.compressorwatch.service.alert.AlertRule;
import com.phillippitts.compressorwatch.service.alert.AnomalyRateSpikeRule;
import com.phillippitts.compressorwatch.service.alert.ApiNotificationChannel;
import com.phillippitts.compressorwatch.service.alert.ConsoleNotificationChannel;
import com.phillippitts.compressorwatch.service.alert.LogNotificationChannel;
import com.phillippitts.compressorwatch.service.alert.NotificationChannel;
import com.phillippitts.compressorwatch.service.alert.ProcessingTimeIncreaseRule;
import com.phillippitts.compressorwatch.service.detector.AdaptiveDetector;
import com.phillippitts.compressorwatch.service.detector.BaselineDetector;
import com.phillippitts.compressorwatch.service.detector.ConsensusEngine;
import com.phillippitts.compressorwatch.service.metrics.DetectionMetricsPublisher;
import com.phillippitts.compressorwatch.service.monitoring.MonitoringHistory;
import com.phillippitts.compressorwatch.service.scorer.PerCallScorerClient;
import com.phillippitts.compressorwatch.service.scorer.PooledScorerClient;
import com.phillippitts.compressorwatch.service.scorer.SampleFileStager;
import com.phillippitts.compressorwatch.service.scorer.ScorerClient;
import com.phillippitts.compressorwatch.service.scorer.ScorerTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Composition root of the detector chain.
 *
 * <p>Builds one {@link ScorerClient} per stage (transport chosen by {@code scorer.mode}), the
 * three detectors, the monitoring history and the alert dispatcher. Each detector is a single
 * explicit instance injected where needed.
 */
@Configuration
public class DetectionConfig {

    private static final Logger LOG = LogManager.getLogger(DetectionConfig.class);

    private final ScorerProperties scorerProperties;
    private final ApplicationEventPublisher publisher;
    private final DetectionMetricsPublisher metricsPublisher;

    public DetectionConfig(ScorerProperties scorerProperties,
                           ApplicationEventPublisher publisher,
                           DetectionMetricsPublisher metricsPublisher) {
        this.scorerProperties = scorerProperties;
        this.publisher = publisher;
        this.metricsPublisher = metricsPublisher;
    }

    @Bean
    public ScorerTimeouts scorerTimeouts() {
        return new ScorerTimeouts(scorerProperties.getDetectTimeout(), scorerProperties.getSetupTimeout());
    }

    @Bean
    public SampleFileStager sampleFileStager() {
        String workDir = scorerProperties.getWorkDir();
        return new SampleFileStager(workDir == null || workDir.isBlank() ? null : Path.of(workDir));
    }

    @Bean
    public ScorerClient baselineScorerClient(ScorerTimeouts timeouts) {
        return scorerClient("baseline", scorerProperties.getBaseline(), timeouts);
    }

    @Bean
    public ScorerClient adaptiveScorerClient(ScorerTimeouts timeouts) {
        return scorerClient("adaptive", scorerProperties.getAdaptive(), timeouts);
    }

    @Bean
    public ScorerClient consensusScorerClient(ScorerTimeouts timeouts) {
        return scorerClient("consensus", scorerProperties.getConsensus(), timeouts);
    }

    @Bean
    public BaselineDetector baselineDetector(@Qualifier("baselineScorerClient") ScorerClient client,
                                             SampleFileStager stager) {
        return new BaselineDetector(client, stager, scorerProperties.getBaseline().getModelPath(),
                metricsPublisher, publisher);
    }

    @Bean
    public AdaptiveDetector adaptiveDetector(@Qualifier("adaptiveScorerClient") ScorerClient client,
                                             SampleFileStager stager) {
        return new AdaptiveDetector(client, stager, scorerProperties.getAdaptive().getModelPath(),
                metricsPublisher, publisher);
    }

    @Bean
    public MonitoringHistory monitoringHistory(MonitoringProperties props) {
        return new MonitoringHistory(props.getDetectionCapacity(), props.getPerformanceCapacity(),
                props.getHealthCapacity(), props.getAlertCapacity());
    }

    @Bean
    public AlertDispatcher alertDispatcher(AlertProperties props) {
        List<AlertRule> rules = List.of(
                new AccuracyDropRule(props.getAccuracyWindow(), props.getAccuracyDrop()),
                new ProcessingTimeIncreaseRule(props.getProcessingTimeWindow(), props.getProcessingTimeIncrease()),
                new AnomalyRateSpikeRule(props.getAnomalyRateWindow(), props.getAnomalyRateSpike()));
        AlertDispatcher dispatcher = new AlertDispatcher(props.isEnabled(), rules,
                notificationChannels(props.getChannels()), metricsPublisher);
        LOG.info("Alerting enabled={}, channels={}", dispatcher.isEnabled(), dispatcher.channelNames());
        return dispatcher;
    }

    @Bean
    public ConsensusEngine consensusEngine(@Qualifier("consensusScorerClient") ScorerClient client,
                                           SampleFileStager stager,
                                           MonitoringHistory monitoringHistory,
                                           AlertDispatcher alertDispatcher) {
        return new ConsensusEngine(client, stager, scorerProperties.getConsensus().getModelPath(),
                monitoringHistory, alertDispatcher, metricsPublisher, publisher);
    }

    private ScorerClient scorerClient(String detector, ScorerProperties.StageProperties stage,
                                      ScorerTimeouts timeouts) {
        LOG.info("Scorer for {}: mode={}, command={}", detector, scorerProperties.getMode(), stage.getCommand());
        if (scorerProperties.getMode() == ScorerProperties.Mode.PER_CALL) {
            return new PerCallScorerClient(detector, stage.getCommand(), timeouts,
                    scorerProperties.getMaxStdoutBytes());
        }
        return new PooledScorerClient(detector, stage.getCommand(), timeouts, scorerProperties.getPoolSize(),
                scorerProperties.getAcquireTimeout(), scorerProperties.getMaxStdoutBytes());
    }

    List<NotificationChannel> notificationChannels(List<String> names) {
        List<NotificationChannel> channels = new ArrayList<>();
        for (String raw : names) {
            String name = raw.trim().toLowerCase(Locale.ROOT);
            switch (name) {
                case ConsoleNotificationChannel.NAME -> channels.add(new ConsoleNotificationChannel());
                case LogNotificationChannel.NAME -> channels.add(new LogNotificationChannel());
                case ApiNotificationChannel.NAME -> channels.add(new ApiNotificationChannel(publisher));
                default -> throw new IllegalArgumentException("Unknown alert channel '" + raw
                        + "'. Supported: console, log, api");
            }
        }
        return channels;
    }
}
