package com.phillippitts.compressorwatch.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Thresholds and windows for the consensus-stage alert rules.
 */
@ConfigurationProperties(prefix = "alerts")
@Validated
public class AlertProperties {

    /** Enable/disable alert evaluation globally. */
    private boolean enabled = true;

    /** Alert when recent mean accuracy falls this far below the overall accuracy. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double accuracyDrop = 0.1;

    /** Alert when recent mean processing time exceeds the overall mean by this factor. */
    @Positive
    private double processingTimeIncrease = 2.0;

    /** Alert when the recent anomalous fraction exceeds this rate. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double anomalyRateSpike = 0.3;

    @Positive
    private int accuracyWindow = 10;

    @Positive
    private int processingTimeWindow = 5;

    @Positive
    private int anomalyRateWindow = 20;

    /** Notification channels: console, log, api. */
    @NotNull
    private List<String> channels = new ArrayList<>(List.of("console", "log", "api"));

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public double getAccuracyDrop() {
        return accuracyDrop;
    }

    public void setAccuracyDrop(double accuracyDrop) {
        this.accuracyDrop = accuracyDrop;
    }

    public double getProcessingTimeIncrease() {
        return processingTimeIncrease;
    }

    public void setProcessingTimeIncrease(double processingTimeIncrease) {
        this.processingTimeIncrease = processingTimeIncrease;
    }

    public double getAnomalyRateSpike() {
        return anomalyRateSpike;
    }

    public void setAnomalyRateSpike(double anomalyRateSpike) {
        this.anomalyRateSpike = anomalyRateSpike;
    }

    public int getAccuracyWindow() {
        return accuracyWindow;
    }

    public void setAccuracyWindow(int accuracyWindow) {
        this.accuracyWindow = accuracyWindow;
    }

    public int getProcessingTimeWindow() {
        return processingTimeWindow;
    }

    public void setProcessingTimeWindow(int processingTimeWindow) {
        this.processingTimeWindow = processingTimeWindow;
    }

    public int getAnomalyRateWindow() {
        return anomalyRateWindow;
    }

    public void setAnomalyRateWindow(int anomalyRateWindow) {
        this.anomalyRateWindow = anomalyRateWindow;
    }

    public List<String> getChannels() {
        return channels;
    }

    public void setChannels(List<String> channels) {
        this.channels = channels;
    }
}
