package com.phillippitts.compressorwatch.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Capacities of the consensus-stage monitoring rings and the health refresh interval.
 */
@ConfigurationProperties(prefix = "monitoring")
@Validated
public class MonitoringProperties {

    @Positive
    private int detectionCapacity = 1000;

    @Positive
    private int performanceCapacity = 100;

    @Positive
    private int healthCapacity = 50;

    @Positive
    private int alertCapacity = 100;

    /** Interval of the scheduled readiness refresh. */
    @Positive
    private long healthCheckIntervalMs = 60_000L;

    public int getDetectionCapacity() {
        return detectionCapacity;
    }

    public void setDetectionCapacity(int detectionCapacity) {
        this.detectionCapacity = detectionCapacity;
    }

    public int getPerformanceCapacity() {
        return performanceCapacity;
    }

    public void setPerformanceCapacity(int performanceCapacity) {
        this.performanceCapacity = performanceCapacity;
    }

    public int getHealthCapacity() {
        return healthCapacity;
    }

    public void setHealthCapacity(int healthCapacity) {
        this.healthCapacity = healthCapacity;
    }

    public int getAlertCapacity() {
        return alertCapacity;
    }

    public void setAlertCapacity(int alertCapacity) {
        this.alertCapacity = alertCapacity;
    }

    public long getHealthCheckIntervalMs() {
        return healthCheckIntervalMs;
    }

    public void setHealthCheckIntervalMs(long healthCheckIntervalMs) {
        this.healthCheckIntervalMs = healthCheckIntervalMs;
    }
}
