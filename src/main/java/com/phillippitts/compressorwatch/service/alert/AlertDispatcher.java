package com.phillippitts.compressorwatch.service.alert;

import com.phillippitts.compressorwatch.domain.Alert;
import com.phillippitts.compressorwatch.service.metrics.DetectionMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates every {@link AlertRule} after an integrated detection and fans triggered alerts out
 * to the configured {@link NotificationChannel}s.
 *
 * <p>Rules are independent: all of them run on every call, in registration order. There is no
 * deduplication. A failing channel is logged and does not stop delivery to the others.
 */
public final class AlertDispatcher {

    private static final Logger LOG = LogManager.getLogger(AlertDispatcher.class);

    private final boolean enabled;
    private final List<AlertRule> rules;
    private final List<NotificationChannel> channels;
    private final DetectionMetricsPublisher metrics;

    public AlertDispatcher(boolean enabled, List<AlertRule> rules, List<NotificationChannel> channels,
                           DetectionMetricsPublisher metrics) {
        this.enabled = enabled;
        this.rules = List.copyOf(rules);
        this.channels = List.copyOf(channels);
        this.metrics = metrics != null ? metrics : DetectionMetricsPublisher.NOOP;
    }

    /**
     * Runs all rules against the context.
     *
     * @return triggered alerts in rule order; empty when alerting is disabled
     */
    public List<Alert> evaluate(AlertContext context) {
        Objects.requireNonNull(context, "context");
        if (!enabled) {
            return List.of();
        }
        List<Alert> raised = new ArrayList<>();
        for (AlertRule rule : rules) {
            Optional<Alert> alert = rule.evaluate(context);
            alert.ifPresent(raised::add);
        }
        return raised;
    }

    /**
     * Delivers one alert to every channel.
     */
    public void dispatch(String detector, Alert alert) {
        metrics.recordAlert(alert);
        for (NotificationChannel channel : channels) {
            try {
                channel.send(detector, alert);
            } catch (RuntimeException e) {
                LOG.warn("Alert channel '{}' failed for type={}: {}", channel.name(), alert.type(), e.toString());
            }
        }
    }

    public boolean isEnabled() {
        return enabled;
    }

    public List<String> channelNames() {
        return channels.stream().map(NotificationChannel::name).toList();
    }
}
