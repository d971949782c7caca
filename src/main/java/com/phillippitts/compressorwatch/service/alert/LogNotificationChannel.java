package com.phillippitts.compressorwatch.service.alert;

import com.phillippitts.compressorwatch.domain.Alert;
import com.phillippitts.compressorwatch.domain.AlertSeverity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Writes alerts to the application log; critical alerts at ERROR, warnings at WARN. */
public final class LogNotificationChannel implements NotificationChannel {

    private static final Logger LOG = LogManager.getLogger(LogNotificationChannel.class);

    public static final String NAME = "log";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void send(String detector, Alert alert) {
        if (alert.severity() == AlertSeverity.CRITICAL) {
            LOG.error("Alert raised: detector={}, type={}, message={}", detector, alert.type(), alert.message());
        } else {
            LOG.warn("Alert raised: detector={}, type={}, message={}", detector, alert.type(), alert.message());
        }
    }
}
