package com.phillippitts.compressorwatch.service.alert;

import com.phillippitts.compressorwatch.domain.Alert;

/**
 * Destination for raised alerts. Implementations must not throw for delivery problems.
 */
public interface NotificationChannel {

    /**
     * @return channel name as used in {@code alerts.channels}
     */
    String name();

    void send(String detector, Alert alert);
}
