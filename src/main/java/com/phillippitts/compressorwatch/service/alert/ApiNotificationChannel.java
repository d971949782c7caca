package com.phillippitts.compressorwatch.service.alert;

import com.phillippitts.compressorwatch.domain.Alert;
import com.phillippitts.compressorwatch.service.events.AlertRaisedEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.util.Objects;

/**
 * Publishes alerts as {@link AlertRaisedEvent}s for external integrations.
 */
public final class ApiNotificationChannel implements NotificationChannel {

    public static final String NAME = "api";

    private final ApplicationEventPublisher publisher;

    public ApiNotificationChannel(ApplicationEventPublisher publisher) {
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void send(String detector, Alert alert) {
        publisher.publishEvent(new AlertRaisedEvent(detector, alert));
    }
}
