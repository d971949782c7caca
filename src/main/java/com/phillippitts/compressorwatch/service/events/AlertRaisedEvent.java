package com.phillippitts.compressorwatch.service.events;

import com.phillippitts.compressorwatch.domain.Alert;

/**
 * Application event carrying an alert raised by the consensus stage. This is the {@code api}
 * notification channel: external integrations subscribe with {@code @EventListener}.
 */
public record AlertRaisedEvent(String detector, Alert alert) {
}
