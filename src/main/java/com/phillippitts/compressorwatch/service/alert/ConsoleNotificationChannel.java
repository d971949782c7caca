package com.phillippitts.compressorwatch.service.alert;

import com.phillippitts.compressorwatch.domain.Alert;

import java.io.PrintStream;
import java.util.Objects;

/** Prints alerts to the process console. */
public final class ConsoleNotificationChannel implements NotificationChannel {

    public static final String NAME = "console";

    private final PrintStream out;

    public ConsoleNotificationChannel() {
        this(System.out);
    }

    public ConsoleNotificationChannel(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void send(String detector, Alert alert) {
        out.println("[ALERT] " + alert.message() + " (severity: " + alert.severity().label()
                + ", detector: " + detector + ")");
    }
}
