package com.phillippitts.compressorwatch.service.events;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Logs scorer failures, throttled per detector and command to avoid log spam while a scorer is down.
 */
@Component
class ScorerFailureListener {
    private static final Logger LOG = LogManager.getLogger(ScorerFailureListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onScorerFailure(ScorerFailureEvent e) {
        String key = e.detector() + '-' + e.command();
        if (shouldLog(key)) {
            LOG.warn("Scorer failure: detector={}, command={}, reason={}. Check scorer.{}.command and model path.",
                    e.detector(), e.command(), e.message(), e.detector());
        }
    }

    @EventListener
    void onAlertRaised(AlertRaisedEvent e) {
        LOG.debug("Alert event published: detector={}, type={}", e.detector(), e.alert().type());
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
