package com.phillippitts.compressorwatch.service.alert;

import com.phillippitts.compressorwatch.domain.Alert;

import java.util.Optional;

/**
 * One threshold rule evaluated after every integrated detection.
 *
 * <p>Rules are stateless and independent: every rule is evaluated on every call and a condition
 * that keeps holding raises a new alert each time.
 */
public interface AlertRule {

    /**
     * @return rule identifier, used as {@link Alert#type()}
     */
    String type();

    /**
     * @param context recent monitoring windows and current engine metrics
     * @return an alert if the rule's precondition is met and it triggers
     */
    Optional<Alert> evaluate(AlertContext context);
}
