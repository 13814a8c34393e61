package com.streamfirst.migration.ports;

import com.streamfirst.migration.domain.Alert;

/**
 * Port for operator notifications (pager, SNS topic, chat webhook).
 */
public interface AlertPort {

    /**
     * Raises an alert. Implementations must not throw for delivery problems they can log.
     *
     * @param alert the alert to deliver
     */
    void raise(Alert alert);
}
