package com.groceryai.infrastructure.ai.transport;

import java.time.Duration;

/**
 * Parses the delta-seconds form of a Retry-After header.
 */
final class RetryAfter {

    private RetryAfter() {
    }

    /**
     * @return the delay, or null when the value is not a non-negative number of seconds
     */
    static Duration parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            double seconds = Double.parseDouble(value.trim());
            if (seconds < 0 || Double.isNaN(seconds)) {
                return null;
            }
            return Duration.ofMillis(Math.round(seconds * 1000));
        } catch (NumberFormatException e) {
            // HTTP-date form is not used by either provider
            return null;
        }
    }
}
