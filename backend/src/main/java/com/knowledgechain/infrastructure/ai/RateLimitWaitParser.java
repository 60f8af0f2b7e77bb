package com.knowledgechain.infrastructure.ai;

import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the wait hint out of a provider rate-limit message, e.g. "Please try again in 1m22.08s".
 */
public final class RateLimitWaitParser {

    // "try again in 1m22.08s", "try again in 22.5s", "try again in 3m"
    private static final Pattern MINUTES_SECONDS = Pattern.compile(
            "try again in\\s+(?:(\\d+)m(?!s))?\\s*(?:(\\d+(?:\\.\\d+)?)s)?",
            Pattern.CASE_INSENSITIVE
    );

    // "try again in 450ms"
    private static final Pattern MILLIS = Pattern.compile(
            "try again in\\s+(\\d+(?:\\.\\d+)?)ms",
            Pattern.CASE_INSENSITIVE
    );

    private RateLimitWaitParser() {
    }

    /**
     * @return the wait in seconds, or empty when the message carries no usable hint
     */
    public static OptionalDouble parseSeconds(String message) {
        if (message == null || message.isBlank()) {
            return OptionalDouble.empty();
        }

        Matcher millis = MILLIS.matcher(message);
        if (millis.find()) {
            return OptionalDouble.of(Double.parseDouble(millis.group(1)) / 1000.0);
        }

        Matcher m = MINUTES_SECONDS.matcher(message);
        while (m.find()) {
            String minutes = m.group(1);
            String seconds = m.group(2);
            if (minutes == null && seconds == null) {
                continue;
            }
            double total = 0;
            if (minutes != null) {
                total += Integer.parseInt(minutes) * 60.0;
            }
            if (seconds != null) {
                total += Double.parseDouble(seconds);
            }
            return OptionalDouble.of(total);
        }
        return OptionalDouble.empty();
    }
}
