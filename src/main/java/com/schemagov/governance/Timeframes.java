package com.schemagov.governance;

import java.time.Duration;
import java.util.Locale;

public final class Timeframes {
    private Timeframes() {
    }

    /**
     * Parses {@code 7d}, {@code 24h}, {@code 30m} or {@code 90s}. A bare number is read as days.
     */
    public static Duration parse(String timeframe) {
        if (timeframe == null || timeframe.isBlank()) {
            throw new IllegalArgumentException("timeframe must not be blank");
        }
        String value = timeframe.trim().toLowerCase(Locale.ROOT);
        char unit = value.charAt(value.length() - 1);
        String amount = Character.isDigit(unit) ? value : value.substring(0, value.length() - 1);
        long quantity;
        try {
            quantity = Long.parseLong(amount);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid timeframe: " + timeframe, e);
        }
        if (quantity < 0) {
            throw new IllegalArgumentException("Invalid timeframe: " + timeframe);
        }
        return switch (unit) {
            case 'h' -> Duration.ofHours(quantity);
            case 'm' -> Duration.ofMinutes(quantity);
            case 's' -> Duration.ofSeconds(quantity);
            case 'd' -> Duration.ofDays(quantity);
            default -> {
                if (!Character.isDigit(unit)) {
                    throw new IllegalArgumentException("Invalid timeframe unit: " + timeframe);
                }
                yield Duration.ofDays(quantity);
            }
        };
    }
}
