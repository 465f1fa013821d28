/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package org.margo.agent.util;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;

public final class Utils {
    private static final long MILLIS_PER_SECOND = 1000L;
    private static final long SECONDS_PER_MINUTE = 60L;
    private static final long MINUTES_PER_HOUR = 60L;
    private static final long HOURS_PER_DAY = 24L;

    private Utils() {
    }

    public static boolean isEmpty(CharSequence s) {
        return s == null || s.length() == 0;
    }

    public static boolean isEmpty(Collection<?> c) {
        return c == null || c.isEmpty();
    }

    public static boolean isEmpty(Map<?, ?> m) {
        return m == null || m.isEmpty();
    }

    /**
     * Parse a human friendly duration such as {@code 30s}, {@code 500ms}, {@code 5m} or {@code 1h}. A bare number is
     * read as seconds. ISO-8601 strings ({@code PT30S}) are accepted as well.
     *
     * @param value duration string
     * @return parsed duration
     * @throws IllegalArgumentException if the value cannot be parsed
     */
    @SuppressWarnings("PMD.AvoidLiteralsInIfCondition")
    public static Duration parseDuration(String value) {
        if (isEmpty(value) || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Duration must not be empty");
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        if (v.charAt(0) == 'p') {
            try {
                return Duration.parse(value.trim().toUpperCase(Locale.ROOT));
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid ISO-8601 duration: " + value, e);
            }
        }
        int unitStart = 0;
        while (unitStart < v.length() && Character.isDigit(v.charAt(unitStart))) {
            unitStart++;
        }
        if (unitStart == 0) {
            throw new IllegalArgumentException("Duration must start with a number: " + value);
        }
        long n = Long.parseLong(v.substring(0, unitStart));
        String unit = v.substring(unitStart).trim();
        long millisPerUnit;
        switch (unit) {
            case "ms":
            case "millis":
            case "milliseconds":
                millisPerUnit = 1;
                break;
            case "":
            case "s":
            case "sec":
            case "second":
            case "seconds":
                millisPerUnit = MILLIS_PER_SECOND;
                break;
            case "m":
            case "min":
            case "minute":
            case "minutes":
                millisPerUnit = MILLIS_PER_SECOND * SECONDS_PER_MINUTE;
                break;
            case "h":
            case "hour":
            case "hours":
                millisPerUnit = MILLIS_PER_SECOND * SECONDS_PER_MINUTE * MINUTES_PER_HOUR;
                break;
            case "d":
            case "day":
            case "days":
                millisPerUnit = MILLIS_PER_SECOND * SECONDS_PER_MINUTE * MINUTES_PER_HOUR * HOURS_PER_DAY;
                break;
            default:
                throw new IllegalArgumentException("Unknown duration unit '" + unit + "' in " + value);
        }
        try {
            return Duration.ofMillis(Math.multiplyExact(n, millisPerUnit));
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Duration is too long: " + value, e);
        }
    }
}
