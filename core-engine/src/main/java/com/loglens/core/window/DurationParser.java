package com.loglens.core.window;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parses window lengths written as shorthand ("30s", "5m", "1h", "2d", "500ms") or ISO-8601 ("PT5M"). */
public final class DurationParser {

    private static final Pattern SHORTHAND = Pattern.compile("^(\\d+)(ms|s|m|h|d)$");

    private DurationParser() {}

    /**
     * @param input duration text
     * @return the parsed, strictly positive duration
     * @throws IllegalArgumentException if the text is blank, malformed, zero or negative
     */
    public static Duration parse(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Window duration cannot be null or empty");
        }

        String trimmed = input.trim();
        Duration duration;
        if (trimmed.startsWith("P") || trimmed.startsWith("p")) {
            try {
                duration = Duration.parse(trimmed);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Invalid ISO-8601 window duration: " + input, e);
            }
        } else {
            duration = parseShorthand(trimmed.toLowerCase(Locale.ROOT), input);
        }

        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("Window duration must be positive, got: " + input);
        }
        return duration;
    }

    private static Duration parseShorthand(String lower, String original) {
        Matcher matcher = SHORTHAND.matcher(lower);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid window format: '" + original
                    + "'. Expected <number><unit> with unit ms, s, m, h or d (e.g. '5m', '1h', '30s')");
        }
        long value;
        try {
            value = Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Window duration out of range: " + original, e);
        }
        return switch (matcher.group(2)) {
            case "ms" -> Duration.ofMillis(value);
            case "s" -> Duration.ofSeconds(value);
            case "m" -> Duration.ofMinutes(value);
            case "h" -> Duration.ofHours(value);
            default -> Duration.ofDays(value);
        };
    }
}
