package in.tickvault.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Candle bucket width. Buckets are aligned on the unix epoch:
 * bucketStart = floor(eventTime / width) * width.
 */
public record Granularity(Duration width) {
    private static final Pattern LABEL_PATTERN = Pattern.compile("(\\d+)\\s*([smhdw])");

    public static final Granularity ONE_SECOND = new Granularity(Duration.ofSeconds(1));
    public static final Granularity ONE_MINUTE = new Granularity(Duration.ofMinutes(1));

    public Granularity {
        if (width == null || width.isNegative() || width.isZero()) {
            throw new IllegalArgumentException("Granularity width must be positive");
        }
        if (width.toMillis() <= 0 || width.toNanos() % 1_000_000 != 0) {
            throw new IllegalArgumentException("Granularity must be a whole number of milliseconds: " + width);
        }
    }

    /**
     * Parse "1s", "5m", "1h", "1d", "1w".
     */
    public static Granularity parse(String text) {
        return new Granularity(parseDuration(text));
    }

    /**
     * Parse a compact duration like "30s", "10d". Shared with CLI periods and config values.
     */
    public static Duration parseDuration(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Duration is required");
        }
        Matcher m = LABEL_PATTERN.matcher(text.trim().toLowerCase());
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid duration '" + text + "' (expected e.g. 1s, 5m, 1h, 10d)");
        }
        long amount = Long.parseLong(m.group(1));
        if (amount <= 0) {
            throw new IllegalArgumentException("Duration must be positive: " + text);
        }
        return switch (m.group(2)) {
            case "s" -> Duration.ofSeconds(amount);
            case "m" -> Duration.ofMinutes(amount);
            case "h" -> Duration.ofHours(amount);
            case "d" -> Duration.ofDays(amount);
            case "w" -> Duration.ofDays(amount * 7);
            default -> throw new IllegalArgumentException("Unsupported unit in " + text);
        };
    }

    public Instant bucketStart(Instant eventTime) {
        long widthMillis = width.toMillis();
        long millis = eventTime.toEpochMilli();
        return Instant.ofEpochMilli(Math.floorDiv(millis, widthMillis) * widthMillis);
    }

    public Instant bucketEnd(Instant bucketStart) {
        return bucketStart.plus(width);
    }

    /**
     * Compact label used in storage and metrics ("1m", "1h", ...).
     */
    public String label() {
        long seconds = width.getSeconds();
        if (width.getNano() != 0) {
            return width.toMillis() + "ms";
        }
        if (seconds % 604_800 == 0) return (seconds / 604_800) + "w";
        if (seconds % 86_400 == 0) return (seconds / 86_400) + "d";
        if (seconds % 3_600 == 0) return (seconds / 3_600) + "h";
        if (seconds % 60 == 0) return (seconds / 60) + "m";
        return seconds + "s";
    }

    @Override
    public String toString() {
        return label();
    }
}
