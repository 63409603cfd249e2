package in.tickvault.service.normalize;

import in.tickvault.domain.model.Candle;
import in.tickvault.domain.model.Granularity;
import in.tickvault.domain.model.ProviderRecord;
import in.tickvault.domain.model.Quote;
import in.tickvault.domain.model.Trade;
import in.tickvault.domain.model.TradeSide;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.UUID;

/**
 * Converts decoded provider records into canonical trades, quotes and candles.
 *
 * Never throws for bad input: every problem becomes a {@link RejectReason}.
 * Timestamps are accepted as epoch seconds (with or without fraction), epoch
 * millis, micros or nanos (told apart by magnitude), or ISO-8601 text.
 */
public final class Normalizer {

    private static final long MILLIS_THRESHOLD = 100_000_000_000L;            // < this: seconds
    private static final long MICROS_THRESHOLD = 100_000_000_000_000L;        // < this: millis
    private static final long NANOS_THRESHOLD = 100_000_000_000_000_000L;     // < this: micros

    private final Clock clock;
    private final Duration maxFutureSkew;

    public Normalizer(Clock clock, Duration maxFutureSkew) {
        this.clock = clock;
        this.maxFutureSkew = maxFutureSkew;
    }

    public NormalizationResult normalize(ProviderRecord record, String provider, String symbol) {
        return normalize(record, provider, symbol, null);
    }

    /**
     * @param granularity bar width, only needed for CANDLE records
     */
    public NormalizationResult normalize(ProviderRecord record, String provider, String symbol, Granularity granularity) {
        if (record == null || record.type() == null) {
            return NormalizationResult.rejected(RejectReason.MISSING_FIELD, "record type");
        }
        String effectiveProvider = provider != null ? provider : record.provider();
        String effectiveSymbol = symbol != null ? symbol : record.symbol();
        if (effectiveProvider == null || effectiveProvider.isBlank()) {
            return NormalizationResult.rejected(RejectReason.MISSING_FIELD, "provider");
        }
        if (effectiveSymbol == null || effectiveSymbol.isBlank()) {
            return NormalizationResult.rejected(RejectReason.MISSING_FIELD, "symbol");
        }

        return switch (record.type()) {
            case TRADE -> normalizeTrade(record, effectiveProvider, effectiveSymbol);
            case QUOTE -> normalizeQuote(record, effectiveProvider, effectiveSymbol);
            case CANDLE -> normalizeCandle(record, effectiveProvider, effectiveSymbol, granularity);
            case KEEPALIVE -> NormalizationResult.rejected(RejectReason.MISSING_FIELD, "keepalive carries no data");
        };
    }

    private NormalizationResult normalizeTrade(ProviderRecord r, String provider, String symbol) {
        NormalizationResult problem = firstProblem(
            required(r.price(), "price"),
            required(r.size(), "size"),
            nonNegative(r.price(), "price"),
            nonNegative(r.size(), "size"));
        if (problem != null) {
            return problem;
        }

        TimeCheck time = parseEventTime(r.eventTime());
        if (time.rejection() != null) {
            return time.rejection();
        }

        Instant receivedAt = r.receivedAt() != null ? r.receivedAt() : clock.instant();
        String tradeId = r.tradeId() == null || r.tradeId().isBlank() ? null : r.tradeId().trim();
        return NormalizationResult.ofTrade(new Trade(
            provider, symbol, tradeId, r.price(), r.size(), TradeSide.parse(r.side()),
            time.instant(), receivedAt, correlationId(provider, symbol, r), r.sequence()));
    }

    private NormalizationResult normalizeQuote(ProviderRecord r, String provider, String symbol) {
        if (r.bidPrice() == null && r.askPrice() == null && r.price() == null) {
            return NormalizationResult.rejected(RejectReason.MISSING_FIELD, "bid, ask and last price all absent");
        }
        NormalizationResult problem = firstProblem(
            nonNegative(r.bidPrice(), "bidPrice"),
            nonNegative(r.bidSize(), "bidSize"),
            nonNegative(r.askPrice(), "askPrice"),
            nonNegative(r.askSize(), "askSize"),
            nonNegative(r.price(), "lastPrice"),
            nonNegative(r.size(), "lastSize"));
        if (problem != null) {
            return problem;
        }

        TimeCheck time = parseEventTime(r.eventTime());
        if (time.rejection() != null) {
            return time.rejection();
        }

        Instant receivedAt = r.receivedAt() != null ? r.receivedAt() : clock.instant();
        return NormalizationResult.ofQuote(new Quote(
            provider, symbol, r.bidPrice(), r.bidSize(), r.askPrice(), r.askSize(), r.price(), r.size(),
            time.instant(), receivedAt, correlationId(provider, symbol, r)));
    }

    private NormalizationResult normalizeCandle(ProviderRecord r, String provider, String symbol, Granularity granularity) {
        if (granularity == null) {
            return NormalizationResult.rejected(RejectReason.MISSING_FIELD, "granularity");
        }
        NormalizationResult problem = firstProblem(
            required(r.open(), "open"),
            required(r.high(), "high"),
            required(r.low(), "low"),
            required(r.close(), "close"),
            required(r.volume(), "volume"),
            nonNegative(r.open(), "open"),
            nonNegative(r.high(), "high"),
            nonNegative(r.low(), "low"),
            nonNegative(r.close(), "close"),
            nonNegative(r.volume(), "volume"));
        if (problem != null) {
            return problem;
        }
        if (r.high().compareTo(r.open().max(r.close())) < 0) {
            return NormalizationResult.rejected(RejectReason.OUT_OF_RANGE,
                "high " + r.high() + " below max(open, close)");
        }
        if (r.low().compareTo(r.open().min(r.close())) > 0) {
            return NormalizationResult.rejected(RejectReason.OUT_OF_RANGE,
                "low " + r.low() + " above min(open, close)");
        }

        TimeCheck time = parseEventTime(r.eventTime());
        if (time.rejection() != null) {
            return time.rejection();
        }

        Instant bucketStart = granularity.bucketStart(time.instant());
        return NormalizationResult.ofCandle(new Candle(
            provider, symbol, granularity, bucketStart,
            r.open(), r.high(), r.low(), r.close(), r.volume(),
            time.instant(), correlationId(provider, symbol, r)));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // TIMESTAMPS
    // ═══════════════════════════════════════════════════════════════════════

    private record TimeCheck(Instant instant, NormalizationResult rejection) {}

    private TimeCheck parseEventTime(String raw) {
        if (raw == null || raw.isBlank()) {
            return new TimeCheck(null, NormalizationResult.rejected(RejectReason.MISSING_FIELD, "eventTime"));
        }
        Instant parsed;
        try {
            parsed = parseInstant(raw.trim());
        } catch (DateTimeException | ArithmeticException | NumberFormatException e) {
            return new TimeCheck(null, NormalizationResult.rejected(RejectReason.MALFORMED_TIMESTAMP,
                "unparsable eventTime '" + raw + "'"));
        }

        Instant limit = clock.instant().plus(maxFutureSkew);
        if (parsed.isAfter(limit)) {
            return new TimeCheck(null, NormalizationResult.rejected(RejectReason.MALFORMED_TIMESTAMP,
                "eventTime " + parsed + " is more than " + maxFutureSkew.toMillis() + "ms in the future"));
        }
        return new TimeCheck(parsed, null);
    }

    static Instant parseInstant(String text) {
        if (isNumeric(text)) {
            if (text.contains(".")) {
                BigDecimal seconds = new BigDecimal(text);
                long wholeSeconds = seconds.toBigInteger().longValueExact();
                long nanos = seconds.subtract(BigDecimal.valueOf(wholeSeconds))
                    .movePointRight(9).longValue();
                return Instant.ofEpochSecond(wholeSeconds, nanos);
            }
            long value = Long.parseLong(text);
            long magnitude = Math.abs(value);
            if (magnitude < MILLIS_THRESHOLD) {
                return Instant.ofEpochSecond(value);
            }
            if (magnitude < MICROS_THRESHOLD) {
                return Instant.ofEpochMilli(value);
            }
            if (magnitude < NANOS_THRESHOLD) {
                return Instant.ofEpochSecond(Math.floorDiv(value, 1_000_000L), Math.floorMod(value, 1_000_000L) * 1_000L);
            }
            return Instant.ofEpochSecond(Math.floorDiv(value, 1_000_000_000L), Math.floorMod(value, 1_000_000_000L));
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            return OffsetDateTime.parse(text).toInstant();
        }
    }

    private static boolean isNumeric(String text) {
        int dots = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '.') {
                dots++;
            } else if (!(Character.isDigit(c) || (i == 0 && c == '-'))) {
                return false;
            }
        }
        return dots <= 1 && !text.equals("-") && !text.equals(".");
    }

    // ═══════════════════════════════════════════════════════════════════════
    // FIELD CHECKS
    // ═══════════════════════════════════════════════════════════════════════

    private static NormalizationResult required(Object value, String field) {
        return value == null ? NormalizationResult.rejected(RejectReason.MISSING_FIELD, field) : null;
    }

    private static NormalizationResult nonNegative(BigDecimal value, String field) {
        if (value != null && value.signum() < 0) {
            return NormalizationResult.rejected(RejectReason.OUT_OF_RANGE, field + " " + value + " < 0");
        }
        return null;
    }

    private static NormalizationResult firstProblem(NormalizationResult... checks) {
        for (NormalizationResult check : checks) {
            if (check != null) {
                return check;
            }
        }
        return null;
    }

    /**
     * Stable per record so replays carry the same id.
     */
    private static String correlationId(String provider, String symbol, ProviderRecord r) {
        String key = r.rawPayload() != null
            ? provider + "|" + symbol + "|" + r.rawPayload()
            : provider + "|" + symbol + "|" + r.type() + "|" + r.tradeId() + "|" + r.sequence() + "|" + r.eventTime()
                + "|" + r.price() + "|" + r.size();
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
