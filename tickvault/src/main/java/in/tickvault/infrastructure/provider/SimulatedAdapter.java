package in.tickvault.infrastructure.provider;

import in.tickvault.config.ProviderSettings;
import in.tickvault.domain.model.Granularity;
import in.tickvault.domain.model.ProviderRecord;
import in.tickvault.domain.model.StreamOffset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Random-walk feed for local runs and demos. No network, no credentials.
 *
 * Prices are seeded from the symbol so repeated backfills of the same range
 * produce the same bars.
 */
public class SimulatedAdapter implements ProviderAdapter {
    private static final Logger log = LoggerFactory.getLogger(SimulatedAdapter.class);

    private static final BigDecimal BASE_PRICE = new BigDecimal("100.00");

    private final ProviderSettings settings;
    private final Duration tickInterval;
    private final Clock clock;

    public SimulatedAdapter(ProviderSettings settings, Duration tickInterval, Clock clock) {
        this.settings = settings;
        this.tickInterval = tickInterval;
        this.clock = clock;
    }

    @Override
    public String providerName() {
        return settings.name();
    }

    @Override
    public List<ProviderRecord> fetchHistorical(String symbol, Instant start, Instant end, Granularity granularity) {
        Instant now = clock.instant();
        List<ProviderRecord> records = new ArrayList<>();
        Instant bucket = granularity.bucketStart(start);
        if (bucket.isBefore(start)) {
            bucket = granularity.bucketEnd(bucket);
        }

        while (bucket.isBefore(end)) {
            Random random = new Random(symbol.hashCode() * 31L + bucket.toEpochMilli());
            BigDecimal open = walk(BASE_PRICE, random);
            BigDecimal close = walk(open, random);
            BigDecimal high = open.max(close).add(BigDecimal.valueOf(random.nextInt(50), 2));
            BigDecimal low = open.min(close).subtract(BigDecimal.valueOf(random.nextInt(50), 2));
            BigDecimal volume = BigDecimal.valueOf(1 + random.nextInt(1000));

            records.add(ProviderRecord.candle(providerName(), symbol, open, high, low, close, volume,
                String.valueOf(bucket.toEpochMilli()), now, null));
            bucket = granularity.bucketEnd(bucket);
        }

        log.debug("[{}:{}] Generated {} simulated bars", providerName(), symbol, records.size());
        return records;
    }

    @Override
    public LiveStream streamLive(String symbol, StreamOffset resumeFrom) {
        Long resumeSequence = resumeFrom != null ? resumeFrom.sequenceOrNull() : null;
        long firstSequence = resumeSequence != null ? resumeSequence + 1 : 1L;
        log.info("[{}:{}] Simulated stream starting at sequence {}", providerName(), symbol, firstSequence);
        return new SimulatedLiveStream(symbol, firstSequence);
    }

    @Override
    public void close() {
        log.debug("[{}] Simulated adapter closed", providerName());
    }

    private static BigDecimal walk(BigDecimal from, Random random) {
        double change = (random.nextDouble() - 0.5) * 0.02;
        BigDecimal next = from.multiply(BigDecimal.valueOf(1.0 + change)).setScale(2, RoundingMode.HALF_UP);
        return next.signum() > 0 ? next : new BigDecimal("0.01");
    }

    /**
     * Emits a trade every tick interval and a quote every fifth tick.
     */
    private final class SimulatedLiveStream implements LiveStream {
        private final String symbol;
        private final Random random;
        private final CountDownLatch closed = new CountDownLatch(1);

        private long sequence;
        private BigDecimal lastPrice = BASE_PRICE;
        private Instant nextEmit;

        SimulatedLiveStream(String symbol, long firstSequence) {
            this.symbol = symbol;
            this.random = new Random(symbol.hashCode());
            this.sequence = firstSequence;
            this.nextEmit = clock.instant();
        }

        @Override
        public ProviderRecord poll(Duration timeout) throws InterruptedException {
            if (closed.getCount() == 0) {
                throw new TransientProviderException(providerName(), symbol, "Stream closed: closed by client");
            }

            Duration wait = Duration.between(clock.instant(), nextEmit);
            if (wait.compareTo(timeout) > 0) {
                if (closed.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    throw new TransientProviderException(providerName(), symbol, "Stream closed: closed by client");
                }
                return null;
            }
            if (!wait.isNegative() && closed.await(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new TransientProviderException(providerName(), symbol, "Stream closed: closed by client");
            }

            Instant now = clock.instant();
            nextEmit = now.plus(tickInterval);
            long seq = sequence++;
            lastPrice = walk(lastPrice, random);
            String eventTime = String.valueOf(now.toEpochMilli());

            if (seq % 5 == 0) {
                BigDecimal spread = new BigDecimal("0.02");
                return ProviderRecord.quote(providerName(), symbol,
                    lastPrice.subtract(spread), BigDecimal.valueOf(1 + random.nextInt(500)),
                    lastPrice.add(spread), BigDecimal.valueOf(1 + random.nextInt(500)),
                    lastPrice, null, eventTime, now, seq, null);
            }
            return ProviderRecord.trade(providerName(), symbol, "sim-" + seq, lastPrice,
                BigDecimal.valueOf(1 + random.nextInt(100)), random.nextBoolean() ? "BUY" : "SELL",
                eventTime, now, seq, null);
        }

        @Override
        public boolean isOpen() {
            return closed.getCount() > 0;
        }

        @Override
        public void close() {
            closed.countDown();
        }
    }
}
