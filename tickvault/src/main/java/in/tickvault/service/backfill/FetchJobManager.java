package in.tickvault.service.backfill;

import in.tickvault.application.port.output.FetchJobRepository;
import in.tickvault.application.port.output.StorageException;
import in.tickvault.config.BackfillSettings;
import in.tickvault.domain.model.Candle;
import in.tickvault.domain.model.DeadLetterRecord;
import in.tickvault.domain.model.FetchJob;
import in.tickvault.domain.model.FetchJobKind;
import in.tickvault.domain.model.FetchJobStatus;
import in.tickvault.domain.model.Granularity;
import in.tickvault.domain.model.ProviderRecord;
import in.tickvault.domain.model.Quote;
import in.tickvault.domain.model.Trade;
import in.tickvault.domain.model.WriteOutcome;
import in.tickvault.infrastructure.metrics.IngestionMetrics;
import in.tickvault.infrastructure.provider.ProviderAdapter;
import in.tickvault.infrastructure.provider.ProviderAuthenticationException;
import in.tickvault.infrastructure.provider.ProviderException;
import in.tickvault.infrastructure.provider.RateLimitedException;
import in.tickvault.infrastructure.provider.common.RetryPolicy;
import in.tickvault.infrastructure.provider.common.Sleeper;
import in.tickvault.service.candle.CandleAggregator;
import in.tickvault.service.normalize.NormalizationResult;
import in.tickvault.service.normalize.Normalizer;
import in.tickvault.service.storage.StorageUnavailableException;
import in.tickvault.service.storage.StorageWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fetch Job Manager - drives historical fetches chunk by chunk.
 *
 * Lifecycle: PENDING -> RUNNING -> COMPLETED | FAILED, FAILED -> PENDING on retry.
 *
 * Each chunk is fetched (with bounded retries), normalized, written through the
 * storage writer and then checkpointed, so a resumed job never re-fetches a
 * chunk it already finished. Jobs run on a bounded pool; chunks of one job run
 * one after another.
 */
public final class FetchJobManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FetchJobManager.class);

    private final FetchJobRepository jobs;
    private final Map<String, ProviderAdapter> adapters;
    private final Normalizer normalizer;
    private final StorageWriter writer;
    private final IngestionMetrics metrics;
    private final BackfillSettings settings;
    private final RetryPolicy chunkRetry;
    private final Clock clock;
    private final ExecutorService pool;

    private volatile boolean stopping = false;

    public FetchJobManager(FetchJobRepository jobs,
                           Map<String, ProviderAdapter> adapters,
                           Normalizer normalizer,
                           StorageWriter writer,
                           IngestionMetrics metrics,
                           BackfillSettings settings,
                           Clock clock,
                           Sleeper sleeper) {
        this.jobs = jobs;
        this.adapters = Map.copyOf(adapters);
        this.normalizer = normalizer;
        this.writer = writer;
        this.metrics = metrics;
        this.settings = settings;
        this.clock = clock;
        this.chunkRetry = RetryPolicy.builder()
            .maxAttempts(settings.chunkMaxAttempts())
            .maxElapsed(settings.chunkMaxElapsed())
            .initialBackoff(settings.initialBackoff())
            .maxBackoff(settings.maxBackoff())
            .clock(clock)
            .sleeper(sleeper)
            .build();

        AtomicInteger threadCounter = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(settings.parallelism(), r -> {
            Thread t = new Thread(r, "backfill-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ═══════════════════════════════════════════════════════════════
    // Submission
    // ═══════════════════════════════════════════════════════════════

    /**
     * Register a job over [start, end). A job with the same (provider, symbol, kind, start)
     * is not created twice; the existing one is returned with {@code created == false}.
     */
    public FetchJobRepository.InsertResult submit(String provider, String symbol, FetchJobKind kind,
                                                  Granularity granularity, Instant start, Instant end) {
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Empty range [" + start + ", " + end + ") for " + provider + ":" + symbol);
        }
        Instant now = clock.instant();
        FetchJob job = new FetchJob(0L, provider, symbol, kind, granularity, start, end,
            FetchJobStatus.PENDING, null, 0, null, now, now);

        FetchJobRepository.InsertResult result = jobs.insertIfAbsent(job);
        if (result.created()) {
            log.info("[BACKFILL] Submitted job #{} {}:{} {} [{}, {}) @ {}",
                result.job().id(), provider, symbol, kind, start, end, granularity);
        } else {
            log.info("[BACKFILL] Duplicate submission for {}:{} {} from {}, existing job #{} is {}",
                provider, symbol, kind, start, result.job().id(), result.job().status());
        }
        return result;
    }

    // ═══════════════════════════════════════════════════════════════
    // Execution
    // ═══════════════════════════════════════════════════════════════

    /**
     * Run jobs on the pool and wait for all of them.
     */
    public BackfillReport runAll(List<FetchJob> toRun) {
        List<Future<BackfillReport.JobResult>> futures = new ArrayList<>();
        for (FetchJob job : toRun) {
            futures.add(pool.submit(() -> run(job)));
        }

        List<BackfillReport.JobResult> results = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            FetchJob job = toRun.get(i);
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                results.add(unfinished(job, "interrupted"));
            } catch (ExecutionException e) {
                log.error("[BACKFILL] Job #{} crashed: {}", job.id(), e.getCause().getMessage(), e.getCause());
                results.add(unfinished(job, String.valueOf(e.getCause().getMessage())));
            }
        }
        return new BackfillReport(results);
    }

    /**
     * Pick up jobs left PENDING or RUNNING by a previous process.
     */
    public BackfillReport resumeIncomplete() {
        return resumeIncomplete(null);
    }

    /**
     * @param provider only resume jobs of this provider; null for all
     */
    public BackfillReport resumeIncomplete(String provider) {
        return resumeIncomplete(provider, null);
    }

    /**
     * @param provider only resume jobs of this provider; null for all
     * @param symbols  only resume jobs for these symbols; null for all
     */
    public BackfillReport resumeIncomplete(String provider, Collection<String> symbols) {
        List<FetchJob> incomplete = jobs.findByStatus(EnumSet.of(FetchJobStatus.PENDING, FetchJobStatus.RUNNING))
            .stream()
            .filter(job -> provider == null || job.provider().equals(provider))
            .filter(job -> symbols == null || symbols.contains(job.symbol()))
            .toList();
        log.info("[BACKFILL] Resuming {} incomplete jobs", incomplete.size());
        return runAll(incomplete);
    }

    /**
     * Manually re-queue a FAILED job over the same range and run it.
     */
    public BackfillReport.JobResult retry(long jobId) {
        FetchJob job = jobs.findById(jobId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown fetch job " + jobId));
        if (job.status() != FetchJobStatus.FAILED) {
            throw new IllegalStateException("Fetch job " + jobId + " is " + job.status() + ", only FAILED jobs can be retried");
        }
        FetchJob pending = job.withStatus(FetchJobStatus.PENDING, null, clock.instant());
        jobs.update(pending);
        log.info("[BACKFILL] Job #{} re-queued from {}", jobId, pending.resumePoint());
        return run(pending);
    }

    /**
     * Drive one job until it completes, fails for good, or the manager is stopped.
     * Runs on the calling thread.
     */
    public BackfillReport.JobResult run(FetchJob initial) {
        Progress progress = new Progress();
        FetchJob job = initial;

        while (true) {
            if (job.status() == FetchJobStatus.COMPLETED) {
                return progress.result(job);
            }
            if (job.status() == FetchJobStatus.FAILED) {
                if (job.attempts() >= settings.maxJobAttempts()) {
                    return progress.result(job);
                }
                job = job.withStatus(FetchJobStatus.PENDING, job.errorMessage(), clock.instant());
                jobs.update(job);
            }
            if (job.status() == FetchJobStatus.PENDING) {
                job = job.withStatus(FetchJobStatus.RUNNING, null, clock.instant());
                jobs.update(job);
                log.info("[BACKFILL] Job #{} {}:{} running (attempt {}) from {}",
                    job.id(), job.provider(), job.symbol(), job.attempts(), job.resumePoint());
            }

            ProviderAdapter adapter = adapters.get(job.provider());
            if (adapter == null) {
                job = fail(job, "No adapter configured for provider " + job.provider());
                return progress.result(job);
            }

            try {
                job = runChunks(job, adapter, progress);
                return progress.result(job);

            } catch (CancellationException e) {
                log.warn("[BACKFILL] Job #{} interrupted at checkpoint {}", job.id(), job.resumePoint());
                return progress.result(jobs.findById(job.id()).orElse(job));

            } catch (ProviderAuthenticationException e) {
                job = fail(currentState(job), e.getMessage());
                return progress.result(job);

            } catch (ProviderException | StorageException | StorageUnavailableException e) {
                job = fail(currentState(job), e.getMessage());
                if (stopping || job.attempts() >= settings.maxJobAttempts()) {
                    return progress.result(job);
                }
                log.info("[BACKFILL] Job #{} will be retried ({}/{} attempts used)",
                    job.id(), job.attempts(), settings.maxJobAttempts());
            }
        }
    }

    private FetchJob runChunks(FetchJob job, ProviderAdapter adapter, Progress progress) {
        String label = job.provider() + ":" + job.symbol();

        while (!job.isRangeExhausted()) {
            if (stopping) {
                log.info("[BACKFILL] Job #{} stopped at checkpoint {}", job.id(), job.resumePoint());
                return job;
            }

            Instant chunkStart = job.resumePoint();
            Instant chunkEnd = min(chunkStart.plus(settings.chunkSize()), job.requestedEnd());
            String symbol = job.symbol();
            Granularity granularity = job.granularity();

            List<ProviderRecord> records;
            try {
                records = chunkRetry.execute(label, () -> adapter.fetchHistorical(symbol, chunkStart, chunkEnd, granularity),
                    this::isRetryable);
            } catch (RuntimeException e) {
                metrics.recordBackfillChunk(job.provider(), "failed");
                throw e;
            }

            writeChunk(job, records, progress);

            job = job.withCheckpoint(chunkEnd, clock.instant());
            jobs.update(job);
            progress.chunks++;
            metrics.recordBackfillChunk(job.provider(), "completed");
            log.debug("[BACKFILL] Job #{} checkpoint {} ({} records)", job.id(), chunkEnd, records.size());
        }

        FetchJob completed = job.withStatus(FetchJobStatus.COMPLETED, null, clock.instant());
        jobs.update(completed);
        log.info("[BACKFILL] Job #{} {} completed ({} chunks this run)", completed.id(), label, progress.chunks);
        return completed;
    }

    private void writeChunk(FetchJob job, List<ProviderRecord> records, Progress progress) {
        List<Trade> trades = new ArrayList<>();
        List<Quote> quotes = new ArrayList<>();
        List<Candle> candles = new ArrayList<>();
        List<DeadLetterRecord> rejected = new ArrayList<>();

        for (ProviderRecord record : records) {
            if (record.isKeepalive()) {
                continue;
            }
            NormalizationResult result = normalizer.normalize(record, job.provider(), job.symbol(), job.granularity());
            if (!result.isAccepted()) {
                metrics.recordNormalizationFailure(job.provider(), result.rejectReason().code());
                rejected.add(DeadLetterRecord.of(job.provider(), job.symbol(), record.rawPayload(),
                    result.rejectionText(), 0, clock.instant()));
            } else if (result.trade() != null) {
                trades.add(result.trade());
            } else if (result.quote() != null) {
                quotes.add(result.quote());
            } else {
                candles.add(result.candle());
            }
        }

        writer.deadLetter(rejected);
        progress.deadLettered += rejected.size();

        List<WriteOutcome> tradeOutcomes = writer.writeTrades(trades);
        progress.tally(tradeOutcomes);

        // only newly stored trades; a bucket split by the previous chunk continues from its stored candle
        if (!trades.isEmpty() && !settings.aggregation().isEmpty()) {
            CandleAggregator aggregator = new CandleAggregator(settings.aggregation(), settings.latenessWindow(),
                candles::add, writer::findCandle, metrics);
            for (int i = 0; i < trades.size() && i < tradeOutcomes.size(); i++) {
                if (tradeOutcomes.get(i) == WriteOutcome.INSERTED) {
                    aggregator.addTrade(trades.get(i));
                }
            }
            aggregator.flushAll();
        }

        progress.tally(writer.writeQuotes(quotes));
        progress.tally(writer.writeCandles(candles));
    }

    private boolean isRetryable(RuntimeException e) {
        if (e instanceof RateLimitedException rle) {
            metrics.recordRateLimited(rle.getProvider());
        }
        return !stopping && e instanceof ProviderException pe && pe.isTransient();
    }

    private FetchJob currentState(FetchJob fallback) {
        return jobs.findById(fallback.id()).orElse(fallback);
    }

    private FetchJob fail(FetchJob job, String error) {
        log.error("[BACKFILL] Job #{} {}:{} failed at {}: {}",
            job.id(), job.provider(), job.symbol(), job.resumePoint(), error);
        FetchJob failed = job.withStatus(FetchJobStatus.FAILED, error, clock.instant());
        jobs.update(failed);
        return failed;
    }

    private static BackfillReport.JobResult unfinished(FetchJob job, String error) {
        return new BackfillReport.JobResult(job.id(), job.provider(), job.symbol(), job.status(),
            0, 0, 0, 0, error);
    }

    private static Instant min(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }

    // ═══════════════════════════════════════════════════════════════
    // Shutdown
    // ═══════════════════════════════════════════════════════════════

    /**
     * Cooperative stop: in-flight chunks finish, no new chunk starts, jobs keep their checkpoint.
     */
    public void stop() {
        stopping = true;
        pool.shutdown();
        log.info("[BACKFILL] Stop requested");
    }

    public boolean isStopping() {
        return stopping;
    }

    /**
     * @return true if every job thread finished within the grace period
     */
    public boolean awaitTermination(Duration grace) throws InterruptedException {
        if (pool.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
            return true;
        }
        log.warn("[BACKFILL] Jobs still running after {}ms, interrupting", grace.toMillis());
        pool.shutdownNow();
        return false;
    }

    @Override
    public void close() {
        stop();
        pool.shutdownNow();
    }

    private static final class Progress {
        int chunks;
        long written;
        long duplicates;
        long deadLettered;

        void tally(List<WriteOutcome> outcomes) {
            for (WriteOutcome outcome : outcomes) {
                switch (outcome) {
                    case INSERTED -> written++;
                    case DUPLICATE_IGNORED -> duplicates++;
                    case FAILED -> deadLettered++;
                }
            }
        }

        BackfillReport.JobResult result(FetchJob job) {
            return new BackfillReport.JobResult(job.id(), job.provider(), job.symbol(), job.status(),
                chunks, written, duplicates, deadLettered, job.errorMessage());
        }
    }
}
