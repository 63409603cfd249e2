package in.tickvault.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.tickvault.application.port.output.FetchJobRepository;
import in.tickvault.application.port.output.InstrumentRepository;
import in.tickvault.application.port.output.ProviderRepository;
import in.tickvault.application.port.output.StreamOffsetRepository;
import in.tickvault.bootstrap.CommandLine.Command;
import in.tickvault.bootstrap.CommandLine.CommandName;
import in.tickvault.bootstrap.CommandLine.UsageException;
import in.tickvault.config.DatabaseSettings;
import in.tickvault.config.IngestionConfig;
import in.tickvault.config.ProviderSettings;
import in.tickvault.domain.model.FetchJobKind;
import in.tickvault.domain.model.FetchJobStatus;
import in.tickvault.domain.model.Instrument;
import in.tickvault.infrastructure.metrics.PrometheusIngestionMetrics;
import in.tickvault.infrastructure.metrics.PrometheusMetricsHandler;
import in.tickvault.infrastructure.persistence.PostgresCandleRepository;
import in.tickvault.infrastructure.persistence.PostgresDeadLetterRepository;
import in.tickvault.infrastructure.persistence.PostgresFetchJobRepository;
import in.tickvault.infrastructure.persistence.PostgresInstrumentRepository;
import in.tickvault.infrastructure.persistence.PostgresProviderRepository;
import in.tickvault.infrastructure.persistence.PostgresQuoteRepository;
import in.tickvault.infrastructure.persistence.PostgresRawEnvelopeRepository;
import in.tickvault.infrastructure.persistence.PostgresStreamOffsetRepository;
import in.tickvault.infrastructure.persistence.PostgresTradeRepository;
import in.tickvault.infrastructure.provider.ProviderAdapter;
import in.tickvault.infrastructure.provider.ProviderAdapterFactory;
import in.tickvault.infrastructure.provider.common.RateLimiterRegistry;
import in.tickvault.infrastructure.provider.common.Sleeper;
import in.tickvault.migration.PartitionPlanner;
import in.tickvault.migration.SchemaMigration;
import in.tickvault.service.backfill.BackfillReport;
import in.tickvault.service.backfill.FetchJobManager;
import in.tickvault.service.normalize.Normalizer;
import in.tickvault.service.realtime.RealtimePipeline;
import in.tickvault.service.realtime.StreamStatus;
import in.tickvault.service.storage.StorageWriter;
import in.tickvault.transport.http.HealthHandler;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * TickVault entry point. Wires repositories, adapters and services by hand and runs one CLI command.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    private final IngestionConfig config;
    private final Clock clock;
    private final DataSource dataSource;

    private final ProviderRepository providerRepo;
    private final InstrumentRepository instrumentRepo;
    private final FetchJobRepository fetchJobRepo;
    private final StreamOffsetRepository streamOffsetRepo;

    private final PrometheusIngestionMetrics metrics;
    private final StorageWriter storageWriter;
    private final Normalizer normalizer;
    private final ProviderAdapterFactory adapterFactory;

    App(IngestionConfig config, DataSource dataSource, Clock clock) {
        this.config = config;
        this.clock = clock;
        this.dataSource = dataSource;

        // ═══════════════════════════════════════════════════════════════
        // Repositories
        // ═══════════════════════════════════════════════════════════════
        this.providerRepo = new PostgresProviderRepository(dataSource);
        this.instrumentRepo = new PostgresInstrumentRepository(dataSource);
        this.fetchJobRepo = new PostgresFetchJobRepository(dataSource);
        this.streamOffsetRepo = new PostgresStreamOffsetRepository(dataSource);

        // ═══════════════════════════════════════════════════════════════
        // Services
        // ═══════════════════════════════════════════════════════════════
        this.metrics = new PrometheusIngestionMetrics();
        this.storageWriter = new StorageWriter(
            new PostgresTradeRepository(dataSource),
            new PostgresQuoteRepository(dataSource),
            new PostgresCandleRepository(dataSource),
            new PostgresRawEnvelopeRepository(dataSource),
            streamOffsetRepo,
            new PostgresDeadLetterRepository(dataSource),
            metrics,
            config.storage(),
            clock,
            Sleeper.SYSTEM);
        this.normalizer = new Normalizer(clock, config.maxFutureSkew());

        HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(config.connectTimeout())
            .build();
        this.adapterFactory = new ProviderAdapterFactory(new RateLimiterRegistry(clock, Sleeper.SYSTEM),
            httpClient, clock, config.connectTimeout(), config.simulatedTickInterval());
    }

    public static void main(String[] args) {
        ShutdownSignal signal = new ShutdownSignal();
        int code = run(args, signal);
        signal.finished.countDown();
        if (signal.signalled) {
            // JVM shutdown is already in progress; System.exit would block
            Runtime.getRuntime().halt(code);
        }
        System.exit(code);
    }

    static int run(String[] args, ShutdownSignal signal) {
        Command command;
        IngestionConfig config;
        try {
            command = CommandLine.parse(args);
            if (command.name() == CommandName.HELP) {
                System.out.println(CommandLine.usage());
                return CommandLine.EXIT_OK;
            }
            config = IngestionConfig.fromEnv();
        } catch (UsageException | IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println(CommandLine.usage());
            return CommandLine.EXIT_USAGE;
        }

        log.info("════════════════════════════════════════════════════════");
        log.info("TickVault {} starting", command.name().name().toLowerCase());
        log.info("════════════════════════════════════════════════════════");

        Clock clock = Clock.systemUTC();
        try (HikariDataSource dataSource = createDataSource(config.database())) {
            new SchemaMigration(dataSource, new PartitionPlanner(clock, config.partitionMonthsAhead())).migrate();
            if (command.name() == CommandName.MIGRATE) {
                System.out.println("Schema is up to date.");
                return CommandLine.EXIT_OK;
            }
            signal.install(config.shutdownGrace());
            return new App(config, dataSource, clock).execute(command, signal);

        } catch (UsageException e) {
            System.err.println("Error: " + e.getMessage());
            return CommandLine.EXIT_USAGE;
        } catch (RuntimeException e) {
            log.error("Fatal error: {}", e.getMessage(), e);
            return CommandLine.EXIT_FAILED;
        }
    }

    int execute(Command command, ShutdownSignal signal) {
        ProviderSettings providerSettings = config.catalog().provider(command.provider())
            .orElseThrow(() -> new UsageException("Unknown provider: " + command.provider()));
        if (!providerSettings.active()) {
            throw new UsageException("Provider " + providerSettings.name() + " is not active");
        }
        registerCatalog(providerSettings.name(), command.symbols());

        ProviderAdapter adapter = adapterFactory.create(providerSettings);
        RealtimePipeline pipeline = command.name() == CommandName.REALTIME
            ? new RealtimePipeline(Map.of(providerSettings.name(), adapter), normalizer, storageWriter,
                streamOffsetRepo, metrics, config.streams(), clock, Sleeper.SYSTEM)
            : null;
        Supplier<List<StreamStatus>> streams = pipeline != null ? pipeline::statuses : List::of;

        Undertow server = startHttpServer(new HealthHandler(dataSource, streams));
        try {
            return switch (command.name()) {
                case BACKFILL -> backfill(command, providerSettings.name(), adapter, signal);
                case REALTIME -> realtime(command, providerSettings.name(), pipeline, signal);
                default -> throw new UsageException("Unsupported command " + command.name());
            };
        } finally {
            if (server != null) {
                server.stop();
            }
            adapter.close();
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Commands
    // ═══════════════════════════════════════════════════════════════

    private int backfill(Command command, String provider, ProviderAdapter adapter, ShutdownSignal signal) {
        try (FetchJobManager manager = new FetchJobManager(fetchJobRepo, Map.of(provider, adapter), normalizer,
                storageWriter, metrics, config.backfill(), clock, Sleeper.SYSTEM)) {

            signal.onRequested(manager::stop);

            Instant end = command.interval().bucketStart(clock.instant());
            Instant start = command.interval().bucketStart(end.minus(command.period()));
            log.info("[BACKFILL] {} symbols from {} to {} @ {}", command.symbols().size(), start, end, command.interval());

            List<BackfillReport.JobResult> results = new ArrayList<>();
            List<Long> failedJobs = new ArrayList<>();
            for (String symbol : command.symbols()) {
                FetchJobRepository.InsertResult submitted = manager.submit(provider, symbol, FetchJobKind.BACKFILL,
                    command.interval(), start, end);
                if (!submitted.created() && submitted.job().status() == FetchJobStatus.COMPLETED) {
                    results.add(new BackfillReport.JobResult(submitted.job().id(), provider, symbol,
                        FetchJobStatus.COMPLETED, 0, 0, 0, 0, null));
                } else if (!submitted.created() && submitted.job().status() == FetchJobStatus.FAILED) {
                    failedJobs.add(submitted.job().id());
                }
            }

            results.addAll(manager.resumeIncomplete(provider, command.symbols()).jobs());
            for (Long jobId : failedJobs) {
                if (!manager.isStopping()) {
                    results.add(manager.retry(jobId));
                }
            }

            BackfillReport report = new BackfillReport(results);
            System.out.println(report.getSummary());
            log.info("[BACKFILL] Done: {} of {} jobs completed",
                report.countByStatus(FetchJobStatus.COMPLETED), report.jobs().size());
            return report.allCompleted() ? CommandLine.EXIT_OK : CommandLine.EXIT_FAILED;
        }
    }

    private int realtime(Command command, String provider, RealtimePipeline pipeline, ShutdownSignal signal) {
        pipeline.start(provider, command.symbols());
        System.out.println("Streaming " + command.symbols() + " from " + provider + ", press Ctrl+C to stop.");

        try {
            signal.requested.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        pipeline.stop();
        boolean clean;
        try {
            clean = pipeline.awaitTermination(config.shutdownGrace());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            clean = false;
        }

        for (StreamStatus status : pipeline.statuses()) {
            System.out.printf("%s:%s %s records=%d reconnects=%d degraded=%s%n", status.provider(), status.symbol(),
                status.state(), status.recordsProcessed(), status.reconnects(), status.degraded());
        }
        if (!clean) {
            log.error("[REALTIME] Forced shutdown after {}ms grace period", config.shutdownGrace().toMillis());
            return CommandLine.EXIT_FORCED_SHUTDOWN;
        }
        log.info("[REALTIME] Clean shutdown");
        return CommandLine.EXIT_OK;
    }

    // ═══════════════════════════════════════════════════════════════
    // Wiring helpers
    // ═══════════════════════════════════════════════════════════════

    /**
     * Seed providers and instruments from configuration; CLI symbols not yet known are registered too.
     */
    private void registerCatalog(String provider, List<String> symbols) {
        for (ProviderSettings settings : config.catalog().providers()) {
            providerRepo.upsert(settings.toProvider());
        }
        for (Instrument instrument : config.catalog().instruments()) {
            instrumentRepo.upsert(instrument);
        }
        for (String symbol : symbols) {
            if (instrumentRepo.findBySymbol(symbol).isEmpty()) {
                instrumentRepo.upsert(Instrument.discovered(symbol, provider));
                log.info("[CATALOG] Registered instrument {} for {}", symbol, provider);
            }
        }
    }

    private Undertow startHttpServer(HealthHandler health) {
        int port = config.httpPort();
        if (port <= 0) {
            log.info("[HTTP] Disabled (TICKVAULT_HTTP_PORT={})", port);
            return null;
        }

        RoutingHandler routes = Handlers.routing()
            .get("/health/live", health::live)
            .get("/health/ready", health::ready)
            .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(routes)
            .build();
        server.start();
        log.info("[HTTP] Health and metrics on http://localhost:{}/ (/health/live, /health/ready, /metrics)", port);
        return server;
    }

    private static HikariDataSource createDataSource(DatabaseSettings db) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(db.jdbcUrl());
        config.setUsername(db.username());
        config.setPassword(db.password());
        config.setMaximumPoolSize(db.maximumPoolSize());
        config.setMinimumIdle(Math.min(2, db.maximumPoolSize()));
        config.setConnectionTimeout(db.connectionTimeout().toMillis());
        config.setPoolName("tickvault-hikari");

        log.info("DB: url={}, user={}, pool={}", db.jdbcUrl(), db.username(), db.maximumPoolSize());
        return new HikariDataSource(config);
    }

    /**
     * Bridges SIGINT/SIGTERM to the command: the hook flags the request and waits for the command to wind down.
     */
    static final class ShutdownSignal {
        final CountDownLatch requested = new CountDownLatch(1);
        final CountDownLatch finished = new CountDownLatch(1);
        volatile boolean signalled = false;

        void install(Duration grace) {
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                log.info("Shutdown requested, stopping (grace {}ms)", grace.toMillis());
                signalled = true;
                requested.countDown();
                try {
                    finished.await(grace.toMillis() + 5_000L, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "shutdown-hook"));
        }

        void onRequested(Runnable action) {
            Thread watcher = new Thread(() -> {
                try {
                    requested.await();
                    action.run();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "shutdown-watcher");
            watcher.setDaemon(true);
            watcher.start();
        }
    }
}
