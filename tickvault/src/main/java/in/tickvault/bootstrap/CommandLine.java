package in.tickvault.bootstrap;

import in.tickvault.domain.model.Granularity;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Argument parsing for {@code tickvault <command> [options]}.
 */
public final class CommandLine {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_FORCED_SHUTDOWN = 3;

    public enum CommandName {
        MIGRATE,
        BACKFILL,
        REALTIME,
        HELP
    }

    /**
     * Parsed invocation. period and interval are only set for backfill.
     */
    public record Command(
        CommandName name,
        String provider,
        List<String> symbols,
        Duration period,
        Granularity interval
    ) {}

    public static class UsageException extends RuntimeException {
        public UsageException(String message) {
            super(message);
        }
    }

    public static Command parse(String[] args) {
        if (args == null || args.length == 0) {
            throw new UsageException("Missing command");
        }

        CommandName name = switch (args[0].toLowerCase()) {
            case "migrate" -> CommandName.MIGRATE;
            case "backfill" -> CommandName.BACKFILL;
            case "realtime" -> CommandName.REALTIME;
            case "help", "--help", "-h" -> CommandName.HELP;
            default -> throw new UsageException("Unknown command: " + args[0]);
        };

        Map<String, String> options = parseOptions(args);

        return switch (name) {
            case MIGRATE, HELP -> {
                if (!options.isEmpty()) {
                    throw new UsageException(args[0] + " takes no options");
                }
                yield new Command(name, null, List.of(), null, null);
            }
            case REALTIME -> {
                requireOnly(options, "symbols", "provider");
                yield new Command(name, provider(options), symbols(options), null, null);
            }
            case BACKFILL -> {
                requireOnly(options, "symbols", "provider", "period", "interval");
                yield new Command(name, provider(options), symbols(options),
                    duration(options, "period", "1d"), interval(options));
            }
        };
    }

    public static String usage() {
        return """
            Usage: tickvault <command> [options]

            Commands:
              migrate                                   Apply the schema (idempotent)
              backfill --symbols A,B --period 10d --interval 1m --provider binance
                                                        Fetch history through resumable jobs
              realtime --symbols A,B --provider polygon Stream live data until SIGINT/SIGTERM
              help                                      Show this message

            Exit codes: 0 success, 1 a job failed, 2 usage error, 3 forced shutdown
            """;
    }

    private static Map<String, String> parseOptions(String[] args) {
        Map<String, String> options = new HashMap<>();
        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                throw new UsageException("Unexpected argument: " + arg);
            }
            String key;
            String value;
            int eq = arg.indexOf('=');
            if (eq > 0) {
                key = arg.substring(2, eq);
                value = arg.substring(eq + 1);
            } else {
                key = arg.substring(2);
                if (i + 1 >= args.length) {
                    throw new UsageException("Missing value for --" + key);
                }
                value = args[++i];
            }
            if (options.put(key, value) != null) {
                throw new UsageException("Duplicate option --" + key);
            }
        }
        return options;
    }

    private static void requireOnly(Map<String, String> options, String... allowed) {
        List<String> known = List.of(allowed);
        for (String key : options.keySet()) {
            if (!known.contains(key)) {
                throw new UsageException("Unknown option --" + key);
            }
        }
    }

    private static String provider(Map<String, String> options) {
        String provider = options.get("provider");
        if (provider == null || provider.isBlank()) {
            throw new UsageException("--provider is required");
        }
        return provider.trim().toLowerCase();
    }

    private static List<String> symbols(Map<String, String> options) {
        String raw = options.get("symbols");
        if (raw == null) {
            throw new UsageException("--symbols is required");
        }
        List<String> symbols = new ArrayList<>();
        for (String part : raw.split(",")) {
            String symbol = part.trim().toUpperCase();
            if (!symbol.isEmpty() && !symbols.contains(symbol)) {
                symbols.add(symbol);
            }
        }
        if (symbols.isEmpty()) {
            throw new UsageException("--symbols must name at least one symbol");
        }
        return symbols;
    }

    private static Duration duration(Map<String, String> options, String key, String defaultValue) {
        String raw = options.getOrDefault(key, defaultValue);
        try {
            Duration value = Granularity.parseDuration(raw);
            if (value.isZero() || value.isNegative()) {
                throw new UsageException("--" + key + " must be positive");
            }
            return value;
        } catch (IllegalArgumentException e) {
            throw new UsageException("Invalid --" + key + ": " + raw);
        }
    }

    private static Granularity interval(Map<String, String> options) {
        String raw = options.getOrDefault("interval", "1m");
        try {
            return Granularity.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new UsageException("Invalid --interval: " + raw);
        }
    }

    private CommandLine() {}
}
