package in.tickvault.bootstrap;

import in.tickvault.bootstrap.CommandLine.Command;
import in.tickvault.bootstrap.CommandLine.CommandName;
import in.tickvault.bootstrap.CommandLine.UsageException;
import in.tickvault.domain.model.Granularity;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CommandLine.
 *
 * Tests:
 * - Each command with its options
 * - Defaults for period and interval
 * - Usage errors (unknown command/option, missing values, bad durations)
 */
class CommandLineTest {

    @Test
    void testBackfillWithAllOptions() {
        Command command = CommandLine.parse(new String[]{
            "backfill", "--symbols", "btcusdt, ethusdt", "--period", "10d", "--interval", "1h", "--provider", "Binance"});

        assertEquals(CommandName.BACKFILL, command.name());
        assertEquals("binance", command.provider(), "Provider is normalized to lower case");
        assertEquals(List.of("BTCUSDT", "ETHUSDT"), command.symbols());
        assertEquals(Duration.ofDays(10), command.period());
        assertEquals(Granularity.parse("1h"), command.interval());
    }

    @Test
    void testBackfillDefaults() {
        Command command = CommandLine.parse(new String[]{"backfill", "--symbols=AAPL", "--provider=polygon"});

        assertEquals(Duration.ofDays(1), command.period());
        assertEquals(Granularity.ONE_MINUTE, command.interval());
    }

    @Test
    void testRealtime() {
        Command command = CommandLine.parse(new String[]{"realtime", "--symbols", "AAPL,MSFT,AAPL", "--provider", "polygon"});

        assertEquals(CommandName.REALTIME, command.name());
        assertEquals(List.of("AAPL", "MSFT"), command.symbols(), "Duplicates are collapsed");
        assertNull(command.period());
        assertNull(command.interval());
    }

    @Test
    void testMigrateAndHelp() {
        assertEquals(CommandName.MIGRATE, CommandLine.parse(new String[]{"migrate"}).name());
        assertEquals(CommandName.HELP, CommandLine.parse(new String[]{"--help"}).name());
        assertTrue(CommandLine.usage().contains("backfill"));
    }

    @Test
    void testMissingCommand() {
        assertThrows(UsageException.class, () -> CommandLine.parse(new String[]{}));
        assertThrows(UsageException.class, () -> CommandLine.parse(null));
    }

    @Test
    void testUnknownCommand() {
        UsageException e = assertThrows(UsageException.class, () -> CommandLine.parse(new String[]{"replay"}));
        assertTrue(e.getMessage().contains("replay"));
    }

    @Test
    void testUnknownOption() {
        UsageException e = assertThrows(UsageException.class, () -> CommandLine.parse(
            new String[]{"realtime", "--symbols", "AAPL", "--provider", "polygon", "--period", "1d"}));
        assertTrue(e.getMessage().contains("--period"));
    }

    @Test
    void testMissingRequiredOptions() {
        assertThrows(UsageException.class,
            () -> CommandLine.parse(new String[]{"backfill", "--symbols", "AAPL"}), "provider is required");
        assertThrows(UsageException.class,
            () -> CommandLine.parse(new String[]{"realtime", "--provider", "polygon"}), "symbols are required");
        assertThrows(UsageException.class,
            () -> CommandLine.parse(new String[]{"realtime", "--provider", "polygon", "--symbols", " , "}));
    }

    @Test
    void testMissingOptionValue() {
        assertThrows(UsageException.class,
            () -> CommandLine.parse(new String[]{"realtime", "--provider", "polygon", "--symbols"}));
    }

    @Test
    void testDuplicateOption() {
        assertThrows(UsageException.class, () -> CommandLine.parse(
            new String[]{"realtime", "--provider", "a", "--provider", "b", "--symbols", "X"}));
    }

    @Test
    void testInvalidDurations() {
        assertThrows(UsageException.class, () -> CommandLine.parse(
            new String[]{"backfill", "--symbols", "X", "--provider", "p", "--period", "ten days"}));
        assertThrows(UsageException.class, () -> CommandLine.parse(
            new String[]{"backfill", "--symbols", "X", "--provider", "p", "--interval", "0m"}));
    }

    @Test
    void testMigrateRejectsOptions() {
        assertThrows(UsageException.class, () -> CommandLine.parse(new String[]{"migrate", "--force", "yes"}));
    }

    @Test
    void testPositionalArgumentRejected() {
        assertThrows(UsageException.class, () -> CommandLine.parse(new String[]{"realtime", "AAPL"}));
    }
}
