package in.tickvault.infrastructure.provider;

/**
 * Failure talking to a market data provider. Not retried unless a subclass says so.
 */
public class ProviderException extends RuntimeException {

    private final String provider;
    private final String symbol;

    public ProviderException(String provider, String symbol, String message) {
        super(String.format("[%s:%s] %s", provider, symbol, message));
        this.provider = provider;
        this.symbol = symbol;
    }

    public ProviderException(String provider, String symbol, String message, Throwable cause) {
        super(String.format("[%s:%s] %s", provider, symbol, message), cause);
        this.provider = provider;
        this.symbol = symbol;
    }

    public String getProvider() {
        return provider;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isTransient() {
        return false;
    }
}
