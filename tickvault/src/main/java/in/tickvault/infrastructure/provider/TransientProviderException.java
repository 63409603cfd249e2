package in.tickvault.infrastructure.provider;

/**
 * Network failure, timeout or 5xx. Safe to retry with backoff.
 */
public class TransientProviderException extends ProviderException {

    public TransientProviderException(String provider, String symbol, String message) {
        super(provider, symbol, message);
    }

    public TransientProviderException(String provider, String symbol, String message, Throwable cause) {
        super(provider, symbol, message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
