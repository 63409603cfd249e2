package in.tickvault.infrastructure.provider;

/**
 * Credentials rejected (401/403 or an auth failure message on the stream).
 */
public class ProviderAuthenticationException extends ProviderException {

    public ProviderAuthenticationException(String provider, String symbol, String message) {
        super(provider, symbol, message);
    }

    public ProviderAuthenticationException(String provider, String symbol, String message, Throwable cause) {
        super(provider, symbol, message, cause);
    }
}
