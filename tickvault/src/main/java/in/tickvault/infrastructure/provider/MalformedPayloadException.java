package in.tickvault.infrastructure.provider;

/**
 * Message that could not be decoded at all. Carries the raw text so it can be dead-lettered.
 */
public class MalformedPayloadException extends ProviderException {

    private final String rawPayload;

    public MalformedPayloadException(String provider, String symbol, String rawPayload, Throwable cause) {
        super(provider, symbol, "Undecodable payload: " + cause.getMessage(), cause);
        this.rawPayload = rawPayload;
    }

    public String getRawPayload() {
        return rawPayload;
    }
}
