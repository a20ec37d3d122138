package io.github.drompincen.lumenta.runtime.provider;

/**
 * An outbound provider (Resend, Vonage, Vapi, a webhook target) rejected a request or could not be
 * reached. Never retried automatically.
 */
public class ProviderException extends RuntimeException {

    private final String provider;

    public ProviderException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public ProviderException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public String provider() {
        return provider;
    }
}
