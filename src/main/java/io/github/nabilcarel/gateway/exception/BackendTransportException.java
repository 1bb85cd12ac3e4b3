package io.github.nabilcarel.gateway.exception;

/**
 * The backend could not be reached or did not answer within the timeout.
 */
public class BackendTransportException extends RuntimeException {
    private final String url;
    private final boolean timedOut;

    public BackendTransportException(String message, String url, boolean timedOut, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.timedOut = timedOut;
    }

    public String getUrl() {
        return url;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
