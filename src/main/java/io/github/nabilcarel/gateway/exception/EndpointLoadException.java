package io.github.nabilcarel.gateway.exception;

public class EndpointLoadException extends RuntimeException {

    public EndpointLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
