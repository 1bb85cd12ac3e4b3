package io.github.nabilcarel.gateway.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.FORBIDDEN)
public class EnvironmentNotAllowedException extends RuntimeException {
    private final String environment;

    public EnvironmentNotAllowedException(String environment, String message) {
        super(message);
        this.environment = environment;
    }

    public String getEnvironment() {
        return environment;
    }
}
