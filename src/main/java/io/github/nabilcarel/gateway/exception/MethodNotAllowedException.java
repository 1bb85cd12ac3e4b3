package io.github.nabilcarel.gateway.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.Set;

@ResponseStatus(HttpStatus.METHOD_NOT_ALLOWED)
public class MethodNotAllowedException extends RuntimeException {
    private final String method;
    private final Set<String> allowedMethods;

    public MethodNotAllowedException(String endpointName, String method, Set<String> allowedMethods) {
        super("Method " + method + " is not allowed for endpoint '" + endpointName + "'");
        this.method = method;
        this.allowedMethods = allowedMethods;
    }

    public String getMethod() {
        return method;
    }

    public Set<String> getAllowedMethods() {
        return allowedMethods;
    }
}
