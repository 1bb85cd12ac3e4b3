package io.github.nabilcarel.gateway.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class EndpointNotFoundException extends RuntimeException {
    private final String endpointName;

    public EndpointNotFoundException(String endpointName) {
        super("Endpoint '" + endpointName + "' not found");
        this.endpointName = endpointName;
    }

    public String getEndpointName() {
        return endpointName;
    }
}
