package io.github.nabilcarel.gateway.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidRequestPathException extends RuntimeException {
    private final String path;

    public InvalidRequestPathException(String path) {
        super("Request path '" + path + "' must not contain '.' or '..' segments");
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
