package io.github.nabilcarel.gateway.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.FORBIDDEN)
public class TargetUrlNotAllowedException extends RuntimeException {
    private final String url;

    public TargetUrlNotAllowedException(String url, String reason) {
        super("Target URL '" + url + "' is not allowed: " + reason);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
