package io.github.nabilcarel.gateway.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

@Getter
@ConfigurationProperties(prefix = "gateway.backend")
public class BackendClientProperties {

    private final Duration connectTimeout;
    private final Duration responseTimeout;
    private final DataSize maxInMemorySize;

    public BackendClientProperties(@DefaultValue("PT5S") Duration connectTimeout,
                                   @DefaultValue("PT30S") Duration responseTimeout,
                                   @DefaultValue("16MB") DataSize maxInMemorySize) {
        this.connectTimeout = connectTimeout;
        this.responseTimeout = responseTimeout;
        this.maxInMemorySize = maxInMemorySize;
    }
}
