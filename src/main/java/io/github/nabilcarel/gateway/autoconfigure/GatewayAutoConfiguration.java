package io.github.nabilcarel.gateway.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.nabilcarel.gateway.config.BackendClientProperties;
import io.github.nabilcarel.gateway.config.GatewayProperties;
import io.github.nabilcarel.gateway.config.filter.RequestIdFilter;
import io.github.nabilcarel.gateway.config.filter.SecurityHeadersFilter;
import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.boot.web.servlet.context.ServletWebServerInitializedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.core.Ordered;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
@RequiredArgsConstructor
@EnableConfigurationProperties({BackendClientProperties.class, GatewayProperties.class})
@Import(CacheBackendConfiguration.class)
@Slf4j
public class GatewayAutoConfiguration implements ApplicationListener<ServletWebServerInitializedEvent> {
    private final GatewayProperties properties;

    @Bean("gatewayObjectMapper")
    @ConditionalOnMissingBean(name = "gatewayObjectMapper")
    public ObjectMapper gatewayObjectMapper(Jackson2ObjectMapperBuilder builder) {
        return builder.build();
    }

    @Bean
    public FilterRegistrationBean<RequestIdFilter> requestIdFilterRegistration(RequestIdFilter filter) {
        FilterRegistrationBean<RequestIdFilter> registrationBean = new FilterRegistrationBean<>();
        registrationBean.setFilter(filter);
        registrationBean.addUrlPatterns("/*");
        registrationBean.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
        return registrationBean;
    }

    @Bean
    public FilterRegistrationBean<SecurityHeadersFilter> securityHeadersFilterRegistration(
            SecurityHeadersFilter filter) {
        FilterRegistrationBean<SecurityHeadersFilter> registrationBean = new FilterRegistrationBean<>();
        registrationBean.setFilter(filter);
        registrationBean.addUrlPatterns("/*");
        registrationBean.setOrder(Ordered.HIGHEST_PRECEDENCE + 20);
        return registrationBean;
    }

    @Override
    public void onApplicationEvent(ServletWebServerInitializedEvent event) {
        log.info("Gateway started on port {} with {} cache, endpoints from {}",
                event.getWebServer().getPort(), properties.getCache().getProvider(),
                properties.getEndpointsDirectory());
    }

    @Bean("gatewayWebClient")
    @ConditionalOnMissingBean(name = "gatewayWebClient")
    public WebClient gatewayWebClient(BackendClientProperties backendProperties) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) backendProperties.getConnectTimeout().toMillis())
                .responseTimeout(backendProperties.getResponseTimeout());

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs()
                        .maxInMemorySize((int) backendProperties.getMaxInMemorySize().toBytes()))
                .build();
    }
}
