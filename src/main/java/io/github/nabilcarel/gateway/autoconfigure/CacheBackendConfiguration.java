package io.github.nabilcarel.gateway.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.nabilcarel.gateway.cache.CacheStore;
import io.github.nabilcarel.gateway.cache.CaffeineCacheStore;
import io.github.nabilcarel.gateway.cache.RedisCacheStore;
import io.github.nabilcarel.gateway.config.GatewayProperties;
import io.github.nabilcarel.gateway.lock.DistributedLock;
import io.github.nabilcarel.gateway.lock.InMemoryDistributedLock;
import io.github.nabilcarel.gateway.lock.RedisDistributedLock;
import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Cache store and lock for the configured {@code gateway.cache.provider}.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class CacheBackendConfiguration {

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(name = "gateway.cache.provider", havingValue = "memory", matchIfMissing = true)
    static class InMemory {

        @Bean
        @ConditionalOnMissingBean
        public CacheStore caffeineCacheStore(GatewayProperties properties) {
            log.info("Using in-memory response cache (max {} entries)", properties.getCache().getMaxEntries());
            return new CaffeineCacheStore(properties.getCache().getMaxEntries());
        }

        @Bean
        @ConditionalOnMissingBean
        public DistributedLock inMemoryDistributedLock() {
            return new InMemoryDistributedLock();
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(name = "gateway.cache.provider", havingValue = "redis")
    static class Redis {

        @Bean(destroyMethod = "shutdown")
        @ConditionalOnMissingBean
        public RedissonClient gatewayRedissonClient(GatewayProperties properties) {
            GatewayProperties.Redis redis = properties.getCache().getRedis();
            Config config = new Config();
            SingleServerConfig server = config.useSingleServer()
                    .setAddress(redis.getAddress())
                    .setDatabase(redis.getDatabase());
            if (StringUtils.hasText(redis.getPassword())) {
                server.setPassword(redis.getPassword());
            }
            log.info("Using Redis response cache at {}", redis.getAddress());
            return Redisson.create(config);
        }

        @Bean
        @ConditionalOnMissingBean
        public CacheStore redisCacheStore(RedissonClient redissonClient,
                                          @Qualifier("gatewayObjectMapper") ObjectMapper mapper,
                                          GatewayProperties properties) {
            return new RedisCacheStore(redissonClient.reactive(), mapper,
                    properties.getCache().getRedis().getKeyPrefix());
        }

        @Bean
        @ConditionalOnMissingBean
        public DistributedLock redisDistributedLock(RedissonClient redissonClient, GatewayProperties properties) {
            return new RedisDistributedLock(redissonClient.reactive(), properties.getCache().getRedis().getKeyPrefix());
        }
    }
}
