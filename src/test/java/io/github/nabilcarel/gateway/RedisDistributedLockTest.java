package io.github.nabilcarel.gateway;

import io.github.nabilcarel.gateway.lock.LockHandle;
import io.github.nabilcarel.gateway.lock.RedisDistributedLock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLockReactive;
import org.redisson.api.RedissonReactiveClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisDistributedLockTest {

    @Mock
    private RedissonReactiveClient client;

    @Mock
    private RLockReactive rLock;

    private RedisDistributedLock lock;

    @BeforeEach
    void setUp() {
        when(client.getLock("gateway:lock:k")).thenReturn(rLock);
        lock = new RedisDistributedLock(client, "gateway:");
    }

    @Test
    void testTryAcquire_passesWaitAndLease() {
        when(rLock.tryLock(anyLong(), anyLong(), any(TimeUnit.class), anyLong())).thenReturn(Mono.just(true));

        LockHandle handle = lock.tryAcquire("lock:k", Duration.ofSeconds(30), Duration.ofSeconds(10),
                Duration.ofMillis(200)).block();

        assertThat(handle).isNotNull();
        assertThat(handle.getKey()).isEqualTo("lock:k");
        verify(rLock).tryLock(eq(10_000L), eq(30_000L), eq(TimeUnit.MILLISECONDS), anyLong());
    }

    @Test
    void testTryAcquire_notAcquiredIsEmpty() {
        when(rLock.tryLock(anyLong(), anyLong(), any(TimeUnit.class), anyLong())).thenReturn(Mono.just(false));

        LockHandle handle = lock.tryAcquire("lock:k", Duration.ofSeconds(30), Duration.ofMillis(50),
                Duration.ofMillis(10)).block();

        assertThat(handle).isNull();
    }

    @Test
    void testRelease_unlocksWithTheAcquiringOwnerOnce() {
        ArgumentCaptor<Long> ownerId = ArgumentCaptor.forClass(Long.class);
        when(rLock.tryLock(anyLong(), anyLong(), any(TimeUnit.class), ownerId.capture())).thenReturn(Mono.just(true));
        when(rLock.unlock(anyLong())).thenReturn(Mono.empty());

        LockHandle handle = lock.tryAcquire("lock:k", Duration.ofSeconds(30), Duration.ZERO, Duration.ofMillis(10))
                .block();
        handle.release().block();
        handle.release().block();

        verify(rLock, times(1)).unlock(ownerId.getValue().longValue());
    }

    @Test
    void testTryAcquire_eachHandleHasItsOwnOwner() {
        ArgumentCaptor<Long> ownerId = ArgumentCaptor.forClass(Long.class);
        when(rLock.tryLock(anyLong(), anyLong(), any(TimeUnit.class), ownerId.capture())).thenReturn(Mono.just(true));

        lock.tryAcquire("lock:k", Duration.ofSeconds(30), Duration.ZERO, Duration.ofMillis(10)).block();
        lock.tryAcquire("lock:k", Duration.ofSeconds(30), Duration.ZERO, Duration.ofMillis(10)).block();

        assertThat(ownerId.getAllValues()).hasSize(2);
        assertThat(ownerId.getAllValues().get(0)).isNotEqualTo(ownerId.getAllValues().get(1));
    }

    @Test
    void testRelease_expiredLeaseIsNotPropagated() {
        when(rLock.tryLock(anyLong(), anyLong(), any(TimeUnit.class), anyLong())).thenReturn(Mono.just(true));
        when(rLock.unlock(anyLong())).thenReturn(Mono.error(new IllegalMonitorStateException("not locked by owner")));

        LockHandle handle = lock.tryAcquire("lock:k", Duration.ofSeconds(30), Duration.ZERO, Duration.ofMillis(10))
                .block();

        assertThatCode(() -> handle.release().block()).doesNotThrowAnyException();
    }
}
