package io.github.vevoly.jscopedcache.core.internal;

import io.github.vevoly.jscopedcache.api.ScopedCacheHandle;
import io.github.vevoly.jscopedcache.api.ScopedCacheInvalidator;
import io.github.vevoly.jscopedcache.api.annotation.InvalidatesScopedCache;
import io.github.vevoly.jscopedcache.api.constants.CacheTypes;
import io.github.vevoly.jscopedcache.core.ScopedCacheFactory;
import io.github.vevoly.jscopedcache.core.support.MutableClock;
import io.github.vevoly.jscopedcache.core.support.TestPolicies;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ScopedCacheInvalidationAspectTest {

    private ScopedCacheHandle cache;

    @BeforeEach
    void setUp() {
        cache = ScopedCacheFactory.open(TestPolicies.properties(100, true), new MutableClock(0L));
        cache.fetch("mensajes:u1:s1", CacheTypes.MESSAGES, () -> "list");
        cache.fetch("destinatarios:u1:s1:{}", CacheTypes.RECIPIENTS, () -> "recipients");
        cache.fetch("mensajes:u2:s1", CacheTypes.MESSAGES, () -> "other");
    }

    @AfterEach
    void tearDown() {
        cache.close();
    }

    @Test
    void invalidatesScopeAfterSuccessfulWrite() {
        MessageService proxy = proxy(cache);

        assertEquals("u1", proxy.send("s1", new Message("u1")));

        assertEquals(Set.of("mensajes:u2:s1"), cache.keys());
    }

    @Test
    void doesNothingWhenWriteFails() {
        MessageService proxy = proxy(cache);

        assertThrows(IllegalStateException.class, () -> proxy.sendFailing("u1", "s1"));

        assertEquals(3, cache.keys().size());
    }

    @Test
    void invalidationErrorsNeverReachTheCaller() {
        ScopedCacheInvalidator broken = new NoOpScopedCache() {
            @Override
            public int invalidate(String primaryType, String userId, String schoolId, List<String> relatedTypes) {
                throw new IllegalStateException("cache down");
            }
        };
        MessageService proxy = proxy(broken);

        assertEquals("u1", proxy.send("s1", new Message("u1")));
    }

    private static MessageService proxy(ScopedCacheInvalidator invalidator) {
        AspectJProxyFactory factory = new AspectJProxyFactory(new MessageService());
        factory.setProxyTargetClass(true);
        factory.addAspect(new ScopedCacheInvalidationAspect(invalidator));
        return factory.getProxy();
    }

    static class Message {
        private final String senderId;

        Message(String senderId) {
            this.senderId = senderId;
        }

        public String getSenderId() {
            return senderId;
        }
    }

    static class MessageService {

        @InvalidatesScopedCache(type = CacheTypes.MESSAGES, related = CacheTypes.RECIPIENTS,
                userId = "#result", schoolId = "#p0")
        public String send(String schoolId, Message message) {
            return message.getSenderId();
        }

        @InvalidatesScopedCache(type = CacheTypes.MESSAGES, userId = "#p0", schoolId = "#p1")
        public String sendFailing(String userId, String schoolId) {
            throw new IllegalStateException("db down");
        }
    }
}
