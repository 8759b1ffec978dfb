package io.github.vevoly.jscopedcache.core.config;

import io.github.vevoly.jscopedcache.api.config.ResolvedCacheTypePolicy;
import io.github.vevoly.jscopedcache.core.properties.CacheTypeProperties;
import io.github.vevoly.jscopedcache.core.properties.ScopedCacheRootProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CachePolicyResolverTest {

    @Test
    void builtInTableIsAvailableWithoutConfiguration() {
        CachePolicyResolver resolver = resolve(new ScopedCacheRootProperties());

        assertEquals(180, resolver.policyOf("dashboard").getTtlSeconds());
        assertEquals(60, resolver.policyOf("notificaciones").getTtlSeconds());
        assertEquals(1800, resolver.policyOf("escuela").getTtlSeconds());
        assertEquals(21, resolver.getAllResolvedPolicies().size());
    }

    @Test
    void unknownTypeFallsBackToDefaultTtl() {
        ScopedCacheRootProperties properties = new ScopedCacheRootProperties();
        properties.setDefaultTtl(Duration.ofSeconds(42));

        ResolvedCacheTypePolicy policy = resolve(properties).policyOf("whatever");

        assertEquals("whatever", policy.getTypeName());
        assertEquals(42, policy.getTtlSeconds());
        assertEquals("Default", policy.getDescription());
    }

    @Test
    void configuredTypeOverridesBuiltIn() {
        ScopedCacheRootProperties properties = new ScopedCacheRootProperties();
        properties.getTypes().put("dashboard", type(Duration.ofSeconds(30), "Fast dashboard"));

        ResolvedCacheTypePolicy policy = resolve(properties).policyOf("dashboard");

        assertEquals(30, policy.getTtlSeconds());
        assertEquals("Fast dashboard", policy.getDescription());
    }

    @Test
    void configuredTypeWithoutTtlKeepsBuiltInTtl() {
        ScopedCacheRootProperties properties = new ScopedCacheRootProperties();
        properties.getTypes().put("escuela", type(null, "School"));
        properties.getTypes().put("reportes", type(null, null));

        CachePolicyResolver resolver = resolve(properties);

        assertEquals(1800, resolver.policyOf("escuela").getTtlSeconds());
        assertEquals(300, resolver.policyOf("reportes").getTtlSeconds());
        assertEquals("", resolver.policyOf("reportes").getDescription());
    }

    @Test
    void zeroTtlMakesTypeUncacheable() {
        ScopedCacheRootProperties properties = new ScopedCacheRootProperties();
        properties.getTypes().put("live", type(Duration.ZERO, null));

        assertFalse(resolve(properties).policyOf("live").isCacheable());
    }

    @Test
    void policyOfKeyUsesFirstSegment() {
        CachePolicyResolver resolver = resolve(new ScopedCacheRootProperties());

        assertEquals(120, resolver.policyOfKey("destinatarios:u1:s1:{}").getTtlSeconds());
        assertEquals(900, resolver.policyOfKey("logros").getTtlSeconds());
    }

    @Test
    void invalidSettingsFailFast() {
        ScopedCacheRootProperties capacity = new ScopedCacheRootProperties();
        capacity.setMaxEntries(0);
        assertThrows(IllegalStateException.class, () -> resolve(capacity));

        ScopedCacheRootProperties negativeTtl = new ScopedCacheRootProperties();
        negativeTtl.getTypes().put("dashboard", type(Duration.ofSeconds(-1), null));
        assertThrows(IllegalStateException.class, () -> resolve(negativeTtl));

        ScopedCacheRootProperties badName = new ScopedCacheRootProperties();
        badName.getTypes().put("a:b", type(Duration.ofSeconds(1), null));
        assertThrows(IllegalStateException.class, () -> resolve(badName));

        ScopedCacheRootProperties negativeSweep = new ScopedCacheRootProperties();
        negativeSweep.setSweepInterval(Duration.ofSeconds(-5));
        assertThrows(IllegalStateException.class, () -> resolve(negativeSweep));
    }

    @Test
    void fractionalSecondTtlsAreRejectedInsteadOfTruncated() {
        ScopedCacheRootProperties subSecond = new ScopedCacheRootProperties();
        subSecond.getTypes().put("fast", type(Duration.ofMillis(500), null));
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> resolve(subSecond));
        assertTrue(e.getMessage().contains("fast"));

        ScopedCacheRootProperties fractional = new ScopedCacheRootProperties();
        fractional.getTypes().put("fast", type(Duration.ofMillis(1500), null));
        assertThrows(IllegalStateException.class, () -> resolve(fractional));

        ScopedCacheRootProperties fractionalDefault = new ScopedCacheRootProperties();
        fractionalDefault.setDefaultTtl(Duration.ofMillis(2500));
        assertThrows(IllegalStateException.class, () -> resolve(fractionalDefault));

        ScopedCacheRootProperties whole = new ScopedCacheRootProperties();
        whole.getTypes().put("fast", type(Duration.ofMillis(2000), null));
        assertEquals(2, resolve(whole).policyOf("fast").getTtlSeconds());
    }

    @Test
    void sweepIntervalBelowOneMillisecondIsRejected() {
        ScopedCacheRootProperties tooShort = new ScopedCacheRootProperties();
        tooShort.setSweepInterval(Duration.ofNanos(500_000));
        assertThrows(IllegalStateException.class, () -> resolve(tooShort));

        ScopedCacheRootProperties oneMilli = new ScopedCacheRootProperties();
        oneMilli.setSweepInterval(Duration.ofMillis(1));
        assertDoesNotThrow(() -> resolve(oneMilli));

        ScopedCacheRootProperties disabled = new ScopedCacheRootProperties();
        disabled.setSweepInterval(Duration.ZERO);
        assertDoesNotThrow(() -> resolve(disabled));
    }

    private static CachePolicyResolver resolve(ScopedCacheRootProperties properties) {
        CachePolicyResolver resolver = new CachePolicyResolver(properties);
        resolver.afterPropertiesSet();
        return resolver;
    }

    private static CacheTypeProperties type(Duration ttl, String description) {
        CacheTypeProperties properties = new CacheTypeProperties();
        properties.setTtl(ttl);
        properties.setDescription(description);
        return properties;
    }
}
