/*
 * Copyright (c) 2015, Haiyang Li. All rights reserved.
 */

package com.landawn.abacus.redis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class RedisCacheFactoryTest {

    @Test
    public void test_config() {
        final RedisCacheConfig config = RedisCacheConfig.of("localhost", 6380);
        assertEquals("localhost", config.host());
        assertEquals(6380, config.port());
        assertEquals(RedisCacheConfig.DEFAULT_RECONNECTION_DELAY, config.reconnectionDelay());
        assertFalse(config.failOnServerError());

        final RedisCacheConfig other = config.withReconnectionDelay(50).withFailOnServerError(true);
        assertEquals(50, other.reconnectionDelay());
        assertTrue(other.failOnServerError());
        assertEquals(RedisCacheConfig.DEFAULT_RECONNECTION_DELAY, config.reconnectionDelay());
    }

    @Test
    public void test_config_fromServerUrl() {
        final RedisCacheConfig config = RedisCacheConfig.of("127.0.0.1:6390");
        assertEquals("127.0.0.1", config.host());
        assertEquals(6390, config.port());
    }

    @Test
    public void test_config_invalid() {
        assertThrows(IllegalArgumentException.class, () -> RedisCacheConfig.of("", 6379));
        assertThrows(IllegalArgumentException.class, () -> RedisCacheConfig.of("localhost", 0));
        assertThrows(IllegalArgumentException.class, () -> RedisCacheConfig.of("localhost", 70000));
        assertThrows(IllegalArgumentException.class, () -> RedisCacheConfig.of("localhost", 6379, -1));
        assertThrows(IllegalArgumentException.class, () -> RedisCacheConfig.of((String) null));
        assertThrows(IllegalArgumentException.class, () -> RedisCacheConfig.of("127.0.0.1:6379,127.0.0.1:6380"));
    }

    @Test
    public void test_createRedisCache() {
        try (RedisCache cache = RedisCacheFactory.createRedisCache("localhost", 6379, 250)) {
            assertEquals(250, cache.config().reconnectionDelay());
            assertFalse(cache.isHealthy());
        }
    }

    @Test
    public void test_createRedisCache_fromProvider() {
        RedisCache cache = RedisCacheFactory.createRedisCache("Redis(127.0.0.1:6379)");
        assertEquals("127.0.0.1", cache.config().host());
        assertEquals(6379, cache.config().port());
        assertEquals(RedisCacheConfig.DEFAULT_RECONNECTION_DELAY, cache.config().reconnectionDelay());

        cache = RedisCacheFactory.createRedisCache("redis(127.0.0.1:6380, 2000)");
        assertEquals(6380, cache.config().port());
        assertEquals(2000, cache.config().reconnectionDelay());
        assertFalse(cache.config().failOnServerError());

        cache = RedisCacheFactory.createRedisCache("Redis(127.0.0.1:6380, 2000, true)");
        assertTrue(cache.config().failOnServerError());
    }

    @Test
    public void test_createRedisCache_invalidProvider() {
        assertThrows(IllegalArgumentException.class, () -> RedisCacheFactory.createRedisCache(""));
        assertThrows(IllegalArgumentException.class, () -> RedisCacheFactory.createRedisCache("Memcached(127.0.0.1:11211)"));
        assertThrows(IllegalArgumentException.class, () -> RedisCacheFactory.createRedisCache("Redis(127.0.0.1:6379, soon)"));
        assertThrows(IllegalArgumentException.class, () -> RedisCacheFactory.createRedisCache("Redis(127.0.0.1:6379, 10, maybe)"));
        assertThrows(IllegalArgumentException.class, () -> RedisCacheFactory.createRedisCache("Redis(127.0.0.1:6379, 10, true, x)"));
    }
}
