/*
 * Copyright (C) 2015 HaiYang Li
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */

package com.landawn.abacus.redis;

import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;

import com.landawn.abacus.util.N;
import com.landawn.abacus.util.Numbers;
import com.landawn.abacus.util.Strings;
import com.landawn.abacus.util.TypeAttrParser;

/**
 * Factory for {@link RedisCache} instances with a {@link ReentrantLock} guard, the
 * {@code RedisCache} class logger and the system UTC clock.
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * RedisCache cache = RedisCacheFactory.createRedisCache("localhost", 6379);
 *
 * // provider syntax: Redis(host:port[, reconnectionDelay[, failOnServerError]])
 * RedisCache other = RedisCacheFactory.createRedisCache("Redis(redis1.example.com:6379, 5000)");
 * }</pre>
 */
public final class RedisCacheFactory {

    public static final String REDIS = "Redis";

    private RedisCacheFactory() {
    }

    /**
     * Creates a cache for {@code host:port} with the default reconnection delay.
     *
     * @param host the Redis server host
     * @param port the Redis server port
     * @return a new, not yet started cache
     * @throws IllegalArgumentException if {@code host} is empty or {@code port} is out of range
     */
    public static RedisCache createRedisCache(final String host, final int port) {
        return createRedisCache(RedisCacheConfig.of(host, port));
    }

    /**
     * Creates a cache for {@code host:port} with the given reconnection delay.
     *
     * @param host the Redis server host
     * @param port the Redis server port
     * @param reconnectionDelay milliseconds to wait after a failed connection attempt
     * @return a new, not yet started cache
     */
    public static RedisCache createRedisCache(final String host, final int port, final long reconnectionDelay) {
        return createRedisCache(RedisCacheConfig.of(host, port, reconnectionDelay));
    }

    /**
     * Creates a cache from a config.
     *
     * <p><b>Usage Examples:</b></p>
     * <pre>{@code
     * RedisCache cache = RedisCacheFactory.createRedisCache(RedisCacheConfig.of("localhost:6379").withFailOnServerError(true));
     * cache.startUp();
     * }</pre>
     *
     * @param config the settings
     * @return a new, not yet started cache
     * @throws IllegalArgumentException if {@code config} is {@code null}
     */
    public static RedisCache createRedisCache(final RedisCacheConfig config) {
        return new RedisCache(config, new ReentrantLock(), RedisCache.logger, Clock.systemUTC());
    }

    /**
     * Creates a cache from a provider specification such as {@code "Redis(localhost:6379)"},
     * {@code "Redis(localhost:6379, 2000)"} or {@code "Redis(localhost:6379, 2000, true)"}.
     *
     * @param provider the provider specification
     * @return a new, not yet started cache
     * @throws IllegalArgumentException if the specification is malformed
     */
    public static RedisCache createRedisCache(final String provider) {
        if (Strings.isEmpty(provider)) {
            throw new IllegalArgumentException("provider cannot be null or empty");
        }

        final TypeAttrParser attrResult = TypeAttrParser.parse(provider);

        if (!REDIS.equalsIgnoreCase(attrResult.getClassName())) {
            throw new IllegalArgumentException("Unsupported provider: " + attrResult.getClassName());
        }

        final String[] parameters = attrResult.getParameters();

        if (N.isEmpty(parameters)) {
            throw new IllegalArgumentException("Invalid provider specification: missing parameters");
        } else if (parameters.length > 3) {
            throw new IllegalArgumentException("Unsupported parameters: " + Strings.join(parameters));
        }

        RedisCacheConfig config = RedisCacheConfig.of(parameters[0].trim());

        if (parameters.length >= 2) {
            try {
                config = config.withReconnectionDelay(Numbers.toLong(parameters[1].trim()));
            } catch (final NumberFormatException e) {
                throw new IllegalArgumentException("Invalid reconnectionDelay parameter: " + parameters[1], e);
            }
        }

        if (parameters.length == 3) {
            final String flag = parameters[2].trim();

            if (!"true".equalsIgnoreCase(flag) && !"false".equalsIgnoreCase(flag)) {
                throw new IllegalArgumentException("Invalid failOnServerError parameter: " + parameters[2]);
            }

            config = config.withFailOnServerError(Boolean.parseBoolean(flag));
        }

        return createRedisCache(config);
    }
}
