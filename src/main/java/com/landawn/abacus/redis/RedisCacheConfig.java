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

import java.net.InetSocketAddress;
import java.util.List;

import com.landawn.abacus.util.AddrUtil;
import com.landawn.abacus.util.N;
import com.landawn.abacus.util.Strings;

/**
 * Immutable settings of a {@link RedisCache}.
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * RedisCacheConfig config = RedisCacheConfig.of("localhost", 6379);
 * RedisCacheConfig fromUrl = RedisCacheConfig.of("redis1.example.com:6379").withReconnectionDelay(5000);
 * }</pre>
 *
 * @param host the Redis server host, must not be {@code null} or empty
 * @param port the Redis server port, between 1 and 65535
 * @param reconnectionDelay the minimum time in milliseconds between two failed connection attempts, must not be negative
 * @param failOnServerError whether an error reply from the server fails the operation; when {@code false}
 *        such replies are logged only, a {@code get} reports a miss and a {@code put} reports success
 */
public record RedisCacheConfig(String host, int port, long reconnectionDelay, boolean failOnServerError) {

    public static final int DEFAULT_PORT = 6379;

    public static final long DEFAULT_RECONNECTION_DELAY = 1000;

    public RedisCacheConfig {
        if (Strings.isEmpty(host)) {
            throw new IllegalArgumentException("host cannot be null or empty");
        }

        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }

        if (reconnectionDelay < 0) {
            throw new IllegalArgumentException("reconnectionDelay cannot be negative: " + reconnectionDelay);
        }
    }

    /**
     * Creates a config with the default reconnection delay that logs server errors without failing.
     *
     * @param host the Redis server host
     * @param port the Redis server port
     * @return the config
     * @throws IllegalArgumentException if {@code host} is empty or {@code port} is out of range
     */
    public static RedisCacheConfig of(final String host, final int port) {
        return new RedisCacheConfig(host, port, DEFAULT_RECONNECTION_DELAY, false);
    }

    /**
     * Creates a config with the given reconnection delay that logs server errors without failing.
     *
     * @param host the Redis server host
     * @param port the Redis server port
     * @param reconnectionDelay milliseconds to wait after a failed connection attempt
     * @return the config
     * @throws IllegalArgumentException if an argument is out of range
     */
    public static RedisCacheConfig of(final String host, final int port, final long reconnectionDelay) {
        return new RedisCacheConfig(host, port, reconnectionDelay, false);
    }

    /**
     * Creates a config from a single {@code host:port} server URL.
     *
     * @param serverUrl the server URL, e.g. {@code "localhost:6379"}
     * @return the config, with the default reconnection delay
     * @throws IllegalArgumentException if {@code serverUrl} does not contain exactly one address
     */
    public static RedisCacheConfig of(final String serverUrl) {
        if (Strings.isEmpty(serverUrl)) {
            throw new IllegalArgumentException("serverUrl cannot be null or empty");
        }

        final List<InetSocketAddress> addressList = AddrUtil.getAddressList(serverUrl);

        if (N.isEmpty(addressList)) {
            throw new IllegalArgumentException("No valid server address found in: " + serverUrl);
        } else if (addressList.size() > 1) {
            throw new IllegalArgumentException("Only one server address is supported: " + serverUrl);
        }

        final InetSocketAddress addr = addressList.get(0);

        return of(addr.getHostString(), addr.getPort());
    }

    /**
     * Returns a copy of this config with another reconnection delay.
     *
     * @param reconnectionDelay milliseconds to wait after a failed connection attempt, must not be negative
     * @return the new config
     */
    public RedisCacheConfig withReconnectionDelay(final long reconnectionDelay) {
        return new RedisCacheConfig(host, port, reconnectionDelay, failOnServerError);
    }

    /**
     * Returns a copy of this config with another server-error policy.
     *
     * <p><b>Usage Examples:</b></p>
     * <pre>{@code
     * RedisCacheConfig strict = RedisCacheConfig.of("localhost", 6379).withFailOnServerError(true);
     * }</pre>
     *
     * @param failOnServerError {@code true} to fail operations that receive an error reply
     * @return the new config
     */
    public RedisCacheConfig withFailOnServerError(final boolean failOnServerError) {
        return new RedisCacheConfig(host, port, reconnectionDelay, failOnServerError);
    }
}
