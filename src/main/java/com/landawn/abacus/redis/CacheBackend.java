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

/**
 * A key/value cache backend as seen by the caching framework.
 * Keys are strings, values are byte arrays passed by reference: implementations must neither copy
 * nor retain them after an operation returns.
 *
 * <p>The framework must call {@link #startUp()} before the first operation and {@link #shutDown()}
 * before discarding the backend.</p>
 *
 * @see RedisCache
 */
public interface CacheBackend {

    /**
     * Outcome of a lookup.
     */
    enum KeyState {
        AVAILABLE,
        NOT_FOUND,
        FAILED
    }

    /**
     * Receives the outcome of {@link CacheBackend#get(String, Callback)}.
     */
    @FunctionalInterface
    interface Callback {

        /**
         *
         * @param state the lookup outcome
         * @param value the value if {@code state} is {@link KeyState#AVAILABLE}, otherwise {@code null}
         */
        void done(KeyState state, byte[] value);
    }

    /**
     * Looks up {@code key} and reports the outcome to {@code callback}.
     * Blocking implementations invoke the callback before this method returns.
     *
     * @param key the key, must not be {@code null}
     * @param callback the receiver of the outcome, must not be {@code null}
     */
    void get(String key, Callback callback);

    /**
     *
     * @param key the key, must not be {@code null}
     * @param value the value, must not be {@code null}
     * @return {@code true} if the value was stored
     */
    boolean put(String key, byte[] value);

    /**
     * Removes {@code key}. A missing key is not an error.
     *
     * @param key the key, must not be {@code null}
     */
    void delete(String key);

    /**
     * Returns a constant name used in diagnostics.
     *
     * @return the backend name
     */
    String name();

    /**
     * Whether operations may stall on I/O.
     *
     * @return {@code true} if callers may block
     */
    boolean isBlocking();

    boolean isHealthy();

    void startUp();

    void shutDown();
}
