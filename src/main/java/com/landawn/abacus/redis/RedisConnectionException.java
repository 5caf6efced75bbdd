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
 * Thrown when a connection to the Redis server cannot be established.
 * The next attempt is postponed by the configured reconnection delay.
 */
public class RedisConnectionException extends RedisCacheException {

    private static final long serialVersionUID = 5390216447751265030L;

    public RedisConnectionException(final String message) {
        super(message);
    }

    public RedisConnectionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
