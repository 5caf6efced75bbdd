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
 * Base class of the failures raised while talking to the Redis server.
 * These exceptions are used inside the adapter only; {@link RedisCache} resolves each of them to a
 * plain success/failure outcome before returning to the caller.
 *
 * @see RedisConnectionException
 * @see RedisTransportException
 * @see RedisProtocolException
 */
public class RedisCacheException extends RuntimeException {

    private static final long serialVersionUID = -2467331842530398112L;

    public RedisCacheException(final String message) {
        super(message);
    }

    public RedisCacheException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
