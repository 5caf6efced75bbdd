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
 * Thrown when an established connection stops working in the middle of a command.
 * The connection is dropped and the next operation may reconnect right away.
 */
public class RedisTransportException extends RedisCacheException {

    private static final long serialVersionUID = -8837915632470173452L;

    public RedisTransportException(final String message) {
        super(message);
    }

    public RedisTransportException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
