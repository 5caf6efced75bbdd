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
 * Opens connections to a Redis server.
 *
 * @see JedisRedisConnector
 */
@FunctionalInterface
public interface RedisConnector {

    /**
     * Opens a new connection, blocking until it is established.
     *
     * @param host the server host
     * @param port the server port
     * @return the open connection
     * @throws RedisConnectionException if the server cannot be reached
     */
    RedisConnection connect(String host, int port);
}
