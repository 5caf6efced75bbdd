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
 * Snapshot of the counters of a {@link RedisCache}.
 *
 * @param getCount number of {@code get} operations
 * @param hitCount number of {@code get} operations that found a value
 * @param missCount number of {@code get} operations that found no value
 * @param putCount number of {@code put} operations
 * @param deleteCount number of {@code delete} operations
 * @param failedCount number of operations of any kind that failed
 * @param connectAttempts number of connection attempts
 * @param connectFailures number of connection attempts that failed
 * @param discardedConnections number of connections dropped after a transport or protocol error
 */
public record RedisCacheStats(long getCount, long hitCount, long missCount, long putCount, long deleteCount, long failedCount, long connectAttempts,
        long connectFailures, long discardedConnections) {

}
