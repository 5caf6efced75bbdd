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
 * The shapes a Redis reply can take, as reported by the client library.
 *
 * <p>Jedis decodes both bulk strings ({@code $}) and status lines ({@code +OK}) into byte arrays,
 * so a status line is reported as {@link #STRING} and told apart by its payload.</p>
 */
public enum ReplyType {
    STRING,
    INTEGER,
    ARRAY,
    NIL,
    ERROR
}
