/*
 * Copyright 2026 Makalisio Contributors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.makalisio.dvfbatch.core.resolver;

import java.util.Map;

/**
 * Store of an entity identified by a generated surrogate id.
 *
 * @param <K> business key type
 * @param <R> row type
 * @author Makalisio
 * @since 0.0.1
 */
public interface SurrogateKeyStore<K, R> extends EntityStore<K, R> {

    /**
     * @return every stored business key with its surrogate id
     */
    Map<K, Long> loadKeyIds();

    /**
     * @return the highest stored surrogate id, 0 when the table is empty
     */
    long maxId();
}
