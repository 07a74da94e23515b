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

import java.util.Set;

/**
 * Store of an entity whose business key is its primary key.
 *
 * @param <K> business key type
 * @param <R> row type
 * @author Makalisio
 * @since 0.0.1
 */
public interface NaturalKeyStore<K, R> extends EntityStore<K, R> {

    /**
     * @return every stored key
     */
    Set<K> loadKeys();
}
