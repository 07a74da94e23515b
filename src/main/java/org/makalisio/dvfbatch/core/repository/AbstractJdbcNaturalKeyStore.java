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
package org.makalisio.dvfbatch.core.repository;

import org.makalisio.dvfbatch.core.model.EntityType;
import org.makalisio.dvfbatch.core.resolver.NaturalKeyStore;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.HashSet;
import java.util.Set;

/**
 * Store JDBC d'une entité identifiée par sa clé naturelle.
 *
 * @author Makalisio
 * @since 0.0.1
 */
public abstract class AbstractJdbcNaturalKeyStore<K, R> extends AbstractJdbcEntityStore<K, R>
        implements NaturalKeyStore<K, R> {

    protected AbstractJdbcNaturalKeyStore(NamedParameterJdbcTemplate jdbc, EntityType entityType,
                                          String... keyColumns) {
        super(jdbc, entityType, keyColumns);
    }

    @Override
    public Set<K> loadKeys() {
        Set<K> keys = new HashSet<>();
        jdbc.query(selectKeysSql(), (RowCallbackHandler) rs -> {
            keys.add(mapKey(rs));
        });
        return keys;
    }
}
