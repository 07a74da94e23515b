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
import org.makalisio.dvfbatch.core.resolver.SurrogateKeyStore;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * Store JDBC d'une entité à identifiant technique.
 * Les identifiants sont attribués par le resolver et insérés explicitement.
 *
 * @author Makalisio
 * @since 0.0.1
 */
public abstract class AbstractJdbcSurrogateKeyStore<K, R> extends AbstractJdbcEntityStore<K, R>
        implements SurrogateKeyStore<K, R> {

    private final String idColumn;

    protected AbstractJdbcSurrogateKeyStore(NamedParameterJdbcTemplate jdbc, EntityType entityType,
                                            String idColumn, String... keyColumns) {
        super(jdbc, entityType, keyColumns);
        this.idColumn = idColumn;
    }

    @Override
    public Map<K, Long> loadKeyIds() {
        String sql = selectKeysSql().replaceFirst("SELECT ", "SELECT " + idColumn + ", ");
        Map<K, Long> keyIds = new HashMap<>();
        jdbc.query(sql, (RowCallbackHandler) rs -> {
            keyIds.put(mapKey(rs), rs.getLong(idColumn));
        });
        return keyIds;
    }

    @Override
    public long maxId() {
        Long max = jdbc.queryForObject(
                "SELECT COALESCE(MAX(" + idColumn + "), 0) FROM " + getEntityType().getTableName(),
                new MapSqlParameterSource(), Long.class);
        return max == null ? 0 : max;
    }
}
