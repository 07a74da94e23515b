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

import lombok.extern.slf4j.Slf4j;
import org.makalisio.dvfbatch.core.model.EntityType;
import org.makalisio.dvfbatch.core.resolver.EntityStore;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Base JDBC de tous les stores.
 *
 * <p>Les colonnes de la clé métier peuvent être NULL (valeur « inconnue »).
 * La recherche des clés existantes génère donc, pour chaque clé, un prédicat
 * {@code col = :p} ou {@code col IS NULL} selon la valeur, ce qui reste portable
 * entre MySQL et H2.</p>
 *
 * @param <K> type de la clé métier
 * @param <R> type de la ligne
 * @author Makalisio
 * @since 0.0.1
 */
@Slf4j
public abstract class AbstractJdbcEntityStore<K, R> implements EntityStore<K, R> {

    /** Nombre maximal de clés par requête de recherche. */
    static final int PROBE_SLICE = 200;

    protected final NamedParameterJdbcTemplate jdbc;
    private final EntityType entityType;
    private final String[] keyColumns;

    protected AbstractJdbcEntityStore(NamedParameterJdbcTemplate jdbc, EntityType entityType, String... keyColumns) {
        this.jdbc = jdbc;
        this.entityType = entityType;
        this.keyColumns = keyColumns;
    }

    @Override
    public EntityType getEntityType() {
        return entityType;
    }

    /**
     * @return the key components, in {@code keyColumns} order
     */
    protected abstract Object[] keyValues(K key);

    /**
     * Reads a key from a row selected with every key column.
     */
    protected abstract K mapKey(ResultSet rs) throws SQLException;

    protected abstract String insertSql();

    protected abstract SqlParameterSource toParams(R row);

    @Override
    public Set<K> findExisting(Collection<K> keys) {
        Set<K> found = new HashSet<>();
        if (keys.isEmpty()) {
            return found;
        }
        List<K> all = new ArrayList<>(keys);
        for (int from = 0; from < all.size(); from += PROBE_SLICE) {
            List<K> slice = all.subList(from, Math.min(from + PROBE_SLICE, all.size()));
            MapSqlParameterSource params = new MapSqlParameterSource();
            String sql = "SELECT " + String.join(", ", keyColumns) + " FROM " + entityType.getTableName()
                    + " WHERE " + probePredicate(slice, params);
            found.addAll(jdbc.query(sql, params, (rs, rowNum) -> mapKey(rs)));
        }
        return found;
    }

    @Override
    public void persist(List<R> rows) {
        if (rows.isEmpty()) {
            return;
        }
        SqlParameterSource[] batchParams = rows.stream()
                .map(this::toParams)
                .toArray(SqlParameterSource[]::new);
        jdbc.batchUpdate(insertSql(), batchParams);
        log.debug("{} — {} ligne(s) insérée(s)", entityType.getTableName(), rows.size());
    }

    // ─── Helpers ─────────────────────────────────────────────────────────────

    private String probePredicate(List<K> slice, MapSqlParameterSource params) {
        StringBuilder sql = new StringBuilder();
        for (int i = 0; i < slice.size(); i++) {
            if (i > 0) {
                sql.append(" OR ");
            }
            Object[] values = keyValues(slice.get(i));
            sql.append('(');
            for (int c = 0; c < keyColumns.length; c++) {
                if (c > 0) {
                    sql.append(" AND ");
                }
                if (values[c] == null) {
                    sql.append(keyColumns[c]).append(" IS NULL");
                } else {
                    String name = "k" + i + "_" + c;
                    sql.append(keyColumns[c]).append(" = :").append(name);
                    params.addValue(name, values[c]);
                }
            }
            sql.append(')');
        }
        return sql.toString();
    }

    protected String selectKeysSql() {
        return "SELECT " + String.join(", ", keyColumns) + " FROM " + entityType.getTableName();
    }
}
