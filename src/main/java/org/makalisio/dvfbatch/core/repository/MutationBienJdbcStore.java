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
import org.makalisio.dvfbatch.core.model.MutationBien;
import org.makalisio.dvfbatch.core.model.MutationBienKey;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;

/**
 * Table MUTATION_BIEN, keyed by (mutation, bien).
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Repository
public class MutationBienJdbcStore extends AbstractJdbcNaturalKeyStore<MutationBienKey, MutationBien> {

    private static final String INSERT_SQL =
            "INSERT INTO MUTATION_BIEN (ID_Mutation, ID_Bien, Valeur_fonciere)"
            + " VALUES (:mutationId, :bienId, :value)";

    public MutationBienJdbcStore(NamedParameterJdbcTemplate jdbc) {
        super(jdbc, EntityType.MUTATION_BIEN, "ID_Mutation", "ID_Bien");
    }

    @Override
    public MutationBienKey keyOf(MutationBien row) {
        return row.key();
    }

    @Override
    protected Object[] keyValues(MutationBienKey key) {
        return new Object[]{key.getMutationId(), key.getBienId()};
    }

    @Override
    protected MutationBienKey mapKey(ResultSet rs) throws SQLException {
        return new MutationBienKey(rs.getString("ID_Mutation"), rs.getLong("ID_Bien"));
    }

    @Override
    protected String insertSql() {
        return INSERT_SQL;
    }

    @Override
    protected SqlParameterSource toParams(MutationBien row) {
        return new MapSqlParameterSource()
                .addValue("mutationId", row.getMutationId())
                .addValue("bienId", row.getBienId())
                .addValue("value", row.getValue(), Types.DECIMAL);
    }
}
