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
import org.makalisio.dvfbatch.core.model.Mutation;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;

/**
 * Table MUTATION, keyed by the DVF mutation id.
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Repository
public class MutationJdbcStore extends AbstractJdbcNaturalKeyStore<String, Mutation> {

    private static final String INSERT_SQL =
            "INSERT INTO MUTATION (ID_Mutation, Numero_disposition, Nature_mutation, Date_mutation)"
            + " VALUES (:mutationId, :dispositionNumber, :nature, :date)";

    public MutationJdbcStore(NamedParameterJdbcTemplate jdbc) {
        super(jdbc, EntityType.MUTATION, "ID_Mutation");
    }

    @Override
    public String keyOf(Mutation row) {
        return row.getMutationId();
    }

    @Override
    protected Object[] keyValues(String key) {
        return new Object[]{key};
    }

    @Override
    protected String mapKey(ResultSet rs) throws SQLException {
        return rs.getString("ID_Mutation");
    }

    @Override
    protected String insertSql() {
        return INSERT_SQL;
    }

    @Override
    protected SqlParameterSource toParams(Mutation row) {
        return new MapSqlParameterSource()
                .addValue("mutationId", row.getMutationId())
                .addValue("dispositionNumber", row.getDispositionNumber())
                .addValue("nature", row.getNature(), Types.VARCHAR)
                .addValue("date", row.getDate(), Types.DATE);
    }
}
