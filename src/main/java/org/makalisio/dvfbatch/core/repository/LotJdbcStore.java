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
import org.makalisio.dvfbatch.core.model.Lot;
import org.makalisio.dvfbatch.core.model.LotKey;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;

/**
 * Table LOT.
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Repository
public class LotJdbcStore extends AbstractJdbcSurrogateKeyStore<LotKey, Lot> {

    private static final String INSERT_SQL =
            "INSERT INTO LOT (ID_Lot, Numero_lot, Surface_carree, ID_Bien)"
            + " VALUES (:id, :lotNumber, :surface, :bienId)";

    public LotJdbcStore(NamedParameterJdbcTemplate jdbc) {
        super(jdbc, EntityType.LOT, "ID_Lot", "ID_Bien", "Numero_lot");
    }

    @Override
    public LotKey keyOf(Lot row) {
        return row.key();
    }

    @Override
    protected Object[] keyValues(LotKey key) {
        return new Object[]{key.getBienId(), key.getLotNumber()};
    }

    @Override
    protected LotKey mapKey(ResultSet rs) throws SQLException {
        return new LotKey(rs.getLong("ID_Bien"), rs.getString("Numero_lot"));
    }

    @Override
    protected String insertSql() {
        return INSERT_SQL;
    }

    @Override
    protected SqlParameterSource toParams(Lot row) {
        return new MapSqlParameterSource()
                .addValue("id", row.getId())
                .addValue("lotNumber", row.getLotNumber())
                .addValue("surface", row.getSurface(), Types.DECIMAL)
                .addValue("bienId", row.getBienId());
    }
}
