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

import org.makalisio.dvfbatch.core.model.Bien;
import org.makalisio.dvfbatch.core.model.BienKey;
import org.makalisio.dvfbatch.core.model.Decimals;
import org.makalisio.dvfbatch.core.model.EntityType;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;

/**
 * Table BIEN.
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Repository
public class BienJdbcStore extends AbstractJdbcSurrogateKeyStore<BienKey, Bien> {

    private static final String INSERT_SQL =
            "INSERT INTO BIEN (ID_Bien, ID_Parcelle, Surface_reelle_bati, Surface_terrain,"
            + " Nombre_pieces_principales, Type_local, ID_Localisation)"
            + " VALUES (:id, :parcelId, :builtSurface, :landSurface, :roomCount, :propertyType, :localisationId)";

    public BienJdbcStore(NamedParameterJdbcTemplate jdbc) {
        super(jdbc, EntityType.BIEN, "ID_Bien",
                "ID_Parcelle", "ID_Localisation", "Type_local",
                "Surface_reelle_bati", "Surface_terrain", "Nombre_pieces_principales");
    }

    @Override
    public BienKey keyOf(Bien row) {
        return row.key();
    }

    @Override
    protected Object[] keyValues(BienKey key) {
        return new Object[]{
                key.getParcelId(), key.getLocalisationId(), key.getPropertyType(),
                key.getBuiltSurface(), key.getLandSurface(), key.getRoomCount()
        };
    }

    @Override
    protected BienKey mapKey(ResultSet rs) throws SQLException {
        return new BienKey(
                rs.getString("ID_Parcelle"),
                rs.getLong("ID_Localisation"),
                rs.getString("Type_local"),
                Decimals.amount(rs.getBigDecimal("Surface_reelle_bati")),
                Decimals.amount(rs.getBigDecimal("Surface_terrain")),
                rs.getObject("Nombre_pieces_principales", Integer.class));
    }

    @Override
    protected String insertSql() {
        return INSERT_SQL;
    }

    @Override
    protected SqlParameterSource toParams(Bien row) {
        return new MapSqlParameterSource()
                .addValue("id", row.getId())
                .addValue("parcelId", row.getParcelId(), Types.VARCHAR)
                .addValue("builtSurface", row.getBuiltSurface(), Types.DECIMAL)
                .addValue("landSurface", row.getLandSurface(), Types.DECIMAL)
                .addValue("roomCount", row.getRoomCount(), Types.INTEGER)
                .addValue("propertyType", row.getPropertyType(), Types.VARCHAR)
                .addValue("localisationId", row.getLocalisationId());
    }
}
