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

import org.makalisio.dvfbatch.core.model.Decimals;
import org.makalisio.dvfbatch.core.model.EntityType;
import org.makalisio.dvfbatch.core.model.Localisation;
import org.makalisio.dvfbatch.core.model.LocalisationKey;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;

/**
 * Table LOCALISATION.
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Repository
public class LocalisationJdbcStore extends AbstractJdbcSurrogateKeyStore<LocalisationKey, Localisation> {

    private static final String INSERT_SQL =
            "INSERT INTO LOCALISATION (ID_Localisation, Adresse_numero, Adresse_suffixe, Adresse_nom_voie,"
            + " Code_postal, Date_localisation, Code_departement, Code_commune, Nom_commune, Longitude, Latitude)"
            + " VALUES (:id, :addressNumber, :addressSuffix, :streetName, :postalCode, :observationDate,"
            + " :departmentCode, :communeCode, :communeName, :longitude, :latitude)";

    public LocalisationJdbcStore(NamedParameterJdbcTemplate jdbc) {
        super(jdbc, EntityType.LOCALISATION, "ID_Localisation",
                "Adresse_numero", "Adresse_suffixe", "Adresse_nom_voie", "Code_postal",
                "Code_departement", "Code_commune", "Nom_commune", "Longitude", "Latitude");
    }

    @Override
    public LocalisationKey keyOf(Localisation row) {
        return row.key();
    }

    @Override
    protected Object[] keyValues(LocalisationKey key) {
        return new Object[]{
                key.getAddressNumber(), key.getAddressSuffix(), key.getStreetName(), key.getPostalCode(),
                key.getDepartmentCode(), key.getCommuneCode(), key.getCommuneName(),
                key.getLongitude(), key.getLatitude()
        };
    }

    @Override
    protected LocalisationKey mapKey(ResultSet rs) throws SQLException {
        return new LocalisationKey(
                rs.getString("Adresse_numero"),
                rs.getString("Adresse_suffixe"),
                rs.getString("Adresse_nom_voie"),
                rs.getString("Code_postal"),
                rs.getString("Code_departement"),
                rs.getString("Code_commune"),
                rs.getString("Nom_commune"),
                Decimals.coordinate(rs.getBigDecimal("Longitude")),
                Decimals.coordinate(rs.getBigDecimal("Latitude")));
    }

    @Override
    protected String insertSql() {
        return INSERT_SQL;
    }

    @Override
    protected SqlParameterSource toParams(Localisation row) {
        return new MapSqlParameterSource()
                .addValue("id", row.getId())
                .addValue("addressNumber", row.getAddressNumber(), Types.VARCHAR)
                .addValue("addressSuffix", row.getAddressSuffix(), Types.VARCHAR)
                .addValue("streetName", row.getStreetName(), Types.VARCHAR)
                .addValue("postalCode", row.getPostalCode(), Types.VARCHAR)
                .addValue("observationDate", row.getObservationDate(), Types.DATE)
                .addValue("departmentCode", row.getDepartmentCode(), Types.VARCHAR)
                .addValue("communeCode", row.getCommuneCode(), Types.VARCHAR)
                .addValue("communeName", row.getCommuneName(), Types.VARCHAR)
                .addValue("longitude", row.getLongitude(), Types.DECIMAL)
                .addValue("latitude", row.getLatitude(), Types.DECIMAL);
    }
}
