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
package org.makalisio.dvfbatch.core.processor;

import java.util.Map;

/**
 * Column names of the DVF export, as they appear (lower-cased) in the header line,
 * and the maximum length of the text columns in the target schema.
 *
 * @author Makalisio
 * @since 0.0.1
 */
public final class DvfColumns {

    public static final String ID_MUTATION = "id_mutation";
    public static final String DATE_MUTATION = "date_mutation";
    public static final String NUMERO_DISPOSITION = "numero_disposition";
    public static final String NATURE_MUTATION = "nature_mutation";
    public static final String VALEUR_FONCIERE = "valeur_fonciere";

    public static final String ADRESSE_NUMERO = "adresse_numero";
    public static final String ADRESSE_SUFFIXE = "adresse_suffixe";
    public static final String ADRESSE_NOM_VOIE = "adresse_nom_voie";
    public static final String CODE_POSTAL = "code_postal";
    public static final String CODE_COMMUNE = "code_commune";
    public static final String NOM_COMMUNE = "nom_commune";
    public static final String CODE_DEPARTEMENT = "code_departement";
    public static final String LONGITUDE = "longitude";
    public static final String LATITUDE = "latitude";

    public static final String ID_PARCELLE = "id_parcelle";
    public static final String TYPE_LOCAL = "type_local";
    public static final String SURFACE_REELLE_BATI = "surface_reelle_bati";
    public static final String SURFACE_TERRAIN = "surface_terrain";
    public static final String NOMBRE_PIECES_PRINCIPALES = "nombre_pieces_principales";

    /** The export carries lots 1 to 5 on the same row. */
    public static final int MAX_LOTS = 5;

    /** Numero_lot VARCHAR(10), for every lotN_numero column. */
    public static final int LOT_NUMBER_LENGTH = 10;

    // longueurs VARCHAR de schema/dvf-schema.sql
    private static final Map<String, Integer> MAX_LENGTHS = Map.ofEntries(
            Map.entry(ID_MUTATION, 30),
            Map.entry(NATURE_MUTATION, 50),
            Map.entry(ADRESSE_NUMERO, 10),
            Map.entry(ADRESSE_SUFFIXE, 5),
            Map.entry(ADRESSE_NOM_VOIE, 100),
            Map.entry(CODE_POSTAL, 10),
            Map.entry(CODE_COMMUNE, 10),
            Map.entry(NOM_COMMUNE, 50),
            Map.entry(CODE_DEPARTEMENT, 10),
            Map.entry(ID_PARCELLE, 20),
            Map.entry(TYPE_LOCAL, 50));

    private DvfColumns() {
    }

    public static String lotNumber(int index) {
        return "lot" + index + "_numero";
    }

    public static String lotSurface(int index) {
        return "lot" + index + "_surface_carrez";
    }

    /**
     * @param column a text column
     * @return its maximum length in characters, or null if the column is not stored as text
     */
    public static Integer maxLength(String column) {
        if (column.startsWith("lot") && column.endsWith("_numero")) {
            return LOT_NUMBER_LENGTH;
        }
        return MAX_LENGTHS.get(column);
    }
}
