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
package org.makalisio.dvfbatch.core.model;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.IllformedLocaleException;
import java.util.List;
import java.util.Locale;

/**
 * Configuration model for a DVF source.
 * Loaded from YAML files in the ingestion/ directory.
 *
 * <h2>Exemple</h2>
 * <pre>
 * type: CSV
 * path: /data/dvf/2023/33.csv
 * delimiter: ","
 * chunkSize: 5000
 * locale: fr-FR
 * dateFormats: [ "yyyy-MM-dd", "dd/MM/yyyy" ]
 * retryLimit: 2
 * </pre>
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Getter
@Setter
@ToString
public class SourceConfig {

    /**
     * Name of the source (e.g., "dvf-2023-33")
     */
    private String name;

    /**
     * Type of source. Only CSV is supported.
     */
    private String type;

    /**
     * Chunk size: rows per transaction (default: 1000)
     */
    private Integer chunkSize;

    // ── CSV ──────────────────────────────────────────────────────────────────

    /** Chemin vers un fichier CSV, ou vers un repertoire de fichiers *.csv */
    private String path;

    /** Delimiteur CSV (defaut : ",") */
    private String delimiter = ",";

    /** Ignorer la ligne d'en-tete (defaut : true) */
    private boolean skipHeader = true;

    /** Encodage des fichiers (defaut : UTF-8) */
    private String encoding = "UTF-8";

    /**
     * Noms de colonnes explicites, dans l'ordre du fichier.
     * Si vide, les noms sont lus dans la ligne d'en-tete.
     */
    private List<String> columns = new ArrayList<>();

    // ── Parsing ──────────────────────────────────────────────────────────────

    /**
     * Locale des nombres (separateurs decimal et de milliers), tag BCP 47.
     */
    private String locale = "fr-FR";

    /**
     * Formats de date acceptes, essayes dans l'ordre.
     */
    private List<String> dateFormats = new ArrayList<>(List.of("yyyy-MM-dd", "dd/MM/yyyy"));

    // ── Retry ────────────────────────────────────────────────────────────────

    /**
     * Nombre maximal de tentatives d'ecriture d'un chunk (defaut : 2, soit un retry).
     */
    private int retryLimit = 2;

    /** Backoff initial entre deux tentatives, en millisecondes. */
    private long backoffInitialMillis = 200;

    /** Backoff maximal entre deux tentatives, en millisecondes. */
    private long backoffMaxMillis = 5000;

    /**
     * Gets the chunk size, returning 1000 if not configured.
     *
     * @return the chunk size
     */
    public Integer getChunkSize() {
        return chunkSize != null && chunkSize > 0 ? chunkSize : 1000;
    }

    /**
     * Extracts the explicit column names as a String array.
     *
     * @return array of column names, empty when names come from the header
     */
    public String[] getColumnNames() {
        if (columns == null || columns.isEmpty()) {
            return new String[0];
        }
        return columns.stream()
                .map(c -> c.strip().toLowerCase(Locale.ROOT))
                .toArray(String[]::new);
    }

    /**
     * @return true if column names must be taken from the header line
     */
    public boolean isHeaderNamed() {
        return columns == null || columns.isEmpty();
    }

    /**
     * @return the parsed number locale
     */
    public Locale getNumberLocale() {
        return Locale.forLanguageTag(locale);
    }

    /**
     * Validates the configuration.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new IllegalStateException("Source name is required");
        }

        if (type == null || type.isBlank()) {
            throw new IllegalStateException("Source type is required for source: " + name);
        }

        if (!"CSV".equalsIgnoreCase(type)) {
            throw new IllegalStateException(
                "Unsupported source type '" + type + "' for source: " + name + ". Supported types: CSV");
        }

        // ── Validation CSV ───────────────────────────────────────────────────
        if (path == null || path.isBlank()) {
            throw new IllegalStateException("Path is required for CSV source: " + name);
        }
        if (delimiter == null || delimiter.isEmpty()) {
            throw new IllegalStateException("Delimiter is required for CSV source: " + name);
        }
        if (!skipHeader && isHeaderNamed()) {
            throw new IllegalStateException(
                "Columns configuration is required when skipHeader=false for source: " + name);
        }
        if (columns != null) {
            for (int i = 0; i < columns.size(); i++) {
                String col = columns.get(i);
                if (col == null || col.isBlank()) {
                    throw new IllegalStateException(
                        String.format("Column name is required at index %d for source: %s", i, name));
                }
            }
        }

        // ── Validation parsing ───────────────────────────────────────────────
        if (locale == null || locale.isBlank()) {
            throw new IllegalStateException("locale is required for source: " + name);
        }
        try {
            new Locale.Builder().setLanguageTag(locale);
        } catch (IllformedLocaleException e) {
            throw new IllegalStateException("locale is invalid: '" + locale + "' for source: " + name);
        }
        if (dateFormats == null || dateFormats.isEmpty()) {
            throw new IllegalStateException("At least one date format is required for source: " + name);
        }
        for (String format : dateFormats) {
            try {
                DateTimeFormatter.ofPattern(format);
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException(
                    "Date format is invalid: '" + format + "' for source: " + name);
            }
        }

        if (chunkSize != null && chunkSize <= 0) {
            throw new IllegalStateException("Chunk size must be positive for source: " + name);
        }

        // ── Validation retry ─────────────────────────────────────────────────
        if (retryLimit < 1) {
            throw new IllegalStateException("retryLimit must be >= 1 for source: " + name);
        }
        if (backoffInitialMillis < 0 || backoffMaxMillis < backoffInitialMillis) {
            throw new IllegalStateException(
                "backoff settings are invalid (0 <= backoffInitialMillis <= backoffMaxMillis) for source: " + name);
        }
    }
}
