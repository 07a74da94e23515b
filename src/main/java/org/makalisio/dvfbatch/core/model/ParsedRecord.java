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

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * A source row after parsing: every field typed and cleaned, absent fields {@code null}.
 *
 * <p>Produced by {@code DvfRecordParser}; the identity resolver and the relationship
 * builder only ever work from this type.</p>
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Value
@Builder(toBuilder = true)
public class ParsedRecord {

    int lineNumber;

    // ── Mutation ─────────────────────────────────────────────────────────────
    String mutationId;
    int dispositionNumber;
    String nature;
    LocalDate mutationDate;
    BigDecimal value;

    // ── Localisation ─────────────────────────────────────────────────────────
    String addressNumber;
    String addressSuffix;
    String streetName;
    String postalCode;
    String departmentCode;
    String communeCode;
    String communeName;
    BigDecimal longitude;
    BigDecimal latitude;

    // ── Bien ─────────────────────────────────────────────────────────────────
    String parcelId;
    String propertyType;
    BigDecimal builtSurface;
    BigDecimal landSurface;
    Integer roomCount;

    // ── Lots ─────────────────────────────────────────────────────────────────
    @Builder.Default
    List<ParsedLot> lots = List.of();

    /** Lots named by the row but dropped because their surface was absent. */
    int lotsWithoutSurface;
}
