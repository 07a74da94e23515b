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

import lombok.Value;

import java.math.BigDecimal;

/**
 * Business key of a {@link Localisation}: every address, commune and coordinate field.
 *
 * <p>A {@code null} component means "unknown" and only matches another unknown;
 * it is never a wildcard. The observation date is not part of the key.</p>
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Value
public class LocalisationKey {

    String addressNumber;
    String addressSuffix;
    String streetName;
    String postalCode;
    String departmentCode;
    String communeCode;
    String communeName;
    BigDecimal longitude;
    BigDecimal latitude;

    /**
     * @param record a parsed row
     * @return the key of the location the row describes
     */
    public static LocalisationKey of(ParsedRecord record) {
        return new LocalisationKey(
                record.getAddressNumber(),
                record.getAddressSuffix(),
                record.getStreetName(),
                record.getPostalCode(),
                record.getDepartmentCode(),
                record.getCommuneCode(),
                record.getCommuneName(),
                Decimals.coordinate(record.getLongitude()),
                Decimals.coordinate(record.getLatitude()));
    }
}
