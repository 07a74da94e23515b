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

/**
 * Row of the {@code LOCALISATION} relation.
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Value
@Builder
public class Localisation {

    long id;
    String addressNumber;
    String addressSuffix;
    String streetName;
    String postalCode;
    String departmentCode;
    String communeCode;
    String communeName;
    BigDecimal longitude;
    BigDecimal latitude;

    /** Date of the first mutation that referenced this location. */
    LocalDate observationDate;

    public LocalisationKey key() {
        return new LocalisationKey(addressNumber, addressSuffix, streetName, postalCode,
                departmentCode, communeCode, communeName, longitude, latitude);
    }
}
