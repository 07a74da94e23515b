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
 * Business key of a {@link Bien}: the parcel at a resolved location plus its descriptive attributes.
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Value
public class BienKey {

    String parcelId;
    long localisationId;
    String propertyType;
    BigDecimal builtSurface;
    BigDecimal landSurface;
    Integer roomCount;

    /**
     * @param record         a parsed row
     * @param localisationId the id its location resolved to
     * @return the key of the property unit the row describes
     */
    public static BienKey of(ParsedRecord record, long localisationId) {
        return new BienKey(
                record.getParcelId(),
                localisationId,
                record.getPropertyType(),
                Decimals.amount(record.getBuiltSurface()),
                Decimals.amount(record.getLandSurface()),
                record.getRoomCount());
    }
}
