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

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Scales applied to decimal fields, identical to the column precision of the schema.
 *
 * <p>Business keys compare decimals with {@link BigDecimal#equals}, which is
 * scale-sensitive. Both the parser and the stores rehydrating keys from the
 * database go through these methods, so {@code 80}, {@code 80,0} and the stored
 * {@code 80.00} all yield the same key component.</p>
 *
 * @author Makalisio
 * @since 0.0.1
 */
public final class Decimals {

    /** DECIMAL(15,2): surfaces and transaction values. */
    public static final int AMOUNT_SCALE = 2;

    /** DECIMAL(15,10): longitude and latitude. */
    public static final int COORDINATE_SCALE = 10;

    /** Digits left of the point in DECIMAL(15,2). */
    public static final int AMOUNT_INTEGER_DIGITS = 13;

    /** Digits left of the point in DECIMAL(15,10). */
    public static final int COORDINATE_INTEGER_DIGITS = 5;

    private Decimals() {
    }

    /**
     * @param value a surface or a value, may be null
     * @return the value at scale 2, or null
     */
    public static BigDecimal amount(BigDecimal value) {
        return value == null ? null : value.setScale(AMOUNT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * @param value a longitude or latitude, may be null
     * @return the value at scale 10, or null
     */
    public static BigDecimal coordinate(BigDecimal value) {
        return value == null ? null : value.setScale(COORDINATE_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * @param value a scaled decimal
     * @return the number of digits left of the decimal point, 0 for a pure fraction
     */
    public static int integerDigits(BigDecimal value) {
        return Math.max(value.precision() - value.scale(), 0);
    }
}
