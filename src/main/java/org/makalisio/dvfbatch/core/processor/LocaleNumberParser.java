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

import org.makalisio.dvfbatch.core.exception.MalformedRecordException;

import java.math.BigDecimal;
import java.text.DecimalFormatSymbols;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parses numbers written with the decimal and grouping separators of a locale.
 *
 * <p>With {@code fr-FR}, {@code "1 234,50"} and {@code "1234,5"} are both accepted.
 * Unless the locale groups digits with dots, a {@code '.'} is read as a decimal
 * separator too, so the geolocalised export ({@code "-0.5792"}) parses under a
 * French locale.</p>
 *
 * <p>Only plain decimal notation is accepted: an exponent ({@code "2E5"}) or any
 * other character is a malformed number.</p>
 *
 * @author Makalisio
 * @since 0.0.1
 */
public class LocaleNumberParser {

    /** Sign, digits and at most one decimal point, once separators are normalized. */
    private static final Pattern PLAIN_DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");

    private final char decimalSeparator;
    private final char groupingSeparator;

    public LocaleNumberParser(Locale locale) {
        DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(locale);
        this.decimalSeparator = symbols.getDecimalSeparator();
        this.groupingSeparator = symbols.getGroupingSeparator();
    }

    /**
     * @param field column name, used in the error
     * @param text  trimmed, non-blank text
     * @return the parsed value, never null
     * @throws MalformedRecordException if the text is not a number
     */
    public BigDecimal parseDecimal(String field, String text) {
        StringBuilder normalized = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == decimalSeparator) {
                normalized.append('.');
            } else if (c != groupingSeparator && !Character.isSpaceChar(c) && !Character.isWhitespace(c)) {
                normalized.append(c);
            }
        }

        if (!PLAIN_DECIMAL.matcher(normalized).matches()) {
            throw new MalformedRecordException(field, text, "'" + text + "' is not a number");
        }
        try {
            return new BigDecimal(normalized.toString());
        } catch (NumberFormatException | ArithmeticException e) {
            throw new MalformedRecordException(field, text, "'" + text + "' is not a number", e);
        }
    }

    /**
     * Parses a whole number. A decimal with a zero fraction ({@code "3,0"}) is accepted.
     *
     * @param field column name, used in the error
     * @param text  trimmed, non-blank text
     * @return the parsed value
     * @throws MalformedRecordException if the text is not a whole number
     */
    public int parseInteger(String field, String text) {
        BigDecimal value = parseDecimal(field, text);
        try {
            return value.stripTrailingZeros().intValueExact();
        } catch (ArithmeticException e) {
            throw new MalformedRecordException(field, text, "'" + text + "' is not a whole number", e);
        }
    }
}
