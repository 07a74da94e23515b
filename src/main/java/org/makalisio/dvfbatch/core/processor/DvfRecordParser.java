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

import lombok.extern.slf4j.Slf4j;
import org.makalisio.dvfbatch.core.exception.InvalidValueException;
import org.makalisio.dvfbatch.core.exception.MalformedRecordException;
import org.makalisio.dvfbatch.core.model.Decimals;
import org.makalisio.dvfbatch.core.model.ParsedLot;
import org.makalisio.dvfbatch.core.model.ParsedRecord;
import org.makalisio.dvfbatch.core.model.RawRecord;
import org.makalisio.dvfbatch.core.model.SourceConfig;
import org.springframework.batch.item.ItemProcessor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.makalisio.dvfbatch.core.processor.DvfColumns.*;

/**
 * Turns one raw DVF row into a {@link ParsedRecord}, or rejects it.
 *
 * <ul>
 *   <li>blank text is absent, never zero or empty</li>
 *   <li>numbers follow the source locale (see {@link LocaleNumberParser})</li>
 *   <li>dates are tried against each configured format, strictly</li>
 *   <li>surfaces, the transaction value and the room count must be nonnegative</li>
 *   <li>text, amounts and coordinates must fit their storage column</li>
 *   <li>id_mutation, date_mutation, numero_disposition and code_departement are required</li>
 * </ul>
 *
 * <p>Rejections are thrown as {@link MalformedRecordException} (absent or unparsable
 * field) or {@link InvalidValueException} (parsable but out of range). The processor
 * holds no state between rows.</p>
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Slf4j
public class DvfRecordParser implements ItemProcessor<RawRecord, ParsedRecord> {

    private final String sourceName;
    private final LocaleNumberParser numbers;
    private final List<DateTimeFormatter> dateFormatters;

    /**
     * @param config the source configuration (locale and date formats)
     */
    public DvfRecordParser(SourceConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("SourceConfig cannot be null");
        }
        this.sourceName = config.getName();
        this.numbers = new LocaleNumberParser(config.getNumberLocale());
        this.dateFormatters = new ArrayList<>();
        for (String pattern : config.getDateFormats()) {
            // STRICT refuses 'yyyy' without an era: use the proleptic year instead
            this.dateFormatters.add(DateTimeFormatter.ofPattern(pattern.replace('y', 'u'))
                    .withResolverStyle(ResolverStyle.STRICT));
        }
    }

    @Override
    public ParsedRecord process(RawRecord raw) {
        ParsedRecord.ParsedRecordBuilder builder = ParsedRecord.builder()
                .lineNumber(raw.getLineNumber());

        // ── Mutation ─────────────────────────────────────────────────────────
        builder.mutationId(required(raw, ID_MUTATION))
                .mutationDate(parseDate(DATE_MUTATION, required(raw, DATE_MUTATION)))
                .dispositionNumber(numbers.parseInteger(NUMERO_DISPOSITION, required(raw, NUMERO_DISPOSITION)))
                .nature(text(raw, NATURE_MUTATION))
                .value(amount(raw, VALEUR_FONCIERE));

        // ── Localisation ─────────────────────────────────────────────────────
        builder.departmentCode(required(raw, CODE_DEPARTEMENT))
                .addressNumber(text(raw, ADRESSE_NUMERO))
                .addressSuffix(text(raw, ADRESSE_SUFFIXE))
                .streetName(text(raw, ADRESSE_NOM_VOIE))
                .postalCode(text(raw, CODE_POSTAL))
                .communeCode(text(raw, CODE_COMMUNE))
                .communeName(text(raw, NOM_COMMUNE))
                .longitude(coordinate(raw, LONGITUDE))
                .latitude(coordinate(raw, LATITUDE));

        // ── Bien ─────────────────────────────────────────────────────────────
        builder.parcelId(text(raw, ID_PARCELLE))
                .propertyType(text(raw, TYPE_LOCAL))
                .builtSurface(amount(raw, SURFACE_REELLE_BATI))
                .landSurface(amount(raw, SURFACE_TERRAIN))
                .roomCount(nonNegativeInteger(raw, NOMBRE_PIECES_PRINCIPALES));

        // ── Lots ─────────────────────────────────────────────────────────────
        Map<String, ParsedLot> lots = new LinkedHashMap<>();
        int withoutSurface = 0;
        for (int i = 1; i <= MAX_LOTS; i++) {
            String number = text(raw, lotNumber(i));
            BigDecimal surface = amount(raw, lotSurface(i));
            if (number == null) {
                continue;
            }
            if (surface == null) {
                withoutSurface++;
                log.debug("Source '{}' — line {}: lot '{}' has no surface, dropped",
                        sourceName, raw.getLineNumber(), number);
                continue;
            }
            lots.putIfAbsent(number, new ParsedLot(number, surface));
        }
        builder.lots(List.copyOf(lots.values()))
                .lotsWithoutSurface(withoutSurface);

        return builder.build();
    }

    // ─── Conversions ─────────────────────────────────────────────────────────

    private String required(RawRecord raw, String field) {
        String text = text(raw, field);
        if (text == null) {
            throw new MalformedRecordException(field, raw.get(field),
                    "Required field '" + field + "' is absent");
        }
        return text;
    }

    private LocalDate parseDate(String field, String text) {
        for (DateTimeFormatter formatter : dateFormatters) {
            try {
                return LocalDate.parse(text, formatter);
            } catch (DateTimeParseException e) {
                // next format
            }
        }
        throw new MalformedRecordException(field, text, "'" + text + "' is not a date in any accepted format");
    }

    private String text(RawRecord raw, String field) {
        String text = raw.getText(field);
        Integer maxLength = maxLength(field);
        if (text != null && maxLength != null && text.length() > maxLength) {
            throw new InvalidValueException(field, raw.get(field),
                    "'" + field + "' is longer than " + maxLength + " characters");
        }
        return text;
    }

    private BigDecimal amount(RawRecord raw, String field) {
        BigDecimal value = Decimals.amount(nonNegativeDecimal(raw, field));
        if (value != null && Decimals.integerDigits(value) > Decimals.AMOUNT_INTEGER_DIGITS) {
            throw new InvalidValueException(field, raw.get(field),
                    "'" + field + "' has more than " + Decimals.AMOUNT_INTEGER_DIGITS + " integer digits");
        }
        return value;
    }

    private BigDecimal coordinate(RawRecord raw, String field) {
        BigDecimal value = Decimals.coordinate(decimal(raw, field));
        if (value != null && Decimals.integerDigits(value) > Decimals.COORDINATE_INTEGER_DIGITS) {
            throw new InvalidValueException(field, raw.get(field),
                    "'" + field + "' has more than " + Decimals.COORDINATE_INTEGER_DIGITS + " integer digits");
        }
        return value;
    }

    private BigDecimal decimal(RawRecord raw, String field) {
        String text = raw.getText(field);
        return text == null ? null : numbers.parseDecimal(field, text);
    }

    private BigDecimal nonNegativeDecimal(RawRecord raw, String field) {
        BigDecimal value = decimal(raw, field);
        if (value != null && value.signum() < 0) {
            throw new InvalidValueException(field, raw.get(field), "'" + field + "' must not be negative");
        }
        return value;
    }

    private Integer nonNegativeInteger(RawRecord raw, String field) {
        String text = raw.getText(field);
        if (text == null) {
            return null;
        }
        int value = numbers.parseInteger(field, text);
        if (value < 0) {
            throw new InvalidValueException(field, raw.get(field), "'" + field + "' must not be negative");
        }
        return value;
    }
}
