package org.makalisio.dvfbatch.core.processor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.makalisio.dvfbatch.core.exception.InvalidValueException;
import org.makalisio.dvfbatch.core.exception.MalformedRecordException;
import org.makalisio.dvfbatch.core.exception.RecordRejectedException;
import org.makalisio.dvfbatch.core.exception.RejectionReason;
import org.makalisio.dvfbatch.core.model.ParsedLot;
import org.makalisio.dvfbatch.core.model.ParsedRecord;
import org.makalisio.dvfbatch.core.model.RawRecord;
import org.makalisio.dvfbatch.core.model.SourceConfig;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DvfRecordParserTest {

    private DvfRecordParser parser;

    @BeforeEach
    void setUp() {
        SourceConfig config = new SourceConfig();
        config.setName("dvf-33");
        config.setType("CSV");
        config.setPath("/data/dvf/33.csv");
        parser = new DvfRecordParser(config);
    }

    // ── Ligne valide ─────────────────────────────────────────────────────────

    @Test
    void process_completeRow_mapsEveryField() {
        ParsedRecord record = parser.process(validRow());

        assertThat(record.getLineNumber()).isEqualTo(2);
        assertThat(record.getMutationId()).isEqualTo("2023-1");
        assertThat(record.getMutationDate()).isEqualTo(LocalDate.of(2023, 1, 5));
        assertThat(record.getDispositionNumber()).isEqualTo(1);
        assertThat(record.getNature()).isEqualTo("Vente");
        assertThat(record.getValue()).isEqualTo(new BigDecimal("200000.00"));
        assertThat(record.getAddressNumber()).isEqualTo("12");
        assertThat(record.getStreetName()).isEqualTo("RUE SAINTE-CATHERINE");
        assertThat(record.getDepartmentCode()).isEqualTo("33");
        assertThat(record.getCommuneName()).isEqualTo("Bordeaux");
        assertThat(record.getLongitude()).isEqualTo(new BigDecimal("-0.5736000000"));
        assertThat(record.getParcelId()).isEqualTo("P1");
        assertThat(record.getPropertyType()).isEqualTo("Appartement");
        assertThat(record.getBuiltSurface()).isEqualTo(new BigDecimal("80.00"));
        assertThat(record.getRoomCount()).isEqualTo(3);
        assertThat(record.getLots()).containsExactly(new ParsedLot("L1", new BigDecimal("30.00")));
        assertThat(record.getLotsWithoutSurface()).isZero();
    }

    @Test
    void process_blankOptionalFields_areAbsent() {
        RawRecord raw = validRow();
        raw.put("valeur_fonciere", "");
        raw.put("adresse_numero", "  ");
        raw.put("longitude", "");
        raw.put("nombre_pieces_principales", "");

        ParsedRecord record = parser.process(raw);

        assertThat(record.getValue()).isNull();
        assertThat(record.getAddressNumber()).isNull();
        assertThat(record.getLongitude()).isNull();
        assertThat(record.getRoomCount()).isNull();
        assertThat(record.getAddressSuffix()).isNull();
    }

    @Test
    void process_frenchDateAndNumbers_areParsed() {
        RawRecord raw = validRow();
        raw.put("date_mutation", "15/02/2023");
        raw.put("valeur_fonciere", "150000,50");
        raw.put("surface_terrain", "1 200");

        ParsedRecord record = parser.process(raw);

        assertThat(record.getMutationDate()).isEqualTo(LocalDate.of(2023, 2, 15));
        assertThat(record.getValue()).isEqualTo(new BigDecimal("150000.50"));
        assertThat(record.getLandSurface()).isEqualTo(new BigDecimal("1200.00"));
    }

    @Test
    void process_unknownColumns_areIgnored() {
        RawRecord raw = validRow();
        raw.put("code_nature_culture", "S");
        assertThatNoException().isThrownBy(() -> parser.process(raw));
    }

    // ── Lots ─────────────────────────────────────────────────────────────────

    @Test
    void process_lotWithoutSurface_isDroppedAndCounted() {
        RawRecord raw = validRow();
        raw.put("lot2_numero", "L3");
        raw.put("lot2_surface_carrez", "");

        ParsedRecord record = parser.process(raw);

        assertThat(record.getLots()).extracting(ParsedLot::getNumber).containsExactly("L1");
        assertThat(record.getLotsWithoutSurface()).isEqualTo(1);
    }

    @Test
    void process_repeatedLotNumber_firstOccurrenceWins() {
        RawRecord raw = validRow();
        raw.put("lot2_numero", "L1");
        raw.put("lot2_surface_carrez", "99");
        raw.put("lot5_numero", "L5");
        raw.put("lot5_surface_carrez", "12,25");

        ParsedRecord record = parser.process(raw);

        assertThat(record.getLots()).containsExactly(
                new ParsedLot("L1", new BigDecimal("30.00")),
                new ParsedLot("L5", new BigDecimal("12.25")));
    }

    @Test
    void process_surfaceWithoutLotNumber_isIgnored() {
        RawRecord raw = validRow();
        raw.put("lot2_surface_carrez", "15");

        assertThat(parser.process(raw).getLots()).hasSize(1);
    }

    // ── Rejets ───────────────────────────────────────────────────────────────

    @Test
    void process_impossibleDate_isMalformed() {
        RawRecord raw = validRow();
        raw.put("date_mutation", "2023-02-30");

        assertThatThrownBy(() -> parser.process(raw))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("'2023-02-30' is not a date in any accepted format");
    }

    @Test
    void process_missingMutationId_isMalformed() {
        RawRecord raw = validRow();
        raw.put("id_mutation", " ");

        assertThatThrownBy(() -> parser.process(raw))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessage("Required field 'id_mutation' is absent");
    }

    @Test
    void process_missingDepartment_isMalformed() {
        RawRecord raw = validRow();
        raw.put("code_departement", "");

        assertThatThrownBy(() -> parser.process(raw))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("code_departement");
    }

    @Test
    void process_unparsableNumber_isMalformed() {
        RawRecord raw = validRow();
        raw.put("surface_reelle_bati", "quatre-vingts");

        assertThatThrownBy(() -> parser.process(raw))
                .isInstanceOf(RecordRejectedException.class)
                .extracting(e -> ((RecordRejectedException) e).getReason())
                .isEqualTo(RejectionReason.MALFORMED_RECORD);
    }

    @Test
    void process_negativeSurface_isInvalidValue() {
        RawRecord raw = validRow();
        raw.put("surface_reelle_bati", "-5");

        assertThatThrownBy(() -> parser.process(raw))
                .isInstanceOf(InvalidValueException.class)
                .hasMessage("'surface_reelle_bati' must not be negative")
                .extracting(e -> ((InvalidValueException) e).getField())
                .isEqualTo("surface_reelle_bati");
    }

    @Test
    void process_negativeValue_isInvalidValue() {
        RawRecord raw = validRow();
        raw.put("valeur_fonciere", "-1");

        assertThatThrownBy(() -> parser.process(raw))
                .isInstanceOf(InvalidValueException.class);
    }

    @Test
    void process_negativeLotSurface_isInvalidValue() {
        RawRecord raw = validRow();
        raw.put("lot1_surface_carrez", "-30");

        assertThatThrownBy(() -> parser.process(raw))
                .isInstanceOf(InvalidValueException.class)
                .hasMessageContaining("lot1_surface_carrez");
    }

    @Test
    void process_negativeRoomCount_isInvalidValue() {
        RawRecord raw = validRow();
        raw.put("nombre_pieces_principales", "-2");

        assertThatThrownBy(() -> parser.process(raw))
                .isInstanceOf(InvalidValueException.class);
    }

    @Test
    void process_negativeCoordinate_isAccepted() {
        RawRecord raw = validRow();
        raw.put("longitude", "-1.25");

        assertThat(parser.process(raw).getLongitude()).isEqualByComparingTo("-1.25");
    }

    // ── Rejets : valeurs trop grandes pour la base ───────────────────────────

    @Test
    void process_valueAboveAmountPrecision_isInvalidValue() {
        RawRecord raw = validRow();
        raw.put("valeur_fonciere", "99999999999999999");

        assertThatThrownBy(() -> parser.process(raw))
                .isInstanceOf(InvalidValueException.class)
                .hasMessage("'valeur_fonciere' has more than 13 integer digits")
                .extracting(e -> ((InvalidValueException) e).getField())
                .isEqualTo("valeur_fonciere");
    }

    @Test
    void process_valueWithThirteenIntegerDigits_isAccepted() {
        RawRecord raw = validRow();
        raw.put("valeur_fonciere", "9999999999999,99");

        assertThat(parser.process(raw).getValue()).isEqualTo(new BigDecimal("9999999999999.99"));
    }

    @Test
    void process_valueRoundedAbovePrecision_isInvalidValue() {
        RawRecord raw = validRow();
        raw.put("valeur_fonciere", "9999999999999,999");

        assertThatThrownBy(() -> parser.process(raw)).isInstanceOf(InvalidValueException.class);
    }

    @Test
    void process_oversizedLotSurface_isInvalidValue() {
        RawRecord raw = validRow();
        raw.put("lot1_surface_carrez", "12345678901234");

        assertThatThrownBy(() -> parser.process(raw))
                .isInstanceOf(InvalidValueException.class)
                .hasMessageContaining("lot1_surface_carrez");
    }

    @Test
    void process_coordinateAbovePrecision_isInvalidValue() {
        RawRecord raw = validRow();
        raw.put("latitude", "448404");

        assertThatThrownBy(() -> parser.process(raw))
                .isInstanceOf(InvalidValueException.class)
                .hasMessage("'latitude' has more than 5 integer digits");
    }

    @Test
    void process_communeNameLongerThanColumn_isInvalidValue() {
        RawRecord raw = validRow();
        raw.put("nom_commune", "B".repeat(55));

        assertThatThrownBy(() -> parser.process(raw))
                .isInstanceOf(InvalidValueException.class)
                .hasMessage("'nom_commune' is longer than 50 characters")
                .extracting(e -> ((InvalidValueException) e).getField())
                .isEqualTo("nom_commune");
    }

    @Test
    void process_textAtColumnLength_isAccepted() {
        RawRecord raw = validRow();
        raw.put("nom_commune", "B".repeat(50));
        raw.put("id_mutation", "M".repeat(30));

        ParsedRecord record = parser.process(raw);

        assertThat(record.getCommuneName()).hasSize(50);
        assertThat(record.getMutationId()).hasSize(30);
    }

    @Test
    void process_lengthIsCheckedAfterTrimming() {
        RawRecord raw = validRow();
        raw.put("adresse_suffixe", "  BIS  ");

        assertThat(parser.process(raw).getAddressSuffix()).isEqualTo("BIS");
    }

    @Test
    void process_overlongMutationIdOrLotNumber_isInvalidValue() {
        RawRecord longId = validRow();
        longId.put("id_mutation", "M".repeat(31));
        RawRecord longLot = validRow();
        longLot.put("lot1_numero", "L12345678901");

        assertThatThrownBy(() -> parser.process(longId))
                .isInstanceOf(InvalidValueException.class)
                .hasMessageContaining("id_mutation");
        assertThatThrownBy(() -> parser.process(longLot))
                .isInstanceOf(InvalidValueException.class)
                .hasMessageContaining("lot1_numero");
    }

    @Test
    void process_exponentNotation_isMalformed() {
        RawRecord raw = validRow();
        raw.put("valeur_fonciere", "1E999999999");

        assertThatThrownBy(() -> parser.process(raw))
                .isInstanceOf(MalformedRecordException.class)
                .extracting(e -> ((MalformedRecordException) e).getField())
                .isEqualTo("valeur_fonciere");
    }

    // ── Configuration ────────────────────────────────────────────────────────

    @Test
    void constructor_nullConfig_throws() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new DvfRecordParser(null));
    }

    @Test
    void process_onlyConfiguredDateFormats_areAccepted() {
        SourceConfig config = new SourceConfig();
        config.setName("iso-only");
        config.setDateFormats(List.of("yyyy-MM-dd"));
        DvfRecordParser isoOnly = new DvfRecordParser(config);

        RawRecord raw = validRow();
        raw.put("date_mutation", "05/01/2023");

        assertThatThrownBy(() -> isoOnly.process(raw)).isInstanceOf(MalformedRecordException.class);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static RawRecord validRow() {
        RawRecord raw = new RawRecord(2);
        raw.put("id_mutation", "2023-1");
        raw.put("date_mutation", "2023-01-05");
        raw.put("numero_disposition", "000001");
        raw.put("nature_mutation", "Vente");
        raw.put("valeur_fonciere", "200000");
        raw.put("adresse_numero", "12");
        raw.put("adresse_suffixe", "");
        raw.put("adresse_nom_voie", "RUE SAINTE-CATHERINE");
        raw.put("code_postal", "33000");
        raw.put("code_commune", "33063");
        raw.put("nom_commune", "Bordeaux");
        raw.put("code_departement", "33");
        raw.put("id_parcelle", "P1");
        raw.put("lot1_numero", "L1");
        raw.put("lot1_surface_carrez", "30");
        raw.put("type_local", "Appartement");
        raw.put("surface_reelle_bati", "80");
        raw.put("nombre_pieces_principales", "3");
        raw.put("surface_terrain", "");
        raw.put("longitude", "-0.5736");
        raw.put("latitude", "44.8404");
        return raw;
    }
}
