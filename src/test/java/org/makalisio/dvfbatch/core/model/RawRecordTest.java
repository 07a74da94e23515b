package org.makalisio.dvfbatch.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RawRecordTest {

    // ── put / get ────────────────────────────────────────────────────────────

    @Test
    void put_andGet_returnsRawText() {
        RawRecord record = new RawRecord(3);
        record.put("nom_commune", "  Bordeaux ");
        assertThat(record.get("nom_commune")).isEqualTo("  Bordeaux ");
        assertThat(record.getLineNumber()).isEqualTo(3);
    }

    @Test
    void put_blankColumn_throws() {
        RawRecord record = new RawRecord();
        assertThatIllegalArgumentException()
                .isThrownBy(() -> record.put(" ", "x"))
                .withMessageContaining("Column name cannot be null or blank");
    }

    @Test
    void put_nullColumn_throws() {
        RawRecord record = new RawRecord();
        assertThatIllegalArgumentException()
                .isThrownBy(() -> record.put(null, "x"));
    }

    // ── getText ──────────────────────────────────────────────────────────────

    @Test
    void getText_trimsValue() {
        RawRecord record = new RawRecord(2, Map.of("code_postal", " 33000 "));
        assertThat(record.getText("code_postal")).isEqualTo("33000");
    }

    @Test
    void getText_blankValue_isAbsent() {
        RawRecord record = new RawRecord(2, Map.of("adresse_suffixe", "   "));
        assertThat(record.getText("adresse_suffixe")).isNull();
        assertThat(record.containsKey("adresse_suffixe")).isTrue();
    }

    @Test
    void getText_unknownColumn_isAbsent() {
        assertThat(new RawRecord().getText("longitude")).isNull();
    }

    // ── Divers ───────────────────────────────────────────────────────────────

    @Test
    void constructor_nullInitialValues_createsEmptyRecord() {
        RawRecord record = new RawRecord(1, null);
        assertThat(record.isEmpty()).isTrue();
        assertThat(record.size()).isZero();
    }

    @Test
    void getValues_isUnmodifiable() {
        RawRecord record = new RawRecord(1, Map.of("id_mutation", "M1"));
        assertThatThrownBy(() -> record.getValues().put("x", "y"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void equals_sameLineAndValues_areEqual() {
        Map<String, String> values = new HashMap<>();
        values.put("id_mutation", "M1");
        values.put("valeur_fonciere", null);
        assertThat(new RawRecord(5, values)).isEqualTo(new RawRecord(5, values));
        assertThat(new RawRecord(5, values)).isNotEqualTo(new RawRecord(6, values));
    }
}
