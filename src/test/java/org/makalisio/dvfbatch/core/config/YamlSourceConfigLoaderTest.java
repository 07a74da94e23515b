package org.makalisio.dvfbatch.core.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.makalisio.dvfbatch.core.exception.ConfigurationLoadException;
import org.makalisio.dvfbatch.core.model.SourceConfig;
import org.springframework.core.io.DefaultResourceLoader;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.Locale;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for YamlSourceConfigLoader.
 *
 * Note: @Cacheable is a Spring AOP proxy, instantiating the class directly
 * bypasses caching.
 */
class YamlSourceConfigLoaderTest {

    private YamlSourceConfigLoader loader;

    @BeforeEach
    void setUp() {
        loader = new YamlSourceConfigLoader(new DefaultResourceLoader());
    }

    // ── Chargement normal ────────────────────────────────────────────────────

    @Test
    void load_headerNamedSource_returnsConfiguredSourceConfig() {
        SourceConfig config = loader.load("test-mixed");
        assertThat(config.getName()).isEqualTo("test-mixed");
        assertThat(config.getType()).isEqualToIgnoringCase("CSV");
        assertThat(config.getPath()).endsWith("mixed.csv");
        assertThat(config.getChunkSize()).isEqualTo(3);
        assertThat(config.getBackoffInitialMillis()).isEqualTo(10);
        assertThat(config.isHeaderNamed()).isTrue();
    }

    @Test
    void load_explicitColumns_keepsFileOrder() {
        SourceConfig config = loader.load("test-headerless");
        assertThat(config.isSkipHeader()).isFalse();
        assertThat(config.getDelimiter()).isEqualTo(";");
        assertThat(config.getColumnNames()).startsWith("id_mutation", "date_mutation", "numero_disposition");
        assertThat(config.getDateFormats()).containsExactly("dd/MM/yyyy", "yyyy-MM-dd");
    }

    @Test
    void load_omittedSettings_keepDefaults() {
        SourceConfig config = loader.load("test-directory");
        assertThat(config.getName()).isEqualTo("test-directory");
        assertThat(config.getChunkSize()).isEqualTo(1);
        assertThat(config.getRetryLimit()).isEqualTo(2);
        assertThat(config.getNumberLocale()).isEqualTo(Locale.FRANCE);
    }

    @Test
    void load_yamlWithoutName_setsNameFromSourceName() {
        assertThat(loader.load("test-scenario").getName()).isEqualTo("test-scenario");
    }

    // ── Validation du sourceName ─────────────────────────────────────────────

    @Test
    void load_nullSourceName_throwsIllegalArgument() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> loader.load(null))
                .withMessageContaining("Source name cannot be null or blank");
    }

    @Test
    void load_blankSourceName_throwsIllegalArgument() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> loader.load("  "));
    }

    // ── Protection contre path traversal ────────────────────────────────────

    @Test
    void load_dotDotInSourceName_throwsIllegalArgument() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> loader.load("../secret"))
                .withMessageContaining("invalid characters");
    }

    @Test
    void load_backslashInSourceName_throwsIllegalArgument() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> loader.load("windows\\path"))
                .withMessageContaining("invalid characters");
    }

    // ── Fichier introuvable ou invalide ──────────────────────────────────────

    @Test
    void load_nonExistentSource_throwsConfigurationLoadException() {
        assertThatThrownBy(() -> loader.load("does-not-exist-xyz"))
                .isInstanceOf(ConfigurationLoadException.class)
                .hasMessageContaining("does-not-exist-xyz")
                .hasMessageContaining("classpath:ingestion/does-not-exist-xyz.yml");
    }

    @Test
    void load_emptyFile_throwsConfigurationLoadException() {
        assertThatThrownBy(() -> loader.load("test-empty"))
                .isInstanceOf(ConfigurationLoadException.class)
                .hasMessageContaining("empty");
    }

    @Test
    void load_malformedYaml_wrapsParserError() {
        assertThatThrownBy(() -> loader.load("test-invalid-yaml"))
                .isInstanceOf(ConfigurationLoadException.class)
                .hasCauseInstanceOf(YAMLException.class)
                .satisfies(e -> assertThat(((ConfigurationLoadException) e).getSourceName())
                        .isEqualTo("test-invalid-yaml"));
    }

    @Test
    void load_unsupportedType_throwsConfigurationLoadException() {
        assertThatThrownBy(() -> loader.load("test-unsupported-type"))
                .isInstanceOf(ConfigurationLoadException.class)
                .hasMessageContaining("Unsupported source type 'XML'")
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
