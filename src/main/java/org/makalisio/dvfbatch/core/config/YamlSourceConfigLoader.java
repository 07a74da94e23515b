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
package org.makalisio.dvfbatch.core.config;

import lombok.extern.slf4j.Slf4j;
import org.makalisio.dvfbatch.core.exception.ConfigurationLoadException;
import org.makalisio.dvfbatch.core.model.SourceConfig;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads the description of a DVF source from {@code classpath:ingestion/{sourceName}.yml}.
 * A loaded configuration is validated once and then cached under the source name.
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Slf4j
@Component
public class YamlSourceConfigLoader {

    private static final String CONFIG_PATH_TEMPLATE = "classpath:ingestion/%s.yml";

    private final ResourceLoader resourceLoader;
    private final Yaml yaml;

    public YamlSourceConfigLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
        // SnakeYAML 2.x : constructeur type, pas de tags globaux
        this.yaml = new Yaml(new Constructor(SourceConfig.class, new LoaderOptions()));
    }

    /**
     * Loads and validates the configuration of a source.
     *
     * @param sourceName the name of the source (file name without .yml)
     * @return the validated configuration
     * @throws ConfigurationLoadException if the file is missing, unreadable, or invalid
     * @throws IllegalArgumentException   if sourceName is blank or contains path characters
     */
    @Cacheable(value = CacheConfiguration.SOURCE_CONFIGS, key = "#sourceName")
    public SourceConfig load(String sourceName) {
        validateSourceName(sourceName);

        String path = String.format(CONFIG_PATH_TEMPLATE, sourceName);
        Resource resource = resourceLoader.getResource(path);
        log.debug("Source '{}' — loading configuration from {}", sourceName, path);

        if (!resource.exists()) {
            log.error("Source '{}' — no configuration file at {}", sourceName, path);
            throw new ConfigurationLoadException(sourceName,
                    "No ingestion configuration found for source '" + sourceName + "' (expected " + path + ")");
        }

        SourceConfig config;
        try (InputStream in = resource.getInputStream()) {
            config = yaml.loadAs(in, SourceConfig.class);
        } catch (IOException e) {
            log.error("Source '{}' — failed to read {}", sourceName, path, e);
            throw new ConfigurationLoadException(sourceName,
                    "Failed to read configuration file for source '" + sourceName + "'", e);
        } catch (YAMLException e) {
            log.error("Source '{}' — YAML is invalid: {}", sourceName, e.getMessage());
            throw new ConfigurationLoadException(sourceName,
                    "Failed to parse YAML configuration for source '" + sourceName + "'", e);
        }

        if (config == null) {
            throw new ConfigurationLoadException(sourceName,
                    "Configuration file is empty for source: " + sourceName);
        }
        if (config.getName() == null || config.getName().isBlank()) {
            config.setName(sourceName);
        }

        try {
            config.validate();
        } catch (IllegalStateException e) {
            log.error("Source '{}' — invalid configuration: {}", sourceName, e.getMessage());
            throw new ConfigurationLoadException(sourceName, e.getMessage(), e);
        }

        log.info("Source '{}' — configuration loaded (path={}, chunkSize={}, locale={})",
                sourceName, config.getPath(), config.getChunkSize(), config.getLocale());
        return config;
    }

    private void validateSourceName(String sourceName) {
        if (sourceName == null || sourceName.isBlank()) {
            throw new IllegalArgumentException("Source name cannot be null or blank");
        }
        if (sourceName.contains("..") || sourceName.contains("/") || sourceName.contains("\\")) {
            throw new IllegalArgumentException("Source name contains invalid characters: " + sourceName);
        }
    }
}
