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

import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Cache des configurations de source : une entree par nom de source, chargee
 * une seule fois par {@link YamlSourceConfigLoader} pour toute la duree de l'application.
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Configuration
@EnableCaching
public class CacheConfiguration {

    public static final String SOURCE_CONFIGS = "sourceConfigs";

    @Bean
    public CacheManager cacheManager() {
        // liste de caches fixe : pas de creation a la volee
        ConcurrentMapCacheManager cacheManager = new ConcurrentMapCacheManager(SOURCE_CONFIGS);
        cacheManager.setAllowNullValues(false);
        return cacheManager;
    }
}
