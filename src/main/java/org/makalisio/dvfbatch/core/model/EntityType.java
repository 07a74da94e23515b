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

/**
 * The five relations of the normalized DVF schema.
 *
 * <p>Declaration order is the write order: a type is always persisted after
 * the types its foreign keys point to.</p>
 *
 * @author Makalisio
 * @since 0.0.1
 */
public enum EntityType {

    LOCALISATION("LOCALISATION"),
    BIEN("BIEN"),
    LOT("LOT"),
    MUTATION("MUTATION"),
    MUTATION_BIEN("MUTATION_BIEN");

    private final String tableName;

    EntityType(String tableName) {
        this.tableName = tableName;
    }

    public String getTableName() {
        return tableName;
    }
}
