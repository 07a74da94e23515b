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
package org.makalisio.dvfbatch.core.relation;

import lombok.Value;
import org.makalisio.dvfbatch.core.model.Lot;
import org.makalisio.dvfbatch.core.model.MutationBien;

import java.util.List;

/**
 * Association rows derived from one parsed record.
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Value
public class Relationships {

    /** Lots seen for the first time, to be written. */
    List<Lot> newLots;

    /** The (mutation, bien) association, or null when the pair already exists. */
    MutationBien association;

    public boolean isDuplicateAssociation() {
        return association == null;
    }
}
