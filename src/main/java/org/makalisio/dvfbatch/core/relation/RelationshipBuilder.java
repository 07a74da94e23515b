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

import lombok.extern.slf4j.Slf4j;
import org.makalisio.dvfbatch.core.model.Decimals;
import org.makalisio.dvfbatch.core.model.Lot;
import org.makalisio.dvfbatch.core.model.MutationBien;
import org.makalisio.dvfbatch.core.model.ParsedLot;
import org.makalisio.dvfbatch.core.model.ParsedRecord;
import org.makalisio.dvfbatch.core.resolver.Resolution;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the Lot and MutationBien rows of a record from ids already resolved.
 *
 * <p>A repeated (mutation, bien) pair is a duplicate association: the stored row
 * is kept as is, its value is neither summed nor overwritten.</p>
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Slf4j
@Component
public class RelationshipBuilder {

    /**
     * @param record         the parsed record
     * @param bienId         the id its Bien resolved to
     * @param lots           each lot of the record with the resolution of its (bien, number) key
     * @param newAssociation true if the (mutation, bien) pair was seen for the first time
     * @return the rows to write
     */
    public Relationships build(ParsedRecord record, long bienId,
                               Map<ParsedLot, Resolution> lots, boolean newAssociation) {
        List<Lot> newLots = new ArrayList<>();
        lots.forEach((lot, resolution) -> {
            if (resolution.isCreated()) {
                newLots.add(Lot.builder()
                        .id(resolution.getId())
                        .lotNumber(lot.getNumber())
                        .surface(lot.getSurface())
                        .bienId(bienId)
                        .build());
            }
        });

        if (!newAssociation) {
            log.debug("Line {} — mutation {} already linked to bien {}, association kept",
                    record.getLineNumber(), record.getMutationId(), bienId);
            return new Relationships(newLots, null);
        }

        MutationBien association = MutationBien.builder()
                .mutationId(record.getMutationId())
                .bienId(bienId)
                .value(Decimals.amount(record.getValue()))
                .build();
        return new Relationships(newLots, association);
    }
}
