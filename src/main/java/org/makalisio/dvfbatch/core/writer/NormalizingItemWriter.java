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
package org.makalisio.dvfbatch.core.writer;

import lombok.extern.slf4j.Slf4j;
import org.makalisio.dvfbatch.core.exception.IntegrityConflictException;
import org.makalisio.dvfbatch.core.model.Bien;
import org.makalisio.dvfbatch.core.model.BienKey;
import org.makalisio.dvfbatch.core.model.EntityType;
import org.makalisio.dvfbatch.core.model.Localisation;
import org.makalisio.dvfbatch.core.model.LocalisationKey;
import org.makalisio.dvfbatch.core.model.LotKey;
import org.makalisio.dvfbatch.core.model.Mutation;
import org.makalisio.dvfbatch.core.model.MutationBienKey;
import org.makalisio.dvfbatch.core.model.ParsedLot;
import org.makalisio.dvfbatch.core.model.ParsedRecord;
import org.makalisio.dvfbatch.core.relation.RelationshipBuilder;
import org.makalisio.dvfbatch.core.relation.Relationships;
import org.makalisio.dvfbatch.core.resolver.IdentityResolver;
import org.makalisio.dvfbatch.core.resolver.Resolution;
import org.makalisio.dvfbatch.core.statistics.ChunkStatistics;
import org.makalisio.dvfbatch.core.statistics.SourceStatistics;
import org.springframework.batch.item.Chunk;
import org.springframework.batch.item.ItemWriter;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writer du step d'ingestion : normalise un chunk de {@link ParsedRecord} et
 * l'écrit via le {@link BatchLoader}.
 *
 * <p>Pour chaque record, dans l'ordre du chunk :</p>
 * <ol>
 *   <li>résolution de la Localisation, puis du Bien (qui dépend de son id)</li>
 *   <li>résolution des Lots (qui dépendent de l'id du Bien)</li>
 *   <li>vérification d'existence de la Mutation et de l'association (mutation, bien)</li>
 *   <li>construction des lignes d'association par le {@link RelationshipBuilder}</li>
 * </ol>
 *
 * <p>Les ids attribués pendant le chunk restent en attente dans le resolver jusqu'à la
 * fin de la transaction : validés au commit, oubliés au rollback. Les compteurs du chunk
 * ne sont ajoutés aux statistiques de la source qu'au commit.</p>
 *
 * @author Makalisio
 * @since 0.0.1
 */
@Slf4j
public class NormalizingItemWriter implements ItemWriter<ParsedRecord> {

    private final String sourceName;
    private final IdentityResolver identityResolver;
    private final RelationshipBuilder relationshipBuilder;
    private final BatchLoader batchLoader;
    private final SourceStatistics statistics;

    public NormalizingItemWriter(String sourceName,
                                 IdentityResolver identityResolver,
                                 RelationshipBuilder relationshipBuilder,
                                 BatchLoader batchLoader,
                                 SourceStatistics statistics) {
        this.sourceName = sourceName;
        this.identityResolver = identityResolver;
        this.relationshipBuilder = relationshipBuilder;
        this.batchLoader = batchLoader;
        this.statistics = statistics;
    }

    @Override
    public void write(Chunk<? extends ParsedRecord> chunk) {
        if (chunk.isEmpty()) {
            log.debug("Source '{}' — chunk vide, rien à écrire", sourceName);
            return;
        }

        // rechargement après un conflit d'intégrité
        identityResolver.ensureFresh();

        ChunkStatistics chunkStats = new ChunkStatistics();
        boolean transactional = TransactionSynchronizationManager.isSynchronizationActive();
        if (transactional) {
            TransactionSynchronizationManager.registerSynchronization(new ResolverSynchronization(chunkStats));
        }

        LoadReport report;
        try {
            LoadBatch batch = normalize(chunk, chunkStats);
            report = batchLoader.load(batch);
        } catch (IntegrityConflictException e) {
            log.warn("Source '{}' — integrity conflict on {}, chunk of {} record(s) rolled back",
                    sourceName, e.getEntityType(), chunk.size());
            statistics.recordIntegrityConflict();
            identityResolver.invalidate();
            if (!transactional) {
                identityResolver.discardPending();
            }
            throw e;
        } catch (RuntimeException e) {
            if (!transactional) {
                identityResolver.discardPending();
            }
            throw e;
        }

        for (EntityType type : EntityType.values()) {
            chunkStats.recordCreated(type, report.getWritten(type));
            chunkStats.recordConfirmed(type, report.getConfirmed(type));
        }
        if (!transactional) {
            identityResolver.commitPending();
            statistics.merge(chunkStats);
        }

        log.info("Source '{}' — chunk écrit : {} record(s), {}", sourceName, chunk.size(), chunkStats);
    }

    // ─── Normalisation ───────────────────────────────────────────────────────

    private LoadBatch normalize(Chunk<? extends ParsedRecord> chunk, ChunkStatistics chunkStats) {
        LoadBatch batch = new LoadBatch();

        for (ParsedRecord record : chunk) {
            Resolution localisation = identityResolver.resolveLocalisation(LocalisationKey.of(record));
            if (localisation.isCreated()) {
                batch.addLocalisation(toLocalisation(record, localisation.getId()));
            }

            BienKey bienKey = BienKey.of(record, localisation.getId());
            Resolution bien = identityResolver.resolveBien(bienKey);
            if (bien.isCreated()) {
                batch.addBien(toBien(bienKey, bien.getId()));
            }

            Map<ParsedLot, Resolution> lots = new LinkedHashMap<>();
            for (ParsedLot lot : record.getLots()) {
                lots.put(lot, identityResolver.resolveLot(new LotKey(bien.getId(), lot.getNumber())));
            }

            if (identityResolver.resolveMutation(record.getMutationId())) {
                batch.addMutation(Mutation.builder()
                        .mutationId(record.getMutationId())
                        .dispositionNumber(record.getDispositionNumber())
                        .nature(record.getNature())
                        .date(record.getMutationDate())
                        .build());
            }

            boolean newAssociation = identityResolver.resolveAssociation(
                    new MutationBienKey(record.getMutationId(), bien.getId()));
            Relationships relationships = relationshipBuilder.build(record, bien.getId(), lots, newAssociation);
            relationships.getNewLots().forEach(batch::addLot);
            if (relationships.isDuplicateAssociation()) {
                chunkStats.recordDuplicateAssociation();
            } else {
                batch.addAssociation(relationships.getAssociation());
            }

            chunkStats.recordLotsWithoutSurface(record.getLotsWithoutSurface());
            chunkStats.recordAccepted();
        }
        return batch;
    }

    private static Localisation toLocalisation(ParsedRecord record, long id) {
        LocalisationKey key = LocalisationKey.of(record);
        return Localisation.builder()
                .id(id)
                .addressNumber(key.getAddressNumber())
                .addressSuffix(key.getAddressSuffix())
                .streetName(key.getStreetName())
                .postalCode(key.getPostalCode())
                .departmentCode(key.getDepartmentCode())
                .communeCode(key.getCommuneCode())
                .communeName(key.getCommuneName())
                .longitude(key.getLongitude())
                .latitude(key.getLatitude())
                .observationDate(record.getMutationDate())
                .build();
    }

    private static Bien toBien(BienKey key, long id) {
        return Bien.builder()
                .id(id)
                .parcelId(key.getParcelId())
                .localisationId(key.getLocalisationId())
                .propertyType(key.getPropertyType())
                .builtSurface(key.getBuiltSurface())
                .landSurface(key.getLandSurface())
                .roomCount(key.getRoomCount())
                .build();
    }

    /**
     * Valide ou annule les clés en attente selon l'issue de la transaction du chunk.
     */
    private final class ResolverSynchronization implements TransactionSynchronization {

        private final ChunkStatistics chunkStats;

        private ResolverSynchronization(ChunkStatistics chunkStats) {
            this.chunkStats = chunkStats;
        }

        @Override
        public void afterCompletion(int status) {
            if (status == STATUS_COMMITTED) {
                identityResolver.commitPending();
                statistics.merge(chunkStats);
            } else {
                identityResolver.discardPending();
                log.debug("Source '{}' — transaction annulée, ids en attente oubliés", sourceName);
            }
        }
    }
}
