package org.makalisio.dvfbatch.core.writer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.makalisio.dvfbatch.core.exception.IntegrityConflictException;
import org.makalisio.dvfbatch.core.exception.StorageUnavailableException;
import org.makalisio.dvfbatch.core.model.EntityType;
import org.makalisio.dvfbatch.core.model.ParsedLot;
import org.makalisio.dvfbatch.core.model.ParsedRecord;
import org.makalisio.dvfbatch.core.relation.RelationshipBuilder;
import org.makalisio.dvfbatch.core.resolver.IdentityResolver;
import org.makalisio.dvfbatch.core.resolver.Resolution;
import org.makalisio.dvfbatch.core.statistics.SourceStatistics;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.batch.item.Chunk;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NormalizingItemWriterTest {

    @Mock IdentityResolver identityResolver;
    @Mock BatchLoader batchLoader;

    private SourceStatistics statistics;
    private NormalizingItemWriter writer;

    @BeforeEach
    void setUp() {
        statistics = new SourceStatistics("dvf-33");
        writer = new NormalizingItemWriter("dvf-33", identityResolver, new RelationshipBuilder(),
                batchLoader, statistics);
    }

    @AfterEach
    void tearDown() {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }

    // ── Chunk vide ───────────────────────────────────────────────────────────

    @Test
    void write_emptyChunk_doesNothing() {
        writer.write(new Chunk<>());
        verifyNoInteractions(identityResolver, batchLoader);
    }

    // ── Normalisation ────────────────────────────────────────────────────────

    @Test
    void write_newRecord_buildsOneRowPerEntity() {
        stubAllNew();
        LoadReport report = new LoadReport();
        report.recordWritten(EntityType.LOCALISATION, 1);
        report.recordWritten(EntityType.MUTATION_BIEN, 1);
        when(batchLoader.load(any())).thenReturn(report);

        writer.write(new Chunk<>(List.of(record())));

        ArgumentCaptor<LoadBatch> captor = ArgumentCaptor.forClass(LoadBatch.class);
        verify(batchLoader).load(captor.capture());
        LoadBatch batch = captor.getValue();
        assertThat(batch.getLocalisations()).singleElement()
                .satisfies(l -> {
                    assertThat(l.getId()).isEqualTo(1L);
                    assertThat(l.getObservationDate()).isEqualTo(LocalDate.of(2023, 1, 5));
                });
        assertThat(batch.getBiens()).singleElement()
                .satisfies(b -> assertThat(b.getLocalisationId()).isEqualTo(1L));
        assertThat(batch.getLots()).singleElement()
                .satisfies(l -> assertThat(l.getBienId()).isEqualTo(5L));
        assertThat(batch.getMutations()).extracting("mutationId").containsExactly("M1");
        assertThat(batch.getAssociations()).singleElement()
                .satisfies(a -> assertThat(a.getBienId()).isEqualTo(5L));

        verify(identityResolver).commitPending();
        assertThat(statistics.getAccepted()).isEqualTo(1);
        assertThat(statistics.getCreated(EntityType.LOCALISATION)).isEqualTo(1);
        assertThat(statistics.getLotsWithoutSurface()).isEqualTo(1);
    }

    @Test
    void write_resolverRefreshedBeforeResolving() {
        stubAllNew();
        when(batchLoader.load(any())).thenReturn(new LoadReport());

        writer.write(new Chunk<>(List.of(record())));

        InOrder order = inOrder(identityResolver);
        order.verify(identityResolver).ensureFresh();
        order.verify(identityResolver).resolveLocalisation(any());
    }

    @Test
    void write_knownAssociation_isCountedAsDuplicate() {
        when(identityResolver.resolveLocalisation(any())).thenReturn(Resolution.existing(1L));
        when(identityResolver.resolveBien(any())).thenReturn(Resolution.existing(5L));
        when(identityResolver.resolveLot(any())).thenReturn(Resolution.existing(2L));
        when(identityResolver.resolveMutation("M1")).thenReturn(false);
        when(identityResolver.resolveAssociation(any())).thenReturn(false);
        when(batchLoader.load(any())).thenReturn(new LoadReport());

        writer.write(new Chunk<>(List.of(record())));

        ArgumentCaptor<LoadBatch> captor = ArgumentCaptor.forClass(LoadBatch.class);
        verify(batchLoader).load(captor.capture());
        assertThat(captor.getValue().isEmpty()).isTrue();
        assertThat(statistics.getDuplicateAssociations()).isEqualTo(1);
        assertThat(statistics.getAccepted()).isEqualTo(1);
    }

    // ── Erreurs ──────────────────────────────────────────────────────────────

    @Test
    void write_integrityConflict_invalidatesResolverAndRethrows() {
        stubAllNew();
        when(batchLoader.load(any())).thenThrow(new IntegrityConflictException(EntityType.BIEN, "conflict"));

        assertThatThrownBy(() -> writer.write(new Chunk<>(List.of(record()))))
                .isInstanceOf(IntegrityConflictException.class);

        verify(identityResolver).invalidate();
        verify(identityResolver).discardPending();
        verify(identityResolver, never()).commitPending();
        assertThat(statistics.getIntegrityConflicts()).isEqualTo(1);
        assertThat(statistics.getAccepted()).isZero();
    }

    @Test
    void write_storageUnavailable_discardsPendingWithoutInvalidating() {
        stubAllNew();
        when(batchLoader.load(any())).thenThrow(new StorageUnavailableException("down",
                new DataAccessResourceFailureException("down")));

        assertThatThrownBy(() -> writer.write(new Chunk<>(List.of(record()))))
                .isInstanceOf(StorageUnavailableException.class);

        verify(identityResolver).discardPending();
        verify(identityResolver, never()).invalidate();
    }

    // ── Synchronisation transactionnelle ─────────────────────────────────────

    @Test
    void write_inTransaction_commitsResolverOnlyAfterCommit() {
        stubAllNew();
        when(batchLoader.load(any())).thenReturn(new LoadReport());
        TransactionSynchronizationManager.initSynchronization();

        writer.write(new Chunk<>(List.of(record())));

        verify(identityResolver, never()).commitPending();
        assertThat(statistics.getAccepted()).isZero();

        completeTransaction(TransactionSynchronization.STATUS_COMMITTED);

        verify(identityResolver).commitPending();
        assertThat(statistics.getAccepted()).isEqualTo(1);
    }

    @Test
    void write_inTransaction_rollbackDiscardsPending() {
        stubAllNew();
        when(batchLoader.load(any())).thenReturn(new LoadReport());
        TransactionSynchronizationManager.initSynchronization();

        writer.write(new Chunk<>(List.of(record())));
        completeTransaction(TransactionSynchronization.STATUS_ROLLED_BACK);

        verify(identityResolver).discardPending();
        verify(identityResolver, never()).commitPending();
        assertThat(statistics.getAccepted()).isZero();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private void stubAllNew() {
        when(identityResolver.resolveLocalisation(any())).thenReturn(Resolution.created(1L));
        when(identityResolver.resolveBien(any())).thenReturn(Resolution.created(5L));
        when(identityResolver.resolveLot(any())).thenReturn(Resolution.created(2L));
        when(identityResolver.resolveMutation("M1")).thenReturn(true);
        when(identityResolver.resolveAssociation(any())).thenReturn(true);
    }

    private static void completeTransaction(int status) {
        List<TransactionSynchronization> synchronizations = TransactionSynchronizationManager.getSynchronizations();
        TransactionSynchronizationManager.clearSynchronization();
        synchronizations.forEach(s -> s.afterCompletion(status));
    }

    private static ParsedRecord record() {
        return ParsedRecord.builder()
                .lineNumber(2)
                .mutationId("M1")
                .dispositionNumber(1)
                .nature("Vente")
                .mutationDate(LocalDate.of(2023, 1, 5))
                .value(new BigDecimal("200000.00"))
                .addressNumber("12")
                .streetName("RUE SAINTE-CATHERINE")
                .postalCode("33000")
                .departmentCode("33")
                .communeCode("33063")
                .communeName("Bordeaux")
                .parcelId("P1")
                .propertyType("Appartement")
                .builtSurface(new BigDecimal("80.00"))
                .roomCount(3)
                .lots(List.of(new ParsedLot("L1", new BigDecimal("30.00"))))
                .lotsWithoutSurface(1)
                .build();
    }
}
