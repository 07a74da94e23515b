package org.makalisio.dvfbatch.core.resolver;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.makalisio.dvfbatch.core.exception.StorageUnavailableException;
import org.makalisio.dvfbatch.core.model.Bien;
import org.makalisio.dvfbatch.core.model.BienKey;
import org.makalisio.dvfbatch.core.model.EntityType;
import org.makalisio.dvfbatch.core.model.Localisation;
import org.makalisio.dvfbatch.core.model.LocalisationKey;
import org.makalisio.dvfbatch.core.model.Lot;
import org.makalisio.dvfbatch.core.model.LotKey;
import org.makalisio.dvfbatch.core.model.Mutation;
import org.makalisio.dvfbatch.core.model.MutationBien;
import org.makalisio.dvfbatch.core.model.MutationBienKey;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IdentityResolverTest {

    private static final LocalisationKey BORDEAUX = new LocalisationKey(
            "12", null, "RUE SAINTE-CATHERINE", "33000", "33", "33063", "Bordeaux", null, null);

    @Mock SurrogateKeyStore<LocalisationKey, Localisation> localisationStore;
    @Mock SurrogateKeyStore<BienKey, Bien> bienStore;
    @Mock SurrogateKeyStore<LotKey, Lot> lotStore;
    @Mock NaturalKeyStore<String, Mutation> mutationStore;
    @Mock NaturalKeyStore<MutationBienKey, MutationBien> mutationBienStore;

    private IdentityResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new IdentityResolver(localisationStore, bienStore, lotStore, mutationStore, mutationBienStore);
    }

    // ── reload ───────────────────────────────────────────────────────────────

    @Test
    void newResolver_isStale() {
        assertThat(resolver.isStale()).isTrue();
    }

    @Test
    void reload_loadsEveryStore() {
        stubStorage();

        resolver.reload();

        assertThat(resolver.isStale()).isFalse();
        assertThat(resolver.resolveLocalisation(BORDEAUX)).isEqualTo(Resolution.existing(4L));
        assertThat(resolver.resolveMutation("M1")).isFalse();
        assertThat(resolver.resolveMutation("M2")).isTrue();
        assertThat(resolver.resolveAssociation(new MutationBienKey("M1", 3L))).isFalse();
        assertThat(resolver.resolveBien(bienKey(4L))).isEqualTo(Resolution.created(11L));
        assertThat(resolver.resolveLot(new LotKey(11L, "L1"))).isEqualTo(Resolution.created(1L));
    }

    @Test
    void reload_storageDown_throwsStorageUnavailable() {
        when(localisationStore.loadKeyIds()).thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(resolver::reload)
                .isInstanceOf(StorageUnavailableException.class)
                .hasCauseInstanceOf(DataAccessResourceFailureException.class);
        assertThat(resolver.isStale()).isTrue();
    }

    // ── invalidate / ensureFresh ─────────────────────────────────────────────

    @Test
    void ensureFresh_notStale_doesNotReload() {
        stubStorage();
        resolver.reload();

        resolver.ensureFresh();

        verify(localisationStore, times(1)).loadKeyIds();
    }

    @Test
    void ensureFresh_afterInvalidate_reloads() {
        stubStorage();
        resolver.reload();
        resolver.invalidate();

        resolver.ensureFresh();

        verify(localisationStore, times(2)).loadKeyIds();
        assertThat(resolver.isStale()).isFalse();
    }

    // ── Transaction ──────────────────────────────────────────────────────────

    @Test
    void commitPending_keysOfEveryTypeBecomeCommitted() {
        stubStorage();
        resolver.reload();
        LocalisationKey other = new LocalisationKey(null, null, "LIEU DIT", null, "33", null, null, null, null);

        resolver.resolveLocalisation(other);
        resolver.resolveMutation("M9");
        assertThat(resolver.isCommitted(EntityType.LOCALISATION, other)).isFalse();

        resolver.commitPending();

        assertThat(resolver.isCommitted(EntityType.LOCALISATION, other)).isTrue();
        assertThat(resolver.isCommitted(EntityType.MUTATION, "M9")).isTrue();
    }

    @Test
    void discardPending_mintedIdsAreReused() {
        stubStorage();
        resolver.reload();

        Resolution first = resolver.resolveBien(bienKey(4L));
        resolver.discardPending();
        Resolution second = resolver.resolveBien(bienKey(5L));

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(resolver.isCommitted(EntityType.BIEN, bienKey(4L))).isFalse();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private void stubStorage() {
        when(localisationStore.loadKeyIds()).thenReturn(Map.of(BORDEAUX, 4L));
        when(localisationStore.maxId()).thenReturn(4L);
        when(bienStore.loadKeyIds()).thenReturn(Map.of());
        when(bienStore.maxId()).thenReturn(10L);
        when(lotStore.loadKeyIds()).thenReturn(Map.of());
        when(lotStore.maxId()).thenReturn(0L);
        when(mutationStore.loadKeys()).thenReturn(Set.of("M1"));
        when(mutationBienStore.loadKeys()).thenReturn(Set.of(new MutationBienKey("M1", 3L)));
    }

    private static BienKey bienKey(long localisationId) {
        return new BienKey("P1", localisationId, "Appartement", null, null, 3);
    }
}
