package io.b2mash.opsdesk.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.opsdesk.config.OpenSearchConfig.SearchIndexProperties;
import io.b2mash.opsdesk.exception.BackendUnavailableException;
import io.b2mash.opsdesk.health.BackendHealthMonitor;
import io.b2mash.opsdesk.store.EntityRecord;
import io.b2mash.opsdesk.store.EntityType;
import io.b2mash.opsdesk.store.RecordQuery;
import io.b2mash.opsdesk.store.StoreKind;
import io.b2mash.opsdesk.store.relational.RelationalStoreAdapter;
import io.b2mash.opsdesk.store.search.SearchIndexAdapter;
import io.b2mash.opsdesk.store.search.SearchOrder;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QueryRouterTest {

  private static final Instant T0 = Instant.parse("2026-03-01T00:00:00Z");

  @Mock private SearchIndexAdapter searchIndex;
  @Mock private RelationalStoreAdapter relational;

  private BackendHealthMonitor healthMonitor;
  private QueryRouter router;

  @BeforeEach
  void setUp() {
    healthMonitor = new BackendHealthMonitor(List.of(), 100);
    router =
        new QueryRouter(
            searchIndex,
            relational,
            healthMonitor,
            new SearchIndexProperties("http://localhost:9200", "test", null, null, 3));
  }

  private static EntityRecord record(EntityType type, Instant updatedAt) {
    return new EntityRecord(
        type,
        UUID.randomUUID(),
        0,
        false,
        "NEW",
        "Acme Oy",
        null,
        null,
        null,
        null,
        null,
        updatedAt,
        updatedAt);
  }

  private void relationalHolds(EntityType type, EntityRecord... records) {
    when(relational.query(eq(type), any(RecordQuery.class)))
        .thenAnswer(inv -> List.of(records).stream());
  }

  @Test
  void usesSearchIndexWhileAvailable() {
    var hit = record(EntityType.LEAD, T0);
    when(searchIndex.search(any(), eq(SearchOrder.RELEVANCE), eq(3))).thenReturn(List.of(hit));

    var result = router.find(RecordQuery.text("acme"), SearchOrder.RELEVANCE, 10);

    assertThat(result.servedBy()).isEqualTo(StoreKind.SEARCH);
    assertThat(result.records()).containsExactly(hit);
    verifyNoInteractions(relational);
  }

  @Test
  void fallsBackToRelationalWhenSearchIsDown() {
    healthMonitor.reportUnavailable(StoreKind.SEARCH);
    var lead = record(EntityType.LEAD, T0);
    var offer = record(EntityType.OFFER, T0.plusSeconds(60));
    var job = record(EntityType.INSTALLATION, T0.plusSeconds(30));
    relationalHolds(EntityType.LEAD, lead);
    relationalHolds(EntityType.OFFER, offer);
    relationalHolds(EntityType.INSTALLATION, job);
    relationalHolds(EntityType.DOCUMENT);

    var result = router.find(RecordQuery.all(), SearchOrder.RELEVANCE, 10);

    assertThat(result.servedBy()).isEqualTo(StoreKind.RELATIONAL);
    assertThat(result.records()).containsExactly(offer, job, lead);
    verifyNoInteractions(searchIndex);
  }

  @Test
  void fallbackIsBoundedByMaxScan() {
    healthMonitor.reportUnavailable(StoreKind.SEARCH);
    relationalHolds(
        EntityType.LEAD,
        record(EntityType.LEAD, T0.plusSeconds(3)),
        record(EntityType.LEAD, T0.plusSeconds(2)),
        record(EntityType.LEAD, T0.plusSeconds(1)),
        record(EntityType.LEAD, T0));
    var leadsOnly =
        new RecordQuery(Set.of(EntityType.LEAD), null, null, null, null, null, null, null, null);

    var result = router.find(leadsOnly, SearchOrder.NEWEST, 100);

    assertThat(result.records()).hasSize(3);
    assertThat(result.records().get(0).updatedAt()).isEqualTo(T0.plusSeconds(3));
  }

  @Test
  void searchFailureMidRequestFallsBackAndMarksSearchDown() {
    when(searchIndex.search(any(), any(), anyInt()))
        .thenThrow(new BackendUnavailableException(StoreKind.SEARCH, "timeout"));
    var lead = record(EntityType.LEAD, T0);
    relationalHolds(EntityType.LEAD, lead);
    var leadsOnly = RecordQuery.all().withTypes(EnumSet.of(EntityType.LEAD));

    var result = router.find(leadsOnly, SearchOrder.NEWEST, 10);

    assertThat(result.servedBy()).isEqualTo(StoreKind.RELATIONAL);
    assertThat(result.records()).containsExactly(lead);
    assertThat(healthMonitor.snapshot().search()).isFalse();
  }

  @Test
  void stopsUsingIndexOnceMarkedDown() {
    when(searchIndex.search(any(), any(), anyInt()))
        .thenThrow(new BackendUnavailableException(StoreKind.SEARCH, "timeout"));
    relationalHolds(EntityType.LEAD);
    var leadsOnly = RecordQuery.all().withTypes(EnumSet.of(EntityType.LEAD));

    router.find(leadsOnly, SearchOrder.NEWEST, 10);
    router.find(leadsOnly, SearchOrder.NEWEST, 10);

    verify(searchIndex, times(1)).search(any(), any(), anyInt());
  }
}
