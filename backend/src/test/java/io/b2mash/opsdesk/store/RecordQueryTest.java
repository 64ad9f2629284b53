package io.b2mash.opsdesk.store;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class RecordQueryTest {

  private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");
  private static final UUID OWNER_ID = UUID.randomUUID();

  private static EntityRecord record(EntityType type, String status, String title, String body) {
    return new EntityRecord(
        type,
        UUID.randomUUID(),
        1,
        false,
        status,
        title,
        body,
        OWNER_ID,
        null,
        null,
        null,
        T0,
        T0);
  }

  private static RecordQuery keywords(String keywords, KeywordOperator operator) {
    return new RecordQuery(null, null, null, null, null, null, null, keywords, operator);
  }

  @Test
  void emptyQueryMatchesEveryLiveRecord() {
    var query = RecordQuery.all();

    assertThat(query.entityTypes()).isEqualTo(EnumSet.allOf(EntityType.class));
    assertThat(query.matches(record(EntityType.DOCUMENT, "active", "Reset", null))).isTrue();
  }

  @Test
  void deletedRecordsNeverMatch() {
    var deleted =
        new EntityRecord(
            EntityType.DOCUMENT,
            UUID.randomUUID(),
            2,
            true,
            "active",
            "Reset",
            null,
            null,
            null,
            null,
            null,
            T0,
            T0);

    assertThat(RecordQuery.all().matches(deleted)).isFalse();
  }

  @Test
  void allKeywordsMustAppearByDefault() {
    var record = record(EntityType.LEAD, "NEW", "Acme Oy", "Wants a heat pump");

    assertThat(keywords("acme PUMP", null).matches(record)).isTrue();
    assertThat(keywords("acme boiler", null).matches(record)).isFalse();
  }

  @Test
  void anyOperatorMatchesOneKeyword() {
    var record = record(EntityType.LEAD, "NEW", "Acme Oy", "Wants a heat pump");

    assertThat(keywords("acme boiler", KeywordOperator.ANY).matches(record)).isTrue();
    assertThat(keywords("globex boiler", KeywordOperator.ANY).matches(record)).isFalse();
  }

  @Test
  void blankKeywordsAreIgnored() {
    var query = keywords("   ", KeywordOperator.AND);

    assertThat(query.keywords()).isNull();
    assertThat(query.terms()).isEmpty();
  }

  @Test
  void statusFilterIsCaseInsensitive() {
    var query = new RecordQuery(null, Set.of("sent"), null, null, null, null, null, null, null);

    assertThat(query.matches(record(EntityType.OFFER, "SENT", "Offer #1", null))).isTrue();
    assertThat(query.matches(record(EntityType.OFFER, "DRAFT", "Offer #1", null))).isFalse();
  }

  @Test
  void keywordsMatchWholeWordsOnly() {
    var record = record(EntityType.INSTALLATION, "SCHEDULED", "Installation at Acme", "Roof work");

    assertThat(keywords("inst", null).matches(record)).isFalse();
    assertThat(keywords("installation", null).matches(record)).isTrue();
  }

  @Test
  void queryOperatorCharactersAreWordSeparators() {
    var query = keywords("foo -bar \"baz*\"", KeywordOperator.AND);

    assertThat(query.terms()).containsExactly("foo", "bar", "baz");
    assertThat(query.matches(record(EntityType.LEAD, "NEW", "Foo", "bar baz"))).isTrue();
    assertThat(query.matches(record(EntityType.LEAD, "NEW", "Foo", "baz"))).isFalse();
  }

  @Test
  void recordStatusIsStoredInCanonicalForm() {
    var record = record(EntityType.DOCUMENT, " Active ", "Reset", null);
    var query = new RecordQuery(null, Set.of("ACTIVE"), null, null, null, null, null, null, null);

    assertThat(record.status()).isEqualTo("active");
    assertThat(query.statuses()).containsExactly("active");
    assertThat(query.matches(record)).isTrue();
  }

  @Test
  void updatedRangeIsInclusive() {
    var record = record(EntityType.LEAD, "NEW", "Acme Oy", null);

    var exact = new RecordQuery(null, null, null, null, null, T0, T0, null, null);
    var later = new RecordQuery(null, null, null, null, null, T0.plusSeconds(1), null, null, null);

    assertThat(exact.matches(record)).isTrue();
    assertThat(later.matches(record)).isFalse();
  }

  @Test
  void ownerAndTypeFiltersApply() {
    var record = record(EntityType.LEAD, "NEW", "Acme Oy", null);

    var otherOwner =
        new RecordQuery(null, null, UUID.randomUUID(), null, null, null, null, null, null);
    var offersOnly = RecordQuery.all().withTypes(EnumSet.of(EntityType.OFFER));

    assertThat(otherOwner.matches(record)).isFalse();
    assertThat(offersOnly.matches(record)).isFalse();
  }

  @Test
  void operatorParsing() {
    assertThat(KeywordOperator.parse(null)).isEqualTo(KeywordOperator.AND);
    assertThat(KeywordOperator.parse("OR")).isEqualTo(KeywordOperator.ANY);
    assertThat(KeywordOperator.parse("any")).isEqualTo(KeywordOperator.ANY);
    assertThat(KeywordOperator.parse("and")).isEqualTo(KeywordOperator.AND);
  }
}
