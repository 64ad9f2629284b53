package io.b2mash.opsdesk.sales;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.opsdesk.exception.IllegalTransitionException;
import io.b2mash.opsdesk.exception.InvalidRequestException;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class LeadTest {

  private final Lead lead = new Lead("Acme Oy", "Jane", UUID.randomUUID(), UUID.randomUUID());

  @Test
  void newLeadStartsInNew() {
    assertThat(lead.getStatus()).isEqualTo(LeadStatus.NEW);
    assertThat(lead.acceptsOffers()).isTrue();
  }

  @Test
  void happyPathReachesConverted() {
    assertThat(lead.apply(LeadEvent.CONTACT, null)).isEqualTo(LeadStatus.NEW);
    assertThat(lead.apply(LeadEvent.QUALIFY, null)).isEqualTo(LeadStatus.CONTACTED);
    assertThat(lead.apply(LeadEvent.CONVERT, null)).isEqualTo(LeadStatus.QUALIFIED);

    assertThat(lead.getStatus()).isEqualTo(LeadStatus.CONVERTED);
    assertThat(lead.acceptsOffers()).isTrue();
  }

  @Test
  void markLostRequiresReason() {
    assertThatThrownBy(() -> lead.apply(LeadEvent.MARK_LOST, "  "))
        .isInstanceOf(InvalidRequestException.class);

    assertThat(lead.getStatus()).isEqualTo(LeadStatus.NEW);
    assertThat(lead.getLossReason()).isNull();
  }

  @Test
  void markLostKeepsReasonAndStopsOffers() {
    lead.apply(LeadEvent.MARK_LOST, " went with a competitor ");

    assertThat(lead.getStatus()).isEqualTo(LeadStatus.LOST);
    assertThat(lead.getLossReason()).isEqualTo("went with a competitor");
    assertThat(lead.acceptsOffers()).isFalse();
  }

  @Test
  void illegalTransitionLeavesStatusUnchanged() {
    assertThatThrownBy(() -> lead.apply(LeadEvent.CONVERT, null))
        .isInstanceOf(IllegalTransitionException.class)
        .satisfies(
            e -> {
              var ex = (IllegalTransitionException) e;
              assertThat(ex.getCurrentStatus()).isEqualTo("new");
              assertThat(ex.getEvent()).isEqualTo("convert");
            });

    assertThat(lead.getStatus()).isEqualTo(LeadStatus.NEW);
  }

  @Test
  void contactTwiceIsRejected() {
    lead.apply(LeadEvent.CONTACT, null);

    assertThatThrownBy(() -> lead.apply(LeadEvent.CONTACT, null))
        .isInstanceOf(IllegalTransitionException.class);
    assertThat(lead.getStatus()).isEqualTo(LeadStatus.CONTACTED);
  }
}
