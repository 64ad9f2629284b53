package io.b2mash.opsdesk.sales;

import static io.b2mash.opsdesk.testutil.TestEntities.persisted;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.opsdesk.exception.BackendUnavailableException;
import io.b2mash.opsdesk.exception.IllegalTransitionException;
import io.b2mash.opsdesk.exception.ResourceNotFoundException;
import io.b2mash.opsdesk.exception.VersionConflictException;
import io.b2mash.opsdesk.health.BackendHealthMonitor;
import io.b2mash.opsdesk.lifecycle.ChangePublisher;
import io.b2mash.opsdesk.lifecycle.TransitionContext;
import io.b2mash.opsdesk.store.EntityType;
import io.b2mash.opsdesk.store.StoreKind;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LeadServiceTest {

  private static final UUID OWNER_ID = UUID.randomUUID();
  private static final UUID COMPANY_ID = UUID.randomUUID();

  @Mock private LeadRepository leadRepository;
  @Mock private BackendHealthMonitor healthMonitor;
  @Mock private ChangePublisher changePublisher;
  @Mock private LeadActivityService activityService;

  private LeadService service;

  @BeforeEach
  void setUp() {
    service = new LeadService(leadRepository, healthMonitor, changePublisher, activityService);
  }

  private Lead storedLead(long version) {
    var lead =
        persisted(new Lead("Acme Oy", "Jane", OWNER_ID, COMPANY_ID), UUID.randomUUID(), version);
    when(leadRepository.findById(lead.getId())).thenReturn(Optional.of(lead));
    return lead;
  }

  @Test
  void createLead_savesAndPublishesChange() {
    when(leadRepository.saveAndFlush(any(Lead.class)))
        .thenAnswer(inv -> persisted(inv.getArgument(0, Lead.class)));

    var lead =
        service.createLead(
            "Acme Oy", "Jane", "jane@acme.fi", null, OWNER_ID, COMPANY_ID, null, null, null);

    assertThat(lead.getId()).isNotNull();
    assertThat(lead.getStatus()).isEqualTo(LeadStatus.NEW);
    assertThat(lead.getEmail()).isEqualTo("jane@acme.fi");
    verify(changePublisher).changed(EntityType.LEAD, lead.getId(), 0L);
    verify(activityService).record(lead.getId(), ActivityType.FIELD_CHANGE, "Lead created", null);
  }

  @Test
  void createLead_relationalDown_savesNothing() {
    doThrow(new BackendUnavailableException(StoreKind.RELATIONAL, "down"))
        .when(healthMonitor)
        .requireRelationalAvailable();

    assertThatThrownBy(
            () ->
                service.createLead(
                    "Acme Oy", null, null, null, OWNER_ID, null, null, null, null))
        .isInstanceOf(BackendUnavailableException.class);
    verifyNoInteractions(leadRepository, changePublisher, activityService);
  }

  @Test
  void getLead_unknownId_throwsNotFound() {
    var id = UUID.randomUUID();
    when(leadRepository.findById(id)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.getLead(id)).isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void transition_contactPublishesTransitionForOwner() {
    var lead = storedLead(3L);

    var result = service.transition(lead.getId(), LeadEvent.CONTACT, 3L, null);

    assertThat(result.getStatus()).isEqualTo(LeadStatus.CONTACTED);
    verify(leadRepository).saveAndFlush(lead);
    var context = ArgumentCaptor.forClass(TransitionContext.class);
    verify(changePublisher)
        .transitioned(context.capture(), eq(LeadEvent.CONTACT), eq(LeadStatus.NEW), eq(3L));
    assertThat(context.getValue().ownerId()).isEqualTo(OWNER_ID);
    assertThat(context.getValue().title()).isEqualTo("Acme Oy");
    verify(activityService)
        .record(lead.getId(), ActivityType.STATUS_CHANGE, "Status: new -> contacted", null);
  }

  @Test
  void transition_staleExpectedVersion_throwsConflictWithoutSaving() {
    var lead = storedLead(4L);

    assertThatThrownBy(() -> service.transition(lead.getId(), LeadEvent.CONTACT, 2L, null))
        .isInstanceOf(VersionConflictException.class);

    assertThat(lead.getStatus()).isEqualTo(LeadStatus.NEW);
    verify(leadRepository, never()).saveAndFlush(any());
    verifyNoInteractions(changePublisher, activityService);
  }

  @Test
  void transition_illegalEvent_throwsWithoutSaving() {
    var lead = storedLead(0L);

    assertThatThrownBy(() -> service.transition(lead.getId(), LeadEvent.CONVERT, null, null))
        .isInstanceOf(IllegalTransitionException.class);

    verify(leadRepository, never()).saveAndFlush(any());
    verify(changePublisher, never()).transitioned(any(), any(), any(), anyLong());
  }

  @Test
  void changeStatus_resolvesEventFromTarget() {
    var lead = storedLead(0L);

    var result = service.changeStatus(lead.getId(), LeadStatus.LOST, null, "no budget");

    assertThat(result.getStatus()).isEqualTo(LeadStatus.LOST);
    assertThat(result.getLossReason()).isEqualTo("no budget");
    verify(changePublisher)
        .transitioned(any(), eq(LeadEvent.MARK_LOST), eq(LeadStatus.NEW), eq(0L));
  }

  @Test
  void changeStatus_unreachableTarget_throwsIllegalTransition() {
    var lead = storedLead(0L);

    assertThatThrownBy(() -> service.changeStatus(lead.getId(), LeadStatus.CONVERTED, null, null))
        .isInstanceOf(IllegalTransitionException.class);
    verify(leadRepository, never()).saveAndFlush(any());
  }

  @Test
  void updateLead_publishesChange() {
    var lead = storedLead(1L);

    service.updateLead(lead.getId(), 1L, "Acme Group", "Jane", null, null, "vip", null, null);

    assertThat(lead.getCompanyName()).isEqualTo("Acme Group");
    assertThat(lead.getNotes()).isEqualTo("vip");
    verify(changePublisher).changed(EntityType.LEAD, lead.getId(), 1L);
    verify(activityService).record(lead.getId(), ActivityType.FIELD_CHANGE, "Lead updated", null);
  }
}
