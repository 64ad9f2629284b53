package io.b2mash.opsdesk.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.opsdesk.lifecycle.Audience;
import io.b2mash.opsdesk.lifecycle.LifecycleTransitionEvent;
import io.b2mash.opsdesk.store.EntityType;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationFanoutTest {

  private static final UUID OWNER_ID = UUID.randomUUID();
  private static final UUID COMPANY_ID = UUID.randomUUID();
  private static final UUID TECHNICIAN_ID = UUID.randomUUID();

  @Mock private NotificationService notificationService;

  private NotificationFanout fanout;

  @BeforeEach
  void setUp() {
    fanout = new NotificationFanout(notificationService, 2, 3);
  }

  private static LifecycleTransitionEvent event(
      Audience audience, UUID ownerId, UUID companyId, UUID technicianId) {
    return new LifecycleTransitionEvent(
        EntityType.INSTALLATION,
        UUID.randomUUID(),
        "Acme Oy",
        "finish",
        "IN_PROGRESS",
        "DONE",
        4L,
        audience,
        ownerId,
        companyId,
        technicianId,
        Instant.now());
  }

  @Test
  void recipients_followAudience() {
    assertThat(
            NotificationFanout.recipientsOf(
                event(Audience.NONE, OWNER_ID, COMPANY_ID, TECHNICIAN_ID)))
        .isEmpty();
    assertThat(
            NotificationFanout.recipientsOf(
                event(Audience.OWNER, OWNER_ID, COMPANY_ID, TECHNICIAN_ID)))
        .containsExactly(OWNER_ID);
    assertThat(
            NotificationFanout.recipientsOf(
                event(Audience.COMPANY, OWNER_ID, COMPANY_ID, TECHNICIAN_ID)))
        .containsExactly(COMPANY_ID);
    assertThat(
            NotificationFanout.recipientsOf(
                event(Audience.TECHNICIAN, OWNER_ID, COMPANY_ID, TECHNICIAN_ID)))
        .containsExactly(TECHNICIAN_ID);
    assertThat(
            NotificationFanout.recipientsOf(
                event(Audience.STAKEHOLDERS, OWNER_ID, COMPANY_ID, TECHNICIAN_ID)))
        .containsExactly(OWNER_ID, TECHNICIAN_ID);
  }

  @Test
  void recipients_skipMissingReferencesAndDuplicates() {
    assertThat(NotificationFanout.recipientsOf(event(Audience.COMPANY, OWNER_ID, null, null)))
        .isEmpty();
    assertThat(
            NotificationFanout.recipientsOf(
                event(Audience.STAKEHOLDERS, OWNER_ID, null, OWNER_ID)))
        .containsExactly(OWNER_ID);
  }

  @Test
  void onTransition_writesOneNotificationPerRecipient() {
    var event = event(Audience.STAKEHOLDERS, OWNER_ID, COMPANY_ID, TECHNICIAN_ID);

    fanout.onTransition(event);

    verify(notificationService)
        .createNotification(
            OWNER_ID,
            "INSTALLATION_DONE",
            "Acme Oy is now done",
            "finish: IN_PROGRESS -> DONE",
            "INSTALLATION",
            event.entityId());
    verify(notificationService)
        .createNotification(
            eq(TECHNICIAN_ID),
            eq("INSTALLATION_DONE"),
            any(),
            any(),
            any(),
            eq(event.entityId()));
    assertThat(fanout.parkedCount()).isZero();
  }

  @Test
  void onTransition_noAudienceWritesNothing() {
    fanout.onTransition(event(Audience.NONE, OWNER_ID, COMPANY_ID, TECHNICIAN_ID));

    verifyNoInteractions(notificationService);
  }

  @Test
  void failedWriteIsParkedAndRetried() {
    when(notificationService.createNotification(any(), any(), any(), any(), any(), any()))
        .thenThrow(new IllegalStateException("db down"))
        .thenReturn(null);

    fanout.onTransition(event(Audience.OWNER, OWNER_ID, null, null));
    assertThat(fanout.parkedCount()).isEqualTo(1);

    fanout.drainParked();

    assertThat(fanout.parkedCount()).isZero();
    verify(notificationService, times(2))
        .createNotification(eq(OWNER_ID), any(), any(), any(), any(), any());
  }

  @Test
  void notificationIsDroppedAfterMaxAttempts() {
    when(notificationService.createNotification(any(), any(), any(), any(), any(), any()))
        .thenThrow(new IllegalStateException("db down"));

    fanout.onTransition(event(Audience.OWNER, OWNER_ID, null, null));
    fanout.drainParked();
    fanout.drainParked();
    fanout.drainParked();

    assertThat(fanout.parkedCount()).isZero();
    verify(notificationService, times(3))
        .createNotification(any(), any(), any(), any(), any(), any());
  }

  @Test
  void fullBufferDropsOldestEntry() {
    when(notificationService.createNotification(any(), any(), any(), any(), any(), any()))
        .thenThrow(new IllegalStateException("db down"));

    fanout.onTransition(event(Audience.OWNER, UUID.randomUUID(), null, null));
    fanout.onTransition(event(Audience.OWNER, UUID.randomUUID(), null, null));
    fanout.onTransition(event(Audience.OWNER, UUID.randomUUID(), null, null));

    assertThat(fanout.parkedCount()).isEqualTo(2);
  }
}
