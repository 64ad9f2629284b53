package io.b2mash.opsdesk.notification;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.opsdesk.exception.ResourceNotFoundException;
import io.b2mash.opsdesk.health.BackendHealthMonitor;
import io.b2mash.opsdesk.member.MemberFilter;
import io.b2mash.opsdesk.testutil.StandaloneMvc;
import io.b2mash.opsdesk.testutil.TestEntities;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.test.web.servlet.MockMvc;

@ExtendWith(MockitoExtension.class)
class NotificationControllerTest {

  private static final UUID MEMBER_ID = UUID.randomUUID();

  @Mock private NotificationService notificationService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        StandaloneMvc.of(
            new NotificationController(notificationService),
            new BackendHealthMonitor(List.of(), 100));
  }

  @Test
  void listsCallersUnreadNotifications() throws Exception {
    var notification =
        new Notification(
            MEMBER_ID,
            "OFFER_SENT",
            "Offer sent",
            "send: DRAFT -> SENT",
            "OFFER",
            UUID.randomUUID());
    TestEntities.set(notification, "id", UUID.randomUUID());
    when(notificationService.listNotifications(eq(MEMBER_ID), eq(true), any(Pageable.class)))
        .thenReturn(new PageImpl<>(List.of(notification), PageRequest.of(0, 20), 1));

    mockMvc
        .perform(
            get("/notifications")
                .param("unreadOnly", "true")
                .header(MemberFilter.MEMBER_HEADER, MEMBER_ID.toString()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(1))
        .andExpect(jsonPath("$.items[0].type").value("OFFER_SENT"))
        .andExpect(jsonPath("$.items[0].id").value(notification.getId().toString()));
  }

  @Test
  void unreadCountForCaller() throws Exception {
    when(notificationService.getUnreadCount(MEMBER_ID)).thenReturn(4L);

    mockMvc
        .perform(
            get("/notifications/unread-count")
                .header(MemberFilter.MEMBER_HEADER, MEMBER_ID.toString()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.count").value(4));
  }

  @Test
  void inboxRequiresMemberIdentity() throws Exception {
    mockMvc
        .perform(get("/notifications"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.kind").value("ValidationError"));
    verifyNoInteractions(notificationService);
  }

  @Test
  void markAsRead_isNoContent() throws Exception {
    var id = UUID.randomUUID();

    mockMvc
        .perform(
            put("/notifications/{id}/read", id)
                .header(MemberFilter.MEMBER_HEADER, MEMBER_ID.toString()))
        .andExpect(status().isNoContent());
    verify(notificationService).markAsRead(id, MEMBER_ID);
  }

  @Test
  void markAsRead_otherMembersNotification_isNotFound() throws Exception {
    var id = UUID.randomUUID();
    doThrow(new ResourceNotFoundException("Notification", id))
        .when(notificationService)
        .markAsRead(id, MEMBER_ID);

    mockMvc
        .perform(
            put("/notifications/{id}/read", id)
                .header(MemberFilter.MEMBER_HEADER, MEMBER_ID.toString()))
        .andExpect(status().isNotFound());
  }

  @Test
  void markAllAsRead_isNoContent() throws Exception {
    mockMvc
        .perform(
            put("/notifications/read-all").header(MemberFilter.MEMBER_HEADER, MEMBER_ID.toString()))
        .andExpect(status().isNoContent());
    verify(notificationService).markAllAsRead(MEMBER_ID);
  }
}
