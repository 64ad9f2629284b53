package io.b2mash.opsdesk.health;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.opsdesk.projection.ConsistencyPropagator;
import io.b2mash.opsdesk.projection.ProjectionStatus;
import io.b2mash.opsdesk.store.StoreKind;
import io.b2mash.opsdesk.testutil.StandaloneMvc;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

  @Mock private ConsistencyPropagator propagator;

  private BackendHealthMonitor healthMonitor;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    healthMonitor = new BackendHealthMonitor(List.of(), 100);
    mockMvc = StandaloneMvc.of(new HealthController(healthMonitor, propagator), healthMonitor);
  }

  @Test
  void reportsEveryStore() throws Exception {
    mockMvc
        .perform(get("/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true))
        .andExpect(jsonPath("$.relational").value(true))
        .andExpect(jsonPath("$.search").value(true))
        .andExpect(jsonPath("$.cache").value(true));
  }

  @Test
  void searchOutageKeepsServiceOk() throws Exception {
    healthMonitor.reportUnavailable(StoreKind.SEARCH);

    mockMvc
        .perform(get("/health"))
        .andExpect(jsonPath("$.ok").value(true))
        .andExpect(jsonPath("$.search").value(false));
  }

  @Test
  void relationalOutageIsNotOk() throws Exception {
    healthMonitor.reportUnavailable(StoreKind.RELATIONAL);

    mockMvc
        .perform(get("/health"))
        .andExpect(jsonPath("$.ok").value(false))
        .andExpect(jsonPath("$.relational").value(false));
  }

  @Test
  void projectionStatusExposesBacklog() throws Exception {
    when(propagator.status()).thenReturn(new ProjectionStatus(3, 1_500L, 40, 2, 1));

    mockMvc
        .perform(get("/health/projection"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.pending").value(3))
        .andExpect(jsonPath("$.oldestPendingAgeMillis").value(1500))
        .andExpect(jsonPath("$.failedAttempts").value(1));
  }
}
