package io.b2mash.opsdesk.health;

import io.b2mash.opsdesk.projection.ConsistencyPropagator;
import io.b2mash.opsdesk.projection.ProjectionStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/health")
public class HealthController {

  private final BackendHealthMonitor healthMonitor;
  private final ConsistencyPropagator propagator;

  public HealthController(BackendHealthMonitor healthMonitor, ConsistencyPropagator propagator) {
    this.healthMonitor = healthMonitor;
    this.propagator = propagator;
  }

  @GetMapping
  public ResponseEntity<HealthResponse> health() {
    return ResponseEntity.ok(HealthResponse.from(healthMonitor.snapshot()));
  }

  @GetMapping("/projection")
  public ResponseEntity<ProjectionStatus> projection() {
    return ResponseEntity.ok(propagator.status());
  }

  public record HealthResponse(boolean ok, boolean relational, boolean search, boolean cache) {

    public static HealthResponse from(HealthSnapshot snapshot) {
      return new HealthResponse(
          snapshot.ok(), snapshot.relational(), snapshot.search(), snapshot.cache());
    }
  }
}
