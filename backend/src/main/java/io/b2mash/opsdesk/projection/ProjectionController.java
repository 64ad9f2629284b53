package io.b2mash.opsdesk.projection;

import io.b2mash.opsdesk.store.EntityType;
import java.util.EnumSet;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/projection")
public class ProjectionController {

  private final ProjectionResyncService resyncService;

  public ProjectionController(ProjectionResyncService resyncService) {
    this.resyncService = resyncService;
  }

  @PostMapping("/resync")
  public ResponseEntity<ResyncResponse> resync(@RequestParam(required = false) EntityType type) {
    var types = type != null ? EnumSet.of(type) : EnumSet.allOf(EntityType.class);
    return ResponseEntity.ok(new ResyncResponse(resyncService.resync(types)));
  }

  public record ResyncResponse(int enqueued) {}
}
