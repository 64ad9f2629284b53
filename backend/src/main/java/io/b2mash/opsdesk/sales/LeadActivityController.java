package io.b2mash.opsdesk.sales;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/sales/leads/{leadId}/activity")
public class LeadActivityController {

  private final LeadActivityService activityService;

  public LeadActivityController(LeadActivityService activityService) {
    this.activityService = activityService;
  }

  @PostMapping
  public ResponseEntity<ActivityResponse> addActivity(
      @PathVariable UUID leadId, @Valid @RequestBody ActivityRequest request) {
    var activity = activityService.addActivity(leadId, request.type(), request.content());
    return ResponseEntity.created(URI.create("/sales/leads/" + leadId + "/activity"))
        .body(ActivityResponse.from(activity));
  }

  @GetMapping
  public ResponseEntity<List<ActivityResponse>> listActivity(@PathVariable UUID leadId) {
    return ResponseEntity.ok(
        activityService.listActivity(leadId).stream().map(ActivityResponse::from).toList());
  }

  // --- DTOs ---

  public record ActivityRequest(@NotNull ActivityType type, @Size(max = 5000) String content) {}

  public record ActivityResponse(
      UUID id,
      String type,
      String content,
      UUID memberId,
      UUID offerId,
      Instant createdAt) {

    public static ActivityResponse from(LeadActivity activity) {
      return new ActivityResponse(
          activity.getId(),
          activity.getType().toString(),
          activity.getContent(),
          activity.getMemberId(),
          activity.getOfferId(),
          activity.getCreatedAt());
    }
  }
}
