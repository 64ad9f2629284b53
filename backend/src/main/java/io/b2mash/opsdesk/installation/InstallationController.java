package io.b2mash.opsdesk.installation;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/installations")
public class InstallationController {

  private final InstallationService installationService;

  public InstallationController(InstallationService installationService) {
    this.installationService = installationService;
  }

  @GetMapping("/{id}")
  public ResponseEntity<InstallationResponse> getJob(@PathVariable UUID id) {
    return ResponseEntity.ok(InstallationResponse.from(installationService.getJob(id)));
  }

  @PostMapping("/{id}/schedule")
  public ResponseEntity<InstallationResponse> schedule(
      @PathVariable UUID id, @RequestBody ScheduleRequest request) {
    var job =
        installationService.schedule(
            id, request.date(), request.technicianId(), request.expectedVersion());
    return ResponseEntity.ok(InstallationResponse.from(job));
  }

  @PostMapping("/{id}/start")
  public ResponseEntity<InstallationResponse> start(
      @PathVariable UUID id, @RequestBody(required = false) TransitionRequest request) {
    var job = installationService.start(id, TransitionRequest.expectedVersionOf(request));
    return ResponseEntity.ok(InstallationResponse.from(job));
  }

  @PostMapping("/{id}/finish")
  public ResponseEntity<InstallationResponse> finish(
      @PathVariable UUID id, @RequestBody(required = false) TransitionRequest request) {
    var job = installationService.finish(id, TransitionRequest.expectedVersionOf(request));
    return ResponseEntity.ok(InstallationResponse.from(job));
  }

  @GetMapping("/undone-jobs")
  public ResponseEntity<UndoneJobsResponse> undoneJobs(
      @RequestParam(required = false) UUID companyId,
      @RequestParam(required = false) UUID technicianId,
      @RequestParam(required = false) String q,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {
    var result = installationService.listUndone(companyId, technicianId, q, page, size);
    return ResponseEntity.ok(
        new UndoneJobsResponse(
            result.getContent().stream().map(InstallationResponse::from).toList(),
            result.getTotalElements(),
            result.getNumber(),
            result.getSize()));
  }

  // --- DTOs ---

  public record ScheduleRequest(LocalDate date, UUID technicianId, Long expectedVersion) {}

  public record TransitionRequest(Long expectedVersion) {

    static Long expectedVersionOf(TransitionRequest request) {
      return request != null ? request.expectedVersion() : null;
    }
  }

  public record UndoneJobsResponse(
      List<InstallationResponse> items, long total, int page, int size) {}

  public record InstallationResponse(
      UUID id,
      long version,
      String status,
      String title,
      UUID leadId,
      UUID offerId,
      UUID companyId,
      UUID technicianId,
      LocalDate scheduledDate,
      LocalDate deadline,
      Instant startedAt,
      Instant finishedAt,
      Instant updatedAt) {

    public static InstallationResponse from(InstallationJob job) {
      return new InstallationResponse(
          job.getId(),
          job.getVersion(),
          job.getStatus().toString(),
          job.getTitle(),
          job.getLeadId(),
          job.getOfferId(),
          job.getCompanyId(),
          job.getTechnicianId(),
          job.getScheduledDate(),
          job.getDeadline(),
          job.getStartedAt(),
          job.getFinishedAt(),
          job.getUpdatedAt());
    }
  }
}
