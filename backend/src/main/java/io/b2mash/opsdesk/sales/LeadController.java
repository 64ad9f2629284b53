package io.b2mash.opsdesk.sales;

import io.b2mash.opsdesk.member.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/sales/leads")
public class LeadController {

  private final LeadService leadService;

  public LeadController(LeadService leadService) {
    this.leadService = leadService;
  }

  @PostMapping
  public ResponseEntity<LeadResponse> createLead(@Valid @RequestBody CreateLeadRequest request) {
    var ownerId = request.ownerId() != null ? request.ownerId() : RequestScopes.requireMemberId();
    var lead =
        leadService.createLead(
            request.companyName(),
            request.contactName(),
            request.email(),
            request.phone(),
            ownerId,
            request.companyId(),
            request.notes(),
            request.dealValue(),
            request.nextFollowUpDate());
    return ResponseEntity.created(URI.create("/sales/leads/" + lead.getId()))
        .body(LeadResponse.from(lead));
  }

  @GetMapping
  public ResponseEntity<LeadPageResponse> listLeads(
      @RequestParam(required = false) LeadStatus status,
      @RequestParam(required = false) UUID ownerId,
      @RequestParam(required = false) String q,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {
    var pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), 200));
    var result = leadService.listLeads(status, ownerId, q, pageable);
    return ResponseEntity.ok(
        new LeadPageResponse(
            result.getContent().stream().map(LeadResponse::from).toList(),
            result.getTotalElements(),
            result.getNumber(),
            result.getSize()));
  }

  @GetMapping("/{id}")
  public ResponseEntity<LeadResponse> getLead(@PathVariable UUID id) {
    return ResponseEntity.ok(LeadResponse.from(leadService.getLead(id)));
  }

  @PutMapping("/{id}")
  public ResponseEntity<LeadResponse> updateLead(
      @PathVariable UUID id, @Valid @RequestBody UpdateLeadRequest request) {
    var lead =
        leadService.updateLead(
            id,
            request.expectedVersion(),
            request.companyName(),
            request.contactName(),
            request.email(),
            request.phone(),
            request.notes(),
            request.dealValue(),
            request.nextFollowUpDate());
    return ResponseEntity.ok(LeadResponse.from(lead));
  }

  @PostMapping("/{id}/contact")
  public ResponseEntity<LeadResponse> contact(
      @PathVariable UUID id, @RequestBody(required = false) LeadTransitionRequest request) {
    return fire(id, LeadEvent.CONTACT, request);
  }

  @PostMapping("/{id}/qualify")
  public ResponseEntity<LeadResponse> qualify(
      @PathVariable UUID id, @RequestBody(required = false) LeadTransitionRequest request) {
    return fire(id, LeadEvent.QUALIFY, request);
  }

  @PostMapping("/{id}/lost")
  public ResponseEntity<LeadResponse> markLost(
      @PathVariable UUID id, @RequestBody(required = false) LeadTransitionRequest request) {
    return fire(id, LeadEvent.MARK_LOST, request);
  }

  @PostMapping("/{id}/convert")
  public ResponseEntity<LeadResponse> convert(
      @PathVariable UUID id, @RequestBody(required = false) LeadTransitionRequest request) {
    return fire(id, LeadEvent.CONVERT, request);
  }

  @PostMapping("/{id}/status")
  public ResponseEntity<LeadResponse> changeStatus(
      @PathVariable UUID id, @Valid @RequestBody LeadStatusRequest request) {
    var lead =
        leadService.changeStatus(id, request.status(), request.expectedVersion(), request.reason());
    return ResponseEntity.ok(LeadResponse.from(lead));
  }

  private ResponseEntity<LeadResponse> fire(
      UUID id, LeadEvent event, LeadTransitionRequest request) {
    var expectedVersion = request != null ? request.expectedVersion() : null;
    var reason = request != null ? request.reason() : null;
    return ResponseEntity.ok(
        LeadResponse.from(leadService.transition(id, event, expectedVersion, reason)));
  }

  // --- DTOs ---

  public record CreateLeadRequest(
      @NotBlank @Size(max = 200) String companyName,
      @Size(max = 200) String contactName,
      @Size(max = 255) String email,
      @Size(max = 50) String phone,
      UUID ownerId,
      UUID companyId,
      String notes,
      @PositiveOrZero BigDecimal dealValue,
      LocalDate nextFollowUpDate) {}

  public record UpdateLeadRequest(
      Long expectedVersion,
      @NotBlank @Size(max = 200) String companyName,
      @Size(max = 200) String contactName,
      @Size(max = 255) String email,
      @Size(max = 50) String phone,
      String notes,
      @PositiveOrZero BigDecimal dealValue,
      LocalDate nextFollowUpDate) {}

  public record LeadTransitionRequest(Long expectedVersion, @Size(max = 500) String reason) {}

  public record LeadStatusRequest(
      @NotNull LeadStatus status, Long expectedVersion, @Size(max = 500) String reason) {}

  public record LeadPageResponse(List<LeadResponse> items, long total, int page, int size) {}

  public record LeadResponse(
      UUID id,
      long version,
      String status,
      String companyName,
      String contactName,
      String email,
      String phone,
      UUID ownerId,
      UUID companyId,
      String notes,
      BigDecimal dealValue,
      LocalDate nextFollowUpDate,
      String lossReason,
      Instant createdAt,
      Instant updatedAt) {

    public static LeadResponse from(Lead lead) {
      return new LeadResponse(
          lead.getId(),
          lead.getVersion(),
          lead.getStatus().toString(),
          lead.getCompanyName(),
          lead.getContactName(),
          lead.getEmail(),
          lead.getPhone(),
          lead.getOwnerId(),
          lead.getCompanyId(),
          lead.getNotes(),
          lead.getDealValue(),
          lead.getNextFollowUpDate(),
          lead.getLossReason(),
          lead.getCreatedAt(),
          lead.getUpdatedAt());
    }
  }
}
