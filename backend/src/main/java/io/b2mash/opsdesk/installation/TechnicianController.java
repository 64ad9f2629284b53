package io.b2mash.opsdesk.installation;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/technicians")
public class TechnicianController {

  private final TechnicianService technicianService;

  public TechnicianController(TechnicianService technicianService) {
    this.technicianService = technicianService;
  }

  @GetMapping
  public ResponseEntity<List<TechnicianResponse>> listTechnicians(
      @RequestParam(defaultValue = "true") boolean activeOnly) {
    return ResponseEntity.ok(
        technicianService.list(activeOnly).stream().map(TechnicianResponse::from).toList());
  }

  @PostMapping
  public ResponseEntity<TechnicianResponse> createTechnician(
      @Valid @RequestBody CreateTechnicianRequest request) {
    var technician =
        technicianService.create(
            request.name(), request.email(), request.phone(), request.availabilityNote());
    return ResponseEntity.created(URI.create("/technicians/" + technician.getId()))
        .body(TechnicianResponse.from(technician));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<TechnicianResponse> deactivateTechnician(@PathVariable UUID id) {
    return ResponseEntity.ok(TechnicianResponse.from(technicianService.deactivate(id)));
  }

  // --- DTOs ---

  public record CreateTechnicianRequest(
      @NotBlank @Size(max = 200) String name,
      @Size(max = 255) String email,
      @Size(max = 50) String phone,
      @Size(max = 500) String availabilityNote) {}

  public record TechnicianResponse(
      UUID id, String name, String email, String phone, boolean active, String availabilityNote) {

    public static TechnicianResponse from(Technician technician) {
      return new TechnicianResponse(
          technician.getId(),
          technician.getName(),
          technician.getEmail(),
          technician.getPhone(),
          technician.isActive(),
          technician.getAvailabilityNote());
    }
  }
}
