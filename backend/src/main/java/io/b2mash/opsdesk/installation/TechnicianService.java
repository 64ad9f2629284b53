package io.b2mash.opsdesk.installation;

import io.b2mash.opsdesk.exception.ResourceNotFoundException;
import io.b2mash.opsdesk.health.BackendHealthMonitor;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TechnicianService {

  private final TechnicianRepository technicianRepository;
  private final BackendHealthMonitor healthMonitor;

  public TechnicianService(
      TechnicianRepository technicianRepository, BackendHealthMonitor healthMonitor) {
    this.technicianRepository = technicianRepository;
    this.healthMonitor = healthMonitor;
  }

  @Transactional(readOnly = true)
  public List<Technician> list(boolean activeOnly) {
    return activeOnly
        ? technicianRepository.findByActiveTrueOrderByNameAsc()
        : technicianRepository.findAllByOrderByNameAsc();
  }

  @Transactional
  public Technician create(String name, String email, String phone, String availabilityNote) {
    healthMonitor.requireRelationalAvailable();
    return technicianRepository.save(new Technician(name, email, phone, availabilityNote));
  }

  /** Deactivated technicians stay referenced by past jobs but cannot be assigned again. */
  @Transactional
  public Technician deactivate(UUID id) {
    healthMonitor.requireRelationalAvailable();
    var technician =
        technicianRepository
            .findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("Technician", id));
    technician.deactivate();
    return technician;
  }
}
