package io.b2mash.opsdesk.installation;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TechnicianRepository extends JpaRepository<Technician, UUID> {

  List<Technician> findByActiveTrueOrderByNameAsc();

  List<Technician> findAllByOrderByNameAsc();
}
