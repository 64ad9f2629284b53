package io.b2mash.opsdesk.sales;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LeadActivityRepository extends JpaRepository<LeadActivity, UUID> {

  @Query(
      """
      SELECT a FROM LeadActivity a
      WHERE a.leadId = :leadId
      ORDER BY a.createdAt DESC, a.id DESC
      """)
  List<LeadActivity> findLatestForLead(@Param("leadId") UUID leadId, Pageable pageable);
}
