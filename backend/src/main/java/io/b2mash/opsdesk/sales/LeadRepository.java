package io.b2mash.opsdesk.sales;

import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LeadRepository extends JpaRepository<Lead, UUID> {

  @Query(
      """
      SELECT l FROM Lead l
      WHERE (:status IS NULL OR l.status = :status)
        AND (:ownerId IS NULL OR l.ownerId = :ownerId)
        AND (LOWER(l.companyName) LIKE :pattern
          OR LOWER(COALESCE(l.contactName, '')) LIKE :pattern
          OR LOWER(COALESCE(l.email, '')) LIKE :pattern)
      ORDER BY l.updatedAt DESC
      """)
  Page<Lead> findFiltered(
      @Param("status") LeadStatus status,
      @Param("ownerId") UUID ownerId,
      @Param("pattern") String pattern,
      Pageable pageable);

  @Query(
      """
      SELECT l FROM Lead l
      WHERE (:ownerId IS NULL OR l.ownerId = :ownerId)
        AND (:companyId IS NULL OR l.companyId = :companyId)
      ORDER BY l.updatedAt DESC, l.id
      """)
  Slice<Lead> findRecordPage(
      @Param("ownerId") UUID ownerId, @Param("companyId") UUID companyId, Pageable pageable);
}
