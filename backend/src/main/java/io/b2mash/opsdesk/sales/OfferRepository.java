package io.b2mash.opsdesk.sales;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface OfferRepository extends JpaRepository<Offer, UUID> {

  List<Offer> findByLeadIdOrderByRevisionAsc(UUID leadId);

  @Query("SELECT COALESCE(MAX(o.revision), 0) FROM Offer o WHERE o.leadId = :leadId")
  int findMaxRevision(@Param("leadId") UUID leadId);

  List<Offer> findByStatusAndValidUntilBefore(OfferStatus status, LocalDate date);

  @Query(
      """
      SELECT o FROM Offer o, Lead l
      WHERE l.id = o.leadId
        AND (:ownerId IS NULL OR l.ownerId = :ownerId)
        AND (:companyId IS NULL OR l.companyId = :companyId)
      ORDER BY o.updatedAt DESC, o.id
      """)
  Slice<Offer> findRecordPage(
      @Param("ownerId") UUID ownerId, @Param("companyId") UUID companyId, Pageable pageable);
}
