package io.b2mash.opsdesk.installation;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InstallationJobRepository extends JpaRepository<InstallationJob, UUID> {

  @Query(
      """
      SELECT j.id FROM InstallationJob j
      WHERE j.status IN :statuses
        AND j.deadline < :today
      """)
  List<UUID> findIdsPastDeadline(
      @Param("statuses") Collection<InstallationStatus> statuses, @Param("today") LocalDate today);

  /** Undone jobs plus open jobs whose deadline passed but were not swept yet. */
  @Query(
      """
      SELECT j FROM InstallationJob j
      WHERE (j.status = :undone OR (j.status IN :open AND j.deadline < :today))
        AND (:companyId IS NULL OR j.companyId = :companyId)
        AND (:technicianId IS NULL OR j.technicianId = :technicianId)
        AND (LOWER(j.title) LIKE :pattern OR LOWER(COALESCE(j.notes, '')) LIKE :pattern)
      ORDER BY j.deadline DESC, j.id
      """)
  Page<InstallationJob> findUndone(
      @Param("undone") InstallationStatus undone,
      @Param("open") Collection<InstallationStatus> open,
      @Param("today") LocalDate today,
      @Param("companyId") UUID companyId,
      @Param("technicianId") UUID technicianId,
      @Param("pattern") String pattern,
      Pageable pageable);

  @Query(
      """
      SELECT j FROM InstallationJob j
      WHERE (:ownerId IS NULL OR j.ownerId = :ownerId)
        AND (:companyId IS NULL OR j.companyId = :companyId)
        AND (:technicianId IS NULL OR j.technicianId = :technicianId)
      ORDER BY j.updatedAt DESC, j.id
      """)
  Slice<InstallationJob> findRecordPage(
      @Param("ownerId") UUID ownerId,
      @Param("companyId") UUID companyId,
      @Param("technicianId") UUID technicianId,
      Pageable pageable);
}
