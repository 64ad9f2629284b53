package io.b2mash.opsdesk.installation;

import io.b2mash.opsdesk.exception.InvalidRequestException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * Field work created when an offer is accepted.
 *
 * <p>Lifecycle: PENDING → SCHEDULED → IN_PROGRESS → DONE. Scheduled or in-progress jobs still open
 * after their deadline become UNDONE.
 */
@Entity
@Table(name = "installation_jobs")
public class InstallationJob {

  public static final String ENTITY = "Installation";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Version
  @Column(name = "version", nullable = false)
  private Long version;

  @Column(name = "lead_id", nullable = false, updatable = false)
  private UUID leadId;

  @Column(name = "offer_id", nullable = false, updatable = false)
  private UUID offerId;

  @Column(name = "company_id", updatable = false)
  private UUID companyId;

  @Column(name = "owner_id", nullable = false, updatable = false)
  private UUID ownerId;

  @Column(name = "title", nullable = false, length = 200)
  private String title;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private InstallationStatus status;

  @Column(name = "scheduled_date")
  private LocalDate scheduledDate;

  @Column(name = "deadline")
  private LocalDate deadline;

  @Column(name = "technician_id")
  private UUID technicianId;

  @Column(name = "notes", columnDefinition = "TEXT")
  private String notes;

  @Column(name = "started_at")
  private Instant startedAt;

  @Column(name = "finished_at")
  private Instant finishedAt;

  @Column(name = "undone_at")
  private Instant undoneAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected InstallationJob() {}

  public InstallationJob(UUID leadId, UUID offerId, UUID companyId, UUID ownerId, String title) {
    this.leadId = Objects.requireNonNull(leadId, "leadId must not be null");
    this.offerId = Objects.requireNonNull(offerId, "offerId must not be null");
    this.companyId = companyId;
    this.ownerId = Objects.requireNonNull(ownerId, "ownerId must not be null");
    this.title = Objects.requireNonNull(title, "title must not be null");
    this.status = InstallationStatus.PENDING;
  }

  @PrePersist
  void onPrePersist() {
    var now = Instant.now();
    this.createdAt = now;
    this.updatedAt = now;
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  // --- Lifecycle methods ---

  /**
   * Assigns a date and technician. The deadline is the scheduled date plus {@code graceDays}.
   * Returns the status the job left.
   */
  public InstallationStatus schedule(
      LocalDate date, UUID technicianId, int graceDays, LocalDate today) {
    var target = InstallationEvent.SCHEDULE.fire(status, ENTITY);
    if (date == null || technicianId == null) {
      throw new InvalidRequestException(
          "Incomplete schedule", "A date and a technician are required");
    }
    if (date.isBefore(today)) {
      throw new InvalidRequestException(
          "Invalid schedule date", "Cannot schedule an installation in the past: " + date);
    }
    var from = this.status;
    this.scheduledDate = date;
    this.deadline = date.plusDays(graceDays);
    this.technicianId = technicianId;
    this.status = target;
    this.updatedAt = Instant.now();
    return from;
  }

  /** Fires a non-scheduling event and returns the status the job left. */
  public InstallationStatus apply(InstallationEvent event) {
    if (event == InstallationEvent.SCHEDULE) {
      throw new IllegalArgumentException("Use schedule(...) to schedule an installation");
    }
    var target = event.fire(status, ENTITY);
    var from = this.status;
    var now = Instant.now();
    switch (event) {
      case START -> this.startedAt = now;
      case FINISH -> this.finishedAt = now;
      case MARK_UNDONE -> this.undoneAt = now;
      default -> {}
    }
    this.status = target;
    this.updatedAt = now;
    return from;
  }

  public boolean isPastDeadline(LocalDate today) {
    return deadline != null && deadline.isBefore(today);
  }

  public void setNotes(String notes) {
    this.notes = notes;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public Long getVersion() {
    return version;
  }

  public UUID getLeadId() {
    return leadId;
  }

  public UUID getOfferId() {
    return offerId;
  }

  public UUID getCompanyId() {
    return companyId;
  }

  public UUID getOwnerId() {
    return ownerId;
  }

  public String getTitle() {
    return title;
  }

  public InstallationStatus getStatus() {
    return status;
  }

  public LocalDate getScheduledDate() {
    return scheduledDate;
  }

  public LocalDate getDeadline() {
    return deadline;
  }

  public UUID getTechnicianId() {
    return technicianId;
  }

  public String getNotes() {
    return notes;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public Instant getFinishedAt() {
    return finishedAt;
  }

  public Instant getUndoneAt() {
    return undoneAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
