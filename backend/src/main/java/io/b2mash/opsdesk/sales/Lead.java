package io.b2mash.opsdesk.sales;

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
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * A sales prospect.
 *
 * <p>Lifecycle: NEW → CONTACTED → QUALIFIED → CONVERTED, or LOST from any open status. Offers may
 * be created for any lead that is not LOST.
 */
@Entity
@Table(name = "leads")
public class Lead {

  public static final String ENTITY = "Lead";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Version
  @Column(name = "version", nullable = false)
  private Long version;

  @Column(name = "company_name", nullable = false, length = 200)
  private String companyName;

  @Column(name = "contact_name", length = 200)
  private String contactName;

  @Column(name = "email", length = 255)
  private String email;

  @Column(name = "phone", length = 50)
  private String phone;

  @Column(name = "owner_id", nullable = false)
  private UUID ownerId;

  @Column(name = "company_id")
  private UUID companyId;

  @Column(name = "notes", columnDefinition = "TEXT")
  private String notes;

  @Column(name = "deal_value", precision = 14, scale = 2)
  private BigDecimal dealValue;

  @Column(name = "next_follow_up_date")
  private LocalDate nextFollowUpDate;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private LeadStatus status;

  @Column(name = "loss_reason", length = 500)
  private String lossReason;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Lead() {}

  public Lead(String companyName, String contactName, UUID ownerId, UUID companyId) {
    this.companyName = Objects.requireNonNull(companyName, "companyName must not be null");
    this.contactName = contactName;
    this.ownerId = Objects.requireNonNull(ownerId, "ownerId must not be null");
    this.companyId = companyId;
    this.status = LeadStatus.NEW;
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
   * Fires {@code event} and returns the status the lead left. A lost lead must carry a reason.
   * Nothing is modified when the transition is rejected.
   */
  public LeadStatus apply(LeadEvent event, String reason) {
    var target = event.fire(status, ENTITY);
    if (event == LeadEvent.MARK_LOST && (reason == null || reason.isBlank())) {
      throw new InvalidRequestException("Loss reason required", "A lost lead needs a loss reason");
    }
    var from = this.status;
    if (event == LeadEvent.MARK_LOST) {
      this.lossReason = reason.trim();
    }
    this.status = target;
    this.updatedAt = Instant.now();
    return from;
  }

  public boolean acceptsOffers() {
    return status != LeadStatus.LOST;
  }

  public void updateDetails(
      String companyName,
      String contactName,
      String email,
      String phone,
      String notes,
      BigDecimal dealValue,
      LocalDate nextFollowUpDate) {
    this.companyName = Objects.requireNonNull(companyName, "companyName must not be null");
    this.contactName = contactName;
    this.email = email;
    this.phone = phone;
    this.notes = notes;
    this.dealValue = dealValue;
    this.nextFollowUpDate = nextFollowUpDate;
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public Long getVersion() {
    return version;
  }

  public String getCompanyName() {
    return companyName;
  }

  public String getContactName() {
    return contactName;
  }

  public String getEmail() {
    return email;
  }

  public String getPhone() {
    return phone;
  }

  public UUID getOwnerId() {
    return ownerId;
  }

  public UUID getCompanyId() {
    return companyId;
  }

  public String getNotes() {
    return notes;
  }

  public BigDecimal getDealValue() {
    return dealValue;
  }

  public LocalDate getNextFollowUpDate() {
    return nextFollowUpDate;
  }

  public LeadStatus getStatus() {
    return status;
  }

  public String getLossReason() {
    return lossReason;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
