package io.b2mash.opsdesk.sales;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/** One entry in a lead's activity log. Entries are append-only. */
@Entity
@Table(name = "lead_activities")
public class LeadActivity {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "lead_id", nullable = false, updatable = false)
  private UUID leadId;

  @Column(name = "member_id", updatable = false)
  private UUID memberId;

  @Enumerated(EnumType.STRING)
  @Column(name = "type", nullable = false, length = 30, updatable = false)
  private ActivityType type;

  @Column(name = "content", columnDefinition = "TEXT", updatable = false)
  private String content;

  @Column(name = "offer_id", updatable = false)
  private UUID offerId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected LeadActivity() {}

  public LeadActivity(
      UUID leadId, UUID memberId, ActivityType type, String content, UUID offerId) {
    this.leadId = Objects.requireNonNull(leadId, "leadId must not be null");
    this.memberId = memberId;
    this.type = Objects.requireNonNull(type, "type must not be null");
    this.content = content;
    this.offerId = offerId;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getLeadId() {
    return leadId;
  }

  public UUID getMemberId() {
    return memberId;
  }

  public ActivityType getType() {
    return type;
  }

  public String getContent() {
    return content;
  }

  public UUID getOfferId() {
    return offerId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
