package io.b2mash.opsdesk.sales;

import io.b2mash.opsdesk.exception.IllegalTransitionException;
import io.b2mash.opsdesk.exception.InvalidRequestException;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A priced offer made to a lead.
 *
 * <p>Lifecycle: DRAFT → SENT → ACCEPTED | REJECTED | EXPIRED. Only DRAFT offers are editable;
 * totals are recomputed whenever the line items change.
 */
@Entity
@Table(name = "offers")
public class Offer {

  public static final String ENTITY = "Offer";
  public static final String DEFAULT_CURRENCY = "EUR";
  public static final BigDecimal DEFAULT_VAT_PCT = new BigDecimal("24.00");

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Version
  @Column(name = "version", nullable = false)
  private Long version;

  @Column(name = "lead_id", nullable = false, updatable = false)
  private UUID leadId;

  @Column(name = "revision", nullable = false, updatable = false)
  private int revision;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private OfferStatus status;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Column(name = "valid_until", nullable = false)
  private LocalDate validUntil;

  @Column(name = "notes", columnDefinition = "TEXT")
  private String notes;

  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(name = "offer_line_items", joinColumns = @JoinColumn(name = "offer_id"))
  @OrderColumn(name = "sort_order")
  private List<OfferLineItem> lineItems = new ArrayList<>();

  // --- Totals, recomputed from line items ---

  @Column(name = "subtotal", nullable = false, precision = 14, scale = 2)
  private BigDecimal subtotal = BigDecimal.ZERO;

  @Column(name = "discount_total", nullable = false, precision = 14, scale = 2)
  private BigDecimal discountTotal = BigDecimal.ZERO;

  @Column(name = "vat_total", nullable = false, precision = 14, scale = 2)
  private BigDecimal vatTotal = BigDecimal.ZERO;

  @Column(name = "total", nullable = false, precision = 14, scale = 2)
  private BigDecimal total = BigDecimal.ZERO;

  // --- Lifecycle timestamps ---

  @Column(name = "sent_at")
  private Instant sentAt;

  @Column(name = "accepted_at")
  private Instant acceptedAt;

  @Column(name = "rejected_at")
  private Instant rejectedAt;

  @Column(name = "reject_reason", length = 500)
  private String rejectReason;

  @Column(name = "expired_at")
  private Instant expiredAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Offer() {}

  public Offer(UUID leadId, int revision, String currency, LocalDate validUntil, String notes) {
    this.leadId = Objects.requireNonNull(leadId, "leadId must not be null");
    this.revision = revision;
    this.currency = currency != null && !currency.isBlank() ? currency : DEFAULT_CURRENCY;
    this.validUntil = Objects.requireNonNull(validUntil, "validUntil must not be null");
    this.notes = notes;
    this.status = OfferStatus.DRAFT;
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
   * Fires {@code event} and returns the status the offer left. {@code reason} is kept for
   * rejections. Nothing is modified when the transition is rejected.
   */
  public OfferStatus apply(OfferEvent event, String reason) {
    var target = event.fire(status, ENTITY);
    if (event == OfferEvent.SEND && lineItems.isEmpty()) {
      throw new InvalidRequestException("Offer has no line items", "Add line items before sending");
    }
    var from = this.status;
    var now = Instant.now();
    switch (event) {
      case SEND -> this.sentAt = now;
      case ACCEPT -> this.acceptedAt = now;
      case REJECT -> {
        this.rejectedAt = now;
        this.rejectReason = reason;
      }
      case EXPIRE -> this.expiredAt = now;
    }
    this.status = target;
    this.updatedAt = now;
    return from;
  }

  public boolean isPastValidity(LocalDate today) {
    return validUntil.isBefore(today);
  }

  // --- Guarded setters for mutable fields ---

  public void requireEditable() {
    if (status != OfferStatus.DRAFT) {
      throw new IllegalTransitionException(
          ENTITY, status, "edit", "Cannot edit offer in status " + status);
    }
  }

  public void updateTerms(String currency, LocalDate validUntil, String notes) {
    requireEditable();
    if (currency != null && !currency.isBlank()) {
      this.currency = currency;
    }
    if (validUntil != null) {
      this.validUntil = validUntil;
    }
    this.notes = notes;
    this.updatedAt = Instant.now();
  }

  public void replaceLineItems(List<OfferLineItem> items) {
    requireEditable();
    this.lineItems.clear();
    this.lineItems.addAll(items);
    recalculateTotals();
    this.updatedAt = Instant.now();
  }

  private void recalculateTotals() {
    var gross = BigDecimal.ZERO;
    var discount = BigDecimal.ZERO;
    var vat = BigDecimal.ZERO;
    for (var item : lineItems) {
      gross = gross.add(item.gross());
      discount = discount.add(item.discount());
      vat = vat.add(item.vat());
    }
    this.subtotal = gross.setScale(2, RoundingMode.HALF_UP);
    this.discountTotal = discount.setScale(2, RoundingMode.HALF_UP);
    this.vatTotal = vat.setScale(2, RoundingMode.HALF_UP);
    this.total = gross.subtract(discount).add(vat).setScale(2, RoundingMode.HALF_UP);
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

  public int getRevision() {
    return revision;
  }

  public OfferStatus getStatus() {
    return status;
  }

  public String getCurrency() {
    return currency;
  }

  public LocalDate getValidUntil() {
    return validUntil;
  }

  public String getNotes() {
    return notes;
  }

  public List<OfferLineItem> getLineItems() {
    return List.copyOf(lineItems);
  }

  public BigDecimal getSubtotal() {
    return subtotal;
  }

  public BigDecimal getDiscountTotal() {
    return discountTotal;
  }

  public BigDecimal getVatTotal() {
    return vatTotal;
  }

  public BigDecimal getTotal() {
    return total;
  }

  public Instant getSentAt() {
    return sentAt;
  }

  public Instant getAcceptedAt() {
    return acceptedAt;
  }

  public Instant getRejectedAt() {
    return rejectedAt;
  }

  public String getRejectReason() {
    return rejectReason;
  }

  public Instant getExpiredAt() {
    return expiredAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
