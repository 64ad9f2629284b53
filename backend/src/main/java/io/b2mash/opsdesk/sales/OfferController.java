package io.b2mash.opsdesk.sales;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/sales")
public class OfferController {

  private final OfferService offerService;

  public OfferController(OfferService offerService) {
    this.offerService = offerService;
  }

  @PostMapping("/leads/{leadId}/offers")
  public ResponseEntity<OfferResponse> createOffer(
      @PathVariable UUID leadId, @Valid @RequestBody OfferRequest request) {
    var offer =
        offerService.createOffer(
            leadId,
            request.currency(),
            request.validUntil(),
            request.notes(),
            LineItemRequest.toLineItems(request.lineItems()));
    return ResponseEntity.created(URI.create("/sales/offers/" + offer.getId()))
        .body(OfferResponse.from(offer));
  }

  @GetMapping("/leads/{leadId}/offers")
  public ResponseEntity<List<OfferResponse>> listOffers(@PathVariable UUID leadId) {
    return ResponseEntity.ok(
        offerService.listOffersForLead(leadId).stream().map(OfferResponse::from).toList());
  }

  @GetMapping("/offers/{id}")
  public ResponseEntity<OfferResponse> getOffer(@PathVariable UUID id) {
    return ResponseEntity.ok(OfferResponse.from(offerService.getOffer(id)));
  }

  @PutMapping("/offers/{id}")
  public ResponseEntity<OfferResponse> updateOffer(
      @PathVariable UUID id, @Valid @RequestBody OfferRequest request) {
    var offer =
        offerService.updateOffer(
            id,
            request.expectedVersion(),
            request.currency(),
            request.validUntil(),
            request.notes(),
            request.lineItems() != null ? LineItemRequest.toLineItems(request.lineItems()) : null);
    return ResponseEntity.ok(OfferResponse.from(offer));
  }

  @PostMapping("/offers/{id}/send")
  public ResponseEntity<OfferResponse> send(
      @PathVariable UUID id, @RequestBody(required = false) OfferTransitionRequest request) {
    return fire(id, OfferEvent.SEND, request);
  }

  @PostMapping("/offers/{id}/accept")
  public ResponseEntity<OfferResponse> accept(
      @PathVariable UUID id, @RequestBody(required = false) OfferTransitionRequest request) {
    return fire(id, OfferEvent.ACCEPT, request);
  }

  @PostMapping("/offers/{id}/reject")
  public ResponseEntity<OfferResponse> reject(
      @PathVariable UUID id, @RequestBody(required = false) OfferTransitionRequest request) {
    return fire(id, OfferEvent.REJECT, request);
  }

  @PostMapping("/offers/{id}/status")
  public ResponseEntity<OfferResponse> changeStatus(
      @PathVariable UUID id, @Valid @RequestBody OfferStatusRequest request) {
    var offer =
        offerService.changeStatus(
            id, request.status(), request.expectedVersion(), request.reason());
    return ResponseEntity.ok(OfferResponse.from(offer));
  }

  private ResponseEntity<OfferResponse> fire(
      UUID id, OfferEvent event, OfferTransitionRequest request) {
    var expectedVersion = request != null ? request.expectedVersion() : null;
    var reason = request != null ? request.reason() : null;
    return ResponseEntity.ok(
        OfferResponse.from(offerService.transition(id, event, expectedVersion, reason)));
  }

  // --- DTOs ---

  public record OfferRequest(
      Long expectedVersion,
      @Size(min = 3, max = 3) String currency,
      LocalDate validUntil,
      String notes,
      List<@Valid LineItemRequest> lineItems) {}

  public record LineItemRequest(
      @NotBlank @Size(max = 200) String productName,
      @Size(max = 1000) String description,
      @NotNull @Positive BigDecimal quantity,
      @NotNull @PositiveOrZero BigDecimal unitPrice,
      @PositiveOrZero @DecimalMax("100") BigDecimal discountPct,
      @PositiveOrZero @DecimalMax("100") BigDecimal vatPct) {

    static List<OfferLineItem> toLineItems(List<LineItemRequest> requests) {
      if (requests == null) {
        return List.of();
      }
      return requests.stream()
          .map(
              r ->
                  new OfferLineItem(
                      r.productName(),
                      r.description(),
                      r.quantity(),
                      r.unitPrice(),
                      r.discountPct(),
                      r.vatPct()))
          .toList();
    }
  }

  public record OfferTransitionRequest(Long expectedVersion, @Size(max = 500) String reason) {}

  public record OfferStatusRequest(
      @NotNull OfferStatus status, Long expectedVersion, @Size(max = 500) String reason) {}

  public record LineItemResponse(
      String productName,
      String description,
      BigDecimal quantity,
      BigDecimal unitPrice,
      BigDecimal discountPct,
      BigDecimal vatPct) {

    static LineItemResponse from(OfferLineItem item) {
      return new LineItemResponse(
          item.getProductName(),
          item.getDescription(),
          item.getQuantity(),
          item.getUnitPrice(),
          item.getDiscountPct(),
          item.getVatPct());
    }
  }

  public record OfferResponse(
      UUID id,
      long version,
      UUID leadId,
      int revision,
      String status,
      String currency,
      LocalDate validUntil,
      String notes,
      List<LineItemResponse> lineItems,
      BigDecimal subtotal,
      BigDecimal discountTotal,
      BigDecimal vatTotal,
      BigDecimal total,
      Instant sentAt,
      Instant acceptedAt,
      Instant rejectedAt,
      String rejectReason,
      Instant expiredAt,
      Instant updatedAt) {

    public static OfferResponse from(Offer offer) {
      return new OfferResponse(
          offer.getId(),
          offer.getVersion(),
          offer.getLeadId(),
          offer.getRevision(),
          offer.getStatus().toString(),
          offer.getCurrency(),
          offer.getValidUntil(),
          offer.getNotes(),
          offer.getLineItems().stream().map(LineItemResponse::from).toList(),
          offer.getSubtotal(),
          offer.getDiscountTotal(),
          offer.getVatTotal(),
          offer.getTotal(),
          offer.getSentAt(),
          offer.getAcceptedAt(),
          offer.getRejectedAt(),
          offer.getRejectReason(),
          offer.getExpiredAt(),
          offer.getUpdatedAt());
    }
  }
}
