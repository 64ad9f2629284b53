package io.b2mash.opsdesk.sales;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/** Scheduled job that expires sent offers whose validity date has passed. */
@Component
public class OfferExpiryProcessor {

  private static final Logger log = LoggerFactory.getLogger(OfferExpiryProcessor.class);

  private final OfferRepository offerRepository;
  private final OfferService offerService;
  private final TransactionTemplate transactionTemplate;

  public OfferExpiryProcessor(
      OfferRepository offerRepository,
      OfferService offerService,
      TransactionTemplate transactionTemplate) {
    this.offerRepository = offerRepository;
    this.offerService = offerService;
    this.transactionTemplate = transactionTemplate;
  }

  @Scheduled(fixedRateString = "${opsdesk.offer.expiry-interval:3600000}")
  public void expireOffers() {
    expireOffers(LocalDate.now());
  }

  public int expireOffers(LocalDate today) {
    List<UUID> candidates;
    try {
      candidates =
          transactionTemplate.execute(
              status ->
                  offerRepository.findByStatusAndValidUntilBefore(OfferStatus.SENT, today).stream()
                      .map(Offer::getId)
                      .toList());
    } catch (RuntimeException e) {
      log.warn("Offer expiry sweep skipped: {}", e.getMessage());
      return 0;
    }
    if (candidates == null || candidates.isEmpty()) {
      return 0;
    }

    int expired = 0;
    for (var id : candidates) {
      try {
        if (offerService.expireIfOverdue(id, today)) {
          expired++;
        }
      } catch (RuntimeException e) {
        log.error("Failed to expire offer {}", id, e);
      }
    }
    log.info("Offer expiry sweep completed: {} offer(s) expired", expired);
    return expired;
  }
}
