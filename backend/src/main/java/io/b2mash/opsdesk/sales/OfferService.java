package io.b2mash.opsdesk.sales;

import io.b2mash.opsdesk.exception.IllegalTransitionException;
import io.b2mash.opsdesk.exception.ResourceNotFoundException;
import io.b2mash.opsdesk.health.BackendHealthMonitor;
import io.b2mash.opsdesk.installation.InstallationService;
import io.b2mash.opsdesk.lifecycle.ChangePublisher;
import io.b2mash.opsdesk.lifecycle.ExpectedVersion;
import io.b2mash.opsdesk.lifecycle.LifecycleEvent;
import io.b2mash.opsdesk.lifecycle.TransitionContext;
import io.b2mash.opsdesk.store.EntityType;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class OfferService {

  private static final Logger log = LoggerFactory.getLogger(OfferService.class);

  private final OfferRepository offerRepository;
  private final LeadRepository leadRepository;
  private final InstallationService installationService;
  private final BackendHealthMonitor healthMonitor;
  private final ChangePublisher changePublisher;
  private final LeadActivityService activityService;
  private final int defaultValidityDays;

  public OfferService(
      OfferRepository offerRepository,
      LeadRepository leadRepository,
      InstallationService installationService,
      BackendHealthMonitor healthMonitor,
      ChangePublisher changePublisher,
      LeadActivityService activityService,
      @Value("${opsdesk.offer.default-validity-days:30}") int defaultValidityDays) {
    this.offerRepository = offerRepository;
    this.leadRepository = leadRepository;
    this.installationService = installationService;
    this.healthMonitor = healthMonitor;
    this.changePublisher = changePublisher;
    this.activityService = activityService;
    this.defaultValidityDays = defaultValidityDays;
  }

  @Transactional
  public Offer createOffer(
      UUID leadId,
      String currency,
      LocalDate validUntil,
      String notes,
      List<OfferLineItem> lineItems) {
    healthMonitor.requireRelationalAvailable();
    var lead = findLead(leadId);
    if (!lead.acceptsOffers()) {
      throw new IllegalTransitionException(
          Lead.ENTITY,
          lead.getStatus(),
          "create offer",
          "Cannot create an offer for lead " + leadId + " in status " + lead.getStatus());
    }
    int revision = offerRepository.findMaxRevision(leadId) + 1;
    var offer =
        new Offer(
            leadId,
            revision,
            currency,
            validUntil != null ? validUntil : LocalDate.now().plusDays(defaultValidityDays),
            notes);
    offer.replaceLineItems(lineItems != null ? lineItems : List.of());
    offer = offerRepository.saveAndFlush(offer);
    activityService.record(
        leadId, ActivityType.FIELD_CHANGE, "Offer v" + revision + " created", offer.getId());
    changePublisher.changed(EntityType.OFFER, offer.getId(), offer.getVersion());
    log.info("Created offer {} (revision {}) for lead {}", offer.getId(), revision, leadId);
    return offer;
  }

  @Transactional(readOnly = true)
  public Offer getOffer(UUID id) {
    return offerRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException(Offer.ENTITY, id));
  }

  @Transactional(readOnly = true)
  public List<Offer> listOffersForLead(UUID leadId) {
    findLead(leadId);
    return offerRepository.findByLeadIdOrderByRevisionAsc(leadId);
  }

  @Transactional
  public Offer updateOffer(
      UUID id,
      Long expectedVersion,
      String currency,
      LocalDate validUntil,
      String notes,
      List<OfferLineItem> lineItems) {
    healthMonitor.requireRelationalAvailable();
    var offer = getOffer(id);
    ExpectedVersion.check(Offer.ENTITY, id, expectedVersion, offer.getVersion());
    offer.updateTerms(currency, validUntil, notes);
    if (lineItems != null) {
      offer.replaceLineItems(lineItems);
    }
    offerRepository.saveAndFlush(offer);
    activityService.record(
        offer.getLeadId(),
        ActivityType.FIELD_CHANGE,
        "Offer v" + offer.getRevision() + " updated",
        offer.getId());
    changePublisher.changed(EntityType.OFFER, offer.getId(), offer.getVersion());
    return offer;
  }

  /**
   * Fires {@code event} on the offer. Accepting also creates the pending installation job in the
   * same transaction.
   */
  @Transactional
  public Offer transition(UUID id, OfferEvent event, Long expectedVersion, String reason) {
    healthMonitor.requireRelationalAvailable();
    var offer = getOffer(id);
    ExpectedVersion.check(Offer.ENTITY, id, expectedVersion, offer.getVersion());
    return fire(offer, event, reason);
  }

  @Transactional
  public Offer changeStatus(UUID id, OfferStatus target, Long expectedVersion, String reason) {
    healthMonitor.requireRelationalAvailable();
    var offer = getOffer(id);
    var event = LifecycleEvent.resolve(OfferEvent.class, offer.getStatus(), target, Offer.ENTITY);
    return transition(id, event, expectedVersion, reason);
  }

  /** Expires the offer if it is still SENT past its validity. Returns false otherwise. */
  @Transactional
  public boolean expireIfOverdue(UUID id, LocalDate today) {
    var offer = getOffer(id);
    if (offer.getStatus() != OfferStatus.SENT || !offer.isPastValidity(today)) {
      return false;
    }
    fire(offer, OfferEvent.EXPIRE, null);
    return true;
  }

  private Offer fire(Offer offer, OfferEvent event, String reason) {
    var lead = findLead(offer.getLeadId());
    var from = offer.apply(event, reason);
    offerRepository.saveAndFlush(offer);
    activityService.record(
        lead.getId(),
        event == OfferEvent.SEND ? ActivityType.OFFER_SENT : ActivityType.FIELD_CHANGE,
        "Offer v" + offer.getRevision() + " " + offer.getStatus(),
        offer.getId());
    if (event == OfferEvent.ACCEPT) {
      installationService.createForAcceptedOffer(
          lead.getId(),
          offer.getId(),
          lead.getCompanyId(),
          lead.getOwnerId(),
          lead.getCompanyName());
    }
    changePublisher.transitioned(context(offer, lead), event, from, offer.getVersion());
    log.info("Offer {} moved {} -> {}", offer.getId(), from, offer.getStatus());
    return offer;
  }

  private Lead findLead(UUID leadId) {
    return leadRepository
        .findById(leadId)
        .orElseThrow(() -> new ResourceNotFoundException(Lead.ENTITY, leadId));
  }

  private static TransitionContext context(Offer offer, Lead lead) {
    return new TransitionContext(
        EntityType.OFFER,
        offer.getId(),
        OfferRecordSource.title(offer, lead),
        lead.getOwnerId(),
        lead.getCompanyId(),
        null);
  }
}
