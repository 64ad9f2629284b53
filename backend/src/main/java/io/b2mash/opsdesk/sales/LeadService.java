package io.b2mash.opsdesk.sales;

import io.b2mash.opsdesk.exception.ResourceNotFoundException;
import io.b2mash.opsdesk.health.BackendHealthMonitor;
import io.b2mash.opsdesk.lifecycle.ChangePublisher;
import io.b2mash.opsdesk.lifecycle.ExpectedVersion;
import io.b2mash.opsdesk.lifecycle.LifecycleEvent;
import io.b2mash.opsdesk.lifecycle.TransitionContext;
import io.b2mash.opsdesk.store.EntityType;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class LeadService {

  private static final Logger log = LoggerFactory.getLogger(LeadService.class);

  private final LeadRepository leadRepository;
  private final BackendHealthMonitor healthMonitor;
  private final ChangePublisher changePublisher;
  private final LeadActivityService activityService;

  public LeadService(
      LeadRepository leadRepository,
      BackendHealthMonitor healthMonitor,
      ChangePublisher changePublisher,
      LeadActivityService activityService) {
    this.leadRepository = leadRepository;
    this.healthMonitor = healthMonitor;
    this.changePublisher = changePublisher;
    this.activityService = activityService;
  }

  @Transactional
  public Lead createLead(
      String companyName,
      String contactName,
      String email,
      String phone,
      UUID ownerId,
      UUID companyId,
      String notes,
      BigDecimal dealValue,
      LocalDate nextFollowUpDate) {
    healthMonitor.requireRelationalAvailable();
    var lead = new Lead(companyName, contactName, ownerId, companyId);
    lead.updateDetails(
        companyName, contactName, email, phone, notes, dealValue, nextFollowUpDate);
    lead = leadRepository.saveAndFlush(lead);
    activityService.record(lead.getId(), ActivityType.FIELD_CHANGE, "Lead created", null);
    changePublisher.changed(EntityType.LEAD, lead.getId(), lead.getVersion());
    log.info("Created lead {} for owner {}", lead.getId(), ownerId);
    return lead;
  }

  @Transactional(readOnly = true)
  public Lead getLead(UUID id) {
    return leadRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException(Lead.ENTITY, id));
  }

  @Transactional(readOnly = true)
  public Page<Lead> listLeads(LeadStatus status, UUID ownerId, String q, Pageable pageable) {
    var pattern = "%" + (q == null ? "" : q.trim().toLowerCase(Locale.ROOT)) + "%";
    return leadRepository.findFiltered(status, ownerId, pattern, pageable);
  }

  @Transactional
  public Lead updateLead(
      UUID id,
      Long expectedVersion,
      String companyName,
      String contactName,
      String email,
      String phone,
      String notes,
      BigDecimal dealValue,
      LocalDate nextFollowUpDate) {
    healthMonitor.requireRelationalAvailable();
    var lead = getLead(id);
    ExpectedVersion.check(Lead.ENTITY, id, expectedVersion, lead.getVersion());
    lead.updateDetails(
        companyName, contactName, email, phone, notes, dealValue, nextFollowUpDate);
    leadRepository.saveAndFlush(lead);
    activityService.record(id, ActivityType.FIELD_CHANGE, "Lead updated", null);
    changePublisher.changed(EntityType.LEAD, lead.getId(), lead.getVersion());
    return lead;
  }

  @Transactional
  public Lead transition(UUID id, LeadEvent event, Long expectedVersion, String reason) {
    healthMonitor.requireRelationalAvailable();
    var lead = getLead(id);
    ExpectedVersion.check(Lead.ENTITY, id, expectedVersion, lead.getVersion());
    var from = lead.apply(event, reason);
    leadRepository.saveAndFlush(lead);
    activityService.record(
        id, ActivityType.STATUS_CHANGE, "Status: " + from + " -> " + lead.getStatus(), null);
    changePublisher.transitioned(context(lead), event, from, lead.getVersion());
    log.info("Lead {} moved {} -> {}", id, from, lead.getStatus());
    return lead;
  }

  /** Applies whichever client event moves the lead to {@code target}. */
  @Transactional
  public Lead changeStatus(UUID id, LeadStatus target, Long expectedVersion, String reason) {
    healthMonitor.requireRelationalAvailable();
    var lead = getLead(id);
    var event = LifecycleEvent.resolve(LeadEvent.class, lead.getStatus(), target, Lead.ENTITY);
    return transition(id, event, expectedVersion, reason);
  }

  static TransitionContext context(Lead lead) {
    return new TransitionContext(
        EntityType.LEAD,
        lead.getId(),
        lead.getCompanyName(),
        lead.getOwnerId(),
        lead.getCompanyId(),
        null);
  }
}
