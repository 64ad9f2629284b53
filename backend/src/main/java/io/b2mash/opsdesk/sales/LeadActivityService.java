package io.b2mash.opsdesk.sales;

import io.b2mash.opsdesk.exception.ResourceNotFoundException;
import io.b2mash.opsdesk.health.BackendHealthMonitor;
import io.b2mash.opsdesk.member.RequestScopes;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Activity log of a lead. Lead and offer changes record their entries through {@link #record}
 * inside their own transaction, so an entry exists exactly when the change committed.
 */
@Service
public class LeadActivityService {

  private static final Logger log = LoggerFactory.getLogger(LeadActivityService.class);

  static final int LIST_LIMIT = 200;

  private final LeadActivityRepository activityRepository;
  private final LeadRepository leadRepository;
  private final BackendHealthMonitor healthMonitor;

  public LeadActivityService(
      LeadActivityRepository activityRepository,
      LeadRepository leadRepository,
      BackendHealthMonitor healthMonitor) {
    this.activityRepository = activityRepository;
    this.leadRepository = leadRepository;
    this.healthMonitor = healthMonitor;
  }

  /** Appends an entry attributed to the calling member, if any. */
  @Transactional
  public LeadActivity record(UUID leadId, ActivityType type, String content, UUID offerId) {
    var activity =
        new LeadActivity(leadId, RequestScopes.getMemberIdOrNull(), type, content, offerId);
    return activityRepository.save(activity);
  }

  @Transactional
  public LeadActivity addActivity(UUID leadId, ActivityType type, String content) {
    healthMonitor.requireRelationalAvailable();
    requireLead(leadId);
    var activity = record(leadId, type, content, null);
    log.info("Logged {} activity on lead {}", type, leadId);
    return activity;
  }

  /** Newest entries first, at most {@value #LIST_LIMIT}. */
  @Transactional(readOnly = true)
  public List<LeadActivity> listActivity(UUID leadId) {
    requireLead(leadId);
    return activityRepository.findLatestForLead(leadId, PageRequest.of(0, LIST_LIMIT));
  }

  private void requireLead(UUID leadId) {
    if (!leadRepository.existsById(leadId)) {
      throw new ResourceNotFoundException(Lead.ENTITY, leadId);
    }
  }
}
