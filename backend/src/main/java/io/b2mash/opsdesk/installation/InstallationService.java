package io.b2mash.opsdesk.installation;

import io.b2mash.opsdesk.exception.InvalidRequestException;
import io.b2mash.opsdesk.exception.ResourceNotFoundException;
import io.b2mash.opsdesk.health.BackendHealthMonitor;
import io.b2mash.opsdesk.lifecycle.ChangePublisher;
import io.b2mash.opsdesk.lifecycle.ExpectedVersion;
import io.b2mash.opsdesk.lifecycle.TransitionContext;
import io.b2mash.opsdesk.store.EntityType;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class InstallationService {

  private static final Logger log = LoggerFactory.getLogger(InstallationService.class);

  static final EnumSet<InstallationStatus> OPEN_STATUSES =
      EnumSet.of(InstallationStatus.SCHEDULED, InstallationStatus.IN_PROGRESS);

  private final InstallationJobRepository jobRepository;
  private final TechnicianRepository technicianRepository;
  private final BackendHealthMonitor healthMonitor;
  private final ChangePublisher changePublisher;
  private final int graceDays;

  public InstallationService(
      InstallationJobRepository jobRepository,
      TechnicianRepository technicianRepository,
      BackendHealthMonitor healthMonitor,
      ChangePublisher changePublisher,
      @Value("${opsdesk.installation.undone-grace-days:7}") int graceDays) {
    this.jobRepository = jobRepository;
    this.technicianRepository = technicianRepository;
    this.healthMonitor = healthMonitor;
    this.changePublisher = changePublisher;
    this.graceDays = graceDays;
  }

  /** Creates the pending job for an accepted offer. Joins the caller's transaction. */
  @Transactional
  public InstallationJob createForAcceptedOffer(
      UUID leadId, UUID offerId, UUID companyId, UUID ownerId, String title) {
    var job =
        jobRepository.saveAndFlush(
            new InstallationJob(leadId, offerId, companyId, ownerId, title));
    changePublisher.changed(EntityType.INSTALLATION, job.getId(), job.getVersion());
    log.info("Created installation job {} for offer {}", job.getId(), offerId);
    return job;
  }

  @Transactional(readOnly = true)
  public InstallationJob getJob(UUID id) {
    return jobRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException(InstallationJob.ENTITY, id));
  }

  @Transactional
  public InstallationJob schedule(
      UUID id, LocalDate date, UUID technicianId, Long expectedVersion) {
    healthMonitor.requireRelationalAvailable();
    var job = getJob(id);
    ExpectedVersion.check(InstallationJob.ENTITY, id, expectedVersion, job.getVersion());
    if (technicianId != null) {
      var technician =
          technicianRepository
              .findById(technicianId)
              .orElseThrow(() -> new ResourceNotFoundException("Technician", technicianId));
      if (!technician.isActive()) {
        throw new InvalidRequestException(
            "Technician inactive", "Technician " + technicianId + " cannot be assigned");
      }
    }
    var from = job.schedule(date, technicianId, graceDays, LocalDate.now());
    jobRepository.saveAndFlush(job);
    changePublisher.transitioned(context(job), InstallationEvent.SCHEDULE, from, job.getVersion());
    log.info("Scheduled installation {} on {} for technician {}", id, date, technicianId);
    return job;
  }

  @Transactional
  public InstallationJob start(UUID id, Long expectedVersion) {
    return transition(id, InstallationEvent.START, expectedVersion);
  }

  @Transactional
  public InstallationJob finish(UUID id, Long expectedVersion) {
    return transition(id, InstallationEvent.FINISH, expectedVersion);
  }

  /**
   * Marks the job undone if it is still open past its deadline. Returns false when the job moved on
   * since it was selected.
   */
  @Transactional
  public boolean markUndoneIfOverdue(UUID id, LocalDate today) {
    var job = getJob(id);
    if (!OPEN_STATUSES.contains(job.getStatus()) || !job.isPastDeadline(today)) {
      return false;
    }
    var from = job.apply(InstallationEvent.MARK_UNDONE);
    jobRepository.saveAndFlush(job);
    changePublisher.transitioned(
        context(job), InstallationEvent.MARK_UNDONE, from, job.getVersion());
    return true;
  }

  @Transactional(readOnly = true)
  public Page<InstallationJob> listUndone(
      UUID companyId, UUID technicianId, String q, int page, int size) {
    if (size < 1 || size > 200) {
      throw new InvalidRequestException("Invalid page size", "size must be between 1 and 200");
    }
    var pattern = "%" + (q == null ? "" : q.trim().toLowerCase(Locale.ROOT)) + "%";
    return jobRepository.findUndone(
        InstallationStatus.UNDONE,
        OPEN_STATUSES,
        LocalDate.now(),
        companyId,
        technicianId,
        pattern,
        PageRequest.of(Math.max(page, 0), size));
  }

  private InstallationJob transition(UUID id, InstallationEvent event, Long expectedVersion) {
    healthMonitor.requireRelationalAvailable();
    var job = getJob(id);
    ExpectedVersion.check(InstallationJob.ENTITY, id, expectedVersion, job.getVersion());
    var from = job.apply(event);
    jobRepository.saveAndFlush(job);
    changePublisher.transitioned(context(job), event, from, job.getVersion());
    log.info("Installation {} moved {} -> {}", id, from, job.getStatus());
    return job;
  }

  private TransitionContext context(InstallationJob job) {
    return new TransitionContext(
        EntityType.INSTALLATION,
        job.getId(),
        job.getTitle(),
        job.getOwnerId(),
        job.getCompanyId(),
        job.getTechnicianId());
  }
}
