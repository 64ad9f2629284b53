package io.b2mash.opsdesk.installation;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Scheduled job that marks scheduled or in-progress installations past their deadline as UNDONE.
 * Each job is transitioned in its own transaction so one failure does not hold back the rest.
 */
@Component
public class InstallationDeadlineProcessor {

  private static final Logger log = LoggerFactory.getLogger(InstallationDeadlineProcessor.class);

  private final InstallationJobRepository jobRepository;
  private final InstallationService installationService;
  private final TransactionTemplate transactionTemplate;

  public InstallationDeadlineProcessor(
      InstallationJobRepository jobRepository,
      InstallationService installationService,
      TransactionTemplate transactionTemplate) {
    this.jobRepository = jobRepository;
    this.installationService = installationService;
    this.transactionTemplate = transactionTemplate;
  }

  @Scheduled(fixedRateString = "${opsdesk.installation.deadline-interval:3600000}")
  public void processOverdueJobs() {
    processOverdueJobs(LocalDate.now());
  }

  public int processOverdueJobs(LocalDate today) {
    List<UUID> overdue;
    try {
      overdue =
          transactionTemplate.execute(
              status ->
                  jobRepository.findIdsPastDeadline(InstallationService.OPEN_STATUSES, today));
    } catch (RuntimeException e) {
      log.warn("Installation deadline sweep skipped: {}", e.getMessage());
      return 0;
    }
    if (overdue == null || overdue.isEmpty()) {
      log.debug("Installation deadline sweep completed: no overdue jobs");
      return 0;
    }

    int marked = 0;
    for (var id : overdue) {
      try {
        if (installationService.markUndoneIfOverdue(id, today)) {
          marked++;
        }
      } catch (RuntimeException e) {
        log.error("Failed to mark installation {} undone", id, e);
      }
    }
    log.info("Installation deadline sweep completed: {} job(s) marked undone", marked);
    return marked;
  }
}
