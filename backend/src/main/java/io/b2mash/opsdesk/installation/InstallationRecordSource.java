package io.b2mash.opsdesk.installation;

import io.b2mash.opsdesk.store.EntityRecord;
import io.b2mash.opsdesk.store.EntityType;
import io.b2mash.opsdesk.store.RecordQuery;
import io.b2mash.opsdesk.store.relational.RecordSource;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class InstallationRecordSource implements RecordSource {

  private final InstallationJobRepository jobRepository;

  public InstallationRecordSource(InstallationJobRepository jobRepository) {
    this.jobRepository = jobRepository;
  }

  @Override
  public EntityType type() {
    return EntityType.INSTALLATION;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<EntityRecord> load(UUID id) {
    return jobRepository.findById(id).map(InstallationRecordSource::toRecord);
  }

  @Override
  @Transactional(readOnly = true)
  public Slice<EntityRecord> page(RecordQuery query, Pageable pageable) {
    return jobRepository
        .findRecordPage(query.ownerId(), query.companyId(), query.technicianId(), pageable)
        .map(InstallationRecordSource::toRecord);
  }

  static EntityRecord toRecord(InstallationJob job) {
    var body = new StringBuilder();
    if (job.getScheduledDate() != null) {
      body.append("scheduled ").append(job.getScheduledDate()).append(' ');
    }
    if (job.getNotes() != null) {
      body.append(job.getNotes());
    }
    return new EntityRecord(
        EntityType.INSTALLATION,
        job.getId(),
        job.getVersion(),
        false,
        job.getStatus().toString(),
        job.getTitle(),
        body.toString().trim(),
        job.getOwnerId(),
        job.getCompanyId(),
        job.getTechnicianId(),
        job.getOfferId(),
        job.getCreatedAt(),
        job.getUpdatedAt());
  }
}
