package io.b2mash.opsdesk.sales;

import io.b2mash.opsdesk.store.EntityRecord;
import io.b2mash.opsdesk.store.EntityType;
import io.b2mash.opsdesk.store.RecordQuery;
import io.b2mash.opsdesk.store.relational.RecordSource;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class LeadRecordSource implements RecordSource {

  private final LeadRepository leadRepository;

  public LeadRecordSource(LeadRepository leadRepository) {
    this.leadRepository = leadRepository;
  }

  @Override
  public EntityType type() {
    return EntityType.LEAD;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<EntityRecord> load(UUID id) {
    return leadRepository.findById(id).map(LeadRecordSource::toRecord);
  }

  @Override
  @Transactional(readOnly = true)
  public Slice<EntityRecord> page(RecordQuery query, Pageable pageable) {
    return leadRepository
        .findRecordPage(query.ownerId(), query.companyId(), pageable)
        .map(LeadRecordSource::toRecord);
  }

  static EntityRecord toRecord(Lead lead) {
    var body =
        Stream.of(lead.getContactName(), lead.getEmail(), lead.getPhone(), lead.getNotes())
            .filter(Objects::nonNull)
            .collect(Collectors.joining(" "));
    return new EntityRecord(
        EntityType.LEAD,
        lead.getId(),
        lead.getVersion(),
        false,
        lead.getStatus().toString(),
        lead.getCompanyName(),
        body,
        lead.getOwnerId(),
        lead.getCompanyId(),
        null,
        null,
        lead.getCreatedAt(),
        lead.getUpdatedAt());
  }
}
