package io.b2mash.opsdesk.docs;

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

/** Document nodes carry no owner or company; deleted nodes are returned as tombstones. */
@Component
public class DocumentRecordSource implements RecordSource {

  private final DocumentNodeRepository nodeRepository;

  public DocumentRecordSource(DocumentNodeRepository nodeRepository) {
    this.nodeRepository = nodeRepository;
  }

  @Override
  public EntityType type() {
    return EntityType.DOCUMENT;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<EntityRecord> load(UUID id) {
    return nodeRepository.findById(id).map(DocumentRecordSource::toRecord);
  }

  @Override
  @Transactional(readOnly = true)
  public Slice<EntityRecord> page(RecordQuery query, Pageable pageable) {
    return nodeRepository.findRecordPage(pageable).map(DocumentRecordSource::toRecord);
  }

  static EntityRecord toRecord(DocumentNode node) {
    var body =
        Stream.of(node.getDescription(), node.getSolution())
            .filter(Objects::nonNull)
            .collect(Collectors.joining(" "));
    return new EntityRecord(
        EntityType.DOCUMENT,
        node.getId(),
        node.getVersion(),
        node.isDeleted(),
        node.getStatus(),
        node.getName(),
        body,
        null,
        null,
        null,
        node.getParentId(),
        node.getCreatedAt(),
        node.getUpdatedAt());
  }
}
