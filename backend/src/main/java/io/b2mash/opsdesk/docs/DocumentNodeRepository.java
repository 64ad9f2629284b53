package io.b2mash.opsdesk.docs;

import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface DocumentNodeRepository extends JpaRepository<DocumentNode, UUID> {

  List<DocumentNode> findByLevelAndDeletedFalseOrderByNameAsc(DocumentLevel level);

  List<DocumentNode> findByParentIdAndDeletedFalseOrderByNameAsc(UUID parentId);

  List<DocumentNode> findByParentIdInAndDeletedFalse(Collection<UUID> parentIds);

  @Query("SELECT d FROM DocumentNode d ORDER BY d.updatedAt DESC, d.id")
  Slice<DocumentNode> findRecordPage(Pageable pageable);
}
