package io.b2mash.opsdesk.docs;

import io.b2mash.opsdesk.exception.ResourceNotFoundException;
import io.b2mash.opsdesk.health.BackendHealthMonitor;
import io.b2mash.opsdesk.lifecycle.ChangePublisher;
import io.b2mash.opsdesk.lifecycle.ExpectedVersion;
import io.b2mash.opsdesk.store.EntityType;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class DocumentService {

  private static final Logger log = LoggerFactory.getLogger(DocumentService.class);

  private final DocumentNodeRepository nodeRepository;
  private final BackendHealthMonitor healthMonitor;
  private final ChangePublisher changePublisher;

  public DocumentService(
      DocumentNodeRepository nodeRepository,
      BackendHealthMonitor healthMonitor,
      ChangePublisher changePublisher) {
    this.nodeRepository = nodeRepository;
    this.healthMonitor = healthMonitor;
    this.changePublisher = changePublisher;
  }

  /**
   * Creates a node of {@code level} under {@code parentId}. The parent must be a live node of the
   * level directly above; anything else is reported as a missing parent.
   */
  @Transactional
  public DocumentNode createNode(
      DocumentLevel level,
      UUID parentId,
      String name,
      String description,
      String solution,
      String imagePath,
      String status) {
    healthMonitor.requireRelationalAvailable();
    if (!level.isRoot()) {
      requireLiveNode(level.parentLevel(), parentId);
    }
    var node = new DocumentNode(level, level.isRoot() ? null : parentId, name, description);
    if (level == DocumentLevel.STEP) {
      node.setStepContent(solution, imagePath, status);
    }
    node = nodeRepository.saveAndFlush(node);
    changePublisher.changed(EntityType.DOCUMENT, node.getId(), node.getVersion());
    log.info("Created {} {} under {}", level.label().toLowerCase(), node.getId(), parentId);
    return node;
  }

  @Transactional(readOnly = true)
  public List<DocumentNode> listCategories() {
    return nodeRepository.findByLevelAndDeletedFalseOrderByNameAsc(DocumentLevel.CATEGORY);
  }

  /** Lists the live children of a live parent of {@code parentLevel}. */
  @Transactional(readOnly = true)
  public List<DocumentNode> listChildren(DocumentLevel parentLevel, UUID parentId) {
    requireLiveNode(parentLevel, parentId);
    return nodeRepository.findByParentIdAndDeletedFalseOrderByNameAsc(parentId);
  }

  @Transactional
  public DocumentNode updateStep(
      UUID id,
      Long expectedVersion,
      String name,
      String description,
      String solution,
      String imagePath,
      String status) {
    healthMonitor.requireRelationalAvailable();
    var step = requireLiveNode(DocumentLevel.STEP, id);
    ExpectedVersion.check(DocumentNode.ENTITY, id, expectedVersion, step.getVersion());
    step.updateStep(name, description, solution, imagePath, status);
    nodeRepository.saveAndFlush(step);
    changePublisher.changed(EntityType.DOCUMENT, step.getId(), step.getVersion());
    return step;
  }

  /**
   * Logically deletes the node and every live descendant. Each deleted node publishes its own
   * change so the index receives a tombstone per node. Returns the number of nodes deleted.
   */
  @Transactional
  public int deleteNode(UUID id, Long expectedVersion) {
    healthMonitor.requireRelationalAvailable();
    var root =
        nodeRepository
            .findById(id)
            .filter(node -> !node.isDeleted())
            .orElseThrow(() -> new ResourceNotFoundException(DocumentNode.ENTITY, id));
    ExpectedVersion.check(DocumentNode.ENTITY, id, expectedVersion, root.getVersion());

    var deleted = new ArrayList<DocumentNode>();
    var frontier = List.of(root);
    while (!frontier.isEmpty()) {
      for (var node : frontier) {
        if (node.markDeleted()) {
          deleted.add(node);
        }
      }
      var ids = frontier.stream().map(DocumentNode::getId).toList();
      frontier = nodeRepository.findByParentIdInAndDeletedFalse(ids);
    }
    nodeRepository.saveAllAndFlush(deleted);
    for (var node : deleted) {
      changePublisher.changed(EntityType.DOCUMENT, node.getId(), node.getVersion());
    }
    log.info("Deleted document node {} with {} descendant(s)", id, deleted.size() - 1);
    return deleted.size();
  }

  private DocumentNode requireLiveNode(DocumentLevel level, UUID id) {
    if (id == null) {
      throw new ResourceNotFoundException(level.label(), "null");
    }
    return nodeRepository
        .findById(id)
        .filter(node -> node.getLevel() == level && !node.isDeleted())
        .orElseThrow(() -> new ResourceNotFoundException(level.label(), id));
  }
}
