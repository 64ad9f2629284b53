package io.b2mash.opsdesk.docs;

import io.b2mash.opsdesk.exception.InvalidRequestException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One node of the troubleshooting tree. Children reference their parent by id; the reference is
 * fixed at creation. Deletion is logical so the search projection can carry a tombstone.
 */
@Entity
@Table(name = "document_nodes")
public class DocumentNode {

  public static final String ENTITY = "Document";
  public static final String DEFAULT_STATUS = "active";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Version
  @Column(name = "version", nullable = false)
  private Long version;

  @Enumerated(EnumType.STRING)
  @Column(name = "level", nullable = false, length = 20, updatable = false)
  private DocumentLevel level;

  @Column(name = "parent_id", updatable = false)
  private UUID parentId;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "solution", columnDefinition = "TEXT")
  private String solution;

  @Column(name = "image_path", length = 500)
  private String imagePath;

  @Column(name = "status", nullable = false, length = 20)
  private String status;

  @Column(name = "deleted", nullable = false)
  private boolean deleted;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected DocumentNode() {}

  public DocumentNode(DocumentLevel level, UUID parentId, String name, String description) {
    this.level = Objects.requireNonNull(level, "level must not be null");
    if (level.isRoot() != (parentId == null)) {
      throw new IllegalArgumentException(
          level.label() + " nodes " + (level.isRoot() ? "have no parent" : "require a parent"));
    }
    this.parentId = parentId;
    this.name = Objects.requireNonNull(name, "name must not be null");
    this.description = description;
    this.status = DEFAULT_STATUS;
  }

  @PrePersist
  void onCreate() {
    var now = Instant.now();
    this.createdAt = now;
    this.updatedAt = now;
  }

  @PreUpdate
  void onUpdate() {
    this.updatedAt = Instant.now();
  }

  public void updateStep(
      String name, String description, String solution, String imagePath, String status) {
    if (level != DocumentLevel.STEP) {
      throw new InvalidRequestException(
          "Not a step", level.label() + " nodes carry no solution content");
    }
    if (deleted) {
      throw new InvalidRequestException("Step deleted", "Deleted steps cannot be edited");
    }
    if (name != null && !name.isBlank()) {
      this.name = name;
    }
    this.description = description;
    this.solution = solution;
    this.imagePath = imagePath;
    this.status = status != null && !status.isBlank() ? status : DEFAULT_STATUS;
    this.updatedAt = Instant.now();
  }

  public void setStepContent(String solution, String imagePath, String status) {
    this.solution = solution;
    this.imagePath = imagePath;
    if (status != null && !status.isBlank()) {
      this.status = status;
    }
  }

  /** Returns false when the node was already deleted. */
  public boolean markDeleted() {
    if (deleted) {
      return false;
    }
    var now = Instant.now();
    this.deleted = true;
    this.deletedAt = now;
    this.updatedAt = now;
    return true;
  }

  public UUID getId() {
    return id;
  }

  public Long getVersion() {
    return version;
  }

  public DocumentLevel getLevel() {
    return level;
  }

  public UUID getParentId() {
    return parentId;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public String getSolution() {
    return solution;
  }

  public String getImagePath() {
    return imagePath;
  }

  public String getStatus() {
    return status;
  }

  public boolean isDeleted() {
    return deleted;
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
