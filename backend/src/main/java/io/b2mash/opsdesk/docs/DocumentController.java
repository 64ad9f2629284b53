package io.b2mash.opsdesk.docs;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/docs")
public class DocumentController {

  private final DocumentService documentService;

  public DocumentController(DocumentService documentService) {
    this.documentService = documentService;
  }

  @PostMapping("/categories")
  public ResponseEntity<DocumentNodeResponse> createCategory(
      @Valid @RequestBody NodeRequest request) {
    return create(DocumentLevel.CATEGORY, null, request);
  }

  @GetMapping("/categories")
  public ResponseEntity<List<DocumentNodeResponse>> listCategories() {
    return ResponseEntity.ok(toResponses(documentService.listCategories()));
  }

  @PostMapping("/categories/{id}/subcategories")
  public ResponseEntity<DocumentNodeResponse> createSubcategory(
      @PathVariable UUID id, @Valid @RequestBody NodeRequest request) {
    return create(DocumentLevel.SUBCATEGORY, id, request);
  }

  @GetMapping("/categories/{id}/subcategories")
  public ResponseEntity<List<DocumentNodeResponse>> listSubcategories(@PathVariable UUID id) {
    return ResponseEntity.ok(
        toResponses(documentService.listChildren(DocumentLevel.CATEGORY, id)));
  }

  @PostMapping("/subcategories/{id}/subsubcategories")
  public ResponseEntity<DocumentNodeResponse> createSubsubcategory(
      @PathVariable UUID id, @Valid @RequestBody NodeRequest request) {
    return create(DocumentLevel.SUBSUBCATEGORY, id, request);
  }

  @GetMapping("/subcategories/{id}/subsubcategories")
  public ResponseEntity<List<DocumentNodeResponse>> listSubsubcategories(@PathVariable UUID id) {
    return ResponseEntity.ok(
        toResponses(documentService.listChildren(DocumentLevel.SUBCATEGORY, id)));
  }

  @PostMapping("/subsubcategories/{id}/steps")
  public ResponseEntity<DocumentNodeResponse> createStep(
      @PathVariable UUID id, @Valid @RequestBody NodeRequest request) {
    return create(DocumentLevel.STEP, id, request);
  }

  @GetMapping("/subsubcategories/{id}/steps")
  public ResponseEntity<List<DocumentNodeResponse>> listSteps(@PathVariable UUID id) {
    return ResponseEntity.ok(
        toResponses(documentService.listChildren(DocumentLevel.SUBSUBCATEGORY, id)));
  }

  @PutMapping("/steps/{id}")
  public ResponseEntity<DocumentNodeResponse> updateStep(
      @PathVariable UUID id, @Valid @RequestBody NodeRequest request) {
    var step =
        documentService.updateStep(
            id,
            request.expectedVersion(),
            request.name(),
            request.description(),
            request.solution(),
            request.imagePath(),
            request.status());
    return ResponseEntity.ok(DocumentNodeResponse.from(step));
  }

  @DeleteMapping("/nodes/{id}")
  public ResponseEntity<DeleteResponse> deleteNode(
      @PathVariable UUID id, @RequestParam(required = false) Long expectedVersion) {
    return ResponseEntity.ok(new DeleteResponse(documentService.deleteNode(id, expectedVersion)));
  }

  private ResponseEntity<DocumentNodeResponse> create(
      DocumentLevel level, UUID parentId, NodeRequest request) {
    var node =
        documentService.createNode(
            level,
            parentId,
            request.name(),
            request.description(),
            request.solution(),
            request.imagePath(),
            request.status());
    return ResponseEntity.created(URI.create("/docs/nodes/" + node.getId()))
        .body(DocumentNodeResponse.from(node));
  }

  private static List<DocumentNodeResponse> toResponses(List<DocumentNode> nodes) {
    return nodes.stream().map(DocumentNodeResponse::from).toList();
  }

  // --- DTOs ---

  public record NodeRequest(
      Long expectedVersion,
      @NotBlank @Size(max = 200) String name,
      String description,
      String solution,
      @Size(max = 500) String imagePath,
      @Size(max = 20) String status) {}

  public record DeleteResponse(int deleted) {}

  public record DocumentNodeResponse(
      UUID id,
      long version,
      String level,
      UUID parentId,
      String name,
      String description,
      String solution,
      String imagePath,
      String status,
      Instant createdAt,
      Instant updatedAt) {

    public static DocumentNodeResponse from(DocumentNode node) {
      return new DocumentNodeResponse(
          node.getId(),
          node.getVersion(),
          node.getLevel().name(),
          node.getParentId(),
          node.getName(),
          node.getDescription(),
          node.getSolution(),
          node.getImagePath(),
          node.getStatus(),
          node.getCreatedAt(),
          node.getUpdatedAt());
    }
  }
}
