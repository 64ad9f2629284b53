package io.b2mash.opsdesk.search;

import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/search")
public class SearchController {

  private final SearchService searchService;

  public SearchController(SearchService searchService) {
    this.searchService = searchService;
  }

  @GetMapping("/results")
  public ResponseEntity<SearchResponse> results(
      @RequestParam(required = false) String query,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "20") int size) {
    return ResponseEntity.ok(searchService.results(query, page, size));
  }

  @PostMapping("/advanced-results")
  public ResponseEntity<SearchResponse> advancedResults(
      @RequestBody(required = false) SearchFilter filter,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "20") int size) {
    return ResponseEntity.ok(searchService.advancedResults(filter, page, size));
  }

  @PostMapping("/latest-tickets")
  public ResponseEntity<SearchResponse> latestTickets(
      @RequestBody(required = false) SearchFilter filter,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "20") int size) {
    return ResponseEntity.ok(searchService.latestTickets(filter, page, size));
  }

  @PostMapping("/options")
  public ResponseEntity<SearchOptions> options(
      @RequestBody(required = false) SearchFilter filter) {
    return ResponseEntity.ok(searchService.options(filter));
  }

  @GetMapping("/recommendations")
  public ResponseEntity<List<SearchHit>> recommendations(
      @RequestParam(required = false) String query) {
    return ResponseEntity.ok(searchService.recommendations(query));
  }
}
