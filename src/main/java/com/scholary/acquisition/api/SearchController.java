package com.scholary.acquisition.api;

import com.scholary.acquisition.search.SearchCoordinator;
import com.scholary.acquisition.search.SearchPoll;
import com.scholary.acquisition.search.SearchState;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.time.Duration;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for search sessions.
 *
 * <p>Start a session, then poll it until {@code hasMore} is false. Each poll may hold the request
 * open for several seconds while waiting for peers to answer.
 */
@RestController
@Tag(name = "Search", description = "Peer-network search sessions")
public class SearchController {

  private final SearchCoordinator searchCoordinator;

  public SearchController(SearchCoordinator searchCoordinator) {
    this.searchCoordinator = searchCoordinator;
  }

  @PostMapping("/api/searches")
  @Operation(summary = "Start search", description = "Start a search session and return its id")
  public ResponseEntity<SearchStartedResponse> start(@Valid @RequestBody SearchRequest request) {
    String searchId =
        searchCoordinator.startSearch(
            request.artist(),
            request.album(),
            request.tracks(),
            request.timeoutSeconds() != null
                ? Duration.ofSeconds(request.timeoutSeconds())
                : null);
    return ResponseEntity.status(HttpStatus.CREATED).body(new SearchStartedResponse(searchId));
  }

  @GetMapping("/api/searches/{id}")
  @Operation(
      summary = "Poll search",
      description = "Long-poll a search session for newly grouped results")
  public ResponseEntity<SearchPollResponse> poll(@PathVariable String id) {
    SearchPoll poll = searchCoordinator.pollSearch(id);
    SearchPollResponse body = SearchPollResponse.of(id, poll);
    if (poll.state() == SearchState.NOT_FOUND) {
      return ResponseEntity.status(HttpStatus.NOT_FOUND).body(body);
    }
    return ResponseEntity.ok(body);
  }

  @DeleteMapping("/api/searches/{id}")
  @Operation(summary = "Delete search", description = "Stop a search session")
  public ResponseEntity<Void> delete(@PathVariable String id) {
    if (!searchCoordinator.deleteSearch(id)) {
      return ResponseEntity.notFound().build();
    }
    return ResponseEntity.noContent().build();
  }
}
