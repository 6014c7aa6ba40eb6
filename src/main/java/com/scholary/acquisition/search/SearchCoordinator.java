package com.scholary.acquisition.search;

import com.scholary.acquisition.config.AcquisitionProperties;
import com.scholary.acquisition.gateway.GatewayException;
import com.scholary.acquisition.gateway.PeerResponse;
import com.scholary.acquisition.gateway.TransferClient;
import com.scholary.acquisition.logging.StructuredLogger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Runs search sessions against the gateway.
 *
 * <p>A session is started with the artist, optional album and the wanted track titles. Callers
 * then poll it repeatedly. Each poll is a long poll: it waits up to the long-poll window for the
 * gateway to report more peer responses, and as soon as it does, every response collected so far
 * is re-scored and re-grouped from scratch. A session ends when:
 *
 * <ul>
 *   <li>more groups than the result cap have been found (Completed, gateway search deleted)
 *   <li>its timeout passes (Completed if anything was ever found, otherwise TimedOut)
 *   <li>the gateway no longer knows the search (NotFound)
 *   <li>the caller deletes it
 * </ul>
 */
@Service
public class SearchCoordinator {

  private static final Logger LOGGER = LoggerFactory.getLogger(SearchCoordinator.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final TransferClient transferClient;
  private final SearchSessionRegistry sessions;
  private final AcquisitionProperties.Search settings;
  private final Clock clock;

  public SearchCoordinator(
      TransferClient transferClient,
      SearchSessionRegistry sessions,
      AcquisitionProperties properties,
      Clock clock) {
    this.transferClient = transferClient;
    this.sessions = sessions;
    this.settings = properties.search();
    this.clock = clock;
  }

  /**
   * Start a search session.
   *
   * @param artist wanted artist
   * @param album wanted album, or null for a track search
   * @param trackTitles wanted tracks
   * @param timeout session lifetime, or null for the configured default
   * @return the session id to poll
   * @throws GatewayException if the gateway refuses the search
   */
  public String startSearch(
      String artist, String album, List<String> trackTitles, Duration timeout) {
    List<String> titles = trackTitles == null ? List.of() : List.copyOf(trackTitles);
    Duration lifetime =
        timeout != null ? timeout : Duration.ofSeconds(settings.defaultTimeoutSeconds());
    String query = buildQuery(artist, album, titles);

    String searchId = transferClient.submitSearch(query, lifetime);
    sessions.save(
        new SearchSession(
            searchId, artist, blankToNull(album), titles, clock.instant(), lifetime));
    LOGGER.info(
        "Search session {} started: query='{}', tracks={}", searchId, query, titles.size());
    return searchId;
  }

  /**
   * Poll a session, waiting up to the long-poll window for new peer responses.
   *
   * @throws GatewayException for gateway failures other than "search not found"
   */
  public SearchPoll pollSearch(String searchId) {
    MDC.put("searchId", searchId);
    try {
      return doPoll(searchId);
    } finally {
      MDC.remove("searchId");
    }
  }

  /**
   * Forget a session and delete the gateway-side search.
   *
   * @return true if the session was known
   */
  public boolean deleteSearch(String searchId) {
    boolean known = sessions.remove(searchId);
    transferClient.deleteSearch(searchId);
    LOGGER.info("Search session {} deleted (known={})", searchId, known);
    return known;
  }

  private SearchPoll doPoll(String searchId) {
    Instant pollStart = clock.instant();
    Duration longPoll = Duration.ofSeconds(settings.longPollSeconds());

    while (true) {
      Optional<SearchSession> found = sessions.findById(searchId);
      if (found.isEmpty()) {
        return SearchPoll.finished(SearchState.NOT_FOUND);
      }
      SearchSession session = found.get();

      if (session.isExpired(clock.instant())) {
        return expire(session);
      }

      List<PeerResponse> responses;
      try {
        responses = transferClient.pollSearchResponses(searchId);
      } catch (GatewayException e) {
        if (e.isNotFound()) {
          sessions.remove(searchId);
          LOGGER.info("Gateway no longer knows search {}", searchId);
          return SearchPoll.finished(SearchState.NOT_FOUND);
        }
        throw e;
      }

      if (session.advanceSeen(responses.size())) {
        List<AlbumGroup> groups =
            AlbumGrouper.group(
                responses,
                session.getArtist(),
                session.getAlbum(),
                session.getTrackTitles(),
                settings.minScore());

        if (groups.size() > settings.maxResults()) {
          finish(searchId);
          STRUCTURED_LOGGER.logSearchPoll(
              searchId, responses.size(), settings.maxResults(), SearchState.COMPLETED.name());
          return new SearchPoll(
              groups.subList(0, settings.maxResults()), false, SearchState.COMPLETED);
        }
        STRUCTURED_LOGGER.logSearchPoll(
            searchId, responses.size(), groups.size(), SearchState.IN_PROGRESS.name());
        return new SearchPoll(groups, true, SearchState.IN_PROGRESS);
      }

      if (Duration.between(pollStart, clock.instant()).compareTo(longPoll) >= 0) {
        return SearchPoll.noNews();
      }
      try {
        Thread.sleep(settings.pollRetryMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        LOGGER.info("Poll of search {} interrupted", searchId);
        return SearchPoll.noNews();
      }
    }
  }

  private SearchPoll expire(SearchSession session) {
    String searchId = session.getSearchId();
    finish(searchId);
    SearchState state =
        session.getSeenResponseCount() > 0 ? SearchState.COMPLETED : SearchState.TIMED_OUT;
    LOGGER.info("Search {} reached its timeout, reporting {}", searchId, state);
    return SearchPoll.finished(state);
  }

  /** Drop the session and stop the gateway-side search. Best effort: the results already stand. */
  private void finish(String searchId) {
    sessions.remove(searchId);
    try {
      transferClient.deleteSearch(searchId);
    } catch (GatewayException e) {
      LOGGER.warn("Could not delete finished search {}: {}", searchId, e.getMessage());
    }
  }

  /**
   * Album searches for several tracks query by album title; a single track, or a search without an
   * album, queries by track title, which the network's index answers better.
   */
  static String buildQuery(String artist, String album, List<String> trackTitles) {
    String who = artist == null ? "" : artist.trim();
    boolean hasAlbum = album != null && !album.isBlank();
    String what;
    if (hasAlbum && trackTitles.size() != 1) {
      what = album.trim();
    } else if (!trackTitles.isEmpty()) {
      what = trackTitles.get(0).trim();
    } else {
      what = "";
    }
    return (who + " " + what).trim();
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
