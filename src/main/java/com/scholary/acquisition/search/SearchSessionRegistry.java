package com.scholary.acquisition.search;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory store of active search sessions.
 *
 * <p>Sessions a client abandons without polling to completion are evicted once they have not been
 * touched for the retention period. Nothing survives a restart.
 */
@Repository
public class SearchSessionRegistry {

  private final Cache<String, SearchSession> cache;

  public SearchSessionRegistry(
      @Value("${acquisition.search.sessionRetentionMinutes}") int retentionMinutes) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterAccess(Duration.ofMinutes(retentionMinutes))
            .build();
  }

  public void save(SearchSession session) {
    cache.put(session.getSearchId(), session);
  }

  public Optional<SearchSession> findById(String searchId) {
    return Optional.ofNullable(cache.getIfPresent(searchId));
  }

  /** @return true if a session was removed */
  public boolean remove(String searchId) {
    return cache.asMap().remove(searchId) != null;
  }
}
