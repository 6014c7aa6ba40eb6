package com.scholary.acquisition.importer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finds where the gateway actually wrote a finished download.
 *
 * <p>The reported filename is the peer's path ("@@peer\Music\Artist\Album\01 - Track.flac"), but
 * the gateway stores files under its download directory using only part of that path. Candidates
 * are tried in order and the first existing file wins:
 *
 * <ol>
 *   <li>the full path under the root
 *   <li>the path without a leading "@@peer" component
 *   <li>the last three components
 *   <li>the last two components
 *   <li>the bare filename
 *   <li>a search for the filename up to {@value #MAX_SEARCH_DEPTH} levels below the root
 * </ol>
 */
@Component
public class DownloadPathResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(DownloadPathResolver.class);

  static final int MAX_SEARCH_DEPTH = 5;
  private static final String PEER_MARKER = "@@";

  /** How a path was found. */
  public enum Strategy {
    EXACT,
    WITHOUT_PEER_MARKER,
    LAST_THREE_COMPONENTS,
    LAST_TWO_COMPONENTS,
    FILENAME_ONLY,
    RECURSIVE_SEARCH
  }

  public record ResolvedPath(Path path, Strategy strategy) {}

  public Optional<ResolvedPath> resolve(String reportedFilename, Path downloadRoot) {
    List<String> parts = new ArrayList<>();
    for (String part : reportedFilename.replace('\\', '/').split("/")) {
      if (!part.isEmpty() && !part.equals(".") && !part.equals("..")) {
        parts.add(part);
      }
    }
    if (parts.isEmpty()) {
      return Optional.empty();
    }
    Path root = downloadRoot.toAbsolutePath().normalize();
    int size = parts.size();

    Optional<ResolvedPath> found = tryCandidate(root, parts, Strategy.EXACT);
    if (found.isEmpty() && parts.get(0).startsWith(PEER_MARKER) && size > 1) {
      found = tryCandidate(root, parts.subList(1, size), Strategy.WITHOUT_PEER_MARKER);
    }
    if (found.isEmpty() && size >= 3) {
      found = tryCandidate(root, parts.subList(size - 3, size), Strategy.LAST_THREE_COMPONENTS);
    }
    if (found.isEmpty() && size >= 2) {
      found = tryCandidate(root, parts.subList(size - 2, size), Strategy.LAST_TWO_COMPONENTS);
    }
    if (found.isEmpty()) {
      found = tryCandidate(root, parts.subList(size - 1, size), Strategy.FILENAME_ONLY);
    }
    if (found.isEmpty()) {
      found = search(root, parts.get(size - 1));
    }
    if (found.isEmpty()) {
      LOGGER.warn("Could not locate download {} under {}", reportedFilename, root);
    }
    return found;
  }

  private static Optional<ResolvedPath> tryCandidate(
      Path root, List<String> parts, Strategy strategy) {
    Path candidate = root;
    for (String part : parts) {
      candidate = candidate.resolve(part);
    }
    candidate = candidate.normalize();
    if (candidate.startsWith(root) && Files.isRegularFile(candidate)) {
      LOGGER.debug("Resolved {} via {}", candidate, strategy);
      return Optional.of(new ResolvedPath(candidate, strategy));
    }
    return Optional.empty();
  }

  private static Optional<ResolvedPath> search(Path root, String filename) {
    if (!Files.isDirectory(root)) {
      return Optional.empty();
    }
    try (Stream<Path> walk = Files.walk(root, MAX_SEARCH_DEPTH)) {
      return walk.filter(p -> p.getFileName() != null)
          .filter(p -> p.getFileName().toString().equals(filename))
          .filter(Files::isRegularFile)
          .sorted()
          .findFirst()
          .map(p -> new ResolvedPath(p, Strategy.RECURSIVE_SEARCH));
    } catch (IOException | UncheckedIOException e) {
      LOGGER.warn("Search for {} under {} failed: {}", filename, root, e.getMessage());
      return Optional.empty();
    }
  }
}
