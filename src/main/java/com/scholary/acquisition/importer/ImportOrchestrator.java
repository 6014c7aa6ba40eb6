package com.scholary.acquisition.importer;

import com.scholary.acquisition.config.AcquisitionProperties;
import com.scholary.acquisition.gateway.TransferRecord;
import com.scholary.acquisition.gateway.TransferState;
import com.scholary.acquisition.logging.StructuredLogger;
import com.scholary.acquisition.updates.TransferUpdateSink;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Hands finished downloads to the {@link MusicImporter} and reports the result per file.
 *
 * <p>Each record is first located on disk; a record that cannot be found is marked import-failed
 * and never reaches the importer. In album mode the located files are grouped by parent directory
 * and each directory is imported as one release. Files lying directly in the download root have no
 * release folder and are imported one by one instead. In singleton mode every file is imported on
 * its own.
 *
 * <p>Skipped, failed and timed-out imports delete the source files (and their folder once empty)
 * so rejected downloads do not pile up.
 */
@Service
public class ImportOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(ImportOrchestrator.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final String UNRESOLVED = "Could not resolve file path";

  private final MusicImporter importer;
  private final DownloadPathResolver pathResolver;
  private final Path downloadRoot;
  private final boolean albumMode;

  public ImportOrchestrator(
      MusicImporter importer, DownloadPathResolver pathResolver, AcquisitionProperties properties) {
    this.importer = importer;
    this.pathResolver = pathResolver;
    this.downloadRoot = Path.of(properties.downloadRoot()).toAbsolutePath().normalize();
    this.albumMode = properties.albumMode();
  }

  /**
   * Import successfully transferred records into {@code targetDir}, publishing every state change.
   */
  public void processCompleted(
      List<TransferRecord> records, Path targetDir, TransferUpdateSink sink) {
    if (records.isEmpty()) {
      LOGGER.info("No successful downloads to import");
      return;
    }
    LOGGER.info("Importing {} downloads into {}", records.size(), targetDir);

    Map<Path, List<Located>> releases = new LinkedHashMap<>();
    List<Located> singles = new ArrayList<>();
    for (TransferRecord record : records) {
      Optional<DownloadPathResolver.ResolvedPath> resolved =
          pathResolver.resolve(record.filename(), downloadRoot);
      if (resolved.isEmpty()) {
        sink.publish(
            List.of(record.withImportState(TransferState.IMPORT_FAILED, UNRESOLVED, UNRESOLVED)));
        continue;
      }
      Located located = new Located(record, resolved.get().path());
      Path parent = located.path().getParent();
      if (albumMode && parent != null && !parent.equals(downloadRoot)) {
        releases.computeIfAbsent(parent, k -> new ArrayList<>()).add(located);
      } else {
        singles.add(located);
      }
    }

    for (Map.Entry<Path, List<Located>> release : releases.entrySet()) {
      importGroup(release.getValue(), List.of(release.getKey()), true, targetDir, sink);
    }
    for (Located single : singles) {
      importGroup(List.of(single), List.of(single.path()), false, targetDir, sink);
    }
  }

  private void importGroup(
      List<Located> entries,
      List<Path> sources,
      boolean asAlbum,
      Path targetDir,
      TransferUpdateSink sink) {
    sink.publish(
        entries.stream()
            .map(e -> e.record().withImportState(TransferState.IMPORTING, "Importing", null))
            .toList());

    ImportResult result;
    try {
      result = importer.importSources(sources, targetDir, asAlbum);
    } catch (RuntimeException e) {
      LOGGER.error("Importer {} failed unexpectedly", importer.id(), e);
      result = ImportResult.failed("Import error: " + e.getMessage());
    }
    STRUCTURED_LOGGER.logImportResult(
        entries.size(), asAlbum, result.outcome().name(), result.reason());

    TransferState state;
    String description;
    String error = null;
    ImportResult.Outcome outcome = result.outcome();
    if (outcome == ImportResult.Outcome.SUCCESS) {
      state = TransferState.IMPORTED;
      description = "Imported";
    } else if (outcome == ImportResult.Outcome.SKIPPED) {
      state = TransferState.IMPORT_SKIPPED;
      description = result.reason() != null ? result.reason() : "Import skipped";
    } else if (outcome == ImportResult.Outcome.TIMED_OUT) {
      state = TransferState.IMPORT_FAILED;
      description = result.reason() != null ? result.reason() : "Import timed out";
      error = description;
    } else {
      state = TransferState.IMPORT_FAILED;
      description = "Import failed: " + result.reason();
      error = result.reason();
    }

    String finalError = error;
    sink.publish(
        entries.stream()
            .map(e -> e.record().withImportState(state, description, finalError))
            .toList());

    if (result.outcome() != ImportResult.Outcome.SUCCESS) {
      cleanUp(entries);
    }
  }

  /** Best effort: a file we cannot delete is logged and left behind. */
  private void cleanUp(List<Located> entries) {
    for (Located entry : entries) {
      Path file = entry.path();
      try {
        if (Files.deleteIfExists(file)) {
          LOGGER.info("Removed rejected download {}", file);
        }
        Path parent = file.getParent();
        if (parent != null && !parent.equals(downloadRoot) && isEmptyDirectory(parent)) {
          Files.delete(parent);
          LOGGER.info("Removed empty folder {}", parent);
        }
      } catch (IOException e) {
        LOGGER.warn("Could not clean up {}: {}", file, e.getMessage());
      }
    }
  }

  private static boolean isEmptyDirectory(Path dir) throws IOException {
    if (!Files.isDirectory(dir)) {
      return false;
    }
    try (Stream<Path> children = Files.list(dir)) {
      return children.findAny().isEmpty();
    }
  }

  private record Located(TransferRecord record, Path path) {}
}
