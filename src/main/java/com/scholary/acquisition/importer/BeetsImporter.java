package com.scholary.acquisition.importer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs {@code beet import} as an external process.
 *
 * <p>Command line: {@code beet -c <config> -l <target>/<library> -d <target> import -q [-s]
 * <sources...>}. {@code -s} is added for singleton (non-album) imports.
 *
 * <p>Output is redirected to temp files rather than read from pipes so a chatty process can never
 * block on a full pipe buffer. Classification:
 *
 * <ul>
 *   <li>no exit within the timeout: process killed, TIMED_OUT
 *   <li>exit 0 with "skip" anywhere in the output: SKIPPED (duplicate or no confident match)
 *   <li>exit 0 otherwise: SUCCESS
 *   <li>non-zero exit: FAILED with stderr, else stdout, else the exit code
 * </ul>
 */
@Component
public class BeetsImporter implements MusicImporter {

  private static final Logger LOGGER = LoggerFactory.getLogger(BeetsImporter.class);

  private final ImporterProperties properties;

  public BeetsImporter(ImporterProperties properties) {
    this.properties = properties;
  }

  @Override
  public String id() {
    return "beets";
  }

  @Override
  public String name() {
    return "Beets";
  }

  @Override
  public ImportResult importSources(List<Path> sources, Path target, boolean asAlbum) {
    for (Path source : sources) {
      if (!Files.exists(source)) {
        return ImportResult.failed("Source path does not exist: " + source);
      }
    }
    try {
      Files.createDirectories(target);
    } catch (IOException e) {
      return ImportResult.failed(
          "Cannot create target directory " + target + ": " + e.getMessage());
    }

    List<String> command = buildCommand(sources, target, asAlbum);
    LOGGER.info(
        "Starting beet import of {} items into {} (album={}, config={})",
        sources.size(),
        target,
        asAlbum,
        properties.configPath());

    Path stdout = null;
    Path stderr = null;
    try {
      stdout = Files.createTempFile("beet-import-", ".out");
      stderr = Files.createTempFile("beet-import-", ".err");
      Process process =
          new ProcessBuilder(command)
              .redirectOutput(stdout.toFile())
              .redirectError(stderr.toFile())
              .start();

      if (!process.waitFor(properties.timeoutSeconds(), TimeUnit.SECONDS)) {
        process.destroyForcibly();
        LOGGER.warn(
            "Beet import timed out after {}s for sources {}",
            properties.timeoutSeconds(),
            sources);
        return ImportResult.timedOut(
            String.format("Import timed out after %ds", properties.timeoutSeconds()));
      }

      String out = Files.readString(stdout, StandardCharsets.UTF_8);
      String err = Files.readString(stderr, StandardCharsets.UTF_8);
      int exitCode = process.exitValue();
      return classify(exitCode, out, err);

    } catch (IOException e) {
      LOGGER.error("Could not run beet import", e);
      return ImportResult.failed("Could not run importer: " + e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return ImportResult.failed("Import interrupted");
    } finally {
      deleteQuietly(stdout);
      deleteQuietly(stderr);
    }
  }

  @Override
  public boolean healthCheck() {
    try {
      Process process =
          new ProcessBuilder(properties.command(), "version")
              .redirectErrorStream(true)
              .redirectOutput(ProcessBuilder.Redirect.DISCARD)
              .start();
      if (!process.waitFor(10, TimeUnit.SECONDS)) {
        process.destroyForcibly();
        return false;
      }
      return process.exitValue() == 0;
    } catch (IOException e) {
      LOGGER.warn("Importer health check failed: {}", e.getMessage());
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  List<String> buildCommand(List<Path> sources, Path target, boolean asAlbum) {
    List<String> command = new ArrayList<>();
    command.add(properties.command());
    command.add("-c");
    command.add(properties.configPath());
    command.add("-l");
    command.add(target.resolve(properties.libraryFileName()).toString());
    command.add("-d");
    command.add(target.toString());
    command.add("import");
    command.add("-q");
    if (!asAlbum) {
      command.add("-s");
    }
    for (Path source : sources) {
      command.add(source.toString());
    }
    return command;
  }

  static ImportResult classify(int exitCode, String stdout, String stderr) {
    if (exitCode == 0) {
      String combined = (stdout + stderr).toLowerCase(Locale.ROOT);
      if (combined.contains("skip")) {
        LOGGER.info("Beet import skipped items");
        return ImportResult.skipped("Skipped by beets (duplicate or no confident match)");
      }
      LOGGER.info("Beet import successful");
      return ImportResult.success();
    }
    String reason;
    if (!stderr.isBlank()) {
      reason = stderr.trim();
    } else if (!stdout.isBlank()) {
      reason = stdout.trim();
    } else {
      reason = "exit code " + exitCode;
    }
    LOGGER.warn("Beet import failed: {}", reason);
    return ImportResult.failed(reason);
  }

  private static void deleteQuietly(Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.debug("Could not delete temp file {}: {}", file, e.getMessage());
    }
  }
}
