package com.scholary.acquisition.importer;

import java.nio.file.Path;
import java.util.List;

/** A tool that files downloaded music into a library. */
public interface MusicImporter {

  String id();

  String name();

  /**
   * Import the given files or directories into {@code target}.
   *
   * @param asAlbum import all sources as one release rather than as individual tracks
   * @return the outcome; never throws for tool failures
   */
  ImportResult importSources(List<Path> sources, Path target, boolean asAlbum);

  /** True when the tool can be run. */
  boolean healthCheck();
}
