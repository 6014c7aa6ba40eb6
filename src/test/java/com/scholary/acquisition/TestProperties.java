package com.scholary.acquisition;

import com.scholary.acquisition.config.AcquisitionProperties;

/** Small, fast settings for unit tests. */
public final class TestProperties {

  private TestProperties() {}

  public static AcquisitionProperties acquisition(String downloadRoot, boolean albumMode) {
    return new AcquisitionProperties(
        downloadRoot,
        albumMode,
        new AcquisitionProperties.Search(120, 1, 10, 50, 0.6, 30),
        new AcquisitionProperties.Transfer(3, 0, 3, 0),
        new AcquisitionProperties.Monitor(1, 3, 60));
  }
}
