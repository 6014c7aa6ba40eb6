package com.scholary.acquisition.updates;

import com.scholary.acquisition.gateway.TransferRecord;
import java.util.List;

/** Receives ordered snapshots of transfer records for one user. */
@FunctionalInterface
public interface TransferUpdateSink {

  void publish(List<TransferRecord> records);
}
