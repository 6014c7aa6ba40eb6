package com.scholary.acquisition.gateway;

import java.time.Duration;
import java.util.List;

/**
 * Operations this service needs from a peer-network transfer backend.
 *
 * <p>Every method may throw {@link GatewayException}; retry policy is the caller's business.
 */
public interface TransferClient {

  /** Stable identifier used to select this backend. */
  String id();

  /** Human-readable backend name. */
  String name();

  /**
   * Start a network-wide search. Subject to the search rate limit.
   *
   * @return the gateway's session id
   */
  String submitSearch(String query, Duration timeout);

  /** All peer responses collected so far for a search, oldest first. */
  List<PeerResponse> pollSearchResponses(String searchId);

  /** Stop and discard a search. A search the gateway no longer knows about is not an error. */
  void deleteSearch(String searchId);

  /** Ask one peer for files. Returns one verdict per requested file. */
  List<SubmittedFile> submitDownloads(String username, List<RequestedFile> files);

  /** Every download the gateway knows about, across all peers. */
  List<TransferRecord> listAllTransfers();

  void cancelTransfer(String username, String transferId, boolean remove);

  void clearCompletedTransfers();

  /** True when the gateway answers and accepts our credentials. */
  boolean checkConnectivity();
}
