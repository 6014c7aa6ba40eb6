package com.scholary.acquisition.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** One file offered by a peer in a search response. Bit rate and length are often missing. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PeerFile(String filename, long size, Integer bitRate, Integer length) {}
