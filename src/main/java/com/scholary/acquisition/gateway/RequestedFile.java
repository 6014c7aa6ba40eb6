package com.scholary.acquisition.gateway;

/** A file we ask a peer to send, as posted to the gateway. */
public record RequestedFile(String filename, long size) {}
