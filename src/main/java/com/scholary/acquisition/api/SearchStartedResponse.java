package com.scholary.acquisition.api;

/** Id of a newly started search session. */
public record SearchStartedResponse(String searchId) {}
