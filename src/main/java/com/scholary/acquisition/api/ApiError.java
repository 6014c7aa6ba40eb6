package com.scholary.acquisition.api;

/** Error body. {@code gatewayStatus} is set only for failures reported by the gateway. */
public record ApiError(int status, String message, Integer gatewayStatus) {}
