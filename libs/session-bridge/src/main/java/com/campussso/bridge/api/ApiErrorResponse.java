package com.campussso.bridge.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ApiErrorResponse(
    String error, @JsonProperty("error_description") String errorDescription) {}
