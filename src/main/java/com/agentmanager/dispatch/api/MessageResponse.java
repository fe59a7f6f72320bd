package com.agentmanager.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MessageResponse(
    boolean sent,
    @JsonProperty("event_seq") long eventSeq,
    @JsonProperty("session_status") String sessionStatus
) {}
