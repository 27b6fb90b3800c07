package io.github.drompincen.pledgebook.protocol.api;

public record DelegateObjectiveRequest(
        String targetAddress,
        String description
) {}
