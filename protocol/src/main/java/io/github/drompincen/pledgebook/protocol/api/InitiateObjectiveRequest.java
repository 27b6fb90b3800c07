package io.github.drompincen.pledgebook.protocol.api;

public record InitiateObjectiveRequest(String description) {}
