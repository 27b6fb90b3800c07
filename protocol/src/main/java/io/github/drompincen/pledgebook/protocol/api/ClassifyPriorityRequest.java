package io.github.drompincen.pledgebook.protocol.api;

public record ClassifyPriorityRequest(int urgency) {}
