package io.github.drompincen.pledgebook.protocol.api;

public record ConfirmationDto(String message) {}
