package io.github.drompincen.pledgebook.protocol.api;

public record ErrorDto(
        RegistryErrorKind kind,
        String message
) {}
