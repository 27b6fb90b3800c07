package io.github.drompincen.pledgebook.gateway.controller;

import io.github.drompincen.pledgebook.protocol.api.ConfirmationDto;
import io.github.drompincen.pledgebook.protocol.api.ErrorDto;
import io.github.drompincen.pledgebook.protocol.api.RegistryErrorKind;
import io.github.drompincen.pledgebook.runtime.registry.RegistryResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

final class RegistryResponses {

    private RegistryResponses() {}

    static ResponseEntity<?> confirm(RegistryResult<String> result) {
        if (result.success()) {
            return ResponseEntity.ok(new ConfirmationDto(result.value()));
        }
        return ResponseEntity.status(statusFor(result.errorKind()))
                .body(new ErrorDto(result.errorKind(), result.message()));
    }

    static HttpStatus statusFor(RegistryErrorKind kind) {
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ALREADY_EXISTS -> HttpStatus.CONFLICT;
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
        };
    }
}
