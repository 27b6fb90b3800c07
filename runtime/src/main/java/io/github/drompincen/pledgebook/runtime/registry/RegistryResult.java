package io.github.drompincen.pledgebook.runtime.registry;

import io.github.drompincen.pledgebook.protocol.api.RegistryErrorKind;

/**
 * Outcome of a registry operation. Business-rule violations come back as a failed
 * result carrying a {@link RegistryErrorKind}; they are never thrown.
 */
public record RegistryResult<T>(
        boolean success,
        T value,
        RegistryErrorKind errorKind,
        String message
) {
    public static <T> RegistryResult<T> success(T value) {
        return new RegistryResult<>(true, value, null, null);
    }

    public static <T> RegistryResult<T> failure(RegistryErrorKind errorKind, String message) {
        return new RegistryResult<>(false, null, errorKind, message);
    }
}
