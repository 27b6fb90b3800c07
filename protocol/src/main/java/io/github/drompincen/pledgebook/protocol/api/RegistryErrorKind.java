package io.github.drompincen.pledgebook.protocol.api;

/**
 * Failure taxonomy shared by every registry operation.
 */
public enum RegistryErrorKind {
    /** The operation needs an objective for the address and there is none. */
    NOT_FOUND,
    /** The operation needs the address to be free and an objective already exists. */
    ALREADY_EXISTS,
    /** A supplied value failed its field-level check. */
    INVALID_INPUT
}
