package io.github.drompincen.pledgebook.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RegistryErrorKindTest {

    @Test
    void allErrorKindsExist() {
        assertThat(RegistryErrorKind.values()).containsExactly(
                RegistryErrorKind.NOT_FOUND,
                RegistryErrorKind.ALREADY_EXISTS,
                RegistryErrorKind.INVALID_INPUT);
    }

    @Test
    void valueOfReturnsCorrectEnum() {
        assertThat(RegistryErrorKind.valueOf("ALREADY_EXISTS")).isEqualTo(RegistryErrorKind.ALREADY_EXISTS);
    }
}
