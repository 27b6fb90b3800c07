package io.github.drompincen.pledgebook.protocol.api;

import java.time.Instant;

public record DeadlineDto(
        String address,
        long targetPoint,
        long scheduledAt,
        boolean alertActivated,
        Instant updatedAt
) {}
