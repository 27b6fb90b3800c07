package io.github.drompincen.pledgebook.protocol.api;

import java.time.Instant;

public record PriorityDto(
        String address,
        int urgency,
        Instant updatedAt
) {}
