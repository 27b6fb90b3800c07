package io.github.drompincen.pledgebook.protocol.api;

/** {@code completed} is boxed so that a body without the flag is distinguishable from {@code false}. */
public record ModifyObjectiveRequest(
        String description,
        Boolean completed
) {}
