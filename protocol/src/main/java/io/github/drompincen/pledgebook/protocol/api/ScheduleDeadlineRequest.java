package io.github.drompincen.pledgebook.protocol.api;

/**
 * @param offset number of counter ticks from now; the deadline is stored as an absolute point
 */
public record ScheduleDeadlineRequest(long offset) {}
