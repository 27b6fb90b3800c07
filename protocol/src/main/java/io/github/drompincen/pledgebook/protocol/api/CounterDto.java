package io.github.drompincen.pledgebook.protocol.api;

public record CounterDto(long current) {}
