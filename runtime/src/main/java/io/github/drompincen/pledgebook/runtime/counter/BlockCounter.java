package io.github.drompincen.pledgebook.runtime.counter;

/**
 * Source of the monotonically increasing counter that deadlines are measured against.
 */
@FunctionalInterface
public interface BlockCounter {

    long current();
}
