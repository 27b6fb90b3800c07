package io.github.drompincen.pledgebook.runtime.counter;

import io.github.drompincen.pledgebook.persistence.document.CounterDocument;
import io.github.drompincen.pledgebook.persistence.repository.CounterRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

@Service
public class BlockCounterService implements BlockCounter {

    private static final Logger log = LoggerFactory.getLogger(BlockCounterService.class);

    private final CounterRepository counterRepository;
    private final AtomicLong value;

    public BlockCounterService(CounterRepository counterRepository,
                               @Value("${pledgebook.counter.initial-value:0}") long initialValue) {
        this.counterRepository = counterRepository;
        long persisted = counterRepository.findById(CounterDocument.BLOCK)
                .map(CounterDocument::getValue)
                .orElse(initialValue);
        // a configured initial value may move the counter forward, never back
        this.value = new AtomicLong(Math.max(persisted, initialValue));
        log.info("Block counter starting at {}", value.get());
    }

    @Override
    public long current() {
        return value.get();
    }

    /**
     * Moves the counter forward by one and persists the new value. The in-memory value
     * only changes once the save succeeded, so a failed write leaves {@link #current()} as it was.
     */
    public synchronized long advance() {
        long next = value.get() + 1;
        CounterDocument doc = new CounterDocument(CounterDocument.BLOCK, next);
        doc.setAdvancedAt(Instant.now());
        counterRepository.save(doc);
        value.set(next);
        return next;
    }
}
