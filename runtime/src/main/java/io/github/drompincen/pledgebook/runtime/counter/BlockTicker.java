package io.github.drompincen.pledgebook.runtime.counter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "pledgebook.counter.ticking", havingValue = "true", matchIfMissing = true)
public class BlockTicker {

    private static final Logger log = LoggerFactory.getLogger(BlockTicker.class);

    private final BlockCounterService blockCounterService;

    public BlockTicker(BlockCounterService blockCounterService) {
        this.blockCounterService = blockCounterService;
    }

    @Scheduled(fixedDelayString = "${pledgebook.counter.tick-millis:12000}")
    public void tick() {
        try {
            long next = blockCounterService.advance();
            log.debug("Block counter advanced to {}", next);
        } catch (DataAccessException e) {
            log.error("Failed to persist block counter, will retry on next tick", e);
        }
    }
}
