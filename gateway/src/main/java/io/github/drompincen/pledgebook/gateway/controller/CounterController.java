package io.github.drompincen.pledgebook.gateway.controller;

import io.github.drompincen.pledgebook.protocol.api.CounterDto;
import io.github.drompincen.pledgebook.runtime.counter.BlockCounter;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class CounterController {

    private final BlockCounter blockCounter;

    public CounterController(BlockCounter blockCounter) {
        this.blockCounter = blockCounter;
    }

    @GetMapping("/api/counter")
    public CounterDto current() {
        return new CounterDto(blockCounter.current());
    }
}
