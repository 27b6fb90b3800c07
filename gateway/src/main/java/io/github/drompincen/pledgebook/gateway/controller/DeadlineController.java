package io.github.drompincen.pledgebook.gateway.controller;

import io.github.drompincen.pledgebook.persistence.document.DeadlineDocument;
import io.github.drompincen.pledgebook.protocol.api.DeadlineDto;
import io.github.drompincen.pledgebook.runtime.registry.ObjectiveRegistryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/deadlines")
public class DeadlineController {

    private final ObjectiveRegistryService registryService;

    public DeadlineController(ObjectiveRegistryService registryService) {
        this.registryService = registryService;
    }

    @GetMapping("/due")
    public List<DeadlineDto> due() {
        return registryService.findDueDeadlines().stream()
                .map(this::toDto)
                .collect(Collectors.toList());
    }

    @GetMapping("/{address}")
    public ResponseEntity<DeadlineDto> get(@PathVariable String address) {
        return registryService.findDeadline(address)
                .map(d -> ResponseEntity.ok(toDto(d)))
                .orElse(ResponseEntity.notFound().build());
    }

    private DeadlineDto toDto(DeadlineDocument doc) {
        return new DeadlineDto(doc.getAddress(), doc.getTargetPoint(), doc.getScheduledAt(),
                doc.isAlertActivated(), doc.getUpdatedAt());
    }
}
