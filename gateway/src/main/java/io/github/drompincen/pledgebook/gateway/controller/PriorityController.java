package io.github.drompincen.pledgebook.gateway.controller;

import io.github.drompincen.pledgebook.persistence.document.PriorityDocument;
import io.github.drompincen.pledgebook.protocol.api.PriorityDto;
import io.github.drompincen.pledgebook.runtime.registry.ObjectiveRegistryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/priorities")
public class PriorityController {

    private final ObjectiveRegistryService registryService;

    public PriorityController(ObjectiveRegistryService registryService) {
        this.registryService = registryService;
    }

    @GetMapping("/{address}")
    public ResponseEntity<PriorityDto> get(@PathVariable String address) {
        return registryService.findPriority(address)
                .map(d -> ResponseEntity.ok(toDto(d)))
                .orElse(ResponseEntity.notFound().build());
    }

    private PriorityDto toDto(PriorityDocument doc) {
        return new PriorityDto(doc.getAddress(), doc.getUrgency(), doc.getUpdatedAt());
    }
}
