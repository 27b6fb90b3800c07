package io.github.drompincen.pledgebook.gateway.controller;

import io.github.drompincen.pledgebook.protocol.api.ClassifyPriorityRequest;
import io.github.drompincen.pledgebook.protocol.api.DelegateObjectiveRequest;
import io.github.drompincen.pledgebook.protocol.api.ErrorDto;
import io.github.drompincen.pledgebook.protocol.api.InitiateObjectiveRequest;
import io.github.drompincen.pledgebook.protocol.api.ModifyObjectiveRequest;
import io.github.drompincen.pledgebook.protocol.api.ObjectiveStatusDto;
import io.github.drompincen.pledgebook.protocol.api.RegistryErrorKind;
import io.github.drompincen.pledgebook.protocol.api.ScheduleDeadlineRequest;
import io.github.drompincen.pledgebook.runtime.registry.ObjectiveRegistryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Operations on the calling participant's own objective. The caller is identified by the
 * {@value #CALLER_HEADER} header; only {@code delegations} acts on a different address.
 */
@RestController
@RequestMapping("/api/objectives")
public class ObjectiveController {

    public static final String CALLER_HEADER = "X-Caller-Address";

    private final ObjectiveRegistryService registryService;

    public ObjectiveController(ObjectiveRegistryService registryService) {
        this.registryService = registryService;
    }

    @GetMapping("/me")
    public ObjectiveStatusDto inspect(@RequestHeader(CALLER_HEADER) String caller) {
        return registryService.inspect(caller);
    }

    @PostMapping
    public ResponseEntity<?> initiate(@RequestHeader(CALLER_HEADER) String caller,
                                      @RequestBody InitiateObjectiveRequest req) {
        return RegistryResponses.confirm(registryService.initiate(caller, req.description()));
    }

    @PutMapping
    public ResponseEntity<?> modify(@RequestHeader(CALLER_HEADER) String caller,
                                    @RequestBody ModifyObjectiveRequest req) {
        if (req.completed() == null) {
            return ResponseEntity.badRequest()
                    .body(new ErrorDto(RegistryErrorKind.INVALID_INPUT, "completed is required"));
        }
        return RegistryResponses.confirm(registryService.modify(caller, req.description(), req.completed()));
    }

    @DeleteMapping
    public ResponseEntity<?> terminate(@RequestHeader(CALLER_HEADER) String caller) {
        return RegistryResponses.confirm(registryService.terminate(caller));
    }

    @PutMapping("/priority")
    public ResponseEntity<?> classify(@RequestHeader(CALLER_HEADER) String caller,
                                      @RequestBody ClassifyPriorityRequest req) {
        return RegistryResponses.confirm(registryService.classify(caller, req.urgency()));
    }

    @PutMapping("/deadline")
    public ResponseEntity<?> schedule(@RequestHeader(CALLER_HEADER) String caller,
                                      @RequestBody ScheduleDeadlineRequest req) {
        return RegistryResponses.confirm(registryService.schedule(caller, req.offset()));
    }

    @PostMapping("/delegations")
    public ResponseEntity<?> delegate(@RequestHeader(CALLER_HEADER) String caller,
                                      @RequestBody DelegateObjectiveRequest req) {
        return RegistryResponses.confirm(
                registryService.delegate(caller, req.targetAddress(), req.description()));
    }
}
