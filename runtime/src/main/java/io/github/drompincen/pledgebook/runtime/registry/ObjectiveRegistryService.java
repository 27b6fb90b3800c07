package io.github.drompincen.pledgebook.runtime.registry;

import io.github.drompincen.pledgebook.persistence.document.DeadlineDocument;
import io.github.drompincen.pledgebook.persistence.document.ObjectiveDocument;
import io.github.drompincen.pledgebook.persistence.document.PriorityDocument;
import io.github.drompincen.pledgebook.persistence.repository.DeadlineRepository;
import io.github.drompincen.pledgebook.persistence.repository.ObjectiveRepository;
import io.github.drompincen.pledgebook.persistence.repository.PriorityRepository;
import io.github.drompincen.pledgebook.protocol.api.ObjectiveStatusDto;
import io.github.drompincen.pledgebook.protocol.api.RegistryErrorKind;
import io.github.drompincen.pledgebook.runtime.counter.BlockCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static io.github.drompincen.pledgebook.runtime.registry.RegistryValidation.isValidAddress;
import static io.github.drompincen.pledgebook.runtime.registry.RegistryValidation.isValidDescription;
import static io.github.drompincen.pledgebook.runtime.registry.RegistryValidation.isValidOffset;
import static io.github.drompincen.pledgebook.runtime.registry.RegistryValidation.isValidPriority;

/**
 * Operations over the objective, priority and deadline stores.
 *
 * <p>The three stores share the address key space but nothing links them structurally.
 * Priority and deadline writes are gated on an objective existing at the time of the
 * call; terminating an objective leaves any priority or deadline for the same address
 * in place, and a later objective for that address sees them again.
 *
 * <p>Every operation rejects a blank address before touching any store, then reads the
 * objective store, then validates its input, then writes at most one document. Mutating
 * methods are serialized on this instance.
 */
@Service
public class ObjectiveRegistryService {

    private static final Logger log = LoggerFactory.getLogger(ObjectiveRegistryService.class);

    static final String INITIATED = "Objective initiated";
    static final String MODIFIED = "Objective updated";
    static final String TERMINATED = "Objective removed";
    static final String CLASSIFIED = "Priority set";
    static final String SCHEDULED = "Deadline set";
    static final String DELEGATED = "Objective created for delegate";

    private final ObjectiveRepository objectiveRepository;
    private final PriorityRepository priorityRepository;
    private final DeadlineRepository deadlineRepository;
    private final BlockCounter blockCounter;

    public ObjectiveRegistryService(ObjectiveRepository objectiveRepository,
                                    PriorityRepository priorityRepository,
                                    DeadlineRepository deadlineRepository,
                                    BlockCounter blockCounter) {
        this.objectiveRepository = objectiveRepository;
        this.priorityRepository = priorityRepository;
        this.deadlineRepository = deadlineRepository;
        this.blockCounter = blockCounter;
    }

    // ---- Objective store ----

    public synchronized RegistryResult<String> initiate(String caller, String description) {
        if (!isValidAddress(caller)) {
            return reject("initiate", caller, RegistryErrorKind.INVALID_INPUT, addressError());
        }
        if (objectiveRepository.existsById(caller)) {
            return reject("initiate", caller, RegistryErrorKind.ALREADY_EXISTS,
                    "An objective already exists for " + caller);
        }
        if (!isValidDescription(description)) {
            return reject("initiate", caller, RegistryErrorKind.INVALID_INPUT, descriptionError());
        }
        createObjective(caller, description);
        log.info("Objective initiated for {}", caller);
        return RegistryResult.success(INITIATED);
    }

    public synchronized RegistryResult<String> modify(String caller, String description, boolean completed) {
        if (!isValidAddress(caller)) {
            return reject("modify", caller, RegistryErrorKind.INVALID_INPUT, addressError());
        }
        Optional<ObjectiveDocument> existing = objectiveRepository.findById(caller);
        if (existing.isEmpty()) {
            return reject("modify", caller, RegistryErrorKind.NOT_FOUND, noObjective(caller));
        }
        if (!isValidDescription(description)) {
            return reject("modify", caller, RegistryErrorKind.INVALID_INPUT, descriptionError());
        }
        ObjectiveDocument doc = existing.get();
        doc.setDescription(description);
        doc.setCompleted(completed);
        doc.setUpdatedAt(Instant.now());
        objectiveRepository.save(doc);
        log.info("Objective for {} updated (completed={})", caller, completed);
        return RegistryResult.success(MODIFIED);
    }

    public synchronized RegistryResult<String> terminate(String caller) {
        if (!isValidAddress(caller)) {
            return reject("terminate", caller, RegistryErrorKind.INVALID_INPUT, addressError());
        }
        if (!objectiveRepository.existsById(caller)) {
            return reject("terminate", caller, RegistryErrorKind.NOT_FOUND, noObjective(caller));
        }
        objectiveRepository.deleteById(caller);
        log.info("Objective for {} removed", caller);
        return RegistryResult.success(TERMINATED);
    }

    /** Read-only projection of the caller's objective. Absence is reported, not failed. */
    public ObjectiveStatusDto inspect(String caller) {
        if (!isValidAddress(caller)) {
            return ObjectiveStatusDto.absent();
        }
        return objectiveRepository.findById(caller)
                .map(doc -> new ObjectiveStatusDto(true,
                        doc.getDescription() != null
                                ? doc.getDescription().codePointCount(0, doc.getDescription().length()) : 0,
                        doc.isCompleted()))
                .orElseGet(ObjectiveStatusDto::absent);
    }

    // ---- Priority store ----

    public synchronized RegistryResult<String> classify(String caller, int urgency) {
        if (!isValidAddress(caller)) {
            return reject("classify", caller, RegistryErrorKind.INVALID_INPUT, addressError());
        }
        if (!objectiveRepository.existsById(caller)) {
            return reject("classify", caller, RegistryErrorKind.NOT_FOUND, noObjective(caller));
        }
        if (!isValidPriority(urgency)) {
            return reject("classify", caller, RegistryErrorKind.INVALID_INPUT,
                    "Urgency must be between " + RegistryValidation.MIN_URGENCY
                            + " and " + RegistryValidation.MAX_URGENCY);
        }
        PriorityDocument doc = new PriorityDocument();
        doc.setAddress(caller);
        doc.setUrgency(urgency);
        doc.setUpdatedAt(Instant.now());
        priorityRepository.save(doc);
        log.info("Priority for {} set to {}", caller, urgency);
        return RegistryResult.success(CLASSIFIED);
    }

    public Optional<PriorityDocument> findPriority(String address) {
        if (!isValidAddress(address)) {
            return Optional.empty();
        }
        return priorityRepository.findById(address);
    }

    // ---- Deadline store ----

    public synchronized RegistryResult<String> schedule(String caller, long offset) {
        if (!isValidAddress(caller)) {
            return reject("schedule", caller, RegistryErrorKind.INVALID_INPUT, addressError());
        }
        if (!objectiveRepository.existsById(caller)) {
            return reject("schedule", caller, RegistryErrorKind.NOT_FOUND, noObjective(caller));
        }
        long now = blockCounter.current();
        if (!isValidOffset(offset)) {
            return reject("schedule", caller, RegistryErrorKind.INVALID_INPUT,
                    "Deadline offset must be positive");
        }
        if (!isValidOffset(offset, now)) {
            return reject("schedule", caller, RegistryErrorKind.INVALID_INPUT,
                    "Deadline offset " + offset + " overflows the block counter at " + now);
        }
        DeadlineDocument doc = new DeadlineDocument();
        doc.setAddress(caller);
        doc.setScheduledAt(now);
        doc.setTargetPoint(now + offset);
        doc.setAlertActivated(false);
        doc.setUpdatedAt(Instant.now());
        deadlineRepository.save(doc);
        log.info("Deadline for {} set to block {} (offset {})", caller, doc.getTargetPoint(), offset);
        return RegistryResult.success(SCHEDULED);
    }

    public Optional<DeadlineDocument> findDeadline(String address) {
        if (!isValidAddress(address)) {
            return Optional.empty();
        }
        return deadlineRepository.findById(address);
    }

    /** Deadlines whose target point the counter has already reached. */
    public List<DeadlineDocument> findDueDeadlines() {
        return deadlineRepository.findByTargetPointLessThanEqualOrderByTargetPointAsc(blockCounter.current());
    }

    // ---- Delegation ----

    /**
     * Creates an objective for {@code target} on behalf of {@code caller}. No relationship
     * between the two addresses is checked; any caller may seed any free address.
     */
    public synchronized RegistryResult<String> delegate(String caller, String target, String description) {
        if (!isValidAddress(caller)) {
            return reject("delegate", caller, RegistryErrorKind.INVALID_INPUT, addressError());
        }
        if (!isValidAddress(target)) {
            return reject("delegate", target, RegistryErrorKind.INVALID_INPUT, addressError());
        }
        if (objectiveRepository.existsById(target)) {
            return reject("delegate", target, RegistryErrorKind.ALREADY_EXISTS,
                    "An objective already exists for " + target);
        }
        if (!isValidDescription(description)) {
            return reject("delegate", target, RegistryErrorKind.INVALID_INPUT, descriptionError());
        }
        createObjective(target, description);
        log.info("Objective created for {} by {}", target, caller);
        return RegistryResult.success(DELEGATED);
    }

    private void createObjective(String address, String description) {
        Instant now = Instant.now();
        ObjectiveDocument doc = new ObjectiveDocument();
        doc.setAddress(address);
        doc.setDescription(description);
        doc.setCompleted(false);
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        objectiveRepository.save(doc);
    }

    private static <T> RegistryResult<T> reject(String operation, String address,
                                                RegistryErrorKind kind, String message) {
        log.debug("{} rejected for {}: {} ({})", operation, address, kind, message);
        return RegistryResult.failure(kind, message);
    }

    private static String noObjective(String address) {
        return "No objective exists for " + address;
    }

    private static String addressError() {
        return "Address must not be blank";
    }

    private static String descriptionError() {
        return "Description must be between 1 and " + RegistryValidation.MAX_DESCRIPTION_LENGTH + " characters";
    }
}
