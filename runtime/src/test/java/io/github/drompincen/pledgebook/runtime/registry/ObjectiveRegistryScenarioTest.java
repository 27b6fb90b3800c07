package io.github.drompincen.pledgebook.runtime.registry;

import io.github.drompincen.pledgebook.persistence.document.DeadlineDocument;
import io.github.drompincen.pledgebook.persistence.document.PriorityDocument;
import io.github.drompincen.pledgebook.persistence.repository.DeadlineRepository;
import io.github.drompincen.pledgebook.persistence.repository.ObjectiveRepository;
import io.github.drompincen.pledgebook.persistence.repository.PriorityRepository;
import io.github.drompincen.pledgebook.protocol.api.ObjectiveStatusDto;
import io.github.drompincen.pledgebook.protocol.api.RegistryErrorKind;
import io.github.drompincen.pledgebook.runtime.TestMongoConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.ContextConfiguration;

import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs operation sequences against real collections, where the lack of any link between
 * the three stores is observable.
 */
@DataMongoTest
@ActiveProfiles("test")
@ContextConfiguration(classes = TestMongoConfiguration.class)
class ObjectiveRegistryScenarioTest {

    private static final String CAROL = "0xca201";
    private static final String DAVE = "0xda7e";

    @Autowired private MongoTemplate mongoTemplate;
    @Autowired private ObjectiveRepository objectiveRepository;
    @Autowired private PriorityRepository priorityRepository;
    @Autowired private DeadlineRepository deadlineRepository;

    private final AtomicLong counter = new AtomicLong(100);
    private ObjectiveRegistryService service;

    @BeforeEach
    void setUp() {
        for (String collectionName : mongoTemplate.getCollectionNames()) {
            mongoTemplate.dropCollection(collectionName);
        }
        service = new ObjectiveRegistryService(objectiveRepository, priorityRepository,
                deadlineRepository, counter::get);
    }

    @Test
    void initiateThenInspectReportsObjective() {
        assertThat(service.initiate(CAROL, "Plant a garden").success()).isTrue();

        assertThat(service.inspect(CAROL)).isEqualTo(new ObjectiveStatusDto(true, 14, false));
    }

    @Test
    void secondInitiateFailsUntilTerminated() {
        service.initiate(CAROL, "first");

        assertThat(service.initiate(CAROL, "second").errorKind()).isEqualTo(RegistryErrorKind.ALREADY_EXISTS);

        service.terminate(CAROL);
        assertThat(service.initiate(CAROL, "second").success()).isTrue();
    }

    @Test
    void terminateTwiceFailsSecondTime() {
        service.initiate(CAROL, "Run daily");

        assertThat(service.terminate(CAROL).success()).isTrue();
        assertThat(service.inspect(CAROL).present()).isFalse();
        assertThat(service.terminate(CAROL).errorKind()).isEqualTo(RegistryErrorKind.NOT_FOUND);
    }

    @Test
    void completionCanBeToggledBackAndForth() {
        service.initiate(CAROL, "Fix the bike");

        service.modify(CAROL, "Fix the bike", true);
        assertThat(service.inspect(CAROL).completed()).isTrue();

        service.modify(CAROL, "Fix the bike again", false);
        ObjectiveStatusDto status = service.inspect(CAROL);
        assertThat(status.completed()).isFalse();
        assertThat(status.descriptionLength()).isEqualTo(18);
    }

    @Test
    void priorityOutlivesTerminatedObjective() {
        service.initiate(CAROL, "x");
        service.classify(CAROL, 2);
        service.terminate(CAROL);
        service.initiate(CAROL, "y");

        assertThat(service.findPriority(CAROL))
                .get()
                .extracting(PriorityDocument::getUrgency)
                .isEqualTo(2);

        assertThat(service.classify(CAROL, 3).success()).isTrue();
        assertThat(service.findPriority(CAROL).orElseThrow().getUrgency()).isEqualTo(3);
    }

    @Test
    void orphanedPriorityCannotBeOverwrittenWithoutObjective() {
        service.initiate(CAROL, "x");
        service.classify(CAROL, 1);
        service.terminate(CAROL);

        assertThat(service.classify(CAROL, 3).errorKind()).isEqualTo(RegistryErrorKind.NOT_FOUND);
        assertThat(service.findPriority(CAROL).orElseThrow().getUrgency()).isEqualTo(1);
    }

    @Test
    void deadlineTargetIsNotRecomputedWhenCounterMoves() {
        service.initiate(CAROL, "Ship release");
        service.schedule(CAROL, 50);

        counter.set(400);
        service.modify(CAROL, "Ship release 2", true);
        service.classify(CAROL, 1);

        DeadlineDocument deadline = service.findDeadline(CAROL).orElseThrow();
        assertThat(deadline.getTargetPoint()).isEqualTo(150);
        assertThat(deadline.getScheduledAt()).isEqualTo(100);
        assertThat(deadline.isAlertActivated()).isFalse();
    }

    @Test
    void rescheduleOverwritesDeadlineFromNewCounter() {
        service.initiate(CAROL, "Ship release");
        service.schedule(CAROL, 50);
        counter.set(120);

        service.schedule(CAROL, 10);

        assertThat(service.findDeadline(CAROL).orElseThrow().getTargetPoint()).isEqualTo(130);
        assertThat(deadlineRepository.count()).isEqualTo(1);
    }

    @Test
    void dueDeadlinesFollowTheCounter() {
        service.initiate(CAROL, "a");
        service.initiate(DAVE, "b");
        service.schedule(CAROL, 10);
        service.schedule(DAVE, 30);

        assertThat(service.findDueDeadlines()).isEmpty();

        counter.set(115);
        assertThat(service.findDueDeadlines()).extracting(DeadlineDocument::getAddress).containsExactly(CAROL);

        counter.set(130);
        assertThat(service.findDueDeadlines()).extracting(DeadlineDocument::getAddress).containsExactly(CAROL, DAVE);
    }

    @Test
    void delegateSeedsAnotherAddressEvenWhenCallerHasObjective() {
        service.initiate(CAROL, "mine");

        assertThat(service.delegate(CAROL, DAVE, "yours").success()).isTrue();

        assertThat(service.inspect(DAVE)).isEqualTo(new ObjectiveStatusDto(true, 5, false));
        assertThat(service.inspect(CAROL).descriptionLength()).isEqualTo(4);
        assertThat(service.delegate(CAROL, DAVE, "again").errorKind()).isEqualTo(RegistryErrorKind.ALREADY_EXISTS);
    }
}
