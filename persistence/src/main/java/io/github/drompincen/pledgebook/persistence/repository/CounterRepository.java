package io.github.drompincen.pledgebook.persistence.repository;

import io.github.drompincen.pledgebook.persistence.document.CounterDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface CounterRepository extends MongoRepository<CounterDocument, String> {
}
