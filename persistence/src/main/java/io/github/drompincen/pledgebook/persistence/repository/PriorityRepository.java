package io.github.drompincen.pledgebook.persistence.repository;

import io.github.drompincen.pledgebook.persistence.document.PriorityDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface PriorityRepository extends MongoRepository<PriorityDocument, String> {
}
