package io.github.drompincen.pledgebook.persistence.repository;

import io.github.drompincen.pledgebook.persistence.document.ObjectiveDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface ObjectiveRepository extends MongoRepository<ObjectiveDocument, String> {
}
