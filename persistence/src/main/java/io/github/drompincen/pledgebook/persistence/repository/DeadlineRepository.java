package io.github.drompincen.pledgebook.persistence.repository;

import io.github.drompincen.pledgebook.persistence.document.DeadlineDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface DeadlineRepository extends MongoRepository<DeadlineDocument, String> {
    List<DeadlineDocument> findByTargetPointLessThanEqualOrderByTargetPointAsc(long point);
}
