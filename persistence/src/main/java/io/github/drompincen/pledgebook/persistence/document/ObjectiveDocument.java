package io.github.drompincen.pledgebook.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * A participant's single commitment. The address is the document id, so the
 * collection can hold at most one objective per participant.
 */
@Document(collection = "objectives")
public class ObjectiveDocument {

    @Id
    private String address;
    private String description;
    private boolean completed;
    private Instant createdAt;
    private Instant updatedAt;

    public ObjectiveDocument() {}

    public String getAddress() { return address; }
    public void setAddress(String address) { this.address = address; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public boolean isCompleted() { return completed; }
    public void setCompleted(boolean completed) { this.completed = completed; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
