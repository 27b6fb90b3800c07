package io.github.drompincen.pledgebook.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "priorities")
public class PriorityDocument {

    @Id
    private String address;
    private int urgency;
    private Instant updatedAt;

    public PriorityDocument() {}

    public String getAddress() { return address; }
    public void setAddress(String address) { this.address = address; }

    public int getUrgency() { return urgency; }
    public void setUrgency(int urgency) { this.urgency = urgency; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
