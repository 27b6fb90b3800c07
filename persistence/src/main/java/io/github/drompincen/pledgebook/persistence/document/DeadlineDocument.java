package io.github.drompincen.pledgebook.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Deadline attached to an address. {@code targetPoint} is an absolute block counter
 * value fixed when the deadline is written; {@code scheduledAt} is the counter value
 * observed at that moment.
 */
@Document(collection = "deadlines")
public class DeadlineDocument {

    @Id
    private String address;
    @Indexed
    private long targetPoint;
    private long scheduledAt;
    private boolean alertActivated;
    private Instant updatedAt;

    public DeadlineDocument() {}

    public String getAddress() { return address; }
    public void setAddress(String address) { this.address = address; }

    public long getTargetPoint() { return targetPoint; }
    public void setTargetPoint(long targetPoint) { this.targetPoint = targetPoint; }

    public long getScheduledAt() { return scheduledAt; }
    public void setScheduledAt(long scheduledAt) { this.scheduledAt = scheduledAt; }

    public boolean isAlertActivated() { return alertActivated; }
    public void setAlertActivated(boolean alertActivated) { this.alertActivated = alertActivated; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
