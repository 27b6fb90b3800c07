package io.github.drompincen.pledgebook.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "counters")
public class CounterDocument {

    public static final String BLOCK = "block";

    @Id
    private String name;
    private long value;
    private Instant advancedAt;

    public CounterDocument() {}

    public CounterDocument(String name, long value) {
        this.name = name;
        this.value = value;
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public long getValue() { return value; }
    public void setValue(long value) { this.value = value; }

    public Instant getAdvancedAt() { return advancedAt; }
    public void setAdvancedAt(Instant advancedAt) { this.advancedAt = advancedAt; }
}
