package io.github.drompincen.pledgebook.protocol.api;

public record ObjectiveStatusDto(
        boolean present,
        int descriptionLength,
        boolean completed
) {
    public static ObjectiveStatusDto absent() {
        return new ObjectiveStatusDto(false, 0, false);
    }
}
