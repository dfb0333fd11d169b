package io.github.drompincen.elvtrack.protocol.api;

/** The three persisted entity kinds, each backed by its own logical collection. */
public enum RecordKind {
    VEHICLE("vehicle"),
    EVENT("event"),
    PART("part");

    private final String collection;

    RecordKind(String collection) {
        this.collection = collection;
    }

    public String collection() { return collection; }
}
