package io.github.drompincen.elvtrack.runtime.record;

public class RecordNotFoundException extends RuntimeException {

    public RecordNotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
    }
}
