package io.github.drompincen.elvtrack.runtime.record;

public class InvalidRecordIdException extends RuntimeException {

    public InvalidRecordIdException(String kind, String id) {
        super("Invalid " + kind + " id: " + id);
    }
}
