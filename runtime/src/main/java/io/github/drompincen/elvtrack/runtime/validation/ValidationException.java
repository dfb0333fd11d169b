package io.github.drompincen.elvtrack.runtime.validation;

/** A payload field is malformed, missing or outside its enumerated set. */
public class ValidationException extends RuntimeException {

    private final String field;
    private final String constraint;

    public ValidationException(String field, String constraint) {
        super(field + ": " + constraint);
        this.field = field;
        this.constraint = constraint;
    }

    public String getField() { return field; }

    public String getConstraint() { return constraint; }
}
