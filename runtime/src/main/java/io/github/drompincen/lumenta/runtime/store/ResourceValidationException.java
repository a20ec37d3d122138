package io.github.drompincen.lumenta.runtime.store;

/**
 * An ingested resource payload failed validation. {@code field} names the offending field
 * when the failure is field-level, and is {@code null} otherwise (for example an unknown type).
 */
public class ResourceValidationException extends RuntimeException {

    private final String field;

    public ResourceValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public ResourceValidationException(String message) {
        this(null, message);
    }

    public String field() {
        return field;
    }
}
