package uk.gegc.schoolwork.shared.exception;

/**
 * Business-rule validation failure that bean validation cannot express
 * (unknown language, scheduling conflicts, missing scope and so on).
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }
}
