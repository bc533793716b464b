package com.ozone.core.assessment;

/**
 * Raised by an {@link Assessor} that cannot score a task. Recorded as a report
 * warning, never fatal to the assessment as a whole.
 */
public class AssessmentException extends RuntimeException {

    public AssessmentException(String message) {
        super(message);
    }

    public AssessmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
