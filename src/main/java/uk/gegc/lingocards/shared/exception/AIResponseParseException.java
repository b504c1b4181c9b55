package uk.gegc.lingocards.shared.exception;

/**
 * Exception thrown when a generated word explanation cannot be parsed or fails validation
 */
public class AIResponseParseException extends AiServiceException {

    public AIResponseParseException(String message) {
        super(message);
    }

    public AIResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
