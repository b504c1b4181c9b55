package uk.gegc.lingocards.shared.exception;

/**
 * Base for failures of the word explanation provider. The lookup flow turns any of
 * these into a placeholder card.
 */
public class AiServiceException extends RuntimeException {

    public AiServiceException(String message) {
        super(message);
    }

    public AiServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
