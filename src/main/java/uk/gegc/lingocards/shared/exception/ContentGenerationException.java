package uk.gegc.lingocards.shared.exception;

/**
 * Raised by the content generation gateway when the provider times out,
 * errors, or returns nothing usable.
 */
public class ContentGenerationException extends AiServiceException {

    public ContentGenerationException(String message) {
        super(message);
    }

    public ContentGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
