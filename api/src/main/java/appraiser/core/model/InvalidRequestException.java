package appraiser.core.model;

/**
 * Thrown when client input passes schema validation but cannot be served,
 * such as an oversized batch. Rendered as a 422 validation problem.
 */
public class InvalidRequestException extends IllegalArgumentException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
