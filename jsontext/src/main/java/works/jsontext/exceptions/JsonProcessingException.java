package works.jsontext.exceptions;

/**
 * An unexpected error has occurred while emitting JSON text.
 * <p>
 * Rendering itself cannot fail: every value the encoder accepts has a textual form.
 * This is thrown when the finished text cannot be handed to its destination,
 * such as a {@link java.io.Writer} that fails with an {@link java.io.IOException}.
 */
public final class JsonProcessingException extends JsonException {
	public JsonProcessingException(String message) {
		super(message);
	}

	public JsonProcessingException(Throwable cause) {
		super(cause);
	}

	public JsonProcessingException(String message, Throwable cause) {
		super(message, cause);
	}
}
