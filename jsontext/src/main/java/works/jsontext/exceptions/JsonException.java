package works.jsontext.exceptions;

public sealed abstract class JsonException extends RuntimeException permits JsonProcessingException {
	protected JsonException(String message) {
		super(message);
	}

	protected JsonException(Throwable cause) {
		super(cause);
	}

	protected JsonException(String message, Throwable cause) {
		super(message, cause);
	}
}
