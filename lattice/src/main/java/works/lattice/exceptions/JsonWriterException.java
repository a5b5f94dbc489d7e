package works.lattice.exceptions;

import works.lattice.codec.JsonPosition;

/**
 * A writer was asked to produce a token that is illegal in its current state,
 * such as ending an array that isn't open.
 * <p>
 * This indicates a bug in the calling code, not a problem with any data.
 * The writer should not be used further.
 */
public final class JsonWriterException extends JsonException {
	public JsonWriterException(String message, String path, Throwable cause) {
		super(message, path, cause);
	}

	public static JsonWriterException create(String path, String message) {
		return new JsonWriterException(JsonPosition.formatMessage(null, path, message), path, null);
	}
}
