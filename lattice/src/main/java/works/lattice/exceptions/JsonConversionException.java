package works.lattice.exceptions;

/**
 * A JSON value could not be converted to the requested Java type,
 * either because its kind is not convertible to that type at all
 * or because its text could not be parsed.
 * <p>
 * Throwing this does not disturb the state of the reader or tree involved.
 */
public final class JsonConversionException extends JsonException {
	public JsonConversionException(String message, String path, Throwable cause) {
		super(message, path, cause);
	}
}
