package works.lattice.exceptions;

/**
 * Root of the exceptions thrown while reading, writing, or converting JSON.
 * All of them are unchecked: they indicate either malformed input or
 * a caller that used a reader, writer, or tree node incorrectly.
 */
public sealed abstract class JsonException extends RuntimeException permits
	JsonReaderException,
	JsonWriterException,
	JsonConversionException
{
	private final String path;

	protected JsonException(String message, String path) {
		super(message);
		this.path = path;
	}

	protected JsonException(String message, String path, Throwable cause) {
		super(message, cause);
		this.path = path;
	}

	/**
	 * @return the path of the JSON location where the problem was detected,
	 * or the empty string if the problem occurred at the root or no path is known.
	 */
	public String path() {
		return path;
	}
}
