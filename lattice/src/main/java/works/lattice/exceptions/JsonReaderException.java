package works.lattice.exceptions;

import works.lattice.codec.JsonPosition;
import works.lattice.codec.LineInfo;

/**
 * The JSON input text is invalid, or a reader was asked to do something
 * its current state doesn't allow.
 * <p>
 * The reader's position after this is thrown is not meaningfully resumable.
 */
public final class JsonReaderException extends JsonException {
	private final int lineNumber;
	private final int linePosition;

	public JsonReaderException(String message, String path, int lineNumber, int linePosition, Throwable cause) {
		super(message, path, cause);
		this.lineNumber = lineNumber;
		this.linePosition = linePosition;
	}

	/**
	 * Builds an exception whose message names the path and, where available,
	 * the line and position at which the problem was found.
	 */
	public static JsonReaderException create(LineInfo lineInfo, String path, String message) {
		return create(lineInfo, path, message, null);
	}

	public static JsonReaderException create(LineInfo lineInfo, String path, String message, Throwable cause) {
		String fullMessage = JsonPosition.formatMessage(lineInfo, path, message);
		if (lineInfo != null && lineInfo.hasLineInfo()) {
			return new JsonReaderException(fullMessage, path, lineInfo.lineNumber(), lineInfo.linePosition(), cause);
		} else {
			return new JsonReaderException(fullMessage, path, 0, 0, cause);
		}
	}

	/**
	 * @return the 1-based line number, or 0 if unknown
	 */
	public int lineNumber() {
		return lineNumber;
	}

	/**
	 * @return the position within the line, or 0 if unknown
	 */
	public int linePosition() {
		return linePosition;
	}
}
