package works.lattice.codec;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.lattice.exceptions.JsonConversionException;
import works.lattice.exceptions.JsonReaderException;

import static java.util.Objects.requireNonNull;

/**
 * Forward-only cursor over a JSON token stream.
 * <p>
 * This class keeps the bookkeeping shared by all readers:
 * the current token and value, the container stack from which
 * {@link #depth()} and {@link #path()} are derived, and the typed
 * {@code readAs*} conversions. Subclasses implement {@link #read()}
 * and report each token through {@link #setToken}.
 * <p>
 * Token values have these types:
 * <ul>
 *     <li>{@link JsonToken#INTEGER}: {@link Long} or {@link BigInteger}</li>
 *     <li>{@link JsonToken#FLOAT}: {@link Double} or {@link BigDecimal}</li>
 *     <li>{@link JsonToken#DATE}: {@link OffsetDateTime} or {@link LocalDateTime}</li>
 *     <li>{@link JsonToken#BYTES}: {@code byte[]}</li>
 *     <li>{@link JsonToken#BOOLEAN}: {@link Boolean}</li>
 *     <li>{@link JsonToken#STRING}, {@link JsonToken#PROPERTY_NAME}, {@link JsonToken#COMMENT},
 *         {@link JsonToken#RAW}, {@link JsonToken#START_CONSTRUCTOR}: {@link String}</li>
 *     <li>everything else: null</li>
 * </ul>
 * Not thread-safe.
 */
public abstract class JsonReader implements LineInfo, AutoCloseable {
	private static final Logger LOGGER = LoggerFactory.getLogger(JsonReader.class);

	protected final ReaderSettings settings;

	/**
	 * One entry per open container, innermost last.
	 */
	private final List<JsonPosition> stack = new ArrayList<>();
	private JsonToken tokenType = JsonToken.NONE;
	private Object value = null;
	private ReaderState state = ReaderState.START;

	protected JsonReader(ReaderSettings settings) {
		this.settings = requireNonNull(settings);
	}

	/**
	 * Advances to the next token.
	 *
	 * @return false if there are no more tokens
	 * @throws JsonReaderException if the input is malformed
	 */
	public abstract boolean read();

	public ReaderSettings settings() {
		return settings;
	}

	public JsonToken tokenType() {
		return tokenType;
	}

	public Object value() {
		return value;
	}

	/**
	 * @return the class of {@link #value()}, or null if the value is null
	 */
	public Class<?> valueType() {
		return value == null ? null : value.getClass();
	}

	public ReaderState currentState() {
		return state;
	}

	/**
	 * @return the number of containers open after the current token
	 */
	public int depth() {
		return stack.size();
	}

	/**
	 * @return the path of the current token, like {@code a.b[2]}
	 */
	public String path() {
		return JsonPosition.buildPath(stack);
	}

	@Override
	public boolean hasLineInfo() {
		return false;
	}

	@Override
	public int lineNumber() {
		return 0;
	}

	@Override
	public int linePosition() {
		return 0;
	}

	/**
	 * Skips the children of the current token.
	 * If the reader is on a property name, skips the property's value.
	 * Afterward, the reader is on the last token skipped.
	 */
	public void skip() {
		if (tokenType == JsonToken.PROPERTY_NAME) {
			read();
		}
		if (tokenType.isStartToken()) {
			int target = depth() - 1;
			while (read() && depth() > target) {
				// keep going
			}
		}
	}

	@Override
	public void close() {
		if (state != ReaderState.CLOSED) {
			LOGGER.trace("Closing reader at '{}'", path());
			state = ReaderState.CLOSED;
			tokenType = JsonToken.NONE;
			value = null;
			closeInput();
		}
	}

	/**
	 * Called once, when the reader is closed.
	 */
	protected void closeInput() {
	}

	//
	// Typed reads
	//

	public Integer readAsInt() {
		BigDecimal number = readNumber("integer");
		if (number == null) {
			return null;
		}
		int result;
		try {
			result = number.intValueExact();
		} catch (ArithmeticException e) {
			throw conversionFailure("Value " + number + " is not a valid integer", e);
		}
		replaceValue(JsonToken.INTEGER, (long) result);
		return result;
	}

	public Long readAsLong() {
		BigDecimal number = readNumber("long");
		if (number == null) {
			return null;
		}
		long result;
		try {
			result = number.longValueExact();
		} catch (ArithmeticException e) {
			throw conversionFailure("Value " + number + " is not a valid long", e);
		}
		replaceValue(JsonToken.INTEGER, result);
		return result;
	}

	public Double readAsDouble() {
		JsonToken token = readSkippingComments();
		Double result;
		switch (token) {
			case INTEGER, FLOAT -> result = ((Number) value).doubleValue();
			case STRING -> {
				String text = value.toString().trim();
				if (text.isEmpty()) {
					replaceValue(JsonToken.NULL, null);
					return null;
				}
				try {
					result = Double.parseDouble(text);
				} catch (NumberFormatException e) {
					throw conversionFailure("Could not convert string to double: " + text, e);
				}
			}
			case NONE, NULL, UNDEFINED, END_ARRAY, END_OBJECT, END_CONSTRUCTOR -> {
				return null;
			}
			default -> throw conversionFailure("Error reading double. Unexpected token: " + token, null);
		}
		replaceValue(JsonToken.FLOAT, result);
		return result;
	}

	public BigDecimal readAsDecimal() {
		BigDecimal result = readNumber("decimal");
		if (result != null) {
			replaceValue(JsonToken.FLOAT, result);
		}
		return result;
	}

	public String readAsString() {
		JsonToken token = readSkippingComments();
		String result;
		switch (token) {
			case STRING -> {
				if (value instanceof String s) {
					return s;
				}
				// A non-string value presented as a string, like a UUID from a tree
				result = value.toString();
			}
			case INTEGER, FLOAT, BOOLEAN -> result = value.toString();
			case DATE -> result = DateTimeText.formatIso((Temporal) value);
			case BYTES -> result = Base64.getEncoder().encodeToString((byte[]) value);
			case NONE, NULL, UNDEFINED, END_ARRAY, END_OBJECT, END_CONSTRUCTOR -> {
				return null;
			}
			default -> throw conversionFailure("Error reading string. Unexpected token: " + token, null);
		}
		replaceValue(JsonToken.STRING, result);
		return result;
	}

	public Boolean readAsBoolean() {
		JsonToken token = readSkippingComments();
		Boolean result;
		switch (token) {
			case BOOLEAN -> {
				return (Boolean) value;
			}
			case INTEGER -> result = value instanceof BigInteger b ? b.signum() != 0 : ((Long) value) != 0L;
			case FLOAT -> result = value instanceof Double d ? d != 0.0 : ((BigDecimal) value).signum() != 0;
			case STRING -> {
				String text = value.toString().trim();
				if (text.isEmpty()) {
					replaceValue(JsonToken.NULL, null);
					return null;
				}
				switch (text.toLowerCase(Locale.ROOT)) {
					case "true" -> result = true;
					case "false" -> result = false;
					default -> throw conversionFailure("Could not convert string to boolean: " + text, null);
				}
			}
			case NONE, NULL, UNDEFINED, END_ARRAY, END_OBJECT, END_CONSTRUCTOR -> {
				return null;
			}
			default -> throw conversionFailure("Error reading boolean. Unexpected token: " + token, null);
		}
		replaceValue(JsonToken.BOOLEAN, result);
		return result;
	}

	/**
	 * A date read from text that carries an offset keeps its own wall-clock time.
	 */
	public LocalDateTime readAsDateTime() {
		Temporal date = readDate();
		if (date == null) {
			return null;
		}
		LocalDateTime result = DateTimeText.toLocal(date);
		replaceValue(JsonToken.DATE, result);
		return result;
	}

	/**
	 * A date read from text with no offset is taken to be UTC.
	 */
	public OffsetDateTime readAsDateTimeOffset() {
		Temporal date = readDate();
		if (date == null) {
			return null;
		}
		OffsetDateTime result = DateTimeText.toOffset(date);
		replaceValue(JsonToken.DATE, result);
		return result;
	}

	/**
	 * Accepts a base64 string, a {@link JsonToken#BYTES} token, or an array of integers.
	 */
	public byte[] readAsBytes() {
		JsonToken token = readSkippingComments();
		byte[] result;
		switch (token) {
			case BYTES -> {
				return (byte[]) value;
			}
			case STRING -> {
				try {
					result = Base64.getDecoder().decode(value.toString());
				} catch (IllegalArgumentException e) {
					throw conversionFailure("Could not convert string to bytes: " + value, e);
				}
			}
			case START_ARRAY -> result = readByteArray();
			case NONE, NULL, UNDEFINED, END_ARRAY, END_OBJECT, END_CONSTRUCTOR -> {
				return null;
			}
			default -> throw conversionFailure("Error reading bytes. Unexpected token: " + token, null);
		}
		replaceValue(JsonToken.BYTES, result);
		return result;
	}

	private byte[] readByteArray() {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		while (true) {
			JsonToken token = readSkippingComments();
			switch (token) {
				case INTEGER -> {
					if (value instanceof BigInteger) {
						throw conversionFailure("Value " + value + " is out of range for a byte", null);
					}
					long element = ((Number) value).longValue();
					if (element < Byte.MIN_VALUE || element > 0xFF) {
						throw conversionFailure("Value " + element + " is out of range for a byte", null);
					}
					bytes.write((int) element);
				}
				case END_ARRAY -> {
					return bytes.toByteArray();
				}
				case NONE -> throw readerFailure("Unexpected end when reading bytes");
				default -> throw conversionFailure("Unexpected token when reading bytes: " + token, null);
			}
		}
	}

	private Temporal readDate() {
		JsonToken token = readSkippingComments();
		switch (token) {
			case DATE -> {
				return (Temporal) value;
			}
			case STRING -> {
				String text = value.toString();
				if (text.isEmpty()) {
					replaceValue(JsonToken.NULL, null);
					return null;
				}
				Optional<Temporal> parsed = DateTimeText.tryParse(text, ReaderSettings.DateParseHandling.DATE_TIME);
				return parsed.orElseThrow(() -> conversionFailure("Could not convert string to date: " + text, null));
			}
			case NONE, NULL, UNDEFINED, END_ARRAY, END_OBJECT, END_CONSTRUCTOR -> {
				return null;
			}
			default -> throw conversionFailure("Error reading date. Unexpected token: " + token, null);
		}
	}

	/**
	 * @return the number as a {@link BigDecimal} so that callers can check exactness, or null
	 */
	private BigDecimal readNumber(String description) {
		JsonToken token = readSkippingComments();
		switch (token) {
			case INTEGER, FLOAT -> {
				if (value instanceof Double d && !Double.isFinite(d)) {
					throw conversionFailure("Cannot convert " + d + " to " + description, null);
				}
				return toDecimal(value);
			}
			case STRING -> {
				String text = value.toString().trim();
				if (text.isEmpty()) {
					replaceValue(JsonToken.NULL, null);
					return null;
				}
				try {
					return new BigDecimal(text);
				} catch (NumberFormatException e) {
					throw conversionFailure("Could not convert string to " + description + ": " + text, e);
				}
			}
			case NONE, NULL, UNDEFINED, END_ARRAY, END_OBJECT, END_CONSTRUCTOR -> {
				return null;
			}
			default -> throw conversionFailure("Error reading " + description + ". Unexpected token: " + token, null);
		}
	}

	private static BigDecimal toDecimal(Object number) {
		if (number instanceof BigDecimal b) {
			return b;
		} else if (number instanceof BigInteger b) {
			return new BigDecimal(b);
		} else if (number instanceof Long l) {
			return BigDecimal.valueOf(l);
		} else {
			return BigDecimal.valueOf(((Number) number).doubleValue());
		}
	}

	private JsonToken readSkippingComments() {
		do {
			if (!read()) {
				return JsonToken.NONE;
			}
		} while (tokenType == JsonToken.COMMENT);
		return tokenType;
	}

	//
	// Subclass support
	//

	/**
	 * Reports a new token, updating the state, depth, and path accordingly.
	 *
	 * @throws JsonReaderException if a start token exceeds {@link ReaderSettings#maxDepth()},
	 * or an end token doesn't match the open container
	 */
	protected void setToken(JsonToken newToken, Object newValue) {
		switch (newToken) {
			case START_OBJECT -> push(ContainerType.OBJECT, ReaderState.OBJECT_START);
			case START_ARRAY -> push(ContainerType.ARRAY, ReaderState.ARRAY_START);
			case START_CONSTRUCTOR -> push(ContainerType.CONSTRUCTOR, ReaderState.CONSTRUCTOR_START);
			case END_OBJECT, END_ARRAY, END_CONSTRUCTOR -> pop(newToken);
			case PROPERTY_NAME -> {
				state = ReaderState.PROPERTY;
				if (!stack.isEmpty()) {
					current().propertyName = (String) newValue;
				}
			}
			case INTEGER, FLOAT, STRING, BOOLEAN, NULL, UNDEFINED, DATE, BYTES, RAW -> {
				updateScopeWithFinishedValue();
				setPostValueState();
			}
			case NONE, COMMENT -> { }
		}
		tokenType = newToken;
		value = newValue;
	}

	/**
	 * Changes how the current token is reported without affecting position.
	 * Used when a typed read converts a value.
	 */
	protected void replaceValue(JsonToken newToken, Object newValue) {
		tokenType = newToken;
		value = newValue;
	}

	protected void setState(ReaderState newState) {
		state = newState;
	}

	/**
	 * @return the type of the innermost open container, or {@link ContainerType#NONE}
	 */
	protected ContainerType peek() {
		return stack.isEmpty() ? ContainerType.NONE : current().type;
	}

	/**
	 * The state to return to after a delimiter inside the current container.
	 */
	protected ReaderState stateInsideContainer() {
		return switch (peek()) {
			case OBJECT -> ReaderState.OBJECT;
			case ARRAY -> ReaderState.ARRAY;
			case CONSTRUCTOR -> ReaderState.CONSTRUCTOR;
			case NONE -> ReaderState.START;
		};
	}

	protected JsonReaderException readerFailure(String message) {
		state = ReaderState.ERROR;
		return JsonReaderException.create(this, path(), message);
	}

	protected JsonReaderException readerFailure(String message, Throwable cause) {
		state = ReaderState.ERROR;
		return JsonReaderException.create(this, path(), message, cause);
	}

	protected JsonConversionException conversionFailure(String message, Throwable cause) {
		return new JsonConversionException(JsonPosition.formatMessage(this, path(), message), path(), cause);
	}

	private JsonPosition current() {
		return stack.get(stack.size() - 1);
	}

	private void push(ContainerType type, ReaderState newState) {
		updateScopeWithFinishedValue();
		stack.add(new JsonPosition(type));
		state = newState;
		if (settings.maxDepth() > 0 && stack.size() > settings.maxDepth()) {
			throw readerFailure("The reader's maxDepth of " + settings.maxDepth() + " has been exceeded");
		}
	}

	private void pop(JsonToken endToken) {
		ContainerType expected = endToken.containerType();
		ContainerType actual = peek();
		if (actual != expected) {
			throw readerFailure("JsonToken " + endToken + " is not valid for closing container type " + actual);
		}
		stack.remove(stack.size() - 1);
		setPostValueState();
	}

	private void setPostValueState() {
		if (!stack.isEmpty() || settings.supportMultipleContent()) {
			state = ReaderState.POST_VALUE;
		} else {
			state = ReaderState.FINISHED;
		}
	}

	private void updateScopeWithFinishedValue() {
		if (!stack.isEmpty()) {
			JsonPosition current = current();
			if (current.type.hasIndex()) {
				current.position++;
			}
		}
	}
}
