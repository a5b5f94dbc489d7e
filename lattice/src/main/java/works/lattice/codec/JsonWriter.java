package works.lattice.codec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.lattice.codec.WriterState.PreTokenAction;
import works.lattice.exceptions.JsonWriterException;

import static java.util.Objects.requireNonNull;
import static works.lattice.codec.WriterState.ARRAY_START;
import static works.lattice.codec.WriterState.CLOSED;
import static works.lattice.codec.WriterState.CONSTRUCTOR_START;
import static works.lattice.codec.WriterState.ERROR;
import static works.lattice.codec.WriterState.OBJECT_START;
import static works.lattice.codec.WriterState.PROPERTY;
import static works.lattice.codec.WriterState.START;

/**
 * Forward-only producer of a JSON token stream.
 * <p>
 * This class does all the bookkeeping shared by every writer:
 * it tracks the container stack and the {@link WriterState},
 * rejects tokens that would produce invalid JSON,
 * and decides where delimiters and indentation go.
 * Subclasses only decide what each token turns into,
 * by implementing the {@code emit*} methods, which are called
 * only after the token has been validated.
 * <p>
 * Scalar values reach {@link #emitValue} normalized as follows:
 * integers as {@link Long} or {@link BigInteger};
 * floating point as {@link Double} or {@link BigDecimal};
 * dates as {@link OffsetDateTime} or {@link LocalDateTime};
 * {@link UUID}, {@link URI}, and {@link Duration} as themselves, under {@link JsonToken#STRING}.
 * <p>
 * Not thread-safe.
 */
public abstract class JsonWriter implements AutoCloseable {
	private static final Logger LOGGER = LoggerFactory.getLogger(JsonWriter.class);

	protected final WriterSettings settings;

	/**
	 * One entry per open container, innermost last.
	 */
	private final List<JsonPosition> stack = new ArrayList<>();
	private WriterState state = START;
	private boolean topLevelValueWritten = false;

	protected JsonWriter(WriterSettings settings) {
		this.settings = requireNonNull(settings);
	}

	public WriterSettings settings() {
		return settings;
	}

	public WriterState state() {
		return state;
	}

	/**
	 * @return the number of containers currently open
	 */
	public int top() {
		return stack.size();
	}

	/**
	 * @return the type of the innermost open container, or {@link ContainerType#NONE} if there is none
	 */
	public ContainerType peek() {
		return stack.isEmpty() ? ContainerType.NONE : stack.get(stack.size() - 1).type;
	}

	/**
	 * @return the path to the location currently being written, like {@code a.b[2]}
	 */
	public String path() {
		return JsonPosition.buildPath(stack);
	}

	//
	// Structure
	//

	public void writeStartObject() {
		internalWriteStart(JsonToken.START_OBJECT, ContainerType.OBJECT);
		emitStart(ContainerType.OBJECT, null);
	}

	public void writeStartArray() {
		internalWriteStart(JsonToken.START_ARRAY, ContainerType.ARRAY);
		emitStart(ContainerType.ARRAY, null);
	}

	public void writeStartConstructor(String name) {
		requireNonNull(name, "Constructor name");
		internalWriteStart(JsonToken.START_CONSTRUCTOR, ContainerType.CONSTRUCTOR);
		emitStart(ContainerType.CONSTRUCTOR, name);
	}

	public void writeEndObject() {
		internalWriteEnd(ContainerType.OBJECT);
	}

	public void writeEndArray() {
		internalWriteEnd(ContainerType.ARRAY);
	}

	public void writeEndConstructor() {
		internalWriteEnd(ContainerType.CONSTRUCTOR);
	}

	/**
	 * Ends the innermost open container, whatever its type.
	 */
	public void writeEnd() {
		ContainerType type = peek();
		if (type == ContainerType.NONE) {
			throw failure("No token to close");
		}
		internalWriteEnd(type);
	}

	public void writePropertyName(String name) {
		requireNonNull(name, "Property name");
		internalWritePropertyName(name);
		emitPropertyName(name);
	}

	//
	// Values
	//

	public void writeNull() {
		internalWriteValue(JsonToken.NULL);
		emitValue(JsonToken.NULL, null);
	}

	public void writeUndefined() {
		internalWriteValue(JsonToken.UNDEFINED);
		emitValue(JsonToken.UNDEFINED, null);
	}

	public void writeValue(String value) {
		if (value == null) {
			writeNull();
		} else {
			writeScalar(JsonToken.STRING, value);
		}
	}

	public void writeValue(int value) {
		writeScalar(JsonToken.INTEGER, (long) value);
	}

	public void writeValue(long value) {
		writeScalar(JsonToken.INTEGER, value);
	}

	public void writeValue(short value) {
		writeScalar(JsonToken.INTEGER, (long) value);
	}

	public void writeValue(byte value) {
		writeScalar(JsonToken.INTEGER, (long) value);
	}

	/**
	 * Written as a bare integer literal with every digit, however large.
	 */
	public void writeValue(BigInteger value) {
		if (value == null) {
			writeNull();
		} else {
			writeScalar(JsonToken.INTEGER, value);
		}
	}

	public void writeValue(double value) {
		writeScalar(JsonToken.FLOAT, value);
	}

	/**
	 * The float is widened via its own shortest decimal representation,
	 * so {@code 0.1f} is written as {@code 0.1}.
	 */
	public void writeValue(float value) {
		double widened = Float.isFinite(value) ? Double.parseDouble(Float.toString(value)) : value;
		writeScalar(JsonToken.FLOAT, widened);
	}

	public void writeValue(BigDecimal value) {
		if (value == null) {
			writeNull();
		} else {
			writeScalar(JsonToken.FLOAT, value);
		}
	}

	public void writeValue(boolean value) {
		writeScalar(JsonToken.BOOLEAN, value);
	}

	public void writeValue(char value) {
		writeScalar(JsonToken.STRING, String.valueOf(value));
	}

	public void writeValue(OffsetDateTime value) {
		if (value == null) {
			writeNull();
		} else {
			writeScalar(JsonToken.DATE, value);
		}
	}

	/**
	 * A date with no offset information.
	 */
	public void writeValue(LocalDateTime value) {
		if (value == null) {
			writeNull();
		} else {
			writeScalar(JsonToken.DATE, value);
		}
	}

	/**
	 * Written as a UTC date.
	 */
	public void writeValue(Instant value) {
		if (value == null) {
			writeNull();
		} else {
			writeScalar(JsonToken.DATE, value.atOffset(ZoneOffset.UTC));
		}
	}

	public void writeValue(byte[] value) {
		if (value == null) {
			writeNull();
		} else {
			writeScalar(JsonToken.BYTES, value);
		}
	}

	public void writeValue(UUID value) {
		if (value == null) {
			writeNull();
		} else {
			writeScalar(JsonToken.STRING, value);
		}
	}

	public void writeValue(URI value) {
		if (value == null) {
			writeNull();
		} else {
			writeScalar(JsonToken.STRING, value);
		}
	}

	public void writeValue(Duration value) {
		if (value == null) {
			writeNull();
		} else {
			writeScalar(JsonToken.STRING, value);
		}
	}

	/**
	 * Writes any of the scalar types accepted by the other {@code writeValue} overloads.
	 *
	 * @throws JsonWriterException if {@code value} can't be written as a single JSON token
	 */
	public void writeValue(Object value) {
		if (value == null) {
			writeNull();
		} else if (value instanceof String s) {
			writeValue(s);
		} else if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
			writeValue(((Number) value).longValue());
		} else if (value instanceof BigInteger b) {
			writeValue(b);
		} else if (value instanceof Double d) {
			writeValue(d.doubleValue());
		} else if (value instanceof Float f) {
			writeValue(f.floatValue());
		} else if (value instanceof BigDecimal b) {
			writeValue(b);
		} else if (value instanceof Boolean b) {
			writeValue(b.booleanValue());
		} else if (value instanceof Character c) {
			writeValue(c.charValue());
		} else if (value instanceof OffsetDateTime d) {
			writeValue(d);
		} else if (value instanceof LocalDateTime d) {
			writeValue(d);
		} else if (value instanceof Instant i) {
			writeValue(i);
		} else if (value instanceof byte[] b) {
			writeValue(b);
		} else if (value instanceof UUID u) {
			writeValue(u);
		} else if (value instanceof URI u) {
			writeValue(u);
		} else if (value instanceof Duration d) {
			writeValue(d);
		} else {
			throw failure("Unsupported type: " + value.getClass().getName() + ". Use a tree or a serializer to write values of this type");
		}
	}

	/**
	 * Writes a comment. Comments don't count as values.
	 */
	public void writeComment(String text) {
		autoComplete(JsonToken.COMMENT);
		emitComment(text == null ? "" : text);
	}

	/**
	 * Writes {@code json} verbatim, without changing the writer's state.
	 * The caller is responsible for the result being valid.
	 */
	public void writeRaw(String json) {
		emitRaw(json == null ? "" : json, false);
	}

	/**
	 * Writes {@code json} verbatim as though it were a single value,
	 * with the usual delimiters and indentation around it.
	 */
	public void writeRawValue(String json) {
		internalWriteValue(JsonToken.UNDEFINED);
		emitRaw(json == null ? "" : json, true);
	}

	//
	// Copying from token streams
	//

	/**
	 * Writes a single token with the given value, which must be
	 * of a type appropriate for the token, as produced by a {@link JsonReader}.
	 */
	public void writeToken(JsonToken token, Object value) {
		switch (token) {
			case NONE -> { }
			case START_OBJECT -> writeStartObject();
			case START_ARRAY -> writeStartArray();
			case START_CONSTRUCTOR -> writeStartConstructor(requireNonNull(value, "Constructor name").toString());
			case PROPERTY_NAME -> writePropertyName(requireNonNull(value, "Property name").toString());
			case COMMENT -> writeComment(value == null ? null : value.toString());
			case RAW -> writeRawValue(value == null ? null : value.toString());
			case INTEGER, FLOAT, STRING, BOOLEAN, DATE, BYTES -> writeValue(requireNonNull(value, () -> "Value for " + token));
			case NULL -> writeNull();
			case UNDEFINED -> writeUndefined();
			case END_OBJECT -> writeEndObject();
			case END_ARRAY -> writeEndArray();
			case END_CONSTRUCTOR -> writeEndConstructor();
		}
	}

	/**
	 * Copies the reader's current token, including all its children,
	 * and leaves the reader positioned on the last token copied.
	 */
	public void writeToken(JsonReader reader) {
		writeToken(reader, true, true, true);
	}

	/**
	 * @param writeChildren if true, and the reader is at the start of a container or on a property name,
	 *                      the whole container or property is copied; otherwise just the one token
	 * @param writeDateConstructorAsDate if true, {@code new Date(millis)} is written as a date value
	 * @param writeComments if false, comment tokens are skipped
	 */
	public void writeToken(JsonReader reader, boolean writeChildren, boolean writeDateConstructorAsDate, boolean writeComments) {
		requireNonNull(reader);
		if (reader.tokenType() == JsonToken.NONE && !reader.read()) {
			return;
		}
		int baseDepth = depthBefore(reader);
		boolean more = true;
		do {
			JsonToken token = reader.tokenType();
			if (writeDateConstructorAsDate && token == JsonToken.START_CONSTRUCTOR && "Date".equals(reader.value())) {
				writeConstructorDate(reader);
			} else if (token == JsonToken.PROPERTY_NAME && writeChildren && reader.depth() == baseDepth) {
				writePropertyName(reader.value().toString());
				if (!reader.read()) {
					throw failure("Unexpected end when reading token");
				}
				while (reader.tokenType() == JsonToken.COMMENT) {
					if (writeComments) {
						writeToken(JsonToken.COMMENT, reader.value());
					}
					if (!reader.read()) {
						throw failure("Unexpected end when reading token");
					}
				}
				writeToken(reader, true, writeDateConstructorAsDate, writeComments);
			} else if (writeComments || token != JsonToken.COMMENT) {
				writeToken(token, reader.value());
			}
		} while (writeChildren && reader.depth() > baseDepth && (more = reader.read()));
		if (!more) {
			throw failure("Unexpected end when reading token");
		}
	}

	/**
	 * @return the number of containers that were open before the reader's current token
	 */
	private static int depthBefore(JsonReader reader) {
		JsonToken token = reader.tokenType();
		if (token.isStartToken()) {
			return reader.depth() - 1;
		} else if (token.isEndToken()) {
			return reader.depth() + 1;
		} else {
			return reader.depth();
		}
	}

	private void writeConstructorDate(JsonReader reader) {
		if (!reader.read()) {
			throw failure("Unexpected end when reading date constructor");
		}
		if (reader.tokenType() != JsonToken.INTEGER) {
			throw failure("Unexpected token when reading date constructor. Expected INTEGER, got " + reader.tokenType());
		}
		long millis = ((Number) reader.value()).longValue();
		if (!reader.read()) {
			throw failure("Unexpected end when reading date constructor");
		}
		if (reader.tokenType() != JsonToken.END_CONSTRUCTOR) {
			throw failure("Unexpected token when reading date constructor. Expected END_CONSTRUCTOR, got " + reader.tokenType());
		}
		writeValue(Instant.ofEpochMilli(millis));
	}

	//
	// Lifecycle
	//

	public abstract void flush();

	/**
	 * Closes this writer, ending any open containers
	 * if {@link WriterSettings#autoCompleteOnClose()} is set.
	 */
	@Override
	public void close() {
		if (state == CLOSED) {
			return;
		}
		if (state != ERROR && settings.autoCompleteOnClose() && !stack.isEmpty()) {
			LOGGER.debug("Auto-completing {} open container(s) at '{}'", stack.size(), path());
			while (!stack.isEmpty()) {
				writeEnd();
			}
		}
		state = CLOSED;
		closeOutput();
	}

	//
	// Subclass hooks
	//

	/**
	 * @param constructorName non-null only for {@link ContainerType#CONSTRUCTOR}
	 */
	protected abstract void emitStart(ContainerType type, String constructorName);

	protected abstract void emitEnd(ContainerType type);

	protected abstract void emitPropertyName(String name);

	/**
	 * @param value null for {@link JsonToken#NULL} and {@link JsonToken#UNDEFINED}
	 */
	protected abstract void emitValue(JsonToken token, Object value);

	protected abstract void emitComment(String text);

	/**
	 * @param asValue true if called from {@link #writeRawValue}
	 */
	protected abstract void emitRaw(String json, boolean asValue);

	protected void writeIndent() {
	}

	protected void writeValueDelimiter() {
	}

	protected void writeIndentSpace() {
	}

	/**
	 * Called between top-level values when {@link WriterSettings#supportMultipleContent()} is set.
	 */
	protected void writeTopLevelSeparator() {
	}

	/**
	 * Called once, when the writer is closed.
	 */
	protected void closeOutput() {
	}

	/**
	 * Updates the writer's state as though a complete value had been written,
	 * for subclasses that attach whole values by other means.
	 */
	protected final void recordValue() {
		internalWriteValue(JsonToken.NULL);
	}

	protected JsonWriterException failure(String message) {
		return JsonWriterException.create(path(), message);
	}

	//
	// Bookkeeping
	//

	private void writeScalar(JsonToken token, Object value) {
		internalWriteValue(token);
		emitValue(token, value);
	}

	private void internalWriteStart(JsonToken token, ContainerType type) {
		checkTopLevel(token);
		updateScopeWithFinishedValue();
		autoComplete(token);
		stack.add(new JsonPosition(type));
	}

	private void internalWritePropertyName(String name) {
		autoComplete(JsonToken.PROPERTY_NAME);
		if (!stack.isEmpty()) {
			stack.get(stack.size() - 1).propertyName = name;
		}
	}

	private void internalWriteValue(JsonToken token) {
		checkTopLevel(token);
		updateScopeWithFinishedValue();
		autoComplete(token);
		if (stack.isEmpty() && state == START) {
			topLevelValueWritten = true;
		}
	}

	private void internalWriteEnd(ContainerType type) {
		if (state == ERROR || state == CLOSED) {
			throw failure("Cannot write end of " + type + " in state " + state);
		}
		int levelsToComplete = levelsToComplete(type);
		for (int i = 0; i < levelsToComplete; i++) {
			if (state == PROPERTY) {
				writeNull();
			}
			boolean empty = (state == OBJECT_START || state == ARRAY_START || state == CONSTRUCTOR_START);
			JsonPosition popped = stack.remove(stack.size() - 1);
			if (settings.formatting() == Formatting.INDENTED && !empty) {
				writeIndent();
			}
			emitEnd(popped.type);
			state = WriterState.inside(peek());
			if (stack.isEmpty()) {
				topLevelValueWritten = true;
			}
		}
	}

	private int levelsToComplete(ContainerType type) {
		for (int i = stack.size() - 1; i >= 0; i--) {
			if (stack.get(i).type == type) {
				return stack.size() - i;
			}
		}
		throw failure("No " + type + " to close");
	}

	private void checkTopLevel(JsonToken token) {
		if (stack.isEmpty() && state == START && topLevelValueWritten) {
			if (settings.supportMultipleContent()) {
				writeTopLevelSeparator();
			} else {
				state = ERROR;
				throw failure("Token " + token + " would start a second top-level value, but supportMultipleContent is not enabled");
			}
		}
	}

	private void updateScopeWithFinishedValue() {
		if (!stack.isEmpty()) {
			JsonPosition current = stack.get(stack.size() - 1);
			if (current.type.hasIndex()) {
				current.position++;
			}
		}
	}

	private void autoComplete(JsonToken token) {
		WriterState oldState = state;
		WriterState newState = oldState.transition(token);
		if (newState == ERROR) {
			state = ERROR;
			throw failure("Token " + token + " in state " + oldState + " would result in an invalid JSON object");
		}
		state = newState;
		for (PreTokenAction action : oldState.preTokenActions(token, settings.formatting())) {
			switch (action) {
				case VALUE_DELIMITER -> writeValueDelimiter();
				case INDENT -> writeIndent();
				case INDENT_SPACE -> writeIndentSpace();
			}
		}
	}
}
