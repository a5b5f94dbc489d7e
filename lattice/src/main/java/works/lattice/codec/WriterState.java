package works.lattice.codec;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static works.lattice.codec.JsonToken.COMMENT;
import static works.lattice.codec.JsonToken.PROPERTY_NAME;

/**
 * The states of a {@link JsonWriter}, and the rules for moving between them.
 * <p>
 * {@link #transition} determines <em>whether</em> a token may be written;
 * {@link #preTokenActions} determines what must be written before it.
 * Formatting affects only the latter.
 * <p>
 * End tokens never go through {@link #transition}: closing a scope
 * pops the container stack and restores the state of the enclosing container.
 */
public enum WriterState {
	START,
	PROPERTY,
	OBJECT_START,
	OBJECT,
	ARRAY_START,
	ARRAY,
	CONSTRUCTOR_START,
	CONSTRUCTOR,
	CLOSED,
	ERROR;

	/**
	 * Columns are: start object, start array, start constructor, property name, comment, raw, any value.
	 */
	private static final EnumMap<WriterState, EnumMap<JsonToken, WriterState>> TRANSITIONS = new EnumMap<>(Map.of(
		START,             row(OBJECT_START, ARRAY_START, CONSTRUCTOR_START, PROPERTY, START,             START,             START),
		PROPERTY,          row(OBJECT_START, ARRAY_START, CONSTRUCTOR_START, ERROR,    PROPERTY,          PROPERTY,          OBJECT),
		OBJECT_START,      row(ERROR,        ERROR,       ERROR,             PROPERTY, OBJECT_START,      OBJECT_START,      ERROR),
		OBJECT,            row(ERROR,        ERROR,       ERROR,             PROPERTY, OBJECT,            OBJECT,            ERROR),
		ARRAY_START,       row(OBJECT_START, ARRAY_START, CONSTRUCTOR_START, ERROR,    ARRAY_START,       ARRAY_START,       ARRAY),
		ARRAY,             row(OBJECT_START, ARRAY_START, CONSTRUCTOR_START, ERROR,    ARRAY,             ARRAY,             ARRAY),
		CONSTRUCTOR_START, row(OBJECT_START, ARRAY_START, CONSTRUCTOR_START, ERROR,    CONSTRUCTOR_START, CONSTRUCTOR_START, CONSTRUCTOR),
		CONSTRUCTOR,       row(OBJECT_START, ARRAY_START, CONSTRUCTOR_START, ERROR,    CONSTRUCTOR,       CONSTRUCTOR,       CONSTRUCTOR),
		CLOSED,            row(ERROR,        ERROR,       ERROR,             ERROR,    ERROR,             ERROR,             ERROR),
		ERROR,             row(ERROR,        ERROR,       ERROR,             ERROR,    ERROR,             ERROR,             ERROR)
	));

	private static EnumMap<JsonToken, WriterState> row(
		WriterState startObject, WriterState startArray, WriterState startConstructor,
		WriterState propertyName, WriterState comment, WriterState raw, WriterState value
	) {
		EnumMap<JsonToken, WriterState> result = new EnumMap<>(JsonToken.class);
		for (JsonToken token : JsonToken.values()) {
			WriterState next;
			if (token.isPrimitive()) {
				next = value;
			} else {
				next = switch (token) {
					case START_OBJECT -> startObject;
					case START_ARRAY -> startArray;
					case START_CONSTRUCTOR -> startConstructor;
					case PROPERTY_NAME -> propertyName;
					case COMMENT -> comment;
					case RAW -> raw;
					default -> ERROR;
				};
			}
			result.put(token, next);
		}
		return result;
	}

	/**
	 * @return the state after writing {@code token} in this state,
	 * or {@link #ERROR} if doing so would produce invalid JSON.
	 * Never returns null.
	 */
	public WriterState transition(JsonToken token) {
		return TRANSITIONS.get(this).get(token);
	}

	/**
	 * What needs to be written before {@code token} when in this state.
	 * Only meaningful if {@link #transition} is not {@link #ERROR}.
	 */
	public Set<PreTokenAction> preTokenActions(JsonToken token, Formatting formatting) {
		if (formatting == Formatting.INDENTED) {
			return switch (this) {
				case START -> EnumSet.noneOf(PreTokenAction.class);
				case PROPERTY -> EnumSet.of(PreTokenAction.INDENT_SPACE);
				case ARRAY_START, CONSTRUCTOR_START -> EnumSet.of(PreTokenAction.INDENT);
				case ARRAY, CONSTRUCTOR -> (token == COMMENT)
					? EnumSet.of(PreTokenAction.INDENT)
					: EnumSet.of(PreTokenAction.VALUE_DELIMITER, PreTokenAction.INDENT);
				case OBJECT -> switch (token) {
					case COMMENT -> EnumSet.noneOf(PreTokenAction.class);
					case PROPERTY_NAME -> EnumSet.of(PreTokenAction.VALUE_DELIMITER, PreTokenAction.INDENT);
					default -> EnumSet.of(PreTokenAction.VALUE_DELIMITER);
				};
				default -> (token == PROPERTY_NAME)
					? EnumSet.of(PreTokenAction.INDENT)
					: EnumSet.noneOf(PreTokenAction.class);
			};
		} else if (token != COMMENT) {
			return switch (this) {
				case OBJECT, ARRAY, CONSTRUCTOR -> EnumSet.of(PreTokenAction.VALUE_DELIMITER);
				default -> EnumSet.noneOf(PreTokenAction.class);
			};
		} else {
			return EnumSet.noneOf(PreTokenAction.class);
		}
	}

	/**
	 * @return the state of a writer positioned inside a container of the given type
	 * that has already had at least one child written to it.
	 */
	public static WriterState inside(ContainerType type) {
		return switch (type) {
			case OBJECT -> OBJECT;
			case ARRAY -> ARRAY;
			case CONSTRUCTOR -> CONSTRUCTOR;
			case NONE -> START;
		};
	}

	/**
	 * Formatting output that precedes a token.
	 */
	public enum PreTokenAction {
		/**
		 * A comma.
		 */
		VALUE_DELIMITER,

		/**
		 * A newline followed by indentation for the current depth.
		 */
		INDENT,

		/**
		 * A single space, after a property's colon.
		 */
		INDENT_SPACE,
	}
}
