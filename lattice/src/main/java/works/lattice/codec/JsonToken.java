package works.lattice.codec;

/**
 * A lexical unit of a JSON token stream, as produced by a {@link JsonReader}
 * and consumed by a {@link JsonWriter}.
 */
public enum JsonToken {
	/**
	 * No token has been read yet, or the reader has run out of input.
	 */
	NONE,

	START_OBJECT,
	START_ARRAY,

	/**
	 * The start of a {@code new Name(...)} constructor call.
	 * The token's value is the constructor name.
	 */
	START_CONSTRUCTOR,

	PROPERTY_NAME,
	COMMENT,

	/**
	 * JSON text passed through verbatim.
	 */
	RAW,

	INTEGER,
	FLOAT,
	STRING,
	BOOLEAN,
	NULL,
	UNDEFINED,
	END_OBJECT,
	END_ARRAY,
	END_CONSTRUCTOR,
	DATE,
	BYTES;

	public boolean isStartToken() {
		return switch (this) {
			case START_OBJECT, START_ARRAY, START_CONSTRUCTOR -> true;
			default -> false;
		};
	}

	public boolean isEndToken() {
		return switch (this) {
			case END_OBJECT, END_ARRAY, END_CONSTRUCTOR -> true;
			default -> false;
		};
	}

	/**
	 * @return true for tokens that represent a complete scalar value
	 */
	public boolean isPrimitive() {
		return switch (this) {
			case INTEGER, FLOAT, STRING, BOOLEAN, NULL, UNDEFINED, DATE, BYTES -> true;
			default -> false;
		};
	}

	/**
	 * @return the kind of container this start or end token opens or closes
	 * @throws IllegalArgumentException if this is neither a start nor an end token
	 */
	public ContainerType containerType() {
		return switch (this) {
			case START_OBJECT, END_OBJECT -> ContainerType.OBJECT;
			case START_ARRAY, END_ARRAY -> ContainerType.ARRAY;
			case START_CONSTRUCTOR, END_CONSTRUCTOR -> ContainerType.CONSTRUCTOR;
			default -> throw new IllegalArgumentException("Token does not delimit a container: " + this);
		};
	}
}
