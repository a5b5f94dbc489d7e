package works.lattice.tree;

/**
 * The kind of a {@link JsonNode}.
 */
public enum NodeType {
	OBJECT,
	ARRAY,
	CONSTRUCTOR,
	PROPERTY,
	COMMENT,
	INTEGER,
	FLOAT,
	STRING,
	BOOLEAN,
	NULL,
	UNDEFINED,
	DATE,

	/**
	 * JSON text kept verbatim.
	 */
	RAW,

	BYTES,

	/**
	 * A {@link java.util.UUID}, written as a string.
	 */
	GUID,

	/**
	 * A {@link java.net.URI}, written as a string.
	 */
	URI,

	/**
	 * A {@link java.time.Duration}, written as an ISO 8601 string like {@code PT1H30M}.
	 */
	TIMESPAN;

	public boolean isNumeric() {
		return this == INTEGER || this == FLOAT;
	}
}
