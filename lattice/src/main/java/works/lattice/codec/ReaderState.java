package works.lattice.codec;

/**
 * What a {@link JsonReader} expects to see next.
 */
public enum ReaderState {
	/**
	 * Nothing has been read yet.
	 */
	START,

	/**
	 * A property name was just read; its value comes next.
	 */
	PROPERTY,

	OBJECT_START,

	/**
	 * Inside an object, after a comma.
	 */
	OBJECT,

	ARRAY_START,

	/**
	 * Inside an array, after a comma.
	 */
	ARRAY,

	CONSTRUCTOR_START,
	CONSTRUCTOR,

	/**
	 * A value was just completed; a delimiter or the end of the container comes next.
	 */
	POST_VALUE,

	/**
	 * The single top-level value is complete. Only whitespace and comments may follow.
	 */
	FINISHED,

	CLOSED,
	ERROR,
}
