package works.lattice.codec;

/**
 * The kind of scope a reader or writer is currently inside.
 */
public enum ContainerType {
	NONE,
	OBJECT,
	ARRAY,
	CONSTRUCTOR;

	/**
	 * @return true if the children of this kind of container are identified by position rather than by name
	 */
	public boolean hasIndex() {
		return this == ARRAY || this == CONSTRUCTOR;
	}

	public JsonToken startToken() {
		return switch (this) {
			case OBJECT -> JsonToken.START_OBJECT;
			case ARRAY -> JsonToken.START_ARRAY;
			case CONSTRUCTOR -> JsonToken.START_CONSTRUCTOR;
			case NONE -> throw new IllegalArgumentException("No start token for " + this);
		};
	}

	public JsonToken endToken() {
		return switch (this) {
			case OBJECT -> JsonToken.END_OBJECT;
			case ARRAY -> JsonToken.END_ARRAY;
			case CONSTRUCTOR -> JsonToken.END_CONSTRUCTOR;
			case NONE -> throw new IllegalArgumentException("No end token for " + this);
		};
	}
}
