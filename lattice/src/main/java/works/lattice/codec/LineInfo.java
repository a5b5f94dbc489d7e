package works.lattice.codec;

/**
 * Something that may know where in the source text it came from.
 */
public interface LineInfo {
	boolean hasLineInfo();

	/**
	 * @return 1-based line number, or 0 if {@link #hasLineInfo()} is false
	 */
	int lineNumber();

	/**
	 * @return number of characters on the line up to and including the current token,
	 * or 0 if {@link #hasLineInfo()} is false
	 */
	int linePosition();
}
