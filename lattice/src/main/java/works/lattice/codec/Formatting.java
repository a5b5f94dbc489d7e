package works.lattice.codec;

public enum Formatting {
	/**
	 * No whitespace between tokens.
	 */
	NONE,

	/**
	 * Each child on its own line, indented according to
	 * {@link WriterSettings#indentation() indentation} and {@link WriterSettings#indentChar() indentChar}.
	 */
	INDENTED
}
