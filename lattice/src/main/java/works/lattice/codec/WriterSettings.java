package works.lattice.codec;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class WriterSettings {
	public static final WriterSettings DEFAULT = WriterSettings.builder().build();

	@Default Formatting formatting = Formatting.NONE;

	/**
	 * How many {@link #indentChar}s to write per level of nesting
	 * when {@link #formatting} is {@link Formatting#INDENTED INDENTED}.
	 */
	@Default int indentation = 2;

	@Default char indentChar = ' ';

	/**
	 * Either {@code '"'} or {@code '\''}.
	 * The latter is not standard JSON, but is accepted by {@link JsonReader}.
	 */
	@Default char quoteChar = '"';

	/**
	 * Whether property names are quoted. Unquoted names are not standard JSON.
	 */
	@Default boolean quoteName = true;

	@Default StringEscapeHandling stringEscapeHandling = StringEscapeHandling.DEFAULT;
	@Default DateFormatHandling dateFormatHandling = DateFormatHandling.ISO;
	@Default FloatFormatHandling floatFormatHandling = FloatFormatHandling.STRING;

	/**
	 * When the writer is closed, end any containers that are still open,
	 * writing {@code null} for any property that has no value yet.
	 */
	@Default boolean autoCompleteOnClose = true;

	/**
	 * Whether closing the writer also closes the destination it writes to.
	 */
	@Default boolean closeOutput = true;

	/**
	 * Allow more than one top-level value to be written.
	 */
	@Default boolean supportMultipleContent = false;

	public enum StringEscapeHandling {
		/**
		 * Only control characters, backslashes, and the quote character are escaped.
		 */
		DEFAULT,

		/**
		 * Additionally, all characters outside the ASCII range are escaped.
		 */
		ESCAPE_NON_ASCII,

		/**
		 * Additionally, HTML-significant characters ({@code < > & ' "}) are escaped.
		 */
		ESCAPE_HTML,
	}

	public enum DateFormatHandling {
		/**
		 * {@code "2012-03-21T05:40:00.123Z"}
		 */
		ISO,

		/**
		 * {@code "\/Date(1332308400123)\/"}
		 */
		MICROSOFT,
	}

	/**
	 * How to write floating point values that JSON can't represent as numbers.
	 */
	public enum FloatFormatHandling {
		/**
		 * {@code "NaN"}, {@code "Infinity"}, {@code "-Infinity"}
		 */
		STRING,

		/**
		 * {@code NaN}, {@code Infinity}, {@code -Infinity}, which is not valid JSON
		 * but is accepted by {@link JsonReader}.
		 */
		SYMBOL,

		/**
		 * {@code 0.0}
		 */
		DEFAULT_VALUE,
	}
}
