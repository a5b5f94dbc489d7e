package works.lattice.codec;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ReaderSettings {
	public static final ReaderSettings DEFAULT = ReaderSettings.builder().build();

	/**
	 * Whether strings that look like dates are reported as {@link JsonToken#DATE} tokens.
	 */
	@Default DateParseHandling dateParseHandling = DateParseHandling.DATE_TIME;

	@Default FloatParseHandling floatParseHandling = FloatParseHandling.DOUBLE;

	/**
	 * Nesting deeper than this is rejected. Zero means no limit.
	 */
	@Default int maxDepth = 64;

	/**
	 * Allow more than one top-level value in the input.
	 */
	@Default boolean supportMultipleContent = false;

	/**
	 * Report {@code new Date(1234)} as a single {@link JsonToken#DATE} token
	 * instead of a {@link JsonToken#START_CONSTRUCTOR constructor}.
	 */
	@Default boolean readDateConstructorAsDate = false;

	/**
	 * Whether closing the reader also closes the source it reads from.
	 */
	@Default boolean closeInput = true;

	public enum DateParseHandling {
		/**
		 * Date-like strings remain {@link JsonToken#STRING} tokens.
		 */
		NONE,

		/**
		 * Date-like strings become {@link JsonToken#DATE} tokens
		 * whose value is a {@link java.time.LocalDateTime} if the text has no offset,
		 * or an {@link java.time.OffsetDateTime} otherwise.
		 */
		DATE_TIME,

		/**
		 * Date-like strings become {@link JsonToken#DATE} tokens
		 * whose value is always an {@link java.time.OffsetDateTime}.
		 * Text with no offset is taken to be UTC.
		 */
		DATE_TIME_OFFSET,
	}

	public enum FloatParseHandling {
		/**
		 * Non-integer numbers become {@link Double}s.
		 */
		DOUBLE,

		/**
		 * Non-integer numbers become {@link java.math.BigDecimal}s, preserving all digits.
		 */
		DECIMAL,
	}
}
