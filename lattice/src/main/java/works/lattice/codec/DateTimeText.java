package works.lattice.codec;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.Temporal;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;
import works.lattice.codec.ReaderSettings.DateParseHandling;

/**
 * Conversions between dates and the two textual forms we support:
 * ISO 8601 ({@code 2000-12-15T22:11:03.055Z})
 * and Microsoft ({@code /Date(976918263055+0100)/}).
 * <p>
 * Dates are either {@link OffsetDateTime} or {@link LocalDateTime};
 * the latter represents a date whose offset is unspecified.
 */
public final class DateTimeText {
	private static final String MS_PREFIX = "/Date(";
	private static final String MS_SUFFIX = ")/";

	private DateTimeText() { }

	public static String formatIso(Temporal date) {
		if (date instanceof OffsetDateTime d) {
			return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(d);
		} else if (date instanceof LocalDateTime d) {
			return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(d);
		} else {
			throw new IllegalArgumentException("Not a supported date type: " + date.getClass().getName());
		}
	}

	/**
	 * Dates with no offset are treated as UTC and written with no offset suffix.
	 * The result has no JSON escaping; a text writer that wants {@code \/Date(...)\/} adds it.
	 */
	public static String formatMicrosoft(Temporal date) {
		StringBuilder sb = new StringBuilder(MS_PREFIX);
		if (date instanceof OffsetDateTime d) {
			sb.append(d.toInstant().toEpochMilli());
			int offsetSeconds = d.getOffset().getTotalSeconds();
			int absMinutes = Math.abs(offsetSeconds) / 60;
			sb.append(offsetSeconds < 0 ? '-' : '+')
				.append(String.format("%02d%02d", absMinutes / 60, absMinutes % 60));
		} else if (date instanceof LocalDateTime d) {
			sb.append(d.toInstant(ZoneOffset.UTC).toEpochMilli());
		} else {
			throw new IllegalArgumentException("Not a supported date type: " + date.getClass().getName());
		}
		return sb.append(MS_SUFFIX).toString();
	}

	/**
	 * Cheap test for whether {@link #tryParse} is worth calling.
	 */
	public static boolean looksLikeDate(String text) {
		int length = text.length();
		if (length >= 19 && length <= 40 && Character.isDigit(text.charAt(0)) && text.charAt(10) == 'T') {
			return true;
		}
		return text.startsWith(MS_PREFIX) && text.endsWith(MS_SUFFIX);
	}

	/**
	 * @return the parsed date, or empty if {@code text} is not in one of the supported forms
	 */
	public static Optional<Temporal> tryParse(String text, DateParseHandling handling) {
		if (handling == DateParseHandling.NONE || !looksLikeDate(text)) {
			return Optional.empty();
		}
		Temporal result;
		try {
			if (text.startsWith(MS_PREFIX)) {
				result = parseMicrosoft(text);
			} else {
				TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
				result = (Temporal) parsed;
			}
		} catch (DateTimeException | NumberFormatException e) {
			return Optional.empty();
		}
		if (handling == DateParseHandling.DATE_TIME_OFFSET) {
			return Optional.of(toOffset(result));
		}
		return Optional.of(result);
	}

	/**
	 * @throws DateTimeParseException if {@code text} is not a supported date
	 */
	public static Temporal parse(String text) {
		return tryParse(text, DateParseHandling.DATE_TIME).orElseThrow(() ->
			new DateTimeParseException("Unable to parse date: " + text, text, 0));
	}

	public static OffsetDateTime toOffset(Temporal date) {
		if (date instanceof OffsetDateTime d) {
			return d;
		} else if (date instanceof LocalDateTime d) {
			return d.atOffset(ZoneOffset.UTC);
		} else if (date instanceof Instant i) {
			return i.atOffset(ZoneOffset.UTC);
		} else {
			throw new IllegalArgumentException("Not a supported date type: " + date.getClass().getName());
		}
	}

	/**
	 * An {@link OffsetDateTime} keeps its own wall-clock time, not converted to UTC.
	 */
	public static LocalDateTime toLocal(Temporal date) {
		if (date instanceof LocalDateTime d) {
			return d;
		} else if (date instanceof OffsetDateTime d) {
			return d.toLocalDateTime();
		} else if (date instanceof Instant i) {
			return LocalDateTime.ofInstant(i, ZoneOffset.UTC);
		} else {
			throw new IllegalArgumentException("Not a supported date type: " + date.getClass().getName());
		}
	}

	private static Temporal parseMicrosoft(String text) {
		String body = text.substring(MS_PREFIX.length(), text.length() - MS_SUFFIX.length());
		int signIndex = Math.max(body.lastIndexOf('+'), body.lastIndexOf('-'));
		if (signIndex <= 0) {
			return Instant.ofEpochMilli(Long.parseLong(body)).atOffset(ZoneOffset.UTC);
		}
		long millis = Long.parseLong(body.substring(0, signIndex));
		String offsetText = body.substring(signIndex + 1);
		if (offsetText.length() != 4) {
			throw new DateTimeParseException("Invalid offset", text, MS_PREFIX.length() + signIndex);
		}
		int hours = Integer.parseInt(offsetText.substring(0, 2));
		int minutes = Integer.parseInt(offsetText.substring(2));
		int sign = body.charAt(signIndex) == '-' ? -1 : 1;
		ZoneOffset offset = ZoneOffset.ofHoursMinutes(sign * hours, sign * minutes);
		return Instant.ofEpochMilli(millis).atOffset(offset);
	}
}
