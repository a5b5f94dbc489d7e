package works.lattice.tree;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.temporal.Temporal;
import java.util.Base64;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import works.lattice.codec.DateTimeText;
import works.lattice.codec.JsonPosition;
import works.lattice.exceptions.JsonConversionException;

import static java.util.Map.entry;
import static works.lattice.tree.NodeType.BOOLEAN;
import static works.lattice.tree.NodeType.BYTES;
import static works.lattice.tree.NodeType.COMMENT;
import static works.lattice.tree.NodeType.DATE;
import static works.lattice.tree.NodeType.FLOAT;
import static works.lattice.tree.NodeType.GUID;
import static works.lattice.tree.NodeType.INTEGER;
import static works.lattice.tree.NodeType.RAW;
import static works.lattice.tree.NodeType.STRING;
import static works.lattice.tree.NodeType.TIMESPAN;
import static works.lattice.tree.NodeType.URI;

/**
 * Conversions from tree values to Java types.
 * <p>
 * Each target type has a set of node types it accepts;
 * anything else is rejected before the value is even looked at.
 */
final class ValueConversions {
	private ValueConversions() { }

	private static final EnumSet<NodeType> NUMBER_TYPES = EnumSet.of(INTEGER, FLOAT, STRING, COMMENT, RAW, BOOLEAN);
	private static final EnumSet<NodeType> BIG_INTEGER_TYPES = EnumSet.of(INTEGER, FLOAT, STRING, COMMENT, RAW, BOOLEAN, BYTES);
	private static final EnumSet<NodeType> STRING_TYPES = EnumSet.of(DATE, INTEGER, FLOAT, STRING, COMMENT, RAW, BOOLEAN, BYTES, GUID, TIMESPAN, URI);
	private static final EnumSet<NodeType> GUID_TYPES = EnumSet.of(STRING, COMMENT, RAW, GUID, BYTES);
	private static final EnumSet<NodeType> TIMESPAN_TYPES = EnumSet.of(STRING, COMMENT, RAW, TIMESPAN);
	private static final EnumSet<NodeType> URI_TYPES = EnumSet.of(STRING, COMMENT, RAW, URI);
	private static final EnumSet<NodeType> CHAR_TYPES = EnumSet.of(INTEGER, FLOAT, STRING, COMMENT, RAW);
	private static final EnumSet<NodeType> DATE_TYPES = EnumSet.of(DATE, STRING, COMMENT, RAW);
	private static final EnumSet<NodeType> BYTES_TYPES = EnumSet.of(BYTES, STRING, COMMENT, RAW, INTEGER);

	private record Conversion(EnumSet<NodeType> allowed, Function<JsonValue, Object> function) { }

	private static final Map<Class<?>, Conversion> CONVERSIONS = Map.ofEntries(
		entry(Integer.class, new Conversion(NUMBER_TYPES, v -> exact(v, "Integer", BigDecimal::intValueExact))),
		entry(Long.class, new Conversion(NUMBER_TYPES, v -> exact(v, "Long", BigDecimal::longValueExact))),
		entry(Short.class, new Conversion(NUMBER_TYPES, v -> exact(v, "Short", BigDecimal::shortValueExact))),
		entry(Byte.class, new Conversion(NUMBER_TYPES, v -> exact(v, "Byte", BigDecimal::byteValueExact))),
		entry(Double.class, new Conversion(NUMBER_TYPES, ValueConversions::toDouble)),
		entry(Float.class, new Conversion(NUMBER_TYPES, ValueConversions::toFloat)),
		entry(BigDecimal.class, new Conversion(NUMBER_TYPES, ValueConversions::toDecimal)),
		entry(BigInteger.class, new Conversion(BIG_INTEGER_TYPES, ValueConversions::toBigInteger)),
		entry(Boolean.class, new Conversion(NUMBER_TYPES, ValueConversions::toBoolean)),
		entry(String.class, new Conversion(STRING_TYPES, ValueConversions::toText)),
		entry(Character.class, new Conversion(CHAR_TYPES, ValueConversions::toChar)),
		entry(UUID.class, new Conversion(GUID_TYPES, ValueConversions::toUuid)),
		entry(Duration.class, new Conversion(TIMESPAN_TYPES, ValueConversions::toDuration)),
		entry(java.net.URI.class, new Conversion(URI_TYPES, ValueConversions::toUri)),
		entry(OffsetDateTime.class, new Conversion(DATE_TYPES, v -> DateTimeText.toOffset(toDate(v)))),
		entry(LocalDateTime.class, new Conversion(DATE_TYPES, v -> DateTimeText.toLocal(toDate(v)))),
		entry(byte[].class, new Conversion(BYTES_TYPES, ValueConversions::toBytes))
	);

	static <T> T convert(JsonNode node, Class<T> target) {
		JsonNode subject = (node instanceof JsonProperty p) ? p.value() : node;
		Conversion conversion = CONVERSIONS.get(target);
		if (conversion == null) {
			throw new IllegalArgumentException("Unsupported conversion target: " + target.getName());
		}
		if (!(subject instanceof JsonValue v)) {
			NodeType type = (subject == null) ? NodeType.NULL : subject.type();
			throw failure(node, "Cannot convert " + type + " to " + target.getSimpleName(), null);
		}
		if (v.type() == NodeType.NULL || v.type() == NodeType.UNDEFINED) {
			return null;
		}
		if (!conversion.allowed().contains(v.type())) {
			throw failure(node, "Cannot convert " + v.type() + " to " + target.getSimpleName(), null);
		}
		try {
			return target.cast(conversion.function().apply(v));
		} catch (ArithmeticException | IllegalArgumentException | DateTimeException e) {
			throw failure(node, "Could not convert " + v.type() + " value to " + target.getSimpleName()
				+ ": " + e.getMessage(), e);
		}
	}

	static JsonConversionException failure(JsonNode node, String message, Throwable cause) {
		String path = node.path();
		return new JsonConversionException(JsonPosition.formatMessage(node, path, message), path, cause);
	}

	static BigDecimal toBigDecimal(Object number) {
		if (number instanceof BigDecimal b) {
			return b;
		} else if (number instanceof BigInteger b) {
			return new BigDecimal(b);
		} else if (number instanceof Long l) {
			return BigDecimal.valueOf(l);
		} else {
			return BigDecimal.valueOf(((Number) number).doubleValue());
		}
	}

	private static Object exact(JsonValue v, String targetName, Function<BigDecimal, Object> narrowing) {
		try {
			return narrowing.apply(toDecimal(v));
		} catch (ArithmeticException e) {
			throw new ArithmeticException("Value " + v.value() + " is out of range for " + targetName + " or has a fractional part");
		}
	}

	/**
	 * @throws NumberFormatException (an {@link IllegalArgumentException}) for unparsable text and non-finite doubles
	 */
	private static BigDecimal toDecimal(JsonValue v) {
		return switch (v.type()) {
			case INTEGER, FLOAT -> {
				if (v.value() instanceof Double d && !Double.isFinite(d)) {
					throw new NumberFormatException("Non-finite value " + d);
				}
				yield toBigDecimal(v.value());
			}
			case BOOLEAN -> ((Boolean) v.value()) ? BigDecimal.ONE : BigDecimal.ZERO;
			default -> new BigDecimal(v.value().toString().trim());
		};
	}

	private static Double toDouble(JsonValue v) {
		return switch (v.type()) {
			case INTEGER, FLOAT -> ((Number) v.value()).doubleValue();
			case BOOLEAN -> ((Boolean) v.value()) ? 1.0 : 0.0;
			default -> Double.parseDouble(v.value().toString().trim());
		};
	}

	private static Float toFloat(JsonValue v) {
		double d = toDouble(v);
		float f = (float) d;
		if (Float.isInfinite(f) && !Double.isInfinite(d)) {
			throw new ArithmeticException("Value " + d + " is out of range for Float");
		}
		return f;
	}

	private static BigInteger toBigInteger(JsonValue v) {
		if (v.type() == BYTES) {
			return new BigInteger((byte[]) v.value());
		}
		return toDecimal(v).toBigIntegerExact();
	}

	private static Boolean toBoolean(JsonValue v) {
		return switch (v.type()) {
			case BOOLEAN -> (Boolean) v.value();
			case INTEGER, FLOAT -> toDecimal(v).signum() != 0;
			default -> {
				String text = v.value().toString().trim().toLowerCase(Locale.ROOT);
				if (text.equals("true")) {
					yield true;
				} else if (text.equals("false")) {
					yield false;
				}
				throw new IllegalArgumentException("Not a boolean: " + v.value());
			}
		};
	}

	private static String toText(JsonValue v) {
		return switch (v.type()) {
			case DATE -> DateTimeText.formatIso((Temporal) v.value());
			case BYTES -> Base64.getEncoder().encodeToString((byte[]) v.value());
			default -> v.value().toString();
		};
	}

	private static Character toChar(JsonValue v) {
		if (v.type() == INTEGER || v.type() == FLOAT) {
			int code = toDecimal(v).intValueExact();
			if (code < Character.MIN_VALUE || code > Character.MAX_VALUE) {
				throw new ArithmeticException("Value " + code + " is out of range for Character");
			}
			return (char) code;
		}
		String text = v.value().toString();
		if (text.length() != 1) {
			throw new IllegalArgumentException("String must be exactly one character long: " + text);
		}
		return text.charAt(0);
	}

	private static UUID toUuid(JsonValue v) {
		return switch (v.type()) {
			case GUID -> (UUID) v.value();
			case BYTES -> {
				byte[] bytes = (byte[]) v.value();
				if (bytes.length != 16) {
					throw new IllegalArgumentException("A UUID needs 16 bytes, not " + bytes.length);
				}
				ByteBuffer buffer = ByteBuffer.wrap(bytes);
				yield new UUID(buffer.getLong(), buffer.getLong());
			}
			default -> UUID.fromString(v.value().toString().trim());
		};
	}

	private static Duration toDuration(JsonValue v) {
		if (v.type() == TIMESPAN) {
			return (Duration) v.value();
		}
		return Duration.parse(v.value().toString().trim());
	}

	private static java.net.URI toUri(JsonValue v) {
		if (v.type() == URI) {
			return (java.net.URI) v.value();
		}
		return java.net.URI.create(v.value().toString());
	}

	private static Temporal toDate(JsonValue v) {
		if (v.type() == DATE) {
			return (Temporal) v.value();
		}
		return DateTimeText.parse(v.value().toString().trim());
	}

	private static byte[] toBytes(JsonValue v) {
		return switch (v.type()) {
			case BYTES -> ((byte[]) v.value()).clone();
			case INTEGER -> toBigDecimal(v.value()).toBigIntegerExact().toByteArray();
			default -> Base64.getDecoder().decode(v.value().toString());
		};
	}
}
