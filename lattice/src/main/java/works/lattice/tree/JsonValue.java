package works.lattice.tree;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;
import works.lattice.codec.JsonWriter;

import static java.util.Objects.requireNonNull;

/**
 * A scalar: a string, number, boolean, date, and so on,
 * or a comment or raw JSON fragment.
 * <p>
 * The Java value is normalized on the way in:
 * integers are stored as {@link Long} or {@link BigInteger},
 * floating point numbers as {@link Double} or {@link BigDecimal},
 * and dates as {@link OffsetDateTime} or {@link LocalDateTime}.
 */
public final class JsonValue extends JsonNode {
	private final NodeType type;
	private final Object value;

	private JsonValue(NodeType type, Object value) {
		this.type = type;
		this.value = value;
	}

	public static JsonValue of(String value) {
		return value == null ? nullValue() : new JsonValue(NodeType.STRING, value);
	}

	public static JsonValue of(long value) {
		return new JsonValue(NodeType.INTEGER, value);
	}

	public static JsonValue of(BigInteger value) {
		return value == null ? nullValue() : new JsonValue(NodeType.INTEGER, value);
	}

	public static JsonValue of(double value) {
		return new JsonValue(NodeType.FLOAT, value);
	}

	public static JsonValue of(BigDecimal value) {
		return value == null ? nullValue() : new JsonValue(NodeType.FLOAT, value);
	}

	public static JsonValue of(boolean value) {
		return new JsonValue(NodeType.BOOLEAN, value);
	}

	public static JsonValue of(OffsetDateTime value) {
		return value == null ? nullValue() : new JsonValue(NodeType.DATE, value);
	}

	public static JsonValue of(LocalDateTime value) {
		return value == null ? nullValue() : new JsonValue(NodeType.DATE, value);
	}

	public static JsonValue of(byte[] value) {
		return value == null ? nullValue() : new JsonValue(NodeType.BYTES, value);
	}

	public static JsonValue of(UUID value) {
		return value == null ? nullValue() : new JsonValue(NodeType.GUID, value);
	}

	public static JsonValue of(URI value) {
		return value == null ? nullValue() : new JsonValue(NodeType.URI, value);
	}

	public static JsonValue of(Duration value) {
		return value == null ? nullValue() : new JsonValue(NodeType.TIMESPAN, value);
	}

	public static JsonValue nullValue() {
		return new JsonValue(NodeType.NULL, null);
	}

	public static JsonValue undefined() {
		return new JsonValue(NodeType.UNDEFINED, null);
	}

	public static JsonValue comment(String text) {
		return new JsonValue(NodeType.COMMENT, text == null ? "" : text);
	}

	/**
	 * A JSON fragment that is written verbatim. It is not validated.
	 */
	public static JsonValue raw(String json) {
		return new JsonValue(NodeType.RAW, requireNonNull(json));
	}

	/**
	 * @throws IllegalArgumentException if {@code value} is not of a type that can be a JSON scalar
	 */
	public static JsonValue fromObject(Object value) {
		if (value == null) {
			return nullValue();
		} else if (value instanceof JsonValue v) {
			return v.deepClone();
		} else if (value instanceof String s) {
			return of(s);
		} else if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
			return of(((Number) value).longValue());
		} else if (value instanceof BigInteger b) {
			return of(b);
		} else if (value instanceof Double d) {
			return of(d.doubleValue());
		} else if (value instanceof Float f) {
			return of(Float.isFinite(f) ? Double.parseDouble(f.toString()) : f.doubleValue());
		} else if (value instanceof BigDecimal b) {
			return of(b);
		} else if (value instanceof Boolean b) {
			return of(b.booleanValue());
		} else if (value instanceof Character c) {
			return of(c.toString());
		} else if (value instanceof OffsetDateTime d) {
			return of(d);
		} else if (value instanceof LocalDateTime d) {
			return of(d);
		} else if (value instanceof Instant i) {
			return of(i.atOffset(ZoneOffset.UTC));
		} else if (value instanceof byte[] b) {
			return of(b);
		} else if (value instanceof UUID u) {
			return of(u);
		} else if (value instanceof URI u) {
			return of(u);
		} else if (value instanceof Duration d) {
			return of(d);
		} else {
			throw new IllegalArgumentException("Could not determine JSON node type for " + value.getClass().getName());
		}
	}

	@Override
	public NodeType type() {
		return type;
	}

	/**
	 * @return the Java value, or null for {@link NodeType#NULL} and {@link NodeType#UNDEFINED}
	 */
	public Object value() {
		return value;
	}

	@Override
	public JsonValue deepClone() {
		Object copy = (value instanceof byte[] b) ? b.clone() : value;
		JsonValue result = new JsonValue(type, copy);
		result.copyLineInfoFrom(this);
		return result;
	}

	@Override
	public boolean deepEquals(JsonNode other) {
		if (!(other instanceof JsonValue v)) {
			return false;
		}
		if (type.isNumeric() && v.type.isNumeric()) {
			return numericEquals(value, v.value);
		}
		if (type != v.type) {
			return false;
		}
		return switch (type) {
			case BYTES -> Arrays.equals((byte[]) value, (byte[]) v.value);
			case DATE -> datesEqual(value, v.value);
			default -> Objects.equals(value, v.value);
		};
	}

	private static boolean numericEquals(Object a, Object b) {
		if (a instanceof Double x && b instanceof Double y) {
			return Double.compare(x, y) == 0 || x.doubleValue() == y.doubleValue();
		}
		if (isNonFinite(a) || isNonFinite(b)) {
			return false;
		}
		return ValueConversions.toBigDecimal(a).compareTo(ValueConversions.toBigDecimal(b)) == 0;
	}

	private static boolean isNonFinite(Object n) {
		return n instanceof Double d && !Double.isFinite(d);
	}

	private static boolean datesEqual(Object a, Object b) {
		if (a instanceof OffsetDateTime x && b instanceof OffsetDateTime y) {
			return x.isEqual(y);
		}
		return a.equals(b);
	}

	@Override
	public void writeTo(JsonWriter writer) {
		switch (type) {
			case NULL -> writer.writeNull();
			case UNDEFINED -> writer.writeUndefined();
			case COMMENT -> writer.writeComment((String) value);
			case RAW -> writer.writeRawValue((String) value);
			default -> writer.writeValue(value);
		}
	}
}
