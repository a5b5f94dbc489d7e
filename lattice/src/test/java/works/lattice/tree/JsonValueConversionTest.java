package works.lattice.tree;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.lattice.exceptions.JsonConversionException;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonValueConversionTest {
	private static final UUID ID = UUID.fromString("6ba7b810-9dad-11d1-80b4-00c04fd430c8");

	@Test
	void integers() {
		assertEquals(5, JsonValue.of(5).asInt());
		assertEquals(5, JsonValue.of("5").asInt());
		assertEquals(5, JsonValue.of(5.0).asInt());
		assertEquals(1, JsonValue.of(true).asInt());
		assertEquals(Long.MAX_VALUE, JsonValue.of(Long.MAX_VALUE).asLong());
		assertEquals((short) 7, JsonValue.of(7).as(Short.class));
	}

	@Test
	void integersMustFit() {
		assertThrows(JsonConversionException.class, () -> JsonValue.of(5.5).asInt());
		assertThrows(JsonConversionException.class, () -> JsonValue.of(Long.MAX_VALUE).asInt());
		assertThrows(JsonConversionException.class, () -> JsonValue.of(new BigInteger("123456789012345678901234567890")).asLong());
		assertThrows(JsonConversionException.class, () -> JsonValue.of(300).as(Byte.class));
		assertThrows(JsonConversionException.class, () -> JsonValue.of(Double.NaN).asInt());
		assertThrows(JsonConversionException.class, () -> JsonValue.of("five").asInt());
	}

	@Test
	void floatingPoint() {
		assertEquals(2.5, JsonValue.of("2.5").asDouble());
		assertEquals(3.0, JsonValue.of(3).asDouble());
		assertTrue(Double.isNaN(JsonValue.of(Double.NaN).asDouble()));
		assertEquals(new BigDecimal("1.10"), JsonValue.of(new BigDecimal("1.10")).asBigDecimal());
		assertEquals(0.1f, JsonValue.of(0.1).as(Float.class));
		assertThrows(JsonConversionException.class, () -> JsonValue.of(1e300).as(Float.class));
	}

	@Test
	void bigIntegers() {
		assertEquals(new BigInteger("123456789012345678901234567890"),
			JsonValue.of("123456789012345678901234567890").asBigInteger());
		assertEquals(BigInteger.valueOf(256), JsonValue.of(new byte[]{1, 0}).asBigInteger());
	}

	@Test
	void booleans() {
		assertTrue(JsonValue.of(1.5).asBoolean());
		assertFalse(JsonValue.of(0).asBoolean());
		assertTrue(JsonValue.of("TRUE").asBoolean());
		assertThrows(JsonConversionException.class, () -> JsonValue.of("yes").asBoolean());
	}

	@Test
	void chars() {
		assertEquals('a', JsonValue.of("a").asChar());
		assertEquals('A', JsonValue.of(65).asChar());
		assertThrows(JsonConversionException.class, () -> JsonValue.of("ab").asChar());
		assertThrows(JsonConversionException.class, () -> JsonValue.of(true).asChar());
	}

	@Test
	void strings() {
		assertEquals("1.5", JsonValue.of(1.5).asString());
		assertEquals("true", JsonValue.of(true).asString());
		assertEquals(ID.toString(), JsonValue.of(ID).asString());
		assertEquals("PT1H30M", JsonValue.of(Duration.ofMinutes(90)).asString());
		assertEquals("AQI=", JsonValue.of(new byte[]{1, 2}).asString());
		OffsetDateTime date = OffsetDateTime.of(2012, 3, 21, 5, 40, 0, 123_000_000, ZoneOffset.UTC);
		assertEquals("2012-03-21T05:40:00.123Z", JsonValue.of(date).asString());
	}

	@Test
	void uuids() {
		assertEquals(ID, JsonValue.of(ID).asUuid());
		assertEquals(ID, JsonValue.of(ID.toString()).asUuid());
		byte[] bytes = new byte[16];
		bytes[15] = 1;
		assertEquals(new UUID(0, 1), JsonValue.of(bytes).asUuid());
		assertThrows(JsonConversionException.class, () -> JsonValue.of(new byte[3]).asUuid());
		assertThrows(JsonConversionException.class, () -> JsonValue.of(12).asUuid());
	}

	@Test
	void urisAndDurations() {
		URI uri = URI.create("https://example.com/a?b=c");
		assertEquals(uri, JsonValue.of(uri).asUri());
		assertEquals(uri, JsonValue.of(uri.toString()).asUri());
		assertEquals(Duration.ofSeconds(61), JsonValue.of("PT1M1S").asDuration());
		assertThrows(JsonConversionException.class, () -> JsonValue.of("soon").asDuration());
		assertThrows(JsonConversionException.class, () -> JsonValue.of(5).asUri());
	}

	@Test
	void dates() {
		OffsetDateTime offset = OffsetDateTime.of(2012, 3, 21, 6, 40, 0, 0, ZoneOffset.ofHours(1));
		assertEquals(offset, JsonValue.of("2012-03-21T06:40:00+01:00").asOffsetDateTime());
		assertEquals(LocalDateTime.of(2012, 3, 21, 6, 40), JsonValue.of(offset).asLocalDateTime());
		assertEquals(OffsetDateTime.of(2012, 3, 21, 6, 40, 0, 0, ZoneOffset.UTC),
			JsonValue.of(LocalDateTime.of(2012, 3, 21, 6, 40)).asOffsetDateTime());
		assertThrows(JsonConversionException.class, () -> JsonValue.of(offset).asInt());
		assertThrows(JsonConversionException.class, () -> JsonValue.of("not a date").asOffsetDateTime());
	}

	@Test
	void bytes() {
		assertArrayEquals(new byte[]{1, 2}, JsonValue.of("AQI=").asBytes());
		assertArrayEquals(new byte[]{1, 0}, JsonValue.of(256).asBytes());
		byte[] original = {9};
		JsonValue value = JsonValue.of(original);
		byte[] copy = value.asBytes();
		copy[0] = 0;
		assertArrayEquals(new byte[]{9}, value.asBytes());
	}

	@Test
	void nulls() {
		assertNull(JsonValue.nullValue().as(Integer.class));
		assertNull(JsonValue.undefined().asString());
		JsonConversionException e = assertThrows(JsonConversionException.class, () -> JsonValue.nullValue().asInt());
		assertTrue(e.getMessage().contains("null"), e.getMessage());
	}

	@Test
	void containersDoNotConvert() {
		JsonObject object = new JsonObject(new JsonProperty("a", new JsonArray(1)));
		JsonConversionException e = assertThrows(JsonConversionException.class, () -> object.get("a").asInt());
		assertEquals("Cannot convert ARRAY to Integer. Path 'a'.", e.getMessage());
		assertEquals("a", e.path());
	}

	@Test
	void failuresReportWhereTheValueCameFrom() {
		JsonObject object = (JsonObject) JsonNode.parse("{\n\"a\":\"x\"}");
		JsonConversionException e = assertThrows(JsonConversionException.class, () -> object.get("a").asInt());
		assertTrue(e.getMessage().startsWith("Could not convert STRING value to Integer"), e.getMessage());
		assertTrue(e.getMessage().endsWith(" Path 'a', line 2, position 7."), e.getMessage());
		JsonConversionException nullFailure = assertThrows(JsonConversionException.class,
			() -> new JsonArray(JsonValue.nullValue()).get(0).asLong());
		assertTrue(nullFailure.getMessage().endsWith(" Path '[0]'."), nullFailure.getMessage());
	}

	@Test
	void propertiesConvertTheirValue() {
		assertEquals(3, new JsonProperty("a", 3).asInt());
		assertEquals("x", new JsonProperty("a", "x").asString());
	}

	@ParameterizedTest
	@ValueSource(classes = {Object.class, StringBuilder.class})
	void unsupportedTargets(Class<?> target) {
		assertThrows(IllegalArgumentException.class, () -> JsonValue.of(1).as(target));
	}

	@Test
	void fromObject() {
		assertEquals(NodeType.INTEGER, JsonValue.fromObject((byte) 1).type());
		assertEquals(NodeType.FLOAT, JsonValue.fromObject(1.5f).type());
		assertEquals(NodeType.STRING, JsonValue.fromObject('c').type());
		assertEquals(NodeType.GUID, JsonValue.fromObject(ID).type());
		assertEquals(NodeType.TIMESPAN, JsonValue.fromObject(Duration.ZERO).type());
		assertEquals(NodeType.DATE, JsonValue.fromObject(java.time.Instant.EPOCH).type());
		assertInstanceOf(OffsetDateTime.class, JsonValue.fromObject(java.time.Instant.EPOCH).value());
		assertThrows(IllegalArgumentException.class, () -> JsonValue.fromObject(new Object()));
	}
}
