package works.lattice.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedClass;
import org.junit.jupiter.params.provider.MethodSource;
import works.lattice.codec.JsonReader;
import works.lattice.codec.JsonToken;
import works.lattice.codec.io.JsonTextReader;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static works.lattice.codec.JsonToken.BOOLEAN;
import static works.lattice.codec.JsonToken.END_ARRAY;
import static works.lattice.codec.JsonToken.END_OBJECT;
import static works.lattice.codec.JsonToken.INTEGER;
import static works.lattice.codec.JsonToken.NULL;
import static works.lattice.codec.JsonToken.PROPERTY_NAME;
import static works.lattice.codec.JsonToken.START_ARRAY;
import static works.lattice.codec.JsonToken.START_OBJECT;
import static works.lattice.codec.JsonToken.STRING;

/**
 * Behaviour every {@link JsonReader} shares, whether it parses text or walks a tree.
 */
@ParameterizedClass
@MethodSource("readers")
class JsonReaderContractTest {
	private final Function<String, JsonReader> factory;

	record ReaderFactory(String name, Function<String, JsonReader> factory) {
		@Override
		public String toString() {
			return name;
		}
	}

	JsonReaderContractTest(ReaderFactory p) {
		this.factory = p.factory();
	}

	static List<ReaderFactory> readers() {
		return List.of(
			new ReaderFactory("text", JsonTextReader::forString),
			new ReaderFactory("tree", json -> JsonNode.parse(json).createReader())
		);
	}

	record Step(JsonToken token, Object value, int depth, String path) { }

	@Test
	void tokensDepthsAndPaths() {
		JsonReader reader = factory.apply("{\"a\":[1,\"x\",{\"b\":true}],\"c\":null}");
		List<Step> steps = new ArrayList<>();
		while (reader.read()) {
			steps.add(new Step(reader.tokenType(), reader.value(), reader.depth(), reader.path()));
		}
		assertEquals(List.of(
			new Step(START_OBJECT, null, 1, ""),
			new Step(PROPERTY_NAME, "a", 1, "a"),
			new Step(START_ARRAY, null, 2, "a"),
			new Step(INTEGER, 1L, 2, "a[0]"),
			new Step(STRING, "x", 2, "a[1]"),
			new Step(START_OBJECT, null, 3, "a[2]"),
			new Step(PROPERTY_NAME, "b", 3, "a[2].b"),
			new Step(BOOLEAN, true, 3, "a[2].b"),
			new Step(END_OBJECT, null, 2, "a[2]"),
			new Step(END_ARRAY, null, 1, "a"),
			new Step(PROPERTY_NAME, "c", 1, "c"),
			new Step(NULL, null, 1, "c"),
			new Step(END_OBJECT, null, 0, "")
		), steps);
		assertFalse(reader.read());
	}

	@Test
	void typedReads() {
		JsonReader reader = factory.apply("[1,\"2\",2.5,null,\"AQI=\",[3,4]]");
		reader.read();
		assertEquals(1, reader.readAsInt());
		assertEquals(2L, reader.readAsLong());
		assertEquals(2.5, reader.readAsDouble());
		assertNull(reader.readAsString());
		assertArrayEquals(new byte[]{1, 2}, reader.readAsBytes());
		assertArrayEquals(new byte[]{3, 4}, reader.readAsBytes());
		assertNull(reader.readAsInt());
		assertEquals(END_ARRAY, reader.tokenType());
	}

	@Test
	void skipConsumesTheWholeContainer() {
		JsonReader reader = factory.apply("[{\"a\":[1,[2]]},3]");
		reader.read();
		reader.read();
		reader.skip();
		assertEquals(END_OBJECT, reader.tokenType());
		assertEquals(1, reader.depth());
		reader.read();
		assertEquals(3L, reader.value());
		assertEquals("[1]", reader.path());
	}
}
