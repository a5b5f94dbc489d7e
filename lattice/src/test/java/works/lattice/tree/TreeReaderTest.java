package works.lattice.tree;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import works.lattice.codec.JsonToken;
import works.lattice.codec.io.JsonTextWriter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.lattice.codec.JsonToken.END_ARRAY;
import static works.lattice.codec.JsonToken.END_OBJECT;
import static works.lattice.codec.JsonToken.INTEGER;
import static works.lattice.codec.JsonToken.NULL;
import static works.lattice.codec.JsonToken.PROPERTY_NAME;
import static works.lattice.codec.JsonToken.START_ARRAY;
import static works.lattice.codec.JsonToken.START_OBJECT;
import static works.lattice.codec.JsonToken.STRING;

class TreeReaderTest {
	record Step(JsonToken token, Object value, int depth, String path) { }

	@Test
	void tokens() {
		JsonObject tree = new JsonObject(
			new JsonProperty("a", new JsonArray(1, "x")),
			new JsonProperty("b", null));
		assertEquals(List.of(
			new Step(START_OBJECT, null, 1, ""),
			new Step(PROPERTY_NAME, "a", 1, "a"),
			new Step(START_ARRAY, null, 2, "a"),
			new Step(INTEGER, 1L, 2, "a[0]"),
			new Step(STRING, "x", 2, "a[1]"),
			new Step(END_ARRAY, null, 1, "a"),
			new Step(PROPERTY_NAME, "b", 1, "b"),
			new Step(NULL, null, 1, "b"),
			new Step(END_OBJECT, null, 0, "")
		), steps(tree));
	}

	@Test
	void emptyContainers() {
		assertEquals(List.of(
			new Step(START_ARRAY, null, 1, ""),
			new Step(START_OBJECT, null, 2, "[0]"),
			new Step(END_OBJECT, null, 1, "[0]"),
			new Step(END_ARRAY, null, 0, "")
		), steps(new JsonArray(new JsonObject())));
	}

	@Test
	void singleValue() {
		assertEquals(List.of(new Step(STRING, "s", 0, "")), steps(JsonValue.of("s")));
	}

	@Test
	void startingAtAProperty() {
		JsonObject tree = (JsonObject) JsonNode.parse("{\"a\":[1],\"b\":2}");
		assertEquals(List.of(PROPERTY_NAME, START_ARRAY, INTEGER, END_ARRAY),
			steps(tree.property("a")).stream().map(Step::token).toList());
	}

	@Test
	void subtreeOnly() {
		JsonObject tree = (JsonObject) JsonNode.parse("{\"a\":[1],\"b\":2}");
		assertEquals(List.of(START_ARRAY, INTEGER, END_ARRAY),
			steps(tree.get("a")).stream().map(Step::token).toList());
	}

	@Test
	void uuidsAreReportedAsStrings() {
		UUID id = UUID.randomUUID();
		List<Step> steps = steps(new JsonArray(id));
		assertEquals(STRING, steps.get(1).token());
		assertSame(id, steps.get(1).value());
	}

	@Test
	void readAsStringOfUuid() {
		UUID id = UUID.randomUUID();
		TreeReader reader = new JsonArray(id).createReader();
		reader.read();
		assertEquals(id.toString(), reader.readAsString());
	}

	@Test
	void lineInfoComesFromTheNodes() {
		JsonNode tree = JsonNode.parse("[\n  1,\n  2\n]");
		TreeReader reader = tree.createReader();
		reader.read();
		assertEquals(1, reader.lineNumber());
		reader.read();
		reader.read();
		assertTrue(reader.hasLineInfo());
		assertEquals(3, reader.lineNumber());
		assertEquals(3, reader.linePosition());
		assertFalse(new JsonArray(1).createReader().hasLineInfo());
	}

	@Test
	void currentNode() {
		JsonArray tree = new JsonArray(1, new JsonArray());
		TreeReader reader = tree.createReader();
		reader.read();
		assertSame(tree, reader.currentNode());
		reader.read();
		assertSame(tree.get(0), reader.currentNode());
		reader.read();
		reader.read();
		assertEquals(END_ARRAY, reader.tokenType());
		assertSame(tree.get(1), reader.currentNode());
	}

	@Test
	void writingATreeMatchesCopyingItsReader() {
		JsonNode tree = JsonNode.parse("{\"a\":[1,2.5,{\"b\":null}],\"c\":new F(\"x\"),\"d\":\"2012-03-21T05:40:00Z\"}");
		StringWriter direct = new StringWriter();
		try (JsonTextWriter writer = new JsonTextWriter(direct)) {
			tree.writeTo(writer);
		}
		StringWriter copied = new StringWriter();
		try (JsonTextWriter writer = new JsonTextWriter(copied)) {
			writer.writeToken(tree.createReader());
		}
		assertEquals(direct.toString(), copied.toString());
		assertEquals("{\"a\":[1,2.5,{\"b\":null}],\"c\":new F(\"x\"),\"d\":\"2012-03-21T05:40:00Z\"}", direct.toString());
	}

	private static List<Step> steps(JsonNode root) {
		List<Step> result = new ArrayList<>();
		TreeReader reader = root.createReader();
		while (reader.read()) {
			result.add(new Step(reader.tokenType(), reader.value(), reader.depth(), reader.path()));
		}
		assertEquals(JsonToken.NONE, reader.tokenType());
		return result;
	}
}
