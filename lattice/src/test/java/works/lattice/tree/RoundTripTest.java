package works.lattice.tree;

import java.math.BigInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import works.lattice.codec.Formatting;
import works.lattice.codec.WriterSettings;
import works.lattice.codec.io.JsonTextReader;
import works.lattice.codec.io.JsonTextWriter;
import works.lattice.exceptions.JsonWriterException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Text to tree to text, through every layer.
 */
class RoundTripTest {
	static final String BIG = "9999999990000000000000000000000000000000000";

	@ParameterizedTest
	@ValueSource(strings = {
		"{\"name\":\"James\",\"hobbies\":[\"A\",\"B\"]}",
		"[" + BIG + ",-" + BIG + "]",
		"{\"a\":[1,2.5,true,null,{}],\"b\":\"x\\ny\",\"c\":[]}",
		"[new F(1,\"x\"),undefined]",
		"\"just a string\"",
	})
	void textSurvivesTreeAndBack(String json) {
		JsonNode tree = JsonNode.parse(json);
		String text = JsonTextWriter.writeToString(WriterSettings.DEFAULT, w -> w.writeToken(tree.createReader()));
		assertEquals(json, text);
		assertTrue(tree.deepEquals(JsonNode.parse(text)));
	}

	@Test
	void bigIntegerFidelity() {
		JsonTextReader reader = JsonTextReader.forString(BIG);
		reader.read();
		assertEquals(new BigInteger(BIG), reader.value());
		assertEquals(BIG, JsonTextWriter.writeToString(WriterSettings.DEFAULT, w -> w.writeValue(new BigInteger(BIG))));
		assertEquals(new BigInteger(BIG), JsonNode.parse(BIG).asBigInteger());
	}

	@Test
	void basicScenario() {
		JsonObject root = (JsonObject) JsonNode.parse("{\"name\":\"James\",\"hobbies\":[\"A\",\"B\"]}");
		assertEquals(2, root.children().size());
		JsonArray hobbies = assertInstanceOf(JsonArray.class, root.get("hobbies"));
		assertEquals(2, hobbies.size());
		JsonValue a = assertInstanceOf(JsonValue.class, hobbies.get(0));
		assertEquals(NodeType.STRING, a.type());
		assertEquals("A", a.asString());
		assertEquals("hobbies[0]", a.path());
	}

	@Test
	void endArrayWithNoArrayOpen() {
		TreeWriter writer = new TreeWriter();
		assertThrows(JsonWriterException.class, writer::writeEndArray);
		assertThrows(JsonWriterException.class, () -> JsonTextWriter.writeToString(WriterSettings.DEFAULT, w -> {
			w.writeStartObject();
			w.writeEndArray();
		}));
	}

	@Test
	void duplicatePropertyKeepsTheLastValue() {
		TreeWriter writer = new TreeWriter();
		writer.writeStartObject();
		writer.writePropertyName("x");
		writer.writeValue(1);
		writer.writePropertyName("x");
		writer.writeValue(2);
		writer.writeEndObject();
		JsonObject result = (JsonObject) writer.token();
		assertEquals(1, result.size());
		assertEquals(2, result.get("x").asInt());
	}

	@Test
	void danglingPropertyOnClose() {
		assertEquals("{\"propName\":null}", JsonTextWriter.writeToString(WriterSettings.DEFAULT, w -> {
			w.writeStartObject();
			w.writePropertyName("propName");
		}));
		TreeWriter writer = new TreeWriter();
		writer.writeStartObject();
		writer.writePropertyName("propName");
		writer.close();
		assertEquals("{\"propName\":null}", writer.token().toString(Formatting.NONE));
	}
}
