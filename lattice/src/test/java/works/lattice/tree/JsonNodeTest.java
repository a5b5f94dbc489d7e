package works.lattice.tree;

import java.util.List;
import org.junit.jupiter.api.Test;
import works.lattice.codec.Formatting;
import works.lattice.exceptions.DetachedNodeException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonNodeTest {

	@Test
	void navigation() {
		JsonObject root = (JsonObject) JsonNode.parse("{\"a\":[1,{\"b\":2}],\"c\":\"x\"}");
		JsonArray a = (JsonArray) root.get("a");
		JsonObject inner = (JsonObject) a.get(1);
		JsonNode b = inner.get("b");

		assertEquals(2, b.asInt());
		assertSame(inner.property("b"), b.parent());
		assertSame(root, b.root());
		assertEquals(List.of(inner.property("b"), inner, a, root.property("a"), root), b.ancestors());
		assertSame(a.get(0), inner.previous());
		assertNull(inner.next());
		assertEquals(List.of(root.property("c")), root.property("a").afterSelf());
		assertEquals(List.of(root.property("a")), root.property("c").beforeSelf());
		assertEquals(List.of("a", "c"), root.propertyNames());
		assertEquals(8, root.descendants().size());
		assertTrue(root.hasValues());
		assertFalse(b.hasValues());
	}

	@Test
	void path() {
		JsonObject root = (JsonObject) JsonNode.parse("{\"a\":[1,{\"b\":2}],\"odd.name\":[[true]]}");
		JsonObject inner = (JsonObject) ((JsonArray) root.get("a")).get(1);
		assertEquals("", root.path());
		assertEquals("a", root.get("a").path());
		assertEquals("a[1].b", inner.get("b").path());
		assertEquals("a[1].b", inner.property("b").path());
		JsonArray odd = (JsonArray) root.get("odd.name");
		assertEquals("['odd.name'][0][0]", ((JsonArray) odd.get(0)).get(0).path());
	}

	@Test
	void deepCloneIsIndependent() {
		JsonNode original = JsonNode.parse("{\"a\":[1,{\"b\":2}]}");
		JsonObject clone = (JsonObject) original.deepClone();
		assertNotSame(original, clone);
		assertTrue(original.deepEquals(clone));
		clone.put("c", 3);
		assertFalse(original.deepEquals(clone));
		assertNull(((JsonObject) original).get("c"));
	}

	@Test
	void objectEqualityIgnoresOrder() {
		assertTrue(JsonNode.deepEquals(JsonNode.parse("{\"x\":1,\"y\":[2]}"), JsonNode.parse("{\"y\":[2.0],\"x\":1.0}")));
		assertFalse(JsonNode.deepEquals(JsonNode.parse("{\"x\":1}"), JsonNode.parse("{\"x\":1,\"y\":2}")));
		assertFalse(JsonNode.deepEquals(JsonNode.parse("{\"x\":1}"), JsonNode.parse("{\"z\":1}")));
	}

	@Test
	void arrayEqualityRespectsOrder() {
		assertTrue(JsonNode.deepEquals(JsonNode.parse("[1,2]"), new JsonArray(1, 2)));
		assertFalse(JsonNode.deepEquals(JsonNode.parse("[1,2]"), JsonNode.parse("[2,1]")));
		assertFalse(JsonNode.deepEquals(JsonNode.parse("[1]"), JsonNode.parse("{}")));
	}

	@Test
	void valueEquality() {
		assertTrue(JsonValue.of(1).deepEquals(JsonValue.of(1.0)));
		assertFalse(JsonValue.of(1).deepEquals(JsonValue.of("1")));
		assertTrue(JsonValue.of(new byte[]{1, 2}).deepEquals(JsonValue.of(new byte[]{1, 2})));
		assertTrue(JsonValue.nullValue().deepEquals(JsonValue.nullValue()));
		assertFalse(JsonValue.nullValue().deepEquals(JsonValue.undefined()));
		assertTrue(JsonNode.deepEquals(null, null));
		assertFalse(JsonNode.deepEquals(JsonValue.nullValue(), null));
	}

	@Test
	void addingAnAttachedNodeAddsAClone() {
		JsonArray source = new JsonArray(1, 2);
		JsonArray target = new JsonArray();
		JsonNode first = source.get(0);
		target.add(first);
		assertNotSame(first, target.get(0));
		assertSame(source, first.parent());
		assertSame(target, target.get(0).parent());
		assertEquals(2, source.size());
	}

	@Test
	void addingAContainerToItselfAddsAClone() {
		JsonArray array = new JsonArray(1);
		array.add(array);
		assertEquals(2, array.size());
		assertNotSame(array, array.get(1));
		assertTrue(new JsonArray(1).deepEquals(array.get(1)));
	}

	@Test
	void iterablesAreFlattened() {
		JsonArray array = new JsonArray(List.of(1, 2), 3);
		assertTrue(JsonNode.parse("[1,2,3]").deepEquals(array));
		array.insert(1, List.of("a", "b"));
		assertTrue(JsonNode.parse("[1,\"a\",\"b\",2,3]").deepEquals(array));
	}

	@Test
	void siblingMutation() {
		JsonArray array = new JsonArray(1, 3);
		array.get(0).addAfterSelf(2);
		array.get(0).addBeforeSelf(0);
		array.addFirst(-1);
		assertTrue(JsonNode.parse("[-1,0,1,2,3]").deepEquals(array));
		JsonNode two = array.get(3);
		two.remove();
		assertNull(two.parent());
		assertNull(two.next());
		assertSame(array.get(3), array.get(2).next());
		array.get(0).replace(JsonValue.of("x"));
		assertTrue(JsonNode.parse("[\"x\",0,1,3]").deepEquals(array));
		array.set(1, JsonValue.of(true));
		assertTrue(JsonNode.parse("[\"x\",true,1,3]").deepEquals(array));
	}

	@Test
	void detachedNodes() {
		JsonValue orphan = JsonValue.of(1);
		DetachedNodeException e = assertThrows(DetachedNodeException.class, orphan::remove);
		assertEquals("The parent is missing.", e.getMessage());
		assertThrows(DetachedNodeException.class, () -> orphan.addAfterSelf(2));
		assertThrows(DetachedNodeException.class, () -> orphan.addBeforeSelf(2));
		assertThrows(DetachedNodeException.class, () -> orphan.replace(JsonValue.of(3)));
	}

	@Test
	void objectsHoldOnlyUniquelyNamedProperties() {
		JsonObject object = new JsonObject(new JsonProperty("x", 1));
		assertThrows(IllegalArgumentException.class, () -> object.add(new JsonProperty("x", 2)));
		assertThrows(IllegalArgumentException.class, () -> object.add(5));
		assertThrows(IllegalArgumentException.class, () -> new JsonArray().add(new JsonProperty("x", 2)));
	}

	@Test
	void objectOperations() {
		JsonObject object = new JsonObject();
		object.put("a", 1).put("b", "two").put("a", 3);
		assertEquals(List.of("a", "b"), object.propertyNames());
		assertEquals(3, object.get("a").asInt());
		assertTrue(object.containsKey("b"));
		assertTrue(object.remove("b"));
		assertFalse(object.remove("b"));
		assertFalse(object.containsKey("b"));
		object.add(new JsonProperty("b", new JsonArray()));
		assertEquals(List.of("a", "b"), object.propertyNames());
		object.property("a").replace(new JsonProperty("c", null));
		assertEquals(List.of("c", "b"), object.propertyNames());
		assertFalse(object.containsKey("a"));
		assertEquals(NodeType.NULL, object.get("c").type());
	}

	@Test
	void propertyValueCanBeReplacedButNotRemoved() {
		JsonProperty property = new JsonProperty("p", 1);
		property.value("x");
		assertEquals("x", property.value().asString());
		assertThrows(IllegalStateException.class, () -> property.value().remove());
		assertThrows(IllegalArgumentException.class, () -> property.add(2));
	}

	@Test
	void removeAllAndReplaceAll() {
		JsonArray array = new JsonArray(1, 2, 3);
		JsonNode first = array.get(0);
		array.replaceAll(List.of("a"));
		assertNull(first.parent());
		assertTrue(new JsonArray("a").deepEquals(array));
		array.removeAll();
		assertEquals(0, array.size());
		assertNull(array.first());
	}

	@Test
	void constructors() {
		JsonConstructor c = (JsonConstructor) JsonNode.parse("new Foo(1, \"x\")");
		assertEquals("Foo", c.name());
		assertEquals(2, c.size());
		assertEquals("[1]", c.get(1).path());
		assertEquals("new Foo(1,\"x\")", c.toString(Formatting.NONE));
		assertFalse(c.deepEquals(new JsonConstructor("Bar", 1, "x")));
		assertTrue(c.deepEquals(new JsonConstructor("Foo", 1, "x")));
	}

	@Test
	void toStringIsIndented() {
		JsonObject object = new JsonObject(new JsonProperty("a", new JsonArray(1)));
		assertEquals("{\n  \"a\": [\n    1\n  ]\n}", object.toString());
		assertEquals("{\"a\":[1]}", object.toString(Formatting.NONE));
	}
}
