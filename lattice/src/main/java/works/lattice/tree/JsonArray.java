package works.lattice.tree;

import works.lattice.codec.ContainerType;
import works.lattice.codec.JsonWriter;

public final class JsonArray extends JsonContainer {
	public JsonArray() { }

	/**
	 * @param content added as by {@link #add}, one element at a time
	 */
	public JsonArray(Object... content) {
		for (Object c : content) {
			add(c);
		}
	}

	@Override
	public NodeType type() {
		return NodeType.ARRAY;
	}

	@Override
	ContainerType containerType() {
		return ContainerType.ARRAY;
	}

	@Override
	public JsonArray deepClone() {
		return cloneInto(new JsonArray());
	}

	@Override
	public boolean deepEquals(JsonNode other) {
		return other instanceof JsonArray a && childrenEqual(a);
	}

	@Override
	public void writeTo(JsonWriter writer) {
		writer.writeStartArray();
		for (JsonNode child : children) {
			child.writeTo(writer);
		}
		writer.writeEndArray();
	}
}
