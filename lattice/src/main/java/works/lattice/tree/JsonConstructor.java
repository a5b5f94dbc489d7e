package works.lattice.tree;

import works.lattice.codec.ContainerType;
import works.lattice.codec.JsonWriter;

import static java.util.Objects.requireNonNull;

/**
 * A {@code new Name(args...)} expression. The arguments are the children.
 */
public final class JsonConstructor extends JsonContainer {
	private String name;

	public JsonConstructor(String name) {
		this.name = requireNonNull(name);
	}

	public JsonConstructor(String name, Object... content) {
		this(name);
		for (Object c : content) {
			add(c);
		}
	}

	public String name() {
		return name;
	}

	public void name(String newName) {
		this.name = requireNonNull(newName);
	}

	@Override
	public NodeType type() {
		return NodeType.CONSTRUCTOR;
	}

	@Override
	ContainerType containerType() {
		return ContainerType.CONSTRUCTOR;
	}

	@Override
	public JsonConstructor deepClone() {
		return cloneInto(new JsonConstructor(name));
	}

	@Override
	public boolean deepEquals(JsonNode other) {
		return other instanceof JsonConstructor c
			&& name.equals(c.name)
			&& childrenEqual(c);
	}

	@Override
	public void writeTo(JsonWriter writer) {
		writer.writeStartConstructor(name);
		for (JsonNode child : children) {
			child.writeTo(writer);
		}
		writer.writeEndConstructor();
	}
}
