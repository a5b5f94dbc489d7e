package works.lattice.tree;

import works.lattice.codec.ContainerType;
import works.lattice.codec.JsonWriter;

import static java.util.Objects.requireNonNull;

/**
 * A name-value pair inside a {@link JsonObject}.
 * The value is the property's one and only child.
 */
public final class JsonProperty extends JsonContainer {
	private final String name;

	/**
	 * @param value a node or scalar; null becomes a JSON {@code null}
	 */
	public JsonProperty(String name, Object value) {
		this(name);
		addInternal(0, value == null ? JsonValue.nullValue() : value);
	}

	/**
	 * A property with no value yet. Only for builders that supply the value next.
	 */
	JsonProperty(String name) {
		this.name = requireNonNull(name);
	}

	public String name() {
		return name;
	}

	/**
	 * @return the value, or null only while a builder has yet to supply it
	 */
	public JsonNode value() {
		return children.isEmpty() ? null : children.get(0);
	}

	/**
	 * Replaces the value. The old value is left detached.
	 *
	 * @param newValue a node or scalar; null becomes a JSON {@code null}
	 */
	public void value(Object newValue) {
		JsonNode node = (newValue instanceof JsonNode n) ? n : JsonValue.fromObject(newValue);
		if (children.isEmpty()) {
			insertItem(0, node);
		} else {
			set(0, node);
		}
	}

	@Override
	public NodeType type() {
		return NodeType.PROPERTY;
	}

	@Override
	ContainerType containerType() {
		return ContainerType.NONE;
	}

	@Override
	void validateChild(JsonNode item, JsonNode replacing) {
		super.validateChild(item, replacing);
		if (replacing == null && !children.isEmpty()) {
			throw new IllegalArgumentException("Property " + name + " already has a value");
		}
	}

	@Override
	void removeItemAt(int index) {
		throw new IllegalStateException("Cannot remove the value of property " + name + "; replace it instead");
	}

	@Override
	public JsonProperty deepClone() {
		return cloneInto(new JsonProperty(name));
	}

	@Override
	public boolean deepEquals(JsonNode other) {
		return other instanceof JsonProperty p
			&& name.equals(p.name)
			&& JsonNode.deepEquals(value(), p.value());
	}

	@Override
	public void writeTo(JsonWriter writer) {
		writer.writePropertyName(name);
		JsonNode value = value();
		if (value == null) {
			writer.writeNull();
		} else {
			value.writeTo(writer);
		}
	}
}
