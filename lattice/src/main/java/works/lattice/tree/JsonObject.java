package works.lattice.tree;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import works.lattice.codec.ContainerType;
import works.lattice.codec.JsonWriter;

/**
 * An ordered collection of uniquely named {@link JsonProperty properties}.
 */
public final class JsonObject extends JsonContainer {
	private final Map<String, JsonProperty> propertiesByName = new HashMap<>();

	public JsonObject() { }

	/**
	 * @param content {@link JsonProperty properties}, added as by {@link #add}
	 */
	public JsonObject(Object... content) {
		for (Object c : content) {
			add(c);
		}
	}

	@Override
	public NodeType type() {
		return NodeType.OBJECT;
	}

	@Override
	ContainerType containerType() {
		return ContainerType.OBJECT;
	}

	/**
	 * @return the value of the named property, or null if there is no such property
	 */
	public JsonNode get(String name) {
		JsonProperty p = propertiesByName.get(name);
		return p == null ? null : p.value();
	}

	public JsonProperty property(String name) {
		return propertiesByName.get(name);
	}

	public boolean containsKey(String name) {
		return propertiesByName.containsKey(name);
	}

	/**
	 * Sets the value of the named property, replacing the value in place
	 * if the property exists, or adding the property at the end otherwise.
	 *
	 * @return this
	 */
	public JsonObject put(String name, Object value) {
		JsonProperty existing = propertiesByName.get(name);
		if (existing == null) {
			add(new JsonProperty(name, value));
		} else {
			existing.value(value);
		}
		return this;
	}

	/**
	 * @return true if there was a property to remove
	 */
	public boolean remove(String name) {
		JsonProperty existing = propertiesByName.get(name);
		if (existing == null) {
			return false;
		}
		existing.remove();
		return true;
	}

	/**
	 * @return the property names in document order
	 */
	public List<String> propertyNames() {
		List<String> result = new ArrayList<>(children.size());
		for (JsonNode child : children) {
			result.add(((JsonProperty) child).name());
		}
		return result;
	}

	/**
	 * @return the properties in document order
	 */
	public List<JsonProperty> properties() {
		List<JsonProperty> result = new ArrayList<>(children.size());
		for (JsonNode child : children) {
			result.add((JsonProperty) child);
		}
		return result;
	}

	@Override
	void validateChild(JsonNode item, JsonNode replacing) {
		if (!(item instanceof JsonProperty p)) {
			throw new IllegalArgumentException("Can not add " + item.type() + " to OBJECT");
		}
		JsonProperty existing = propertiesByName.get(p.name());
		if (existing != null && existing != replacing) {
			throw new IllegalArgumentException("Can not add property " + p.name()
				+ " to OBJECT. Property with the same name already exists on object");
		}
	}

	@Override
	void childAdded(JsonNode child) {
		JsonProperty p = (JsonProperty) child;
		propertiesByName.put(p.name(), p);
	}

	@Override
	void childRemoved(JsonNode child) {
		JsonProperty p = (JsonProperty) child;
		propertiesByName.remove(p.name(), p);
	}

	@Override
	public JsonObject deepClone() {
		return cloneInto(new JsonObject());
	}

	@Override
	public boolean deepEquals(JsonNode other) {
		if (!(other instanceof JsonObject o) || o.children.size() != children.size()) {
			return false;
		}
		for (Map.Entry<String, JsonProperty> entry : propertiesByName.entrySet()) {
			JsonProperty theirs = o.propertiesByName.get(entry.getKey());
			if (theirs == null || !JsonNode.deepEquals(entry.getValue().value(), theirs.value())) {
				return false;
			}
		}
		return true;
	}

	@Override
	public void writeTo(JsonWriter writer) {
		writer.writeStartObject();
		for (JsonNode child : children) {
			child.writeTo(writer);
		}
		writer.writeEndObject();
	}
}
