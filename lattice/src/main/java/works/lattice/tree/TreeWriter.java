package works.lattice.tree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.lattice.codec.ContainerType;
import works.lattice.codec.JsonReader;
import works.lattice.codec.JsonToken;
import works.lattice.codec.JsonWriter;
import works.lattice.codec.WriterSettings;

import static java.util.Objects.requireNonNull;

/**
 * A {@link JsonWriter} that builds a tree instead of text.
 * <p>
 * Writing a property name that already exists on the current object
 * replaces the earlier property: the old one is removed and the new one
 * is appended, so the last write wins.
 * Comments written directly inside an object are discarded,
 * since objects can only contain properties.
 */
public final class TreeWriter extends JsonWriter {
	private static final Logger LOGGER = LoggerFactory.getLogger(TreeWriter.class);

	private JsonContainer root;
	private JsonContainer parent;
	private JsonValue value;
	private JsonNode current;

	public TreeWriter() {
		super(WriterSettings.DEFAULT);
	}

	/**
	 * Appends everything written to {@code container}.
	 * Any number of values may be written, each becoming a new child.
	 */
	public TreeWriter(JsonContainer container) {
		super(WriterSettings.builder().supportMultipleContent(true).build());
		this.root = requireNonNull(container);
		this.parent = container;
	}

	/**
	 * @return the tree built so far: the root container, or the single value written,
	 * or null if nothing has been written
	 */
	public JsonNode token() {
		return (root != null) ? root : value;
	}

	/**
	 * @return the node most recently added or completed
	 */
	public JsonNode currentNode() {
		return current;
	}

	@Override
	public void flush() {
	}

	/**
	 * When copying from a {@link TreeReader} positioned on a container,
	 * the container is cloned directly instead of being replayed token by token.
	 */
	@Override
	public void writeToken(JsonReader reader, boolean writeChildren, boolean writeDateConstructorAsDate, boolean writeComments) {
		if (writeChildren && writeDateConstructorAsDate && writeComments
			&& reader instanceof TreeReader treeReader
			&& treeReader.currentNode() instanceof JsonContainer container
			&& !(container instanceof JsonProperty)
			&& reader.tokenType().isStartToken()) {
			recordValue();
			addValue(container.deepClone());
			reader.skip();
			return;
		}
		super.writeToken(reader, writeChildren, writeDateConstructorAsDate, writeComments);
	}

	@Override
	protected void emitStart(ContainerType type, String constructorName) {
		JsonContainer container = switch (type) {
			case OBJECT -> new JsonObject();
			case ARRAY -> new JsonArray();
			case CONSTRUCTOR -> new JsonConstructor(constructorName);
			case NONE -> throw new IllegalArgumentException("Can't start " + type);
		};
		addParent(container);
	}

	@Override
	protected void emitEnd(ContainerType type) {
		current = parent;
		parent = parent.parent();
		if (parent instanceof JsonProperty) {
			parent = parent.parent();
		}
	}

	@Override
	protected void emitPropertyName(String name) {
		if (parent instanceof JsonObject object) {
			JsonProperty existing = object.property(name);
			if (existing != null) {
				LOGGER.debug("Replacing duplicate property '{}' at '{}'", name, path());
				existing.remove();
			}
		}
		addParent(new JsonProperty(name));
	}

	@Override
	protected void emitValue(JsonToken token, Object v) {
		switch (token) {
			case NULL -> addValue(JsonValue.nullValue());
			case UNDEFINED -> addValue(JsonValue.undefined());
			default -> addValue(JsonValue.fromObject(v));
		}
	}

	@Override
	protected void emitComment(String text) {
		if (parent instanceof JsonObject || parent instanceof JsonProperty) {
			LOGGER.debug("Discarding comment at '{}': objects can only contain properties", path());
		} else {
			addValue(JsonValue.comment(text));
		}
	}

	@Override
	protected void emitRaw(String json, boolean asValue) {
		if (parent instanceof JsonObject || (parent instanceof JsonProperty && !asValue)) {
			LOGGER.debug("Discarding raw text at '{}': objects can only contain properties", path());
		} else {
			addValue(JsonValue.raw(json));
		}
	}

	private void addParent(JsonContainer container) {
		if (parent == null) {
			root = container;
		} else {
			parent.add(container);
		}
		parent = container;
		current = container;
	}

	private void addValue(JsonNode node) {
		if (parent == null) {
			// A leading comment only holds the place of the result until a real value arrives
			if (root == null && node instanceof JsonValue v && (value == null || value.type() == NodeType.COMMENT)) {
				value = v;
			} else if (root == null && node instanceof JsonContainer c) {
				root = c;
			}
			current = node;
		} else {
			parent.add(node);
			current = parent.last();
			if (parent instanceof JsonProperty) {
				parent = parent.parent();
			}
		}
	}
}
