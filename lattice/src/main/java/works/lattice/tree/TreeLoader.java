package works.lattice.tree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.lattice.codec.JsonReader;
import works.lattice.codec.JsonToken;
import works.lattice.exceptions.JsonReaderException;
import works.lattice.tree.LoadSettings.CommentHandling;
import works.lattice.tree.LoadSettings.LineInfoHandling;

/**
 * Materializes trees from token streams.
 */
final class TreeLoader {
	private static final Logger LOGGER = LoggerFactory.getLogger(TreeLoader.class);

	private final JsonReader reader;
	private final LoadSettings settings;

	private TreeLoader(JsonReader reader, LoadSettings settings) {
		this.reader = reader;
		this.settings = settings;
	}

	/**
	 * Builds a node from the reader's current token, reading first if the reader hasn't started.
	 * Afterward, the reader is on the last token of the node.
	 */
	static JsonNode load(JsonReader reader, LoadSettings settings) {
		return new TreeLoader(reader, settings).loadNode();
	}

	private JsonNode loadNode() {
		if (reader.tokenType() == JsonToken.NONE && !reader.read()) {
			throw failure("Error reading node from JsonReader: no content");
		}
		if (settings.commentHandling() == CommentHandling.IGNORE) {
			while (reader.tokenType() == JsonToken.COMMENT) {
				if (!reader.read()) {
					throw failure("Error reading node from JsonReader: only comments were found");
				}
			}
		}
		JsonToken token = reader.tokenType();
		switch (token) {
			case START_OBJECT, START_ARRAY, START_CONSTRUCTOR -> {
				JsonContainer container = newContainer(token);
				annotate(container);
				readContent(container);
				return container;
			}
			case PROPERTY_NAME -> {
				JsonProperty property = new JsonProperty((String) reader.value());
				annotate(property);
				readContent(property);
				return property;
			}
			case END_OBJECT, END_ARRAY, END_CONSTRUCTOR, NONE ->
				throw failure("Error reading node from JsonReader. Unexpected token: " + token);
			default -> {
				JsonValue value = newValue(token);
				annotate(value);
				return value;
			}
		}
	}

	/**
	 * Reads the children of {@code container}, whose start token (or property name) the reader is on,
	 * through its end.
	 */
	private void readContent(JsonContainer container) {
		JsonContainer parent = container;
		do {
			if (parent instanceof JsonProperty p && p.value() != null) {
				if (parent == container) {
					return;
				}
				parent = parent.parent();
			}
			if (!reader.read()) {
				break;
			}
			JsonToken token = reader.tokenType();
			switch (token) {
				case START_OBJECT, START_ARRAY, START_CONSTRUCTOR -> {
					JsonContainer child = newContainer(token);
					annotate(child);
					parent.add(child);
					parent = child;
				}
				case END_OBJECT, END_ARRAY, END_CONSTRUCTOR -> {
					if (parent == container) {
						return;
					}
					parent = parent.parent();
				}
				case PROPERTY_NAME -> {
					JsonProperty property = readProperty((JsonObject) parent);
					if (property != null) {
						parent = property;
					} else {
						reader.skip();
					}
				}
				case COMMENT -> {
					if (settings.commentHandling() == CommentHandling.LOAD) {
						if (parent instanceof JsonObject || parent instanceof JsonProperty) {
							LOGGER.debug("Dropping comment inside object at '{}'", reader.path());
						} else {
							JsonValue comment = JsonValue.comment((String) reader.value());
							annotate(comment);
							parent.add(comment);
						}
					}
				}
				case NONE -> throw failure("Unexpected token " + token + " while loading tree");
				default -> {
					JsonValue value = newValue(token);
					annotate(value);
					parent.add(value);
				}
			}
		} while (true);
		throw failure("Unexpected end of content while loading " + container.type());
	}

	/**
	 * @return the new property, already attached to {@code object}, or null if it should be skipped
	 */
	private JsonProperty readProperty(JsonObject object) {
		String name = (String) reader.value();
		JsonProperty property = new JsonProperty(name);
		annotate(property);
		JsonProperty existing = object.property(name);
		if (existing == null) {
			object.add(property);
			return property;
		}
		return switch (settings.duplicatePropertyNameHandling()) {
			case REPLACE -> {
				existing.replace(property);
				yield property;
			}
			case IGNORE -> {
				LOGGER.debug("Ignoring duplicate property '{}'", reader.path());
				yield null;
			}
			case ERROR -> throw failure("Property with the name '" + name + "' already exists in the current JSON object");
		};
	}

	private JsonValue newValue(JsonToken token) {
		return switch (token) {
			case NULL -> JsonValue.nullValue();
			case UNDEFINED -> JsonValue.undefined();
			case COMMENT -> JsonValue.comment((String) reader.value());
			case RAW -> JsonValue.raw((String) reader.value());
			default -> JsonValue.fromObject(reader.value());
		};
	}

	private JsonContainer newContainer(JsonToken token) {
		return switch (token) {
			case START_OBJECT -> new JsonObject();
			case START_ARRAY -> new JsonArray();
			case START_CONSTRUCTOR -> new JsonConstructor((String) reader.value());
			default -> throw new IllegalStateException("Not a container start token: " + token);
		};
	}

	private void annotate(JsonNode node) {
		if (settings.lineInfoHandling() == LineInfoHandling.LOAD && reader.hasLineInfo()) {
			node.setLineInfo(reader.lineNumber(), reader.linePosition());
		}
	}

	private JsonReaderException failure(String message) {
		return JsonReaderException.create(reader, reader.path(), message);
	}
}
