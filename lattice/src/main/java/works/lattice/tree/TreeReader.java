package works.lattice.tree;

import works.lattice.codec.JsonReader;
import works.lattice.codec.JsonToken;
import works.lattice.codec.ReaderSettings;

import static java.util.Objects.requireNonNull;

/**
 * A {@link JsonReader} that walks a tree depth-first, yielding the same tokens
 * that parsing the tree's JSON text would yield.
 * <p>
 * {@link NodeType#GUID GUID}, {@link NodeType#URI URI}, and {@link NodeType#TIMESPAN TIMESPAN}
 * values are reported as {@link JsonToken#STRING} tokens whose {@link #value()}
 * is the original Java object, so copying them into a {@link TreeWriter} preserves their type.
 */
public final class TreeReader extends JsonReader {
	private final JsonNode root;
	private JsonNode current;

	/**
	 * The container whose children we are currently visiting, or whose end token was just reported.
	 */
	private JsonNode parent;
	private boolean started = false;

	public TreeReader(JsonNode root) {
		this(root, ReaderSettings.DEFAULT);
	}

	public TreeReader(JsonNode root, ReaderSettings settings) {
		super(settings);
		this.root = requireNonNull(root);
	}

	/**
	 * @return the node for the current token; for an end token, the container being ended
	 */
	public JsonNode currentNode() {
		return current;
	}

	@Override
	public boolean hasLineInfo() {
		return current != null && current.hasLineInfo();
	}

	@Override
	public int lineNumber() {
		return current == null ? 0 : current.lineNumber();
	}

	@Override
	public int linePosition() {
		return current == null ? 0 : current.linePosition();
	}

	@Override
	public boolean read() {
		if (!started) {
			started = true;
			current = root;
			setTokenFor(root);
			return true;
		}
		if (current == null) {
			return false;
		}
		if (current instanceof JsonContainer container && parent != container) {
			return readInto(container);
		}
		return readOver(current);
	}

	private boolean readInto(JsonContainer container) {
		JsonNode firstChild = container.first();
		if (firstChild == null) {
			return setEnd(container);
		}
		current = firstChild;
		parent = container;
		setTokenFor(firstChild);
		return true;
	}

	private boolean readOver(JsonNode node) {
		if (node == root) {
			return readToEnd();
		}
		JsonNode next = node.next();
		if (next == null) {
			return setEnd(node.parent());
		}
		current = next;
		setTokenFor(next);
		return true;
	}

	private boolean readToEnd() {
		current = null;
		setToken(JsonToken.NONE, null);
		return false;
	}

	/**
	 * Properties have no end token, so we move straight past them.
	 */
	private boolean setEnd(JsonContainer container) {
		current = container;
		parent = container;
		if (container instanceof JsonProperty) {
			return readOver(container);
		}
		setToken(container.containerType().endToken(), null);
		return true;
	}

	private void setTokenFor(JsonNode node) {
		if (node instanceof JsonObject) {
			setToken(JsonToken.START_OBJECT, null);
		} else if (node instanceof JsonArray) {
			setToken(JsonToken.START_ARRAY, null);
		} else if (node instanceof JsonConstructor c) {
			setToken(JsonToken.START_CONSTRUCTOR, c.name());
		} else if (node instanceof JsonProperty p) {
			setToken(JsonToken.PROPERTY_NAME, p.name());
		} else {
			JsonValue v = (JsonValue) node;
			switch (v.type()) {
				case COMMENT -> setToken(JsonToken.COMMENT, v.value());
				case INTEGER -> setToken(JsonToken.INTEGER, v.value());
				case FLOAT -> setToken(JsonToken.FLOAT, v.value());
				case STRING, GUID, URI, TIMESPAN -> setToken(JsonToken.STRING, v.value());
				case BOOLEAN -> setToken(JsonToken.BOOLEAN, v.value());
				case NULL -> setToken(JsonToken.NULL, null);
				case UNDEFINED -> setToken(JsonToken.UNDEFINED, null);
				case DATE -> setToken(JsonToken.DATE, v.value());
				case RAW -> setToken(JsonToken.RAW, v.value());
				case BYTES -> setToken(JsonToken.BYTES, v.value());
				default -> throw new IllegalStateException("Unexpected value type " + v.type());
			}
		}
	}
}
