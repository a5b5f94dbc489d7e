package works.lattice.tree;

import java.io.StringReader;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import works.lattice.codec.Formatting;
import works.lattice.codec.JsonPosition;
import works.lattice.codec.JsonReader;
import works.lattice.codec.JsonWriter;
import works.lattice.codec.LineInfo;
import works.lattice.codec.WriterSettings;
import works.lattice.codec.io.JsonTextReader;
import works.lattice.codec.io.JsonTextWriter;
import works.lattice.exceptions.DetachedNodeException;
import works.lattice.exceptions.JsonConversionException;

/**
 * A node in a mutable JSON document tree.
 * <p>
 * Every node has at most one parent. Adding a node that already has a parent
 * to some other container adds a deep clone instead, so a node never appears
 * in two places at once.
 * <p>
 * Trees are not thread-safe. Callers must ensure that a subtree
 * is not read while another thread is modifying it.
 */
public sealed abstract class JsonNode implements LineInfo permits JsonContainer, JsonValue {
	JsonContainer parent;
	JsonNode previous;
	JsonNode next;
	private int lineNumber = 0;
	private int linePosition = 0;

	JsonNode() { }

	public abstract NodeType type();

	/**
	 * @return the container holding this node, or null if this is a root
	 */
	public JsonContainer parent() {
		return parent;
	}

	/**
	 * @return the next sibling, or null if this is the last child or has no parent
	 */
	public JsonNode next() {
		return next;
	}

	public JsonNode previous() {
		return previous;
	}

	public JsonNode root() {
		JsonNode result = this;
		while (result.parent != null) {
			result = result.parent;
		}
		return result;
	}

	/**
	 * @return true if this node has any children
	 */
	public boolean hasValues() {
		return false;
	}

	public List<JsonNode> children() {
		return List.of();
	}

	public JsonNode first() {
		return null;
	}

	public JsonNode last() {
		return null;
	}

	/**
	 * @return the ancestors of this node, nearest first
	 */
	public List<JsonContainer> ancestors() {
		List<JsonContainer> result = new ArrayList<>();
		for (JsonContainer p = parent; p != null; p = p.parent) {
			result.add(p);
		}
		return result;
	}

	public List<JsonNode> ancestorsAndSelf() {
		List<JsonNode> result = new ArrayList<>();
		result.add(this);
		result.addAll(ancestors());
		return result;
	}

	/**
	 * @return the siblings after this node, in document order
	 */
	public List<JsonNode> afterSelf() {
		List<JsonNode> result = new ArrayList<>();
		for (JsonNode n = next; n != null; n = n.next) {
			result.add(n);
		}
		return result;
	}

	/**
	 * @return the siblings before this node, in document order
	 */
	public List<JsonNode> beforeSelf() {
		List<JsonNode> result = new ArrayList<>();
		for (JsonNode n = previous; n != null; n = n.previous) {
			result.add(n);
		}
		Collections.reverse(result);
		return result;
	}

	/**
	 * @param content a node, an {@link Iterable} or array of contents, or a scalar value
	 * @throws DetachedNodeException if this node has no parent
	 */
	public void addAfterSelf(Object content) {
		JsonContainer p = requireParent();
		p.addInternal(p.indexOf(this) + 1, content);
	}

	/**
	 * @throws DetachedNodeException if this node has no parent
	 */
	public void addBeforeSelf(Object content) {
		JsonContainer p = requireParent();
		p.addInternal(p.indexOf(this), content);
	}

	/**
	 * Detaches this node from its parent.
	 *
	 * @throws DetachedNodeException if this node has no parent
	 */
	public void remove() {
		requireParent().removeItemAt(parent.indexOf(this));
	}

	/**
	 * Puts {@code replacement} where this node was. This node is left detached.
	 *
	 * @throws DetachedNodeException if this node has no parent
	 */
	public void replace(JsonNode replacement) {
		JsonContainer p = requireParent();
		p.set(p.indexOf(this), replacement);
	}

	private JsonContainer requireParent() {
		if (parent == null) {
			throw new DetachedNodeException("The parent is missing.");
		}
		return parent;
	}

	/**
	 * @return the location of this node relative to its root, like {@code a[1].b}.
	 * The root's path is the empty string.
	 */
	public String path() {
		List<JsonNode> chain = ancestorsAndSelf();
		Collections.reverse(chain);
		List<JsonPosition> positions = new ArrayList<>();
		for (int i = 0; i < chain.size(); i++) {
			JsonNode node = chain.get(i);
			JsonNode child = (i + 1 < chain.size()) ? chain.get(i + 1) : null;
			if (node instanceof JsonProperty p) {
				positions.add(JsonPosition.forProperty(p.name()));
			} else if (child != null && (node instanceof JsonArray || node instanceof JsonConstructor)) {
				JsonContainer c = (JsonContainer) node;
				positions.add(JsonPosition.forIndex(c.containerType(), c.indexOf(child)));
			}
		}
		return JsonPosition.buildPath(positions);
	}

	/**
	 * @return a copy of this node and all its descendants, with no parent
	 */
	public abstract JsonNode deepClone();

	/**
	 * Objects compare equal if they have the same property names with equal values,
	 * regardless of order. Numbers compare by magnitude, so {@code 1} equals {@code 1.0}.
	 */
	public abstract boolean deepEquals(JsonNode other);

	public static boolean deepEquals(JsonNode a, JsonNode b) {
		if (a == b) {
			return true;
		} else if (a == null || b == null) {
			return false;
		} else {
			return a.deepEquals(b);
		}
	}

	public abstract void writeTo(JsonWriter writer);

	/**
	 * @return this node as indented JSON text
	 */
	@Override
	public String toString() {
		return toString(Formatting.INDENTED);
	}

	public String toString(Formatting formatting) {
		return JsonTextWriter.writeToString(WriterSettings.builder().formatting(formatting).build(), this::writeTo);
	}

	/**
	 * @return a reader that yields the tokens of this node and its descendants
	 */
	public TreeReader createReader() {
		return new TreeReader(this);
	}

	//
	// Line info
	//

	@Override
	public boolean hasLineInfo() {
		return lineNumber > 0;
	}

	@Override
	public int lineNumber() {
		return lineNumber;
	}

	@Override
	public int linePosition() {
		return linePosition;
	}

	void setLineInfo(int lineNumber, int linePosition) {
		this.lineNumber = lineNumber;
		this.linePosition = linePosition;
	}

	void copyLineInfoFrom(JsonNode other) {
		this.lineNumber = other.lineNumber;
		this.linePosition = other.linePosition;
	}

	//
	// Conversions
	//

	/**
	 * Converts this node's value to {@code target}.
	 * A property converts its value.
	 *
	 * @return null if the value is {@code null} or {@code undefined}
	 * @throws JsonConversionException if this kind of node can't be converted to {@code target},
	 * or the value doesn't fit
	 */
	public <T> T as(Class<T> target) {
		return ValueConversions.convert(this, target);
	}

	public int asInt() {
		return requireNonNullValue(as(Integer.class), "int");
	}

	public long asLong() {
		return requireNonNullValue(as(Long.class), "long");
	}

	public double asDouble() {
		return requireNonNullValue(as(Double.class), "double");
	}

	public boolean asBoolean() {
		return requireNonNullValue(as(Boolean.class), "boolean");
	}

	public char asChar() {
		return requireNonNullValue(as(Character.class), "char");
	}

	public String asString() {
		return as(String.class);
	}

	public BigInteger asBigInteger() {
		return as(BigInteger.class);
	}

	public BigDecimal asBigDecimal() {
		return as(BigDecimal.class);
	}

	public UUID asUuid() {
		return as(UUID.class);
	}

	public URI asUri() {
		return as(URI.class);
	}

	public Duration asDuration() {
		return as(Duration.class);
	}

	public OffsetDateTime asOffsetDateTime() {
		return as(OffsetDateTime.class);
	}

	public LocalDateTime asLocalDateTime() {
		return as(LocalDateTime.class);
	}

	public byte[] asBytes() {
		return as(byte[].class);
	}

	private <T> T requireNonNullValue(T value, String targetName) {
		if (value == null) {
			throw ValueConversions.failure(this, "Cannot convert null to " + targetName, null);
		}
		return value;
	}

	//
	// Loading
	//

	/**
	 * @throws works.lattice.exceptions.JsonReaderException if {@code json} is not valid,
	 * or has anything but comments after the first value
	 */
	public static JsonNode parse(String json) {
		return parse(json, LoadSettings.DEFAULT);
	}

	public static JsonNode parse(String json, LoadSettings settings) {
		try (JsonTextReader reader = new JsonTextReader(new StringReader(json))) {
			JsonNode result = TreeLoader.load(reader, settings);
			while (reader.read()) {
				// Only trailing comments can appear here; the reader rejects anything else
			}
			return result;
		}
	}

	/**
	 * Builds a node from the reader's current token, reading first if the reader hasn't started.
	 * Afterward, the reader is on the last token of the node.
	 */
	public static JsonNode readFrom(JsonReader reader) {
		return readFrom(reader, LoadSettings.DEFAULT);
	}

	public static JsonNode readFrom(JsonReader reader, LoadSettings settings) {
		return TreeLoader.load(reader, settings);
	}
}
