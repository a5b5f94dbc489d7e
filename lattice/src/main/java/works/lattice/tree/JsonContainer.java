package works.lattice.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import works.lattice.codec.ContainerType;

/**
 * A node with an ordered list of children.
 * <p>
 * Methods that take {@code Object content} accept a {@link JsonNode},
 * an {@link Iterable} or array whose elements are each added in turn,
 * or a scalar value that is wrapped in a {@link JsonValue}.
 * A node that already has a parent is cloned before being added.
 */
public sealed abstract class JsonContainer extends JsonNode permits JsonObject, JsonArray, JsonConstructor, JsonProperty {
	final List<JsonNode> children = new ArrayList<>();

	JsonContainer() { }

	abstract ContainerType containerType();

	@Override
	public boolean hasValues() {
		return !children.isEmpty();
	}

	@Override
	public List<JsonNode> children() {
		return Collections.unmodifiableList(children);
	}

	@Override
	public JsonNode first() {
		return children.isEmpty() ? null : children.get(0);
	}

	@Override
	public JsonNode last() {
		return children.isEmpty() ? null : children.get(children.size() - 1);
	}

	public int size() {
		return children.size();
	}

	public JsonNode get(int index) {
		return children.get(index);
	}

	/**
	 * @return the index of {@code child} (compared by identity), or -1 if it is not a child of this container
	 */
	public int indexOf(JsonNode child) {
		if (child == null || child.parent != this) {
			return -1;
		}
		for (int i = 0; i < children.size(); i++) {
			if (children.get(i) == child) {
				return i;
			}
		}
		return -1;
	}

	public void add(Object content) {
		addInternal(children.size(), content);
	}

	public void addFirst(Object content) {
		addInternal(0, content);
	}

	public void insert(int index, Object content) {
		if (index < 0 || index > children.size()) {
			throw new IndexOutOfBoundsException("Index " + index + " out of bounds for size " + children.size());
		}
		addInternal(index, content);
	}

	/**
	 * Replaces the child at {@code index}. The old child is left detached.
	 */
	public void set(int index, JsonNode replacement) {
		JsonNode existing = children.get(index);
		if (existing == replacement) {
			return;
		}
		JsonNode item = ensureParentless(replacement == null ? JsonValue.nullValue() : replacement);
		validateChild(item, existing);
		children.set(index, item);
		item.parent = this;
		item.previous = existing.previous;
		item.next = existing.next;
		if (item.previous != null) {
			item.previous.next = item;
		}
		if (item.next != null) {
			item.next.previous = item;
		}
		detach(existing);
		childRemoved(existing);
		childAdded(item);
	}

	/**
	 * Removes every child.
	 */
	public void removeAll() {
		while (!children.isEmpty()) {
			removeItemAt(children.size() - 1);
		}
	}

	/**
	 * Removes every child, then adds {@code content}.
	 */
	public void replaceAll(Object content) {
		removeAll();
		add(content);
	}

	/**
	 * @return all descendants in document order
	 */
	public List<JsonNode> descendants() {
		List<JsonNode> result = new ArrayList<>();
		collectDescendants(result);
		return result;
	}

	public List<JsonNode> descendantsAndSelf() {
		List<JsonNode> result = new ArrayList<>();
		result.add(this);
		collectDescendants(result);
		return result;
	}

	private void collectDescendants(List<JsonNode> result) {
		for (JsonNode child : children) {
			result.add(child);
			if (child instanceof JsonContainer c) {
				c.collectDescendants(result);
			}
		}
	}

	//
	// Child management
	//

	void addInternal(int index, Object content) {
		if (content instanceof JsonNode node) {
			insertItem(index, node);
		} else if (content instanceof Iterable<?> iterable) {
			int i = index;
			for (Object element : iterable) {
				int sizeBefore = children.size();
				addInternal(i, element);
				i += children.size() - sizeBefore;
			}
		} else if (content instanceof Object[] array) {
			int i = index;
			for (Object element : array) {
				int sizeBefore = children.size();
				addInternal(i, element);
				i += children.size() - sizeBefore;
			}
		} else {
			insertItem(index, JsonValue.fromObject(content));
		}
	}

	void insertItem(int index, JsonNode node) {
		JsonNode item = ensureParentless(node);
		validateChild(item, null);
		JsonNode before = (index == 0) ? null : children.get(index - 1);
		JsonNode after = (index == children.size()) ? null : children.get(index);
		children.add(index, item);
		item.parent = this;
		item.previous = before;
		item.next = after;
		if (before != null) {
			before.next = item;
		}
		if (after != null) {
			after.previous = item;
		}
		childAdded(item);
	}

	void removeItemAt(int index) {
		JsonNode item = children.remove(index);
		if (item.previous != null) {
			item.previous.next = item.next;
		}
		if (item.next != null) {
			item.next.previous = item.previous;
		}
		detach(item);
		childRemoved(item);
	}

	private static void detach(JsonNode item) {
		item.parent = null;
		item.previous = null;
		item.next = null;
	}

	/**
	 * A node that is already attached somewhere, or that would create a cycle, is cloned.
	 */
	private JsonNode ensureParentless(JsonNode node) {
		if (node.parent != null || node == this || ancestors().contains(node)) {
			return node.deepClone();
		}
		return node;
	}

	/**
	 * @param replacing the child being replaced, or null if {@code item} is being inserted
	 * @throws IllegalArgumentException if {@code item} can't be a child of this container
	 */
	void validateChild(JsonNode item, JsonNode replacing) {
		if (item instanceof JsonProperty) {
			throw new IllegalArgumentException("Can not add PROPERTY to " + type());
		}
	}

	void childAdded(JsonNode child) { }

	void childRemoved(JsonNode child) { }

	/**
	 * Ordered, pairwise deep equality of children.
	 */
	boolean childrenEqual(JsonContainer other) {
		if (children.size() != other.children.size()) {
			return false;
		}
		for (int i = 0; i < children.size(); i++) {
			if (!children.get(i).deepEquals(other.children.get(i))) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Copies clones of this container's children and its line info into {@code target}.
	 */
	<C extends JsonContainer> C cloneInto(C target) {
		target.copyLineInfoFrom(this);
		for (JsonNode child : children) {
			target.insertItem(target.children.size(), child.deepClone());
		}
		return target;
	}
}
