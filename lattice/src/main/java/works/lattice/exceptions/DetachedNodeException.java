package works.lattice.exceptions;

/**
 * A tree operation needed the node's parent, but the node has none.
 */
public class DetachedNodeException extends IllegalStateException {
	public DetachedNodeException(String message) {
		super(message);
	}
}
