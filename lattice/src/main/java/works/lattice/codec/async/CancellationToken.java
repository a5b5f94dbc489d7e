package works.lattice.codec.async;

/**
 * Lets a caller ask for pending asynchronous reader and writer operations to be abandoned.
 * <p>
 * Cancellation is cooperative: it is checked before each operation starts,
 * and an operation that has already started runs to completion.
 */
public final class CancellationToken {
	/**
	 * A token that can never be cancelled.
	 */
	public static final CancellationToken NONE = new CancellationToken(false);

	private final boolean cancellable;
	private volatile boolean cancellationRequested = false;

	public CancellationToken() {
		this(true);
	}

	private CancellationToken(boolean cancellable) {
		this.cancellable = cancellable;
	}

	/**
	 * @throws IllegalStateException if this is {@link #NONE}
	 */
	public void cancel() {
		if (!cancellable) {
			throw new IllegalStateException("This token can't be cancelled");
		}
		cancellationRequested = true;
	}

	public boolean isCancellationRequested() {
		return cancellationRequested;
	}

	@Override
	public String toString() {
		return cancellable ? "CancellationToken[" + (cancellationRequested ? "cancelled" : "active") + "]" : "CancellationToken.NONE";
	}
}
