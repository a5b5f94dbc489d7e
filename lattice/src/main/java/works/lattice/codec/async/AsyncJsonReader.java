package works.lattice.codec.async;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.lattice.codec.JsonReader;

import static java.util.Objects.requireNonNull;

/**
 * Runs operations on a {@link JsonReader} and reports their outcome as {@link CompletableFuture}s.
 * <p>
 * By default, operations run on the calling thread, and the returned future is already complete.
 * With an {@link Executor}, they run there instead; callers must still wait for each future
 * before starting the next operation, since the reader is not thread-safe.
 */
public final class AsyncJsonReader {
	private static final Logger LOGGER = LoggerFactory.getLogger(AsyncJsonReader.class);

	private final JsonReader reader;
	private final Executor executor;

	public AsyncJsonReader(JsonReader reader) {
		this(reader, Runnable::run);
	}

	public AsyncJsonReader(JsonReader reader, Executor executor) {
		this.reader = requireNonNull(reader);
		this.executor = requireNonNull(executor);
	}

	public JsonReader reader() {
		return reader;
	}

	/**
	 * @see JsonReader#read()
	 */
	public CompletableFuture<Boolean> readAsync(CancellationToken cancellation) {
		return perform(JsonReader::read, cancellation);
	}

	public CompletableFuture<Void> skipAsync(CancellationToken cancellation) {
		return perform(r -> {
			r.skip();
			return null;
		}, cancellation);
	}

	/**
	 * @return a future that is cancelled, without touching the reader,
	 * if {@code cancellation} was requested before the operation started;
	 * or that completes exceptionally if the operation throws.
	 */
	public <T> CompletableFuture<T> perform(ReaderOperation<T> operation, CancellationToken cancellation) {
		requireNonNull(operation);
		CompletableFuture<T> result = new CompletableFuture<>();
		try {
			executor.execute(() -> {
				if (cancellation.isCancellationRequested()) {
					LOGGER.debug("Reader operation cancelled before starting");
					result.cancel(false);
					return;
				}
				try {
					result.complete(operation.apply(reader));
				} catch (RuntimeException e) {
					result.completeExceptionally(e);
				}
			});
		} catch (RuntimeException e) {
			result.completeExceptionally(e);
		}
		return result;
	}
}
