package works.lattice.codec.async;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.lattice.codec.JsonWriter;

import static java.util.Objects.requireNonNull;

/**
 * Runs operations on a {@link JsonWriter} and reports their outcome as {@link CompletableFuture}s.
 * <p>
 * By default, operations run on the calling thread, and the returned future is already complete.
 * With an {@link Executor}, they run there instead; callers must still wait for each future
 * before starting the next operation, since the writer is not thread-safe.
 */
public final class AsyncJsonWriter {
	private static final Logger LOGGER = LoggerFactory.getLogger(AsyncJsonWriter.class);

	private final JsonWriter writer;
	private final Executor executor;

	public AsyncJsonWriter(JsonWriter writer) {
		this(writer, Runnable::run);
	}

	public AsyncJsonWriter(JsonWriter writer, Executor executor) {
		this.writer = requireNonNull(writer);
		this.executor = requireNonNull(executor);
	}

	public JsonWriter writer() {
		return writer;
	}

	public CompletableFuture<Void> perform(WriterOperation operation) {
		return perform(operation, CancellationToken.NONE);
	}

	/**
	 * @return a future that is cancelled, without touching the writer,
	 * if {@code cancellation} was requested before the operation started;
	 * or that completes exceptionally if the operation throws.
	 */
	public CompletableFuture<Void> perform(WriterOperation operation, CancellationToken cancellation) {
		requireNonNull(operation);
		CompletableFuture<Void> result = new CompletableFuture<>();
		try {
			executor.execute(() -> {
				if (cancellation.isCancellationRequested()) {
					LOGGER.debug("Writer operation cancelled before starting");
					result.cancel(false);
					return;
				}
				try {
					operation.apply(writer);
					result.complete(null);
				} catch (RuntimeException e) {
					result.completeExceptionally(e);
				}
			});
		} catch (RuntimeException e) {
			result.completeExceptionally(e);
		}
		return result;
	}

	public CompletableFuture<Void> flushAsync(CancellationToken cancellation) {
		return perform(JsonWriter::flush, cancellation);
	}

	public CompletableFuture<Void> closeAsync(CancellationToken cancellation) {
		return perform(JsonWriter::close, cancellation);
	}
}
