package org.javai.sqlguard;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative cancellation signal for a single request.
 * <p>
 * Components check {@link #isCancelled()} between steps and register callbacks to abort
 * blocking work (an in-flight generation call, a running statement). Callbacks registered
 * after cancellation run immediately.
 */
public final class CancellationToken {

	private static final Logger logger = LoggerFactory.getLogger(CancellationToken.class);

	private static final CancellationToken NONE = new CancellationToken(false);

	private final boolean cancellable;
	private final AtomicBoolean cancelled = new AtomicBoolean(false);
	private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

	private CancellationToken(boolean cancellable) {
		this.cancellable = cancellable;
	}

	public static CancellationToken create() {
		return new CancellationToken(true);
	}

	/**
	 * A token that is never cancelled.
	 */
	public static CancellationToken none() {
		return NONE;
	}

	public void cancel() {
		if (!cancellable || !cancelled.compareAndSet(false, true)) {
			return;
		}
		for (Runnable callback : callbacks) {
			runCallback(callback);
		}
	}

	public boolean isCancelled() {
		return cancelled.get();
	}

	public void throwIfCancelled() {
		if (isCancelled()) {
			throw new CancellationException("Request was cancelled");
		}
	}

	public Registration onCancel(Runnable callback) {
		if (!cancellable) {
			return () -> { };
		}
		callbacks.add(callback);
		if (isCancelled() && callbacks.remove(callback)) {
			runCallback(callback);
		}
		return () -> callbacks.remove(callback);
	}

	private void runCallback(Runnable callback) {
		try {
			callback.run();
		}
		catch (RuntimeException e) {
			logger.warn("Cancellation callback failed", e);
		}
	}

	/**
	 * Handle for removing a cancellation callback once the guarded work is finished.
	 */
	@FunctionalInterface
	public interface Registration extends AutoCloseable {

		@Override
		void close();
	}
}
