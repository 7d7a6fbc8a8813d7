package org.syncview;

/** A subscription to an observable source of events */
@FunctionalInterface
public interface Subscription extends AutoCloseable {
	/** Unsubscribes the listener for this subscription from its source */
	void unsubscribe();

	@Override
	default void close() {
		unsubscribe();
	}
}
