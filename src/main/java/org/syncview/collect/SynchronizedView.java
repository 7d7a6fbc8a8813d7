package org.syncview.collect;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import org.syncview.Subscription;
import org.syncview.util.Transactable;
import org.syncview.util.swing.SynchronizedViewListModel;

/**
 * <p>
 * A filtered, projected view over an ordered observable collection that keeps itself in sync with the collection incrementally. Each
 * entry pairs a source value with a projection computed exactly once, when the value was added.
 * </p>
 * <p>
 * The view has its own lock, which is always acquired after the source's lock when the view reacts to a change. Code holding a view's
 * lock (e.g. via {@link #lock(boolean, Object)} or inside a filter hook or listener) must never attempt to lock or modify the view's
 * source.
 * </p>
 *
 * @param <T> The type of source values
 * @param <V> The type of projections
 */
public interface SynchronizedView<T, V> extends Iterable<ViewEntry<T, V>>, Transactable, AutoCloseable {
	/** @return The number of entries in this view, regardless of the filter */
	int size();

	/** @return Whether this view enumerates its entries in the reverse of the source's order */
	boolean isReverse();

	/**
	 * @param index The index of the entry in enumeration order, regardless of the filter
	 * @return The entry at the given index
	 * @throws IndexOutOfBoundsException If <code>index&lt;0</code> or <code>index&gt;=size()</code>
	 */
	ViewEntry<T, V> get(int index);

	/** @return The currently active filter, never null */
	SynchronizedViewFilter<T, V> getFilter();

	/**
	 * Makes the given filter active, calling its {@link SynchronizedViewFilter#onAttach(Object, Object) onAttach} hook for every current
	 * entry, in order
	 *
	 * @param filter The filter to attach
	 */
	void attachFilter(SynchronizedViewFilter<T, V> filter);

	/**
	 * Makes the {@link SynchronizedViewFilter#none() no-op filter} active
	 *
	 * @param resetAction If non-null, called for every current entry, in order
	 */
	void resetFilter(BiConsumer<? super T, ? super V> resetAction);

	/**
	 * @param listener The listener to receive every change event from the source, after this view has applied it
	 * @return The subscription to stop the notifications
	 */
	Subscription onChange(CollectionChangeListener<T> listener);

	/**
	 * @param listener The listener to receive the action of every change from the source, after the {@link #onChange(CollectionChangeListener)
	 *        granular} listeners
	 * @return The subscription to stop the notifications
	 */
	Subscription onStateChanged(Consumer<CollectionChangeAction> listener);

	/**
	 * Returns an iterator over a snapshot of the entries visible through the active filter, taken under this view's lock. Each call
	 * reflects the view's state at the time of the call.
	 */
	@Override
	SynchronizedViewIterator<T, V> iterator();

	/** @return A stream over a snapshot of the entries visible through the active filter */
	default Stream<ViewEntry<T, V>> stream() {
		return StreamSupport.stream(spliterator(), false);
	}

	/** @return The projections of the entries visible through the active filter, in enumeration order */
	List<V> toList();

	/** @return A swing list model of this view's projections */
	default SynchronizedViewListModel<T, V> asListModel() {
		return new SynchronizedViewListModel<>(this);
	}

	/** Stops this view from tracking its source. Does nothing if the view is already disposed. */
	void dispose();

	/** @return Whether {@link #dispose()} has been called */
	boolean isDisposed();

	@Override
	default void close() {
		dispose();
	}
}
