package org.syncview.collect;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkPositionIndexes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.syncview.Subscription;
import org.syncview.util.ListenerSet;
import org.syncview.util.RingBuffer;
import org.syncview.util.Transactable;
import org.syncview.util.Transaction;

/**
 * <p>
 * A thread-safe, observable ring buffer. Every modification is made under this buffer's write lock and fires exactly one
 * {@link CollectionChangeEvent} per logical change to this buffer's listeners before the lock is released.
 * </p>
 * <p>
 * A buffer built {@link Builder#withCapacity(int) with a capacity} drops elements from the opposite end when an addition would exceed
 * it, firing a removal event before the addition's event.
 * </p>
 * <p>
 * {@link #createView(Function, boolean) Views} of the buffer maintain a projected mirror of its content incrementally.
 * </p>
 *
 * @param <T> The type of values in the buffer
 */
public class ObservableRingBuffer<T> implements Iterable<T>, Transactable {
	private static final Logger LOG = LoggerFactory.getLogger(ObservableRingBuffer.class);

	/**
	 * @param <T> The type of values for the buffer
	 * @return A builder for an {@link ObservableRingBuffer}
	 */
	public static <T> Builder<T> build() {
		return new Builder<>();
	}

	/**
	 * Builds {@link ObservableRingBuffer}s
	 *
	 * @param <T> The type of values for the buffer
	 */
	public static class Builder<T> {
		private int theCapacity;
		private Collection<? extends T> theInitialValues;

		Builder() {
			theInitialValues = Collections.emptyList();
		}

		/**
		 * @param capacity The maximum number of elements the buffer may hold
		 * @return This builder
		 */
		public Builder<T> withCapacity(int capacity) {
			checkArgument(capacity > 0, "Capacity must be positive: %s", capacity);
			theCapacity = capacity;
			return this;
		}

		/**
		 * @param values The initial content for the buffer. If this exceeds the buffer's capacity, only the last values are kept.
		 * @return This builder
		 */
		public Builder<T> withInitialValues(Collection<? extends T> values) {
			theInitialValues = checkNotNull(values, "values");
			return this;
		}

		/** @return The new buffer */
		public ObservableRingBuffer<T> build() {
			return new ObservableRingBuffer<>(theCapacity, theInitialValues);
		}
	}

	private final RingBuffer<T> theBuffer;
	private final int theCapacity;
	private final ReentrantReadWriteLock theLock;
	private final ListenerSet<CollectionChangeListener<T>> theListeners;

	/** Creates an empty, unbounded buffer */
	public ObservableRingBuffer() {
		this(0, Collections.emptyList());
	}

	/** @param values The initial content for the unbounded buffer */
	public ObservableRingBuffer(Collection<? extends T> values) {
		this(0, values);
	}

	private ObservableRingBuffer(int capacity, Collection<? extends T> values) {
		theCapacity = capacity;
		theBuffer = new RingBuffer<>();
		for (T value : values) {
			if (capacity > 0 && theBuffer.size() == capacity)
				theBuffer.removeFirst();
			theBuffer.addLast(value);
		}
		theLock = new ReentrantReadWriteLock();
		theListeners = new ListenerSet<>();
	}

	@Override
	public Transaction lock(boolean write, Object cause) {
		return Transactable.lock(theLock, write);
	}

	/** @return The maximum number of elements this buffer may hold, or 0 if it is unbounded */
	public int getCapacity() {
		return theCapacity;
	}

	/** @return The number of elements in this buffer */
	public int size() {
		try (Transaction t = lock(false, null)) {
			return theBuffer.size();
		}
	}

	/** @return Whether this buffer has no elements */
	public boolean isEmpty() {
		return size() == 0;
	}

	/**
	 * @param index The index of the element to get
	 * @return The element at the given index
	 */
	public T get(int index) {
		try (Transaction t = lock(false, null)) {
			return theBuffer.get(index);
		}
	}

	/**
	 * @param value The value to search for
	 * @return The index of the first element equal to the value, or -1 if there is none
	 */
	public int indexOf(Object value) {
		try (Transaction t = lock(false, null)) {
			return theBuffer.indexOf(value);
		}
	}

	/**
	 * @param value The value to search for
	 * @return Whether this buffer contains an element equal to the value
	 */
	public boolean contains(Object value) {
		return indexOf(value) >= 0;
	}

	/** @return A copy of this buffer's content, in order */
	public List<T> toList() {
		try (Transaction t = lock(false, null)) {
			return theBuffer.toList();
		}
	}

	/** Iterates over a snapshot of this buffer's content */
	@Override
	public Iterator<T> iterator() {
		return toList().iterator();
	}

	/** @param item The value to add to the beginning of this buffer */
	public void addFirst(T item) {
		try (Transaction t = lock(true, null)) {
			if (isFull()) {
				int last = theBuffer.size() - 1;
				fire(CollectionChangeEvent.remove(theBuffer.removeLast(), last));
			}
			theBuffer.addFirst(item);
			fire(CollectionChangeEvent.add(item, 0));
		}
	}

	/** @param item The value to add to the end of this buffer */
	public void addLast(T item) {
		try (Transaction t = lock(true, null)) {
			addLastLocked(item);
		}
	}

	/**
	 * Adds values to the end of this buffer. An unbounded buffer fires a single batch event; a bounded one adds the values one at a time.
	 *
	 * @param items The values to add
	 */
	public void addLastRange(Collection<? extends T> items) {
		if (items.isEmpty())
			return;
		try (Transaction t = lock(true, null)) {
			if (theCapacity > 0) {
				for (T item : items)
					addLastLocked(item);
				return;
			}
			int index = theBuffer.size();
			for (T item : items)
				theBuffer.addLast(item);
			fire(CollectionChangeEvent.add(items, index));
		}
	}

	private void addLastLocked(T item) {
		if (isFull())
			fire(CollectionChangeEvent.remove(theBuffer.removeFirst(), 0));
		int index = theBuffer.size();
		theBuffer.addLast(item);
		fire(CollectionChangeEvent.add(item, index));
	}

	private boolean isFull() {
		return theCapacity > 0 && theBuffer.size() >= theCapacity;
	}

	/** @return The value removed from the beginning of this buffer */
	public T removeFirst() {
		try (Transaction t = lock(true, null)) {
			T item = theBuffer.removeFirst();
			fire(CollectionChangeEvent.remove(item, 0));
			return item;
		}
	}

	/** @return The value removed from the end of this buffer */
	public T removeLast() {
		try (Transaction t = lock(true, null)) {
			T item = theBuffer.removeLast();
			fire(CollectionChangeEvent.remove(item, theBuffer.size()));
			return item;
		}
	}

	/**
	 * @param index The index of the element to remove
	 * @return The removed value
	 */
	public T removeAt(int index) {
		try (Transaction t = lock(true, null)) {
			T item = theBuffer.removeAt(index);
			fire(CollectionChangeEvent.remove(item, index));
			return item;
		}
	}

	/**
	 * @param start The index of the first element to remove
	 * @param length The number of elements to remove
	 */
	public void removeRange(int start, int length) {
		try (Transaction t = lock(true, null)) {
			checkArgument(length >= 0, "Negative length: %s", length);
			checkPositionIndexes(start, start + length, theBuffer.size());
			if (length == 0)
				return;
			List<T> removed = new ArrayList<>(length);
			for (int i = 0; i < length; i++)
				removed.add(theBuffer.get(start + i));
			theBuffer.removeRange(start, length);
			fire(CollectionChangeEvent.remove(removed, start));
		}
	}

	/**
	 * @param index The index of the element to replace
	 * @param item The new value for the element
	 * @return The previous value
	 */
	public T set(int index, T item) {
		try (Transaction t = lock(true, null)) {
			T old = theBuffer.set(index, item);
			fire(CollectionChangeEvent.replace(item, old, index));
			return old;
		}
	}

	/**
	 * @param oldIndex The current index of the element to move
	 * @param newIndex The index for the element after the move
	 */
	public void move(int oldIndex, int newIndex) {
		try (Transaction t = lock(true, null)) {
			checkElementIndex(oldIndex, theBuffer.size());
			checkElementIndex(newIndex, theBuffer.size());
			T item = theBuffer.removeAt(oldIndex);
			theBuffer.insert(newIndex, item);
			fire(CollectionChangeEvent.move(item, newIndex, oldIndex));
		}
	}

	/** Removes all elements from this buffer */
	public void clear() {
		try (Transaction t = lock(true, null)) {
			theBuffer.clear();
			fire(CollectionChangeEvent.reset());
		}
	}

	/**
	 * @param listener The listener to be notified of each change to this buffer, under this buffer's write lock
	 * @return The subscription to stop notification
	 */
	public Subscription subscribe(CollectionChangeListener<T> listener) {
		return theListeners.subscribe(checkNotNull(listener, "listener"));
	}

	/**
	 * @param listener The listener to stop notifying
	 * @return Whether the listener was subscribed
	 */
	public boolean unsubscribe(CollectionChangeListener<T> listener) {
		return theListeners.remove(listener);
	}

	/** @return The number of listeners currently subscribed to this buffer */
	public int getListenerCount() {
		return theListeners.size();
	}

	private void fire(CollectionChangeEvent<T> event) {
		theListeners.forEach(listener -> listener.onChange(event));
	}

	/**
	 * @param transform The function to compute each entry's projection from its value, once when it is added
	 * @return A view of this buffer in forward order
	 */
	public <V> SynchronizedView<T, V> createView(Function<? super T, ? extends V> transform) {
		return createView(transform, false);
	}

	/**
	 * @param transform The function to compute each entry's projection from its value, once when it is added
	 * @param reverse Whether the view should enumerate its entries from last to first
	 * @return A view of this buffer
	 */
	public <V> SynchronizedView<T, V> createView(Function<? super T, ? extends V> transform, boolean reverse) {
		return new View<>(this, transform, reverse);
	}

	@Override
	public String toString() {
		return toList().toString();
	}

	static class View<T, V> implements SynchronizedView<T, V> {
		private final ObservableRingBuffer<T> theSource;
		private final Function<? super T, ? extends V> theTransform;
		private final boolean isReverse;
		private final RingBuffer<ViewEntry<T, V>> theMirror;
		private final ReentrantReadWriteLock theLock;
		private final CollectionChangeListener<T> theSourceListener;
		private final ListenerSet<CollectionChangeListener<T>> theChangeListeners;
		private final ListenerSet<Consumer<CollectionChangeAction>> theStateListeners;
		private final AtomicBoolean isDisposed;
		private SynchronizedViewFilter<T, V> theFilter;

		View(ObservableRingBuffer<T> source, Function<? super T, ? extends V> transform, boolean reverse) {
			theSource = source;
			theTransform = checkNotNull(transform, "transform");
			isReverse = reverse;
			theFilter = SynchronizedViewFilter.none();
			theLock = new ReentrantReadWriteLock();
			theChangeListeners = new ListenerSet<>();
			theStateListeners = new ListenerSet<>();
			isDisposed = new AtomicBoolean();
			theSourceListener = this::sourceChanged;
			theMirror = new RingBuffer<>();
			// Snapshot and subscription must be atomic with respect to source modification. The read lock excludes every modifier and may
			// be taken by a caller already holding either of the source's locks.
			try (Transaction t = source.lock(false, null)) {
				for (int i = 0; i < source.theBuffer.size(); i++)
					theMirror.addLast(entryFor(source.theBuffer.get(i)));
				source.subscribe(theSourceListener);
			}
			LOG.debug("Created {}view of {} entries", reverse ? "reverse " : "", theMirror.size());
		}

		private ViewEntry<T, V> entryFor(T value) {
			return new ViewEntry<>(value, theTransform.apply(value));
		}

		@Override
		public Transaction lock(boolean write, Object cause) {
			return Transactable.lock(theLock, write);
		}

		@Override
		public int size() {
			try (Transaction t = lock(false, null)) {
				return theMirror.size();
			}
		}

		@Override
		public boolean isReverse() {
			return isReverse;
		}

		@Override
		public ViewEntry<T, V> get(int index) {
			try (Transaction t = lock(false, null)) {
				checkElementIndex(index, theMirror.size());
				return theMirror.get(isReverse ? theMirror.size() - 1 - index : index);
			}
		}

		@Override
		public SynchronizedViewFilter<T, V> getFilter() {
			try (Transaction t = lock(false, null)) {
				return theFilter;
			}
		}

		@Override
		public void attachFilter(SynchronizedViewFilter<T, V> filter) {
			checkNotNull(filter, "filter");
			try (Transaction t = lock(true, null)) {
				theFilter = filter;
				for (ViewEntry<T, V> entry : theMirror)
					filter.onAttach(entry.getValue(), entry.getProjection());
			}
			LOG.debug("Attached filter {}", filter);
		}

		@Override
		public void resetFilter(BiConsumer<? super T, ? super V> resetAction) {
			try (Transaction t = lock(true, null)) {
				theFilter = SynchronizedViewFilter.none();
				if (resetAction != null) {
					for (ViewEntry<T, V> entry : theMirror)
						resetAction.accept(entry.getValue(), entry.getProjection());
				}
			}
			LOG.debug("Reset filter");
		}

		@Override
		public Subscription onChange(CollectionChangeListener<T> listener) {
			return theChangeListeners.subscribe(checkNotNull(listener, "listener"));
		}

		@Override
		public Subscription onStateChanged(Consumer<CollectionChangeAction> listener) {
			return theStateListeners.subscribe(checkNotNull(listener, "listener"));
		}

		@Override
		public SynchronizedViewIterator<T, V> iterator() {
			try (Transaction t = lock(false, null)) {
				return new SynchronizedViewIterator<>(this, isReverse ? theMirror.reversed() : theMirror, theFilter);
			}
		}

		@Override
		public List<V> toList() {
			SynchronizedViewIterator<T, V> iter = iterator();
			List<V> list = new ArrayList<>(iter.remaining());
			while (iter.hasNext())
				list.add(iter.next().getProjection());
			return list;
		}

		@Override
		public void dispose() {
			if (isDisposed.compareAndSet(false, true)) {
				theSource.unsubscribe(theSourceListener);
				LOG.debug("Disposed view");
			}
		}

		@Override
		public boolean isDisposed() {
			return isDisposed.get();
		}

		/** Called under the source's write lock */
		private void sourceChanged(CollectionChangeEvent<T> event) {
			try (Transaction t = lock(true, null)) {
				switch (event.getAction()) {
				case add: {
					// An addition at index 0 of an empty view is treated as an append; the order is the same either way
					boolean first = event.getNewStartingIndex() == 0 && !theMirror.isEmpty();
					for (T item : event.getNewItems()) {
						ViewEntry<T, V> entry = entryFor(item);
						if (first)
							theMirror.addFirst(entry);
						else
							theMirror.addLast(entry);
						theFilter.onAdd(entry.getValue(), entry.getProjection());
					}
					break;
				}
				case remove:
					if (event.isSingleItem()) {
						ViewEntry<T, V> entry = theMirror.get(event.getOldStartingIndex());
						theMirror.removeAt(event.getOldStartingIndex());
						theFilter.onRemove(entry.getValue(), entry.getProjection());
					} else {
						int start = event.getOldStartingIndex();
						int length = event.getOldItems().size();
						// The filter sees the removed entries while they are still in place
						for (int i = start; i < start + length; i++) {
							ViewEntry<T, V> entry = theMirror.get(i);
							theFilter.onRemove(entry.getValue(), entry.getProjection());
						}
						theMirror.removeRange(start, length);
					}
					break;
				case replace: {
					ViewEntry<T, V> entry = entryFor(event.getNewItem());
					ViewEntry<T, V> old = theMirror.set(event.getNewStartingIndex(), entry);
					theFilter.onRemove(old.getValue(), old.getProjection());
					theFilter.onAdd(entry.getValue(), entry.getProjection());
					break;
				}
				case move: {
					ViewEntry<T, V> entry = theMirror.removeAt(event.getOldStartingIndex());
					theMirror.insert(event.getNewStartingIndex(), entry);
					theFilter.onMove(entry.getValue(), entry.getProjection());
					break;
				}
				case reset:
					if (!theFilter.isNullFilter()) {
						for (ViewEntry<T, V> entry : theMirror)
							theFilter.onRemove(entry.getValue(), entry.getProjection());
					}
					theMirror.clear();
					break;
				}

				theChangeListeners.forEach(listener -> listener.onChange(event));
				theStateListeners.forEach(listener -> listener.accept(event.getAction()));
			}
		}

		@Override
		public String toString() {
			try (Transaction t = lock(false, null)) {
				return (isReverse ? "reverse view" : "view") + theMirror;
			}
		}
	}
}
