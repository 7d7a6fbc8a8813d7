package org.syncview.util.swing;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;

import javax.swing.ListModel;
import javax.swing.event.ListDataEvent;
import javax.swing.event.ListDataListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.syncview.Subscription;
import org.syncview.collect.CollectionChangeEvent;
import org.syncview.collect.SynchronizedView;
import org.syncview.util.ListenerSet;
import org.syncview.util.Transaction;

/**
 * <p>
 * A swing ListModel backed by a {@link SynchronizedView}. The model's elements are the view's projections in the view's enumeration
 * order, regardless of the view's filter.
 * </p>
 * <p>
 * The model listens to the view only while it has listeners of its own. Events are fired synchronously on the thread that modified the
 * view's source, under the view's lock; listeners that need to touch swing components must hand the work off to the event dispatch
 * thread themselves.
 * </p>
 *
 * @param <T> The type of source values in the view
 * @param <V> The type of projections in the view
 */
public class SynchronizedViewListModel<T, V> implements ListModel<V> {
	private static final Logger LOG = LoggerFactory.getLogger(SynchronizedViewListModel.class);

	private final SynchronizedView<T, V> theView;
	private final ListenerSet<ListDataListener> theListeners;
	private final AtomicReference<Subscription> theListening;
	private int theLastSize;
	private volatile boolean isEventing;
	private volatile boolean isDisposed;

	/** @param view The view to back this model */
	public SynchronizedViewListModel(SynchronizedView<T, V> view) {
		theView = checkNotNull(view, "view");
		theListening = new AtomicReference<>();
		theListeners = new ListenerSet<>();
		theListeners.setUsedListener(used -> updateListening());
	}

	/** @return The view that this model wraps */
	public SynchronizedView<T, V> getView() {
		return theView;
	}

	@Override
	public int getSize() {
		return theView.size();
	}

	@Override
	public V getElementAt(int index) {
		return theView.get(index).getProjection();
	}

	/** @return Whether this model is currently firing a data event in response to a change in the view */
	public boolean isEventing() {
		return isEventing;
	}

	/** @return Whether this model is currently listening to its view */
	public boolean isListening() {
		return theListening.get() != null;
	}

	@Override
	public void addListDataListener(ListDataListener l) {
		theListeners.add(checkNotNull(l, "listener"));
	}

	@Override
	public void removeListDataListener(ListDataListener l) {
		theListeners.remove(l);
	}

	/** Stops listening to the view. Listeners added afterward will not receive events. Does nothing if called again. */
	public void dispose() {
		isDisposed = true;
		updateListening();
	}

	/**
	 * Subscribes to or unsubscribes from the view to match whether this model has listeners. Called without any of this model's locks
	 * held, possibly by several threads at once, so each caller settles on the state current when it looks.
	 */
	private void updateListening() {
		while (true) {
			Subscription listening = theListening.get();
			boolean used = !isDisposed && !theListeners.isEmpty();
			if (used == (listening != null))
				return;
			if (used) {
				Subscription subscription;
				try (Transaction t = theView.lock(false, null)) {
					theLastSize = theView.size();
					subscription = theView.onChange(this::handleEvent);
				}
				if (theListening.compareAndSet(null, subscription))
					LOG.debug("Listening to {}", theView);
				else
					subscription.unsubscribe();
			} else if (theListening.compareAndSet(listening, null)) {
				listening.unsubscribe();
				LOG.debug("Stopped listening to view");
			}
		}
	}

	private void handleEvent(CollectionChangeEvent<T> event) {
		isEventing = true;
		try {
			int size = theView.size();
			switch (event.getAction()) {
			case add: {
				int count = event.getNewItems().size();
				int before = size - count;
				// Mirrors the view's placement: index 0 of a non-empty view is a prepend, anything else an append
				int start = event.getNewStartingIndex() == 0 && before > 0 ? 0 : before;
				fireInterval(ListDataEvent.INTERVAL_ADDED, start, start + count - 1, size);
				break;
			}
			case remove: {
				int count = event.getOldItems().size();
				int start = event.getOldStartingIndex();
				fireInterval(ListDataEvent.INTERVAL_REMOVED, start, start + count - 1, size + count);
				break;
			}
			case replace:
				fireInterval(ListDataEvent.CONTENTS_CHANGED, event.getNewStartingIndex(), event.getNewStartingIndex(), size);
				break;
			case move:
				fireInterval(ListDataEvent.INTERVAL_REMOVED, event.getOldStartingIndex(), event.getOldStartingIndex(), size);
				fireInterval(ListDataEvent.INTERVAL_ADDED, event.getNewStartingIndex(), event.getNewStartingIndex(), size);
				break;
			case reset:
				if (theLastSize > 0)
					fire(new ListDataEvent(this, ListDataEvent.CONTENTS_CHANGED, 0, theLastSize - 1));
				break;
			}
			theLastSize = size;
		} finally {
			isEventing = false;
		}
	}

	/** Fires an event for a source-ordered interval, translated into the view's enumeration order */
	private void fireInterval(int type, int start, int end, int extent) {
		if (theView.isReverse()) {
			int reverseStart = extent - 1 - end;
			end = extent - 1 - start;
			start = reverseStart;
		}
		fire(new ListDataEvent(this, type, start, end));
	}

	private void fire(ListDataEvent event) {
		BiConsumer<ListDataListener, ListDataEvent> call = callFor(event.getType());
		theListeners.forEach(listener -> {
			try {
				call.accept(listener, event);
			} catch (RuntimeException e) {
				LOG.error("Listener {} failed on {}", listener, event, e);
			}
		});
	}

	private static BiConsumer<ListDataListener, ListDataEvent> callFor(int type) {
		switch (type) {
		case ListDataEvent.INTERVAL_ADDED:
			return ListDataListener::intervalAdded;
		case ListDataEvent.INTERVAL_REMOVED:
			return ListDataListener::intervalRemoved;
		default:
			return ListDataListener::contentsChanged;
		}
	}
}
