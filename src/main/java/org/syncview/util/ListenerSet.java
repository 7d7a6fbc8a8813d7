package org.syncview.util;

import java.util.Collection;
import java.util.LinkedList;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

import org.syncview.Subscription;

/**
 * Stores a set of listeners. Listeners added or removed by the firing thread while this set is {@link #forEach(Consumer) firing} are
 * queued and applied when firing completes, so a listener removed during firing is not called again for later events.
 *
 * This class also allows containing code to lazily initialize itself when the first listener is added and release its resources when the
 * last listener is removed. The {@link #setUsedListener(Consumer) used listener} is called after this set's lock is released, so
 * transitions reported by concurrent callers may arrive out of order; a listener that cares should consult {@link #isEmpty()}.
 *
 * @param <E> The type of listener to store
 */
public class ListenerSet<E> {
	private final Collection<E> theListeners;
	private final ReentrantReadWriteLock theLock;

	private final ConcurrentHashMap<IdentityKey<E>, Boolean> theListenersToRemove;

	private final ConcurrentLinkedQueue<E> theListenersToAdd;

	private Consumer<Boolean> theUsedListener;

	/** Creates the set of listeners */
	public ListenerSet() {
		theListeners = new LinkedList<>();
		theLock = new ReentrantReadWriteLock();
		theListenersToRemove = new ConcurrentHashMap<>();
		theListenersToAdd = new ConcurrentLinkedQueue<>();
		theUsedListener = used -> {
		};
	}

	/**
	 * @param used The function to call when this set goes from being unused (no listeners) to used (having listeners) and vice versa. The
	 *        parameter passed to the function is true when this set goes from being unused to used and false when it goes from being
	 *        used to unused
	 */
	public void setUsedListener(Consumer<Boolean> used) {
		theUsedListener = used;
	}

	/**
	 * @param listener The listener to add
	 * @return A subscription that removes the listener from this set the first time it is called
	 */
	public Subscription subscribe(E listener) {
		add(listener);
		AtomicBoolean subscribed = new AtomicBoolean(true);
		return () -> {
			if (subscribed.compareAndSet(true, false))
				remove(listener);
		};
	}

	/**
	 * @param listener The listener to add
	 * @return Whether the listener was added
	 */
	public boolean add(E listener) {
		if (theLock.getReadHoldCount() > 0) {
			theListenersToRemove.remove(new IdentityKey<>(listener));
			theListenersToAdd.add(listener);
			return true;
		}
		Lock lock = theLock.writeLock();
		lock.lock();
		boolean wasEmpty;
		boolean ret;
		try {
			wasEmpty = theListeners.isEmpty();
			ret = theListeners.add(listener);
		} finally {
			lock.unlock();
		}
		if (wasEmpty)
			theUsedListener.accept(true);
		return ret;
	}

	/**
	 * @param listener The listener to remove
	 * @return Whether the listener was removed (false if the listener was not in this set)
	 */
	public boolean remove(E listener) {
		if (theListenersToAdd.remove(listener))
			return true;
		if (theLock.getReadHoldCount() > 0) {
			if (!theListeners.contains(listener))
				return false;
			return theListenersToRemove.put(new IdentityKey<>(listener), true) == null;
		}
		Lock lock = theLock.writeLock();
		lock.lock();
		boolean ret;
		boolean nowEmpty;
		try {
			ret = theListeners.remove(listener);
			nowEmpty = ret && theListeners.isEmpty();
		} finally {
			lock.unlock();
		}
		if (nowEmpty)
			theUsedListener.accept(false);
		return ret;
	}

	/** @return The number of listeners in this set, counting queued additions and removals as already applied */
	public int size() {
		Lock lock = theLock.readLock();
		lock.lock();
		try {
			return theListeners.size() - theListenersToRemove.size() + theListenersToAdd.size();
		} finally {
			lock.unlock();
		}
	}

	/** @return Whether this set has no listeners */
	public boolean isEmpty() {
		return size() == 0;
	}

	/**
	 * Invokes this set's listeners. An exception thrown by a listener propagates to the caller after the set's lock is released.
	 *
	 * @param call The function to use each listener in this set
	 */
	public void forEach(Consumer<? super E> call) {
		Lock lock = theLock.readLock();
		lock.lock();
		try {
			for (E listener : theListeners) {
				if (!theListenersToRemove.containsKey(new IdentityKey<>(listener)))
					call.accept(listener);
			}
		} finally {
			lock.unlock();
			if (theLock.getReadHoldCount() == 0)
				addAndRemoveQueuedListeners();
		}
	}

	private void addAndRemoveQueuedListeners() {
		if (theListenersToRemove.isEmpty() && theListenersToAdd.isEmpty())
			return;
		Lock lock = theLock.writeLock();
		lock.lock();
		boolean beforeEmpty;
		boolean afterEmpty;
		try {
			beforeEmpty = theListeners.isEmpty();
			if (!theListenersToRemove.isEmpty()) {
				for (IdentityKey<E> listener : theListenersToRemove.keySet())
					theListeners.remove(listener.value);
				theListenersToRemove.clear();
			}
			E added;
			while ((added = theListenersToAdd.poll()) != null)
				theListeners.add(added);
			afterEmpty = theListeners.isEmpty();
		} finally {
			lock.unlock();
		}
		if (beforeEmpty != afterEmpty)
			theUsedListener.accept(!afterEmpty);
	}
}
