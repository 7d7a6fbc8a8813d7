package org.syncview.collect;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.syncview.util.Transactable;
import org.syncview.util.Transaction;

/**
 * Iterates over a snapshot of the entries of a {@link SynchronizedView} that were visible through its filter when the iterator was
 * created. The snapshot is taken under the view's read lock, so it never reflects a partially-applied change.
 *
 * @param <T> The type of source values
 * @param <V> The type of projections
 */
public class SynchronizedViewIterator<T, V> implements Iterator<ViewEntry<T, V>> {
	private final List<ViewEntry<T, V>> theSnapshot;
	private int theIndex;

	/**
	 * @param lock The lock of the view to iterate
	 * @param entries The view's entries, in enumeration order
	 * @param filter The view's active filter
	 */
	public SynchronizedViewIterator(Transactable lock, Iterable<ViewEntry<T, V>> entries, SynchronizedViewFilter<T, V> filter) {
		theSnapshot = new ArrayList<>();
		try (Transaction t = lock.lock(false, null)) {
			for (ViewEntry<T, V> entry : entries) {
				if (filter.isMatch(entry.getValue(), entry.getProjection()))
					theSnapshot.add(entry);
			}
		}
	}

	/** @return The number of entries this iterator has not yet returned */
	public int remaining() {
		return theSnapshot.size() - theIndex;
	}

	@Override
	public boolean hasNext() {
		return theIndex < theSnapshot.size();
	}

	@Override
	public ViewEntry<T, V> next() {
		if (theIndex >= theSnapshot.size())
			throw new NoSuchElementException();
		return theSnapshot.get(theIndex++);
	}
}
