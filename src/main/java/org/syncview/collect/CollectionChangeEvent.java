package org.syncview.collect;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * <p>
 * Describes exactly one mutation of an ordered observable collection.
 * </p>
 * <p>
 * {@link CollectionChangeAction#add Add} events carry the {@link #getNewStartingIndex() index} of the first added item and either a
 * {@link #getNewItem() single item} or an ordered {@link #getNewItems() batch}. {@link CollectionChangeAction#remove Remove} events carry
 * the {@link #getOldStartingIndex() index} of the first removed item and the removed item or batch.
 * {@link CollectionChangeAction#replace Replace} events are always single-item and carry the old and new values at one index.
 * {@link CollectionChangeAction#move Move} events carry the moved item with its old and new index. {@link CollectionChangeAction#reset
 * Reset} events carry nothing.
 * </p>
 *
 * @param <T> The type of values in the collection
 */
public final class CollectionChangeEvent<T> {
	private final CollectionChangeAction theAction;
	private final boolean isSingleItem;
	private final T theNewItem;
	private final List<T> theNewItems;
	private final T theOldItem;
	private final List<T> theOldItems;
	private final int theNewStartingIndex;
	private final int theOldStartingIndex;

	private CollectionChangeEvent(CollectionChangeAction action, boolean singleItem, T newItem, List<T> newItems, T oldItem,
		List<T> oldItems, int newStartingIndex, int oldStartingIndex) {
		theAction = action;
		isSingleItem = singleItem;
		theNewItem = newItem;
		theNewItems = newItems;
		theOldItem = oldItem;
		theOldItems = oldItems;
		theNewStartingIndex = newStartingIndex;
		theOldStartingIndex = oldStartingIndex;
	}

	/**
	 * @param item The item that was added
	 * @param index The index at which the item was added
	 * @return The event
	 */
	public static <T> CollectionChangeEvent<T> add(T item, int index) {
		checkIndex(index);
		return new CollectionChangeEvent<>(CollectionChangeAction.add, true, item, null, null, null, index, -1);
	}

	/**
	 * @param items The items that were added, in order
	 * @param index The index at which the first item was added
	 * @return The event
	 */
	public static <T> CollectionChangeEvent<T> add(Collection<? extends T> items, int index) {
		checkIndex(index);
		return new CollectionChangeEvent<T>(CollectionChangeAction.add, false, null, copy(items), null, null, index, -1);
	}

	/**
	 * @param item The item that was removed
	 * @param index The index from which the item was removed
	 * @return The event
	 */
	public static <T> CollectionChangeEvent<T> remove(T item, int index) {
		checkIndex(index);
		return new CollectionChangeEvent<>(CollectionChangeAction.remove, true, null, null, item, null, -1, index);
	}

	/**
	 * @param items The contiguous items that were removed, in order
	 * @param index The index of the first removed item
	 * @return The event
	 */
	public static <T> CollectionChangeEvent<T> remove(Collection<? extends T> items, int index) {
		checkIndex(index);
		return new CollectionChangeEvent<T>(CollectionChangeAction.remove, false, null, null, null, copy(items), -1, index);
	}

	/**
	 * @param newItem The new value at the index
	 * @param oldItem The value previously at the index
	 * @param index The index of the replaced element
	 * @return The event
	 */
	public static <T> CollectionChangeEvent<T> replace(T newItem, T oldItem, int index) {
		checkIndex(index);
		return new CollectionChangeEvent<>(CollectionChangeAction.replace, true, newItem, null, oldItem, null, index, index);
	}

	/**
	 * @param item The item that was moved
	 * @param newIndex The index of the item after the move
	 * @param oldIndex The index of the item before the move
	 * @return The event
	 */
	public static <T> CollectionChangeEvent<T> move(T item, int newIndex, int oldIndex) {
		checkIndex(newIndex);
		checkIndex(oldIndex);
		return new CollectionChangeEvent<>(CollectionChangeAction.move, true, item, null, item, null, newIndex, oldIndex);
	}

	/** @return An event describing that the collection was cleared */
	public static <T> CollectionChangeEvent<T> reset() {
		return new CollectionChangeEvent<>(CollectionChangeAction.reset, true, null, null, null, null, -1, -1);
	}

	private static <T> List<T> copy(Collection<? extends T> items) {
		return Collections.unmodifiableList(new ArrayList<T>(items));
	}

	private static void checkIndex(int index) {
		if (index < 0)
			throw new IndexOutOfBoundsException("" + index);
	}

	/** @return The kind of the change */
	public CollectionChangeAction getAction() {
		return theAction;
	}

	/** @return Whether this event reports a single item (as opposed to a batch) */
	public boolean isSingleItem() {
		return isSingleItem;
	}

	/** @return The added, replacing or moved item of a single-item event, null otherwise */
	public T getNewItem() {
		return theNewItem;
	}

	/**
	 * @return The added items of an {@link CollectionChangeAction#add add} event, in order. Single-item events yield a singleton list of
	 *         the {@link #getNewItem() new item}.
	 */
	public List<T> getNewItems() {
		return itemsOf(theNewItems, theNewItem, theAction != CollectionChangeAction.remove);
	}

	/** @return The removed, replaced or moved item of a single-item event, null otherwise */
	public T getOldItem() {
		return theOldItem;
	}

	/**
	 * @return The removed items of a {@link CollectionChangeAction#remove remove} event, in order. Single-item events yield a singleton
	 *         list of the {@link #getOldItem() old item}.
	 */
	public List<T> getOldItems() {
		return itemsOf(theOldItems, theOldItem, theAction != CollectionChangeAction.add);
	}

	/** @return The index of the first added item, or of the replaced element or the moved element's destination. -1 if not applicable. */
	public int getNewStartingIndex() {
		return theNewStartingIndex;
	}

	/** @return The index of the first removed item, or of the replaced element or the moved element's origin. -1 if not applicable. */
	public int getOldStartingIndex() {
		return theOldStartingIndex;
	}

	private List<T> itemsOf(List<T> batch, T single, boolean applicable) {
		if (batch != null)
			return batch;
		else if (isSingleItem && applicable && theAction != CollectionChangeAction.reset)
			return Collections.singletonList(single);
		else
			return Collections.emptyList();
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder();
		switch (theAction) {
		case add:
			str.append('[').append(theNewStartingIndex).append("]+:").append(isSingleItem ? theNewItem : theNewItems);
			break;
		case remove:
			str.append('[').append(theOldStartingIndex).append("]-:").append(isSingleItem ? theOldItem : theOldItems);
			break;
		case replace:
			str.append('[').append(theNewStartingIndex).append("]:").append(theOldItem).append("->").append(theNewItem);
			break;
		case move:
			str.append('[').append(theOldStartingIndex).append("->").append(theNewStartingIndex).append("]:").append(theNewItem);
			break;
		case reset:
			str.append("reset");
			break;
		}
		return str.toString();
	}
}
