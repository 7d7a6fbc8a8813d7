package org.syncview.collect;

/**
 * Listens to the changes of an ordered observable collection
 *
 * @param <T> The type of values in the collection
 */
@FunctionalInterface
public interface CollectionChangeListener<T> {
	/** @param event The event describing a single change that was just made to the collection */
	void onChange(CollectionChangeEvent<T> event);
}
