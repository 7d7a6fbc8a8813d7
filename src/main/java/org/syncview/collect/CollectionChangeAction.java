package org.syncview.collect;

/** The kind of change reported by a {@link CollectionChangeEvent} */
public enum CollectionChangeAction {
	/** One or more elements were added to the collection */
	add,
	/** One or more elements were removed from the collection */
	remove,
	/** An element's value was replaced */
	replace,
	/** An element was moved to a different position in the collection */
	move,
	/** The collection was cleared */
	reset;
}
