package org.syncview.collect;

/** The kind of mirror change reported to a {@link PredicateViewFilter}'s change callback */
public enum ViewChangedKind {
	/** An entry was added to the view */
	add,
	/** An entry was removed from the view */
	remove,
	/** An entry was moved within the view */
	move;
}
