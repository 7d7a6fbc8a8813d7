package org.syncview.collect;

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.function.BiConsumer;
import java.util.function.BiPredicate;

/**
 * A {@link SynchronizedViewFilter} driven by a predicate, with optional callbacks for matching and non-matching entries and for each
 * change in the view
 *
 * @param <T> The type of source values
 * @param <V> The type of projections
 */
public class PredicateViewFilter<T, V> implements SynchronizedViewFilter<T, V> {
	/**
	 * Notified of each change in a view
	 *
	 * @param <T> The type of source values
	 * @param <V> The type of projections
	 */
	@FunctionalInterface
	public interface ChangeCallback<T, V> {
		/**
		 * @param kind The kind of the change
		 * @param value The source value of the changed entry
		 * @param projection The projection of the changed entry
		 */
		void onChanged(ViewChangedKind kind, T value, V projection);
	}

	private final BiPredicate<? super T, ? super V> theMatcher;
	private final BiConsumer<? super T, ? super V> theWhenTrue;
	private final BiConsumer<? super T, ? super V> theWhenFalse;
	private final ChangeCallback<? super T, ? super V> theOnChanged;

	/**
	 * @param matcher The visibility predicate
	 * @param whenTrue Called for each attached, added or moved entry that passes the predicate (may be null)
	 * @param whenFalse Called for each attached, added or moved entry that fails the predicate (may be null)
	 * @param onChanged Called for each addition, removal or move in the view (may be null)
	 */
	public PredicateViewFilter(BiPredicate<? super T, ? super V> matcher, BiConsumer<? super T, ? super V> whenTrue,
		BiConsumer<? super T, ? super V> whenFalse, ChangeCallback<? super T, ? super V> onChanged) {
		theMatcher = checkNotNull(matcher, "matcher");
		theWhenTrue = whenTrue;
		theWhenFalse = whenFalse;
		theOnChanged = onChanged;
	}

	@Override
	public boolean isMatch(T value, V projection) {
		return theMatcher.test(value, projection);
	}

	@Override
	public void onAttach(T value, V projection) {
		match(value, projection);
	}

	@Override
	public void onAdd(T value, V projection) {
		match(value, projection);
		changed(ViewChangedKind.add, value, projection);
	}

	@Override
	public void onRemove(T value, V projection) {
		changed(ViewChangedKind.remove, value, projection);
	}

	@Override
	public void onMove(T value, V projection) {
		match(value, projection);
		changed(ViewChangedKind.move, value, projection);
	}

	private void match(T value, V projection) {
		if (theMatcher.test(value, projection)) {
			if (theWhenTrue != null)
				theWhenTrue.accept(value, projection);
		} else if (theWhenFalse != null)
			theWhenFalse.accept(value, projection);
	}

	private void changed(ViewChangedKind kind, T value, V projection) {
		if (theOnChanged != null)
			theOnChanged.onChanged(kind, value, projection);
	}

	@Override
	public String toString() {
		return "filter(" + theMatcher + ")";
	}
}
