package org.syncview.collect;

import java.util.function.BiConsumer;
import java.util.function.BiPredicate;

/**
 * <p>
 * A visibility and notification policy attached to a {@link SynchronizedView}. A view has exactly one active filter at a time;
 * {@link #none()} is active when no other filter has been attached.
 * </p>
 * <p>
 * All hooks are called under the view's lock, with the source value and the projection computed from it when it was added to the view.
 * Hooks should not block and should not attempt to lock the view's source.
 * </p>
 *
 * @param <T> The type of source values
 * @param <V> The type of projections
 */
public interface SynchronizedViewFilter<T, V> {
	/**
	 * @param value The source value
	 * @param projection The value's projection
	 * @return Whether the entry should be visible when the view is enumerated
	 */
	boolean isMatch(T value, V projection);

	/**
	 * Called once for each entry already in a view when this filter is attached to it, in the view's order
	 *
	 * @param value The source value
	 * @param projection The value's projection
	 */
	void onAttach(T value, V projection);

	/**
	 * Called after an entry is added to the view
	 *
	 * @param value The source value
	 * @param projection The value's projection
	 */
	void onAdd(T value, V projection);

	/**
	 * Called when an entry is removed from the view
	 *
	 * @param value The source value
	 * @param projection The value's projection
	 */
	void onRemove(T value, V projection);

	/**
	 * Called after an entry is moved within the view
	 *
	 * @param value The source value
	 * @param projection The value's projection
	 */
	void onMove(T value, V projection);

	/** @return Whether this is the {@link #none() no-op} filter */
	default boolean isNullFilter() {
		return false;
	}

	/** @return The filter that matches everything and does nothing when notified */
	static <T, V> SynchronizedViewFilter<T, V> none() {
		return (SynchronizedViewFilter<T, V>) (SynchronizedViewFilter<?, ?>) NullFilter.INSTANCE;
	}

	/**
	 * @param isMatch The visibility predicate
	 * @return A filter that shows only the entries passing the predicate
	 */
	static <T, V> SynchronizedViewFilter<T, V> create(BiPredicate<? super T, ? super V> isMatch) {
		return new PredicateViewFilter<>(isMatch, null, null, null);
	}

	/**
	 * @param isMatch The visibility predicate
	 * @param whenTrue Called for each attached, added or moved entry that passes the predicate (may be null)
	 * @param whenFalse Called for each attached, added or moved entry that fails the predicate (may be null)
	 * @return A filter that shows only the entries passing the predicate
	 */
	static <T, V> SynchronizedViewFilter<T, V> create(BiPredicate<? super T, ? super V> isMatch, BiConsumer<? super T, ? super V> whenTrue,
		BiConsumer<? super T, ? super V> whenFalse) {
		return new PredicateViewFilter<>(isMatch, whenTrue, whenFalse, null);
	}

	/**
	 * @param isMatch The visibility predicate
	 * @param whenTrue Called for each attached, added or moved entry that passes the predicate (may be null)
	 * @param whenFalse Called for each attached, added or moved entry that fails the predicate (may be null)
	 * @param onChanged Called for each addition, removal or move in the view, after the match callback (may be null)
	 * @return A filter that shows only the entries passing the predicate
	 */
	static <T, V> SynchronizedViewFilter<T, V> create(BiPredicate<? super T, ? super V> isMatch, BiConsumer<? super T, ? super V> whenTrue,
		BiConsumer<? super T, ? super V> whenFalse, PredicateViewFilter.ChangeCallback<? super T, ? super V> onChanged) {
		return new PredicateViewFilter<>(isMatch, whenTrue, whenFalse, onChanged);
	}

	/** Implements {@link SynchronizedViewFilter#none()} */
	class NullFilter implements SynchronizedViewFilter<Object, Object> {
		static final NullFilter INSTANCE = new NullFilter();

		private NullFilter() {
		}

		@Override
		public boolean isMatch(Object value, Object projection) {
			return true;
		}

		@Override
		public void onAttach(Object value, Object projection) {
		}

		@Override
		public void onAdd(Object value, Object projection) {
		}

		@Override
		public void onRemove(Object value, Object projection) {
		}

		@Override
		public void onMove(Object value, Object projection) {
		}

		@Override
		public boolean isNullFilter() {
			return true;
		}

		@Override
		public String toString() {
			return "none";
		}
	}
}
