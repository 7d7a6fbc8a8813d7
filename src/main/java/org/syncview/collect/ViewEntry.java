package org.syncview.collect;

import java.util.Objects;

/**
 * An element of a {@link SynchronizedView}: a value from the source collection paired with the projection computed from it when it was
 * added
 *
 * @param <T> The type of the source value
 * @param <V> The type of the projection
 */
public final class ViewEntry<T, V> {
	private final T theValue;
	private final V theProjection;

	/**
	 * @param value The source value
	 * @param projection The projection of the value
	 */
	public ViewEntry(T value, V projection) {
		theValue = value;
		theProjection = projection;
	}

	/** @return The source value */
	public T getValue() {
		return theValue;
	}

	/** @return The projection computed from the value */
	public V getProjection() {
		return theProjection;
	}

	@Override
	public boolean equals(Object o) {
		if (o == this)
			return true;
		if (!(o instanceof ViewEntry))
			return false;
		ViewEntry<?, ?> entry = (ViewEntry<?, ?>) o;
		return Objects.equals(theValue, entry.theValue) && Objects.equals(theProjection, entry.theProjection);
	}

	@Override
	public int hashCode() {
		return Objects.hash(theValue, theProjection);
	}

	@Override
	public String toString() {
		return "(" + theValue + ", " + theProjection + ")";
	}
}
