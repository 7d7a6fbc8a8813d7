package org.syncview.util;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkPositionIndex;
import static com.google.common.base.Preconditions.checkPositionIndexes;

import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * <p>
 * An indexed, double-ended sequence backed by a circular array. Additions and removals at either end are O(1) (amortized, when the
 * array must grow), indexed get and set are O(1), and insertion or removal in the middle shifts the shorter side of the buffer.
 * </p>
 * <p>
 * This class is not thread-safe. Iterators reflect the buffer as of their creation and fail with a
 * {@link ConcurrentModificationException} if the buffer is structurally modified while they are in use.
 * </p>
 *
 * @param <E> The type of element in the buffer
 */
public class RingBuffer<E> implements Iterable<E> {
	private static final int DEFAULT_CAPACITY = 8;

	private Object[] theBuffer;
	private int theMask;
	private int theHead;
	private int theSize;
	private int theModCount;

	/** Creates an empty buffer */
	public RingBuffer() {
		this(DEFAULT_CAPACITY);
	}

	/** @param initialCapacity The number of elements the buffer can hold before its backing array must grow */
	public RingBuffer(int initialCapacity) {
		checkArgument(initialCapacity > 0, "Capacity must be positive: %s", initialCapacity);
		int capacity = 1;
		while (capacity < initialCapacity)
			capacity <<= 1;
		theBuffer = new Object[capacity];
		theMask = capacity - 1;
	}

	/** @param values The initial content of the buffer, in order */
	public RingBuffer(Iterable<? extends E> values) {
		this();
		for (E value : values)
			addLast(value);
	}

	/** @return The number of elements in this buffer */
	public int size() {
		return theSize;
	}

	/** @return Whether this buffer has no elements */
	public boolean isEmpty() {
		return theSize == 0;
	}

	/**
	 * @param index The index of the element to get
	 * @return The element at the given index
	 * @throws IndexOutOfBoundsException If <code>index&lt;0</code> or <code>index&gt;=size()</code>
	 */
	public E get(int index) {
		checkElementIndex(index, theSize);
		return elementAt(index);
	}

	/**
	 * @param index The index of the element to replace
	 * @param value The new value for the element
	 * @return The previous value at the index
	 * @throws IndexOutOfBoundsException If <code>index&lt;0</code> or <code>index&gt;=size()</code>
	 */
	public E set(int index, E value) {
		checkElementIndex(index, theSize);
		int phys = physical(index);
		E old = (E) theBuffer[phys];
		theBuffer[phys] = value;
		return old;
	}

	/** @param value The value to add to the beginning of this buffer */
	public void addFirst(E value) {
		ensureCapacity(theSize + 1);
		theHead = (theHead - 1) & theMask;
		theBuffer[theHead] = value;
		theSize++;
		theModCount++;
	}

	/** @param value The value to add to the end of this buffer */
	public void addLast(E value) {
		ensureCapacity(theSize + 1);
		theBuffer[physical(theSize)] = value;
		theSize++;
		theModCount++;
	}

	/**
	 * @return The value that was removed from the beginning of this buffer
	 * @throws NoSuchElementException If this buffer is empty
	 */
	public E removeFirst() {
		if (theSize == 0)
			throw new NoSuchElementException("Buffer is empty");
		E value = (E) theBuffer[theHead];
		theBuffer[theHead] = null;
		theHead = (theHead + 1) & theMask;
		theSize--;
		theModCount++;
		return value;
	}

	/**
	 * @return The value that was removed from the end of this buffer
	 * @throws NoSuchElementException If this buffer is empty
	 */
	public E removeLast() {
		if (theSize == 0)
			throw new NoSuchElementException("Buffer is empty");
		int phys = physical(theSize - 1);
		E value = (E) theBuffer[phys];
		theBuffer[phys] = null;
		theSize--;
		theModCount++;
		return value;
	}

	/**
	 * @param index The index of the element to remove
	 * @return The removed value
	 * @throws IndexOutOfBoundsException If <code>index&lt;0</code> or <code>index&gt;=size()</code>
	 */
	public E removeAt(int index) {
		checkElementIndex(index, theSize);
		if (index == 0)
			return removeFirst();
		else if (index == theSize - 1)
			return removeLast();
		E value = elementAt(index);
		if (index < theSize / 2) {
			// Shift the front half toward the back
			for (int i = index; i > 0; i--)
				theBuffer[physical(i)] = theBuffer[physical(i - 1)];
			theBuffer[theHead] = null;
			theHead = (theHead + 1) & theMask;
		} else {
			for (int i = index; i < theSize - 1; i++)
				theBuffer[physical(i)] = theBuffer[physical(i + 1)];
			theBuffer[physical(theSize - 1)] = null;
		}
		theSize--;
		theModCount++;
		return value;
	}

	/**
	 * Removes a contiguous range of elements
	 *
	 * @param start The index of the first element to remove
	 * @param length The number of elements to remove
	 * @throws IllegalArgumentException If <code>length&lt;0</code>
	 * @throws IndexOutOfBoundsException If the range is not within this buffer
	 */
	public void removeRange(int start, int length) {
		checkArgument(length >= 0, "Negative length: %s", length);
		checkPositionIndexes(start, start + length, theSize);
		if (length == 0)
			return;
		if (start == 0) {
			for (int i = 0; i < length; i++)
				theBuffer[physical(i)] = null;
			theHead = (theHead + length) & theMask;
		} else {
			int tail = theSize - start - length;
			for (int i = 0; i < tail; i++)
				theBuffer[physical(start + i)] = theBuffer[physical(start + length + i)];
			for (int i = theSize - length; i < theSize; i++)
				theBuffer[physical(i)] = null;
		}
		theSize -= length;
		theModCount++;
	}

	/**
	 * @param index The index to insert the value at
	 * @param value The value to insert
	 * @throws IndexOutOfBoundsException If <code>index&lt;0</code> or <code>index&gt;size()</code>
	 */
	public void insert(int index, E value) {
		checkPositionIndex(index, theSize);
		if (index == 0) {
			addFirst(value);
			return;
		} else if (index == theSize) {
			addLast(value);
			return;
		}
		ensureCapacity(theSize + 1);
		if (index < theSize / 2) {
			theHead = (theHead - 1) & theMask;
			for (int i = 0; i < index; i++)
				theBuffer[physical(i)] = theBuffer[physical(i + 1)];
		} else {
			for (int i = theSize; i > index; i--)
				theBuffer[physical(i)] = theBuffer[physical(i - 1)];
		}
		theBuffer[physical(index)] = value;
		theSize++;
		theModCount++;
	}

	/** Removes all elements from this buffer */
	public void clear() {
		for (int i = 0; i < theSize; i++)
			theBuffer[physical(i)] = null;
		theHead = 0;
		theSize = 0;
		theModCount++;
	}

	/**
	 * @param value The value to search for
	 * @return The index of the first element equal to the value, or -1 if there is none
	 */
	public int indexOf(Object value) {
		for (int i = 0; i < theSize; i++) {
			if (Objects.equals(elementAt(i), value))
				return i;
		}
		return -1;
	}

	/** @return A new list containing this buffer's elements, in order */
	public List<E> toList() {
		List<E> list = new ArrayList<>(theSize);
		for (int i = 0; i < theSize; i++)
			list.add(elementAt(i));
		return list;
	}

	@Override
	public Iterator<E> iterator() {
		return new BufferIterator(true);
	}

	/** @return An iterable that traverses this buffer from last to first each time it is iterated */
	public Iterable<E> reversed() {
		return () -> new BufferIterator(false);
	}

	@Override
	public String toString() {
		return toList().toString();
	}

	private E elementAt(int index) {
		return (E) theBuffer[physical(index)];
	}

	private int physical(int index) {
		return (theHead + index) & theMask;
	}

	private void ensureCapacity(int capacity) {
		if (capacity <= theBuffer.length)
			return;
		int newLength = theBuffer.length;
		while (newLength < capacity)
			newLength <<= 1;
		Object[] newBuffer = new Object[newLength];
		for (int i = 0; i < theSize; i++)
			newBuffer[i] = theBuffer[physical(i)];
		theBuffer = newBuffer;
		theMask = newLength - 1;
		theHead = 0;
	}

	private class BufferIterator implements Iterator<E> {
		private final boolean isForward;
		private final int theExpectedModCount;
		private int theRemaining;

		BufferIterator(boolean forward) {
			isForward = forward;
			theExpectedModCount = theModCount;
			theRemaining = theSize;
		}

		@Override
		public boolean hasNext() {
			return theRemaining > 0;
		}

		@Override
		public E next() {
			if (theModCount != theExpectedModCount)
				throw new ConcurrentModificationException();
			if (theRemaining == 0)
				throw new NoSuchElementException();
			int index = isForward ? theSize - theRemaining : theRemaining - 1;
			theRemaining--;
			return elementAt(index);
		}
	}
}
