package org.syncview.collect;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import org.junit.Test;
import org.syncview.util.Transaction;

/** Tests {@link SynchronizedView}s of {@link ObservableRingBuffer}s */
public class SynchronizedViewTest {
	/** Tests that a forward view's entries always match its source through random modifications */
	@Test
	public void testParity() {
		testParity(false);
	}

	/** Tests that a reverse view's entries always match the reverse of its source through random modifications */
	@Test
	public void testReverseParity() {
		testParity(true);
	}

	private static void testParity(boolean reverse) {
		Random random = new Random(reverse ? 7 : 42);
		ObservableRingBuffer<Integer> source = new ObservableRingBuffer<>(Arrays.asList(1, 2, 3));
		SynchronizedView<Integer, String> view = source.createView(i -> "#" + i, reverse);
		checkParity(source, view);
		int next = 10;
		for (int i = 0; i < 3000; i++) {
			int size = source.size();
			switch (random.nextInt(size == 0 ? 3 : 10)) {
			case 0:
				source.addFirst(next++);
				break;
			case 1:
				source.addLast(next++);
				break;
			case 2: {
				List<Integer> batch = new ArrayList<>();
				for (int j = random.nextInt(4); j >= 0; j--)
					batch.add(next++);
				source.addLastRange(batch);
				break;
			}
			case 3:
				source.removeFirst();
				break;
			case 4:
				source.removeLast();
				break;
			case 5:
				source.removeAt(random.nextInt(size));
				break;
			case 6: {
				int start = random.nextInt(size);
				source.removeRange(start, random.nextInt(size - start + 1));
				break;
			}
			case 7:
				source.set(random.nextInt(size), next++);
				break;
			case 8:
				source.move(random.nextInt(size), random.nextInt(size));
				break;
			default:
				if (random.nextInt(20) == 0)
					source.clear();
				break;
			}
			checkParity(source, view);
		}
	}

	private static void checkParity(ObservableRingBuffer<Integer> source, SynchronizedView<Integer, String> view) {
		List<Integer> expected = source.toList();
		if (view.isReverse())
			Collections.reverse(expected);
		assertEquals(expected.size(), view.size());
		List<Integer> values = new ArrayList<>();
		for (ViewEntry<Integer, String> entry : view) {
			values.add(entry.getValue());
			assertEquals("#" + entry.getValue(), entry.getProjection());
		}
		assertEquals(expected, values);
		for (int i = 0; i < expected.size(); i++)
			assertEquals(expected.get(i), view.get(i).getValue());
	}

	/** Tests that each projection is computed exactly once, when its value is added, and never recomputed */
	@Test
	public void testProjectionStability() {
		AtomicInteger calls = new AtomicInteger();
		ObservableRingBuffer<String> source = new ObservableRingBuffer<>(Arrays.asList("a", "b"));
		SynchronizedView<String, String> view = source.createView(s -> s + calls.incrementAndGet());
		assertEquals(Arrays.asList("a1", "b2"), view.toList());
		source.addLast("c");
		source.addFirst("z");
		source.move(0, 3);
		source.removeAt(0);
		assertEquals(Arrays.asList("b2", "c3", "z4"), view.toList());
		source.set(0, "b");
		assertEquals(Arrays.asList("b5", "c3", "z4"), view.toList());
		assertEquals(5, calls.get());
	}

	/** Tests the placement of additions at index 0 of empty and non-empty views */
	@Test
	public void testFrontBackAddition() {
		ObservableRingBuffer<String> source = new ObservableRingBuffer<>();
		SynchronizedView<String, String> view = source.createView(String::toUpperCase);
		source.addFirst("b"); // Treated as an append
		assertEquals(1, view.size());
		assertEquals("B", view.get(0).getProjection());
		source.addFirst("a");
		assertEquals(Arrays.asList("A", "B"), view.toList());
		source.addLast("c");
		source.addLastRange(Arrays.asList("d", "e"));
		assertEquals(Arrays.asList("A", "B", "C", "D", "E"), view.toList());
	}

	/** Tests that the filter is notified of each entry of a batch removal before the entries are removed */
	@Test
	public void testBatchRemoveNotifiesFirst() {
		List<Integer> values = new ArrayList<>();
		for (int i = 0; i < 10; i++)
			values.add(i);
		ObservableRingBuffer<Integer> source = new ObservableRingBuffer<>(values);
		SynchronizedView<Integer, Integer> view = source.createView(i -> i * 10);
		RecordingFilter<Integer, Integer> filter = new RecordingFilter<Integer, Integer>().watching(view);
		view.attachFilter(filter);
		filter.calls.clear();
		filter.sizes.clear();

		source.removeRange(2, 3);
		assertEquals(Arrays.asList("remove:2:20", "remove:3:30", "remove:4:40"), filter.calls);
		assertEquals(Arrays.asList(10, 10, 10), filter.sizes);
		assertEquals(7, view.size());

		filter.calls.clear();
		filter.sizes.clear();
		source.removeAt(1);
		assertEquals(Arrays.asList("remove:1:10"), filter.calls);
		assertEquals(Arrays.asList(6), filter.sizes);
	}

	/** Tests that a replacement notifies the filter of the removal of the old entry, then the addition of the new one */
	@Test
	public void testReplace() {
		ObservableRingBuffer<String> source = new ObservableRingBuffer<>(Arrays.asList("a", "b", "c", "d", "e"));
		SynchronizedView<String, Integer> view = source.createView(String::length);
		RecordingFilter<String, Integer> filter = new RecordingFilter<>();
		view.attachFilter(filter);
		filter.calls.clear();

		source.set(3, "dddd");
		assertEquals(Arrays.asList("remove:d:1", "add:dddd:4"), filter.calls);
		assertEquals(new ViewEntry<>("dddd", 4), view.get(3));
		assertEquals(5, view.size());
	}

	/** Tests that a move repositions the entry, then notifies the filter once */
	@Test
	public void testMove() {
		ObservableRingBuffer<String> source = new ObservableRingBuffer<>(Arrays.asList("a", "b", "c", "d"));
		SynchronizedView<String, String> view = source.createView(s -> s);
		RecordingFilter<String, String> filter = new RecordingFilter<String, String>().watching(view);
		view.attachFilter(filter);
		filter.calls.clear();

		source.move(3, 1);
		assertEquals(Arrays.asList("move:d:d"), filter.calls);
		assertEquals(Arrays.asList("a", "d", "b", "c"), view.toList());
		source.move(0, 3);
		assertEquals(Arrays.asList("d", "b", "c", "a"), view.toList());
	}

	/** Tests that clearing the source skips removal notifications only for the no-op filter */
	@Test
	public void testReset() {
		ObservableRingBuffer<String> source = new ObservableRingBuffer<>(Arrays.asList("a", "b", "c", "d", "e"));
		SynchronizedView<String, String> view = source.createView(s -> s);
		RecordingFilter<String, String> filter = new RecordingFilter<>();
		view.attachFilter(filter);
		filter.calls.clear();
		source.clear();
		assertEquals(Arrays.asList("remove:a:a", "remove:b:b", "remove:c:c", "remove:d:d", "remove:e:e"), filter.calls);
		assertEquals(0, view.size());

		// A filter claiming to be the null filter is not notified
		source.addLastRange(Arrays.asList("a", "b", "c", "d", "e"));
		RecordingFilter<String, String> nullish = new RecordingFilter<String, String>() {
			@Override
			public boolean isNullFilter() {
				return true;
			}
		};
		view.attachFilter(nullish);
		nullish.calls.clear();
		source.clear();
		assertTrue(nullish.calls.isEmpty());
		assertEquals(0, view.size());

		view.resetFilter(null);
		source.addLast("x");
		source.clear();
		assertEquals(0, view.size());
		assertTrue(view.getFilter().isNullFilter());
	}

	/** Tests the order of reverse enumeration */
	@Test
	public void testReverseEnumeration() {
		ObservableRingBuffer<String> source = new ObservableRingBuffer<>(Arrays.asList("A", "B", "C"));
		SynchronizedView<String, String> view = source.createView(s -> s, true);
		assertTrue(view.isReverse());
		assertEquals(Arrays.asList("C", "B", "A"), view.toList());
		source.addLast("D");
		assertEquals(Arrays.asList("D", "C", "B", "A"), view.toList());
		assertEquals("D", view.get(0).getValue());
		assertEquals(Arrays.asList("D", "C", "B", "A"), view.stream().map(ViewEntry::getValue).collect(Collectors.toList()));
	}

	/** Tests that an iterator is a snapshot and that each new iteration reflects the view at that time */
	@Test
	public void testIterationSnapshot() {
		ObservableRingBuffer<String> source = new ObservableRingBuffer<>(Arrays.asList("a", "b"));
		SynchronizedView<String, String> view = source.createView(s -> s);
		SynchronizedViewIterator<String, String> iter = view.iterator();
		source.addLast("c");
		source.removeFirst();
		assertEquals(2, iter.remaining());
		assertEquals("a", iter.next().getValue());
		assertEquals("b", iter.next().getValue());
		assertFalse(iter.hasNext());
		assertEquals(Arrays.asList("b", "c"), view.toList());
	}

	/** Tests attaching and resetting a filter */
	@Test
	public void testFilter() {
		ObservableRingBuffer<Integer> source = new ObservableRingBuffer<>(Arrays.asList(1, 2, 3, 4));
		SynchronizedView<Integer, String> view = source.createView(i -> "v" + i);
		assertTrue(view.getFilter().isNullFilter());
		RecordingFilter<Integer, String> filter = new RecordingFilter<>((v, p) -> v % 2 == 0);
		view.attachFilter(filter);
		assertSame(filter, view.getFilter());
		assertEquals(Arrays.asList("attach:1:v1", "attach:2:v2", "attach:3:v3", "attach:4:v4"), filter.calls);
		assertEquals(Arrays.asList("v2", "v4"), view.toList());
		assertEquals(4, view.size());

		source.addLast(6);
		source.addFirst(0);
		assertEquals(Arrays.asList("v0", "v2", "v4", "v6"), view.toList());
		assertEquals("add:6:v6", filter.calls.get(4));
		assertEquals("add:0:v0", filter.calls.get(5));

		List<String> reset = new ArrayList<>();
		view.resetFilter((v, p) -> reset.add(p));
		assertEquals(Arrays.asList("v0", "v1", "v2", "v3", "v4", "v6"), reset);
		assertEquals(reset, view.toList());
		assertNotSame(filter, view.getFilter());
		int calls = filter.calls.size();
		source.addLast(7);
		assertEquals(calls, filter.calls.size());

		try {
			view.attachFilter(null);
			fail("Expected an exception");
		} catch (NullPointerException e) {
		}
	}

	/** Tests the predicate filter's callbacks */
	@Test
	public void testPredicateFilter() {
		ObservableRingBuffer<Integer> source = new ObservableRingBuffer<>(Arrays.asList(1, 2));
		SynchronizedView<Integer, Integer> view = source.createView(i -> -i);
		List<String> calls = new ArrayList<>();
		view.attachFilter(SynchronizedViewFilter.create((v, p) -> v > 1, //
			(v, p) -> calls.add("true:" + v), (v, p) -> calls.add("false:" + v), //
			(kind, v, p) -> calls.add(kind + ":" + v)));
		assertEquals(Arrays.asList("false:1", "true:2"), calls);
		calls.clear();
		source.addLast(3);
		source.move(2, 0);
		source.removeAt(1);
		assertEquals(Arrays.asList("true:3", "add:3", "true:3", "move:3", "remove:1"), calls);
		assertEquals(Arrays.asList(-3, -2), view.toList());

		view.attachFilter(SynchronizedViewFilter.create((v, p) -> p < -2));
		assertEquals(Arrays.asList(-3), view.toList());
	}

	/** Tests that the view forwards each event, then its action, after it has applied the change */
	@Test
	public void testNotifications() {
		ObservableRingBuffer<String> source = new ObservableRingBuffer<>(Arrays.asList("a"));
		SynchronizedView<String, String> view = source.createView(s -> s);
		List<Object> received = new ArrayList<>();
		List<CollectionChangeEvent<String>> sourceEvents = new ArrayList<>();
		source.subscribe(sourceEvents::add);
		view.onStateChanged(action -> received.add(action));
		view.onChange(evt -> received.add(evt));

		source.addLast("b");
		source.clear();
		assertEquals(2, sourceEvents.size());
		assertEquals(Arrays.asList(sourceEvents.get(0), CollectionChangeAction.add, sourceEvents.get(1), CollectionChangeAction.reset),
			received);
	}

	/** Tests that an exception from a filter hook propagates to the modifier of the source without leaving anything locked */
	@Test
	public void testHookException() {
		ObservableRingBuffer<String> source = new ObservableRingBuffer<>();
		SynchronizedView<String, String> view = source.createView(s -> s);
		view.attachFilter(SynchronizedViewFilter.create((v, p) -> true, (v, p) -> {
			if (v.equals("bad"))
				throw new IllegalStateException(v);
		}, null));
		try {
			source.addLast("bad");
			fail("Expected an exception");
		} catch (IllegalStateException e) {
			assertEquals("bad", e.getMessage());
		}
		// The mirror was already updated; no rollback
		assertEquals(1, view.size());
		source.addLast("good");
		assertEquals(Arrays.asList("bad", "good"), view.toList());
	}

	/** Tests that disposal stops tracking the source and may be repeated safely */
	@Test
	public void testDispose() {
		ObservableRingBuffer<String> source = new ObservableRingBuffer<>(Arrays.asList("a", "b"));
		SynchronizedView<String, String> view = source.createView(s -> s);
		SynchronizedView<String, String> other = source.createView(s -> s);
		assertEquals(2, source.getListenerCount());

		view.dispose();
		assertTrue(view.isDisposed());
		assertEquals(1, source.getListenerCount());
		view.dispose();
		view.close();
		assertEquals(1, source.getListenerCount());

		source.addLast("c");
		assertEquals(2, view.size());
		assertEquals(3, other.size());

		try (SynchronizedView<String, String> closing = source.createView(s -> s)) {
			assertEquals(2, source.getListenerCount());
			assertFalse(closing.isDisposed());
		}
		assertEquals(1, source.getListenerCount());
	}

	/** Tests that a view created by a source listener during a modification starts from the modified state without a duplicate */
	@Test
	public void testCreateDuringEvent() {
		ObservableRingBuffer<String> source = new ObservableRingBuffer<>(Arrays.asList("a"));
		List<SynchronizedView<String, String>> created = new ArrayList<>();
		source.subscribe(evt -> {
			if (created.isEmpty())
				created.add(source.createView(s -> s));
		});
		source.addLast("b");
		assertEquals(Arrays.asList("a", "b"), created.get(0).toList());
		source.addLast("c");
		assertEquals(Arrays.asList("a", "b", "c"), created.get(0).toList());
		Iterator<ViewEntry<String, String>> iter = created.get(0).iterator();
		assertEquals(new ViewEntry<>("a", "a"), iter.next());
	}

	/** Tests that a view may be created and used by a thread already holding the source's read lock */
	@Test(timeout = 10_000)
	public void testCreateUnderSourceReadLock() {
		ObservableRingBuffer<String> source = new ObservableRingBuffer<>(Arrays.asList("a", "b"));
		SynchronizedView<String, String> view;
		try (Transaction t = source.lock(false, null)) {
			view = source.createView(String::toUpperCase);
			assertEquals(2, view.size());
			assertEquals(Arrays.asList("A", "B"), view.toList());
		}
		source.addLast("c");
		assertEquals(Arrays.asList("A", "B", "C"), view.toList());
		view.dispose();
	}
}
