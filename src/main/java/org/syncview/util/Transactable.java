package org.syncview.util;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;

/** Represents an object whose inspection and modification may be guarded by a lock held across several operations */
public interface Transactable {
	/**
	 * Locks this object for reading or writing until the returned transaction is closed.
	 *
	 * @param write Whether to lock this object for writing (prevents all access to the object outside of this thread) or just for
	 *        reading (prevents all modification to this object, this thread included).
	 * @param cause An object that may have caused the set of operations to come. May be null.
	 * @return The transaction to close when calling code is finished accessing or modifying this object
	 */
	Transaction lock(boolean write, Object cause);

	/**
	 * @param lock The lock to acquire
	 * @param write Whether to acquire the write or the read lock
	 * @return A transaction that releases the lock exactly once when closed
	 */
	static Transaction lock(ReadWriteLock lock, boolean write) {
		Lock held = write ? lock.writeLock() : lock.readLock();
		held.lock();
		return new Transaction() {
			private volatile boolean hasRun;

			@Override
			public void close() {
				if (hasRun)
					return;
				hasRun = true;
				held.unlock();
			}
		};
	}
}
