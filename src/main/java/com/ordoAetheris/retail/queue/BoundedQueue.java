package com.ordoAetheris.retail.queue;

import java.util.ArrayDeque;
import java.util.Queue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 Bounded blocking FIFO buffer: one lock, two conditions.

 put() blocks while the buffer is full, get() blocks while it is empty.
 Producers wait on notFull, consumers wait on notEmpty, so a put wakes
 only a consumer and a get wakes only a producer.

 Methods
 void put(T item) throws InterruptedException
   item == null -> IllegalArgumentException
   closed -> IllegalStateException (also when closed while waiting)
   full and not closed -> waits for space
   on success signals one waiting get()

 T get() throws InterruptedException
   empty and not closed -> waits
   empty and closed -> null (EOF)
   otherwise removes the head and signals one waiting put()

 boolean offer(T item, long timeout, TimeUnit unit) / T poll(long timeout, TimeUnit unit)
   same as put/get, but give up when the deadline passes:
   offer -> false, poll -> null

 void close()
   closed = true, wakes everybody waiting in put/get; idempotent.
   Items already accepted are still handed out by get().

 Invariants
   0 <= size <= capacity
   no lost items, no duplicates, exact FIFO order
   every read and write of the buffer happens under the lock

 size(), isEmpty(), isFull() are snapshots: the answer may be stale
 as soon as the lock is released.
 */
public class BoundedQueue<T> {

    private final Queue<T> queue;
    private final int capacity;
    private int size = 0;
    private boolean closed = false;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();

    public BoundedQueue(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0, got " + capacity);
        this.queue = new ArrayDeque<>(capacity);
        this.capacity = capacity;
    }

    public void put(T item) throws InterruptedException {
        if (item == null) throw new IllegalArgumentException("item must not be null");
        lock.lock();
        try {
            while (!closed && size >= capacity) notFull.await();
            if (closed) throw new IllegalStateException("queue is closed");
            enqueue(item);
        } finally {
            lock.unlock();
        }
    }

    public T get() throws InterruptedException {
        lock.lock();
        try {
            while (!closed && size == 0) notEmpty.await();
            if (size == 0) return null;
            return dequeue();
        } finally {
            lock.unlock();
        }
    }

    public boolean offer(T item, long timeout, TimeUnit unit) throws InterruptedException {
        if (item == null) throw new IllegalArgumentException("item must not be null");
        long nanos = unit.toNanos(timeout);
        lock.lock();
        try {
            while (!closed && size >= capacity) {
                if (nanos <= 0L) return false;
                nanos = notFull.awaitNanos(nanos);
            }
            if (closed) throw new IllegalStateException("queue is closed");
            enqueue(item);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lock();
        try {
            while (!closed && size == 0) {
                if (nanos <= 0L) return null;
                nanos = notEmpty.awaitNanos(nanos);
            }
            if (size == 0) return null;
            return dequeue();
        } finally {
            lock.unlock();
        }
    }

    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return size;
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        lock.lock();
        try {
            return size == 0;
        } finally {
            lock.unlock();
        }
    }

    public boolean isFull() {
        lock.lock();
        try {
            return size >= capacity;
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    // caller holds the lock
    private void enqueue(T item) {
        queue.offer(item);
        size++;
        notEmpty.signal();
    }

    // caller holds the lock, size > 0
    private T dequeue() {
        T result = queue.poll();
        size--;
        notFull.signal();
        return result;
    }
}
