package tech.yump.secretsync.scheduler;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Delay queue of object keys ordered by due time, with single-flight semantics:
 * <ul>
 *   <li>a key is queued at most once; re-adding keeps the earlier due time;</li>
 *   <li>a key handed out by {@link #take()} is not handed out again until {@link #done(Object)};</li>
 *   <li>adds for a key in flight are coalesced and re-queued by {@link #done(Object)}.</li>
 * </ul>
 */
public class WorkQueue<K> {

    private record Entry<K>(K key, long due, long seq) {}

    private static final Comparator<Entry<?>> ORDER = Comparator
            .<Entry<?>>comparingLong(Entry::due)
            .thenComparingLong(Entry::seq);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final PriorityQueue<Entry<K>> queue = new PriorityQueue<>(ORDER);
    private final Map<K, Entry<K>> scheduled = new HashMap<>();
    private final Set<K> processing = new HashSet<>();
    private final Map<K, Long> dirty = new HashMap<>();
    private long sequence;
    private boolean shutDown;

    public void add(K key) {
        addAfter(key, Duration.ZERO);
    }

    public void addAfter(K key, Duration delay) {
        long due = System.nanoTime() + Math.max(0, delay.toNanos());
        lock.lock();
        try {
            if (shutDown) {
                return;
            }
            if (processing.contains(key)) {
                dirty.merge(key, due, WorkQueue::earlier);
                return;
            }
            enqueue(key, due);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until a key is due and marks it in flight.
     *
     * @return the key, or {@code null} once the queue is shut down
     */
    @Nullable
    public K take() throws InterruptedException {
        lock.lock();
        try {
            while (true) {
                if (shutDown) {
                    return null;
                }
                Entry<K> head = queue.peek();
                if (head == null) {
                    changed.await();
                    continue;
                }
                long wait = head.due() - System.nanoTime();
                if (wait <= 0) {
                    queue.poll();
                    scheduled.remove(head.key());
                    processing.add(head.key());
                    return head.key();
                }
                changed.awaitNanos(wait);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases a key taken by {@link #take()}, re-queuing it if it was added meanwhile.
     */
    public void done(K key) {
        lock.lock();
        try {
            processing.remove(key);
            Long due = dirty.remove(key);
            if (due != null && !shutDown) {
                enqueue(key, due);
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isQueued(K key) {
        lock.lock();
        try {
            return scheduled.containsKey(key) || dirty.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    public boolean isProcessing(K key) {
        lock.lock();
        try {
            return processing.contains(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remaining delay of a queued key, {@code null} when the key is not queued.
     */
    @Nullable
    public Duration delayOf(K key) {
        lock.lock();
        try {
            Entry<K> entry = scheduled.get(key);
            if (entry == null) {
                return null;
            }
            return Duration.ofNanos(Math.max(0, entry.due() - System.nanoTime()));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wakes up all waiting takers, which then return {@code null}. Further adds are ignored.
     */
    public void shutDown() {
        lock.lock();
        try {
            shutDown = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void enqueue(K key, long due) {
        Entry<K> existing = scheduled.get(key);
        if (existing != null) {
            if (existing.due() - due <= 0) {
                return;
            }
            queue.remove(existing);
        }
        Entry<K> entry = new Entry<>(key, due, sequence++);
        scheduled.put(key, entry);
        queue.add(entry);
        changed.signalAll();
    }

    private static Long earlier(Long a, Long b) {
        return a - b <= 0 ? a : b;
    }
}
