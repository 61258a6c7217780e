package exvar.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Small bounded pool of reusable instances. Callers must reset an instance before
 * freeing it; instances freed while the pool is full are dropped.
 */
public final class ObjectPool<T> {
    private static final Logger logger = LoggerFactory.getLogger(ObjectPool.class);

    public static final int DEFAULT_CAPACITY = 10;

    private final Supplier<T> factory;
    private final int capacity;
    private final Deque<T> free = new ArrayDeque<>();

    public ObjectPool(Supplier<T> factory) {
        this(factory, DEFAULT_CAPACITY);
    }

    public ObjectPool(Supplier<T> factory, int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be positive: " + capacity);
        this.factory = Objects.requireNonNull(factory, "factory");
        this.capacity = capacity;
    }

    public synchronized T allocate() {
        T item = free.poll();
        return item != null ? item : factory.get();
    }

    public synchronized void free(T item) {
        Objects.requireNonNull(item, "item");
        if (free.size() >= capacity) {
            logger.debug("Pool full ({}), dropping {}", capacity, item.getClass().getSimpleName());
            return;
        }
        free.push(item);
    }

    public synchronized int available() {
        return free.size();
    }

    public int capacity() {
        return capacity;
    }
}
