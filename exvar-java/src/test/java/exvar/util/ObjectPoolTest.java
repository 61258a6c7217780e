package exvar.util;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class ObjectPoolTest {

    @Test
    void allocate_creates_when_empty() {
        AtomicInteger created = new AtomicInteger();
        var pool = new ObjectPool<>(() -> new StringBuilder("#" + created.incrementAndGet()));

        var a = pool.allocate();
        var b = pool.allocate();

        assertNotSame(a, b);
        assertEquals(2, created.get());
        assertEquals(ObjectPool.DEFAULT_CAPACITY, pool.capacity());
    }

    @Test
    void freed_instance_is_reused() {
        var pool = new ObjectPool<>(Object::new);
        var a = pool.allocate();
        pool.free(a);

        assertEquals(1, pool.available());
        assertSame(a, pool.allocate());
        assertEquals(0, pool.available());
    }

    @Test
    void full_pool_drops_extra_instances() {
        var pool = new ObjectPool<>(Object::new, 2);
        pool.free(new Object());
        pool.free(new Object());
        pool.free(new Object());

        assertEquals(2, pool.available());
    }

    @Test
    void capacity_must_be_positive() {
        assertThrows(IllegalArgumentException.class, () -> new ObjectPool<>(Object::new, 0));
    }

    @Test
    void free_rejects_null() {
        var pool = new ObjectPool<>(Object::new);
        assertThrows(NullPointerException.class, () -> pool.free(null));
    }
}
