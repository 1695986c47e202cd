package io.assay.core.lifecycle;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/// Counts the scheduled cases of each class so that class cleanup can run right
/// after the last one finishes.
public final class ClassCleanupTracker {

    private final Map<String, AtomicInteger> remaining = new ConcurrentHashMap<>();

    /// Records one more scheduled case of `className`.
    ///
    /// @param className test class name, not null
    public void expect(String className) {
        remaining.computeIfAbsent(className, k -> new AtomicInteger()).incrementAndGet();
    }

    /// Records that one case of `className` finished.
    ///
    /// @param className test class name, not null
    /// @return true if it was the last scheduled case of that class
    public boolean complete(String className) {
        AtomicInteger count = remaining.get(className);
        return count != null && count.decrementAndGet() == 0;
    }

    public int remaining(String className) {
        AtomicInteger count = remaining.get(className);
        return count != null ? Math.max(count.get(), 0) : 0;
    }
}
