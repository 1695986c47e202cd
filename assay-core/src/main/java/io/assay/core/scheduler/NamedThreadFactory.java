package io.assay.core.scheduler;

import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/// Gives each thread a distinct name of the form `<prefix>-<n>`.
public final class NamedThreadFactory implements ThreadFactory {

    private final AtomicInteger threadCount = new AtomicInteger();
    private final String prefix;
    private final boolean daemon;

    public NamedThreadFactory(String prefix) {
        this(prefix, false);
    }

    public NamedThreadFactory(String prefix, boolean daemon) {
        this.prefix = prefix;
        this.daemon = daemon;
    }

    @Override
    public Thread newThread(Runnable r) {
        Thread thread = Executors.defaultThreadFactory().newThread(r);
        thread.setName(prefix + "-" + threadCount.incrementAndGet());
        thread.setDaemon(daemon);
        return thread;
    }
}
