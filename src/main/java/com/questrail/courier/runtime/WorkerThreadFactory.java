package com.questrail.courier.runtime;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Names worker threads {@code <prefix>-<n>} and makes them daemons, so an
 * application that forgets to close its {@link Messaging} can still exit.
 */
final class WorkerThreadFactory implements ThreadFactory
{
    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger();

    WorkerThreadFactory(String prefix)
    {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    @Override
    public Thread newThread(Runnable task)
    {
        Thread t = new Thread(task, prefix + "-" + counter.incrementAndGet());
        t.setDaemon(true);
        return t;
    }
}
