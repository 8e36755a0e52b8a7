package io.macroq.world;

import io.macroq.error.WorldAbortedException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

public final class Universe {
    public static final String UNIVERSE_ID = "universe";

    private final int size;
    private final ConcurrentMap<String, GroupContext> contexts;
    private final List<Runnable> abortHooks;
    private final AtomicBoolean started;
    private final AtomicBoolean aborted;

    private Universe(int size) {
        this.size = size;
        this.contexts = new ConcurrentHashMap<>();
        this.abortHooks = new CopyOnWriteArrayList<>();
        this.started = new AtomicBoolean(false);
        this.aborted = new AtomicBoolean(false);
    }

    public static Universe of(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("universe needs at least one process, got " + size);
        }
        return new Universe(size);
    }

    public int size() {
        return size;
    }

    public boolean aborted() {
        return aborted.get();
    }

    public void onAbort(Runnable hook) {
        abortHooks.add(hook);
        if (aborted.get()) {
            hook.run();
        }
    }

    public <R> List<R> run(ProcessBody<R> body) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("universe already ran");
        }
        int[] ranks = new int[size];
        for (int i = 0; i < size; i++) {
            ranks[i] = i;
        }
        GroupContext universeContext = context(UNIVERSE_ID, ranks);

        ExecutorService pool = Executors.newFixedThreadPool(size, processThreads());
        ExecutorCompletionService<R> completion = new ExecutorCompletionService<>(pool);
        List<Future<R>> futures = new ArrayList<>(size);
        try {
            for (int rank = 0; rank < size; rank++) {
                World world = new World(this, universeContext, rank);
                futures.add(completion.submit(() -> body.run(world)));
            }
            Throwable first = null;
            int firstRank = -1;
            for (int i = 0; i < size; i++) {
                Future<R> done = completion.take();
                try {
                    done.get();
                } catch (CancellationException ignored) {
                    // cancelled by abort below; the first failure is already recorded
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    if (first == null || (first instanceof WorldAbortedException && !(cause instanceof WorldAbortedException))) {
                        first = cause;
                        firstRank = futures.indexOf(done);
                    }
                    abort(futures);
                }
            }
            if (first != null) {
                throw propagate(first, firstRank);
            }
            List<R> results = new ArrayList<>(size);
            for (Future<R> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abort(futures);
            throw new WorldAbortedException("Interrupted while waiting for universe ranks", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("rank failed after completion", e);
        } finally {
            pool.shutdownNow();
        }
    }

    GroupContext context(String id, int[] universeRanks) {
        GroupContext context = contexts.computeIfAbsent(id, key -> new GroupContext(key, universeRanks));
        if (context.size() != universeRanks.length) {
            throw new IllegalStateException("context " + id + " created with a different membership");
        }
        return context;
    }

    private void abort(List<? extends Future<?>> futures) {
        if (!aborted.compareAndSet(false, true)) {
            return;
        }
        for (Future<?> future : futures) {
            future.cancel(true);
        }
        for (Runnable hook : abortHooks) {
            hook.run();
        }
    }

    private static RuntimeException propagate(Throwable failure, int rank) {
        if (failure instanceof RuntimeException) {
            return (RuntimeException) failure;
        }
        if (failure instanceof Error) {
            throw (Error) failure;
        }
        return new RuntimeException("Process rank " + rank + " failed", failure);
    }

    private static ThreadFactory processThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "macroq-rank-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
