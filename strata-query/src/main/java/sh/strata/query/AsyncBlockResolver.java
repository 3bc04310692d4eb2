// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.strata.query;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import sh.strata.core.model.BlockRecord;
import sh.strata.core.model.DetailedBlockRecord;

/**
 * {@link CompletableFuture} facade over a {@link BlockResolver}.
 *
 * <p>
 * Each call runs the synchronous lookup on the executor; a failure completes the future
 * exceptionally with the original {@link sh.strata.core.error.BlockQueryException}
 * wrapped in a {@link java.util.concurrent.CompletionException}.
 *
 * <pre>{@code
 * AsyncBlockResolver async = new AsyncBlockResolver(resolver);
 * async.getBlockByNumberAsync(950)
 *         .thenAccept(block -> System.out.println(block.hash()));
 * }</pre>
 *
 * <p>
 * <strong>Executor Lifecycle:</strong> the shared default executor uses daemon threads
 * and is recreated lazily after {@link #shutdownDefaultExecutor(long)}, which tests and
 * containers with context reloads should call to avoid leaking threads.
 */
public final class AsyncBlockResolver {

    private static final AtomicReference<ExecutorService> DEFAULT_EXECUTOR_REF = new AtomicReference<>();

    private static ExecutorService getOrCreateDefaultExecutor() {
        while (true) {
            ExecutorService executor = DEFAULT_EXECUTOR_REF.get();
            if (executor != null && !executor.isShutdown()) {
                return executor;
            }
            ExecutorService newExecutor = Executors.newCachedThreadPool(daemonThreads());
            ExecutorService witness = DEFAULT_EXECUTOR_REF.compareAndExchange(executor, newExecutor);
            if (witness == executor) {
                return newExecutor;
            }
            // lost the race
            newExecutor.shutdown();
            if (witness != null && !witness.isShutdown()) {
                return witness;
            }
        }
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "strata-async-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Shuts down the shared default executor.
     *
     * @param timeoutMillis maximum time to wait for running lookups
     * @return true if the executor terminated in time or was not running
     */
    public static boolean shutdownDefaultExecutor(long timeoutMillis) {
        ExecutorService executor = DEFAULT_EXECUTOR_REF.getAndSet(null);
        if (executor == null || executor.isShutdown()) {
            return true;
        }
        executor.shutdown();
        try {
            return executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private final BlockResolver resolver;
    private final Executor executor;

    public AsyncBlockResolver(BlockResolver resolver) {
        this(resolver, getOrCreateDefaultExecutor());
    }

    public AsyncBlockResolver(BlockResolver resolver, Executor executor) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public CompletableFuture<BlockRecord> getBlockByNumberAsync(long number) {
        return getBlockByNumberAsync(number, CancellationSignal.none());
    }

    public CompletableFuture<BlockRecord> getBlockByNumberAsync(long number, CancellationSignal signal) {
        return CompletableFuture.supplyAsync(() -> resolver.getBlockByNumber(number, signal), executor);
    }

    public CompletableFuture<BlockRecord> getBlockByHashAsync(String hash) {
        return getBlockByHashAsync(hash, CancellationSignal.none());
    }

    public CompletableFuture<BlockRecord> getBlockByHashAsync(String hash, CancellationSignal signal) {
        return CompletableFuture.supplyAsync(() -> resolver.getBlockByHash(hash, signal), executor);
    }

    public CompletableFuture<DetailedBlockRecord> getDetailedBlockAsync(long number) {
        return getDetailedBlockAsync(number, CancellationSignal.none());
    }

    public CompletableFuture<DetailedBlockRecord> getDetailedBlockAsync(long number, CancellationSignal signal) {
        return CompletableFuture.supplyAsync(() -> resolver.getDetailedBlock(number, signal), executor);
    }

    public BlockResolver getResolver() {
        return resolver;
    }

    public Executor getExecutor() {
        return executor;
    }
}
