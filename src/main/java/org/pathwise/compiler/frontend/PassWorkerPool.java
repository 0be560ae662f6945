package org.pathwise.compiler.frontend;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.LockSupport;

/**
 * A small thread pool for barrier-synchronized, per-module pass work.
 * <p>
 * Each resolution pass (declaration collection, one import round, use-site resolution)
 * is one {@link #dispatch(int, ChunkTask)} over the module arena: the range of module
 * indices is split into contiguous chunks, one per thread, and the call returns only
 * after every chunk has finished. That return is the barrier between passes.
 * <p>
 * The pool keeps {@code P-1} daemon threads parked between dispatches. The calling thread
 * participates as worker 0, so the total parallelism is P. With a parallelism of 1 no
 * threads are started and every dispatch runs inline on the caller.
 * <p>
 * <b>Thread safety:</b> {@link #dispatch(int, ChunkTask)} must only be called from the
 * thread that created this pool and is not reentrant. {@link #shutdown()} is idempotent.
 */
public class PassWorkerPool implements AutoCloseable {

    /**
     * Work on a contiguous range of module indices.
     */
    @FunctionalInterface
    public interface ChunkTask {
        /**
         * Processes module indices in [{@code fromInclusive}, {@code toExclusive}).
         *
         * @param fromInclusive start index (inclusive)
         * @param toExclusive   end index (exclusive)
         */
        void run(int fromInclusive, int toExclusive);
    }

    private final Thread[] workers;
    private final int totalThreads;

    private volatile int phase;
    private volatile int workSize;
    private volatile ChunkTask task;
    private volatile boolean stopped;
    private final AtomicInteger workersCompleted = new AtomicInteger();
    private final AtomicReference<Throwable> workerException = new AtomicReference<>();
    private final AtomicInteger readyWorkers = new AtomicInteger();

    /**
     * Creates a pool with the given parallelism and waits until every worker is parked,
     * so that the first dispatch cannot be mistaken for a spurious wakeup.
     *
     * @param parallelism total number of threads including the caller; must be &gt;= 1.
     * @throws IllegalArgumentException if parallelism &lt; 1
     */
    public PassWorkerPool(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be >= 1, got " + parallelism);
        }
        this.totalThreads = parallelism;
        this.workers = new Thread[parallelism - 1];

        for (int i = 0; i < workers.length; i++) {
            int workerIndex = i + 1;
            workers[i] = new Thread(() -> workerLoop(workerIndex), "resolver-worker-" + workerIndex);
            workers[i].setDaemon(true);
            workers[i].start();
        }

        while (readyWorkers.get() < workers.length) {
            Thread.onSpinWait();
        }
    }

    public int parallelism() {
        return totalThreads;
    }

    /**
     * Runs {@code task} over [0, {@code totalSize}) and blocks until every chunk is done.
     * <p>
     * If any chunk throws, the first failure is rethrown here after all threads finished;
     * a failure of the calling thread's own chunk is attached as suppressed.
     *
     * @param totalSize the number of work items (modules); nothing happens if &lt;= 0
     * @param task      the work for one chunk
     * @throws IllegalStateException if the pool has been shut down
     * @throws RuntimeException      wrapping a checked failure of a chunk
     */
    public void dispatch(int totalSize, ChunkTask task) {
        if (stopped) {
            throw new IllegalStateException("Pool has been shut down");
        }
        if (totalSize <= 0) return;

        if (workers.length == 0) {
            task.run(0, totalSize);
            return;
        }

        this.workSize = totalSize;
        this.task = task;
        workerException.set(null);
        workersCompleted.set(0);

        // Volatile write publishes workSize and task to the workers
        phase++;

        for (Thread worker : workers) {
            LockSupport.unpark(worker);
        }

        Throwable mainException = null;
        try {
            int chunkSize = (totalSize + totalThreads - 1) / totalThreads;
            task.run(0, Math.min(chunkSize, totalSize));
        } catch (Throwable t) {
            mainException = t;
        }

        while (workersCompleted.get() < workers.length) {
            Thread.onSpinWait();
        }

        Throwable workerEx = workerException.get();
        if (workerEx != null) {
            if (mainException != null) {
                workerEx.addSuppressed(mainException);
            }
            if (workerEx instanceof RuntimeException re) {
                throw re;
            }
            throw new RuntimeException("Resolver worker failed", workerEx);
        }
        if (mainException != null) {
            if (mainException instanceof RuntimeException re) {
                throw re;
            }
            throw new RuntimeException("Resolver pass failed on the calling thread", mainException);
        }
    }

    /**
     * Stops and joins all workers. Idempotent.
     */
    public void shutdown() {
        stopped = true;
        for (Thread worker : workers) {
            LockSupport.unpark(worker);
        }
        for (Thread worker : workers) {
            try {
                worker.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    private void workerLoop(int workerIndex) {
        int lastPhase = phase;
        readyWorkers.incrementAndGet();

        while (!stopped) {
            LockSupport.park();

            if (stopped) break;

            int currentPhase = phase;
            if (currentPhase == lastPhase) {
                // Spurious wakeup
                continue;
            }
            lastPhase = currentPhase;

            try {
                int chunkSize = (workSize + totalThreads - 1) / totalThreads;
                int from = workerIndex * chunkSize;
                int to = Math.min(from + chunkSize, workSize);
                if (from < workSize) {
                    task.run(from, to);
                }
            } catch (Throwable t) {
                workerException.compareAndSet(null, t);
            }

            workersCompleted.incrementAndGet();
        }
    }
}
