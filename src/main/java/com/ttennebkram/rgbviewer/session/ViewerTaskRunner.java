package com.ttennebkram.rgbviewer.session;

import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Runs load-and-analyze work on a background thread so the UI stays responsive.
 * Results and failures are handed to the callback executor
 * (Platform::runLater in the application), never delivered on the worker thread.
 */
public class ViewerTaskRunner {

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final ExecutorService worker;
    private final Executor callbackExecutor;
    private final AtomicInteger pending = new AtomicInteger();

    public ViewerTaskRunner(Executor callbackExecutor) {
        this.callbackExecutor = callbackExecutor;
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "ViewerWorker-" + THREAD_COUNTER.incrementAndGet());
            t.setDaemon(true);  // Don't prevent JVM exit
            return t;
        });
    }

    /**
     * Run a task in the background.
     *
     * @param task produces the new state
     * @param onSuccess receives the new state on the callback executor
     * @param onFailure receives the exception or error on the callback executor
     */
    public <T> void submit(Callable<T> task, Consumer<T> onSuccess, Consumer<Throwable> onFailure) {
        pending.incrementAndGet();
        try {
            worker.execute(() -> run(task, onSuccess, onFailure));
        } catch (RejectedExecutionException e) {
            pending.decrementAndGet();
            throw e;
        }
    }

    private <T> void run(Callable<T> task, Consumer<T> onSuccess, Consumer<Throwable> onFailure) {
        T result;
        try {
            result = task.call();
        } catch (Throwable t) {
            // Errors such as OutOfMemoryError while decoding still reach the UI
            callbackExecutor.execute(() -> {
                pending.decrementAndGet();
                onFailure.accept(t);
            });
            return;
        }
        callbackExecutor.execute(() -> {
            pending.decrementAndGet();
            onSuccess.accept(result);
        });
    }

    /**
     * True while a submitted task has not yet had its callback delivered.
     */
    public boolean isBusy() {
        return pending.get() > 0;
    }

    /**
     * Stop accepting work and wait briefly for the current task.
     */
    public void shutdown() {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(500, TimeUnit.MILLISECONDS)) {
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
