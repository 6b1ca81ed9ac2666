package com.fixit.genai.thread;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor that carries the submitting thread's MDC ({@code requestId}, {@code callId}) into the
 * worker, so log lines from parallel lead scoring and call stages stay attributable.
 */
public class MdcAwareExecutor implements Executor {

    private final ExecutorService delegate;

    public MdcAwareExecutor(ExecutorService delegate) {
        this.delegate = delegate;
    }

    /**
     * Bounded pool of daemon threads named {@code <prefix>-<n>}.
     */
    public static MdcAwareExecutor fixedPool(String prefix, int poolSize) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new MdcAwareExecutor(Executors.newFixedThreadPool(poolSize, factory));
    }

    @Override
    public void execute(Runnable command) {
        // caller MDC, restored around the task
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            Map<String, String> previous = MDC.getCopyOfContextMap();
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            } else {
                MDC.clear();
            }
            try {
                command.run();
            } finally {
                if (previous != null) {
                    MDC.setContextMap(previous);
                } else {
                    MDC.clear();
                }
            }
        });
    }

    public void shutdown() {
        delegate.shutdownNow();
    }
}
