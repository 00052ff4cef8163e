package de.bsommerfeld.landcover.backend;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Singleton;
import de.bsommerfeld.landcover.core.config.BackendConfig;
import de.bsommerfeld.landcover.core.error.BackendTimeoutException;
import de.bsommerfeld.landcover.core.error.BackendUnavailableException;
import de.bsommerfeld.landcover.core.error.LandCoverException;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs backend calls at read boundaries under a caller-supplied timeout.
 *
 * <h3>Error mapping</h3>
 * <ul>
 * <li>call exceeds the timeout: cancelled, {@link BackendTimeoutException}</li>
 * <li>call throws a {@link LandCoverException}: rethrown unchanged</li>
 * <li>call throws anything else, or the waiting thread is interrupted:
 * {@link BackendUnavailableException}</li>
 * </ul>
 * Nothing is retried.
 */
@Singleton
public class BackendGateway {

    private static final Logger LOG = LoggerFactory.getLogger(BackendGateway.class);

    private final ExecutorService executor;

    @Inject
    public BackendGateway(BackendConfig config) {
        this.executor = Executors.newFixedThreadPool(Math.max(1, config.getWorkerThreads()),
                new ThreadFactoryBuilder().setNameFormat("backend-call-%d").setDaemon(true).build());
    }

    public <T> T call(String operation, Callable<T> call, Duration timeout) {
        Future<T> future = executor.submit(call);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("Backend call '{}' exceeded {} ms", operation, timeout.toMillis());
            throw new BackendTimeoutException(operation, timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof LandCoverException landCoverException) {
                throw landCoverException;
            }
            LOG.error("Backend call '{}' failed", operation, cause);
            throw new BackendUnavailableException("Backend call '" + operation + "' failed: " + cause, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new BackendUnavailableException("Interrupted while waiting for '" + operation + "'", e);
        }
    }

    /**
     * Lets in-flight calls finish (up to 10s), then stops the worker threads.
     */
    public void shutdown() {
        LOG.info("Shutting down BackendGateway...");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                LOG.warn("BackendGateway forced shutdown (timed out).");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
