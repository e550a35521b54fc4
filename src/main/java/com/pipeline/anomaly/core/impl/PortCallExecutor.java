package com.pipeline.anomaly.core.impl;

import com.pipeline.anomaly.exception.PipelineException;
import com.pipeline.anomaly.exception.PortTimeoutException;
import com.pipeline.anomaly.exception.PortUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 端口调用执行器。
 *
 * 对时序存储和预测模型的每次调用都带超时：超时抛出 PortTimeoutException，
 * 其余失败包装为 PortUnavailableException；引擎自身的异常原样透传。
 * 不做任何重试，重试策略属于外部调度层。
 */
public class PortCallExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PortCallExecutor.class);

    public static final String STORE_PORT = "time-series-store";
    public static final String MODEL_PORT = "forecasting-model";

    private final ExecutorService pool;
    private final long storeTimeoutMs;
    private final long modelTimeoutMs;

    public PortCallExecutor(long storeTimeoutMs, long modelTimeoutMs) {
        this.storeTimeoutMs = storeTimeoutMs;
        this.modelTimeoutMs = modelTimeoutMs;
        AtomicInteger counter = new AtomicInteger(0);
        this.pool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "port-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            t.setUncaughtExceptionHandler((th, e) ->
                    log.error("Uncaught exception in port call thread {}: {}",
                            th.getName(), e.getMessage(), e));
            return t;
        });
        log.info("PortCallExecutor initialized. Store timeout: {}ms, Model timeout: {}ms",
                storeTimeoutMs, modelTimeoutMs);
    }

    public <T> T callStore(String operation, Callable<T> call) {
        return call(STORE_PORT, operation, storeTimeoutMs, call);
    }

    public void runStore(String operation, Runnable call) {
        call(STORE_PORT, operation, storeTimeoutMs, () -> {
            call.run();
            return null;
        });
    }

    public <T> T callModel(String operation, Callable<T> call) {
        return call(MODEL_PORT, operation, modelTimeoutMs, call);
    }

    public <T> T call(String port, String operation, long timeoutMs, Callable<T> call) {
        Future<T> future = pool.submit(call);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("Call to {}.{} timed out after {}ms", port, operation, timeoutMs);
            throw new PortTimeoutException(port, operation, timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PipelineException) {
                throw (PipelineException) cause;
            }
            throw new PortUnavailableException(port, operation, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new PortUnavailableException(port, operation, e);
        }
    }

    public long getStoreTimeoutMs() { return storeTimeoutMs; }
    public long getModelTimeoutMs() { return modelTimeoutMs; }

    @Override
    public void close() {
        pool.shutdownNow();
        log.info("PortCallExecutor shut down.");
    }
}
