package cn.hjw.dev.seqflow.worker;

import cn.hjw.dev.seqflow.processor.StageBody;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 进程内线程 worker：任务通过内存队列交接，数组已是私有副本
 */
@Slf4j
public class ThreadWorkerPool implements WorkerPool {

    private final ExecutorService executor;
    private final ScheduledExecutorService ticker;
    private final StageBody body;
    private final Map<WorkerChannel, Future<?>> running = new ConcurrentHashMap<>();

    public ThreadWorkerPool(ExecutorService executor, ScheduledExecutorService ticker, StageBody body) {
        this.executor = executor;
        this.ticker = ticker;
        this.body = body;
    }

    @Override
    public WorkerHandle submit(WorkerTask task) {
        WorkerChannel channel = new WorkerChannel(task.getAlias());
        channel.putInData(task);
        running.put(channel, executor.submit(() -> runWorker(channel)));
        return channel;
    }

    private void runWorker(WorkerChannel channel) {
        WorkerTask task;
        try {
            task = channel.takeInData();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        Progress progress = new Progress();
        ScheduledFuture<?> sampler = null;
        if (task.isWantsProgress()) {
            long period = task.getProgressPeriodMillis();
            sampler = ticker.scheduleAtFixedRate(
                    () -> channel.putProgress(progress.get()), period, period, TimeUnit.MILLISECONDS);
        }
        WorkerResult result;
        try {
            result = WorkerExecution.execute(body, task, WorkerExecution.isolatedSupport(progress));
        } catch (RuntimeException | Error e) {
            // 结果通道不能空着，否则等待方只能等到超时
            channel.putOutData(WorkerResult.failed(task.getAlias(), WorkerExecution.formatError(task, e)));
            throw e;
        } finally {
            if (sampler != null) {
                sampler.cancel(false);
            }
        }
        if (task.isWantsProgress()) {
            channel.putProgress(1.0);
        }
        channel.putOutData(result);
    }

    @Override
    public WorkerResult join(WorkerHandle handle, long timeoutMillis) {
        WorkerChannel channel = (WorkerChannel) handle;
        WorkerResult result = channel.getOutData(timeoutMillis);
        Future<?> future = running.remove(channel);
        if (result == null) {
            log.warn("Thread worker for [{}] timed out after {} ms", channel.getAlias(), timeoutMillis);
            if (future != null) {
                future.cancel(true);
            }
            return WorkerResult.timedOut(channel.getAlias());
        }
        return result;
    }

    @Override
    public List<Double> drainProgress(WorkerHandle handle) {
        return ((WorkerChannel) handle).drainProgress();
    }

    @Override
    public String getWorkerType() {
        return "thread";
    }

    @Override
    public void close() {
        running.values().forEach(f -> f.cancel(true));
        running.clear();
    }
}
