package cn.hjw.dev.seqflow.tasker;

import cn.hjw.dev.seqflow.item.DataItem;
import cn.hjw.dev.seqflow.processor.PipelineTask;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

/**
 * 后台单任务调度器：同一时刻最多只有一个任务在执行
 * 用法: prepare(...) 之后 start()，或直接 submit(...)
 */
@Slf4j
public class Tasker implements AutoCloseable {

    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "seqflow-tasker");
        t.setDaemon(true);
        return t;
    });

    private final Consumer<TaskReport> onReady;

    private Prepared prepared;
    private boolean busy;

    public Tasker() {
        this(report -> {
        });
    }

    public Tasker(Consumer<TaskReport> onReady) {
        this.onReady = onReady;
    }

    private static final class Prepared {
        private final PipelineTask task;
        private final Map<String, Object> params;
        private final boolean runDownstream;
        private final List<DataItem> items;
        private final Object starter;

        private Prepared(PipelineTask task, Map<String, Object> params, boolean runDownstream,
                         List<DataItem> items, Object starter) {
            this.task = task;
            this.params = params;
            this.runDownstream = runDownstream;
            this.items = items;
            this.starter = starter;
        }
    }

    public synchronized void prepare(PipelineTask task, Map<String, Object> params, boolean runDownstream,
                                     List<DataItem> items, Object starter) {
        checkIdle();
        prepared = new Prepared(task, params != null ? params : Map.of(), runDownstream,
                items != null ? new ArrayList<>(items) : null, starter);
    }

    public synchronized CompletableFuture<TaskReport> start() {
        checkIdle();
        if (prepared == null) {
            throw new IllegalStateException("no task prepared");
        }
        Prepared p = prepared;
        prepared = null;
        busy = true;
        return CompletableFuture.supplyAsync(() -> execute(p), executor);
    }

    public CompletableFuture<TaskReport> submit(PipelineTask task, Map<String, Object> params, boolean runDownstream,
                                                List<DataItem> items, Object starter) {
        synchronized (this) {
            prepare(task, params, runDownstream, items, starter);
            return start();
        }
    }

    public synchronized boolean isBusy() {
        return busy;
    }

    private void checkIdle() {
        if (busy) {
            throw new IllegalStateException("a task is already running");
        }
    }

    private TaskReport execute(Prepared p) {
        long t0 = System.nanoTime();
        try {
            List<DataItem> errorItems = List.of();
            Throwable failure = null;
            try {
                errorItems = p.task.run(p.params, p.runDownstream, p.items);
            } catch (RuntimeException e) {
                log.error("Task {} failed: {}", p.task.getName(), e.getMessage());
                failure = e;
            }
            TaskReport report = TaskReport.builder()
                    .starter(p.starter)
                    .taskName(p.task.getName())
                    .chainName(String.join(" + ", p.task.getChainNames(p.runDownstream)))
                    .params(p.params)
                    .durationSeconds((System.nanoTime() - t0) * 1e-9)
                    .errorItems(errorItems)
                    .failure(failure)
                    .build();
            try {
                onReady.accept(report);
            } catch (RuntimeException e) {
                log.warn("Task report consumer failed: {}", e.getMessage());
            }
            return report;
        } finally {
            // 完成通知之后才接受下一个任务
            synchronized (this) {
                busy = false;
            }
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
