package cn.hjw.dev.seqflow.worker;

import java.util.List;

/**
 * 线程 worker 与进程 worker 的统一接口，StageRunner 只针对该接口编写
 */
public interface WorkerPool extends AutoCloseable {

    /**
     * 启动一个 worker 处理该任务
     */
    WorkerHandle submit(WorkerTask task);

    /**
     * 等待 worker 结束
     * @param timeoutMillis 最长等待时间，超时的 worker 被终止
     * @return 结果；超时时 {@link WorkerResult#isCompleted()} 为 false
     */
    WorkerResult join(WorkerHandle handle, long timeoutMillis);

    /**
     * 非阻塞地取出所有缓存的进度采样
     */
    List<Double> drainProgress(WorkerHandle handle);

    String getWorkerType();

    @Override
    void close();
}
