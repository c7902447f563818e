package cn.hjw.dev.seqflow.worker;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * 编排器与单个 worker 之间的一次性交接通道：输入任务、输出结果、进度采样
 */
@Slf4j
public class WorkerChannel implements WorkerHandle {

    @Getter
    private final String alias;

    private final BlockingQueue<WorkerTask> inData = new LinkedBlockingQueue<>();
    private final BlockingQueue<WorkerResult> outData = new LinkedBlockingQueue<>();
    private final BlockingQueue<Double> progress = new LinkedBlockingQueue<>();

    public WorkerChannel(String alias) {
        this.alias = alias;
    }

    public void putInData(WorkerTask task) {
        inData.add(task);
    }

    public WorkerTask takeInData() throws InterruptedException {
        return inData.take();
    }

    public void putOutData(WorkerResult result) {
        outData.add(result);
    }

    /**
     * @return 结果；超时或编排线程被中断时为 null
     */
    public WorkerResult getOutData(long timeoutMillis) {
        try {
            return outData.poll(Math.max(0L, timeoutMillis), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        }
    }

    public void putProgress(double value) {
        progress.offer(value);
    }

    public List<Double> drainProgress() {
        List<Double> values = new ArrayList<>();
        progress.drainTo(values);
        return values;
    }

    @FunctionalInterface
    public interface IoCall<V> {
        V call() throws IOException;
    }

    /**
     * 只在 "被中断的系统调用" 时重试，其他异常原样抛出一次
     */
    public static <V> V retryOnInterrupt(IoCall<V> call) throws IOException {
        while (true) {
            try {
                return call.call();
            } catch (SocketTimeoutException e) {
                throw e;
            } catch (InterruptedIOException e) {
                log.debug("Interrupted channel read, retrying: {}", e.getMessage());
            }
        }
    }
}
