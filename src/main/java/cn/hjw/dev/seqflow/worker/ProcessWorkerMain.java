package cn.hjw.dev.seqflow.worker;

import cn.hjw.dev.seqflow.processor.StageBody;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.lang.reflect.Constructor;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 子进程入口：从 stdin 读入一条任务，执行阶段函数，把进度与结果写回 stdout
 * 协议行以 {@link ProcessWorkerPool#MARKER} 开头，其余输出都被重定向到 stderr
 */
public final class ProcessWorkerMain {

    private ProcessWorkerMain() {
    }

    public static void main(String[] args) throws Exception {
        // 先接管 stdout，阶段函数或日志的输出不能混入协议行
        PrintStream protocol = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        System.setOut(System.err);

        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        String line = WorkerChannel.retryOnInterrupt(in::readLine);
        if (line == null) {
            System.err.println("no task received on stdin");
            System.exit(2);
            return;
        }
        WorkerTask task = WorkerCodec.decodeTask(line);

        WorkerResult result;
        Progress progress = new Progress();
        ScheduledExecutorService sampler = null;
        if (task.isWantsProgress()) {
            sampler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "seqflow-progress");
                t.setDaemon(true);
                return t;
            });
            long period = task.getProgressPeriodMillis();
            sampler.scheduleAtFixedRate(() -> send(protocol, progressLine(progress.get())),
                    period, period, TimeUnit.MILLISECONDS);
        }
        try {
            StageBody body = instantiate(task.getBodyClass());
            result = WorkerExecution.execute(body, task, WorkerExecution.isolatedSupport(progress));
        } catch (ReflectiveOperationException | RuntimeException e) {
            result = WorkerResult.failed(task.getAlias(), WorkerExecution.formatError(task, e));
        } finally {
            if (sampler != null) {
                sampler.shutdownNow();
            }
        }
        if (task.isWantsProgress()) {
            send(protocol, progressLine(1.0));
        }
        send(protocol, WorkerCodec.encodeResult(result));
        protocol.flush();
    }

    static StageBody instantiate(String className) throws ReflectiveOperationException {
        Class<?> cls = Class.forName(className);
        if (!StageBody.class.isAssignableFrom(cls)) {
            throw new IllegalArgumentException(className + " is not a stage body");
        }
        Constructor<?> ctor = cls.getDeclaredConstructor();
        ctor.setAccessible(true);
        return (StageBody) ctor.newInstance();
    }

    private static String progressLine(double value) {
        try {
            return WorkerCodec.encodeProgress(value);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static synchronized void send(PrintStream protocol, String json) {
        protocol.println(ProcessWorkerPool.MARKER + json);
    }
}
