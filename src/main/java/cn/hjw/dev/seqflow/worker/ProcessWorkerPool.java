package cn.hjw.dev.seqflow.worker;

import cn.hjw.dev.seqflow.exception.ConfigurationException;
import cn.hjw.dev.seqflow.exception.StageRuntimeException;
import cn.hjw.dev.seqflow.processor.StageBody;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.lang.reflect.Modifier;
import java.nio.charset.StandardCharsets;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 每个数据项启动一个子 JVM 作为 worker，通过 stdin/stdout 上的 JSON 行交换任务与结果
 * 阶段函数以类名传递，必须是带公开无参构造的具名类
 */
@Slf4j
public class ProcessWorkerPool implements WorkerPool {

    public static final String MARKER = "@@seqflow ";

    private final String javaCommand;
    private final String classpath;
    private final List<String> jvmArgs;
    private final Map<WorkerChannel, Process> running = new ConcurrentHashMap<>();

    public ProcessWorkerPool(StageBody body, String javaCommand, String classpath, List<String> jvmArgs) {
        checkBody(body);
        this.javaCommand = javaCommand != null ? javaCommand
                : Paths.get(System.getProperty("java.home"), "bin", "java").toString();
        this.classpath = classpath != null ? classpath : System.getProperty("java.class.path");
        this.jvmArgs = jvmArgs != null ? jvmArgs : List.of();
    }

    static void checkBody(StageBody body) {
        Class<?> cls = body.getClass();
        if (cls.isSynthetic() || cls.isAnonymousClass() || cls.isLocalClass()
                || cls.getName().contains("$$Lambda")) {
            throw new ConfigurationException(
                    "process workers need a named stage body class, got " + cls.getName());
        }
        if (cls.isMemberClass() && !Modifier.isStatic(cls.getModifiers())) {
            throw new ConfigurationException("stage body " + cls.getName() + " must be a static class");
        }
        try {
            cls.getDeclaredConstructor();
        } catch (NoSuchMethodException e) {
            throw new ConfigurationException("stage body " + cls.getName() + " has no no-arg constructor", e);
        }
    }

    @Override
    public WorkerHandle submit(WorkerTask task) {
        WorkerChannel channel = new WorkerChannel(task.getAlias());
        List<String> command = new ArrayList<>();
        command.add(javaCommand);
        command.addAll(jvmArgs);
        command.add("-cp");
        command.add(classpath);
        command.add(ProcessWorkerMain.class.getName());

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .redirectError(ProcessBuilder.Redirect.INHERIT)
                    .start();
        } catch (IOException e) {
            throw new StageRuntimeException("cannot start process worker for data: " + task.getAlias(), e);
        }
        try (Writer w = new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8)) {
            w.write(WorkerCodec.encodeTask(task));
            w.write('\n');
        } catch (IOException e) {
            process.destroyForcibly();
            throw new StageRuntimeException("cannot send the task to the process worker for data: "
                    + task.getAlias(), e);
        }
        running.put(channel, process);

        Thread reader = new Thread(() -> readOutput(process, channel),
                "seqflow-proc-" + task.getAlias());
        reader.setDaemon(true);
        reader.start();
        return channel;
    }

    private void readOutput(Process process, WorkerChannel channel) {
        BufferedReader out = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
        try {
            String line;
            while ((line = WorkerChannel.retryOnInterrupt(out::readLine)) != null) {
                if (!line.startsWith(MARKER)) {
                    log.debug("[{}] {}", channel.getAlias(), line);
                    continue;
                }
                JsonNode msg = WorkerCodec.readMessage(line.substring(MARKER.length()));
                String type = msg.path("type").asText();
                if (WorkerCodec.TYPE_PROGRESS.equals(type)) {
                    channel.putProgress(msg.get("value").asDouble());
                } else if (WorkerCodec.TYPE_RESULT.equals(type)) {
                    channel.putOutData(WorkerCodec.decodeResult(msg));
                    return;
                }
            }
            channel.putOutData(WorkerResult.failed(channel.getAlias(),
                    "process worker for data: " + channel.getAlias() + " exited without a result"));
        } catch (IOException e) {
            if (process.isAlive()) {
                log.error("Process worker channel broken for [{}]", channel.getAlias(), e);
                channel.putOutData(WorkerResult.failed(channel.getAlias(),
                        "process worker channel broken for data: " + channel.getAlias() + ": " + e.getMessage()));
            } else {
                log.debug("Process worker for [{}] was terminated", channel.getAlias());
            }
        }
    }

    @Override
    public WorkerResult join(WorkerHandle handle, long timeoutMillis) {
        WorkerChannel channel = (WorkerChannel) handle;
        WorkerResult result = channel.getOutData(timeoutMillis);
        Process process = running.remove(channel);
        if (result == null) {
            log.warn("Process worker for [{}] timed out after {} ms", channel.getAlias(), timeoutMillis);
            if (process != null) {
                process.destroyForcibly();
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
        return "process";
    }

    @Override
    public void close() {
        running.values().forEach(Process::destroyForcibly);
        running.clear();
    }
}
