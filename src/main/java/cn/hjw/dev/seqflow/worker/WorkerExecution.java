package cn.hjw.dev.seqflow.worker;

import cn.hjw.dev.seqflow.item.DataItem;
import cn.hjw.dev.seqflow.numeric.NumericPolicy;
import cn.hjw.dev.seqflow.processor.StageBody;
import cn.hjw.dev.seqflow.processor.StageSupport;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintWriter;
import java.lang.reflect.InvocationTargetException;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 在当前线程中对一个任务执行一次阶段函数
 * 顺序执行、线程 worker 与进程 worker 共用这段逻辑。
 * 阶段函数抛出的任何异常与 Error 都记录为数据项错误，只有 JVM 级错误 (栈溢出除外) 继续上抛
 */
@Slf4j
public final class WorkerExecution {

    private WorkerExecution() {
    }

    public static WorkerResult execute(StageBody body, WorkerTask task, StageSupport support) {
        WorkerPayload data = task.toPayload();
        boolean resultPresent = false;
        boolean mathError = false;
        String error = null;
        try {
            Object res = body.process(data, support);
            resultPresent = res != null;
            if (!resultPresent) {
                error = header(task) + "\nthe stage returned no result";
            } else if (task.isStrictNumeric()) {
                String bad = NumericPolicy.findNonFinite(data.getArrays(), task.getOutArrays());
                if (bad != null) {
                    mathError = true;
                    error = header(task) + "\nnon-finite values in output array '" + bad + "'";
                }
            }
        } catch (StackOverflowError e) {
            error = formatError(task, e);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Exception | Error e) {
            mathError = extractRealCause(e) instanceof ArithmeticException;
            error = formatError(task, e);
        }
        if (error != null) {
            log.debug("Worker for [{}] in \"{}\" failed", task.getAlias(), task.getStageName());
        }

        Map<String, Object> out = new LinkedHashMap<>();
        for (String key : task.getOutArrays()) {
            Object arr = data.getArray(key);
            if (arr != null) {
                out.put(key, arr);
            }
        }
        return WorkerResult.builder()
                .alias(task.getAlias())
                .outArrays(out)
                .params(data.getParams())
                .resultPresent(resultPresent)
                .error(error)
                .mathError(mathError)
                .build();
    }

    public static String formatError(WorkerTask task, Throwable e) {
        StringWriter sw = new StringWriter();
        extractRealCause(e).printStackTrace(new PrintWriter(sw));
        String tb = sw.toString().stripTrailing();
        return header(task) + "\nwith the following traceback:\n" + tb;
    }

    /**
     * 剥掉异步框架的包装异常，得到阶段函数真正抛出的异常
     */
    public static Throwable extractRealCause(Throwable e) {
        Throwable cause = e;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException
                || cause instanceof InvocationTargetException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static String header(WorkerTask task) {
        return "failed \"" + task.getStageName() + "\" for data: " + task.getAlias();
    }

    /**
     * worker 一侧的能力：只有进度，没有全部数据项
     */
    public static StageSupport isolatedSupport(Progress progress) {
        return new StageSupport() {
            @Override
            public Progress getProgress() {
                return progress;
            }

            @Override
            public List<DataItem> getAllItems() {
                throw new IllegalStateException("all items are not available in a parallel worker");
            }
        };
    }
}
