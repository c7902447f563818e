package cn.hjw.dev.seqflow.worker;

import lombok.Builder;
import lombok.Getter;

import java.util.Map;

/**
 * worker 的返回：只包含声明的输出数组、参数、结果标志、错误文本
 */
@Getter
@Builder
public class WorkerResult {

    private final String alias;

    // false: worker 超时，数据项视为未完成
    @Builder.Default
    private final boolean completed = true;

    private final Map<String, Object> outArrays;
    private final Map<String, Object> params;

    // 阶段函数返回了非 null 值
    private final boolean resultPresent;
    private final String error;
    private final boolean mathError;

    public boolean isGood() {
        return completed && resultPresent && error == null;
    }

    public static WorkerResult timedOut(String alias) {
        return WorkerResult.builder().alias(alias).completed(false).build();
    }

    public static WorkerResult failed(String alias, String error) {
        return WorkerResult.builder().alias(alias).error(error).build();
    }
}
