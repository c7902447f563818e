package cn.hjw.dev.seqflow.worker;

import cn.hjw.dev.seqflow.exception.MissingInputException;
import cn.hjw.dev.seqflow.item.DataItem;
import cn.hjw.dev.seqflow.numeric.NumericPolicy;
import cn.hjw.dev.seqflow.processor.Params;
import cn.hjw.dev.seqflow.processor.Stage;
import lombok.Builder;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 一次分派请求：只携带声明的输入数组 (私有副本) 与数据项参数，跨越线程/进程边界
 * 每个分派批次创建，合并后丢弃
 */
@Getter
@Builder
public class WorkerTask {

    private final String stageName;
    private final String bodyClass;
    private final String alias;
    private final Map<String, Object> arrays;
    private final Map<String, Object> params;
    private final List<String> outArrays;
    private final boolean wantsProgress;
    private final double progressTimeDelta;
    private final boolean strictNumeric;

    /**
     * 从数据项复制声明的输入数组与参数
     * @throws MissingInputException 如果缺少某个声明的输入数组
     */
    public static WorkerTask capture(Stage stage, DataItem item) {
        Map<String, Object> arrays = new LinkedHashMap<>();
        for (String key : stage.getInArrays()) {
            Object arr = item.getArray(key);
            if (arr == null) {
                throw new MissingInputException(item.getAlias(), key);
            }
            arrays.put(key, Params.copyArray(arr));
        }
        return WorkerTask.builder()
                .stageName(stage.getName())
                .bodyClass(stage.getBody().getClass().getName())
                .alias(item.getAlias())
                .arrays(arrays)
                .params(Params.copy(stage.paramsOf(item)))
                .outArrays(stage.getOutArrays())
                .wantsProgress(stage.getCapabilities().isWantsProgress())
                .progressTimeDelta(stage.getGovernance().getProgressTimeDelta())
                .strictNumeric(NumericPolicy.isStrict())
                .build();
    }

    public WorkerPayload toPayload() {
        return new WorkerPayload(alias, new LinkedHashMap<>(arrays), Params.copy(params));
    }

    public long getProgressPeriodMillis() {
        return Math.max(1L, Math.round(progressTimeDelta * 1000));
    }
}
