package cn.hjw.dev.seqflow.config;

import cn.hjw.dev.seqflow.listener.PipelineListener;
import cn.hjw.dev.seqflow.undo.UndoListener;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * 流水线的全局配置
 */
@AllArgsConstructor
@Builder
@Data
public class PipelineConfig {

    // 线程 worker 使用的线程池，为 null 时由 PipelineContext 按需创建
    private ExecutorService threadPool;

    // 展示层回调
    @Builder.Default
    private PipelineListener listener = PipelineListener.NONE;

    // 撤销服务
    @Builder.Default
    private UndoListener undoListener = UndoListener.NONE;

    // 持久化的阶段默认值
    @Builder.Default
    private StageDefaults stageDefaults = StageDefaults.NONE;

    // 未单独配置的阶段使用的调度方案
    @Builder.Default
    private StageGovernance defaultGovernance = StageGovernance.SEQUENTIAL;

    // --- 进程 worker: 为 null 时沿用当前 JVM 的 java 与 classpath ---
    private String javaCommand;
    private String classpath;
    private List<String> jvmArgs;

    public static PipelineConfig defaults() {
        return PipelineConfig.builder().build();
    }
}
