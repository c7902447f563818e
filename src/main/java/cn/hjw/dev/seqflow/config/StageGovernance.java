package cn.hjw.dev.seqflow.config;

import lombok.Builder;
import lombok.Getter;

import java.util.concurrent.TimeUnit;

/**
 * 阶段的调度方案：
 * 1. 顺序执行 (默认)
 * 2. 线程池并行 (nThreads > 1)
 * 3. 进程池并行 (nProcesses > 1)，两者都配置时优先线程
 */
@Getter
@Builder
public class StageGovernance {

    public static final StageGovernance SEQUENTIAL = StageGovernance.builder().build();

    // --- 并行度: 整数、"half" 或 "all" ---
    @Builder.Default
    private String nThreads = "1";

    @Builder.Default
    private String nProcesses = "1";

    // --- 每个 worker 的超时 ---
    @Builder.Default
    private long timeout = 60;

    @Builder.Default
    private TimeUnit timeUnit = TimeUnit.SECONDS;

    // --- 进度采样间隔 (秒) ---
    @Builder.Default
    private double progressTimeDelta = 1.0;

    public int resolveThreads() {
        return resolve(nThreads);
    }

    public int resolveProcesses() {
        return resolve(nProcesses);
    }

    public long getTimeoutMillis() {
        return timeUnit.toMillis(timeout);
    }

    static int resolve(String count) {
        if (count == null || count.isBlank()) {
            return 1;
        }
        int nC = Runtime.getRuntime().availableProcessors();
        String c = count.trim().toLowerCase();
        if (c.startsWith("h")) {
            return Math.max(1, nC / 2);
        }
        if (c.startsWith("a")) {
            return nC;
        }
        try {
            return Math.max(1, Integer.parseInt(c));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("worker count must be an integer, 'half' or 'all': " + count, e);
        }
    }
}
