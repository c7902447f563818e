package cn.hjw.dev.seqflow.processor;

import lombok.Builder;
import lombok.Getter;

/**
 * 阶段能力描述，注册时给出一次，调用时不再探测
 */
@Getter
@Builder
public class StageCapabilities {

    public static final StageCapabilities NONE = StageCapabilities.builder().build();

    // 需要全部数据项，禁止并行分派
    @Builder.Default
    private boolean wantsAllItems = false;

    // 需要周期性进度上报
    @Builder.Default
    private boolean wantsProgress = false;
}
