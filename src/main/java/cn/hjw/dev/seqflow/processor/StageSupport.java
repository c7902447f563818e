package cn.hjw.dev.seqflow.processor;

import cn.hjw.dev.seqflow.item.DataItem;
import cn.hjw.dev.seqflow.worker.Progress;

import java.util.List;

/**
 * 提供给阶段函数的可选能力，由注册时声明的 {@link StageCapabilities} 决定
 */
public interface StageSupport {

    /**
     * 周期性进度上报 (wantsProgress)
     */
    Progress getProgress();

    /**
     * 全部数据项 (wantsAllItems)，只在顺序执行时可用
     * @throws IllegalStateException 如果阶段未声明该能力
     */
    List<DataItem> getAllItems();
}
