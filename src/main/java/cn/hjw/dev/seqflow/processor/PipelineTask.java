package cn.hjw.dev.seqflow.processor;

import cn.hjw.dev.seqflow.item.DataItem;

import java.util.List;
import java.util.Map;

/**
 * 可以由 Tasker 在后台执行的任务 (变换或拟合)
 */
public interface PipelineTask {

    String getName();

    /**
     * 执行任务
     * @param params        合并到每个数据项的参数，可以为空
     * @param runDownstream 是否级联执行下游阶段
     * @param items         数据项，为 null 时使用当前选中的数据项
     * @return 执行后 error 不为空的数据项
     */
    List<DataItem> run(Map<String, Object> params, boolean runDownstream, List<DataItem> items);

    /**
     * 本任务及其级联执行的下游任务名
     */
    List<String> getChainNames(boolean runDownstream);
}
