package cn.hjw.dev.seqflow.tasker;

import cn.hjw.dev.seqflow.item.DataItem;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * 一次后台任务的完成报告
 */
@Getter
@Builder
public class TaskReport {

    // 发起方 (例如某个界面部件)，可以为 null
    private final Object starter;

    private final String taskName;

    // "a + b + c": 任务及其级联执行的下游阶段
    private final String chainName;

    private final Map<String, Object> params;

    private final double durationSeconds;

    private final List<DataItem> errorItems;

    // 任务本身抛出的异常 (配置错误)，正常结束时为 null
    private final Throwable failure;
}
