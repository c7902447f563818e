package cn.hjw.dev.seqflow.processor;

import cn.hjw.dev.seqflow.worker.WorkerPayload;

/**
 * 阶段函数：对一个数据项执行一次的纯函数
 * 分派到进程 worker 时，实现类必须是可按类名加载的公开类，并带有公开的无参构造器
 */
@FunctionalInterface
public interface StageBody {

    /**
     * 执行阶段逻辑
     * @param data    只包含声明的输入数组、参数和别名的副本，输出数组写回其中
     * @param support 可选能力 (进度、全部数据项)
     * @return 非 null 表示成功
     * @throws Exception 执行异常，由 StageRunner 捕获并记录到数据项上
     */
    Object process(WorkerPayload data, StageSupport support) throws Exception;
}
