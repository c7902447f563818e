package cn.hjw.dev.seqflow.worker;

/**
 * 已提交 worker 的句柄
 */
public interface WorkerHandle {

    String getAlias();
}
