package cn.hjw.dev.seqflow.undo;

/**
 * 外部撤销服务，在参数合并前收到修改记录
 */
@FunctionalInterface
public interface UndoListener {

    UndoListener NONE = record -> {
    };

    void record(UndoRecord record);
}
