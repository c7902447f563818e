package cn.hjw.dev.seqflow.undo;

import cn.hjw.dev.seqflow.item.DataItem;
import cn.hjw.dev.seqflow.processor.Params;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * 有界的撤销/重做栈，每个方向最多保留 {@link #MAX_ENTRIES} 条
 * 撤销与重做通过重新执行阶段 (级联下游) 恢复数据
 */
@Slf4j
public class UndoStack implements UndoListener {

    public static final int MAX_ENTRIES = 100;

    private final Deque<UndoRecord> undo = new ArrayDeque<>();
    private final Deque<UndoRecord> redo = new ArrayDeque<>();

    // undo()/redo() 重新执行阶段时不再记录
    private boolean replaying;

    @Override
    public synchronized void record(UndoRecord record) {
        if (replaying) {
            return;
        }
        redo.clear();
        UndoRecord last = undo.peekLast();
        if (record.isRepeatOf(last)) {
            last.replaceNewValues(record.getNewValues());
            return;
        }
        push(undo, record);
    }

    public synchronized boolean canUndo() {
        return !undo.isEmpty();
    }

    public synchronized boolean canRedo() {
        return !redo.isEmpty();
    }

    /**
     * 恢复最近一次修改前的参数并重新执行该阶段
     */
    public void undo() {
        UndoRecord record;
        synchronized (this) {
            record = undo.pollLast();
            if (record == null) {
                return;
            }
            push(redo, record);
        }
        List<DataItem> items = record.getItems();
        for (int i = 0; i < items.size(); i++) {
            record.getStage().paramsOf(items.get(i)).putAll(Params.copy(record.getPrevious().get(i)));
        }
        log.info("Undo: {}", record.describe());
        replay(record, Map.of());
    }

    /**
     * 重新应用最近一次撤销的修改
     */
    public void redo() {
        UndoRecord record;
        synchronized (this) {
            record = redo.pollLast();
            if (record == null) {
                return;
            }
            push(undo, record);
        }
        log.info("Redo: {}", record.describe());
        replay(record, record.getNewValues());
    }

    private void replay(UndoRecord record, Map<String, Object> params) {
        synchronized (this) {
            replaying = true;
        }
        try {
            record.getStage().run(params, true, new ArrayList<>(record.getItems()));
        } finally {
            synchronized (this) {
                replaying = false;
            }
        }
    }

    public synchronized List<String> describe() {
        List<String> res = new ArrayList<>();
        undo.forEach(r -> res.add(r.describe()));
        return res;
    }

    private static void push(Deque<UndoRecord> deque, UndoRecord record) {
        deque.addLast(record);
        while (deque.size() > MAX_ENTRIES) {
            deque.pollFirst();
        }
    }
}
