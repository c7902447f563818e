package cn.hjw.dev.seqflow.undo;

import cn.hjw.dev.seqflow.item.DataItem;
import cn.hjw.dev.seqflow.processor.Stage;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * 一次参数修改：阶段、数据项、每个数据项修改前的值、新值
 */
@Getter
public class UndoRecord {

    private final Stage stage;
    private final List<DataItem> items;
    private final List<Map<String, Object>> previous;
    private Map<String, Object> newValues;

    public UndoRecord(Stage stage, List<DataItem> items, List<Map<String, Object>> previous,
                      Map<String, Object> newValues) {
        this.stage = stage;
        this.items = List.copyOf(items);
        this.previous = List.copyOf(previous);
        this.newValues = newValues;
    }

    /**
     * 同一阶段、同一组数据项、同一组参数名的修改
     */
    boolean isRepeatOf(UndoRecord other) {
        return other != null
                && stage == other.stage
                && items.equals(other.items)
                && newValues.keySet().equals(other.newValues.keySet());
    }

    void replaceNewValues(Map<String, Object> values) {
        this.newValues = values;
    }

    public String describe() {
        return "apply '" + stage.getName() + "' to " + items + " with " + newValues;
    }
}
