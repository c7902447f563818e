package cn.hjw.dev.seqflow.item;

import cn.hjw.dev.seqflow.node.Node;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 流经流水线的一条数据记录
 * 数组名由当前节点定义；状态按节点记录；参数按阶段名覆盖。
 * 数据项由外部持有，核心只在一次 run() 中借用它
 */
@Getter
@Setter
public class DataItem {

    private final String alias;

    private final Map<String, Object> arrays = new LinkedHashMap<>();
    private final Map<String, DataState> states = new ConcurrentHashMap<>();
    private final Map<String, Map<String, Object>> stageParams = new LinkedHashMap<>();
    private final Map<String, Double> transformTimes = new ConcurrentHashMap<>();
    private final Map<String, Object> meta = new LinkedHashMap<>();

    private volatile String error;
    // 正在执行的阶段名，空闲时为 null
    private volatile String beingTransformed;

    private Node originNode;
    private Node terminalNode;

    // 为 null 时所有阶段都适用
    private Set<String> stageWhitelist;

    private String branch;

    // 组合数据: 由 madeOf 中的数据项按 combineKind 计算
    private List<DataItem> madeOf;
    private CombineKind combineKind;
    private final List<DataItem> combinesTo = new ArrayList<>();

    public DataItem(String alias, Node originNode) {
        this.alias = alias;
        this.originNode = originNode;
    }

    /**
     * 创建组合数据项，并登记到每个源数据项的 combinesTo 中
     */
    public static DataItem combination(String alias, Node originNode, CombineKind kind, List<DataItem> madeOf) {
        DataItem item = new DataItem(alias, originNode);
        item.combineKind = kind;
        item.madeOf = new ArrayList<>(madeOf);
        for (DataItem d : madeOf) {
            if (!d.combinesTo.contains(item)) {
                d.combinesTo.add(item);
            }
        }
        return item;
    }

    public boolean isCombination() {
        return madeOf != null && !madeOf.isEmpty();
    }

    public List<DataItem> getMadeOf() {
        return madeOf == null ? List.of() : Collections.unmodifiableList(madeOf);
    }

    public DataState getState(Node node) {
        return getState(node.getName());
    }

    public DataState getState(String nodeName) {
        return states.getOrDefault(nodeName, DataState.UNDEFINED);
    }

    public void setState(Node node, DataState state) {
        states.put(node.getName(), state);
    }

    public boolean hasArray(String name) {
        return arrays.get(name) != null;
    }

    public Object getArray(String name) {
        return arrays.get(name);
    }

    public double[] getVector(String name) {
        return (double[]) arrays.get(name);
    }

    public DataItem setArray(String name, Object value) {
        arrays.put(name, value);
        return this;
    }

    public Map<String, Object> getParams(String stageName) {
        return stageParams.get(stageName);
    }

    public boolean isAllowed(String stageName) {
        return stageWhitelist == null || stageWhitelist.contains(stageName);
    }

    @Override
    public String toString() {
        return alias;
    }
}
