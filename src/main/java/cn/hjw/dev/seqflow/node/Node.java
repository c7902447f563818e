package cn.hjw.dev.seqflow.node;

import cn.hjw.dev.seqflow.PipelineContext;
import cn.hjw.dev.seqflow.exception.ConfigurationException;
import cn.hjw.dev.seqflow.processor.Stage;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 流水线图中的命名位置，拥有带类型的数组
 * 上下游列表由阶段注册时自动维护，保持相互一致并按节点注册顺序排序
 */
@Getter
public class Node {

    private final String name;
    private final Map<String, ArraySpec> arrays = new LinkedHashMap<>();
    private final int index;

    // 由阶段注册自动填充
    private final List<Node> upstreamNodes = new ArrayList<>();
    private final List<Node> downstreamNodes = new ArrayList<>();
    private final List<Stage> transformsOut = new ArrayList<>();
    private Stage transformIn;

    private final String axisArray;
    private final int plotDimension;

    public Node(PipelineContext context, String name, List<ArraySpec> arraySpecs) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("node name must not be empty");
        }
        this.name = name;
        String axis = null;
        int dim = 0;
        for (ArraySpec spec : arraySpecs) {
            if (arrays.containsKey(spec.getName())) {
                throw new ConfigurationException(
                        "array '" + spec.getName() + "' is declared twice in node '" + name + "'");
            }
            if (spec.getRole().isAxis()) {
                if (axis != null) {
                    throw new ConfigurationException(
                            "there must be only one x array defined in node '" + name + "'");
                }
                axis = spec.getName();
            }
            dim = Math.max(dim, spec.getRole().getNdim());
            arrays.put(spec.getName(), spec);
        }
        this.axisArray = axis;
        this.plotDimension = dim;
        this.index = context.registerNode(this);
    }

    public List<String> getArrayNames() {
        return new ArrayList<>(arrays.keySet());
    }

    public List<String> getArrayNames(ArrayRole role) {
        List<String> res = new ArrayList<>();
        arrays.values().forEach(a -> {
            if (a.getRole() == role) {
                res.add(a.getName());
            }
        });
        return res;
    }

    public ArraySpec getArray(String arrayName) {
        return arrays.get(arrayName);
    }

    public List<Node> getUpstreamNodes() {
        return Collections.unmodifiableList(upstreamNodes);
    }

    public List<Node> getDownstreamNodes() {
        return Collections.unmodifiableList(downstreamNodes);
    }

    public List<Stage> getTransformsOut() {
        return Collections.unmodifiableList(transformsOut);
    }

    /**
     * 判断本节点是否位于 node1 到 node2 之间
     * @param node1   区间起点
     * @param node2   区间终点，可以为 null (右端开放)
     * @param node1in 起点是否闭合
     * @param node2in 终点是否闭合
     */
    public boolean isBetween(Node node1, Node node2, boolean node1in, boolean node2in) {
        boolean ans = upstreamNodes.contains(node1) || (node1in && this == node1);
        if (ans && node2 != null) {
            ans = downstreamNodes.contains(node2) || (node2in && this == node2);
        }
        return ans;
    }

    /**
     * 注册一个阶段 from -> to：登记 transformsOut / transformIn，并维护上下游列表
     * 原地阶段 (from == to) 不改动图结构
     */
    public static void link(Stage stage, Node from, Node to) {
        if (!from.transformsOut.contains(stage)) {
            from.transformsOut.add(stage);
        }
        if (from != to || to.transformIn == null) {
            to.transformIn = stage;
        }
        if (from == to) {
            return;
        }
        Comparator<Node> order = Comparator.comparingInt(Node::getIndex);

        List<Node> grossDown = new ArrayList<>();
        grossDown.add(to);
        grossDown.addAll(to.downstreamNodes);
        List<Node> affectedUp = new ArrayList<>(from.upstreamNodes);
        affectedUp.add(from);
        for (Node node : affectedUp) {
            extendSorted(node.downstreamNodes, grossDown, order);
        }

        List<Node> grossUp = new ArrayList<>(from.upstreamNodes);
        grossUp.add(from);
        List<Node> affectedDown = new ArrayList<>(to.downstreamNodes);
        affectedDown.add(to);
        for (Node node : affectedDown) {
            extendSorted(node.upstreamNodes, grossUp, order);
        }
    }

    private static void extendSorted(List<Node> target, List<Node> extra, Comparator<Node> order) {
        for (Node n : extra) {
            if (!target.contains(n)) {
                target.add(n);
            }
        }
        target.sort(order);
    }

    @Override
    public String toString() {
        return "Node[" + name + "]";
    }
}
