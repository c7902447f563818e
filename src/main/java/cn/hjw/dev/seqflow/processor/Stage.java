package cn.hjw.dev.seqflow.processor;

import cn.hjw.dev.seqflow.PipelineContext;
import cn.hjw.dev.seqflow.config.StageGovernance;
import cn.hjw.dev.seqflow.exception.ConfigurationException;
import cn.hjw.dev.seqflow.item.DataItem;
import cn.hjw.dev.seqflow.node.Node;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 阶段 (变换或拟合) 的基类：从 fromNode 的数组计算 toNode 的数组
 * 构造时登记到 PipelineContext，并与持久化的默认参数合并
 */
@Getter
public abstract class Stage implements PipelineTask {

    protected final PipelineContext context;
    private final String name;
    private final Node fromNode;
    private final Node toNode;
    private final Map<String, Object> defaultParams;
    private final Map<String, Object> iniParams;
    private final List<String> inArrays;
    private final List<String> outArrays;
    private final StageCapabilities capabilities;

    @Setter
    private StageGovernance governance;

    protected Stage(PipelineContext context, String name, Node fromNode, Node toNode,
                    Map<String, Object> defaultParams, List<String> inArrays, List<String> outArrays,
                    StageCapabilities capabilities, StageGovernance governance) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("stage name must not be empty");
        }
        if (fromNode == null || toNode == null) {
            throw new ConfigurationException("stage '" + name + "' needs both fromNode and toNode");
        }
        this.context = context;
        this.name = name;
        this.fromNode = fromNode;
        this.toNode = toNode;
        this.defaultParams = Collections.unmodifiableMap(
                defaultParams == null ? new LinkedHashMap<>() : new LinkedHashMap<>(defaultParams));
        this.inArrays = List.copyOf(inArrays == null ? List.of() : inArrays);
        this.outArrays = List.copyOf(outArrays == null ? List.of() : outArrays);
        this.capabilities = capabilities != null ? capabilities : StageCapabilities.NONE;
        this.governance = governance != null ? governance : context.getConfig().getDefaultGovernance();
        this.iniParams = Collections.unmodifiableMap(Params.copy(
                context.getConfig().getStageDefaults().read(name, this.defaultParams)));
        context.registerStage(this);
    }

    /**
     * 阶段函数
     */
    public abstract StageBody getBody();

    public boolean isInPlace() {
        return fromNode == toNode;
    }

    /**
     * 数据项在本阶段的参数，首次访问时由默认参数初始化
     */
    public Map<String, Object> paramsOf(DataItem item) {
        return item.getStageParams().computeIfAbsent(name, k -> Params.copy(iniParams));
    }

    /**
     * 分派之前的配置检查，在任何参数写入之前调用
     * @param items     本次运行的数据项
     * @param newParams 即将合并到各数据项的参数
     * @throws ConfigurationException 配置无法满足
     */
    public void checkConfiguration(List<DataItem> items, Map<String, Object> newParams) {
    }

    /**
     * 清除数据项的输出 (缺少输入时使用)，子类可覆盖
     */
    public void erase(DataItem item) {
    }

    @Override
    public List<DataItem> run(Map<String, Object> params, boolean runDownstream, List<DataItem> items) {
        return context.getRunner().run(this, params, runDownstream, items);
    }

    public List<DataItem> run(List<DataItem> items) {
        return run(Map.of(), true, items);
    }

    @Override
    public List<String> getChainNames(boolean runDownstream) {
        List<String> res = new ArrayList<>();
        res.add(name);
        if (!runDownstream) {
            return res;
        }
        for (Stage tr : toNode.getTransformsOut()) {
            if (tr == this) {
                continue;
            }
            for (String n : tr.getChainNames(true)) {
                if (!res.contains(n)) {
                    res.add(n);
                }
            }
        }
        return res;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
