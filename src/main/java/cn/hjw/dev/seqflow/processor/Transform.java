package cn.hjw.dev.seqflow.processor;

import cn.hjw.dev.seqflow.PipelineContext;
import cn.hjw.dev.seqflow.config.StageGovernance;
import cn.hjw.dev.seqflow.exception.ConfigurationException;
import cn.hjw.dev.seqflow.node.Node;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * 数据变换：由阶段函数 {@link StageBody} 定义的阶段
 */
public class Transform extends Stage {

    private final StageBody body;

    @Builder
    public Transform(PipelineContext context, String name, Node fromNode, Node toNode,
                     Map<String, Object> defaultParams, List<String> inArrays, List<String> outArrays,
                     StageCapabilities capabilities, StageGovernance governance, StageBody body) {
        super(context, name, fromNode, toNode, defaultParams, inArrays, outArrays, capabilities, governance);
        if (body == null) {
            throw new ConfigurationException("transform '" + name + "' has no body");
        }
        this.body = body;
    }

    @Override
    public StageBody getBody() {
        return body;
    }
}
