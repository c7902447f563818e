package cn.hjw.dev.seqflow.compile;

import cn.hjw.dev.seqflow.PipelineContext;
import cn.hjw.dev.seqflow.exception.ConfigurationException;
import cn.hjw.dev.seqflow.processor.Stage;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;

public class PipelineCompiler {

    /**
     * 校验阶段图并给出依赖顺序
     * 阶段 B 依赖阶段 A 当且仅当 A 的目标节点是 B 的源节点；同一节点上的原地阶段之间没有依赖
     * @param context 已注册节点与阶段的流水线
     * @return 阶段计划
     */
    public static StagePlan compile(PipelineContext context) {
        List<Stage> stages = new ArrayList<>(context.getStages());

        // 1. 反向依赖表 (Stage -> Parents) 与入度
        Map<String, List<String>> parentsMap = new LinkedHashMap<>();
        Map<String, List<String>> childrenMap = new LinkedHashMap<>();
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        stages.forEach(s -> {
            parentsMap.put(s.getName(), new ArrayList<>());
            childrenMap.put(s.getName(), new ArrayList<>());
            inDegree.put(s.getName(), 0);
        });
        for (Stage a : stages) {
            for (Stage b : stages) {
                if (a == b || a.getToNode() != b.getFromNode() || (a.isInPlace() && b.isInPlace())) {
                    continue;
                }
                childrenMap.get(a.getName()).add(b.getName());
                parentsMap.get(b.getName()).add(a.getName());
                inDegree.merge(b.getName(), 1, Integer::sum);
            }
        }

        // 2. 拓扑排序 (Kahn) 校验环
        List<String> order = new ArrayList<>();
        Queue<String> queue = new ArrayDeque<>();
        inDegree.forEach((k, v) -> {
            if (v == 0) queue.offer(k);
        });
        while (!queue.isEmpty()) {
            String name = queue.poll();
            order.add(name);
            for (String child : childrenMap.get(name)) {
                inDegree.put(child, inDegree.get(child) - 1);
                if (inDegree.get(child) == 0) {
                    queue.offer(child);
                }
            }
        }
        if (order.size() != stages.size()) {
            List<String> cyclic = new ArrayList<>(inDegree.keySet());
            cyclic.removeAll(order);
            throw new ConfigurationException("stage graph has a cycle through " + cyclic);
        }
        return new StagePlan(order, parentsMap);
    }

    @Getter
    @RequiredArgsConstructor
    public static class StagePlan {

        // 依赖顺序的阶段名
        private final List<String> order;

        // Key=阶段名, Value=它依赖的阶段名
        private final Map<String, List<String>> parents;
    }
}
