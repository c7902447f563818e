package cn.hjw.dev.seqflow.executor;

import cn.hjw.dev.seqflow.PipelineContext;
import cn.hjw.dev.seqflow.config.PipelineConfig;
import cn.hjw.dev.seqflow.config.StageGovernance;
import cn.hjw.dev.seqflow.exception.ConfigurationException;
import cn.hjw.dev.seqflow.exception.MissingInputException;
import cn.hjw.dev.seqflow.item.Combiner;
import cn.hjw.dev.seqflow.item.DataItem;
import cn.hjw.dev.seqflow.item.DataState;
import cn.hjw.dev.seqflow.listener.PipelineListener;
import cn.hjw.dev.seqflow.node.Node;
import cn.hjw.dev.seqflow.numeric.NumericPolicy;
import cn.hjw.dev.seqflow.processor.EligibilityRule;
import cn.hjw.dev.seqflow.processor.EligibilityRule.Verdict;
import cn.hjw.dev.seqflow.processor.Params;
import cn.hjw.dev.seqflow.processor.Stage;
import cn.hjw.dev.seqflow.processor.StageSupport;
import cn.hjw.dev.seqflow.undo.UndoRecord;
import cn.hjw.dev.seqflow.worker.ProcessWorkerPool;
import cn.hjw.dev.seqflow.worker.Progress;
import cn.hjw.dev.seqflow.worker.ThreadWorkerPool;
import cn.hjw.dev.seqflow.worker.WorkerExecution;
import cn.hjw.dev.seqflow.worker.WorkerHandle;
import cn.hjw.dev.seqflow.worker.WorkerPool;
import cn.hjw.dev.seqflow.worker.WorkerResult;
import cn.hjw.dev.seqflow.worker.WorkerTask;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 阶段执行器：参数合并 -> 资格过滤 -> 分派 -> 合并结果 -> 组合数据与下游级联
 * 只有 {@link ConfigurationException} 会从 run() 中抛出，单个数据项的失败记录在数据项上
 */
@Slf4j
public class StageRunner {

    private final PipelineContext context;
    private final List<EligibilityRule> rules;

    public StageRunner(PipelineContext context) {
        this(context, EligibilityRules.DEFAULT);
    }

    public StageRunner(PipelineContext context, List<EligibilityRule> rules) {
        this.context = context;
        this.rules = rules;
    }

    /**
     * 执行阶段
     * @param params        合并到每个数据项的参数
     * @param runDownstream 是否级联执行下游阶段
     * @param items         为 null 时使用当前选中的数据项
     * @return 执行后 error 不为空的输入数据项
     */
    public List<DataItem> run(Stage stage, Map<String, Object> params, boolean runDownstream, List<DataItem> items) {
        List<DataItem> input = items != null ? new ArrayList<>(items) : context.getSelectedItems();
        Map<String, Object> newParams = params != null ? params : Map.of();
        PipelineConfig config = context.getConfig();
        PipelineListener listener = config.getListener();

        // 1. 配置错误在任何执行之前抛出
        for (String key : newParams.keySet()) {
            if (!stage.getDefaultParams().containsKey(key)) {
                throw new ConfigurationException("unknown parameter '" + key + "' for stage '" + stage.getName() + "'");
            }
        }
        StageGovernance gov = stage.getGovernance();
        int nThreads = gov.resolveThreads();
        int nProcesses = gov.resolveProcesses();
        boolean parallel = nThreads > 1 || nProcesses > 1;
        if (parallel && stage.getCapabilities().isWantsAllItems()) {
            throw new ConfigurationException(
                    "stage '" + stage.getName() + "' needs all data items and cannot run in parallel workers");
        }
        stage.checkConfiguration(input, newParams);

        // 2. 撤销记录与参数合并
        if (!newParams.isEmpty()) {
            offerUndo(stage, input, newParams);
            for (DataItem item : input) {
                stage.paramsOf(item).putAll(Params.copy(newParams));
            }
        }

        listener.beforeTransform(stage);
        long t0 = System.nanoTime();
        NumericPolicy.Mode previous = NumericPolicy.enter(NumericPolicy.Mode.STRICT);
        try {
            List<DataItem> eligible = filter(stage, input);
            listener.beforeDataTransform(stage, eligible);
            if (!eligible.isEmpty()) {
                if (nThreads > 1) {
                    dispatchParallel(stage, eligible, nThreads,
                            new ThreadWorkerPool(context.getThreadPool(), context.getTicker(), stage.getBody()));
                } else if (nProcesses > 1) {
                    dispatchParallel(stage, eligible, nProcesses,
                            new ProcessWorkerPool(stage.getBody(), config.getJavaCommand(),
                                    config.getClasspath(), config.getJvmArgs()));
                } else {
                    dispatchSequential(stage, eligible);
                }
            }
            listener.afterDataTransform(stage, eligible);
        } finally {
            NumericPolicy.restore(previous);
        }
        log.info("{} done for {} item(s) in {} s", stage.getName(), input.size(),
                String.format("%.3f", (System.nanoTime() - t0) * 1e-9));

        // 3. 组合数据与下游
        List<DataItem> combos = refreshCombinations(stage, input);
        if (runDownstream) {
            runDownstream(stage, input, combos);
        }
        listener.afterTransform(stage);

        List<DataItem> failed = input.stream().filter(d -> d.getError() != null).collect(Collectors.toList());
        if (!failed.isEmpty()) {
            log.warn("{} finished with errors in {}", stage.getName(),
                    failed.stream().map(DataItem::getAlias).collect(Collectors.toList()));
        }
        return failed;
    }

    private void offerUndo(Stage stage, List<DataItem> items, Map<String, Object> newParams) {
        List<Map<String, Object>> previous = new ArrayList<>();
        for (DataItem item : items) {
            Map<String, Object> own = stage.paramsOf(item);
            Map<String, Object> old = new LinkedHashMap<>();
            newParams.keySet().forEach(k -> old.put(k, Params.copyValue(own.get(k))));
            previous.add(old);
        }
        try {
            context.getConfig().getUndoListener().record(
                    new UndoRecord(stage, items, previous, Params.copy(newParams)));
        } catch (RuntimeException e) {
            log.warn("Undo listener failed for {}: {}", stage.getName(), e.getMessage());
        }
    }

    private List<DataItem> filter(Stage stage, List<DataItem> items) {
        Node to = stage.getToNode();
        List<DataItem> eligible = new ArrayList<>();
        for (DataItem item : items) {
            Verdict v = EligibilityRules.evaluate(rules, stage, item);
            if (v == null) {
                item.setError(null);
                eligible.add(item);
                continue;
            }
            switch (v) {
                case MARK_BAD:
                    item.setState(to, DataState.BAD);
                    break;
                case MARK_UNDEFINED:
                    item.setState(to, DataState.UNDEFINED);
                    break;
                case FOLLOW_SOURCE:
                    item.setState(to, item.getState(stage.getFromNode()));
                    break;
                default:
                    break;
            }
            log.debug("{} skipped [{}]: {}", stage.getName(), item.getAlias(), v);
        }
        return eligible;
    }

    /**
     * 复制输入；缺少声明的输入数组时数据项直接置 BAD
     * @return null 表示该数据项不再分派
     */
    private WorkerTask capture(Stage stage, DataItem item) {
        try {
            return WorkerTask.capture(stage, item);
        } catch (MissingInputException e) {
            item.setError(e.getMessage());
            item.setState(stage.getToNode(), DataState.BAD);
            stage.erase(item);
            item.setBeingTransformed(null);
            return null;
        }
    }

    private void dispatchSequential(Stage stage, List<DataItem> items) {
        PipelineListener listener = context.getConfig().getListener();
        for (DataItem item : items) {
            item.setBeingTransformed(stage.getName());
            long t0 = System.nanoTime();
            WorkerTask task = capture(stage, item);
            if (task == null) {
                continue;
            }
            Progress progress = new Progress();
            StageSupport support = new StageSupport() {
                @Override
                public Progress getProgress() {
                    return progress;
                }

                @Override
                public List<DataItem> getAllItems() {
                    return context.getAllItems();
                }
            };
            ScheduledFuture<?> relay = null;
            if (task.isWantsProgress()) {
                long period = task.getProgressPeriodMillis();
                relay = context.getTicker().scheduleAtFixedRate(
                        () -> listener.progress(stage, item.getAlias(), progress.get()),
                        period, period, TimeUnit.MILLISECONDS);
            }
            WorkerResult result;
            try {
                result = WorkerExecution.execute(stage.getBody(), task, support);
            } finally {
                if (relay != null) {
                    relay.cancel(false);
                }
            }
            if (task.isWantsProgress()) {
                listener.progress(stage, item.getAlias(), 1.0);
            }
            merge(stage, item, result, System.nanoTime() - t0);
        }
    }

    private void dispatchParallel(Stage stage, List<DataItem> items, int nWorkers, WorkerPool pool) {
        PipelineListener listener = context.getConfig().getListener();
        long timeout = stage.getGovernance().getTimeoutMillis();
        log.debug("{} dispatching {} item(s) to {} {} worker(s)",
                stage.getName(), items.size(), nWorkers, pool.getWorkerType());
        try (pool) {
            for (int start = 0; start < items.size(); start += nWorkers) {
                List<DataItem> group = items.subList(start, Math.min(start + nWorkers, items.size()));
                long t0 = System.nanoTime();
                Map<DataItem, WorkerHandle> handles = new LinkedHashMap<>();
                for (DataItem item : group) {
                    item.setBeingTransformed(stage.getName());
                    WorkerTask task = capture(stage, item);
                    if (task == null) {
                        continue;
                    }
                    try {
                        handles.put(item, pool.submit(task));
                    } catch (RuntimeException e) {
                        log.error("{} cannot start a {} worker for [{}]",
                                stage.getName(), pool.getWorkerType(), item.getAlias(), e);
                        merge(stage, item, WorkerResult.failed(item.getAlias(),
                                WorkerExecution.formatError(task, e)), 0);
                    }
                }
                ScheduledFuture<?> relay = null;
                if (stage.getCapabilities().isWantsProgress() && !handles.isEmpty()) {
                    long period = Math.max(1L, Math.round(stage.getGovernance().getProgressTimeDelta() * 1000));
                    relay = context.getTicker().scheduleAtFixedRate(
                            () -> forwardProgress(stage, pool, handles, listener), period, period, TimeUnit.MILLISECONDS);
                }
                long deadline = System.currentTimeMillis() + timeout;
                Map<DataItem, WorkerResult> results = new LinkedHashMap<>();
                for (Map.Entry<DataItem, WorkerHandle> e : handles.entrySet()) {
                    long left = deadline - System.currentTimeMillis();
                    results.put(e.getKey(), pool.join(e.getValue(), left));
                }
                if (relay != null) {
                    relay.cancel(false);
                    forwardProgress(stage, pool, handles, listener);
                }
                long elapsed = System.nanoTime() - t0;
                // 按原始顺序合并
                results.forEach((item, result) -> merge(stage, item, result, elapsed));
            }
        }
    }

    private static void forwardProgress(Stage stage, WorkerPool pool, Map<DataItem, WorkerHandle> handles,
                                        PipelineListener listener) {
        handles.forEach((item, handle) -> {
            List<Double> values = pool.drainProgress(handle);
            if (!values.isEmpty()) {
                listener.progress(stage, item.getAlias(), values.get(values.size() - 1));
            }
        });
    }

    private void merge(Stage stage, DataItem item, WorkerResult result, long elapsedNanos) {
        Node to = stage.getToNode();
        if (!result.isCompleted()) {
            item.setState(to, DataState.UNDEFINED);
            item.setError("failed \"" + stage.getName() + "\" for data: " + item.getAlias()
                    + "\nthe worker timed out after " + stage.getGovernance().getTimeoutMillis() + " ms");
        } else {
            if (result.getOutArrays() != null) {
                result.getOutArrays().forEach(item::setArray);
            }
            if (result.getParams() != null) {
                stage.paramsOf(item).putAll(result.getParams());
            }
            if (result.isMathError()) {
                item.setState(to, DataState.MATH_ERROR);
                item.setError(result.getError());
            } else if (result.isGood()) {
                item.setState(to, DataState.GOOD);
                item.setError(null);
            } else {
                item.setState(to, DataState.BAD);
                item.setError(result.getError());
            }
        }
        if (item.getError() != null) {
            log.debug("{} failed for [{}]", stage.getName(), item.getAlias());
        }
        item.getTransformTimes().put(stage.getName(), elapsedNanos * 1e-9);
        item.setBeingTransformed(null);
    }

    /**
     * 重新计算以目标节点为起点的组合数据，并对其执行该节点上的原地阶段
     */
    private List<DataItem> refreshCombinations(Stage stage, List<DataItem> items) {
        Node to = stage.getToNode();
        Set<DataItem> combos = new LinkedHashSet<>();
        for (DataItem item : items) {
            for (DataItem combo : item.getCombinesTo()) {
                if (combo.getOriginNode() == to) {
                    combos.add(combo);
                }
            }
        }
        for (DataItem combo : combos) {
            boolean allGood = combo.getMadeOf().stream().allMatch(d -> d.getState(to) == DataState.GOOD);
            if (!allGood) {
                combo.setState(to, DataState.BAD);
                continue;
            }
            Combiner.combine(combo);
            for (Stage tr : to.getTransformsOut()) {
                if (tr.isInPlace()) {
                    tr.run(Map.of(), false, List.of(combo));
                }
            }
        }
        return new ArrayList<>(combos);
    }

    private void runDownstream(Stage stage, List<DataItem> input, List<DataItem> combos) {
        Set<DataItem> union = new LinkedHashSet<>(input);
        union.addAll(combos);
        Set<String> branches = input.stream()
                .map(DataItem::getBranch)
                .filter(b -> b != null)
                .collect(Collectors.toSet());
        if (!branches.isEmpty()) {
            for (DataItem d : context.getAllItems()) {
                if (branches.contains(d.getBranch())) {
                    union.add(d);
                }
            }
        }
        List<DataItem> next = new ArrayList<>(union);
        for (Stage tr : stage.getToNode().getTransformsOut()) {
            // 原地阶段之间不互相级联
            if (tr == stage || (tr.isInPlace() && stage.isInPlace())) {
                continue;
            }
            tr.run(Map.of(), true, next);
        }
    }
}
