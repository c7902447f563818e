package cn.hjw.dev.seqflow;

import cn.hjw.dev.seqflow.config.PipelineConfig;
import cn.hjw.dev.seqflow.exception.ConfigurationException;
import cn.hjw.dev.seqflow.executor.StageRunner;
import cn.hjw.dev.seqflow.item.DataItem;
import cn.hjw.dev.seqflow.node.Node;
import cn.hjw.dev.seqflow.processor.Stage;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 一条流水线的全部注册信息：节点、阶段、数据项集合以及调度资源
 * 节点与阶段在构造时自动登记到这里
 */
@Slf4j
public class PipelineContext implements AutoCloseable {

    @Getter
    private final PipelineConfig config;

    private final Map<String, Node> nodes = new LinkedHashMap<>();
    private final Map<String, Stage> stages = new LinkedHashMap<>();

    // 全部数据项 (包括组合数据)，按加入顺序
    private final List<DataItem> allItems = new ArrayList<>();
    private final List<DataItem> selectedItems = new ArrayList<>();

    @Getter
    private final StageRunner runner;

    private ExecutorService threadPool;
    private ScheduledExecutorService ticker;
    private boolean ownsThreadPool;

    public PipelineContext() {
        this(PipelineConfig.defaults());
    }

    public PipelineContext(PipelineConfig config) {
        this.config = config;
        this.runner = new StageRunner(this);
    }

    /**
     * @return 节点的注册序号
     */
    public synchronized int registerNode(Node node) {
        if (nodes.containsKey(node.getName())) {
            throw new ConfigurationException("duplicate node name '" + node.getName() + "'");
        }
        nodes.put(node.getName(), node);
        return nodes.size() - 1;
    }

    public synchronized void registerStage(Stage stage) {
        if (stages.containsKey(stage.getName())) {
            throw new ConfigurationException("duplicate stage name '" + stage.getName() + "'");
        }
        if (nodes.get(stage.getFromNode().getName()) != stage.getFromNode()
                || nodes.get(stage.getToNode().getName()) != stage.getToNode()) {
            throw new ConfigurationException(
                    "stage '" + stage.getName() + "' refers to a node unknown to this pipeline");
        }
        stages.put(stage.getName(), stage);
        Node.link(stage, stage.getFromNode(), stage.getToNode());
        log.debug("Registered {} : {} -> {}", stage, stage.getFromNode().getName(), stage.getToNode().getName());
    }

    public synchronized Node getNode(String name) {
        return nodes.get(name);
    }

    public synchronized Stage getStage(String name) {
        return stages.get(name);
    }

    public synchronized Collection<Node> getNodes() {
        return Collections.unmodifiableCollection(new ArrayList<>(nodes.values()));
    }

    public synchronized Collection<Stage> getStages() {
        return Collections.unmodifiableCollection(new ArrayList<>(stages.values()));
    }

    // --- 数据项 ---

    public synchronized DataItem addItem(DataItem item) {
        if (findItem(item.getAlias()) != null) {
            throw new ConfigurationException("duplicate data alias '" + item.getAlias() + "'");
        }
        allItems.add(item);
        return item;
    }

    public synchronized DataItem findItem(String alias) {
        for (DataItem item : allItems) {
            if (item.getAlias().equals(alias)) {
                return item;
            }
        }
        return null;
    }

    public synchronized List<DataItem> getAllItems() {
        return new ArrayList<>(allItems);
    }

    public synchronized List<DataItem> getSelectedItems() {
        return new ArrayList<>(selectedItems);
    }

    public synchronized void select(List<DataItem> items) {
        selectedItems.clear();
        selectedItems.addAll(items);
    }

    // --- 调度资源 ---

    public synchronized ExecutorService getThreadPool() {
        if (threadPool == null) {
            if (config.getThreadPool() != null) {
                threadPool = config.getThreadPool();
            } else {
                threadPool = Executors.newCachedThreadPool(daemonFactory("seqflow-worker-"));
                ownsThreadPool = true;
            }
        }
        return threadPool;
    }

    public synchronized ScheduledExecutorService getTicker() {
        if (ticker == null) {
            ticker = Executors.newSingleThreadScheduledExecutor(daemonFactory("seqflow-progress-"));
        }
        return ticker;
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public synchronized void close() {
        if (ticker != null) {
            ticker.shutdownNow();
            ticker = null;
        }
        if (threadPool != null && ownsThreadPool) {
            threadPool.shutdownNow();
        }
        threadPool = null;
    }
}
