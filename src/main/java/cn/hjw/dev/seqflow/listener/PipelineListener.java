package cn.hjw.dev.seqflow.listener;

import cn.hjw.dev.seqflow.item.DataItem;
import cn.hjw.dev.seqflow.processor.Stage;

import java.util.List;

/**
 * 展示层的通知接口，所有方法默认为空操作
 * 回调发生在编排线程中，实现不应长时间阻塞
 */
public interface PipelineListener {

    PipelineListener NONE = new PipelineListener() {
    };

    default void beforeTransform(Stage stage) {
    }

    default void afterTransform(Stage stage) {
    }

    default void beforeDataTransform(Stage stage, List<DataItem> items) {
    }

    default void afterDataTransform(Stage stage, List<DataItem> items) {
    }

    /**
     * @param fraction 0..1，数据项完成时为 1.0
     */
    default void progress(Stage stage, String alias, double fraction) {
    }
}
