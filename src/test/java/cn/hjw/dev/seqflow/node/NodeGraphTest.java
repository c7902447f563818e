package cn.hjw.dev.seqflow.node;

import cn.hjw.dev.seqflow.PipelineContext;
import cn.hjw.dev.seqflow.exception.ConfigurationException;
import cn.hjw.dev.seqflow.processor.Transform;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

/**
 * 节点图的维护测试
 * 验证：阶段注册后上下游列表相互一致、按注册顺序排列，以及构造期的配置错误
 */
@Slf4j
public class NodeGraphTest {

    private static Node node(PipelineContext ctx, String name) {
        return new Node(ctx, name, List.of(ArraySpec.of("x", ArrayRole.X), ArraySpec.of(name + "_y", "1D")));
    }

    private static Transform link(PipelineContext ctx, String name, Node from, Node to) {
        return Transform.builder().context(ctx).name(name).fromNode(from).toNode(to)
                .body((data, support) -> Boolean.TRUE)
                .build();
    }

    /**
     * 场景 1: 链 a -> b -> c 加上分支 b -> d
     * 上下游列表应包含所有传递可达的节点，并按节点注册顺序排列
     */
    @Test
    public void testUpstreamDownstreamConsistency() {
        PipelineContext ctx = new PipelineContext();
        Node a = node(ctx, "a");
        Node b = node(ctx, "b");
        Node c = node(ctx, "c");
        Node d = node(ctx, "d");

        // 故意先注册下游的阶段
        link(ctx, "b2c", b, c);
        link(ctx, "a2b", a, b);
        link(ctx, "b2d", b, d);

        Assertions.assertEquals(List.of(b, c, d), a.getDownstreamNodes());
        Assertions.assertEquals(List.of(c, d), b.getDownstreamNodes());
        Assertions.assertEquals(List.of(a, b), c.getUpstreamNodes());
        Assertions.assertEquals(List.of(a, b), d.getUpstreamNodes());
        Assertions.assertTrue(c.getDownstreamNodes().isEmpty());

        // 对称性: x 在 y 的下游 <=> y 在 x 的上游
        for (Node x : List.of(a, b, c, d)) {
            for (Node y : x.getDownstreamNodes()) {
                Assertions.assertTrue(y.getUpstreamNodes().contains(x), y + " should see " + x + " upstream");
            }
        }
        Assertions.assertEquals("a2b", b.getTransformIn().getName());
    }

    /**
     * 场景 2: isBetween 的开闭区间
     */
    @Test
    public void testIsBetween() {
        PipelineContext ctx = new PipelineContext();
        Node a = node(ctx, "a");
        Node b = node(ctx, "b");
        Node c = node(ctx, "c");
        link(ctx, "a2b", a, b);
        link(ctx, "b2c", b, c);

        Assertions.assertTrue(b.isBetween(a, c, false, false));
        Assertions.assertTrue(a.isBetween(a, c, true, false));
        Assertions.assertFalse(a.isBetween(a, c, false, false));
        Assertions.assertFalse(c.isBetween(a, c, true, false));
        Assertions.assertTrue(c.isBetween(a, c, true, true));
        // 右端开放
        Assertions.assertTrue(c.isBetween(b, null, true, false));
        Assertions.assertFalse(a.isBetween(b, null, true, false));
    }

    /**
     * 场景 3: 原地阶段不改动图结构，也不覆盖 transformIn
     */
    @Test
    public void testInPlaceStage() {
        PipelineContext ctx = new PipelineContext();
        Node a = node(ctx, "a");
        Node b = node(ctx, "b");
        link(ctx, "a2b", a, b);
        Transform inPlace = link(ctx, "smooth", b, b);

        Assertions.assertTrue(inPlace.isInPlace());
        Assertions.assertEquals("a2b", b.getTransformIn().getName());
        Assertions.assertTrue(b.getTransformsOut().contains(inPlace));
        Assertions.assertFalse(b.getDownstreamNodes().contains(b));
        Assertions.assertFalse(b.getUpstreamNodes().contains(b));
    }

    /**
     * 场景 4: 构造期的配置错误
     */
    @Test
    public void testConfigurationErrors() {
        PipelineContext ctx = new PipelineContext();
        Node a = node(ctx, "a");

        Assertions.assertThrows(ConfigurationException.class, () -> node(ctx, "a"), "duplicate node name");
        Assertions.assertThrows(ConfigurationException.class, () -> new Node(ctx, "twoX",
                List.of(ArraySpec.of("x", ArrayRole.X), ArraySpec.of("k", ArrayRole.X))));
        Assertions.assertThrows(ConfigurationException.class, () -> ArraySpec.of("y", "4D"));

        link(ctx, "a2a", a, a);
        Assertions.assertThrows(ConfigurationException.class, () -> link(ctx, "a2a", a, a), "duplicate stage name");

        PipelineContext other = new PipelineContext();
        Node foreign = node(other, "foreign");
        ConfigurationException e = Assertions.assertThrows(ConfigurationException.class,
                () -> link(ctx, "a2foreign", a, foreign));
        log.info("预期的配置错误: {}", e.getMessage());
        Assertions.assertTrue(a.getDownstreamNodes().isEmpty());
    }

    /**
     * 场景 5: 数组角色与绘图维数
     */
    @Test
    public void testArrayRoles() {
        PipelineContext ctx = new PipelineContext();
        Node n = new Node(ctx, "map", List.of(
                ArraySpec.of("x", "x"),
                ArraySpec.of("i0", "y"),
                ArraySpec.of("img", "2D")));
        Assertions.assertEquals("x", n.getAxisArray());
        Assertions.assertEquals(2, n.getPlotDimension());
        Assertions.assertEquals(List.of("img"), n.getArrayNames(ArrayRole.TWO_D));
        Assertions.assertEquals(List.of("x", "i0", "img"), n.getArrayNames());
    }
}
