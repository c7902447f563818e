package cn.hjw.dev.seqflow.fit;

import cn.hjw.dev.seqflow.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 拟合变量布局与约束应用测试
 */
@Slf4j
public class FitProblemTest {

    /**
     * 场景 1: fixed、lim 固定与等式约束都不进入自由变量
     */
    @Test
    public void testFreeLayout() {
        Map<String, FitParameter> vars = new LinkedHashMap<>();
        vars.put("n1", FitParameter.of(4, 0.1));
        vars.put("r1", FitParameter.of(2.0, 0.01).lim(1.5, 3));
        vars.put("s1", FitParameter.of(0.005, 1e-4).tie("fixed"));
        vars.put("e1", FitParameter.of(0, 0.1).tie("=n1/2"));
        vars.put("s0", FitParameter.of(0.9, 0.01).lim(0.8, 0.8));

        FitProblem problem = new FitProblem();
        problem.add("d", vars);

        Assertions.assertEquals(List.of("n1", "r1"), problem.freeKeys());
        Assertions.assertArrayEquals(new double[]{4, 2}, problem.initial());
        Assertions.assertArrayEquals(new double[]{Double.NEGATIVE_INFINITY, 1.5}, problem.lower());
        Assertions.assertArrayEquals(new double[]{0.1, 0.01}, problem.steps());
        Assertions.assertFalse(problem.isJoint());
        // lim 固定的变量取 min
        Assertions.assertEquals(0.8, vars.get("s0").getValue());

        FitProblem.Resolution res = problem.resolve(new double[]{6, 2.2});
        Map<String, Double> v = res.of("d");
        Assertions.assertEquals(3.0, v.get("e1"), 1e-12);
        Assertions.assertEquals(0.005, v.get("s1"), 0.0);
        Assertions.assertEquals(0.8, v.get("s0"), 0.0);
        Assertions.assertEquals(2.2, v.get("r1"), 0.0);
    }

    /**
     * 场景 2: 约束针对约束之前的作用域求值，与声明顺序无关
     */
    @Test
    public void testPreTieScope() {
        Map<String, FitParameter> vars = new LinkedHashMap<>();
        vars.put("a", FitParameter.of(1, 0.1).tie("=b + 1"));
        vars.put("b", FitParameter.of(10, 0.1).tie("=c * 2"));
        vars.put("c", FitParameter.of(5, 0.1));

        FitProblem problem = new FitProblem();
        problem.add("d", vars);
        Map<String, Double> v = problem.resolve(new double[]{7}).of("d");

        // a 看到的是 b 的原值 10，而不是约束后的 14
        Assertions.assertEquals(11.0, v.get("a"), 1e-12);
        Assertions.assertEquals(14.0, v.get("b"), 1e-12);
    }

    /**
     * 场景 3: 不等式约束保持变量自由，只做截断
     */
    @Test
    public void testInequalityClamp() {
        Map<String, FitParameter> vars = new LinkedHashMap<>();
        vars.put("r1", FitParameter.of(2.0, 0.01));
        vars.put("r2", FitParameter.of(2.5, 0.01).tie(">r1 + 0.3"));

        FitProblem problem = new FitProblem();
        problem.add("d", vars);
        Assertions.assertEquals(2, problem.size());

        FitProblem.Resolution res = problem.resolve(new double[]{2.0, 2.1});
        Assertions.assertEquals(2.3, res.of("d").get("r2"), 1e-12);
        Assertions.assertEquals(Set.of("r2"), res.getTied().get("d").keySet());
        Assertions.assertTrue(problem.resolve(new double[]{2.0, 2.6}).getTied().get("d").isEmpty());

        problem.store(new double[]{2.0, 2.1}, new double[]{0.01, 0.02}, new double[]{0.03, 0.04});
        Assertions.assertEquals(2.3, vars.get("r2").getValue(), 1e-12);
        Assertions.assertNull(vars.get("r2").getErrorA());
        Assertions.assertEquals(0.01, vars.get("r1").getErrorA());
        Assertions.assertEquals(0.03, vars.get("r1").getErrorB());
    }

    /**
     * 场景 4: 跨数据项引用
     */
    @Test
    public void testCrossItem() {
        Map<String, FitParameter> first = new LinkedHashMap<>();
        first.put("n1", FitParameter.of(6, 0.1).tie("=fit['second'].n1 / 2"));
        Map<String, FitParameter> second = new LinkedHashMap<>();
        second.put("n1", FitParameter.of(12, 0.1));

        FitProblem problem = new FitProblem();
        problem.add("first", first);
        Assertions.assertEquals(Set.of("second"), problem.referencedAliases("first"));
        problem.add("second", second);

        Assertions.assertTrue(problem.isJoint());
        Assertions.assertEquals(List.of("second.n1"), problem.freeKeys());
        Assertions.assertEquals(5.0, problem.resolve(new double[]{10}).of("first").get("n1"), 1e-12);

        Map<String, FitParameter> broken = new LinkedHashMap<>();
        broken.put("x", FitParameter.of(1, 0.1).tie("=y +* 2"));
        Assertions.assertThrows(ConfigurationException.class, () -> new FitProblem().add("b", broken));
    }

    /**
     * 场景 5: 跨进程边界后的字典形态
     */
    @Test
    public void testFromMap() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("value", 2.5);
        raw.put("step", 0.1);
        raw.put("lim", List.of(1, 4));
        raw.put("tie", "<3");

        FitParameter p = FitParameter.from(raw);

        Assertions.assertEquals(2.5, p.getValue());
        Assertions.assertEquals(4.0, p.getMax());
        Assertions.assertEquals("<3", p.getTie());
        Assertions.assertNull(p.getErrorA());
        Assertions.assertThrows(IllegalArgumentException.class, () -> FitParameter.from("2.5"));
    }

    /**
     * 场景 6: 联合拟合中每个数据项的裸变量名都在它自己的作用域中解析，
     * 其他数据项的变量只能通过 fit['alias'] 访问
     */
    @Test
    public void testJointBareNamesUseOwnScope() {
        Map<String, FitParameter> first = new LinkedHashMap<>();
        first.put("n1", FitParameter.of(6, 0.1));
        first.put("a1", FitParameter.of(1, 0.1).tie("fixed"));
        first.put("link", FitParameter.of(0, 0.1).tie("=fit['second'].n1"));
        Map<String, FitParameter> second = new LinkedHashMap<>();
        second.put("n1", FitParameter.of(3, 0.1));
        second.put("s1", FitParameter.of(0, 0.1).tie("=n1 * 0.001"));
        second.put("r1", FitParameter.of(10, 0.1).tie("<n1"));

        FitProblem problem = new FitProblem();
        problem.add("first", first);
        problem.add("second", second);
        Assertions.assertEquals(List.of("n1", "second.n1", "second.r1"), problem.freeKeys());

        FitProblem.Resolution res = problem.resolve(new double[]{8, 4, 10});
        log.info("联合作用域: {}", res.getValues());

        // second 的 n1 = 4，而不是第一个数据项的 8
        Assertions.assertEquals(0.004, res.of("second").get("s1"), 1e-12);
        Assertions.assertEquals(4.0, res.of("second").get("r1"), 1e-12);
        Assertions.assertEquals(4.0, res.of("first").get("link"), 1e-12);
        Assertions.assertEquals(8.0, res.of("first").get("n1"), 0.0);

        // 只在第一个数据项中定义的名字对第二个数据项不可见
        Map<String, FitParameter> third = new LinkedHashMap<>();
        third.put("q", FitParameter.of(0, 0.1).tie("=a1 + 1"));
        Map<String, FitParameter> plain = new LinkedHashMap<>();
        plain.put("a1", FitParameter.of(1, 0.1).tie("fixed"));
        FitProblem other = new FitProblem();
        other.add("first", plain);
        other.add("third", third);
        ConfigurationException e = Assertions.assertThrows(ConfigurationException.class,
                () -> other.resolve(other.initial()));
        Assertions.assertTrue(e.getMessage().contains("'a1'"), e.getMessage());
    }
}
