package cn.hjw.dev.seqflow.fit.tie;

import cn.hjw.dev.seqflow.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

/**
 * 约束表达式编译测试
 */
@Slf4j
public class TieCompilerTest {

    private final Scope scope = new MapScope(
            Map.of("a", 2.0, "b", 3.0, "r1", 2.5),
            Map.of("other", Map.of("n1", 8.0)));

    private double eval(String expr) {
        return TieCompiler.compileExpression(expr).eval(scope);
    }

    /**
     * 场景 1: 运算优先级与内置函数
     */
    @Test
    public void testArithmetic() {
        Assertions.assertEquals(8.0, eval("a + b * 2"), 1e-12);
        Assertions.assertEquals(-9.0, eval("-b**2"), 1e-12);
        Assertions.assertEquals(512.0, eval("a**b**2"), 1e-12);
        Assertions.assertEquals(0.25, eval("a ** -2"), 1e-12);
        Assertions.assertEquals(2.5e-3, eval("r1 * 1e-3"), 1e-15);
        Assertions.assertEquals(Math.sqrt(2.0) + Math.PI, eval("np.sqrt(a) + pi"), 1e-12);
        Assertions.assertEquals(1.0, eval("a < b"), 0.0);
        Assertions.assertEquals(0.0, eval("a >= b"), 0.0);
        Assertions.assertEquals(TieCompiler.gau(1.0, 0.0, 2.0), eval("gau(1, 0, a)"), 1e-15);
        Assertions.assertEquals(1 / (Math.PI * 2.0), eval("lor(b, b, a)"), 1e-15);
        Assertions.assertEquals(4.0, eval("fit['other'].n1 / a"), 1e-12);
    }

    /**
     * 场景 2: 约束种类与引用收集
     */
    @Test
    public void testTieKinds() {
        Tie eq = TieCompiler.compileTie("=fit['other'].n1/2 + a");
        Assertions.assertEquals(TieKind.EQ, eq.getKind());
        Assertions.assertEquals(Set.of("a"), eq.getNames());
        Assertions.assertEquals(Set.of("other"), eq.getAliases());
        Assertions.assertEquals(6.0, eq.apply(100.0, scope), 1e-12);

        Tie lt = TieCompiler.compileTie("< a*1.5");
        Assertions.assertTrue(lt.getKind().keepsFree());
        Assertions.assertEquals(3.0, lt.apply(3.5, scope), 1e-12);
        Assertions.assertNull(lt.apply(2.9, scope));

        Tie gt = TieCompiler.compileTie(">b");
        Assertions.assertEquals(3.0, gt.apply(1.0, scope), 1e-12);
        Assertions.assertNull(gt.apply(3.1, scope));

        Tie fixed = TieCompiler.compileTie("fixed");
        Assertions.assertEquals(TieKind.FIXED, fixed.getKind());
        Assertions.assertEquals(7.0, fixed.apply(7.0, scope), 0.0);

        Assertions.assertSame(eq, TieCompiler.compileTie("=fit['other'].n1/2 + a"));
    }

    /**
     * 场景 3: 非法表达式与未定义的名字
     */
    @Test
    public void testErrors() {
        Assertions.assertThrows(ConfigurationException.class, () -> TieCompiler.compileTie("a + 1"));
        Assertions.assertThrows(ConfigurationException.class, () -> TieCompiler.compileTie("="));
        Assertions.assertThrows(ConfigurationException.class, () -> TieCompiler.compileExpression("(a + 1"));
        Assertions.assertThrows(ConfigurationException.class, () -> TieCompiler.compileExpression("a $ b"));
        ConfigurationException e = Assertions.assertThrows(ConfigurationException.class,
                () -> TieCompiler.compileExpression("os.system(1)"));
        log.info("预期的拒绝: {}", e.getMessage());
        Assertions.assertThrows(ConfigurationException.class, () -> TieCompiler.compileExpression("exp(a, b)"));

        Assertions.assertThrows(ConfigurationException.class, () -> eval("c + 1"));
        ConfigurationException ref = Assertions.assertThrows(ConfigurationException.class,
                () -> eval("fit['missing'].n1"));
        Assertions.assertEquals("invalid data reference fit['missing']", ref.getMessage());
        Assertions.assertTrue(TieCompiler.isFunction("np.exp"));
        Assertions.assertFalse(TieCompiler.isFunction("x"));
    }
}
