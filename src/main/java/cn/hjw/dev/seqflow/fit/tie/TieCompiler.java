package cn.hjw.dev.seqflow.fit.tie;

import cn.hjw.dev.seqflow.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.DoubleBinaryOperator;

/**
 * 约束与公式的编译器 (递归下降)，编译结果按源字符串缓存
 * <pre>
 * tie      := "fixed" | ('=' | '<' | '>') expr
 * expr     := sum (('<'|'>'|'<='|'>='|'=='|'!=') sum)?
 * sum      := prod (('+'|'-') prod)*
 * prod     := unary (('*'|'/') unary)*
 * unary    := ('+'|'-') unary | power
 * power    := atom ('**' unary)?
 * atom     := number | name | call | '(' expr ')' | fit['alias'].name
 * </pre>
 * 只允许白名单中的函数
 */
public final class TieCompiler {

    private static final Map<String, Tie> TIE_CACHE = new ConcurrentHashMap<>();
    private static final Map<String, Expr> EXPR_CACHE = new ConcurrentHashMap<>();

    private static final Map<String, Integer> FUNCTIONS = Map.of(
            "exp", 1, "log", 1, "log10", 1, "sqrt", 1,
            "sin", 1, "cos", 1, "tan", 1, "abs", 1,
            "gau", 3, "lor", 3);

    private TieCompiler() {
    }

    /**
     * @throws ConfigurationException 约束无法解析
     */
    public static Tie compileTie(String source) {
        return TIE_CACHE.computeIfAbsent(source, TieCompiler::parseTie);
    }

    /**
     * @throws ConfigurationException 表达式无法解析
     */
    public static Expr compileExpression(String source) {
        return EXPR_CACHE.computeIfAbsent(source, s -> new Parser(s).parseAll());
    }

    public static boolean isFunction(String name) {
        return FUNCTIONS.containsKey(stripNamespace(name));
    }

    private static Tie parseTie(String source) {
        String s = source == null ? "" : source.trim();
        if (s.startsWith("fix")) {
            return new Tie(source, TieKind.FIXED, null);
        }
        if (s.isEmpty()) {
            throw new ConfigurationException("empty tie expression");
        }
        TieKind kind;
        switch (s.charAt(0)) {
            case '=':
                kind = TieKind.EQ;
                break;
            case '<':
                kind = TieKind.LT;
                break;
            case '>':
                kind = TieKind.GT;
                break;
            default:
                throw new ConfigurationException("wrong tie expression: " + source);
        }
        return new Tie(source, kind, new Parser(s.substring(1)).parseAll());
    }

    private static String stripNamespace(String name) {
        return name.startsWith("np.") ? name.substring(3) : name;
    }

    // ------------------------------------------------------------------ 词法

    private enum T { NUM, NAME, STR, OP, END }

    private static final class Token {
        final T type;
        final String text;
        final int pos;

        Token(T type, String text, int pos) {
            this.type = type;
            this.text = text;
            this.pos = pos;
        }

        boolean is(String op) {
            return type == T.OP && text.equals(op);
        }
    }

    private static List<Token> tokenize(String s) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c) || (c == '.' && i + 1 < s.length() && Character.isDigit(s.charAt(i + 1)))) {
                int j = i;
                while (j < s.length() && (Character.isDigit(s.charAt(j)) || s.charAt(j) == '.')) {
                    j++;
                }
                if (j < s.length() && (s.charAt(j) == 'e' || s.charAt(j) == 'E')) {
                    int k = j + 1;
                    if (k < s.length() && (s.charAt(k) == '+' || s.charAt(k) == '-')) {
                        k++;
                    }
                    if (k < s.length() && Character.isDigit(s.charAt(k))) {
                        j = k;
                        while (j < s.length() && Character.isDigit(s.charAt(j))) {
                            j++;
                        }
                    }
                }
                tokens.add(new Token(T.NUM, s.substring(i, j), i));
                i = j;
            } else if (Character.isLetter(c) || c == '_') {
                int j = i + 1;
                while (j < s.length()) {
                    char d = s.charAt(j);
                    if (Character.isLetterOrDigit(d) || d == '_') {
                        j++;
                    } else if (d == '.' && j + 1 < s.length() && Character.isLetter(s.charAt(j + 1))) {
                        j++;
                    } else {
                        break;
                    }
                }
                tokens.add(new Token(T.NAME, s.substring(i, j), i));
                i = j;
            } else if (c == '\'' || c == '"') {
                int j = s.indexOf(c, i + 1);
                if (j < 0) {
                    throw new ConfigurationException("unterminated string in expression: " + s);
                }
                tokens.add(new Token(T.STR, s.substring(i + 1, j), i));
                i = j + 1;
            } else {
                String two = i + 1 < s.length() ? s.substring(i, i + 2) : "";
                if (two.equals("**") || two.equals("<=") || two.equals(">=") || two.equals("==") || two.equals("!=")) {
                    tokens.add(new Token(T.OP, two, i));
                    i += 2;
                } else if ("+-*/()[],.<>".indexOf(c) >= 0) {
                    tokens.add(new Token(T.OP, String.valueOf(c), i));
                    i++;
                } else {
                    throw new ConfigurationException("unexpected character '" + c + "' in expression: " + s);
                }
            }
        }
        tokens.add(new Token(T.END, "", s.length()));
        return tokens;
    }

    // ------------------------------------------------------------------ 语法

    private static final class Parser {
        private final String source;
        private final List<Token> tokens;
        private int p;

        Parser(String source) {
            this.source = source;
            this.tokens = tokenize(source);
        }

        Expr parseAll() {
            Expr e = expr();
            if (peek().type != T.END) {
                throw error("unexpected '" + peek().text + "'");
            }
            return e;
        }

        private Token peek() {
            return tokens.get(p);
        }

        private Token next() {
            return tokens.get(p++);
        }

        private void expect(String op) {
            if (!peek().is(op)) {
                throw error("expected '" + op + "'");
            }
            p++;
        }

        private ConfigurationException error(String what) {
            return new ConfigurationException(what + " at " + peek().pos + " in expression: " + source);
        }

        private Expr expr() {
            Expr left = sum();
            Token t = peek();
            if (t.type == T.OP) {
                DoubleBinaryOperator cmp = null;
                switch (t.text) {
                    case "<":
                        cmp = (a, b) -> a < b ? 1 : 0;
                        break;
                    case ">":
                        cmp = (a, b) -> a > b ? 1 : 0;
                        break;
                    case "<=":
                        cmp = (a, b) -> a <= b ? 1 : 0;
                        break;
                    case ">=":
                        cmp = (a, b) -> a >= b ? 1 : 0;
                        break;
                    case "==":
                        cmp = (a, b) -> a == b ? 1 : 0;
                        break;
                    case "!=":
                        cmp = (a, b) -> a != b ? 1 : 0;
                        break;
                    default:
                        break;
                }
                if (cmp != null) {
                    p++;
                    return binary(left, sum(), cmp);
                }
            }
            return left;
        }

        private Expr sum() {
            Expr left = prod();
            while (peek().is("+") || peek().is("-")) {
                boolean plus = next().is("+");
                Expr right = prod();
                left = binary(left, right, plus ? Double::sum : (a, b) -> a - b);
            }
            return left;
        }

        private Expr prod() {
            Expr left = unary();
            while (peek().is("*") || peek().is("/")) {
                boolean mul = next().is("*");
                Expr right = unary();
                left = binary(left, right, mul ? (a, b) -> a * b : (a, b) -> a / b);
            }
            return left;
        }

        private Expr unary() {
            if (peek().is("-")) {
                p++;
                Expr inner = unary();
                return new Expr() {
                    @Override
                    public double eval(Scope scope) {
                        return -inner.eval(scope);
                    }

                    @Override
                    public void collect(Set<String> names, Set<String> aliases) {
                        inner.collect(names, aliases);
                    }
                };
            }
            if (peek().is("+")) {
                p++;
                return unary();
            }
            return power();
        }

        private Expr power() {
            Expr base = atom();
            if (peek().is("**")) {
                p++;
                return binary(base, unary(), Math::pow);
            }
            return base;
        }

        private Expr atom() {
            Token t = next();
            switch (t.type) {
                case NUM:
                    try {
                        double v = Double.parseDouble(t.text);
                        return constant(v);
                    } catch (NumberFormatException e) {
                        throw new ConfigurationException("bad number '" + t.text + "' in expression: " + source, e);
                    }
                case NAME:
                    return name(t);
                case OP:
                    if (t.is("(")) {
                        Expr e = expr();
                        expect(")");
                        return e;
                    }
                    break;
                default:
                    break;
            }
            p--;
            throw error("unexpected '" + t.text + "'");
        }

        private Expr name(Token t) {
            String name = t.text;
            if (name.equals("fit") && peek().is("[")) {
                p++;
                Token alias = next();
                if (alias.type != T.STR) {
                    p--;
                    throw error("expected quoted data alias");
                }
                expect("]");
                expect(".");
                Token var = next();
                if (var.type != T.NAME) {
                    p--;
                    throw error("expected parameter name");
                }
                return crossRef(alias.text, var.text);
            }
            if (peek().is("(")) {
                p++;
                String fn = stripNamespace(name);
                Integer arity = FUNCTIONS.get(fn);
                if (arity == null) {
                    throw new ConfigurationException("function '" + name + "' is not allowed in expression: " + source);
                }
                List<Expr> args = new ArrayList<>();
                args.add(expr());
                while (peek().is(",")) {
                    p++;
                    args.add(expr());
                }
                expect(")");
                if (args.size() != arity) {
                    throw new ConfigurationException(
                            "function '" + fn + "' takes " + arity + " argument(s) in expression: " + source);
                }
                return call(fn, args);
            }
            if (name.equals("pi") || name.equals("np.pi")) {
                return constant(Math.PI);
            }
            if (name.contains(".")) {
                throw new ConfigurationException("name '" + name + "' is not defined in expression: " + source);
            }
            return variable(name);
        }
    }

    // ------------------------------------------------------------------ 节点

    private static Expr constant(double v) {
        return new Expr() {
            @Override
            public double eval(Scope scope) {
                return v;
            }

            @Override
            public void collect(Set<String> names, Set<String> aliases) {
            }
        };
    }

    private static Expr variable(String name) {
        return new Expr() {
            @Override
            public double eval(Scope scope) {
                return scope.get(name);
            }

            @Override
            public void collect(Set<String> names, Set<String> aliases) {
                names.add(name);
            }
        };
    }

    private static Expr crossRef(String alias, String name) {
        return new Expr() {
            @Override
            public double eval(Scope scope) {
                return scope.get(alias, name);
            }

            @Override
            public void collect(Set<String> names, Set<String> aliases) {
                aliases.add(alias);
            }
        };
    }

    private static Expr binary(Expr a, Expr b, DoubleBinaryOperator op) {
        return new Expr() {
            @Override
            public double eval(Scope scope) {
                return op.applyAsDouble(a.eval(scope), b.eval(scope));
            }

            @Override
            public void collect(Set<String> names, Set<String> aliases) {
                a.collect(names, aliases);
                b.collect(names, aliases);
            }
        };
    }

    private static Expr call(String fn, List<Expr> args) {
        Expr[] a = args.toArray(new Expr[0]);
        return new Expr() {
            @Override
            public double eval(Scope scope) {
                double x = a[0].eval(scope);
                switch (fn) {
                    case "exp":
                        return Math.exp(x);
                    case "log":
                        return Math.log(x);
                    case "log10":
                        return Math.log10(x);
                    case "sqrt":
                        return Math.sqrt(x);
                    case "sin":
                        return Math.sin(x);
                    case "cos":
                        return Math.cos(x);
                    case "tan":
                        return Math.tan(x);
                    case "abs":
                        return Math.abs(x);
                    case "gau":
                        return gau(x, a[1].eval(scope), a[2].eval(scope));
                    case "lor":
                        return lor(x, a[1].eval(scope), a[2].eval(scope));
                    default:
                        throw new IllegalStateException("unknown function " + fn);
                }
            }

            @Override
            public void collect(Set<String> names, Set<String> aliases) {
                for (Expr e : a) {
                    e.collect(names, aliases);
                }
            }
        };
    }

    /**
     * 归一化高斯函数，m 为中心，s 为标准差
     */
    public static double gau(double x, double m, double s) {
        return 1 / (s * Math.sqrt(2 * Math.PI)) * Math.exp(-(x - m) * (x - m) / (2 * s * s));
    }

    /**
     * 归一化洛伦兹函数，m 为中心，s 为半高半宽
     */
    public static double lor(double x, double m, double s) {
        return s / Math.PI / ((x - m) * (x - m) + s * s);
    }
}
