package com.sysmuse.math.convert;

import com.sysmuse.math.expr.AbsExpr;
import com.sysmuse.math.expr.CombExpr;
import com.sysmuse.math.expr.ConstExpr;
import com.sysmuse.math.expr.ConstType;
import com.sysmuse.math.expr.DivExpr;
import com.sysmuse.math.expr.Expr;
import com.sysmuse.math.expr.FracExpr;
import com.sysmuse.math.expr.IntExpr;
import com.sysmuse.math.expr.LogExpr;
import com.sysmuse.math.expr.PermExpr;
import com.sysmuse.math.expr.PowExpr;
import com.sysmuse.math.expr.ProdExpr;
import com.sysmuse.math.expr.RootExpr;
import com.sysmuse.math.expr.SumExpr;
import com.sysmuse.math.expr.TrigExpr;
import com.sysmuse.math.expr.TrigFunc;
import com.sysmuse.math.expr.VarExpr;
import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.node.AnsNode;
import com.sysmuse.math.node.CombinationNode;
import com.sysmuse.math.node.ConstantNode;
import com.sysmuse.math.node.DerivativeNode;
import com.sysmuse.math.node.ExponentNode;
import com.sysmuse.math.node.FractionNode;
import com.sysmuse.math.node.IntegralNode;
import com.sysmuse.math.node.LiteralNode;
import com.sysmuse.math.node.LogNode;
import com.sysmuse.math.node.MathNode;
import com.sysmuse.math.node.NewlineNode;
import com.sysmuse.math.node.ParenthesisNode;
import com.sysmuse.math.node.PermutationNode;
import com.sysmuse.math.node.ProductNode;
import com.sysmuse.math.node.RootNode;
import com.sysmuse.math.node.SummationNode;
import com.sysmuse.math.node.TrigNode;
import com.sysmuse.math.node.UnitVectorNode;
import com.sysmuse.math.numeric.NumericEvaluator;
import com.sysmuse.math.serial.MathExpressionSerializer;
import com.sysmuse.util.LoggingUtil;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Converts the editor's node tree into an {@link Expr} for exact evaluation.
 *
 * Structured nodes become pre-built expression tokens, literal text is scanned
 * into numbers, operators and names, and the token stream is parsed with the
 * usual precedence. Implicit multiplication is inserted where two operands meet.
 */
public class MathNodeToExpr {

    /** Upper bound on the number of terms an exact summation or product expands to. */
    public static final int MAX_EXACT_SERIES_TERMS = 1000;

    /** Decimal places kept when a numeric calculus result enters the exact tree. */
    private static final int CALCULUS_SCALE = 10;

    private static final Pattern TYPED_ANS = Pattern.compile("(?i)ans\\d{1,9}");

    private final Map<Integer, Expr> ansExpressions;
    private final NumericEvaluator numericEvaluator;

    public MathNodeToExpr(Map<Integer, Expr> ansExpressions) {
        this.ansExpressions = ansExpressions == null ? Collections.emptyMap() : ansExpressions;
        this.numericEvaluator = new NumericEvaluator(FormatSettings.defaults());
    }

    /**
     * Convert and simplify a node list. Empty input yields 0.
     */
    public static Expr convert(List<MathNode> nodes, Map<Integer, Expr> ansExpressions) {
        return new MathNodeToExpr(ansExpressions).convert(nodes);
    }

    public Expr convert(List<MathNode> nodes) {
        if (nodes == null || nodes.isEmpty()) {
            return IntExpr.ZERO;
        }

        List<Token> tokens = new ArrayList<>();
        for (MathNode node : nodes) {
            tokenizeNode(node, tokens);
        }
        if (tokens.isEmpty()) {
            return IntExpr.ZERO;
        }

        tokens = insertImplicitMultiplication(tokens);
        return new TokenParser(tokens).parse().simplify();
    }

    private void tokenizeNode(MathNode node, List<Token> tokens) {
        if (node instanceof LiteralNode) {
            tokenizeLiteral(((LiteralNode) node).getText(), tokens);
        } else if (node instanceof FractionNode) {
            FractionNode frac = (FractionNode) node;
            tokens.add(Token.ofExpr(new DivExpr(convert(frac.getNumerator()), convert(frac.getDenominator()))));
        } else if (node instanceof ExponentNode) {
            ExponentNode exp = (ExponentNode) node;
            tokens.add(Token.ofExpr(new PowExpr(convert(exp.getBase()), convert(exp.getPower()))));
        } else if (node instanceof RootNode) {
            RootNode root = (RootNode) node;
            Expr index = root.isSquareRoot() ? IntExpr.TWO : convert(root.getIndex());
            tokens.add(Token.ofExpr(new RootExpr(convert(root.getRadicand()), index)));
        } else if (node instanceof LogNode) {
            LogNode log = (LogNode) node;
            Expr argument = convert(log.getArgument());
            tokens.add(Token.ofExpr(log.isNaturalLog()
                    ? LogExpr.ln(argument)
                    : new LogExpr(convert(log.getBase()), argument, false)));
        } else if (node instanceof TrigNode) {
            tokens.add(Token.ofExpr(trigToExpr((TrigNode) node)));
        } else if (node instanceof ParenthesisNode) {
            tokens.add(Token.ofExpr(convert(((ParenthesisNode) node).getContent())));
        } else if (node instanceof PermutationNode) {
            PermutationNode perm = (PermutationNode) node;
            tokens.add(Token.ofExpr(new PermExpr(convert(perm.getN()), convert(perm.getR()))));
        } else if (node instanceof CombinationNode) {
            CombinationNode comb = (CombinationNode) node;
            tokens.add(Token.ofExpr(new CombExpr(convert(comb.getN()), convert(comb.getR()))));
        } else if (node instanceof ConstantNode) {
            String symbol = ((ConstantNode) node).getConstant();
            ConstType type = ConstType.fromSymbol(symbol);
            tokens.add(Token.ofExpr(type != null ? new ConstExpr(type) : new VarExpr(symbol)));
        } else if (node instanceof AnsNode) {
            tokens.add(Token.ofExpr(ansToExpr((AnsNode) node)));
        } else if (node instanceof SummationNode) {
            SummationNode sum = (SummationNode) node;
            tokens.add(Token.ofExpr(expandSeries(node, sum.getVariable(), sum.getLower(), sum.getUpper(),
                    sum.getBody(), false)));
        } else if (node instanceof ProductNode) {
            ProductNode prod = (ProductNode) node;
            tokens.add(Token.ofExpr(expandSeries(node, prod.getVariable(), prod.getLower(), prod.getUpper(),
                    prod.getBody(), true)));
        } else if (node instanceof DerivativeNode || node instanceof IntegralNode) {
            tokens.add(Token.ofExpr(numericLiteral(node)));
        } else if (node instanceof UnitVectorNode) {
            tokens.add(Token.ofExpr(new VarExpr("e_" + ((UnitVectorNode) node).getAxis())));
        } else if (!(node instanceof NewlineNode)) {
            LoggingUtil.debug("Skipping unsupported node type: " + node.getType());
        }
    }

    private Expr trigToExpr(TrigNode node) {
        Expr argument = convert(node.getArgument());
        String name = node.getFunction().toLowerCase(Locale.ROOT);
        if ("abs".equals(name)) {
            return new AbsExpr(argument);
        }
        TrigFunc func = TrigFunc.fromName(name);
        if (func == null) {
            LoggingUtil.debug("Unknown function '" + node.getFunction() + "', treating as sin");
            func = TrigFunc.SIN;
        }
        return new TrigExpr(func, argument);
    }

    private Expr ansToExpr(AnsNode node) {
        return ansToExpr(literalText(node.getIndex()).trim());
    }

    private Expr ansToExpr(String indexText) {
        Integer index = parseIndex(indexText);
        if (index != null && ansExpressions.containsKey(index)) {
            return ansExpressions.get(index);
        }
        return new VarExpr("ans" + indexText);
    }

    private static Integer parseIndex(String text) {
        if (!text.matches("-?\\d{1,9}")) {
            return null;
        }
        return Integer.parseInt(text);
    }

    /**
     * Expand a summation or product with integer bounds term by term.
     * Anything else is evaluated numerically.
     */
    private Expr expandSeries(MathNode node, List<MathNode> variable, List<MathNode> lower,
                              List<MathNode> upper, List<MathNode> body, boolean product) {
        String var = literalText(variable).trim();
        Expr lo = convert(lower);
        Expr hi = convert(upper);

        if (!var.isEmpty() && lo instanceof IntExpr && hi instanceof IntExpr) {
            BigInteger start = ((IntExpr) lo).getValue();
            BigInteger end = ((IntExpr) hi).getValue();
            BigInteger count = end.subtract(start).add(BigInteger.ONE);

            if (count.signum() <= 0) {
                return product ? IntExpr.ONE : IntExpr.ZERO;
            }
            if (count.compareTo(BigInteger.valueOf(MAX_EXACT_SERIES_TERMS)) <= 0) {
                Expr bodyExpr = convert(body);
                List<Expr> parts = new ArrayList<>();
                for (BigInteger i = start; i.compareTo(end) <= 0; i = i.add(BigInteger.ONE)) {
                    parts.add(bodyExpr.substitute(var, new IntExpr(i)));
                }
                if (parts.size() == 1) {
                    return parts.get(0).simplify();
                }
                return (product ? new ProdExpr(parts) : new SumExpr(parts)).simplify();
            }
            LoggingUtil.debug("Series over " + count + " terms exceeds exact limit, evaluating numerically");
        }
        return numericLiteral(node);
    }

    /**
     * Evaluate a node numerically and bring the value back as an exact decimal.
     * When evaluation fails the serialized text stays in the tree as a free symbol.
     */
    private Expr numericLiteral(MathNode node) {
        String text = MathExpressionSerializer.serialize(List.of(node));
        Double value = numericEvaluator.evaluateToDouble(text);
        if (value == null || value.isNaN() || value.isInfinite()) {
            LoggingUtil.debug("Numeric evaluation failed for '" + text + "'");
            return new VarExpr(text);
        }
        return decimalToExpr(value);
    }

    static Expr decimalToExpr(double value) {
        if (Math.abs(value - Math.rint(value)) < 1e-10) {
            return new IntExpr(BigDecimal.valueOf(Math.rint(value)).toBigInteger());
        }
        BigDecimal decimal = BigDecimal.valueOf(value)
                .setScale(CALCULUS_SCALE, RoundingMode.HALF_UP)
                .stripTrailingZeros();
        return new FracExpr(new IntExpr(decimal.unscaledValue()),
                new IntExpr(BigInteger.TEN.pow(decimal.scale()))).simplify();
    }

    private static String literalText(List<MathNode> nodes) {
        StringBuilder sb = new StringBuilder();
        for (MathNode node : nodes) {
            if (node instanceof LiteralNode) {
                sb.append(((LiteralNode) node).getText());
            }
        }
        return sb.toString();
    }

    // ---- literal scanning ----

    private void tokenizeLiteral(String raw, List<Token> tokens) {
        String text = raw.trim()
                .replace('·', '*')
                .replace('×', '*')
                .replace('−', '-')
                .replace('÷', '/');

        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
            } else if ("+-*/^".indexOf(c) >= 0) {
                tokens.add(Token.of(TokenType.OPERATOR, String.valueOf(c)));
                i++;
            } else if (c == '=') {
                tokens.add(Token.of(TokenType.EQUALS, "="));
                i++;
            } else if (c == '(') {
                tokens.add(Token.of(TokenType.LPAREN, "("));
                i++;
            } else if (c == ')') {
                tokens.add(Token.of(TokenType.RPAREN, ")"));
                i++;
            } else if (Character.isDigit(c) || c == '.') {
                i = scanNumber(text, i, tokens);
            } else if (c == 'π') {
                tokens.add(Token.ofExpr(ConstExpr.PI));
                i++;
            } else if (c == 'e' && text.startsWith("e⁻", i)) {
                tokens.add(Token.ofExpr(new ConstExpr(ConstType.E_MINUS)));
                i += 2;
            } else if (c == 'e' && (i + 1 >= text.length() || !isLetter(text.charAt(i + 1)))) {
                tokens.add(Token.ofExpr(ConstExpr.E));
                i++;
            } else if (c == 'φ') {
                tokens.add(Token.ofExpr(ConstExpr.PHI));
                i++;
            } else if (isSubscriptConstant(text, i)) {
                ConstType type = ConstType.fromSymbol(text.substring(i, i + 2));
                tokens.add(Token.ofExpr(new ConstExpr(type)));
                i += 2;
            } else if (isLetter(c)) {
                int start = i;
                while (i < text.length() && (isLetter(text.charAt(i)) || Character.isDigit(text.charAt(i)))) {
                    i++;
                }
                String word = text.substring(start, i);
                if ("pi".equals(word) || "PI".equals(word)) {
                    tokens.add(Token.ofExpr(ConstExpr.PI));
                } else if ("e".equals(word)) {
                    tokens.add(Token.ofExpr(ConstExpr.E));
                } else if (TYPED_ANS.matcher(word).matches()) {
                    // ans3 typed as text reads the same value as an ans node
                    tokens.add(Token.ofExpr(ansToExpr(word.substring(3))));
                } else {
                    tokens.add(Token.ofExpr(new VarExpr(word)));
                }
            } else {
                i++;
            }
        }
    }

    private static int scanNumber(String text, int start, List<Token> tokens) {
        int i = start;
        while (i < text.length() && (Character.isDigit(text.charAt(i)) || text.charAt(i) == '.')) {
            i++;
        }

        // Exponent part: 1e5, 2E-3, 4ᴇ+2
        if (i < text.length() && "eEᴇ".indexOf(text.charAt(i)) >= 0) {
            int j = i + 1;
            if (j < text.length() && (text.charAt(j) == '+' || text.charAt(j) == '-')) {
                j++;
            }
            if (j < text.length() && Character.isDigit(text.charAt(j))) {
                while (j < text.length() && Character.isDigit(text.charAt(j))) {
                    j++;
                }
                String mantissa = text.substring(start, i);
                String exponent = text.substring(i + 1, j);
                tokens.add(Token.of(TokenType.NUMBER, mantissa + "E" + exponent));
                return j;
            }
        }

        tokens.add(Token.of(TokenType.NUMBER, text.substring(start, i)));
        return i;
    }

    private static boolean isSubscriptConstant(String text, int i) {
        if (i + 1 >= text.length() || text.charAt(i + 1) != '₀') {
            return false;
        }
        char c = text.charAt(i);
        return c == 'ε' || c == 'μ' || c == 'µ' || c == 'c';
    }

    private static boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')
                || (c >= 'α' && c <= 'ω') || (c >= 'Α' && c <= 'Ω');
    }

    // ---- implicit multiplication ----

    private static List<Token> insertImplicitMultiplication(List<Token> tokens) {
        List<Token> result = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token current = tokens.get(i);
            result.add(current);
            if (i + 1 < tokens.size() && needsMultiplication(current.getType(), tokens.get(i + 1).getType())) {
                result.add(Token.of(TokenType.OPERATOR, "*"));
            }
        }
        return result;
    }

    private static boolean needsMultiplication(TokenType left, TokenType right) {
        switch (left) {
            case NUMBER:
                return right == TokenType.LPAREN || right == TokenType.EXPR;
            case RPAREN:
            case EXPR:
                return right == TokenType.LPAREN || right == TokenType.NUMBER || right == TokenType.EXPR;
            default:
                return false;
        }
    }
}
