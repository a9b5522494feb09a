package com.sysmuse.math.serial;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
import com.sysmuse.util.LoggingUtil;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of a node tree, used to persist calculator cells.
 *
 * Each node is an object tagged by "type"; child slots are arrays of nodes.
 * Reading is forgiving: malformed input, missing slots and unknown types all
 * fall back to the empty literal placeholder.
 */
public final class MathNodeJsonCodec {

    private static final ObjectMapper mapper = new ObjectMapper();

    private MathNodeJsonCodec() {
    }

    public static String serializeToJson(List<MathNode> nodes) {
        ArrayNode array = toJsonArray(nodes);
        try {
            return mapper.writeValueAsString(array);
        } catch (JsonProcessingException e) {
            // A tree of strings and booleans always serializes
            throw new IllegalStateException("Failed to write node tree as JSON", e);
        }
    }

    public static ArrayNode toJsonArray(List<MathNode> nodes) {
        ArrayNode array = mapper.createArrayNode();
        for (MathNode node : nodes) {
            array.add(nodeToJson(node));
        }
        return array;
    }

    /**
     * Parse a node list. Never throws; anything unreadable yields a single empty literal.
     */
    public static List<MathNode> deserializeFromJson(String json) {
        if (json == null || json.isEmpty()) {
            return MathNode.placeholder();
        }

        try {
            JsonNode root = mapper.readTree(json);
            return fromJsonArray(root);
        } catch (JsonProcessingException | RuntimeException e) {
            LoggingUtil.debug("Unreadable node JSON, using empty expression: " + e.getMessage());
            return MathNode.placeholder();
        }
    }

    public static List<MathNode> fromJsonArray(JsonNode array) {
        if (array == null || !array.isArray()) {
            return MathNode.placeholder();
        }
        List<MathNode> nodes = new ArrayList<>();
        for (JsonNode item : array) {
            nodes.add(jsonToNode(item));
        }
        return nodes.isEmpty() ? MathNode.placeholder() : nodes;
    }

    private static ObjectNode nodeToJson(MathNode node) {
        ObjectNode json = mapper.createObjectNode();

        if (node instanceof LiteralNode) {
            json.put("type", "literal");
            json.put("text", ((LiteralNode) node).getText());
        } else if (node instanceof FractionNode) {
            FractionNode frac = (FractionNode) node;
            json.put("type", "fraction");
            json.set("numerator", toJsonArray(frac.getNumerator()));
            json.set("denominator", toJsonArray(frac.getDenominator()));
        } else if (node instanceof ExponentNode) {
            ExponentNode exp = (ExponentNode) node;
            json.put("type", "exponent");
            json.set("base", toJsonArray(exp.getBase()));
            json.set("power", toJsonArray(exp.getPower()));
        } else if (node instanceof ParenthesisNode) {
            json.put("type", "parenthesis");
            json.set("content", toJsonArray(((ParenthesisNode) node).getContent()));
        } else if (node instanceof TrigNode) {
            TrigNode trig = (TrigNode) node;
            json.put("type", "trig");
            json.put("function", trig.getFunction());
            json.set("argument", toJsonArray(trig.getArgument()));
        } else if (node instanceof RootNode) {
            RootNode root = (RootNode) node;
            json.put("type", "root");
            json.put("isSquareRoot", root.isSquareRoot());
            json.set("index", toJsonArray(root.getIndex()));
            json.set("radicand", toJsonArray(root.getRadicand()));
        } else if (node instanceof LogNode) {
            LogNode log = (LogNode) node;
            json.put("type", "log");
            json.put("isNaturalLog", log.isNaturalLog());
            json.set("base", toJsonArray(log.getBase()));
            json.set("argument", toJsonArray(log.getArgument()));
        } else if (node instanceof PermutationNode) {
            PermutationNode perm = (PermutationNode) node;
            json.put("type", "permutation");
            json.set("n", toJsonArray(perm.getN()));
            json.set("r", toJsonArray(perm.getR()));
        } else if (node instanceof CombinationNode) {
            CombinationNode comb = (CombinationNode) node;
            json.put("type", "combination");
            json.set("n", toJsonArray(comb.getN()));
            json.set("r", toJsonArray(comb.getR()));
        } else if (node instanceof SummationNode) {
            SummationNode sum = (SummationNode) node;
            json.put("type", "summation");
            putSeries(json, sum.getVariable(), sum.getLower(), sum.getUpper(), sum.getBody());
        } else if (node instanceof ProductNode) {
            ProductNode prod = (ProductNode) node;
            json.put("type", "product");
            putSeries(json, prod.getVariable(), prod.getLower(), prod.getUpper(), prod.getBody());
        } else if (node instanceof IntegralNode) {
            IntegralNode integral = (IntegralNode) node;
            json.put("type", "integral");
            putSeries(json, integral.getVariable(), integral.getLower(), integral.getUpper(), integral.getBody());
        } else if (node instanceof DerivativeNode) {
            DerivativeNode diff = (DerivativeNode) node;
            json.put("type", "derivative");
            json.set("variable", toJsonArray(diff.getVariable()));
            json.set("at", toJsonArray(diff.getAt()));
            json.set("body", toJsonArray(diff.getBody()));
        } else if (node instanceof AnsNode) {
            json.put("type", "ans");
            json.set("index", toJsonArray(((AnsNode) node).getIndex()));
        } else if (node instanceof NewlineNode) {
            json.put("type", "newline");
        } else if (node instanceof ConstantNode) {
            json.put("type", "constant");
            json.put("constant", ((ConstantNode) node).getConstant());
        } else if (node instanceof UnitVectorNode) {
            json.put("type", "unit_vector");
            json.put("axis", ((UnitVectorNode) node).getAxis());
        } else {
            json.put("type", "literal");
            json.put("text", "");
        }
        return json;
    }

    private static void putSeries(ObjectNode json, List<MathNode> variable, List<MathNode> lower,
                                  List<MathNode> upper, List<MathNode> body) {
        json.set("variable", toJsonArray(variable));
        json.set("lower", toJsonArray(lower));
        json.set("upper", toJsonArray(upper));
        json.set("body", toJsonArray(body));
    }

    private static MathNode jsonToNode(JsonNode json) {
        if (json == null || !json.isObject()) {
            return new LiteralNode("");
        }
        String type = json.path("type").asText("literal");

        switch (type) {
            case "literal":
                return new LiteralNode(json.path("text").asText(""));
            case "fraction":
                return new FractionNode(slot(json, "numerator"), slot(json, "denominator"));
            case "exponent":
                return new ExponentNode(slot(json, "base"), slot(json, "power"));
            case "parenthesis":
                return new ParenthesisNode(slot(json, "content"));
            case "trig":
                return new TrigNode(json.path("function").asText("sin"), slot(json, "argument"));
            case "root":
                return new RootNode(json.path("isSquareRoot").asBoolean(false),
                        slot(json, "index"), slot(json, "radicand"));
            case "log":
                return new LogNode(json.path("isNaturalLog").asBoolean(false),
                        slot(json, "base"), slot(json, "argument"));
            case "permutation":
                return new PermutationNode(slot(json, "n"), slot(json, "r"));
            case "combination":
                return new CombinationNode(slot(json, "n"), slot(json, "r"));
            case "summation":
                return new SummationNode(slot(json, "variable"), slot(json, "lower"),
                        slot(json, "upper"), slot(json, "body"));
            case "product":
                return new ProductNode(slot(json, "variable"), slot(json, "lower"),
                        slot(json, "upper"), slot(json, "body"));
            case "integral":
                return new IntegralNode(slot(json, "variable"), slot(json, "lower"),
                        slot(json, "upper"), slot(json, "body"));
            case "derivative":
                return new DerivativeNode(slot(json, "variable"), slot(json, "at"), slot(json, "body"));
            case "ans":
                return new AnsNode(slot(json, "index"));
            case "newline":
                return new NewlineNode();
            case "constant":
                return new ConstantNode(json.path("constant").asText(""));
            case "unit_vector":
                return new UnitVectorNode(json.path("axis").asText("x"));
            default:
                LoggingUtil.debug("Unknown node type in JSON: " + type);
                return new LiteralNode("");
        }
    }

    private static List<MathNode> slot(JsonNode json, String field) {
        return fromJsonArray(json.get(field));
    }
}
