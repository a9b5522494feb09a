package com.sysmuse.math.serial;

import com.sysmuse.math.node.AnsNode;
import com.sysmuse.math.node.ConstantNode;
import com.sysmuse.math.node.ExponentNode;
import com.sysmuse.math.node.FractionNode;
import com.sysmuse.math.node.IntegralNode;
import com.sysmuse.math.node.LiteralNode;
import com.sysmuse.math.node.LogNode;
import com.sysmuse.math.node.MathNode;
import com.sysmuse.math.node.NewlineNode;
import com.sysmuse.math.node.RootNode;
import com.sysmuse.math.node.TrigNode;
import com.sysmuse.math.node.UnitVectorNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.sysmuse.math.node.MathNode.text;
import static org.junit.jupiter.api.Assertions.*;

public class MathNodeJsonCodecTest {

    @Test
    public void testNestedTreeSurvivesJson() {
        List<MathNode> nodes = List.of(
                new LiteralNode("2+"),
                new FractionNode(List.of(new ExponentNode(text("x"), text("2"))), text("3")),
                new NewlineNode(),
                RootNode.squareRoot(text("2")),
                new LogNode(true, null, text("5")),
                new TrigNode("cos", List.of(new ConstantNode("π"))),
                new IntegralNode(text("t"), text("0"), text("1"), text("t")),
                new AnsNode(1),
                new UnitVectorNode("z"));

        String json = MathNodeJsonCodec.serializeToJson(nodes);
        assertEquals(nodes, MathNodeJsonCodec.deserializeFromJson(json));
    }

    @Test
    public void testJsonShape() {
        String json = MathNodeJsonCodec.serializeToJson(List.of(new FractionNode(text("1"), text("2"))));
        assertTrue(json.contains("\"type\":\"fraction\""));
        assertTrue(json.contains("\"numerator\":[{\"type\":\"literal\",\"text\":\"1\"}]"));
    }

    @Test
    public void testUnreadableInputGivesPlaceholder() {
        assertEquals(List.of(new LiteralNode("")), MathNodeJsonCodec.deserializeFromJson("not json"));
        assertEquals(List.of(new LiteralNode("")), MathNodeJsonCodec.deserializeFromJson(null));
        assertEquals(List.of(new LiteralNode("")), MathNodeJsonCodec.deserializeFromJson("{\"type\":\"literal\"}"));
        assertEquals(List.of(new LiteralNode("")), MathNodeJsonCodec.deserializeFromJson("[]"));
    }

    @Test
    public void testUnknownTypeBecomesEmptyLiteral() {
        List<MathNode> nodes = MathNodeJsonCodec.deserializeFromJson(
                "[{\"type\":\"literal\",\"text\":\"7\"},{\"type\":\"matrix\"}]");
        assertEquals(List.of(new LiteralNode("7"), new LiteralNode("")), nodes);
    }

    @Test
    public void testMissingSlotIsFilledWithPlaceholder() {
        List<MathNode> nodes = MathNodeJsonCodec.deserializeFromJson(
                "[{\"type\":\"fraction\",\"numerator\":[{\"type\":\"literal\",\"text\":\"1\"}]}]");
        assertEquals(1, nodes.size());
        FractionNode frac = (FractionNode) nodes.get(0);
        assertEquals(text("1"), frac.getNumerator());
        assertEquals(MathNode.placeholder(), frac.getDenominator());
    }
}
