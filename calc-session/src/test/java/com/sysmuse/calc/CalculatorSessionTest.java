package com.sysmuse.calc;

import com.sysmuse.math.config.EngineConfig;
import com.sysmuse.math.format.FormatSettings;
import com.sysmuse.math.format.ThresholdProfile;
import com.sysmuse.math.node.AnsNode;
import com.sysmuse.math.node.LiteralNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Path;
import java.util.List;

import static com.sysmuse.math.node.MathNode.text;
import static org.junit.jupiter.api.Assertions.*;

public class CalculatorSessionTest {

    private CalculatorSession session;

    @TempDir
    Path tempDir;

    @BeforeEach
    public void setup() {
        session = new CalculatorSession(FormatSettings.defaults());
    }

    @Test
    public void testAddCellEvaluates() {
        int index = session.addCell(text("2+3*4"));
        assertEquals(0, index);
        assertEquals("14", session.getAnswer(0));
        assertNotNull(session.getCell(0).getExactValue());
    }

    @Test
    public void testSessionFromConfig() {
        EngineConfig config = new EngineConfig();
        config.setPrecision(2);
        config.setThresholdProfile(ThresholdProfile.SIMPLE);
        config.setConsoleLoggingEnabled(false);

        CalculatorSession configured = CalculatorSession.fromConfig(config);
        assertEquals(config.toFormatSettings(), configured.getSettings());
        configured.addCell(text("1/3"));
        assertEquals("0.33", configured.getAnswer(0));
    }

    @Test
    public void testPlaceholderCellHasEmptyAnswer() {
        session.addCell();
        assertEquals("", session.getAnswer(0));
        assertNull(session.getCell(0).getExactValue());
    }

    @Test
    public void testAnsReferenceCascades() {
        session.addCell(text("21"));
        session.addCell(text("ans0*2"));
        session.addCell(List.of(new AnsNode(1), new LiteralNode("+1")));
        assertEquals("42", session.getAnswer(1));
        assertEquals("43", session.getAnswer(2));

        session.updateCell(0, text("10"));
        assertEquals("20", session.getAnswer(1));
        assertEquals("21", session.getAnswer(2));
    }

    @Test
    public void testForwardReferenceIsFilledWhenCellArrives() {
        session.addCell(text("ans1+1"));
        session.addCell(text("4"));
        assertEquals("5", session.getAnswer(0));
    }

    @Test
    public void testMissingReferenceReadsZero() {
        session.addCell(text("ans3+1"));
        assertEquals("1", session.getAnswer(0));
        session.addCell(text("7"));
        assertEquals("1", session.getAnswer(0));
    }

    @Test
    public void testCycleGivesEmptyAnswers() {
        session.addCell(text("ans1+1"));
        session.addCell(text("ans0+1"));
        assertEquals("", session.getAnswer(0));
        assertEquals("", session.getAnswer(1));
        assertNull(session.getCell(0).getExactValue());

        session.updateCell(1, text("3"));
        assertEquals("4", session.getAnswer(0));
        assertEquals("3", session.getAnswer(1));
    }

    @Test
    public void testSelfReferenceGivesEmptyAnswer() {
        session.addCell(text("ans0+1"));
        assertEquals("", session.getAnswer(0));
    }

    @Test
    public void testAnyReferencePolicyKeepsAnswersConsistent() {
        session.setRecalcPolicy(RecalcPolicy.ANY_ANS_REFERENCE);
        session.addCell(text("5"));
        session.addCell(text("ans0+1"));
        session.addCell(text("7"));
        session.addCell(text("ans2*2"));

        session.updateCell(2, text("8"));
        assertEquals("6", session.getAnswer(1));
        assertEquals("16", session.getAnswer(3));
        assertEquals(RecalcPolicy.ANY_ANS_REFERENCE, session.getRecalcPolicy());
    }

    @Test
    public void testRemoveCellShiftsIndices() {
        session.addCell(text("2"));
        session.addCell(text("3"));
        session.addCell(text("ans0*10"));
        session.setActiveIndex(2);

        session.removeCell(1);
        assertEquals(2, session.size());
        assertEquals("20", session.getAnswer(1));
        assertEquals(1, session.getActiveIndex());
    }

    @Test
    public void testEquationCell() {
        session.addCell(text("2x+3=7"));
        assertEquals("x = 2", session.getAnswer(0));
        session.addCell(text("ans0*5"));
        assertEquals("10", session.getAnswer(1));
    }

    @Test
    public void testActiveIndexIsClamped() {
        session.setActiveIndex(5);
        assertEquals(0, session.getActiveIndex());
        session.addCell(text("1"));
        session.addCell(text("2"));
        session.setActiveIndex(9);
        assertEquals(1, session.getActiveIndex());
        session.setActiveIndex(-3);
        assertEquals(0, session.getActiveIndex());
    }

    @Test
    public void testInvalidIndexThrows() {
        assertThrows(IndexOutOfBoundsException.class, () -> session.getCell(0));
        assertThrows(IndexOutOfBoundsException.class, () -> session.updateCell(3, text("1")));
        assertThrows(IndexOutOfBoundsException.class, () -> session.removeCell(-1));
    }

    @Test
    public void testCellsAreReadOnlyView() {
        session.addCell(text("1"));
        assertThrows(UnsupportedOperationException.class, () -> session.getCells().clear());
    }

    @Test
    public void testSaveAndRestore() throws Exception {
        session.addCell(text("21"));
        session.addCell(text("ans0*2"));
        session.setActiveIndex(1);

        CellPersistence persistence = new CellPersistence(new File(tempDir.toFile(), "cells.json"));
        session.save(persistence);

        CalculatorSession restored = new CalculatorSession(FormatSettings.defaults());
        assertTrue(restored.restore(persistence));
        assertEquals(2, restored.size());
        assertEquals("42", restored.getAnswer(1));
        assertEquals(1, restored.getActiveIndex());
        assertEquals(text("ans0*2"), restored.getCell(1).getExpression());
        assertNotNull(restored.getCell(0).getExactValue());
    }

    @Test
    public void testRestoreWithoutSaveLeavesSessionAlone() {
        session.addCell(text("1"));
        CellPersistence persistence = new CellPersistence(new File(tempDir.toFile(), "missing.json"));
        assertFalse(session.restore(persistence));
        assertEquals(1, session.size());
    }
}
