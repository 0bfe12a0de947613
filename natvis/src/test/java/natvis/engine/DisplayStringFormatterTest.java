package natvis.engine;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import natvis.NatvisConfig;
import natvis.VisualizerId;
import natvis.testutils.FakeProcess;
import natvis.testutils.FakeVariable;
import natvis.testutils.NatvisUtils;

class DisplayStringFormatterTest {
    private static final String VECTOR = String.join("\n",
        "<Type Name='Vec&lt;*&gt;'>",
        "  <DisplayString Condition='_size == 0'>empty</DisplayString>",
        "  <DisplayString>{_size} items</DisplayString>",
        "  <UIVisualizer ServiceId='{svc}' Id='3'/>",
        "</Type>"
    );

    private final FakeProcess process = new FakeProcess();

    private FakeVariable vec(String size) {
        final var v = process.variable("v", "Vec<int>", "{...}");
        v.child("_size", "int", size);
        return v;
    }

    @Test
    void firstRuleWhoseConditionPassesIsUsed() {
        final var session = NatvisUtils.session(true, VECTOR);

        process.answer("(v._size) == 0", "bool", "false");
        process.answer("(v._size)", "int", "5");
        final var formatted = session.formatDisplayString(vec("5"));
        assertEquals("5 items", formatted.text);
        assertArrayEquals(new VisualizerId[] { new VisualizerId("{svc}", 3) }, formatted.maybeNull_uiVisualizers);

        process.answer("(v._size) == 0", "bool", "true");
        assertEquals("empty", session.formatDisplayString(vec("0")).text);
    }

    @Test
    void integerConditionsArePositiveOrFail() {
        final var session = NatvisUtils.session(true,
            "<Type Name='A'>",
            "  <DisplayString Condition='_flags'>flagged</DisplayString>",
            "  <DisplayString Condition='_junk'>junk</DisplayString>",
            "  <DisplayString>plain</DisplayString>",
            "</Type>"
        );
        final var a = process.variable("a", "A", "{...}");
        a.child("_flags", "int", "0");
        a.child("_junk", "int", "?");

        process.answer("(a._flags)", "int", "0");
        process.answer("(a._junk)", "int", "not a number");
        assertEquals("plain", session.formatDisplayString(a).text);

        process.answer("(a._flags)", "int", "2");
        assertEquals("flagged", session.formatDisplayString(a).text);
    }

    @Test
    void escapedBraces() {
        final var session = NatvisUtils.session(true, "<Type Name='Vec&lt;*&gt;'><DisplayString>{{ size={_size} }}</DisplayString></Type>");
        process.answer("(v._size)", "int", "3");
        assertEquals("{ size=3 }", session.formatDisplayString(vec("3")).text);
    }

    @Test
    void anUnmatchedClosingBraceFallsBackToTheRawValue() {
        final var session = NatvisUtils.session(true, "<Type Name='Vec&lt;*&gt;'><DisplayString>size={_size} }</DisplayString></Type>");
        process.answer("(v._size)", "int", "3");
        final var formatted = session.formatDisplayString(vec("3"));
        assertEquals("{...}", formatted.text);
    }

    @Test
    void placeholdersAreBoundFromTheMatchedTemplateArguments() {
        final var session = NatvisUtils.session(true, "<Type Name='Foo&lt;*&gt;'><DisplayString>{sizeof($T1)} bytes each</DisplayString></Type>");
        process.answer("sizeof(Bar)", "unsigned long", "16");
        assertEquals("16 bytes each", session.formatDisplayString(process.variable("f", "Foo<Bar>", "{...}")).text);
        assertEquals(List.of("sizeof(Bar)"), process.evaluated);
    }

    @Test
    void selfReferentialRulesStopAtTheDepthBound() {
        final var session = NatvisUtils.session(true, "<Type Name='Rec'><DisplayString>&lt;{*this}&gt;</DisplayString></Type>");
        process.fallback(expr -> process.value("Rec", "raw"));

        final var text = session.formatDisplayString(process.variable("r", "Rec", "raw")).text;

        final int levels = NatvisConfig.MAX_FORMAT_DEPTH - 1;
        assertEquals("<".repeat(levels) + "raw" + ">".repeat(levels), text);
        assertEquals(levels, process.evaluated.size());
        assertEquals("*(&r)", process.evaluated.get(0));
        assertEquals("*(&*(&r))", process.evaluated.get(1));
    }

    @Test
    void evaluationErrorsShowUpAsText() {
        final var session = NatvisUtils.session(true, "<Type Name='Vec&lt;*&gt;'><DisplayString>size={_nope}</DisplayString></Type>");
        assertEquals("size=" + FakeProcess.EVAL_ERROR, session.formatDisplayString(vec("3")).text);
    }

    @Test
    void onlyVisualizedValuesAreFormattedUnlessDisplayStringsAreOn() {
        final var session = NatvisUtils.session(false, VECTOR);
        process.answer("(v._size) == 0", "bool", "false");
        process.answer("(v._size)", "int", "5");

        final var plain = session.formatDisplayString(vec("5"));
        assertEquals("{...}", plain.text);
        assertNull(plain.maybeNull_uiVisualizers);

        assertEquals("5 items", session.formatDisplayString(vec("5").markVisualized()).text);

        session.getConfig().setShowDisplayStrings(NatvisConfig.DisplayStringsMode.OFF);
        assertEquals("{...}", session.formatDisplayString(vec("5").markVisualized()).text);

        session.getConfig().setShowDisplayStrings(NatvisConfig.DisplayStringsMode.ON);
        assertEquals("5 items", session.formatDisplayString(vec("5")).text);
    }

    @Test
    void preformattedValuesAreLeftAlone() {
        final var session = NatvisUtils.session(true, VECTOR);
        assertEquals("{...}", session.formatDisplayString(vec("5").markPreformatted()).text);
        assertTrue(process.evaluated.isEmpty());
    }

    @Test
    void formattedValuesAreTracked() {
        final var session = NatvisUtils.session(true, VECTOR);
        process.answer("(v._size) == 0", "bool", "false");
        process.answer("(v._size)", "int", "5");

        final var v = vec("5");
        final var other = process.variable("i", "int", "1");
        session.formatDisplayString(v);
        session.formatDisplayString(other);

        assertTrue(session.isVisualized(v));
        assertFalse(session.isVisualized(other));
        assertFalse(session.isVisualized(vec("5")), "tracked by identity");
    }
}
