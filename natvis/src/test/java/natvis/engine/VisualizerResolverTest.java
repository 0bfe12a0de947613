package natvis.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;

import natvis.testutils.FakeProcess;
import natvis.testutils.NatvisUtils;

class VisualizerResolverTest {
    private final FakeProcess process = new FakeProcess();

    @Test
    void firstMatchingTypeWinsAndTemplateArgsAreBound() {
        final var session = NatvisUtils.session(false,
            "<Type Name='Foo&lt;*&gt;'><DisplayString>first</DisplayString></Type>",
            "<Type Name='Foo&lt;int&gt;'><DisplayString>second</DisplayString></Type>"
        );
        final var binding = session.resolve(process.variable("f", "Foo<int>", "{...}")).orElseThrow();
        assertEquals("Foo<*>", binding.visualizer.name);
        assertEquals("int", binding.getScopedNames().get("$T1"));
    }

    @Test
    void alternativeTypesShareTheDefinition() {
        final var session = NatvisUtils.session(false,
            "<Type Name='A'><AlternativeType Name='B'/><DisplayString>ab</DisplayString></Type>"
        );
        assertEquals("A", session.resolve(process.variable("b", "B", "{...}")).orElseThrow().visualizer.name);
    }

    @Test
    void resolutionIsCachedByConcreteTypeName() {
        final var session = NatvisUtils.session(false, "<Type Name='Foo&lt;*&gt;'><DisplayString>x</DisplayString></Type>");
        final var a = session.resolve(process.variable("a", "Foo<int>", "{...}")).orElseThrow();
        final var b = session.resolve(process.variable("b", "Foo<int>", "{...}")).orElseThrow();
        final var c = session.resolve(process.variable("c", "Foo<char>", "{...}")).orElseThrow();
        assertSame(a, b);
        assertNotSame(a, c);
        assertEquals("char", c.getScopedNames().get("$T1"));
    }

    @ParameterizedTest
    @CsvSource({
        "Foo *, true",
        "Foo &, true",
        "Foo * const, true",
        "Foo **, false",
        "Foo ** const, false",
        "Bar *, false",
    })
    void exactlyOnePointerOrReferenceIsStripped(String typeName, boolean resolves) {
        final var session = NatvisUtils.session(false, "<Type Name='Foo'><DisplayString>foo</DisplayString></Type>");
        assertEquals(resolves, session.resolve(process.variable("p", typeName, "0x1000")).isPresent());
    }

    @Test
    void followsTheBaseClassChain() {
        final var session = NatvisUtils.session(false, "<Type Name='Base'><DisplayString>base</DisplayString></Type>");
        final var derived = process.variable("d", "MoreDerived", "{...}");
        derived.child("x", "int", "1");
        derived.baseClass("Derived").baseClass("Base");

        final var binding = session.resolve(derived);
        assertTrue(binding.isPresent());
        assertEquals("Base", binding.get().visualizer.name);
        assertFalse(session.resolve(process.variable("other", "Unrelated", "{...}")).isPresent());
    }

    @Test
    void aliasesBindPlaceholdersAcrossTheQualifierChain() {
        final var session = NatvisUtils.session(false,
            "<Alias Name='Outer&lt;*&gt;::Vec&lt;*&gt;' Value='std::vector&lt;$T2, $T1&gt;'/>",
            "<Type Name='std::vector&lt;*&gt;'><DisplayString>vec</DisplayString></Type>"
        );
        final var binding = session.resolve(process.variable("v", "Outer<char>::Vec<int>", "{...}")).orElseThrow();
        assertEquals("std::vector<*>", binding.visualizer.name);
        assertEquals("int", binding.getScopedNames().get("$T1"));
        assertEquals("char", binding.getScopedNames().get("$T2"));
    }

    private static String[] aliasChain(int hops) {
        final var result = new ArrayList<String>();
        for (int i = 0; i < hops; ++i) {
            final var target = i == hops - 1 ? "Target" : "Alias" + (i + 1);
            result.add("<Alias Name='Alias" + i + "' Value='" + target + "'/>");
        }
        result.add("<Type Name='Target'><DisplayString>target</DisplayString></Type>");
        return result.toArray(new String[0]);
    }

    @Test
    void tenAliasHopsResolve() {
        final var session = NatvisUtils.session(false, aliasChain(10));
        assertTrue(session.resolve(process.variable("a", "Alias0", "{...}")).isPresent());
    }

    @Test
    void elevenAliasHopsDont() {
        final var session = NatvisUtils.session(false, aliasChain(11));
        assertFalse(session.resolve(process.variable("a", "Alias0", "{...}")).isPresent());
        assertTrue(session.resolve(process.variable("a", "Alias1", "{...}")).isPresent(), "the last ten hops alone are fine");
    }

    @Test
    void aliasCyclesTerminate() {
        final var session = NatvisUtils.session(false,
            "<Alias Name='A' Value='B'/>",
            "<Alias Name='B' Value='A'/>"
        );
        assertFalse(session.resolve(process.variable("a", "A", "{...}")).isPresent());
    }

    @Test
    void unparsableTypeNamesDontResolve() {
        final var session = NatvisUtils.session(false, "<Type Name='*'><DisplayString>any</DisplayString></Type>");
        assertFalse(session.resolve(process.variable("x", "Foo<", "?")).isPresent());
        assertTrue(session.resolve(process.variable("y", "Foo", "?")).isPresent());
    }
}
