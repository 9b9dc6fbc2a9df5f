package com.reduction.core;

import com.reduction.core.step.ExecStep;
import com.reduction.core.step.SplitLinesStep;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DependencyResolverTest {

    private static ReductionNode exec(String name) {
        return new ReductionNode(name, null, new ExecStep("echo", List.of(name)));
    }

    private static ReductionNode lines(String name, String source) {
        return new ReductionNode(name, source, new SplitLinesStep());
    }

    @Test
    void dependenciesComeFirstAndTiesFollowDeclarationOrder() {
        ReductionSet set = ReductionSet.of(lines("C", "B"), exec("A"), lines("B", "A"), exec("D"));

        EvaluationPlan plan = DependencyResolver.plan(set);

        assertEquals(List.of("A", "B", "C", "D"), plan.order());
        assertEquals(List.of("A"), plan.dependenciesOf("B"));
        assertEquals(List.of("C"), plan.dependentsOf("B"));
        assertEquals(List.of(), plan.dependenciesOf("A"));
    }

    @Test
    void orderIsStableAcrossCalls() {
        ReductionSet set = ReductionSet.of(exec("x"), lines("y", "x"), exec("w"), lines("z", "w"), lines("v", "x"));
        assertEquals(DependencyResolver.plan(set).order(), DependencyResolver.plan(set).order());
        assertEquals(List.of("x", "y", "w", "z", "v"), DependencyResolver.plan(set).order());
    }

    @Test
    void everyNodeFollowsItsTransitiveSources() {
        ReductionSet set = ReductionSet.of(lines("d", "c"), lines("c", "b"), lines("b", "a"), exec("a"), lines("e", "a"));
        List<String> order = DependencyResolver.plan(set).order();
        for (ReductionNode node : set.nodes()) {
            if (node.source() != null) {
                assertTrue(order.indexOf(node.source()) < order.indexOf(node.name()), node.name());
            }
        }
    }

    @Test
    void unknownSourceIsNamed() {
        ReductionSet set = ReductionSet.of(exec("A"), lines("B", "missing"));
        UnknownSourceException e = assertThrows(UnknownSourceException.class, () -> DependencyResolver.plan(set));
        assertEquals("B", e.node());
        assertEquals("missing", e.source());
    }

    @Test
    void cycleNamesBothNodes() {
        ReductionSet set = ReductionSet.of(lines("A", "B"), lines("B", "A"), exec("C"));
        CycleException e = assertThrows(CycleException.class, () -> DependencyResolver.plan(set));
        assertEquals(2, e.nodes().size());
        assertTrue(e.nodes().containsAll(List.of("A", "B")));
        assertTrue(e.getMessage().contains("A") && e.getMessage().contains("B"), e.getMessage());
    }

    @Test
    void cycleReportExcludesNodesHangingOffIt() {
        ReductionSet set = ReductionSet.of(lines("tail", "A"), lines("A", "B"), lines("B", "C"), lines("C", "A"));
        CycleException e = assertThrows(CycleException.class, () -> DependencyResolver.plan(set));
        assertEquals(3, e.nodes().size());
        assertFalse(e.nodes().contains("tail"));
    }

    @Test
    void targetsPlanOnlyTheirDependencies() {
        ReductionSet set = ReductionSet.of(exec("A"), lines("B", "A"), lines("C", "B"), exec("D"));
        assertEquals(List.of("A", "B"), DependencyResolver.plan(set, List.of("B")).order());
    }

    @Test
    void unknownTargetIsRejected() {
        ReductionSet set = ReductionSet.of(exec("A"));
        UnknownSourceException e = assertThrows(UnknownSourceException.class,
            () -> DependencyResolver.plan(set, List.of("nope")));
        assertNull(e.node());
        assertEquals("nope", e.source());
    }

    @Test
    void duplicateNamesAreRejected() {
        assertThrows(DefinitionException.class, () -> ReductionSet.of(exec("A"), exec("A")));
    }
}
