package com.dcruver.htn.domain;

import com.dcruver.htn.domain.state.FactState;
import com.dcruver.htn.domain.todo.Todo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PlanningDomainTest {

    private PlanningDomain.Builder builder;

    @BeforeEach
    void setUp() {
        builder = PlanningDomain.builder("slots")
            .action("move", (s, args) -> ActionOutcome.success(s))
            .transition("clear", (s, args) -> s.withoutFact((String) args.get(0), "location"))
            .taskMethod("shuffle", "first", (s, args) -> MethodOutcome.done())
            .taskMethod("shuffle", "second", (s, args) -> MethodOutcome.subtasks(Todo.task("move", "a", "b")))
            .unigoalMethod("location", "fill", (s, subject, value) -> MethodOutcome.done())
            .multigoalMethod("all_at_once", (s, multigoal) -> MethodOutcome.done());
    }

    @Test
    void testRegistryKeepsRegistrationOrder() {
        PlanningDomain domain = builder.build();

        assertEquals("slots", domain.getName());
        assertEquals(List.of("move", "clear"), List.copyOf(domain.actionNames()));
        assertEquals(Set.of("shuffle"), domain.taskNames());
        assertEquals(Set.of("location"), domain.goalPredicates());
        assertEquals(List.of("first", "second"),
            domain.taskMethods("shuffle").stream().map(NamedMethod::getId).toList());
        assertEquals("fill", domain.unigoalMethods("location").get(0).getId());
        assertEquals("all_at_once", domain.multigoalMethods().get(0).getId());
    }

    @Test
    void testUnknownNamesYieldNothing() {
        PlanningDomain domain = builder.build();

        assertTrue(domain.taskMethods("teleport").isEmpty());
        assertTrue(domain.unigoalMethods("colour").isEmpty());
        assertTrue(domain.action("teleport").isEmpty());
    }

    @Test
    void testTransitionIsWrappedAsAction() {
        PlanningDomain domain = builder.build();
        FactState state = FactState.empty().withFact("a", "location", "occupied");

        ActionOutcome outcome = domain.action("clear").orElseThrow().apply(state, List.of("a"));

        assertTrue(outcome.isSuccess());
        assertFalse(outcome.getResultingState().hasFact("a", "location"));
    }

    @Test
    void testDuplicateRegistrationsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> builder.action("move", (s, args) -> null));
        assertThrows(IllegalArgumentException.class,
            () -> builder.taskMethod("shuffle", "first", (s, args) -> MethodOutcome.done()));
        assertThrows(IllegalArgumentException.class,
            () -> builder.multigoalMethod("all_at_once", (s, multigoal) -> MethodOutcome.done()));
    }

    @Test
    void testDomainIsUnaffectedByLaterBuilderCalls() {
        PlanningDomain domain = builder.build();

        builder.action("wait", (s, args) -> ActionOutcome.success(s));

        assertFalse(domain.actionNames().contains("wait"));
        assertThrows(UnsupportedOperationException.class, () -> domain.actionNames().remove("move"));
    }
}
