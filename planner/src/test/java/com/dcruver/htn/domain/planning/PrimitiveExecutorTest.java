package com.dcruver.htn.domain.planning;

import com.dcruver.htn.domain.ActionOutcome;
import com.dcruver.htn.domain.PlanningDomain;
import com.dcruver.htn.domain.state.FactState;
import com.dcruver.htn.domain.todo.PrimitiveTodo;
import com.dcruver.htn.domain.todo.Todo;
import com.dcruver.htn.domain.tree.SolutionTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PrimitiveExecutorTest {

    private PrimitiveExecutor executor;
    private PlanningDomain domain;
    private FactState state;
    private SolutionTree tree;

    @BeforeEach
    void setUp() {
        executor = new PrimitiveExecutor();
        domain = PlanningDomain.builder("test")
            .action("move", (s, args) -> ActionOutcome.success(s
                .withFact((String) args.get(0), "location", "empty")
                .withFact((String) args.get(1), "location", "occupied")))
            .transition("clear", (s, args) -> s.withoutFact((String) args.get(0), "location"))
            .transition("void", (s, args) -> null)
            .action("refuse", (s, args) -> ActionOutcome.failure("not allowed"))
            .action("explode", (s, args) -> {
                throw new IllegalArgumentException("bad args");
            })
            .action("nothing", (s, args) -> null)
            .action("stateless", (s, args) -> ActionOutcome.builder().success(true).build())
            .build();
        state = FactState.empty()
            .withFact("a", "location", "occupied")
            .withFact("b", "location", "empty");
        tree = SolutionTree.createInitial(List.of(Todo.task("move", "a", "b")), state);
        tree.insertChildren(0, tree.getGoals(), SolutionTree.ROOT_EXPANSION, state);
    }

    private PlanningException failure(String action) {
        return assertThrows(PlanningException.class,
            () -> executor.execute(domain, tree, 1, action, List.of("a"), state, 0));
    }

    @Test
    void testSuccessfulActionReturnsNewStateAndMarksNode() throws PlanningException {
        FactState next = executor.execute(domain, tree, 1, "move", List.of("a", "b"), state, 3);

        assertTrue(next.matches("location", "a", "empty"));
        assertTrue(next.matches("location", "b", "occupied"));
        assertTrue(state.matches("location", "a", "occupied"));
        assertTrue(tree.getNode(1).isPrimitive());
        assertEquals(new PrimitiveTodo("move", List.of("a", "b")), tree.getNode(1).getTodo());
    }

    @Test
    void testTransitionActionReturnsItsState() throws PlanningException {
        FactState next = executor.execute(domain, tree, 1, "clear", List.of("a"), state, 0);

        assertFalse(next.hasFact("a", "location"));
    }

    @Test
    void testMissingActionIsNotFound() {
        assertEquals(PlanningErrorType.ACTION_NOT_FOUND, failure("teleport").getType());
        assertFalse(tree.getNode(1).isPrimitive());
    }

    @Test
    void testFailedActionsAreFatal() {
        assertEquals(PlanningErrorType.ACTION_FAILED, failure("refuse").getType());
        assertEquals(PlanningErrorType.ACTION_FAILED, failure("nothing").getType());
        assertEquals(PlanningErrorType.ACTION_FAILED, failure("void").getType());
        assertEquals(PlanningErrorType.ACTION_FAILED, failure("stateless").getType());
        assertFalse(tree.getNode(1).isPrimitive());
    }

    @Test
    void testThrowingActionKeepsCause() {
        PlanningException e = failure("explode");

        assertEquals(PlanningErrorType.ACTION_FAILED, e.getType());
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }

    @Test
    void testBlacklistedActionIsNeverCalled() {
        tree.blacklistAction("move");

        PlanningException e = assertThrows(PlanningException.class,
            () -> executor.execute(domain, tree, 1, "move", List.of("a", "b"), state, 0));

        assertEquals(PlanningErrorType.ACTION_FAILED, e.getType());
        assertTrue(e.getMessage().contains("blacklisted"));
    }
}
