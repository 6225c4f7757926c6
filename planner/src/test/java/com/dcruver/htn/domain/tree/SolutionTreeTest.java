package com.dcruver.htn.domain.tree;

import com.dcruver.htn.domain.state.FactState;
import com.dcruver.htn.domain.todo.PrimitiveTodo;
import com.dcruver.htn.domain.todo.RootTodo;
import com.dcruver.htn.domain.todo.Todo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SolutionTreeTest {

    private FactState state;

    @BeforeEach
    void setUp() {
        state = FactState.empty().withFact("a", "location", "occupied");
    }

    @Test
    void testCreateInitialBuildsUnexpandedRoot() {
        List<Todo> todos = List.of(Todo.task("move", "a", "b"));

        SolutionTree tree = SolutionTree.createInitial(todos, state);

        SolutionNode root = tree.getRoot();
        assertEquals(1, tree.size());
        assertEquals(0, root.getId());
        assertTrue(root.isRoot());
        assertFalse(root.isExpanded());
        assertFalse(root.isPrimitive());
        assertEquals(new RootTodo(todos), root.getTodo());
        assertSame(state, root.getState());
        assertEquals(todos, tree.getGoals());
    }

    @Test
    void testInsertChildrenAssignsFreshIdsAndExpandsParent() {
        SolutionTree tree = SolutionTree.createInitial(List.of(Todo.task("t")), state);
        FactState childState = state.withFact("b", "location", "occupied");

        List<Integer> rootChildren = tree.insertChildren(0, List.of(Todo.task("t")), SolutionTree.ROOT_EXPANSION, state);
        List<Integer> ids = tree.insertChildren(rootChildren.get(0),
            List.of(Todo.task("x"), Todo.task("y")), "task_method", childState);

        assertEquals(List.of(2, 3), ids);
        SolutionNode parent = tree.getNode(1);
        assertTrue(parent.isExpanded());
        assertEquals("task_method", parent.getMethodTried());
        assertEquals(ids, parent.getChildrenIds());
        assertEquals(Integer.valueOf(1), tree.getNode(2).getParentId());
        assertSame(childState, tree.getNode(3).getState());
        assertEquals("root_root_expansion_0_task_method_1", tree.getNode(3).getLabel());
        assertEquals(2, tree.getExpansionCount());
    }

    @Test
    void testInsertChildrenRejectsExpandedParent() {
        SolutionTree tree = SolutionTree.createInitial(List.of(Todo.task("t")), state);
        tree.insertChildren(0, List.of(Todo.task("t")), SolutionTree.ROOT_EXPANSION, state);

        assertThrows(IllegalStateException.class,
            () -> tree.insertChildren(0, List.of(Todo.task("u")), SolutionTree.ROOT_EXPANSION, state));
        assertThrows(IllegalArgumentException.class,
            () -> tree.insertChildren(42, List.of(Todo.task("u")), "task_method", state));
    }

    @Test
    void testTerminalMarkersAreIdempotent() {
        SolutionTree tree = SolutionTree.createInitial(List.of(Todo.task("a"), Todo.task("b")), state);
        tree.insertChildren(0, tree.getGoals(), SolutionTree.ROOT_EXPANSION, state);

        tree.markPrimitive(1);
        tree.markPrimitive(1);
        tree.markCompleted(2);
        tree.markCompleted(2);

        assertTrue(tree.getNode(1).isPrimitive());
        assertTrue(tree.getNode(1).isExpanded());
        assertTrue(tree.getNode(1).isVisited());
        assertFalse(tree.getNode(2).isPrimitive());
        assertTrue(tree.getNode(2).isExpanded());
        assertTrue(tree.findNextUnexpanded().isEmpty());
    }

    @Test
    void testMarkExecutedRetagsTaskAsPrimitive() {
        SolutionTree tree = SolutionTree.createInitial(List.of(Todo.task("move", "a", "b")), state);
        tree.insertChildren(0, tree.getGoals(), SolutionTree.ROOT_EXPANSION, state);

        tree.markExecuted(1, "move", List.of("a", "b"));

        assertEquals(new PrimitiveTodo("move", List.of("a", "b")), tree.getNode(1).getTodo());
        assertTrue(tree.getNode(1).isPrimitive());
    }

    @Test
    void testDescendantsAreTransitive() {
        SolutionTree tree = SolutionTree.createInitial(List.of(Todo.task("t")), state);
        tree.insertChildren(0, List.of(Todo.task("t")), SolutionTree.ROOT_EXPANSION, state);
        tree.insertChildren(1, List.of(Todo.task("x"), Todo.task("y")), "task_method", state);
        tree.insertChildren(2, List.of(Todo.task("z")), "task_method", state);

        assertEquals(List.of(1, 2, 4, 3), tree.getDescendants(0));
        assertEquals(List.of(4), tree.getDescendants(2));
        assertEquals(List.of(), tree.getDescendants(3));
    }

    @Test
    void testExtractPrimitiveActionsIsDepthFirstAndIdempotent() {
        SolutionTree tree = SolutionTree.createInitial(List.of(Todo.task("t"), Todo.task("last")), state);
        tree.insertChildren(0, tree.getGoals(), SolutionTree.ROOT_EXPANSION, state);
        // node 1 decomposes after node 2 is already executed
        tree.markExecuted(2, "last", List.of());
        tree.insertChildren(1, List.of(Todo.task("x", 1), Todo.task("y", 2)), "task_method", state);
        tree.markExecuted(3, "x", List.of(1));
        tree.markExecuted(4, "y", List.of(2));

        List<PlanStep> first = tree.extractPrimitiveActions();
        List<PlanStep> second = tree.extractPrimitiveActions();

        assertEquals(List.of(
            new PlanStep("x", List.of(1)),
            new PlanStep("y", List.of(2)),
            new PlanStep("last", List.of())), first);
        assertEquals(first, second);
        assertEquals(3, tree.planCost());
    }

    @Test
    void testExtractSkipsOpenAndGoalNodes() {
        SolutionTree tree = SolutionTree.createInitial(
            List.of(Todo.task("open"), Todo.goal("location", "a", "empty"), Todo.task("done")), state);
        tree.insertChildren(0, tree.getGoals(), SolutionTree.ROOT_EXPANSION, state);
        tree.markPrimitive(2);
        tree.markExecuted(3, "done", List.of());

        assertEquals(List.of(new PlanStep("done", List.of())), tree.extractPrimitiveActions());
    }

    @Test
    void testIsCompleteWhenEveryNodeIsPrimitiveOrHasChildren() {
        SolutionTree tree = SolutionTree.createInitial(List.of(Todo.task("t")), state);
        tree.insertChildren(0, tree.getGoals(), SolutionTree.ROOT_EXPANSION, state);
        tree.insertChildren(1, List.of(Todo.task("x")), "task_method", state);
        tree.markExecuted(2, "x", List.of());

        assertTrue(tree.isComplete());
    }

    @Test
    void testIsCompleteHoldsForBareRoot() {
        SolutionTree tree = SolutionTree.createInitial(List.of(), state);

        assertTrue(tree.isComplete());
    }

    @Test
    void testIsIncompleteWithOpenNode() {
        SolutionTree tree = SolutionTree.createInitial(List.of(Todo.task("t"), Todo.task("u")), state);
        tree.insertChildren(0, tree.getGoals(), SolutionTree.ROOT_EXPANSION, state);
        tree.markExecuted(1, "t", List.of());

        assertFalse(tree.isComplete());
    }

    @Test
    void testIsIncompleteWithCompletedLeafThatIsNotPrimitive() {
        SolutionTree tree = SolutionTree.createInitial(List.of(Todo.goal("location", "a", "occupied")), state);
        tree.insertChildren(0, tree.getGoals(), SolutionTree.ROOT_EXPANSION, state);
        tree.markCompleted(1);

        assertTrue(tree.findNextUnexpanded().isEmpty());
        assertFalse(tree.isComplete());
    }

    @Test
    void testFromActionsBuildsCompleteTree() {
        List<PlanStep> actions = List.of(new PlanStep("move", List.of("a", "b")), new PlanStep("move", List.of("b", "c")));
        List<Todo> goals = List.of(Todo.goal("location", "c", "occupied"));

        SolutionTree tree = SolutionTree.fromActions(actions, goals, state);

        assertTrue(tree.isComplete());
        assertEquals(actions, tree.extractPrimitiveActions());
        assertEquals(goals, tree.getGoals());
        assertEquals("actions_from_plan", tree.getRoot().getMethodTried());
    }

    @Test
    void testStatsSummariseTree() {
        SolutionTree tree = SolutionTree.createInitial(List.of(Todo.task("t"), Todo.task("u")), state);
        tree.insertChildren(0, tree.getGoals(), SolutionTree.ROOT_EXPANSION, state);
        tree.insertChildren(1, List.of(Todo.task("x")), "task_method", state);
        tree.markExecuted(3, "x", List.of());

        TreeStats stats = tree.stats();

        assertEquals(4, stats.getTotalNodes());
        assertEquals(3, stats.getExpandedNodes());
        assertEquals(1, stats.getPrimitiveActions());
        assertEquals(2, stats.getMaxDepth());
        assertEquals(2, stats.getExpansions());
    }

    @Test
    void testBlacklistsAreScoped() {
        SolutionTree tree = SolutionTree.createInitial(List.of(Todo.task("t"), Todo.task("u")), state);
        tree.insertChildren(0, tree.getGoals(), SolutionTree.ROOT_EXPANSION, state);

        tree.blacklistMethod(1, "m1");
        tree.blacklistAction("explode");

        assertTrue(tree.getNode(1).getBlacklistedMethods().contains("m1"));
        assertTrue(tree.getNode(2).getBlacklistedMethods().isEmpty());
        assertTrue(tree.getRoot().getBlacklistedMethods().isEmpty());
        assertTrue(tree.isActionBlacklisted("explode"));
        assertTrue(tree.getGoalNetwork().isEmpty());
    }

    @Test
    void testOnlyRootMayBeExpandedIntoNothing() {
        SolutionTree tree = SolutionTree.createInitial(List.of(Todo.task("t")), state);
        tree.insertChildren(0, tree.getGoals(), SolutionTree.ROOT_EXPANSION, state);

        assertThrows(IllegalArgumentException.class, () -> tree.insertChildren(1, List.of(), "task_method", state));
        assertTrue(tree.getNode(1).isOpen());
        assertEquals(0, SolutionTree.createInitial(List.of(), state)
            .insertChildren(0, List.of(), SolutionTree.ROOT_EXPANSION, state).size());
    }

    @Test
    void testNodesAreListedInInsertionOrder() {
        SolutionTree tree = SolutionTree.createInitial(List.of(Todo.task("t"), Todo.task("u")), state);
        tree.insertChildren(0, tree.getGoals(), SolutionTree.ROOT_EXPANSION, state);

        List<SolutionNode> nodes = tree.getNodes();

        assertEquals(3, nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            assertEquals(i, nodes.get(i).getId());
        }
        assertThrows(UnsupportedOperationException.class, () -> nodes.remove(0));
    }
}
