package com.dcruver.htn.domain.tree;

import com.dcruver.htn.domain.state.FactState;
import com.dcruver.htn.domain.todo.PrimitiveTodo;
import com.dcruver.htn.domain.todo.RootTodo;
import com.dcruver.htn.domain.todo.TaskTodo;
import com.dcruver.htn.domain.todo.Todo;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Append-only record of every decomposition decision made while planning.
 *
 * Nodes live in an arena and are addressed by their index, so ids are dense,
 * unique and never reused. Nodes are never removed; the tree only grows while a
 * plan is being built and is handed to the caller once planning stops.
 */
public class SolutionTree {

    public static final String ROOT_EXPANSION = "root_expansion";

    private static final String ROOT_LABEL = "root";

    private final List<SolutionNode> nodes = new ArrayList<>();
    private final Set<String> blacklistedActions = new LinkedHashSet<>();
    // Reserved for ordering constraints between goals; the base planner never fills it.
    private final Map<Integer, List<Integer>> goalNetwork = new LinkedHashMap<>();

    @Getter
    private int expansionCount;

    private SolutionTree() {
    }

    /**
     * Creates a tree whose only node is an unexpanded root holding the todo list.
     */
    public static SolutionTree createInitial(List<? extends Todo> todos, FactState state) {
        Objects.requireNonNull(todos, "todos");
        SolutionTree tree = new SolutionTree();
        tree.nodes.add(new SolutionNode(0, ROOT_LABEL, new RootTodo(todos), null, state));
        return tree;
    }

    /**
     * Builds an already complete tree from a flat action list, one primitive child per action.
     */
    public static SolutionTree fromActions(List<PlanStep> actions, List<? extends Todo> goals, FactState state) {
        SolutionTree tree = createInitial(goals, state);
        List<Todo> steps = new ArrayList<>();
        for (PlanStep action : actions) {
            steps.add(new PrimitiveTodo(action.getName(), action.getArgs()));
        }
        if (steps.isEmpty()) {
            tree.markCompleted(tree.getRootId());
            return tree;
        }
        List<Integer> childIds = tree.insertChildren(tree.getRootId(), steps, "actions_from_plan", state);
        childIds.forEach(tree::markPrimitive);
        return tree;
    }

    public int getRootId() {
        return 0;
    }

    public SolutionNode getRoot() {
        return nodes.get(0);
    }

    public SolutionNode getNode(int id) {
        if (id < 0 || id >= nodes.size()) {
            throw new IllegalArgumentException("No node with id " + id);
        }
        return nodes.get(id);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * All nodes in insertion order.
     */
    public List<SolutionNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * Adds one child per subtask under an unexpanded parent and marks the parent expanded.
     * Only the root may be expanded into nothing; other nodes with no work left are
     * marked completed instead.
     *
     * @return the new child ids, in subtask order
     */
    public List<Integer> insertChildren(int parentId, List<? extends Todo> subtasks, String methodLabel, FactState state) {
        SolutionNode parent = getNode(parentId);
        if (parent.isExpanded()) {
            throw new IllegalStateException("Node " + parent.getLabel() + " is already expanded");
        }
        if (subtasks.isEmpty() && !parent.isRoot()) {
            throw new IllegalArgumentException("Node " + parent.getLabel() + " cannot be expanded into no subtasks");
        }

        List<Integer> childIds = new ArrayList<>(subtasks.size());
        for (int index = 0; index < subtasks.size(); index++) {
            int childId = nodes.size();
            String label = parent.getLabel() + "_" + methodLabel + "_" + index;
            nodes.add(new SolutionNode(childId, label, subtasks.get(index), parentId, state));
            parent.addChild(childId);
            childIds.add(childId);
        }

        parent.setMethodTried(methodLabel);
        parent.setExpanded(true);
        parent.setVisited(true);
        expansionCount++;
        return childIds;
    }

    public void markPrimitive(int id) {
        SolutionNode node = getNode(id);
        node.setPrimitive(true);
        node.setExpanded(true);
        node.setVisited(true);
    }

    public void markCompleted(int id) {
        SolutionNode node = getNode(id);
        node.setExpanded(true);
        node.setVisited(true);
    }

    /**
     * Records that a task node was executed as an action and re-tags it as primitive.
     */
    public void markExecuted(int id, String actionName, List<Object> args) {
        SolutionNode node = getNode(id);
        node.setTodo(new PrimitiveTodo(actionName, args));
        markPrimitive(id);
    }

    public void blacklistMethod(int nodeId, String methodId) {
        getNode(nodeId).addBlacklistedMethod(methodId);
    }

    public void blacklistAction(String actionName) {
        blacklistedActions.add(actionName);
    }

    public boolean isActionBlacklisted(String actionName) {
        return blacklistedActions.contains(actionName);
    }

    public Set<String> getBlacklistedActions() {
        return Collections.unmodifiableSet(blacklistedActions);
    }

    public Map<Integer, List<Integer>> getGoalNetwork() {
        return Collections.unmodifiableMap(goalNetwork);
    }

    /**
     * First node in insertion order that is neither expanded nor primitive.
     */
    public Optional<SolutionNode> findNextUnexpanded() {
        return nodes.stream()
            .filter(SolutionNode::isOpen)
            .findFirst();
    }

    public List<Integer> getDescendants(int id) {
        List<Integer> descendants = new ArrayList<>();
        collectDescendants(getNode(id), descendants);
        return descendants;
    }

    private void collectDescendants(SolutionNode node, List<Integer> into) {
        for (int childId : node.getChildrenIds()) {
            into.add(childId);
            collectDescendants(nodes.get(childId), into);
        }
    }

    /**
     * Depth-first, left-to-right walk from the root collecting executed actions.
     * Pure: repeated calls on the same tree return equal lists.
     */
    public List<PlanStep> extractPrimitiveActions() {
        List<PlanStep> actions = new ArrayList<>();
        collectActions(getRoot(), actions);
        return actions;
    }

    private void collectActions(SolutionNode node, List<PlanStep> into) {
        if (node.isPrimitive() && node.isExpanded()) {
            Todo todo = node.getTodo();
            if (todo instanceof PrimitiveTodo) {
                PrimitiveTodo primitive = (PrimitiveTodo) todo;
                into.add(new PlanStep(primitive.getName(), primitive.getArgs()));
            } else if (todo instanceof TaskTodo) {
                TaskTodo task = (TaskTodo) todo;
                into.add(new PlanStep(task.getName(), task.getArgs()));
            }
            // goals marked primitive by the permissive policy carry no action
            return;
        }
        for (int childId : node.getChildrenIds()) {
            collectActions(nodes.get(childId), into);
        }
    }

    /**
     * True when every node is an executed primitive, has children, or is the root.
     */
    public boolean isComplete() {
        return nodes.stream()
            .allMatch(node -> (node.isPrimitive() && node.isExpanded()) || node.hasChildren() || node.isRoot());
    }

    /**
     * The todo list the tree was planned for.
     */
    public List<Todo> getGoals() {
        Todo rootTodo = getRoot().getTodo();
        return rootTodo instanceof RootTodo ? ((RootTodo) rootTodo).getTodos() : List.of(rootTodo);
    }

    public int planCost() {
        return extractPrimitiveActions().size();
    }

    public TreeStats stats() {
        int expanded = (int) nodes.stream().filter(SolutionNode::isExpanded).count();
        return TreeStats.builder()
            .totalNodes(nodes.size())
            .expandedNodes(expanded)
            .primitiveActions(planCost())
            .maxDepth(depthBelow(getRoot()))
            .expansions(expansionCount)
            .build();
    }

    private int depthBelow(SolutionNode node) {
        int deepest = 0;
        for (int childId : node.getChildrenIds()) {
            deepest = Math.max(deepest, 1 + depthBelow(nodes.get(childId)));
        }
        return deepest;
    }
}
