package com.dcruver.htn.domain.planning;

import com.dcruver.htn.domain.MultigoalMethod;
import com.dcruver.htn.domain.NamedMethod;
import com.dcruver.htn.domain.PlanningDomain;
import com.dcruver.htn.domain.TaskMethod;
import com.dcruver.htn.domain.state.FactState;
import com.dcruver.htn.domain.todo.GoalTodo;
import com.dcruver.htn.domain.todo.MultigoalTodo;
import com.dcruver.htn.domain.todo.RootTodo;
import com.dcruver.htn.domain.todo.TaskTodo;
import com.dcruver.htn.domain.todo.Todo;
import com.dcruver.htn.domain.todo.TodoKind;
import com.dcruver.htn.domain.tree.SolutionNode;
import com.dcruver.htn.domain.tree.SolutionTree;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Expands a single open node according to the kind of todo it carries.
 *
 * Decomposition never changes the planning state; only a task executed as an
 * action does, and then the new state is returned in the {@link Expansion}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NodeExpander {

    public static final String TASK_METHOD = "task_method";
    public static final String UNIGOAL_METHOD = "unigoal_method";
    public static final String MULTIGOAL_METHOD = "multigoal_method";
    public static final String DEFAULT_MULTIGOAL_METHOD = "default_multigoal_method";

    private static final List<NamedMethod<MultigoalMethod>> DEFAULT_MULTIGOAL =
        List.of(new NamedMethod<>(DefaultMultigoalMethod.ID, new DefaultMultigoalMethod()));

    private final MethodResolver methodResolver;
    private final PrimitiveExecutor primitiveExecutor;

    public Expansion expand(
            PlanningDomain domain,
            SolutionTree tree,
            int nodeId,
            FactState state,
            PlannerOptions options) throws PlanningException {

        SolutionNode node = tree.getNode(nodeId);
        if (!node.isOpen()) {
            throw new PlanningException(PlanningErrorType.MALFORMED_TASK,
                "Node " + node.getLabel() + " was already expanded");
        }

        Todo todo = node.getTodo();
        if (todo == null || todo.getKind() == null) {
            throw new PlanningException(PlanningErrorType.MALFORMED_TASK,
                "Node " + node.getLabel() + " has no recognisable todo: " + todo);
        }

        return switch (todo.getKind()) {
            case ROOT -> expandRoot(tree, node, todoAs(RootTodo.class, node), state, options);
            case TASK -> expandTask(domain, tree, node, todoAs(TaskTodo.class, node), state, options);
            case GOAL -> expandGoal(domain, tree, node, todoAs(GoalTodo.class, node), state, options);
            case MULTIGOAL -> expandMultigoal(domain, tree, node, todoAs(MultigoalTodo.class, node), state, options);
            case PRIMITIVE -> throw new PlanningException(PlanningErrorType.MALFORMED_TASK,
                "Primitive todo " + todo + " reached dispatch at node " + node.getLabel());
        };
    }

    private static <T extends Todo> T todoAs(Class<T> type, SolutionNode node) throws PlanningException {
        Todo todo = node.getTodo();
        if (!type.isInstance(todo)) {
            throw new PlanningException(PlanningErrorType.MALFORMED_TASK,
                "Todo " + todo + " at node " + node.getLabel() + " claims kind " + todo.getKind()
                    + " but is a " + todo.getClass().getSimpleName());
        }
        return type.cast(todo);
    }

    // Methods may hand back anything; only well-formed todos enter the tree.
    private static List<Todo> checkSubtasks(SolutionNode node, String methodId, List<Todo> subtasks)
            throws PlanningException {
        for (Todo subtask : subtasks) {
            if (subtask == null || subtask.getKind() == null
                    || subtask.getKind() == TodoKind.ROOT || subtask.getKind() == TodoKind.PRIMITIVE) {
                throw new PlanningException(PlanningErrorType.MALFORMED_TASK,
                    "Method " + methodId + " returned malformed subtask " + subtask + " for node " + node.getLabel());
            }
        }
        return subtasks;
    }

    private Expansion expandRoot(SolutionTree tree, SolutionNode node, RootTodo root,
                                 FactState state, PlannerOptions options) throws PlanningException {
        if (!node.isRoot()) {
            throw new PlanningException(PlanningErrorType.MALFORMED_TASK,
                "Root todo found below the root at node " + node.getLabel());
        }
        if (options.getVerbose() > 1) {
            log.debug("Expanding root node with {} todos", root.getTodos().size());
        }
        tree.insertChildren(node.getId(), root.getTodos(), SolutionTree.ROOT_EXPANSION, state);
        return new Expansion(state, "root expanded into " + root.getTodos().size() + " todos");
    }

    private Expansion expandTask(PlanningDomain domain, SolutionTree tree, SolutionNode node, TaskTodo task,
                                 FactState state, PlannerOptions options) throws PlanningException {
        String taskName = task.getName();
        List<NamedMethod<TaskMethod>> methods = domain.taskMethods(taskName);

        Resolution resolution = methodResolver.resolve(
            "task " + taskName,
            methods,
            node.getBlacklistedMethods(),
            method -> method.apply(state, task.getArgs()),
            options.getVerbose());

        switch (resolution.getKind()) {
            case COMPLETED:
                tree.markCompleted(node.getId());
                return new Expansion(state, "task " + taskName + " completed by " + resolution.getMethodId());
            case DECOMPOSED:
                tree.insertChildren(node.getId(), checkSubtasks(node, resolution.getMethodId(), resolution.getSubtasks()),
                    TASK_METHOD, state);
                return new Expansion(state, "task " + taskName + " decomposed by " + resolution.getMethodId()
                    + " into " + resolution.getSubtasks().size() + " subtasks");
            case NO_APPLICABLE_METHOD:
            default:
                break;
        }

        if (!methods.isEmpty() && domain.action(taskName).isEmpty()) {
            log.warn("Task '{}' exhausted {} methods and has no action", taskName, methods.size());
            throw new PlanningException(PlanningErrorType.NO_APPLICABLE_METHOD,
                "No applicable method for task " + taskName + ": " + resolution.getFailures());
        }

        if (options.getVerbose() > 2) {
            log.debug("No methods for task {}, executing as primitive action", taskName);
        }
        FactState next = primitiveExecutor.execute(
            domain, tree, node.getId(), taskName, task.getArgs(), state, options.getVerbose());
        return new Expansion(next, "action " + taskName + task.getArgs() + " executed");
    }

    private Expansion expandGoal(PlanningDomain domain, SolutionTree tree, SolutionNode node, GoalTodo goal,
                                 FactState state, PlannerOptions options) throws PlanningException {
        String description = describe(goal);

        if (state.matches(goal.getPredicate(), goal.getSubject(), goal.getValue())) {
            if (options.getVerbose() > 2) {
                log.debug("Goal {} already satisfied", description);
            }
            tree.markCompleted(node.getId());
            return new Expansion(state, "goal " + description + " already satisfied");
        }

        if (options.getVerbose() > 1) {
            log.debug("Expanding goal node {}", description);
        }

        Resolution resolution = methodResolver.resolve(
            "goal " + description,
            domain.unigoalMethods(goal.getPredicate()),
            node.getBlacklistedMethods(),
            method -> method.apply(state, goal.getSubject(), goal.getValue()),
            options.getVerbose());

        return switch (resolution.getKind()) {
            case COMPLETED -> {
                tree.markCompleted(node.getId());
                yield new Expansion(state, "goal " + description + " completed by " + resolution.getMethodId());
            }
            case DECOMPOSED -> {
                tree.insertChildren(node.getId(), checkSubtasks(node, resolution.getMethodId(), resolution.getSubtasks()),
                    UNIGOAL_METHOD, state);
                yield new Expansion(state, "goal " + description + " decomposed by " + resolution.getMethodId());
            }
            case NO_APPLICABLE_METHOD -> unresolved(tree, node, "goal " + description, resolution, state, options);
        };
    }

    private Expansion expandMultigoal(PlanningDomain domain, SolutionTree tree, SolutionNode node,
                                      MultigoalTodo multigoal, FactState state,
                                      PlannerOptions options) throws PlanningException {
        boolean allSatisfied = multigoal.getGoals().stream()
            .allMatch(goal -> state.matches(goal.getPredicate(), goal.getSubject(), goal.getValue()));
        if (allSatisfied) {
            tree.markCompleted(node.getId());
            return new Expansion(state, "multigoal already satisfied");
        }

        if (options.getVerbose() > 1) {
            log.debug("Expanding multigoal node with {} goals", multigoal.getGoals().size());
        }

        Resolution resolution = methodResolver.resolve(
            "multigoal",
            domain.multigoalMethods(),
            node.getBlacklistedMethods(),
            method -> method.apply(state, multigoal),
            options.getVerbose());
        String label = MULTIGOAL_METHOD;

        if (!resolution.isResolved()) {
            if (options.getVerbose() > 1) {
                log.debug("No domain multigoal method applied - using default method");
            }
            resolution = methodResolver.resolve(
                "multigoal",
                DEFAULT_MULTIGOAL,
                node.getBlacklistedMethods(),
                method -> method.apply(state, multigoal),
                options.getVerbose());
            label = DEFAULT_MULTIGOAL_METHOD;
        }

        return switch (resolution.getKind()) {
            case COMPLETED -> {
                tree.markCompleted(node.getId());
                yield new Expansion(state, "multigoal completed by " + resolution.getMethodId());
            }
            case DECOMPOSED -> {
                tree.insertChildren(node.getId(), checkSubtasks(node, resolution.getMethodId(), resolution.getSubtasks()),
                    label, state);
                yield new Expansion(state, "multigoal decomposed by " + resolution.getMethodId()
                    + " into " + resolution.getSubtasks().size() + " subtasks");
            }
            case NO_APPLICABLE_METHOD -> unresolved(tree, node, "multigoal", resolution, state, options);
        };
    }

    private Expansion unresolved(SolutionTree tree, SolutionNode node, String target, Resolution resolution,
                                 FactState state, PlannerOptions options) throws PlanningException {
        switch (options.getUnresolvedGoalPolicy()) {
            case MARK_PRIMITIVE:
                log.debug("No applicable method for {} - marking node {} primitive", target, node.getLabel());
                tree.markPrimitive(node.getId());
                return new Expansion(state, target + " marked primitive without a method");
            case FAIL:
            default:
                log.warn("No applicable method for {} at node {}", target, node.getLabel());
                throw new PlanningException(PlanningErrorType.NO_APPLICABLE_METHOD,
                    "No applicable method for " + target + ": " + resolution.getFailures());
        }
    }

    private static String describe(GoalTodo goal) {
        return goal.getPredicate() + "(" + goal.getSubject() + ", " + goal.getValue() + ")";
    }
}
