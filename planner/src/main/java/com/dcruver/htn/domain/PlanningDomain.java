package com.dcruver.htn.domain;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only registry of the methods and actions a planner may use.
 *
 * Methods are returned in registration order, which is the order the planner tries them in.
 * An action name maps to exactly one action.
 */
public final class PlanningDomain {

    @Getter
    private final String name;
    private final Map<String, List<NamedMethod<TaskMethod>>> taskMethods;
    private final Map<String, List<NamedMethod<UnigoalMethod>>> unigoalMethods;
    private final List<NamedMethod<MultigoalMethod>> multigoalMethods;
    private final Map<String, ActionFunction> actions;

    private PlanningDomain(Builder builder) {
        this.name = builder.name;
        this.taskMethods = freeze(builder.taskMethods);
        this.unigoalMethods = freeze(builder.unigoalMethods);
        this.multigoalMethods = List.copyOf(builder.multigoalMethods);
        this.actions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.actions));
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public List<NamedMethod<TaskMethod>> taskMethods(String taskName) {
        return taskMethods.getOrDefault(taskName, List.of());
    }

    public List<NamedMethod<UnigoalMethod>> unigoalMethods(String predicate) {
        return unigoalMethods.getOrDefault(predicate, List.of());
    }

    public List<NamedMethod<MultigoalMethod>> multigoalMethods() {
        return multigoalMethods;
    }

    public Optional<ActionFunction> action(String actionName) {
        return Optional.ofNullable(actions.get(actionName));
    }

    public Set<String> actionNames() {
        return actions.keySet();
    }

    public Set<String> taskNames() {
        return taskMethods.keySet();
    }

    public Set<String> goalPredicates() {
        return unigoalMethods.keySet();
    }

    @Override
    public String toString() {
        return String.format("PlanningDomain[%s: %d tasks, %d predicates, %d multigoal methods, %d actions]",
            name, taskMethods.size(), unigoalMethods.size(), multigoalMethods.size(), actions.size());
    }

    private static <M> Map<String, List<NamedMethod<M>>> freeze(Map<String, List<NamedMethod<M>>> source) {
        Map<String, List<NamedMethod<M>>> copy = new LinkedHashMap<>();
        source.forEach((key, methods) -> copy.put(key, List.copyOf(methods)));
        return Collections.unmodifiableMap(copy);
    }

    public static final class Builder {
        private final String name;
        private final Map<String, List<NamedMethod<TaskMethod>>> taskMethods = new LinkedHashMap<>();
        private final Map<String, List<NamedMethod<UnigoalMethod>>> unigoalMethods = new LinkedHashMap<>();
        private final List<NamedMethod<MultigoalMethod>> multigoalMethods = new ArrayList<>();
        private final Map<String, ActionFunction> actions = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder taskMethod(String taskName, String methodId, TaskMethod method) {
            addUnique(taskMethods.computeIfAbsent(taskName, k -> new ArrayList<>()), methodId, method,
                "task " + taskName);
            return this;
        }

        public Builder unigoalMethod(String predicate, String methodId, UnigoalMethod method) {
            addUnique(unigoalMethods.computeIfAbsent(predicate, k -> new ArrayList<>()), methodId, method,
                "predicate " + predicate);
            return this;
        }

        public Builder multigoalMethod(String methodId, MultigoalMethod method) {
            addUnique(multigoalMethods, methodId, method, "multigoals");
            return this;
        }

        public Builder action(String actionName, ActionFunction action) {
            if (actions.containsKey(actionName)) {
                throw new IllegalArgumentException("Action already registered: " + actionName);
            }
            actions.put(actionName, action);
            return this;
        }

        /**
         * Registers an action that returns its next state directly; a {@code null}
         * return is reported as a failed action.
         */
        public Builder transition(String actionName, StateTransition transition) {
            return action(actionName, (state, args) -> {
                var next = transition.apply(state, args);
                return next == null ? null : ActionOutcome.success(next);
            });
        }

        public PlanningDomain build() {
            return new PlanningDomain(this);
        }

        private static <M> void addUnique(List<NamedMethod<M>> methods, String methodId, M method, String owner) {
            boolean duplicate = methods.stream().anyMatch(m -> m.getId().equals(methodId));
            if (duplicate) {
                throw new IllegalArgumentException("Method " + methodId + " already registered for " + owner);
            }
            methods.add(new NamedMethod<>(methodId, method));
        }
    }
}
