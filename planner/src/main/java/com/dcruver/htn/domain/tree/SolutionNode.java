package com.dcruver.htn.domain.tree;

import com.dcruver.htn.domain.state.FactState;
import com.dcruver.htn.domain.todo.Todo;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A node of the solution tree. Only {@link SolutionTree} changes a node.
 */
@Getter
public class SolutionNode {

    private final int id;
    private final String label;
    private final Integer parentId;
    private final FactState state;
    private final boolean durative;

    @Setter(AccessLevel.PACKAGE)
    private Todo todo;
    @Setter(AccessLevel.PACKAGE)
    private boolean visited;
    @Setter(AccessLevel.PACKAGE)
    private boolean expanded;
    @Setter(AccessLevel.PACKAGE)
    private boolean primitive;
    @Setter(AccessLevel.PACKAGE)
    private String methodTried;

    @Getter(AccessLevel.NONE)
    private final List<Integer> childrenIds = new ArrayList<>();
    @Getter(AccessLevel.NONE)
    private final Set<String> blacklistedMethods = new LinkedHashSet<>();

    SolutionNode(int id, String label, Todo todo, Integer parentId, FactState state) {
        this.id = id;
        this.label = label;
        this.todo = todo;
        this.parentId = parentId;
        this.state = state;
        this.durative = false;
    }

    public List<Integer> getChildrenIds() {
        return Collections.unmodifiableList(childrenIds);
    }

    public Set<String> getBlacklistedMethods() {
        return Collections.unmodifiableSet(blacklistedMethods);
    }

    public boolean isRoot() {
        return parentId == null;
    }

    public boolean hasChildren() {
        return !childrenIds.isEmpty();
    }

    /**
     * Still waiting for the planner: neither expanded nor executed.
     */
    public boolean isOpen() {
        return !expanded && !primitive;
    }

    void addChild(int childId) {
        childrenIds.add(childId);
    }

    void addBlacklistedMethod(String methodId) {
        blacklistedMethods.add(methodId);
    }

    @Override
    public String toString() {
        return String.format("SolutionNode[%d %s %s expanded=%s primitive=%s children=%s]",
            id, label, todo, expanded, primitive, childrenIds);
    }
}
