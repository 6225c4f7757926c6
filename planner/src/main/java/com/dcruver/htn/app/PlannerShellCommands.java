package com.dcruver.htn.app;

import com.dcruver.htn.config.PlannerProperties;
import com.dcruver.htn.domain.planning.HtnPlanner;
import com.dcruver.htn.domain.planning.PlanResult;
import com.dcruver.htn.domain.planning.PlannerOptions;
import com.dcruver.htn.domain.planning.PlanningException;
import com.dcruver.htn.domain.state.FactState;
import com.dcruver.htn.domain.todo.Todo;
import com.dcruver.htn.domain.tree.PlanStep;
import com.dcruver.htn.domain.tree.TreeStats;
import com.dcruver.htn.examples.SimpleTravelDomain;
import com.dcruver.htn.reporting.PlanReportWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Spring Shell commands for planning in the bundled simple-travel domain.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class PlannerShellCommands {

    private final HtnPlanner planner;
    private final SimpleTravelDomain travelDomain;
    private final PlannerProperties plannerProperties;
    private final PlanReportWriter reportWriter;

    // Last successful or bounded plan
    private PlanResult lastResult;

    @ShellMethod(key = {"plan-travel", "plan"}, value = "Plan trips in the simple travel domain, e.g. plan-travel alice park")
    public String planTravel(
            @ShellOption(help = "Comma-separated people, e.g. alice,bob") String people,
            @ShellOption(help = "Destination location") String destination,
            @ShellOption(value = "--max-depth", defaultValue = "-1", help = "Expansion bound (default from config)") int maxDepth,
            @ShellOption(value = "--verbose", defaultValue = "-1", help = "Diagnostic level 0-3") int verbose) {

        PlannerOptions options = plannerProperties.toOptions();
        if (maxDepth >= 0) {
            options = options.toBuilder().maxDepth(maxDepth).build();
        }
        if (verbose >= 0) {
            options = options.toBuilder().verbose(verbose).build();
        }

        List<Todo> todos = new ArrayList<>();
        for (String person : people.split(",")) {
            todos.add(Todo.task(SimpleTravelDomain.TRAVEL, person.trim(), destination));
        }

        try {
            FactState initialState = travelDomain.initialState();
            lastResult = planner.plan(travelDomain.getDomain(), initialState, todos, options);
        } catch (PlanningException e) {
            log.error("Planning failed", e);
            return String.format("Planning failed (%s): %s", e.getType(), e.getMessage());
        }

        StringBuilder result = new StringBuilder();
        result.append(String.format("Plan %s after %d iterations.\n\n",
            lastResult.isComplete() ? "complete" : "stopped at max depth",
            lastResult.getMetadata().getIterations()));

        List<PlanStep> actions = lastResult.actions();
        if (actions.isEmpty()) {
            result.append("No actions needed.\n");
        }
        int step = 1;
        for (PlanStep action : actions) {
            result.append(String.format("%d. %s\n", step++, action));
        }

        result.append("\nFinal locations:\n");
        for (String person : people.split(",")) {
            String name = person.trim();
            result.append(String.format("- %s: %s (cash %s)\n", name,
                lastResult.getFinalState().getFact(name, SimpleTravelDomain.LOC),
                lastResult.getFinalState().getFact(name, "cash")));
        }
        return result.toString();
    }

    @ShellMethod(key = "plan-stats", value = "Show solution tree statistics for the last plan")
    public String planStats() {
        if (lastResult == null) {
            return "No plan yet. Run 'plan-travel' first.";
        }
        TreeStats stats = lastResult.getSolutionTree().stats();
        return String.format("""
            Nodes: %d (%d expanded)
            Primitive actions: %d
            Tree depth: %d
            Expansions: %d
            Complete: %s
            """,
            stats.getTotalNodes(), stats.getExpandedNodes(), stats.getPrimitiveActions(),
            stats.getMaxDepth(), stats.getExpansions(), lastResult.getSolutionTree().isComplete());
    }

    @ShellMethod(key = "plan-report", value = "Print the last plan as JSON, optionally saving it")
    public String planReport(@ShellOption(defaultValue = "false", help = "Also write the report to disk") boolean save) {
        if (lastResult == null) {
            return "No plan yet. Run 'plan-travel' first.";
        }
        if (!save) {
            return reportWriter.toJson(lastResult);
        }
        try {
            Path file = reportWriter.write(lastResult);
            return "Report written to " + file;
        } catch (IOException e) {
            log.error("Failed to write plan report", e);
            return "Failed to write report: " + e.getMessage();
        }
    }
}
