package com.dcruver.htn.examples;

import com.dcruver.htn.domain.ActionOutcome;
import com.dcruver.htn.domain.MethodOutcome;
import com.dcruver.htn.domain.PlanningDomain;
import com.dcruver.htn.domain.state.FactState;
import com.dcruver.htn.domain.todo.Todo;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * The classic IPyHOP "simple travel" domain: people get around by walking short
 * distances or by taking a taxi they can afford.
 *
 * State layout:
 * - {@code (obj, type)} = person | location | taxi (rigid)
 * - {@code ("x|y", dist)} = distance, stored in one direction (rigid)
 * - {@code (obj, loc)} = where a person or taxi is; a person in a taxi is "at" the taxi
 * - {@code (person, cash)}, {@code (person, owe)} = money
 */
@Component
@Slf4j
public class SimpleTravelDomain {

    public static final String NAME = "simple_travel";
    public static final String LOC = "loc";
    public static final String TRAVEL = "travel";

    private static final double MAX_WALKING_DISTANCE = 2.0;

    @Getter
    private final PlanningDomain domain;

    public SimpleTravelDomain() {
        this.domain = PlanningDomain.builder(NAME)
            .action("walk", this::walk)
            .action("call_taxi", this::callTaxi)
            .action("ride_taxi", this::rideTaxi)
            .action("pay_driver", this::payDriver)
            .unigoalMethod(LOC, "do_nothing", this::doNothing)
            .unigoalMethod(LOC, "travel_by_foot", this::travelByFoot)
            .unigoalMethod(LOC, "travel_by_taxi", this::travelByTaxi)
            .taskMethod(TRAVEL, "travel_to", (state, args) ->
                MethodOutcome.subtasks(Todo.goal(LOC, (String) args.get(0), args.get(1))))
            .build();
    }

    /**
     * Alice at home_a with 20 cash, Bob at home_b with 15, the taxi waiting at the lot.
     */
    public FactState initialState() {
        FactState state = FactState.empty();
        for (String person : List.of("alice", "bob")) {
            state = state.withFact(person, "type", "person");
        }
        for (String location : List.of("home_a", "home_b", "park", "taxi_lot")) {
            state = state.withFact(location, "type", "location");
        }
        return state
            .withFact("taxi1", "type", "taxi")
            .withFact("home_a|park", "dist", 8.0)
            .withFact("home_b|park", "dist", 2.0)
            .withFact("home_a|home_b", "dist", 6.0)
            .withFact("taxi_lot|home_a", "dist", 3.0)
            .withFact("taxi_lot|home_b", "dist", 4.0)
            .withFact("taxi_lot|park", "dist", 5.0)
            .withFact("alice", LOC, "home_a")
            .withFact("bob", LOC, "home_b")
            .withFact("taxi1", LOC, "taxi_lot")
            .withFact("alice", "cash", 20.0)
            .withFact("bob", "cash", 15.0)
            .withFact("alice", "owe", 0.0)
            .withFact("bob", "owe", 0.0);
    }

    public static double taxiRate(double distance) {
        return 1.5 + 0.5 * distance;
    }

    static Double distance(FactState state, Object x, Object y) {
        Object dist = state.getFact(x + "|" + y, "dist");
        if (dist == null) {
            dist = state.getFact(y + "|" + x, "dist");
        }
        return dist == null ? null : ((Number) dist).doubleValue();
    }

    static boolean isA(FactState state, Object obj, String type) {
        return obj != null && type.equals(state.getFact(obj.toString(), "type"));
    }

    private static double money(FactState state, String person, String predicate) {
        Object amount = state.getFact(person, predicate);
        return amount == null ? 0.0 : ((Number) amount).doubleValue();
    }

    // Unigoal methods for loc(person) = destination

    private MethodOutcome doNothing(FactState state, String person, Object destination) {
        if (!isA(state, person, "person") || !isA(state, destination, "location")) {
            return MethodOutcome.failure(person + " -> " + destination + " is not a person and location");
        }
        if (state.matches(LOC, person, destination)) {
            return MethodOutcome.done();
        }
        return MethodOutcome.failure(person + " is not at " + destination);
    }

    private MethodOutcome travelByFoot(FactState state, String person, Object destination) {
        if (!isA(state, person, "person") || !isA(state, destination, "location")) {
            return MethodOutcome.failure(person + " -> " + destination + " is not a person and location");
        }
        Object from = state.getFact(person, LOC);
        Double dist = distance(state, from, destination);
        if (dist == null || dist > MAX_WALKING_DISTANCE) {
            return MethodOutcome.failure("Distance too far for walking (" + dist + ")");
        }
        return MethodOutcome.subtasks(Todo.task("walk", person, from, destination));
    }

    private MethodOutcome travelByTaxi(FactState state, String person, Object destination) {
        if (!isA(state, person, "person") || !isA(state, destination, "location")) {
            return MethodOutcome.failure(person + " -> " + destination + " is not a person and location");
        }
        Object from = state.getFact(person, LOC);
        Double dist = distance(state, from, destination);
        if (dist == null) {
            return MethodOutcome.failure("No route from " + from + " to " + destination);
        }
        double fare = taxiRate(dist);
        double cash = money(state, person, "cash");
        if (cash < fare) {
            return MethodOutcome.failure(String.format("Not enough cash for taxi (has %.1f, needs %.1f)", cash, fare));
        }
        return MethodOutcome.subtasks(
            Todo.task("call_taxi", person, from),
            Todo.task("ride_taxi", person, destination),
            Todo.task("pay_driver", person, destination));
    }

    // Actions

    private ActionOutcome walk(FactState state, List<Object> args) {
        String person = (String) args.get(0);
        Object from = args.get(1);
        Object to = args.get(2);
        if (!isA(state, person, "person") || !isA(state, from, "location") || !isA(state, to, "location")) {
            return ActionOutcome.failure("walk needs a person and two locations");
        }
        if (from.equals(to)) {
            return ActionOutcome.failure("Cannot walk from " + from + " to itself");
        }
        if (!state.matches(LOC, person, from)) {
            return ActionOutcome.failure(person + " is not at " + from);
        }
        return ActionOutcome.success(state.withFact(person, LOC, to));
    }

    private ActionOutcome callTaxi(FactState state, List<Object> args) {
        String person = (String) args.get(0);
        Object location = args.get(1);
        if (!isA(state, person, "person") || !isA(state, location, "location")) {
            return ActionOutcome.failure("call_taxi needs a person and a location");
        }
        return ActionOutcome.success(state
            .withFact("taxi1", LOC, location)
            .withFact(person, LOC, "taxi1"));
    }

    private ActionOutcome rideTaxi(FactState state, List<Object> args) {
        String person = (String) args.get(0);
        Object destination = args.get(1);
        if (!isA(state, person, "person") || !isA(state, destination, "location")) {
            return ActionOutcome.failure("ride_taxi needs a person and a location");
        }
        Object taxi = state.getFact(person, LOC);
        if (!isA(state, taxi, "taxi")) {
            return ActionOutcome.failure(person + " is not in a taxi");
        }
        Object from = state.getFact(taxi.toString(), LOC);
        if (!isA(state, from, "location")) {
            return ActionOutcome.failure("Taxi is not at a valid location");
        }
        if (from.equals(destination)) {
            return ActionOutcome.failure("Already at destination " + destination);
        }
        Double dist = distance(state, from, destination);
        if (dist == null) {
            return ActionOutcome.failure("No route from " + from + " to " + destination);
        }
        return ActionOutcome.success(state
            .withFact(taxi.toString(), LOC, destination)
            .withFact(person, "owe", taxiRate(dist)));
    }

    private ActionOutcome payDriver(FactState state, List<Object> args) {
        String person = (String) args.get(0);
        Object destination = args.get(1);
        if (!isA(state, person, "person")) {
            return ActionOutcome.failure(person + " is not a person");
        }
        double cash = money(state, person, "cash");
        double owe = money(state, person, "owe");
        if (cash < owe) {
            return ActionOutcome.failure(String.format("%s doesn't have enough cash (has %.1f, owes %.1f)",
                person, cash, owe));
        }
        log.debug("{} pays {} for the taxi", person, owe);
        return ActionOutcome.success(state
            .withFact(person, "cash", cash - owe)
            .withFact(person, "owe", 0.0)
            .withFact(person, LOC, destination));
    }
}
