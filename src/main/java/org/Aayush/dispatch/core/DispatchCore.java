package org.Aayush.dispatch.core;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.core.concurrent.FanOut;
import org.Aayush.core.id.IDMapper;
import org.Aayush.dispatch.assignment.Assignment;
import org.Aayush.dispatch.assignment.AssignmentEnumerator;
import org.Aayush.dispatch.budget.EnumerationBudget;
import org.Aayush.dispatch.feasibility.FeasibilityEvaluator;
import org.Aayush.dispatch.feasibility.FeasibilityTable;
import org.Aayush.dispatch.model.Drone;
import org.Aayush.dispatch.model.Order;
import org.Aayush.dispatch.route.RouteCatalog;
import org.Aayush.dispatch.route.RouteGenerator;
import org.Aayush.dispatch.route.RouteProfile;
import org.Aayush.dispatch.selection.AssignmentSelector;

import java.util.ArrayList;
import java.util.List;

/**
 * Main dispatch orchestration entry point.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Validate the request and map order/drone ids to dense internal indices.</li>
 * <li>Drop unavailable drones.</li>
 * <li>Generate every route with its metrics.</li>
 * <li>Evaluate per-drone feasibility.</li>
 * <li>Enumerate order-disjoint assignments.</li>
 * <li>Select by coverage, then order count, then total time.</li>
 * <li>Map the selected assignment back to external ids.</li>
 * </ul>
 *
 * <p>Every stage derives a new immutable structure from the previous one, so one instance
 * may serve concurrent callers.</p>
 */
@Slf4j
public final class DispatchCore implements DispatchService {
    public static final String REASON_REQUEST_REQUIRED = "DISPATCH_REQUEST_REQUIRED";
    public static final String REASON_ORDERS_REQUIRED = "DISPATCH_ORDERS_REQUIRED";
    public static final String REASON_DRONES_REQUIRED = "DISPATCH_DRONES_REQUIRED";
    public static final String REASON_NO_AVAILABLE_DRONES = "DISPATCH_NO_AVAILABLE_DRONES";
    public static final String REASON_DUPLICATE_ORDER_ID = "DISPATCH_DUPLICATE_ORDER_ID";
    public static final String REASON_DUPLICATE_DRONE_ID = "DISPATCH_DUPLICATE_DRONE_ID";
    public static final String REASON_INVALID_ID = "DISPATCH_INVALID_ID";
    public static final String REASON_ROUTE_BUDGET_EXCEEDED = "DISPATCH_ROUTE_BUDGET_EXCEEDED";
    public static final String REASON_ASSIGNMENT_BUDGET_EXCEEDED = "DISPATCH_ASSIGNMENT_BUDGET_EXCEEDED";
    public static final String REASON_EVALUATION_FAILED = "DISPATCH_EVALUATION_FAILED";

    private final DispatchRuntimeConfig config;
    private final RouteGenerator routeGenerator;
    private final FeasibilityEvaluator feasibilityEvaluator;
    private final AssignmentEnumerator assignmentEnumerator;
    private final AssignmentSelector assignmentSelector;

    /**
     * Creates the dispatch facade.
     *
     * @param config optional runtime config; {@link DispatchRuntimeConfig#defaults()} when null.
     * @param assignmentSelector optional selector override.
     */
    @Builder
    public DispatchCore(DispatchRuntimeConfig config, AssignmentSelector assignmentSelector) {
        this.config = config == null ? DispatchRuntimeConfig.defaults() : config;
        EnumerationBudget budget = this.config.enumerationBudget();
        this.routeGenerator = new RouteGenerator(budget, this.config.getParallelism());
        this.feasibilityEvaluator = new FeasibilityEvaluator(this.config.getParallelism());
        this.assignmentEnumerator = new AssignmentEnumerator(budget);
        this.assignmentSelector = assignmentSelector == null ? new AssignmentSelector() : assignmentSelector;
    }

    /**
     * Returns the runtime config bound at construction.
     */
    public DispatchRuntimeConfig config() {
        return config;
    }

    /**
     * Plans one exact assignment.
     *
     * @param request orders and fleet in external-id space.
     * @return selected plan, one entry per available drone in fleet order.
     * @throws DispatchCoreException when request contracts or enumeration budgets fail.
     */
    @Override
    public DispatchPlan plan(DispatchRequest request) {
        if (request == null) {
            throw new DispatchCoreException(REASON_REQUEST_REQUIRED, "dispatch request must be provided");
        }
        List<Order> orders = requireOrders(request.getOrders());
        List<Drone> fleet = requireDrones(request.getDrones());

        IDMapper orderIds = mapIds(orderIdsOf(orders), REASON_DUPLICATE_ORDER_ID, "order");
        mapIds(droneIdsOf(fleet), REASON_DUPLICATE_DRONE_ID, "drone");

        List<Drone> available = new ArrayList<>(fleet.size());
        for (Drone drone : fleet) {
            if (drone.isAvailable()) {
                available.add(drone);
            }
        }
        if (available.isEmpty()) {
            throw new DispatchCoreException(
                    REASON_NO_AVAILABLE_DRONES,
                    "no available drones among " + fleet.size() + " fleet entries"
            );
        }

        try {
            RouteCatalog catalog = routeGenerator.generate(orders);
            log.debug("generated {} routes for {} orders", catalog.size(), orders.size());

            FeasibilityTable table = feasibilityEvaluator.evaluateFleet(catalog, available);
            AssignmentEnumerator.Enumeration enumeration =
                    assignmentEnumerator.enumerate(table, available, orders.size());
            Assignment selected = assignmentSelector.select(enumeration.assignments());

            DispatchExecutionStats stats = DispatchExecutionStats.of(
                    orders.size(),
                    available.size(),
                    catalog.size(),
                    table.feasibleRouteCounts(),
                    enumeration.searchStates(),
                    enumeration.assignments().size()
            );
            log.info("planned {} orders on {} drones: routes={}, validAssignments={}, covered={}, totalTime={}",
                    orders.size(), available.size(), catalog.size(), enumeration.assignments().size(),
                    selected.orderCount(), selected.totalTime());
            return toPlan(selected, available, orderIds, stats);
        } catch (EnumerationBudget.BudgetExceededException ex) {
            String reason = EnumerationBudget.REASON_ROUTES_EXCEEDED.equals(ex.reasonCode())
                    ? REASON_ROUTE_BUDGET_EXCEEDED
                    : REASON_ASSIGNMENT_BUDGET_EXCEEDED;
            throw new DispatchCoreException(reason, ex.reasonCode() + ": " + ex.getMessage(), ex);
        } catch (FanOut.FanOutException ex) {
            throw new DispatchCoreException(REASON_EVALUATION_FAILED, "parallel evaluation failed", ex);
        }
    }

    /**
     * Expands the selected assignment into per-drone external entries.
     */
    private static DispatchPlan toPlan(
            Assignment selected,
            List<Drone> available,
            IDMapper orderIds,
            DispatchExecutionStats stats
    ) {
        DispatchPlan.DispatchPlanBuilder builder = DispatchPlan.builder()
                .totalTime(selected.totalTime())
                .totalDistance(selected.totalDistance())
                .coveredOrderCount(selected.orderCount())
                .fullCoverage(selected.isFullCoverage())
                .executionStats(stats);

        for (int d = 0; d < available.size(); d++) {
            DroneAssignment.DroneAssignmentBuilder entry = DroneAssignment.builder()
                    .droneId(available.get(d).getId())
                    .totalDistance(selected.distanceOf(d))
                    .totalTime(selected.timeOf(d));
            RouteProfile leg = selected.legOf(d);
            if (leg != null) {
                for (int stop : leg.route().stops()) {
                    entry.orderId(orderIds.toExternal(stop));
                }
            }
            builder.droneAssignment(entry.build());
        }
        return builder.build();
    }

    private static List<Order> requireOrders(List<Order> orders) {
        if (orders == null) {
            throw new DispatchCoreException(REASON_ORDERS_REQUIRED, "orders must be provided");
        }
        for (int i = 0; i < orders.size(); i++) {
            if (orders.get(i) == null) {
                throw new DispatchCoreException(REASON_ORDERS_REQUIRED, "orders[" + i + "] must be non-null");
            }
        }
        return orders;
    }

    private static List<Drone> requireDrones(List<Drone> drones) {
        if (drones == null || drones.isEmpty()) {
            throw new DispatchCoreException(REASON_DRONES_REQUIRED, "drones must be non-empty");
        }
        for (int i = 0; i < drones.size(); i++) {
            if (drones.get(i) == null) {
                throw new DispatchCoreException(REASON_DRONES_REQUIRED, "drones[" + i + "] must be non-null");
            }
        }
        return drones;
    }

    private static List<String> orderIdsOf(List<Order> orders) {
        List<String> ids = new ArrayList<>(orders.size());
        for (Order order : orders) {
            ids.add(order.getId());
        }
        return ids;
    }

    private static List<String> droneIdsOf(List<Drone> drones) {
        List<String> ids = new ArrayList<>(drones.size());
        for (Drone drone : drones) {
            ids.add(drone.getId());
        }
        return ids;
    }

    /**
     * Builds a dense id mapping, translating mapper failures into reason codes.
     */
    private static IDMapper mapIds(List<String> externalIds, String duplicateReasonCode, String kind) {
        try {
            return IDMapper.ofOrdered(externalIds);
        } catch (IDMapper.DuplicateIDException ex) {
            throw new DispatchCoreException(duplicateReasonCode, "duplicate " + kind + " id: " + ex.getMessage(), ex);
        } catch (IllegalArgumentException ex) {
            throw new DispatchCoreException(REASON_INVALID_ID, kind + " id invalid: " + ex.getMessage(), ex);
        }
    }
}
