package org.Aayush.dispatch.core;

/**
 * Public fleet dispatch contract.
 *
 * <p>Implementations validate input deterministically and throw reason-coded runtime
 * exceptions for contract failures.</p>
 */
public interface DispatchService {
    /**
     * Plans one exact order-to-drone assignment.
     *
     * @param request orders and fleet in external-id space.
     * @return selected plan with one entry per available drone.
     */
    DispatchPlan plan(DispatchRequest request);
}
