package org.taskfarm.farm.api.services;

import java.util.List;
import java.util.Map;

/**
 * A component that exposes metrics and a health verdict.
 */
public interface IMonitorable {

    /**
     * @return metric names mapped to their current values.
     */
    Map<String, Number> getMetrics();

    /**
     * @return a copy of the recorded operational errors, oldest first.
     */
    List<OperationalError> getErrors();

    /**
     * Clears all recorded operational errors.
     */
    void clearErrors();

    /**
     * @return {@code true} if the component is running without recorded errors.
     */
    boolean isHealthy();
}
