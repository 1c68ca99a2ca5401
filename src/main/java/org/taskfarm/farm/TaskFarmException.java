package org.taskfarm.farm;

/**
 * A run of the farm failed. Thrown after the supervised shutdown has happened: the
 * transport was aborted, local workers were stopped and the sink was closed.
 */
public class TaskFarmException extends Exception {

    public TaskFarmException(String message) {
        super(message);
    }

    public TaskFarmException(String message, Throwable cause) {
        super(message, cause);
    }
}
