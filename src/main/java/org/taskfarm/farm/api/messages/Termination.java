package org.taskfarm.farm.api.messages;

/**
 * The termination sentinel. A worker that receives it leaves its loop without replying
 * and joins the final rendezvous.
 */
public enum Termination implements WorkerMessage {
    INSTANCE
}
