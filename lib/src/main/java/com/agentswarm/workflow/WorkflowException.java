package com.agentswarm.workflow;

/**
 * Thrown when a workflow step could not be handed to any actor.
 */
public class WorkflowException extends RuntimeException {

    private final String workflow;
    private final String step;

    public WorkflowException(String workflow, String step, Throwable cause) {
        super("Workflow " + workflow + " could not distribute step " + step + ": " + cause.getMessage(), cause);
        this.workflow = workflow;
        this.step = step;
    }

    public String getWorkflow() {
        return workflow;
    }

    public String getStep() {
        return step;
    }
}
