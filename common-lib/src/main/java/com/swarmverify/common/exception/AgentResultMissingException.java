package com.swarmverify.common.exception;

/** An agent's publisher completed without emitting a verdict or an error. */
public class AgentResultMissingException extends RuntimeException {

    private final String agentName;

    public AgentResultMissingException(String agentName) {
        super("Agent " + agentName + " completed without a result");
        this.agentName = agentName;
    }

    public String getAgentName() {
        return agentName;
    }
}
