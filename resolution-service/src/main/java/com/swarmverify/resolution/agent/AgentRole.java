package com.swarmverify.resolution.agent;

public enum AgentRole {
    RESEARCH,
    SKEPTIC,
    FACT_CHECKER,
    INVESTIGATOR
}
