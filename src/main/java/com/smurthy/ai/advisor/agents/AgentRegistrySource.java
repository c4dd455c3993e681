package com.smurthy.ai.advisor.agents;

import java.util.List;

/**
 * External collection of agent definitions layered over the static defaults.
 */
public interface AgentRegistrySource {

    List<AgentOverride> loadOverrides();

    String describe();
}
