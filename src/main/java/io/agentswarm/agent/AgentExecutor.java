package io.agentswarm.agent;

public interface AgentExecutor {
    String name();

    TurnResult execute(TurnContext context) throws Exception;
}
