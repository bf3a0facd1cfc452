package com.proofsmith.core.agent;

/**
 * One stage of the plan / generate / verify loop.
 *
 * Each implementation wraps exactly one generative-service call and never throws:
 * transport failures come back as {@link StageResult.Kind#FAILED}, unparseable
 * responses as {@link StageResult.Kind#FALLBACK}.
 */
public interface StageAgent<I, O> {

    String getAgentId();

    AgentType getAgentType();

    StageResult<O> process(I input);
}
