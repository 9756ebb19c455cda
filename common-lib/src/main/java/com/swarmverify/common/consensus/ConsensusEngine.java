package com.swarmverify.common.consensus;

import com.swarmverify.common.model.AgentResult;

import java.util.List;

/**
 * Strategy contract for folding agent votes into a single {@link ConsensusResult}.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Stateless</b>: no mutable state; safe to call concurrently</li>
 *   <li><b>Pure</b>: no I/O, no reactive types, no side effects</li>
 *   <li><b>Total</b>: always return a valid result, even for an empty or all-skipped list</li>
 * </ul>
 *
 * <p>Skipped results ({@link AgentResult#skipped()}) must be excluded entirely,
 * not counted as zero-weight votes. Degraded results are ordinary votes.
 */
public interface ConsensusEngine {

    ConsensusResult compute(List<AgentResult> results);
}
