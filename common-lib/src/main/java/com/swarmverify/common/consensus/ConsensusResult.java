package com.swarmverify.common.consensus;

import com.swarmverify.common.model.Outcome;

import java.util.List;
import java.util.Map;

/**
 * Immutable output of a {@link ConsensusEngine} run.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code outcome}: label of the largest vote group</li>
 *   <li>{@code confidence}: geometric median of the majority group's confidences, [0, 100]</li>
 *   <li>{@code rationale}: majority-group rationales, each prefixed with its agent name</li>
 *   <li>{@code sources}: de-duplicated union of every counted agent's sources</li>
 *   <li>{@code agentVotes}: vote count per outcome, all three outcomes present</li>
 * </ul>
 */
public record ConsensusResult(
    Outcome outcome,
    int confidence,
    String rationale,
    List<String> sources,
    Map<Outcome, Integer> agentVotes
) {
    public int votesFor(Outcome candidate) {
        return agentVotes.getOrDefault(candidate, 0);
    }
}
