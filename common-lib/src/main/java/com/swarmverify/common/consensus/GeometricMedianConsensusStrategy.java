package com.swarmverify.common.consensus;

import com.swarmverify.common.model.AgentResult;
import com.swarmverify.common.model.Outcome;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Default {@link ConsensusEngine}: majority vote on outcome, geometric median on confidence.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Drop skipped results.</li>
 *   <li>Group the rest by outcome.</li>
 *   <li>The largest group wins. On equal counts the later {@link Outcome} constant wins
 *       ({@code AMBIGUOUS} over {@code NO} over {@code YES}), so a 1-1-1 split resolves to AMBIGUOUS
 *       and a YES/NO tie resolves to NO.</li>
 *   <li>Confidence is the {@link GeometricMedian} of the winning group only, rounded and clamped.</li>
 * </ol>
 *
 * <p>This class is stateless and thread-safe.
 */
public class GeometricMedianConsensusStrategy implements ConsensusEngine {

    static final int RATIONALE_EXCERPT = 200;

    @Override
    public ConsensusResult compute(List<AgentResult> results) {
        Map<Outcome, List<AgentResult>> groups = new EnumMap<>(Outcome.class);
        for (Outcome outcome : Outcome.values()) {
            groups.put(outcome, new ArrayList<>());
        }
        List<AgentResult> counted = results.stream()
            .filter(r -> !r.skipped())
            .collect(Collectors.toList());
        counted.forEach(r -> groups.get(r.outcome()).add(r));

        Outcome majority = Outcome.YES;
        for (Outcome candidate : Outcome.values()) {
            if (groups.get(candidate).size() >= groups.get(majority).size()) {
                majority = candidate;
            }
        }

        List<AgentResult> majorityGroup = groups.get(majority);
        List<Integer> confidences = majorityGroup.stream()
            .map(AgentResult::confidence)
            .collect(Collectors.toList());
        int confidence = (int) Math.max(0, Math.min(100, Math.round(GeometricMedian.compute(confidences))));

        String rationale = majorityGroup.stream()
            .map(r -> "[" + r.agent() + "] " + excerpt(r.rationale()))
            .collect(Collectors.joining("\n\n"));

        Set<String> sources = new LinkedHashSet<>();
        counted.forEach(r -> sources.addAll(r.sources()));

        Map<Outcome, Integer> votes = new EnumMap<>(Outcome.class);
        groups.forEach((outcome, members) -> votes.put(outcome, members.size()));

        return new ConsensusResult(majority, confidence, rationale,
                                   List.copyOf(sources), Collections.unmodifiableMap(votes));
    }

    private static String excerpt(String text) {
        return text.length() > RATIONALE_EXCERPT ? text.substring(0, RATIONALE_EXCERPT) : text;
    }
}
