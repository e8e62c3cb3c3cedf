package com.signalsentinel.core.fusion;

import com.signalsentinel.core.model.FusionResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders one batch of fused results and attaches rank and percentile.
 *
 * <p>
 * Scored results are sorted by fusion score (descending), observed count
 * (descending), drug and then event (ascending), and receive ranks
 * {@code 1..n} with {@code percentile = 100 · (1 - rank / n)}. Error-marked
 * results keep their input order and follow the ranked ones, unranked.
 * </p>
 *
 * <p>
 * Each scored result also gets a classical rank: its position when the same
 * results are ordered by observed count alone (descending), ties broken by
 * the fused order.
 * </p>
 *
 * @since 1.0.0
 */
final class BatchRanker {

    static final Comparator<FusionResult> ORDER = Comparator
            .comparingDouble((FusionResult r) -> r.getFusionScore().getAsDouble()).reversed()
            .thenComparing(Comparator.comparingLong(FusionResult::getObserved).reversed())
            .thenComparing(FusionResult::getDrug)
            .thenComparing(FusionResult::getEvent);

    static final Comparator<FusionResult> CLASSICAL_ORDER = Comparator
            .comparingLong(FusionResult::getObserved).reversed()
            .thenComparing(ORDER);

    private BatchRanker() {
    }

    static List<FusionResult> rank(List<FusionResult> results) {
        List<FusionResult> scored = new ArrayList<>();
        List<FusionResult> failed = new ArrayList<>();
        for (FusionResult result : results) {
            if (result.isScored()) {
                scored.add(result);
            } else {
                failed.add(result);
            }
        }
        scored.sort(ORDER);

        List<FusionResult> byCount = new ArrayList<>(scored);
        byCount.sort(CLASSICAL_ORDER);
        Map<FusionResult, Integer> classicalRanks = new IdentityHashMap<>();
        for (int i = 0; i < byCount.size(); i++) {
            classicalRanks.put(byCount.get(i), i + 1);
        }

        int n = scored.size();
        List<FusionResult> ranked = new ArrayList<>(results.size());
        for (int i = 0; i < n; i++) {
            int rank = i + 1;
            FusionResult result = scored.get(i);
            ranked.add(result.withRanking(rank, 100.0 * (1.0 - (double) rank / n), classicalRanks.get(result)));
        }
        ranked.addAll(failed);
        return ranked;
    }
}
