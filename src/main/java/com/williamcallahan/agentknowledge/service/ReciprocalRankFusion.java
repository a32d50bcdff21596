package com.williamcallahan.agentknowledge.service;

import com.williamcallahan.agentknowledge.store.CandidateRow;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Merges ranked candidate lists into a single ranking.
 *
 * <p>A row at zero-based position {@code idx} adds {@code nativeScore + 1 / (k + idx + 1)} to
 * its entry. Entries present in several lists accumulate one contribution per list. Equal fused
 * scores keep the order in which entries were first seen.</p>
 */
public final class ReciprocalRankFusion {

    private ReciprocalRankFusion() {}

    /**
     * Fused score for one entry.
     *
     * @param row representative row for shaping (the last one seen for the entry)
     * @param score accumulated score
     */
    public record FusedCandidate(CandidateRow row, double score) {
        public FusedCandidate {
            Objects.requireNonNull(row, "row");
        }
    }

    /**
     * Fuses ranked lists.
     *
     * @param rankedLists lists in descending native order
     * @param k rank damping constant, 0 or greater
     * @return fused candidates, highest score first
     */
    public static List<FusedCandidate> fuse(List<List<CandidateRow>> rankedLists, int k) {
        Objects.requireNonNull(rankedLists, "rankedLists");
        if (k < 0) {
            throw new IllegalArgumentException("k must be 0 or greater");
        }
        Map<UUID, CandidateRow> rowsByEntry = new LinkedHashMap<>();
        Map<UUID, Double> scoresByEntry = new LinkedHashMap<>();
        for (List<CandidateRow> rankedList : rankedLists) {
            for (int idx = 0; idx < rankedList.size(); idx++) {
                CandidateRow row = rankedList.get(idx);
                double contribution = row.nativeScore() + 1.0 / (k + idx + 1);
                scoresByEntry.merge(row.entryId(), contribution, Double::sum);
                rowsByEntry.put(row.entryId(), row);
            }
        }

        List<FusedCandidate> fused = new ArrayList<>(scoresByEntry.size());
        for (Map.Entry<UUID, Double> scored : scoresByEntry.entrySet()) {
            fused.add(new FusedCandidate(rowsByEntry.get(scored.getKey()), scored.getValue()));
        }
        // List.sort is stable
        fused.sort(Comparator.comparingDouble(FusedCandidate::score).reversed());
        return fused;
    }
}
