package com.fedsearch.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Min-max normalizes each source to [0, 1], multiplies by the source weight and sorts by
 * normalized score, then source priority, then within-path rank. A source whose scores are all
 * equal (a single result included) normalizes to 1.0.
 */
public class MinMaxScoreFusion implements ScoreFusion {

    private final Map<SourceType, Double> weights;
    private final List<SourceType> priority;

    public MinMaxScoreFusion(Map<SourceType, Double> weights, List<SourceType> priority) {
        this.weights = new EnumMap<>(SourceType.class);
        this.weights.putAll(weights);
        List<SourceType> order = new ArrayList<>(priority);
        for (SourceType source : SourceType.values()) {
            if (!order.contains(source)) {
                order.add(source);
            }
        }
        this.priority = List.copyOf(order);
    }

    public MinMaxScoreFusion() {
        this(Map.of(), List.of(SourceType.SQL, SourceType.DOC));
    }

    @Override
    public List<SearchResult> fuse(Map<SourceType, List<SearchResult>> resultsBySource) {
        List<SearchResult> fused = new ArrayList<>();
        for (Map.Entry<SourceType, List<SearchResult>> entry : resultsBySource.entrySet()) {
            List<SearchResult> results = entry.getValue();
            if (results == null || results.isEmpty()) {
                continue;
            }
            double min = results.stream().mapToDouble(SearchResult::getRawScore).min().orElse(0.0);
            double max = results.stream().mapToDouble(SearchResult::getRawScore).max().orElse(0.0);
            double weight = weights.getOrDefault(entry.getKey(), 1.0);
            for (SearchResult result : results) {
                double normalized = max == min ? 1.0 : (result.getRawScore() - min) / (max - min);
                fused.add(result.toBuilder().normalizedScore(normalized * weight).build());
            }
        }
        fused.sort(Comparator.comparingDouble(SearchResult::getNormalizedScore).reversed()
                .thenComparingInt(r -> priority.indexOf(r.getSource()))
                .thenComparingInt(SearchResult::getRank)
                .thenComparing(SearchResult::getOriginId, Comparator.nullsLast(Comparator.naturalOrder())));
        return fused;
    }
}
