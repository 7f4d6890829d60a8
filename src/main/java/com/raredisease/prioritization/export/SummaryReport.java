package com.raredisease.prioritization.export;

import com.raredisease.prioritization.core.model.Criterion;
import com.raredisease.prioritization.run.CollectionFailure;
import com.raredisease.prioritization.run.CollectionReport;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Plain-text overview of a prioritization batch. It shows data coverage per criterion
 * and the top of the ranking. Every disease criterion left without a score is listed
 * with its reason, whether the key failed to collect or was collected without usable
 * data. Collection failures for keys outside the ranking are listed last.
 */
public class SummaryReport {

    public static final int DEFAULT_TOP_N = 10;

    private final List<Criterion> criteria;
    private final int topN;

    public SummaryReport(List<Criterion> criteria) {
        this(criteria, DEFAULT_TOP_N);
    }

    public SummaryReport(List<Criterion> criteria, int topN) {
        if (topN < 1) {
            throw new IllegalArgumentException("topN must be >= 1");
        }
        this.criteria = List.copyOf(criteria);
        this.topN = topN;
    }

    public String render(List<EntityJustification> ranked, CollectionReport collection) {
        StringBuilder out = new StringBuilder();
        out.append("RARE DISEASE PRIORITIZATION SUMMARY\n");
        out.append("===================================\n");
        out.append("Diseases ranked: ").append(ranked.size()).append('\n');
        if (collection != null) {
            out.append(String.format(Locale.ROOT, "Collection: %d keys, %d with evidence, %d without (%d ms)%n",
                    collection.totalKeys(), collection.succeeded(), collection.failures().size(),
                    collection.duration().toMillis()));
        }

        out.append("\nCoverage by criterion\n");
        for (Criterion criterion : criteria) {
            long covered = ranked.stream()
                    .filter(e -> e.criterion(criterion.key()).map(CriterionJustification::hasScore).orElse(false))
                    .count();
            double percent = ranked.isEmpty() ? 0.0 : 100.0 * covered / ranked.size();
            out.append(String.format(Locale.ROOT, "  %-16s %5d / %-5d (%.1f%%)%n",
                    criterion.key(), covered, ranked.size(), percent));
        }

        out.append("\nTop ").append(Math.min(topN, ranked.size())).append('\n');
        ranked.stream().limit(topN).forEach(e -> out.append(String.format(Locale.ROOT,
                "  %3d. %-12s %-40s %.4f%n", e.rank(), e.entityId(), e.name(), e.finalScore())));

        List<String> unscored = new ArrayList<>();
        for (EntityJustification entity : ranked) {
            for (CriterionJustification criterion : entity.criteria()) {
                if (!criterion.hasScore()) {
                    unscored.add(String.format(Locale.ROOT, "  %-12s %-16s %-16s %s%n",
                            entity.entityId(), criterion.criterion(), criterion.selectionMethod(),
                            reason(entity.entityId(), criterion, collection)));
                }
            }
        }
        if (!unscored.isEmpty()) {
            out.append("\nDiseases not fully scored\n");
            unscored.forEach(out::append);
        }

        if (collection != null && collection.hasFailures()) {
            out.append("\nKeys without evidence\n");
            for (CollectionFailure failure : collection.failures()) {
                out.append(String.format(Locale.ROOT, "  %-12s %-16s %-16s %s%n",
                        failure.entityId(), failure.criterion().key(), failure.state(), failure.reason()));
            }
        }
        return out.toString();
    }

    private static String reason(String entityId, CriterionJustification criterion, CollectionReport collection) {
        if (collection != null) {
            for (CollectionFailure failure : collection.failures()) {
                if (failure.entityId().equals(entityId) && failure.criterion().key().equals(criterion.criterion())) {
                    return failure.state() + ": " + failure.reason();
                }
            }
        }
        if ("NONE".equals(criterion.selectionMethod())) {
            return "not curated";
        }
        return "collected but no usable evidence";
    }

    public void write(List<EntityJustification> ranked, CollectionReport collection, Writer writer) {
        try {
            writer.write(render(ranked, collection));
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Summary report export failed", e);
        }
    }
}
