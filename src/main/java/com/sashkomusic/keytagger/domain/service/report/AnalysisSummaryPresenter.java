package com.sashkomusic.keytagger.domain.service.report;

import com.sashkomusic.keytagger.domain.model.RunStatistics;
import com.sashkomusic.keytagger.domain.model.TrackResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.IntSummaryStatistics;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

@Component
public class AnalysisSummaryPresenter {

    static final int ORIGINAL_NAME_WIDTH = 30;
    static final int NEW_NAME_WIDTH = 40;

    private static final String HEAVY_RULE = "=".repeat(100);
    private static final String LIGHT_RULE = "-".repeat(120);

    public String render(List<TrackResult> results, RunStatistics statistics) {
        if (results == null || results.isEmpty()) {
            return "No results to display";
        }

        StringBuilder out = new StringBuilder();
        out.append(HEAVY_RULE).append('\n');
        out.append("ANALYSIS SUMMARY").append('\n');
        out.append(HEAVY_RULE).append('\n');

        appendBpmStatistics(out, results);
        appendKeyHistogram(out, results);

        out.append('\n').append("Rename Summary:").append('\n');
        out.append("  Total files: ").append(results.size()).append('\n');
        out.append("  Renamed: ").append(statistics.getRenamedCount()).append('\n');
        out.append("  Errors: ").append(statistics.getRenameErrors()).append('\n');
        out.append(HEAVY_RULE).append('\n');

        appendDetails(out, results);
        return out.toString();
    }

    private void appendBpmStatistics(StringBuilder out, List<TrackResult> results) {
        List<Integer> bpms = results.stream()
                .map(TrackResult::bpm)
                .filter(Objects::nonNull)
                .toList();
        if (bpms.isEmpty()) {
            return;
        }

        IntSummaryStatistics stats = bpms.stream().mapToInt(Integer::intValue).summaryStatistics();
        double mean = stats.getAverage();
        double variance = bpms.stream()
                .mapToDouble(bpm -> (bpm - mean) * (bpm - mean))
                .sum() / bpms.size();

        out.append('\n').append("BPM").append('\n');
        out.append(String.format(Locale.ROOT, "  Average: %.2f\n", mean));
        out.append("  Min: ").append(stats.getMin()).append('\n');
        out.append("  Max: ").append(stats.getMax()).append('\n');
        out.append(String.format(Locale.ROOT, "  Std Dev: %.2f\n", Math.sqrt(variance)));
    }

    private void appendKeyHistogram(StringBuilder out, List<TrackResult> results) {
        Map<String, Integer> keyCounts = new LinkedHashMap<>();
        for (TrackResult result : results) {
            if (result.keyLabel() != null) {
                keyCounts.merge(result.keyLabel(), 1, Integer::sum);
            }
        }
        if (keyCounts.isEmpty()) {
            return;
        }

        // stable sort keeps first-seen order between equal counts
        List<Map.Entry<String, Integer>> sorted = new ArrayList<>(keyCounts.entrySet());
        sorted.sort(Map.Entry.<String, Integer>comparingByValue().reversed());

        out.append('\n').append("Keys Found:").append('\n');
        for (Map.Entry<String, Integer> entry : sorted) {
            out.append("  ").append(entry.getKey()).append(": ").append(entry.getValue()).append("x\n");
        }
    }

    private void appendDetails(StringBuilder out, List<TrackResult> results) {
        out.append('\n').append("DETAILS:").append('\n');
        out.append(LIGHT_RULE).append('\n');
        out.append(String.format("%-30s %-40s %-7s %-12s\n", "Original File", "New File", "BPM", "Key"));
        out.append(LIGHT_RULE).append('\n');

        for (TrackResult result : results) {
            out.append(String.format("%-30s %-40s %-7s %-12s\n",
                    truncate(result.originalFilename(), ORIGINAL_NAME_WIDTH),
                    truncate(result.finalFilename(), NEW_NAME_WIDTH),
                    result.bpm() != null ? result.bpm().toString() : "N/A",
                    result.keyLabel() != null ? result.keyLabel() : "N/A"));
        }
        out.append(LIGHT_RULE).append('\n');
    }

    static String truncate(String value, int width) {
        if (value.length() <= width) {
            return value;
        }
        return value.substring(0, width - 3) + "...";
    }
}
