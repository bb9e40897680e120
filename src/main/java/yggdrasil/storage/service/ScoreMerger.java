package yggdrasil.storage.service;

import org.springframework.stereotype.Component;
import yggdrasil.storage.dto.RankedMatch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * 混合打分
 * 两路分数分别按最大值归一化，score = alpha * text + (1 - alpha) * vector，
 * 同一记录只保留一条，按 (score 降序, id 升序) 排序
 */
@Component
public class ScoreMerger {

    public static final Comparator<RankedMatch> ORDER = Comparator
        .comparingDouble(RankedMatch::getScore).reversed()
        .thenComparing(RankedMatch::getRecordId);

    public List<RankedMatch> merge(Map<Long, Double> textScores, Map<Long, Double> vectorScores, double alpha) {
        Map<Long, Double> text = normalize(textScores);
        Map<Long, Double> vector = normalize(vectorScores);

        TreeSet<Long> ids = new TreeSet<>(text.keySet());
        ids.addAll(vector.keySet());

        List<RankedMatch> merged = new ArrayList<>(ids.size());
        for (Long id : ids) {
            double textScore = text.getOrDefault(id, 0.0);
            double vectorScore = vector.getOrDefault(id, 0.0);
            double score = alpha * textScore + (1.0 - alpha) * vectorScore;
            merged.add(new RankedMatch(id, score, textScore, vectorScore));
        }
        merged.sort(ORDER);
        return merged;
    }

    private Map<Long, Double> normalize(Map<Long, Double> scores) {
        Map<Long, Double> normalized = new HashMap<>();
        if (scores == null || scores.isEmpty()) {
            return normalized;
        }
        double max = 0.0;
        for (double value : scores.values()) {
            max = Math.max(max, value);
        }
        for (Map.Entry<Long, Double> entry : scores.entrySet()) {
            normalized.put(entry.getKey(), max > 0.0 ? Math.max(0.0, entry.getValue()) / max : 0.0);
        }
        return normalized;
    }
}
