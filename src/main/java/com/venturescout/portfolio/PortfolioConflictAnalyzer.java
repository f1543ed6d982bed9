package com.venturescout.portfolio;

import com.venturescout.config.Config;
import com.venturescout.model.CompanyProfile;
import com.venturescout.model.ConflictReport;
import com.venturescout.model.PortfolioHolding;
import com.venturescout.vector.EmbeddingException;
import com.venturescout.vector.TextSimilarity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * 模块说明：PortfolioConflictAnalyzer（class）。
 * 主要职责：用与契合度相同的文本相似度，比较候选公司与现有持仓，给出冲突分与组合契合分。
 * 使用建议：阈值来自 conflict.threshold；单个持仓编码失败按相似度 0 处理，不影响其它持仓。
 */
public final class PortfolioConflictAnalyzer {
    private static final Logger log = LogManager.getLogger(PortfolioConflictAnalyzer.class);

    public static final double DEFAULT_THRESHOLD = 60.0;

    private final TextSimilarity similarity;
    private final double threshold;

    public PortfolioConflictAnalyzer(TextSimilarity similarity) {
        this(similarity, DEFAULT_THRESHOLD);
    }

    public PortfolioConflictAnalyzer(TextSimilarity similarity, double threshold) {
        if (similarity == null) {
            throw new IllegalArgumentException("text similarity is required");
        }
        if (!Double.isFinite(threshold) || threshold < 0.0 || threshold > 100.0) {
            throw new IllegalArgumentException("conflict threshold must be within [0,100]: " + threshold);
        }
        this.similarity = similarity;
        this.threshold = threshold;
    }

    public static PortfolioConflictAnalyzer fromConfig(TextSimilarity similarity, Config config) {
        double threshold = config == null ? DEFAULT_THRESHOLD : config.getDouble("conflict.threshold", DEFAULT_THRESHOLD);
        return new PortfolioConflictAnalyzer(similarity, threshold);
    }

    public ConflictReport analyze(CompanyProfile candidate, List<PortfolioHolding> holdings) {
        if (candidate == null || holdings == null || holdings.isEmpty()) {
            return ConflictReport.none();
        }
        String candidateText = (candidate.description + " " + candidate.industry).trim();
        if (candidateText.isEmpty()) {
            candidateText = candidate.name;
        }

        double maxScore = 0.0;
        List<String> conflicting = new ArrayList<>();
        List<String> industryOverlaps = new ArrayList<>();
        for (PortfolioHolding holding : holdings) {
            if (holding == null) {
                continue;
            }
            double score = holdingSimilarity(candidate, candidateText, holding);
            maxScore = Math.max(maxScore, score);
            if (score > threshold) {
                conflicting.add(holding.name());
            }
            if (!candidate.industry.isEmpty() && candidate.industry.equalsIgnoreCase(holding.industry())) {
                industryOverlaps.add(holding.name());
            }
        }

        double conflictScore = round2(maxScore);
        double portfolioFit = conflictScore > threshold ? round2(100.0 - conflictScore) : 100.0;
        return new ConflictReport(conflictScore, portfolioFit, conflicting, industryOverlaps, severity(conflicting.size()));
    }

    public double threshold() {
        return threshold;
    }

    static String severity(int conflicts) {
        if (conflicts > 2) {
            return ConflictReport.SEVERITY_HIGH;
        }
        if (conflicts > 0) {
            return ConflictReport.SEVERITY_MEDIUM;
        }
        return ConflictReport.SEVERITY_NONE;
    }

    private double holdingSimilarity(CompanyProfile candidate, String candidateText, PortfolioHolding holding) {
        try {
            return similarity.score(candidateText, holding.comparisonText());
        } catch (EmbeddingException e) {
            log.warn("holding similarity unavailable candidate={} holding={} err={}",
                    candidate.name, holding.name(), e.getMessage());
            return 0.0;
        }
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
