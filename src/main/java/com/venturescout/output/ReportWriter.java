package com.venturescout.output;

import com.venturescout.model.BatchResult;
import com.venturescout.model.BatchSummary;
import com.venturescout.model.ConflictReport;
import com.venturescout.model.FitScore;
import com.venturescout.model.FounderQualityScore;
import com.venturescout.model.QualityScore;
import com.venturescout.model.Recommendation;
import com.venturescout.model.ScoreBreakdown;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * 模块说明：ReportWriter（class）。
 * 主要职责：把排好序的评分结果写成 JSON 文档和纯文本摘要。
 * 使用建议：JSON 内容只依赖评分结果本身，不写入耗时等运行指标，便于对比两次运行。
 */
public final class ReportWriter {
    private static final DateTimeFormatter FILE_TS = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final int topN;

    public ReportWriter() {
        this(20);
    }

    public ReportWriter(int topN) {
        this.topN = Math.max(1, topN);
    }

    public Path writeJson(BatchResult result, Path outputDir, Instant generatedAt) throws IOException {
        Files.createDirectories(outputDir);
        Path file = outputDir.resolve("ranking_" + slug(result.summary().organization) + "_" + FILE_TS.format(generatedAt) + ".json");
        Files.writeString(file, toJson(result).toString(2), StandardCharsets.UTF_8);
        return file;
    }

    public Path writeDigest(BatchResult result, Path outputDir, Instant generatedAt) throws IOException {
        Files.createDirectories(outputDir);
        Path file = outputDir.resolve("ranking_" + slug(result.summary().organization) + "_" + FILE_TS.format(generatedAt) + ".txt");
        Files.writeString(file, digest(result), StandardCharsets.UTF_8);
        return file;
    }

    public JSONObject toJson(BatchResult result) {
        JSONObject root = new JSONObject();
        root.put("summary", summaryJson(result.summary()));
        JSONArray ranked = new JSONArray();
        int rank = 1;
        for (ScoreBreakdown row : result.ranked()) {
            JSONObject item = breakdownJson(row);
            item.put("rank", rank++);
            ranked.put(item);
        }
        root.put("ranked", ranked);
        return root;
    }

    public String digest(BatchResult result) {
        BatchSummary s = result.summary();
        StringBuilder sb = new StringBuilder();
        sb.append("Organization: ").append(s.organization).append('\n');
        sb.append(String.format(Locale.US,
                "Candidates: %d scored=%d failed=%d%s%n",
                s.candidates, s.scored, s.failed, s.cancelled ? " (cancelled)" : ""));
        sb.append(String.format(Locale.US,
                "Averages: overall=%.2f quality=%.2f fit=%.2f portfolio_fit=%.2f%n",
                s.averageOverall, s.averageQuality, s.averageFit, s.averagePortfolioFit));
        for (Recommendation r : Recommendation.values()) {
            sb.append("  ").append(r.label()).append(": ").append(s.recommendationCounts.getOrDefault(r, 0)).append('\n');
        }
        sb.append('\n');
        List<ScoreBreakdown> rows = result.ranked();
        int limit = Math.min(topN, rows.size());
        for (int i = 0; i < limit; i++) {
            ScoreBreakdown row = rows.get(i);
            sb.append(String.format(Locale.US,
                    "%2d. %-30s overall=%6.2f quality=%6.2f fit=%6.2f portfolio=%6.2f  %s%n",
                    i + 1,
                    row.candidateName,
                    row.overallScore,
                    row.qualityScore,
                    row.fitScore,
                    row.portfolioFitScore,
                    row.recommendation.label()));
            for (String pro : row.pros) {
                sb.append("      + ").append(pro).append('\n');
            }
            for (String con : row.cons) {
                sb.append("      - ").append(con).append('\n');
            }
            for (String note : row.notes) {
                sb.append("      ! ").append(note).append('\n');
            }
        }
        if (rows.size() > limit) {
            sb.append("... ").append(rows.size() - limit).append(" more\n");
        }
        return sb.toString();
    }

    private JSONObject summaryJson(BatchSummary s) {
        JSONObject o = new JSONObject();
        o.put("organization", s.organization);
        o.put("candidates", s.candidates);
        o.put("scored", s.scored);
        o.put("failed", s.failed);
        o.put("cancelled", s.cancelled);
        o.put("average_overall", s.averageOverall);
        o.put("average_quality", s.averageQuality);
        o.put("average_fit", s.averageFit);
        o.put("average_portfolio_fit", s.averagePortfolioFit);
        JSONObject counts = new JSONObject();
        for (Recommendation r : Recommendation.values()) {
            counts.put(r.label(), s.recommendationCounts.getOrDefault(r, 0));
        }
        o.put("recommendations", counts);
        return o;
    }

    private JSONObject breakdownJson(ScoreBreakdown row) {
        JSONObject o = new JSONObject();
        o.put("candidate", row.candidateName);
        if (!row.website.isEmpty()) {
            o.put("website", row.website);
        }
        o.put("overall_score", row.overallScore);
        o.put("quality_score", row.qualityScore);
        o.put("fit_score", row.fitScore);
        o.put("portfolio_fit_score", row.portfolioFitScore);
        o.put("recommendation", row.recommendation.label());
        o.put("pros", new JSONArray(row.pros));
        o.put("cons", new JSONArray(row.cons));
        o.put("notes", new JSONArray(row.notes));
        o.put("cause_code", row.causeCode.name());
        o.put("quality", qualityJson(row.quality));
        o.put("fit", fitJson(row.fit));
        if (row.conflict != null) {
            o.put("conflict", conflictJson(row.conflict));
        }
        return o;
    }

    private JSONObject qualityJson(QualityScore q) {
        JSONObject o = new JSONObject();
        o.put("overall", q.overall);
        o.put("founder_average", q.founderAverage);
        o.put("company_score", q.companyScore);
        o.put("team_completeness", q.teamCompleteness);
        JSONArray founders = new JSONArray();
        for (FounderQualityScore f : q.founders) {
            JSONObject fo = new JSONObject();
            fo.put("name", f.name());
            fo.put("experience", f.experience());
            fo.put("education", f.education());
            fo.put("honors", f.honors());
            fo.put("network", f.network());
            fo.put("title_relevance", f.titleRelevance());
            fo.put("total", f.total());
            founders.put(fo);
        }
        o.put("founders", founders);
        return o;
    }

    private JSONObject fitJson(FitScore f) {
        JSONObject o = new JSONObject();
        o.put("fit_score", f.fitScore);
        o.put("text_similarity", f.textSimilarity);
        o.put("industry_match", f.industryMatch);
        o.put("stage_match", f.stageMatch);
        o.put("location_match", f.locationMatch);
        o.put("network_proximity", f.networkProximity);
        o.put("stage", f.resolvedStage == null ? "" : f.resolvedStage);
        o.put("similarity_degraded", f.similarityDegraded);
        return o;
    }

    private JSONObject conflictJson(ConflictReport c) {
        JSONObject o = new JSONObject();
        o.put("conflict_score", c.conflictScore);
        o.put("portfolio_fit_score", c.portfolioFitScore);
        o.put("conflicting", new JSONArray(c.conflictingNames));
        o.put("industry_overlaps", new JSONArray(c.industryOverlaps));
        o.put("severity", c.severity);
        return o;
    }

    static String slug(String name) {
        String s = name == null ? "" : name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
        s = s.replaceAll("^_+|_+$", "");
        return s.isEmpty() ? "organization" : s;
    }
}
