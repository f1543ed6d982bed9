package com.venturescout.app;

import com.venturescout.app.properties.BatchProperties;
import com.venturescout.app.properties.RateLimitProperties;
import com.venturescout.config.Config;
import com.venturescout.core.TimeSource;
import com.venturescout.model.OverallWeights;
import com.venturescout.output.ReportWriter;
import com.venturescout.portfolio.PortfolioConflictAnalyzer;
import com.venturescout.ratelimit.SlidingWindowRateLimiter;
import com.venturescout.runner.BatchScoringCoordinator;
import com.venturescout.runner.CandidateScorer;
import com.venturescout.runner.ScoringPipeline;
import com.venturescout.scoring.FitScorer;
import com.venturescout.scoring.QualityScorer;
import com.venturescout.scoring.RecommendationPolicy;
import com.venturescout.vector.EmbeddingClient;
import com.venturescout.vector.EmbeddingClients;
import com.venturescout.vector.SimilarityCache;
import com.venturescout.vector.TextSimilarity;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.util.Map;

/**
 * Spring wiring for hosts that embed the scoring engine. Everything under
 * {@code venturescout.*} is also exposed through {@link Config} with the prefix removed.
 */
@Configuration
@EnableConfigurationProperties({BatchProperties.class, RateLimitProperties.class})
public class VentureScoutBootstrapConfig {

    @Bean
    public Config ventureScoutConfig(Environment environment) {
        Map<String, Object> raw = Binder.get(environment)
                .bind("venturescout", Bindable.mapOf(String.class, Object.class))
                .orElseGet(Map::of);
        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        return Config.fromConfigurationProperties(workingDir, raw);
    }

    @Bean
    public SlidingWindowRateLimiter rateLimiter(RateLimitProperties properties) {
        return new SlidingWindowRateLimiter(
                properties.getMaxRequests(),
                properties.getWindowSec() * 1000L,
                properties.getSource(),
                TimeSource.system()
        );
    }

    @Bean
    public EmbeddingClient embeddingClient(Config config, SlidingWindowRateLimiter rateLimiter) {
        return EmbeddingClients.fromConfig(config, rateLimiter);
    }

    /**
     * Same {@code cache.*} keys as the command line, read through {@link Config}.
     */
    @Bean
    public SimilarityCache similarityCache(EmbeddingClient embeddingClient, Config config) {
        return EmbeddingClients.cacheFromConfig(config, embeddingClient);
    }

    @Bean
    public TextSimilarity textSimilarity(SimilarityCache similarityCache) {
        return new TextSimilarity(similarityCache);
    }

    @Bean
    public QualityScorer qualityScorer(Config config) {
        return new QualityScorer(config);
    }

    @Bean
    public FitScorer fitScorer(TextSimilarity textSimilarity, QualityScorer qualityScorer, Config config) {
        return new FitScorer(textSimilarity, qualityScorer, config);
    }

    @Bean
    public PortfolioConflictAnalyzer portfolioConflictAnalyzer(TextSimilarity textSimilarity, Config config) {
        return PortfolioConflictAnalyzer.fromConfig(textSimilarity, config);
    }

    @Bean
    public RecommendationPolicy recommendationPolicy(Config config) {
        return RecommendationPolicy.fromConfig(config);
    }

    @Bean
    public CandidateScorer candidateScorer(
            QualityScorer qualityScorer,
            FitScorer fitScorer,
            PortfolioConflictAnalyzer portfolioConflictAnalyzer,
            RecommendationPolicy recommendationPolicy,
            Config config
    ) {
        return new ScoringPipeline(
                qualityScorer,
                fitScorer,
                portfolioConflictAnalyzer,
                recommendationPolicy,
                OverallWeights.fromConfig(config)
        );
    }

    @Bean
    public BatchScoringCoordinator batchScoringCoordinator(CandidateScorer candidateScorer, BatchProperties properties) {
        return new BatchScoringCoordinator(candidateScorer, properties.getThreads(), null);
    }

    @Bean
    public ReportWriter reportWriter(BatchProperties properties) {
        return new ReportWriter(properties.getTopN());
    }
}
