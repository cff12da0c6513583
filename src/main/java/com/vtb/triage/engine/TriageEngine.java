package com.vtb.triage.engine;

import com.vtb.triage.config.EngineConfig;
import com.vtb.triage.models.Classification;
import com.vtb.triage.models.OrchestrationResult;
import com.vtb.triage.models.RiskScore;
import com.vtb.triage.models.TriageReport;
import com.vtb.triage.models.TriagedFinding;
import com.vtb.triage.models.UnifiedFinding;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Триаж: классификация, оценка риска, кластеризация и объяснения.
 * 
 * Результат детерминирован: повторный триаж того же набора с той же конфигурацией
 * даёт те же вердикты, оценки и кластеры.
 */
@Slf4j
public class TriageEngine {
    
    static final Comparator<TriagedFinding> BY_RISK = Comparator
        .comparingDouble((TriagedFinding f) -> f.getRiskScore().getValue())
        .reversed()
        .thenComparing(TriagedFinding::getFingerprint);
    
    private final Function<EngineConfig, ClassifierChain> chainFactory;
    
    public TriageEngine() {
        this(config -> ClassifierChain.defaults(config.getTriage().getDisabledClassifiers()));
    }
    
    /**
     * @param chainFactory построение цепочки классификаторов по конфигурации (для подмены в тестах)
     */
    public TriageEngine(Function<EngineConfig, ClassifierChain> chainFactory) {
        this.chainFactory = chainFactory;
    }
    
    /**
     * Находки после триажа, по убыванию риска (при равенстве по fingerprint)
     */
    public List<TriagedFinding> triage(List<UnifiedFinding> findings, EngineConfig config) {
        return triageAndCluster(findings, config).findings();
    }
    
    /**
     * Полный отчёт по результату оркестрации
     */
    public TriageReport buildReport(Path target, OrchestrationResult orchestration, EngineConfig config) {
        FindingClusterer.Result result = triageAndCluster(orchestration.getFindings(), config);
        TriageReport report = TriageReport.builder()
            .generatedAt(Instant.now())
            .target(target != null ? target.toString() : null)
            .findings(result.findings())
            .clusters(result.clusters())
            .adapterOutcomes(new ArrayList<>(orchestration.getOutcomes()))
            .build();
        log.info("Отчёт: {} находок, к исправлению {}, кластеров {}",
            report.getFindings().size(), report.actionableFindings().size(), report.getClusters().size());
        return report;
    }
    
    FindingClusterer.Result triageAndCluster(List<UnifiedFinding> findings, EngineConfig config) {
        config.ensureDefaults();
        ClassifierChain chain = chainFactory.apply(config);
        RiskScorer scorer = new RiskScorer(config.getRiskTables());
        ExplanationGenerator explanations = new ExplanationGenerator(config.getTriage().getExplanationMaxLength());
        FindingClusterer clusterer = new FindingClusterer(
            config.getTriage().getMinPatternClusterSize(),
            config.getTriage().getMinFileClusterSize());
        
        List<TriagedFinding> triaged = new ArrayList<>(findings.size());
        for (UnifiedFinding finding : findings) {
            Classification classification = chain.classify(finding);
            // Оценка считается и для ложных срабатываний: фильтруют по вердикту
            RiskScore score = scorer.score(finding);
            triaged.add(TriagedFinding.builder()
                .finding(finding)
                .classification(classification)
                .riskScore(score)
                .explanation(explanations.explain(finding, classification))
                .build());
        }
        
        FindingClusterer.Result clustered = clusterer.cluster(triaged);
        List<TriagedFinding> sorted = new ArrayList<>(clustered.findings());
        sorted.sort(BY_RISK);
        
        long truePositives = sorted.stream().filter(TriagedFinding::isActionable).count();
        long review = sorted.stream().filter(TriagedFinding::requiresReview).count();
        log.info("Триаж {} находок: TP {}, требуют проверки {}, FP {}",
            sorted.size(), truePositives, review, sorted.size() - truePositives - review);
        return new FindingClusterer.Result(sorted, clustered.clusters());
    }
}
