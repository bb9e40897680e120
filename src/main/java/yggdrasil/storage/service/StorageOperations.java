package yggdrasil.storage.service;

import org.springframework.stereotype.Service;
import yggdrasil.storage.dto.HealthReport;
import yggdrasil.storage.dto.IngestRequest;
import yggdrasil.storage.dto.IngestResult;
import yggdrasil.storage.dto.QueryRequest;
import yggdrasil.storage.dto.QueryResponse;
import yggdrasil.storage.dto.RecordStatusReport;
import yggdrasil.storage.model.ContentAnnotation;
import yggdrasil.storage.model.OptimizationRecommendation;

import java.util.List;
import java.util.Map;

/**
 * 运维入口
 * 采集端、检索调用方与运维人员经此访问存储引擎
 */
@Service
public class StorageOperations {

    private final IngestionService ingestionService;
    private final HybridQueryPlanner queryPlanner;
    private final RecommendationService recommendationService;
    private final StorageHealthService healthService;
    private final MigrationService migrationService;
    private final AnnotationService annotationService;

    public StorageOperations(IngestionService ingestionService,
                             HybridQueryPlanner queryPlanner,
                             RecommendationService recommendationService,
                             StorageHealthService healthService,
                             MigrationService migrationService,
                             AnnotationService annotationService) {
        this.ingestionService = ingestionService;
        this.queryPlanner = queryPlanner;
        this.recommendationService = recommendationService;
        this.healthService = healthService;
        this.migrationService = migrationService;
        this.annotationService = annotationService;
    }

    /**
     * @return 内容记录 ID
     */
    public Long ingest(IngestRequest request) {
        IngestResult result = ingestionService.ingest(request);
        return result.getRecordId();
    }

    public IngestResult ingestDetailed(IngestRequest request) {
        return ingestionService.ingest(request);
    }

    public QueryResponse query(QueryRequest request) {
        return queryPlanner.query(request);
    }

    public List<OptimizationRecommendation> listRecommendations() {
        return recommendationService.listRecommendations(OptimizationRecommendation.Status.PENDING);
    }

    public OptimizationRecommendation applyRecommendation(Long recommendationId) {
        return recommendationService.apply(recommendationId);
    }

    public RecordStatusReport recordStatus(Long recordId) {
        return healthService.recordStatus(recordId);
    }

    public HealthReport health() {
        return healthService.report();
    }

    public boolean cancelMigration(Long recordId) {
        return migrationService.cancel(recordId);
    }

    public ContentAnnotation annotate(Long recordId, String agent, Map<String, Object> payload) {
        return annotationService.attach(recordId, agent, payload);
    }
}
