package yggdrasil.storage.service;

import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import yggdrasil.storage.common.convention.errorcode.StorageErrorCode;
import yggdrasil.storage.common.convention.exception.ContentValidationException;
import yggdrasil.storage.common.convention.exception.ServiceException;
import yggdrasil.storage.config.StorageProperties;
import yggdrasil.storage.dto.ClassificationInput;
import yggdrasil.storage.dto.ContentProfile;
import yggdrasil.storage.dto.IngestRequest;
import yggdrasil.storage.dto.IngestResult;
import yggdrasil.storage.dto.PlacementDecision;
import yggdrasil.storage.dto.WriteOutcome;
import yggdrasil.storage.model.ContentRecord;
import yggdrasil.storage.model.RecordStatus;
import yggdrasil.storage.model.StorageLeg;
import yggdrasil.storage.model.StorageLocation;
import yggdrasil.storage.repository.ContentRecordRepository;
import yggdrasil.storage.service.support.LocatorSerialExecutor;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 内容摄取服务
 *
 * <p>处理流程：</p>
 * <ol>
 *     <li>校验输入，失败在任何写入之前抛出</li>
 *     <li>同一来源地址串行执行；已存在的地址只合并抓取统计</li>
 *     <li>分类、决策，以 PENDING 状态落库占住来源地址</li>
 *     <li>协调器写入各分支，一致性映射设置指针</li>
 *     <li>失败分支登记补写，记录为 DEGRADED</li>
 * </ol>
 */
@Service
public class IngestionService {

    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final ContentRecordRepository recordRepository;
    private final ContentClassifier classifier;
    private final PlacementPolicy placementPolicy;
    private final StorageCoordinator coordinator;
    private final ConsistencyMapper consistencyMapper;
    private final ReconciliationService reconciliationService;
    private final LocatorSerialExecutor serialExecutor;
    private final StorageProperties properties;

    public IngestionService(ContentRecordRepository recordRepository,
                            ContentClassifier classifier,
                            PlacementPolicy placementPolicy,
                            StorageCoordinator coordinator,
                            ConsistencyMapper consistencyMapper,
                            ReconciliationService reconciliationService,
                            LocatorSerialExecutor serialExecutor,
                            StorageProperties properties) {
        this.recordRepository = recordRepository;
        this.classifier = classifier;
        this.placementPolicy = placementPolicy;
        this.coordinator = coordinator;
        this.consistencyMapper = consistencyMapper;
        this.reconciliationService = reconciliationService;
        this.serialExecutor = serialExecutor;
        this.properties = properties;
    }

    /**
     * 摄取一条内容
     *
     * @throws ContentValidationException 输入不合法
     */
    public IngestResult ingest(IngestRequest request) {
        validate(request);
        String locator = request.getSourceLocator().trim();
        return serialExecutor.run(locator, () -> ingestSerialized(locator, request));
    }

    private IngestResult ingestSerialized(String locator, IngestRequest request) {
        String content = request.getContent();
        String contentHash = DigestUtils.sha256Hex(content);

        Optional<ContentRecord> existing = recordRepository.findBySourceLocator(locator);
        if (existing.isPresent()) {
            ContentRecord found = existing.get();
            if (found.getStatus() == RecordStatus.PENDING) {
                return resumePending(found, request, content, contentHash);
            }
            return mergeRescrape(found, contentHash);
        }

        ContentRecord record = new ContentRecord();
        record.setSourceLocator(locator);
        record.setScrapeCount(1);
        classifyInto(record, request, content, contentHash);
        try {
            record = recordRepository.saveAndFlush(record);
        } catch (DataIntegrityViolationException e) {
            // 其他进程已占用该来源地址
            ContentRecord winner = recordRepository.findBySourceLocator(locator)
                .orElseThrow(() -> new ServiceException("来源地址冲突后未找到记录: " + locator, e,
                    StorageErrorCode.DATABASE_ERROR));
            return mergeRescrape(winner, contentHash);
        }

        return writeAndCommit(record, content, contentHash, true);
    }

    /**
     * 上次摄取在写入分支时中断，记录仍为 PENDING 且没有指针
     * 内容未变时按已有决策继续；内容已变时按新内容重新分类和决策后写入
     */
    private IngestResult resumePending(ContentRecord record, IngestRequest request, String content, String contentHash) {
        if (!contentHash.equals(record.getContentHash())) {
            log.warn("来源 {} 存在未完成的摄取且内容已变化，按新内容重新决策", record.getSourceLocator());
            classifyInto(record, request, content, contentHash);
            record.setScrapeCount(record.getScrapeCount() + 1);
            record = recordRepository.saveAndFlush(record);
        } else {
            log.warn("来源 {} 存在未完成的摄取，继续写入", record.getSourceLocator());
        }
        return writeAndCommit(record, content, contentHash, false);
    }

    private IngestResult writeAndCommit(ContentRecord record, String content, String contentHash, boolean created) {
        WriteOutcome outcome = coordinator.execute(record, content, contentHash, record.getStrategy());
        ContentRecord committed = consistencyMapper.commitIngestion(record.getId(), outcome);

        // 写入失败或回读未通过的分支都没有指针，统一登记补写
        Set<StorageLeg> missing = EnumSet.noneOf(StorageLeg.class);
        for (StorageLeg leg : committed.getStrategy().requiredLegs()) {
            if (committed.getLocation().hasLeg(leg)) {
                continue;
            }
            missing.add(leg);
            String error = outcome.errorFor(leg);
            reconciliationService.scheduleRepair(committed, leg, content, error == null ? "写入后回读校验失败" : error);
        }

        return new IngestResult(committed.getId(), created, committed.getStrategy(), committed.getStatus(),
            committed.getConfidenceScore(), missing);
    }

    private IngestResult mergeRescrape(ContentRecord record, String contentHash) {
        recordRepository.mergeRescrape(record.getId(), LocalDateTime.now(), contentHash);
        if (record.getContentHash() != null && !record.getContentHash().equals(contentHash)) {
            log.info("来源 {} 内容已变化，仅记录最新哈希，等待策略复核", record.getSourceLocator());
        } else {
            log.debug("来源 {} 重复抓取，合并统计", record.getSourceLocator());
        }
        return new IngestResult(record.getId(), false, record.getStrategy(), record.getStatus(),
            record.getConfidenceScore(), Collections.emptySet());
    }

    /**
     * 分类并决策，结果写入记录；记录置为 PENDING，指针清空
     */
    private void classifyInto(ContentRecord record, IngestRequest request, String content, String contentHash) {
        String locator = record.getSourceLocator();
        long size = request.getDeclaredSize() != null
            ? request.getDeclaredSize()
            : content.getBytes(StandardCharsets.UTF_8).length;
        String domain = isBlank(request.getDomain())
            ? classifier.inferDomain(content, locator)
            : request.getDomain().trim().toLowerCase(Locale.ROOT);
        String contentType = isBlank(request.getContentType())
            ? classifier.inferContentType(locator, size)
            : request.getContentType().trim().toLowerCase(Locale.ROOT);

        ContentProfile profile = classifier.classify(ClassificationInput.builder()
            .text(content)
            .declaredSize(size)
            .domain(domain)
            .contentType(contentType)
            .build());
        PlacementDecision decision = placementPolicy.decide(size, profile, domain, placementPolicy.currentVersion());
        log.info("来源 {} 放置决策: {} (置信度 {}), 依据: {}",
            locator, decision.getStrategy().value(), String.format("%.2f", decision.getConfidence()), decision.getReasons());

        record.setTitle(isBlank(request.getTitle()) ? locator : request.getTitle().trim());
        record.setAuthor(request.getAuthor());
        record.setDomain(domain);
        record.setContentType(contentType);
        record.setLanguage(isBlank(request.getLanguage()) ? "en" : request.getLanguage());
        record.setDeclaredSize(size);
        record.setWordCount(profile.getWordCount());
        record.setCharacterCount(profile.getCharacterCount());
        int previewLength = properties.getClassifier().getPreviewLength();
        record.setContentPreview(content.length() > previewLength ? content.substring(0, previewLength) : content);
        record.setSemanticComplexity(profile.getSemanticComplexity());
        record.setTopicCoherence(profile.getTopicCoherence());
        record.setInformationDensity(profile.getInformationDensity());
        record.setQueryPotential(profile.getQueryPotential());
        record.setStrategy(decision.getStrategy());
        record.setPolicyVersion(decision.getPolicyVersion());
        record.setConfidenceScore(decision.getConfidence());
        record.setStatus(RecordStatus.PENDING);
        record.setLocation(new StorageLocation());
        record.setContentHash(contentHash);
        record.setLastSeenHash(contentHash);
        record.setLastScrapedAt(LocalDateTime.now());
        record.setMetadata(request.getMetadata() == null ? new HashMap<>() : new HashMap<>(request.getMetadata()));
        record.setTags(request.getTags() == null ? new ArrayList<>() : new ArrayList<>(request.getTags()));
        record.setKeywords(new ArrayList<>(profile.getKeywords()));
    }

    private void validate(IngestRequest request) {
        if (request == null) {
            throw new ContentValidationException(StorageErrorCode.PARAM_INVALID);
        }
        if (isBlank(request.getSourceLocator())) {
            throw new ContentValidationException(StorageErrorCode.SOURCE_LOCATOR_EMPTY);
        }
        if (isBlank(request.getContent())) {
            throw new ContentValidationException(StorageErrorCode.CONTENT_EMPTY);
        }
        if (request.getDeclaredSize() != null && request.getDeclaredSize() < 0) {
            throw new ContentValidationException("声明大小不能为负数: " + request.getDeclaredSize(),
                StorageErrorCode.DECLARED_SIZE_INVALID);
        }
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
