package yggdrasil.storage.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import yggdrasil.storage.common.convention.errorcode.StorageErrorCode;
import yggdrasil.storage.common.convention.exception.ClientException;
import yggdrasil.storage.common.convention.exception.ContentValidationException;
import yggdrasil.storage.model.ContentAnnotation;
import yggdrasil.storage.repository.ContentAnnotationRepository;
import yggdrasil.storage.repository.ContentRecordRepository;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 分析代理标注
 * 代理只能写自己的标注行，不接触内容记录与位置指针
 */
@Service
public class AnnotationService {

    private static final Logger log = LoggerFactory.getLogger(AnnotationService.class);

    private final ContentAnnotationRepository annotationRepository;
    private final ContentRecordRepository recordRepository;

    public AnnotationService(ContentAnnotationRepository annotationRepository,
                             ContentRecordRepository recordRepository) {
        this.annotationRepository = annotationRepository;
        this.recordRepository = recordRepository;
    }

    /**
     * 写入或覆盖 (记录, 代理) 的标注
     */
    public ContentAnnotation attach(Long recordId, String agent, Map<String, Object> payload) {
        if (agent == null || agent.isBlank()) {
            throw new ContentValidationException("代理名称不能为空", StorageErrorCode.PARAM_INVALID);
        }
        if (recordId == null || !recordRepository.existsById(recordId)) {
            throw new ClientException(StorageErrorCode.RECORD_NOT_FOUND);
        }
        String normalizedAgent = agent.trim().toLowerCase(Locale.ROOT);
        Map<String, Object> body = payload == null ? new HashMap<>() : new HashMap<>(payload);

        ContentAnnotation annotation = annotationRepository.findByRecordIdAndAgent(recordId, normalizedAgent)
            .orElseGet(ContentAnnotation::new);
        annotation.setRecordId(recordId);
        annotation.setAgent(normalizedAgent);
        annotation.setPayload(body);
        try {
            ContentAnnotation saved = annotationRepository.saveAndFlush(annotation);
            log.debug("标注已写入, 记录: {}, 代理: {}", recordId, normalizedAgent);
            return saved;
        } catch (DataIntegrityViolationException e) {
            // 同一代理并发写入，改为覆盖已存在的行
            ContentAnnotation existing = annotationRepository.findByRecordIdAndAgent(recordId, normalizedAgent)
                .orElseThrow(() -> e);
            existing.setPayload(body);
            return annotationRepository.save(existing);
        }
    }

    public List<ContentAnnotation> list(Long recordId) {
        return annotationRepository.findByRecordIdOrderByAgentAsc(recordId);
    }
}
