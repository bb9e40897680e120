package yggdrasil.storage.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import yggdrasil.storage.common.convention.errorcode.StorageErrorCode;
import yggdrasil.storage.common.convention.exception.ServiceException;
import yggdrasil.storage.common.convention.exception.TransientStoreException;
import yggdrasil.storage.dto.QueryFilter;
import yggdrasil.storage.dto.TextRankView;
import yggdrasil.storage.repository.ContentRecordRepository;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 全文检索
 * 标题加预览与完整正文两路排序，同一记录取最大分
 */
@Service
public class FullTextSearchService {

    private static final Logger log = LoggerFactory.getLogger(FullTextSearchService.class);

    private final ContentRecordRepository recordRepository;

    public FullTextSearchService(ContentRecordRepository recordRepository) {
        this.recordRepository = recordRepository;
    }

    /**
     * @return 记录 ID 到原始排序分，按分数降序
     */
    public Map<Long, Double> search(String queryText, QueryFilter filter, int limit) {
        QueryFilter effective = filter == null ? QueryFilter.none() : filter;
        String domain = blankToNull(effective.getDomain());
        try {
            List<TextRankView> rows = recordRepository.rankFullText(
                queryText,
                domain == null ? null : domain.toLowerCase(Locale.ROOT),
                blankToNull(effective.getContentType()),
                effective.getCreatedFrom(),
                effective.getCreatedTo(),
                limit);
            Map<Long, Double> scores = new LinkedHashMap<>();
            for (TextRankView row : rows) {
                scores.merge(row.getId(), row.getRank() == null ? 0.0 : row.getRank(), Math::max);
            }
            log.debug("全文检索完成, 命中: {}", scores.size());
            return scores;
        } catch (TransientDataAccessException | RecoverableDataAccessException e) {
            throw new TransientStoreException("全文检索失败: " + e.getMessage(), e, StorageErrorCode.DATABASE_ERROR);
        } catch (DataAccessException e) {
            throw new ServiceException("全文检索失败: " + e.getMessage(), e, StorageErrorCode.SEARCH_SERVICE_ERROR);
        }
    }

    private String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
