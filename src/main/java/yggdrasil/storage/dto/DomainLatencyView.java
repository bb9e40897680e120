package yggdrasil.storage.dto;

/**
 * 领域查询延迟聚合
 */
public interface DomainLatencyView {

    String getDomain();

    Double getAvgLatencyMs();

    Long getSampleCount();
}
