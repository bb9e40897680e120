package yggdrasil.storage.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;
import yggdrasil.storage.common.convention.errorcode.StorageErrorCode;
import yggdrasil.storage.common.convention.exception.ServiceException;
import yggdrasil.storage.common.convention.exception.TransientStoreException;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 向量编码服务
 * 调用 OpenAI 兼容的 /embeddings 接口，把分块文本或查询文本转换为向量
 */
@Component
public class VectorEncodingService {

    private static final Logger log = LoggerFactory.getLogger(VectorEncodingService.class);

    @Value("${embedding.api.model}")
    private String encodingModel;

    @Value("${embedding.api.batch-size:64}")
    private int processingBatchSize;

    @Value("${embedding.api.dimension:1024}")
    private int vectorDimension;

    @Value("${embedding.api.timeout-seconds:30}")
    private long timeoutSeconds;

    private final WebClient httpClient;
    private final ObjectMapper jsonParser;

    public VectorEncodingService(WebClient embeddingWebClient, ObjectMapper objectMapper) {
        this.httpClient = embeddingWebClient;
        this.jsonParser = objectMapper;
    }

    public String getModelName() {
        return encodingModel;
    }

    public int getDimension() {
        return vectorDimension;
    }

    /**
     * 对文本列表进行向量编码，返回顺序与输入一致
     *
     * @param textList 待编码的文本列表
     * @return 对应的向量数组列表
     * @throws TransientStoreException 接口超时、网络错误或响应不完整
     * @throws ServiceException 接口以 4xx 拒绝请求（429 除外）
     */
    public List<float[]> encode(List<String> textList) {
        if (textList == null || textList.isEmpty()) {
            return new ArrayList<>();
        }
        log.debug("启动向量编码任务，文本总数: {}", textList.size());

        List<float[]> allVectors = new ArrayList<>(textList.size());
        List<List<String>> batches = partitionIntoBatches(textList);
        for (int batchIndex = 0; batchIndex < batches.size(); batchIndex++) {
            List<String> currentBatch = batches.get(batchIndex);
            log.debug("处理第 {}/{} 批，大小: {}", batchIndex + 1, batches.size(), currentBatch.size());

            String apiResponse = invokeEncodingApi(currentBatch);
            List<float[]> batchVectors = extractVectorsFromResponse(apiResponse);
            if (batchVectors.size() != currentBatch.size()) {
                throw new TransientStoreException(
                    "向量数量与文本数量不一致: " + batchVectors.size() + " != " + currentBatch.size(),
                    StorageErrorCode.EMBEDDING_API_ERROR);
            }
            allVectors.addAll(batchVectors);
        }

        log.debug("向量编码完成，共生成 {} 个向量", allVectors.size());
        return allVectors;
    }

    /**
     * 编码单条查询文本
     */
    public List<Float> encodeQuery(String text) {
        float[] vector = encode(List.of(text)).get(0);
        List<Float> boxed = new ArrayList<>(vector.length);
        for (float value : vector) {
            boxed.add(value);
        }
        return boxed;
    }

    private List<List<String>> partitionIntoBatches(List<String> textList) {
        List<List<String>> batches = new ArrayList<>();
        int batchSize = Math.max(1, processingBatchSize);
        for (int i = 0; i < textList.size(); i += batchSize) {
            int endIndex = Math.min(i + batchSize, textList.size());
            batches.add(textList.subList(i, endIndex));
        }
        return batches;
    }

    private String invokeEncodingApi(List<String> batch) {
        try {
            return httpClient.post()
                .uri("/embeddings")
                .bodyValue(buildRequestBody(batch))
                .retrieve()
                .bodyToMono(String.class)
                .retryWhen(createRetryPolicy())
                .block(Duration.ofSeconds(timeoutSeconds));
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            if (isRetryableStatus(status)) {
                throw new TransientStoreException("向量编码接口返回错误: " + status,
                    e, StorageErrorCode.EMBEDDING_API_ERROR);
            }
            // 鉴权、参数等 4xx 错误重试无意义
            log.error("向量编码接口拒绝请求, 状态码: {}, 响应: {}", status, e.getResponseBodyAsString());
            throw new ServiceException("向量编码接口拒绝请求: " + status, e, StorageErrorCode.EMBEDDING_API_ERROR);
        } catch (RuntimeException e) {
            // 超时与重试耗尽都以 RuntimeException 形式抛出
            throw new TransientStoreException("向量编码接口调用失败: " + e.getMessage(),
                e, StorageErrorCode.EMBEDDING_API_ERROR);
        }
    }

    private Map<String, Object> buildRequestBody(List<String> batch) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", encodingModel);
        body.put("input", batch);
        body.put("dimensions", vectorDimension);
        body.put("encoding_format", "float");
        return body;
    }

    /**
     * 只对 5xx、429 和连接错误做快速重试，其他 4xx 直接失败
     */
    private Retry createRetryPolicy() {
        return Retry.fixedDelay(2, Duration.ofMillis(500))
            .filter(error -> error instanceof WebClientRequestException
                || (error instanceof WebClientResponseException
                    && isRetryableStatus(((WebClientResponseException) error).getStatusCode().value())));
    }

    private static boolean isRetryableStatus(int status) {
        return status == 429 || status >= 500;
    }

    private List<float[]> extractVectorsFromResponse(String response) {
        JsonNode dataArray;
        try {
            JsonNode responseJson = jsonParser.readTree(response == null ? "{}" : response);
            dataArray = responseJson.get("data");
        } catch (IOException e) {
            throw new TransientStoreException("向量编码响应无法解析", e, StorageErrorCode.EMBEDDING_API_ERROR);
        }
        if (dataArray == null || !dataArray.isArray()) {
            throw new TransientStoreException("API响应格式异常: 缺少data数组", StorageErrorCode.EMBEDDING_API_ERROR);
        }

        List<float[]> vectors = new ArrayList<>();
        for (JsonNode item : dataArray) {
            JsonNode embeddingNode = item.get("embedding");
            if (embeddingNode != null && embeddingNode.isArray()) {
                vectors.add(parseVector(embeddingNode));
            }
        }
        return vectors;
    }

    private float[] parseVector(JsonNode embeddingNode) {
        float[] vector = new float[embeddingNode.size()];
        for (int i = 0; i < embeddingNode.size(); i++) {
            vector[i] = (float) embeddingNode.get(i).asDouble();
        }
        return vector;
    }
}
