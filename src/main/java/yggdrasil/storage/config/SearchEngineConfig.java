package yggdrasil.storage.config;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.rest_client.RestClientTransport;
import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.elasticsearch.client.RestClient;
import org.elasticsearch.client.RestClientBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Elasticsearch 向量存储配置
 */
@Configuration
public class SearchEngineConfig {

    @Value("${elasticsearch.host}")
    private String esHost;

    @Value("${elasticsearch.port}")
    private int esPort;

    @Value("${elasticsearch.scheme:http}")
    private String protocol;

    @Value("${elasticsearch.username:}")
    private String userName;

    @Value("${elasticsearch.password:}")
    private String userPassword;

    @Value("${elasticsearch.connect-timeout-ms:3000}")
    private int connectTimeoutMs;

    @Value("${elasticsearch.socket-timeout-ms:10000}")
    private int socketTimeoutMs;

    /**
     * 构建Elasticsearch客户端实例
     *
     * @return ES客户端
     */
    @Bean
    public ElasticsearchClient elasticsearchClient() {
        RestClientBuilder clientBuilder = RestClient.builder(
            new HttpHost(esHost, esPort, protocol)
        );

        clientBuilder.setRequestConfigCallback(requestConfig -> requestConfig
            .setConnectTimeout(connectTimeoutMs)
            .setSocketTimeout(socketTimeoutMs));

        if (isAuthenticationRequired()) {
            configureAuthentication(clientBuilder);
        }

        RestClient restClient = clientBuilder.build();
        RestClientTransport transport = new RestClientTransport(
            restClient,
            new JacksonJsonpMapper()
        );

        return new ElasticsearchClient(transport);
    }

    private boolean isAuthenticationRequired() {
        return userName != null && !userName.trim().isEmpty();
    }

    private void configureAuthentication(RestClientBuilder builder) {
        BasicCredentialsProvider credentialsProvider = new BasicCredentialsProvider();
        credentialsProvider.setCredentials(
            AuthScope.ANY,
            new UsernamePasswordCredentials(userName, userPassword)
        );

        builder.setHttpClientConfigCallback(httpClientBuilder ->
            httpClientBuilder.setDefaultCredentialsProvider(credentialsProvider));
    }
}
