package com.knowledgechain.infrastructure.knowledge;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class KnowledgeConfig {

    @Value("${knowledge.user-agent:KnowledgeChain/1.0 (research prototype)}")
    private String userAgent;

    @Value("${knowledge.http.connect-timeout-ms:5000}")
    private int connectTimeoutMs;

    @Value("${knowledge.http.read-timeout-ms:10000}")
    private int readTimeoutMs;

    @Value("${knowledge.executor.core-pool-size:4}")
    private int corePoolSize;

    @Value("${knowledge.executor.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${knowledge.executor.queue-capacity:50}")
    private int queueCapacity;

    @Bean
    public RestClient knowledgeRestClient(RestClient.Builder builder) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeoutMs);
        requestFactory.setReadTimeout(readTimeoutMs);
        return builder
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.USER_AGENT, userAgent)
                .build();
    }

    /**
     * Pool for concurrent source queries within one retrieval attempt. When the queue is full the
     * retrieving thread runs the query itself.
     */
    @Bean(name = "knowledgeExecutor")
    public ThreadPoolTaskExecutor knowledgeExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("knowledge-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
