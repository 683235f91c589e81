package com.example.ample.common.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.PreDestroy;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TaskExecutionConfig {

    private ExecutorService lastFmDispatchExecutor;

    /**
     * Single worker so LastFM calls leave in the order the polling loop emitted them.
     */
    @Bean
    public ExecutorService lastFmDispatchExecutor() {
        this.lastFmDispatchExecutor = new ThreadPoolExecutor(
                1,
                1,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("lastfm-dispatch-"),
                new ThreadPoolExecutor.AbortPolicy());
        return this.lastFmDispatchExecutor;
    }

    @Bean(destroyMethod = "close")
    public CloseableHttpClient lastFmHttpClient(AppLastFmProperties appLastFmProperties) {
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(appLastFmProperties.getConnectTimeoutMs())
                .setConnectionRequestTimeout(appLastFmProperties.getConnectTimeoutMs())
                .setSocketTimeout(appLastFmProperties.getSocketTimeoutMs())
                .build();
        return HttpClients.custom()
                .setDefaultRequestConfig(requestConfig)
                .setUserAgent(appLastFmProperties.getUserAgent())
                .useSystemProperties()
                .build();
    }

    @PreDestroy
    public void shutdown() {
        if (lastFmDispatchExecutor != null) {
            lastFmDispatchExecutor.shutdown();
        }
    }

    private static class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger idx = new AtomicInteger(1);
        private final String prefix;

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + idx.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
