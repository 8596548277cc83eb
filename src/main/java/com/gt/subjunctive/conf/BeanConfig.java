package com.gt.subjunctive.conf;

import com.gt.subjunctive.feedback.FeedbackElaborator;
import com.gt.subjunctive.feedback.impl.DisabledFeedbackElaborator;
import com.gt.subjunctive.feedback.impl.RestFeedbackElaborator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
public class BeanConfig {

    private static final Logger log = LoggerFactory.getLogger(BeanConfig.class);

    @Bean
    public RestTemplate getFeedbackRestTemplate(RestTemplateBuilder restTemplateBuilder,
                                                @Value("${subjunctive.feedback.elaborator.timeoutMs:2000}") long timeoutMs) {
        return restTemplateBuilder
                .setConnectTimeout(Duration.ofMillis(timeoutMs))
                .setReadTimeout(Duration.ofMillis(timeoutMs))
                .build();
    }

    @Bean
    public FeedbackElaborator getFeedbackElaborator(RestTemplate feedbackRestTemplate,
                                                    @Value("${subjunctive.feedback.elaborator.enabled:false}") boolean enabled,
                                                    @Value("${subjunctive.feedback.elaborator.url:}") String url,
                                                    @Value("${subjunctive.feedback.elaborator.apiKey:}") String apiKey,
                                                    @Value("${subjunctive.feedback.elaborator.maxTokens:200}") int maxTokens) {
        if (!enabled || url.isBlank()) {
            log.info("Feedback elaboration disabled");
            return new DisabledFeedbackElaborator();
        }

        log.info("Feedback elaboration enabled using {}", url);
        return new RestFeedbackElaborator(feedbackRestTemplate, url, apiKey, maxTokens);
    }

    // Rejected submissions surface as RejectedExecutionException and fall back to the deterministic text
    @Bean(name = "feedbackExecutor", destroyMethod = "shutdown")
    public ExecutorService getFeedbackExecutor(@Value("${subjunctive.feedback.elaborator.threads:4}") int threads,
                                               @Value("${subjunctive.feedback.elaborator.queueSize:32}") int queueSize) {
        return new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(queueSize),
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    public Random getRandom() {
        return new SecureRandom();
    }
}
