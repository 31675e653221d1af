package com.plyoox.stream.notifier.conf;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
public class CommonConfig {
    public static final String DELIVERY_EXECUTOR = "deliveryExecutor";

    public static ObjectMapper DEFAULT_OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Bean
    public ObjectMapper objectMapper() {
        return DEFAULT_OBJECT_MAPPER;
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Bot deliveries are detached from the webhook response; when the queue is full the delivery is dropped.
     */
    @Bean(value = DELIVERY_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService deliveryExecutor(@Value("${bot.delivery.threads:4}") int threads,
                                            @Value("${bot.delivery.queue.size:1000}") int queueSize) {
        return new ThreadPoolExecutor(threads, threads, 60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(queueSize),
                new BasicThreadFactory.Builder()
                        .namingPattern("bot-delivery-thread-%d")
                        .daemon(true)
                        .build(),
                new ThreadPoolExecutor.AbortPolicy());
    }
}
