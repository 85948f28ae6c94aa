package com.connecthub.gamekafkanotifier.config;

import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * 对局事件 Kafka 生产者配置。
 *
 * 配置要求（application.yml）：
 * <pre>
 * game:
 *   kafka:
 *     bootstrap-servers: localhost:9092
 *     topic: game-events
 * </pre>
 *
 * 条件控制由 {@link GameKafkaNotifierAutoConfiguration} 统一管理。
 */
@Configuration
public class GameKafkaConfig {

    /** Kafka 集群地址，多个 broker 用逗号分隔 */
    @Value("${game.kafka.bootstrap-servers}")
    private String bootstrapServers;

    /**
     * 生产者工厂：Key/Value 均为 String（Value 为 JSON 文本）。
     */
    @Bean
    public ProducerFactory<String, String> gameKafkaProducerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        // leader 确认即可；元数据不可用时 send 最多阻塞 2 秒
        props.put(ProducerConfig.ACKS_CONFIG, "1");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, 2000);
        props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean
    public KafkaTemplate<String, String> gameKafkaTemplate() {
        return new KafkaTemplate<>(gameKafkaProducerFactory());
    }
}
