package com.connecthub.gamekafkanotifier.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.ComponentScan;

/**
 * 对局事件 Kafka 通知器自动配置。
 * <p>
 * 仅当配置了 game.kafka.bootstrap-servers 时启用，未配置时业务侧拿不到
 * {@link com.connecthub.gamekafkanotifier.publisher.GameEventPublisher}，事件只保留在本地。
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "game.kafka", name = "bootstrap-servers")
@ComponentScan(basePackages = "com.connecthub.gamekafkanotifier")
public class GameKafkaNotifierAutoConfiguration {
}
