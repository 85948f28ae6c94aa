package com.connecthub.gamekafkanotifier.publisher;

import com.alibaba.fastjson2.JSON;
import com.connecthub.gamekafkanotifier.event.GameLifecycleEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * 对局事件发布器。
 * <p>
 * 发后即忘：发送失败只记录日志，绝不向调用方抛出异常。
 */
@Slf4j
@Component
public class GameEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;

    private final String topic;

    public GameEventPublisher(@Qualifier("gameKafkaTemplate") KafkaTemplate<String, String> kafkaTemplate,
                              @Value("${game.kafka.topic:game-events}") String topic) {
        this.kafkaTemplate = kafkaTemplate;
        this.topic = topic;
    }

    /**
     * 发布对局事件，key 为 sessionId。
     */
    public void publish(GameLifecycleEvent event) {
        try {
            String message = JSON.toJSONString(event);
            CompletableFuture<SendResult<String, String>> future =
                    kafkaTemplate.send(topic, event.getSessionId(), message);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.debug("对局事件发布成功: sessionId={}, type={}, offset={}",
                            event.getSessionId(), event.getEventType(), result.getRecordMetadata().offset());
                } else {
                    log.error("对局事件发布失败: sessionId={}, type={}", event.getSessionId(), event.getEventType(), ex);
                }
            });
        } catch (Exception e) {
            log.error("发布对局事件异常: sessionId={}, type={}", event.getSessionId(), event.getEventType(), e);
        }
    }

    public String getTopic() {
        return topic;
    }
}
