package com.duohub.partnernotifier.publisher;

import com.alibaba.fastjson2.JSON;
import com.duohub.partnernotifier.PartnerNotifier;
import com.duohub.partnernotifier.event.PartnerNotification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * 伴侣通知的 Kafka 发布器。
 *
 * 使用方式：
 * <pre>
 * {@code
 * notifier.notifyPartner(PartnerNotification.of(
 *         PartnerNotification.Type.MOVE_MADE, pairKey, sessionId, "ladder", me, partner, "COT"));
 * }
 * </pre>
 * 发送结果只在回调里记日志，调用方不等待。
 */
@Slf4j
@Component
public class KafkaPartnerNotifier implements PartnerNotifier {

    private final KafkaTemplate<String, String> kafkaTemplate;

    @Value("${partner.kafka.topic:partner-notifications}")
    private String topic;

    public KafkaPartnerNotifier(@Qualifier("partnerKafkaTemplate") KafkaTemplate<String, String> kafkaTemplate) {
        this.kafkaTemplate = kafkaTemplate;
    }

    void setTopic(String topic) {
        this.topic = topic;
    }

    @Override
    public void notifyPartner(PartnerNotification notification) {
        if (notification == null || notification.getRecipientId() == null) {
            log.warn("伴侣通知缺少接收方，已忽略: {}", notification);
            return;
        }
        try {
            String message = JSON.toJSONString(notification);
            CompletableFuture<SendResult<String, String>> future =
                    kafkaTemplate.send(topic, notification.getRecipientId(), message);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.debug("伴侣通知发布成功: type={}, sessionId={}, offset={}",
                            notification.getType(), notification.getSessionId(),
                            result.getRecordMetadata().offset());
                } else {
                    log.warn("伴侣通知发布失败（不重试，对方下次轮询可见）: type={}, sessionId={}",
                            notification.getType(), notification.getSessionId(), ex);
                }
            });
        } catch (Exception e) {
            log.error("发布伴侣通知异常: type={}, sessionId={}",
                    notification.getType(), notification.getSessionId(), e);
        }
    }
}
