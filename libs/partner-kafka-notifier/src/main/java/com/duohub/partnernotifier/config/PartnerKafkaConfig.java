package com.duohub.partnernotifier.config;

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
 * 伴侣通知 Kafka 生产者配置。
 *
 * 配置要求（application.yml）：
 * <pre>
 * partner:
 *   kafka:
 *     bootstrap-servers: localhost:9092
 *     topic: partner-notifications
 * </pre>
 *
 * 只有生产者：消费端在推送服务里，不在本仓库。
 */
@Configuration
public class PartnerKafkaConfig {

    @Value("${partner.kafka.bootstrap-servers}")
    private String bootstrapServers;

    /** 投递超时：通知是发后即忘，不值得长时间阻塞 producer 缓冲 */
    @Value("${partner.kafka.delivery-timeout-ms:30000}")
    private int deliveryTimeoutMs;

    @Bean
    public ProducerFactory<String, String> partnerKafkaProducerFactory() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        // 通知丢一条问题不大：leader 确认即可
        props.put(ProducerConfig.ACKS_CONFIG, "1");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, false);
        props.put(ProducerConfig.RETRIES_CONFIG, 1);
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, deliveryTimeoutMs);
        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, Math.min(deliveryTimeoutMs, 15000));
        props.put(ProducerConfig.LINGER_MS_CONFIG, 0);
        return new DefaultKafkaProducerFactory<>(props);
    }

    @Bean
    public KafkaTemplate<String, String> partnerKafkaTemplate() {
        return new KafkaTemplate<>(partnerKafkaProducerFactory());
    }
}
