package com.duohub.partnernotifier.config;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.ComponentScan;

/**
 * 伴侣通知 Kafka 自动配置类。
 *
 * 当配置了 partner.kafka.bootstrap-servers 时自动启用，注册：
 * - {@link PartnerKafkaConfig}：生产者配置
 * - {@link com.duohub.partnernotifier.publisher.KafkaPartnerNotifier}：通知发布器
 *
 * 未配置时业务侧应提供自己的 {@link com.duohub.partnernotifier.PartnerNotifier}（例如只记日志）。
 */
@AutoConfiguration
@ConditionalOnProperty(prefix = "partner.kafka", name = "bootstrap-servers")
@ComponentScan(basePackages = "com.duohub.partnernotifier")
public class PartnerKafkaNotifierAutoConfiguration {
}
