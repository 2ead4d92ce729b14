package com.proptrading.infra.kafka.topics;

import java.util.List;
import java.util.Map;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.config.TopicConfig;

public final class KafkaTopicDefinitions {
  private KafkaTopicDefinitions() {}

  /**
   * Trade events keep the broker's default retention. Market data is superseded by the next
   * record, so it only needs to survive a consumer restart.
   */
  public static List<KafkaTopicDefinition> defaults(
      int partitions, short replicationFactor, long priceRetentionMs) {
    if (priceRetentionMs < 1) {
      throw new IllegalArgumentException("priceRetentionMs must be >= 1");
    }
    Map<String, String> marketData =
        Map.of(TopicConfig.RETENTION_MS_CONFIG, Long.toString(priceRetentionMs));
    return List.of(
        new KafkaTopicDefinition(
            TopicNames.TRADING_EVENTS_V1, partitions, replicationFactor, Map.of()),
        new KafkaTopicDefinition(
            TopicNames.MARKET_PRICES_V1, partitions, replicationFactor, marketData),
        new KafkaTopicDefinition(
            TopicNames.MARKET_ORDER_BOOKS_V1, partitions, replicationFactor, marketData));
  }

  public record KafkaTopicDefinition(
      String name, int partitions, short replicationFactor, Map<String, String> configs) {
    public KafkaTopicDefinition {
      TopicNameValidator.assertValid(name);
      if (partitions < 1) {
        throw new IllegalArgumentException("partitions must be >= 1");
      }
      if (replicationFactor < 1) {
        throw new IllegalArgumentException("replicationFactor must be >= 1");
      }
      configs = configs == null ? Map.of() : Map.copyOf(configs);
    }

    public NewTopic toNewTopic() {
      return new NewTopic(name, partitions, replicationFactor).configs(configs);
    }
  }
}
