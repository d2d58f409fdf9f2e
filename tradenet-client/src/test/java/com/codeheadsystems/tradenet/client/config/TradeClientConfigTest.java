package com.codeheadsystems.tradenet.client.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.URI;
import java.time.Duration;
import org.junit.jupiter.api.Test;

/**
 * The type Trade client config test.
 */
class TradeClientConfigTest {

  @Test
  void forDevelopment_hasDocumentedDefaults() {
    TradeClientConfig config = TradeClientConfig.forDevelopment();

    assertThat(config.serverUri()).isEqualTo(URI.create("http://localhost:5000"));
    assertThat(config.requestTimeout()).isEqualTo(Duration.ofSeconds(30));
    assertThat(config.tokenTtl()).isEqualTo(Duration.ofHours(24));
    assertThat(config.maxLoginAttempts()).isEqualTo(3);
    assertThat(config.loginRetryDelay()).isEqualTo(Duration.ofSeconds(2));
  }

  @Test
  void withRequestTimeout_acceptsFiveToSixtySeconds() {
    TradeClientConfig config = TradeClientConfig.forDevelopment();

    assertThat(config.withRequestTimeout(Duration.ofSeconds(5)).requestTimeout()).isEqualTo(Duration.ofSeconds(5));
    assertThat(config.withRequestTimeout(Duration.ofSeconds(60)).requestTimeout()).isEqualTo(Duration.ofSeconds(60));
    assertThatThrownBy(() -> config.withRequestTimeout(Duration.ofSeconds(4)))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> config.withRequestTimeout(Duration.ofSeconds(61)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void constructor_rejectsZeroLoginAttempts() {
    assertThatThrownBy(() -> new TradeClientConfig(URI.create("http://localhost:5000"),
        Duration.ofSeconds(30), Duration.ofHours(24), 0, Duration.ofSeconds(2)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void resolve_toleratesSlashesOnEitherSide() {
    TradeClientConfig config = TradeClientConfig.forServer(URI.create("https://trade.example.com/api/"));

    assertThat(config.resolve("/forsale")).isEqualTo(URI.create("https://trade.example.com/api/forsale"));
    assertThat(config.resolve("sales/claim")).isEqualTo(URI.create("https://trade.example.com/api/sales/claim"));
  }
}
