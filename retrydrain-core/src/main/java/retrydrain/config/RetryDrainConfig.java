package retrydrain.config;

import retrydrain.retry.RetryPolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

/**
 * Mutable retry settings, readable from {@link Properties}.
 *
 * <p>Recognized keys, relative to the prefix ({@value #DEFAULT_PREFIX} by default):
 * <ul>
 *   <li>{@code max-attempts}: attempt budget including the first attempt</li>
 *   <li>{@code delays-ms}: comma-separated delays; the last one is reused</li>
 *   <li>{@code fixed-delay-ms}: a single delay for every retry; wins over {@code delays-ms}</li>
 * </ul>
 */
public final class RetryDrainConfig {
  public static final String DEFAULT_PREFIX = "retrydrain.";

  private int maxAttempts = RetryPolicy.DEFAULT_MAX_ATTEMPTS;
  private List<Long> delaysMs = defaultDelaysMs();

  public static RetryDrainConfig fromProperties(Properties properties) {
    return fromProperties(properties, DEFAULT_PREFIX);
  }

  /**
   * Reads settings from {@code properties}; absent keys keep their defaults.
   *
   * @param properties the source
   * @param prefix     key prefix, for example {@code "app.logging.retry."}
   * @return the config
   * @throws IllegalArgumentException if a value is not a valid number
   */
  public static RetryDrainConfig fromProperties(Properties properties, String prefix) {
    Objects.requireNonNull(properties, "properties");
    Objects.requireNonNull(prefix, "prefix");
    RetryDrainConfig config = new RetryDrainConfig();

    String maxAttempts = properties.getProperty(prefix + "max-attempts");
    if (maxAttempts != null) {
      config.setMaxAttempts(parseInt(prefix + "max-attempts", maxAttempts));
    }

    String delays = properties.getProperty(prefix + "delays-ms");
    if (delays != null) {
      List<Long> parsed = new ArrayList<>();
      for (String part : delays.split(",")) {
        if (!part.isBlank()) {
          parsed.add(parseLong(prefix + "delays-ms", part));
        }
      }
      config.setDelaysMs(parsed);
    }

    String fixedDelay = properties.getProperty(prefix + "fixed-delay-ms");
    if (fixedDelay != null) {
      config.setFixedDelayMs(parseLong(prefix + "fixed-delay-ms", fixedDelay));
    }
    return config;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public RetryDrainConfig setMaxAttempts(int maxAttempts) {
    this.maxAttempts = maxAttempts;
    return this;
  }

  public List<Long> getDelaysMs() {
    return delaysMs;
  }

  public RetryDrainConfig setDelaysMs(List<Long> delaysMs) {
    this.delaysMs = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(delaysMs, "delaysMs")));
    return this;
  }

  public RetryDrainConfig setFixedDelayMs(long fixedDelayMs) {
    this.delaysMs = List.of(fixedDelayMs);
    return this;
  }

  /**
   * Builds an immutable policy from the current settings.
   *
   * @return the policy
   * @throws IllegalArgumentException if the settings are invalid
   */
  public RetryPolicy toRetryPolicy() {
    List<Duration> delays = new ArrayList<>(delaysMs.size());
    for (Long delayMs : delaysMs) {
      delays.add(Duration.ofMillis(Objects.requireNonNull(delayMs, "delaysMs must not contain null")));
    }
    return RetryPolicy.builder()
        .maxAttempts(maxAttempts)
        .delays(delays)
        .build();
  }

  private static List<Long> defaultDelaysMs() {
    List<Long> delays = new ArrayList<>();
    for (Duration delay : RetryPolicy.DEFAULT_DELAYS) {
      delays.add(delay.toMillis());
    }
    return Collections.unmodifiableList(delays);
  }

  private static int parseInt(String key, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value for " + key + ": '" + value + "'", e);
    }
  }

  private static long parseLong(String key, String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value for " + key + ": '" + value + "'", e);
    }
  }
}
