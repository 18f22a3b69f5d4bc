package retrydrain;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable unit of log data handed to a {@link Drain}.
 *
 * <p>Each record is assigned a ULID-based {@code recordId} by default, so a destination
 * that receives the same record more than once can deduplicate it. Structured fields
 * keep their insertion order. Use the {@linkplain Builder builder} or {@link #of(Level, String)}.
 *
 * @see Drain
 */
public final class LogRecord {
  private final String recordId;
  private final Instant timestamp;
  private final Level level;
  private final String message;
  private final String loggerName;
  private final Map<String, String> fields;

  private LogRecord(Builder builder) {
    this.recordId = builder.recordId == null ? newRecordId() : builder.recordId;
    if (this.recordId.isEmpty()) {
      throw new IllegalArgumentException("recordId cannot be empty");
    }
    this.level = Objects.requireNonNull(builder.level, "level");
    this.message = Objects.requireNonNull(builder.message, "message");
    this.timestamp = builder.timestamp == null ? Instant.now() : builder.timestamp;
    this.loggerName = builder.loggerName;

    Map<String, String> fieldCopy = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
    if (fieldCopy.containsKey(null)) {
      throw new IllegalArgumentException("fields cannot contain null keys");
    }
    if (fieldCopy.containsValue(null)) {
      throw new IllegalArgumentException("fields cannot contain null values");
    }
    this.fields = fieldCopy;
  }

  /**
   * Creates a builder for a record with the given level and message.
   *
   * @param level   the severity
   * @param message the log message
   * @return a new builder
   */
  public static Builder builder(Level level, String message) {
    return new Builder(level, message);
  }

  /**
   * Creates a record with no fields.
   *
   * @param level   the severity
   * @param message the log message
   * @return a new record
   */
  public static LogRecord of(Level level, String message) {
    return builder(level, message).build();
  }

  public String recordId() {
    return recordId;
  }

  public Instant timestamp() {
    return timestamp;
  }

  public Level level() {
    return level;
  }

  public String message() {
    return message;
  }

  /**
   * Returns the name of the logger that produced this record, or {@code null}.
   *
   * @return the logger name, or {@code null}
   */
  public String loggerName() {
    return loggerName;
  }

  public Map<String, String> fields() {
    return fields;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("LogRecord{recordId=").append(recordId)
        .append(", level=").append(level)
        .append(", message=").append(message);
    if (loggerName != null) {
      sb.append(", logger=").append(loggerName);
    }
    if (!fields.isEmpty()) {
      sb.append(", fields=").append(fields);
    }
    return sb.append('}').toString();
  }

  private static String newRecordId() {
    return UlidCreator.getMonotonicUlid().toString();
  }

  /**
   * Builder for {@link LogRecord}.
   */
  public static final class Builder {
    private final Level level;
    private final String message;
    private String recordId;
    private Instant timestamp;
    private String loggerName;
    private final Map<String, String> fields = new LinkedHashMap<>();

    private Builder(Level level, String message) {
      this.level = level;
      this.message = message;
    }

    /**
     * Sets a custom record identifier.
     *
     * <p>Optional. Defaults to a monotonic ULID.
     *
     * @param recordId the record identifier
     * @return this builder
     */
    public Builder recordId(String recordId) {
      this.recordId = recordId;
      return this;
    }

    /**
     * Sets the record timestamp.
     *
     * <p>Optional. Defaults to {@link Instant#now()}.
     *
     * @param timestamp when the record was produced
     * @return this builder
     */
    public Builder timestamp(Instant timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public Builder loggerName(String loggerName) {
      this.loggerName = loggerName;
      return this;
    }

    /**
     * Adds one structured field. A later value for the same key replaces the earlier one.
     *
     * @param key   the field name
     * @param value the field value
     * @return this builder
     */
    public Builder field(String key, String value) {
      fields.put(key, value);
      return this;
    }

    /**
     * Adds all given fields in the map's iteration order.
     *
     * @param fields the fields to add
     * @return this builder
     */
    public Builder fields(Map<String, String> fields) {
      Objects.requireNonNull(fields, "fields");
      this.fields.putAll(fields);
      return this;
    }

    public LogRecord build() {
      return new LogRecord(this);
    }
  }
}
