package com.flamingo.ai.archiveqa.service.rag.postprocess;

import com.flamingo.ai.archiveqa.config.RagConfig;
import com.google.common.annotations.VisibleForTesting;
import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.TextStyle;
import java.util.Locale;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Renders archive timestamps as "Dec 15, 2pm". */
@Component
public class FriendlyTimestampFormatter {

  static final String UNKNOWN = "recently";

  private final ZoneId zone;

  @Autowired
  public FriendlyTimestampFormatter(RagConfig ragConfig) {
    this(ZoneId.of(ragConfig.getEvidence().getZoneId()));
  }

  @VisibleForTesting
  FriendlyTimestampFormatter(ZoneId zone) {
    this.zone = zone;
  }

  /**
   * Formats a chat-platform timestamp ({@code 1702650000.123456}, rendered in the configured zone)
   * or an ISO-8601 value (rendered in its own offset). Anything unparsable becomes "recently".
   */
  public String format(String timestamp) {
    if (timestamp == null || timestamp.isBlank()) {
      return UNKNOWN;
    }
    try {
      return render(parse(timestamp.strip()));
    } catch (DateTimeException | ArithmeticException | NumberFormatException e) {
      return UNKNOWN;
    }
  }

  private LocalDateTime parse(String timestamp) {
    int dot = timestamp.indexOf('.');
    if (dot == 10) {
      BigDecimal seconds = new BigDecimal(timestamp);
      Instant instant =
          Instant.ofEpochSecond(
              seconds.longValue(), seconds.remainder(BigDecimal.ONE).movePointRight(9).longValue());
      return LocalDateTime.ofInstant(instant, zone);
    }
    String iso =
        timestamp.endsWith("Z")
            ? timestamp.substring(0, timestamp.length() - 1) + "+00:00"
            : timestamp;
    try {
      return OffsetDateTime.parse(iso).toLocalDateTime();
    } catch (DateTimeException e) {
      if (iso.length() == 10) {
        return LocalDate.parse(iso).atStartOfDay();
      }
      return LocalDateTime.parse(iso);
    }
  }

  private static String render(LocalDateTime time) {
    String month = time.getMonth().getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
    return month + " " + time.getDayOfMonth() + ", " + hour(time.getHour());
  }

  static String hour(int hour) {
    if (hour == 0) {
      return "12am";
    }
    if (hour < 12) {
      return hour + "am";
    }
    if (hour == 12) {
      return "12pm";
    }
    return (hour - 12) + "pm";
  }
}
