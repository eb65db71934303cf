package com.acme.streamer.persistence.redis;

import com.acme.streamer.domain.Range;
import java.util.Optional;
import org.redisson.api.StreamMessageId;

/** Conversion between textual stream ids ({@code <ms>-<seq>}) and Redisson ids. */
final class StreamIds {

  private StreamIds() {}

  /**
   * Parse an id or one of the open range bounds. A bare {@code <ms>} means sequence 0.
   *
   * @return empty if the text is not a valid stream id
   */
  static Optional<StreamMessageId> parse(String id) {
    if (Range.FIRST.equals(id)) {
      return Optional.of(StreamMessageId.MIN);
    }
    if (Range.LAST.equals(id)) {
      return Optional.of(StreamMessageId.MAX);
    }
    String[] parts = id.split("-", -1);
    if (parts.length > 2) {
      return Optional.empty();
    }
    try {
      long millis = Long.parseLong(parts[0]);
      long sequence = parts.length == 2 ? Long.parseLong(parts[1]) : 0L;
      if (millis < 0 || sequence < 0) {
        return Optional.empty();
      }
      return Optional.of(new StreamMessageId(millis, sequence));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  static String format(StreamMessageId id) {
    return id.getId0() + "-" + id.getId1();
  }
}
