package com.chatdigest.backend.shared.time;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SlackTimestampsTest {

  @Test
  void ordersNumericallyNotLexically() {
    List<String> timestamps = new ArrayList<>(List.of("100.000300", "99.000900", "100.000100"));

    timestamps.sort(SlackTimestamps.ORDER);

    assertThat(timestamps).containsExactly("99.000900", "100.000100", "100.000300");
  }

  @Test
  void maxTreatsNullAsAbsent() {
    assertThat(SlackTimestamps.max(null, "1.000001")).isEqualTo("1.000001");
    assertThat(SlackTimestamps.max("2.000000", null)).isEqualTo("2.000000");
    assertThat(SlackTimestamps.max("10.000000", "9.999999")).isEqualTo("10.000000");
    assertThat(SlackTimestamps.max(null, null)).isNull();
  }

  @Test
  void convertsToInstantWithMicrosecondPrecision() {
    Instant instant = SlackTimestamps.toInstant("1621573200.000123");

    assertThat(instant.getEpochSecond()).isEqualTo(1621573200L);
    assertThat(instant.getNano()).isEqualTo(123_000);
    assertThat(SlackTimestamps.fromInstant(instant)).isEqualTo("1621573200.000123");
  }

  @Test
  void rejectsMalformedTimestamps() {
    assertThatThrownBy(() -> SlackTimestamps.parse("abc"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("abc");
    assertThatThrownBy(() -> SlackTimestamps.parse(" "))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
