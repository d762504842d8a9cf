package com.chatdigest.backend.extract;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class MentionExtractorTest {

  @Test
  void extractsPlainAndLabelledMentionsInOrder() {
    assertThat(MentionExtractor.extractMentions("hey <@U2|bob> and <@U1>, also <@U2>"))
        .containsExactly("U2", "U1");
  }

  @Test
  void ignoresChannelAndSpecialReferences() {
    assertThat(MentionExtractor.extractMentions("<#C123|general> <!here> <@u1> @U1")).isEmpty();
  }

  @Test
  void blankTextHasNoMentions() {
    assertThat(MentionExtractor.extractMentions(null)).isEmpty();
    assertThat(MentionExtractor.extractMentions("   ")).isEmpty();
  }
}
