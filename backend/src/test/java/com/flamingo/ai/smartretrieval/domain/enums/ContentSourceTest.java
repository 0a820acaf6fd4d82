package com.flamingo.ai.smartretrieval.domain.enums;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Locale;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ContentSource Tests")
class ContentSourceTest {

  private final Locale originalLocale = Locale.getDefault();

  @AfterEach
  void restoreLocale() {
    Locale.setDefault(originalLocale);
  }

  @Test
  @DisplayName("should match ids regardless of case and surrounding whitespace")
  void shouldNormalizeIds() {
    assertThat(ContentSource.fromId(" Document-Archive ")).contains(ContentSource.DOCUMENT_ARCHIVE);
    assertThat(ContentSource.fromId("notion")).isEmpty();
    assertThat(ContentSource.fromId(null)).isEmpty();
  }

  @Test
  @DisplayName("should match upper-case ids under a Turkish default locale")
  void shouldIgnoreDefaultLocale() {
    Locale.setDefault(Locale.forLanguageTag("tr-TR"));

    assertThat(ContentSource.fromId("READING-LOG")).contains(ContentSource.READING_LOG);
    assertThat(ContentSource.fromId("UPLOADED")).contains(ContentSource.UPLOADED);
  }
}
