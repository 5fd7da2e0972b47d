package com.example.pms.router.extraction;

import com.example.pms.router.model.EntitySource;
import com.example.pms.router.model.EntityType;
import com.example.pms.router.model.ExtractedEntity;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ChatModelEntityExtractorTest {

  private final ChatModel chatModel = mock(ChatModel.class);
  private final ChatModelEntityExtractor extractor = new ChatModelEntityExtractor(chatModel, new ObjectMapper());

  @Test
  void fencedJsonAnswer_isParsed() {
    when(chatModel.chat(anyString())).thenReturn("""
        ```json
        [{"type": "equipment", "text": " stern thruster ", "confidence": 0.9},
         {"type": "symptom", "text": "clicking"}]
        ```
        """);

    List<ExtractedEntity> entities = extractor.extract("stern thruster keeps clicking").block();

    assertThat(entities).hasSize(2);
    assertThat(entities.get(0).type()).isEqualTo(EntityType.EQUIPMENT);
    assertThat(entities.get(0).text()).isEqualTo("stern thruster");
    assertThat(entities.get(1).confidence()).isEqualTo(ChatModelEntityExtractor.DEFAULT_CONFIDENCE);
    assertThat(entities).allSatisfy(e -> {
      assertThat(e.source()).isEqualTo(EntitySource.MODEL);
      assertThat(e.start()).isEqualTo(-1);
    });
  }

  @Test
  void unknownTypesAndBlankTexts_areDropped() {
    List<ExtractedEntity> entities = extractor.parse(
        "[{\"type\":\"colour\",\"text\":\"red\"},{\"type\":\"PART\",\"text\":\"  \"},{\"type\":\"part\",\"text\":\"impeller\",\"confidence\":3}]");

    assertThat(entities).singleElement().satisfies(e -> {
      assertThat(e.text()).isEqualTo("impeller");
      assertThat(e.confidence()).isEqualTo(1.0);
    });
  }

  @Test
  void emptyAnswer_meansNoEntities() {
    assertThat(extractor.parse("")).isEmpty();
    assertThat(extractor.parse(null)).isEmpty();
  }

  @Test
  void proseAnswer_isAnError() {
    assertThatThrownBy(() -> extractor.parse("I found a stern thruster."))
        .isInstanceOf(IllegalStateException.class);
  }
}
