package com.example.pms.router.refresh;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LangChain4jEmbeddingProviderTest {

  private final EmbeddingModel model = mock(EmbeddingModel.class);

  @Test
  void returnsVectorOfExpectedDimension() {
    when(model.embed("impeller")).thenReturn(Response.from(Embedding.from(new float[]{0.5f, 0.5f, 0.1f})));

    assertThat(new LangChain4jEmbeddingProvider(model, 3).embed("impeller")).containsExactly(0.5f, 0.5f, 0.1f);
  }

  @Test
  void wrongDimensionIsRejected() {
    when(model.embed("impeller")).thenReturn(Response.from(Embedding.from(new float[]{0.5f, 0.5f})));

    assertThatThrownBy(() -> new LangChain4jEmbeddingProvider(model, 3).embed("impeller"))
        .isInstanceOf(InvalidEmbeddingException.class)
        .hasMessageContaining("dimension 2");
  }

  @Test
  void emptyVectorIsRejected() {
    when(model.embed("impeller")).thenReturn(Response.from(Embedding.from(new float[0])));

    assertThatThrownBy(() -> new LangChain4jEmbeddingProvider(model, 0).embed("impeller"))
        .isInstanceOf(InvalidEmbeddingException.class);
  }
}
