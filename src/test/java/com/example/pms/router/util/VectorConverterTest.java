package com.example.pms.router.util;

import com.example.pms.router.model.RecordType;
import com.pgvector.PGvector;
import org.junit.jupiter.api.Test;
import org.postgresql.util.PGobject;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VectorConverterTest {

  @Test
  void readsDriverRepresentations() throws Exception {
    PGobject obj = new PGobject();
    obj.setType("vector");
    obj.setValue("[0.5,1,2]");

    assertThat(VectorConverter.toFloatArray(obj)).containsExactly(0.5f, 1f, 2f);
    assertThat(VectorConverter.toFloatArray(" [3,4] ")).containsExactly(3f, 4f);
    assertThat(VectorConverter.toFloatArray(new PGvector(new float[]{1f, 2f}))).containsExactly(1f, 2f);
    assertThat(VectorConverter.toFloatArray(new float[]{7f})).containsExactly(7f);
  }

  @Test
  void missingValuesAreNull() {
    assertThat(VectorConverter.toFloatArray(null)).isNull();
    assertThat(VectorConverter.toFloatArray("  ")).isNull();
    assertThat(VectorConverter.toFloatArray(new float[0])).isNull();
  }

  @Test
  void malformedTextIsRejected() {
    assertThatThrownBy(() -> VectorConverter.toFloatArray("not a vector"))
        .isInstanceOf(RuntimeException.class);
  }

  @Test
  void onlyEmbeddedTablesAreReported() {
    assertThat(EntityTables.embeddingTable(RecordType.MANUAL)).contains("documents");
    assertThat(EntityTables.embeddingTable(RecordType.EMAIL)).isEmpty();
    assertThat(EntityTables.table(RecordType.SHOPPING_ITEM)).isEqualTo("shopping_list_items");
  }
}
