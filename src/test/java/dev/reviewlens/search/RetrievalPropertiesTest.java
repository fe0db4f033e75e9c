package dev.reviewlens.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RetrievalPropertiesTest {

  @Test
  void defaults_match_documented_fusion_constants() {
    RetrievalProperties properties = new RetrievalProperties();
    properties.validate();

    assertThat(properties.getLexicalWeight()).isEqualTo(0.4);
    assertThat(properties.getVectorWeight()).isEqualTo(0.6);
    assertThat(properties.getStrategyMultiplier()).isEqualTo(5);
    assertThat(properties.getTopK()).isEqualTo(10);
  }

  @Test
  void phrase_boost_must_exceed_one() {
    RetrievalProperties properties = new RetrievalProperties();
    properties.setPhraseBoost(1.0);

    assertThatThrownBy(properties::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("phrase-boost");
  }

  @Test
  void top_k_out_of_range_is_rejected() {
    RetrievalProperties properties = new RetrievalProperties();
    properties.setTopK(0);

    assertThatThrownBy(properties::validate).isInstanceOf(IllegalStateException.class);
  }
}
