package dev.reviewlens.review;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class QueryFilterExtractorTest {

  private final QueryFilterExtractor extractor = new QueryFilterExtractor();

  @Test
  void recognises_branch_case_insensitively() {
    assertThat(extractor.extract("Is the staff in PARIS friendly?"))
        .containsExactly(AttributePredicate.contains(ReviewAttribute.BRANCH, "Paris"));
  }

  @Test
  void recognises_multi_word_branch() {
    assertThat(extractor.extract("How are the queues in Hong Kong?"))
        .containsExactly(AttributePredicate.contains(ReviewAttribute.BRANCH, "hongkong"));
  }

  @Test
  void combines_branch_and_reviewer_location() {
    List<AttributePredicate> predicates =
        extractor.extract("What do visitors from Australia think about California?");

    assertThat(predicates)
        .containsExactly(
            AttributePredicate.contains(ReviewAttribute.BRANCH, "California"),
            AttributePredicate.contains(ReviewAttribute.REVIEWER_LOCATION, "Australia"));
  }

  @Test
  void only_first_branch_is_used() {
    assertThat(extractor.extract("Compare Paris and Hong Kong"))
        .extracting(AttributePredicate::value)
        .containsExactly("hongkong");
  }

  @Test
  void question_without_known_places_yields_no_predicates() {
    assertThat(extractor.extract("Is the food expensive?")).isEmpty();
  }
}
