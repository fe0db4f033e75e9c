package dev.reviewlens.answer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.reviewlens.fixture.ReviewBuilder;
import dev.reviewlens.search.RankedReview;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@SuppressWarnings("NullAway.Init")
@ExtendWith(MockitoExtension.class)
class AnswerGeneratorTest {

  @Mock ChatModel chatModel;

  @Captor ArgumentCaptor<List<ChatMessage>> messagesCaptor;

  @InjectMocks AnswerGenerator answerGenerator;

  private static RankedReview ranked(String id, String text) {
    return new RankedReview(
        new ReviewBuilder()
            .id(id)
            .branch("Disneyland_Paris")
            .rating("5")
            .yearMonth("2019-4")
            .reviewerLocation("Australia")
            .text(text)
            .build(),
        0.5,
        0.5,
        0.5);
  }

  @Test
  void sends_system_and_user_messages_and_returns_answer() {
    when(chatModel.chat(messagesCaptor.capture()))
        .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("Mostly friendly.")).build());

    String answer =
        answerGenerator.generate("Is the staff friendly?", List.of(ranked("1", "Lovely staff")));

    assertThat(answer).isEqualTo("Mostly friendly.");
    List<ChatMessage> messages = messagesCaptor.getValue();
    assertThat(messages).hasSize(2);
    assertThat(((SystemMessage) messages.get(0)).text()).isEqualTo(AnswerGenerator.SYSTEM_PROMPT);
    assertThat(((UserMessage) messages.get(1)).singleText())
        .contains("Question: Is the staff friendly?")
        .contains("Review: Lovely staff");
  }

  @Test
  void context_blocks_list_review_fields_in_rank_order() {
    String context =
        AnswerGenerator.buildContext(List.of(ranked("1", "First"), ranked("2", "Second")));

    assertThat(context)
        .isEqualTo(
            "Review 1:\nPark: Disneyland_Paris\nRating: 5\nDate: 2019-4\n"
                + "Reviewer Location: Australia\nReview: First\n"
                + "\n---\n"
                + "Review 2:\nPark: Disneyland_Paris\nRating: 5\nDate: 2019-4\n"
                + "Reviewer Location: Australia\nReview: Second\n");
  }

  @Test
  void long_review_text_is_truncated() {
    String context = AnswerGenerator.buildContext(List.of(ranked("1", "x".repeat(800))));

    assertThat(context).contains("Review: " + "x".repeat(500) + "\n");
    assertThat(context).doesNotContain("x".repeat(501));
  }

  @Test
  void missing_attributes_are_shown_as_unknown() {
    RankedReview bare =
        new RankedReview(
            new ReviewBuilder().id("1").branch(null).rating(null).text("ok").build(), 0, 0, 0);

    assertThat(AnswerGenerator.buildContext(List.of(bare)))
        .contains("Park: unknown")
        .contains("Rating: unknown");
  }

  @Test
  void no_reviews_uses_placeholder_context() {
    assertThat(AnswerGenerator.userPrompt("q", List.of())).contains("No relevant reviews found.");
  }

  @Test
  void model_failure_is_wrapped() {
    when(chatModel.chat(anyList())).thenThrow(new RuntimeException("rate limited"));

    assertThatThrownBy(() -> answerGenerator.generate("q", List.of()))
        .isInstanceOf(AnswerGenerationException.class)
        .hasMessageContaining("rate limited")
        .hasCauseInstanceOf(RuntimeException.class);
    verify(chatModel).chat(anyList());
  }
}
