package dev.reviewlens.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures the chat model that turns retrieved reviews into an answer.
 *
 * <p>Connection settings are externalised via {@code reviewlens.chat.*}. The request timeout is
 * enforced by the client; retries are applied one level up by
 * {@link dev.reviewlens.answer.AnswerGenerator}.
 */
@Configuration
public class ChatModelConfig {

    /**
     * Provides the OpenAI chat model.
     *
     * @param apiKey      OpenAI API key
     * @param modelName   chat model name (e.g. {@code gpt-4o-mini})
     * @param temperature sampling temperature
     * @param maxTokens   upper bound on answer length
     * @param timeout     per-request timeout
     * @return a ready-to-use chat model
     */
    @Bean
    public ChatModel chatModel(
            @Value("${reviewlens.chat.api-key}") String apiKey,
            @Value("${reviewlens.chat.model-name:gpt-4o-mini}") String modelName,
            @Value("${reviewlens.chat.temperature:0.7}") double temperature,
            @Value("${reviewlens.chat.max-tokens:500}") int maxTokens,
            @Value("${reviewlens.chat.timeout:30s}") Duration timeout) {
        return OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .timeout(timeout)
                .build();
    }
}
