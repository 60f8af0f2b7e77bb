package com.knowledgechain.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.errors.BadRequestException;
import com.openai.errors.RateLimitException;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * OpenAI-compatible chat completion provider. Translates SDK errors into the gateway's taxonomy.
 */
@Slf4j
@Component
public class OpenAiLlmProvider implements LlmProvider {

    private final OpenAIClient openAIClient;
    private final String model;
    private final int maxTokens;

    public OpenAiLlmProvider(OpenAIClient openAIClient,
                             @Value("${openai.model}") String model,
                             @Value("${openai.max-tokens:1024}") int maxTokens) {
        this.openAIClient = openAIClient;
        this.model = model;
        this.maxTokens = maxTokens;
    }

    @Override
    public String complete(String prompt, double temperature) {
        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                .model(model)
                .temperature(temperature)
                .maxCompletionTokens(maxTokens)
                .addUserMessage(prompt)
                .build();

        ChatCompletion completion;
        try {
            completion = openAIClient.chat().completions().create(params);
        } catch (RateLimitException e) {
            throw new RateLimitedException(e.getMessage(), e);
        } catch (BadRequestException e) {
            if (isSafetyRejection(e.getMessage())) {
                throw new ContentBlockedException(e.getMessage(), e);
            }
            throw new LlmProviderException("LLM request rejected: " + e.getMessage(), e);
        } catch (Exception e) {
            log.error("[OpenAI] call failed [{}]", model, e);
            throw new LlmProviderException("LLM call failed: " + e.getMessage(), e);
        }

        completion.usage().ifPresent(usage ->
                log.debug("[OpenAI] token usage [{}] - prompt: {}, completion: {}",
                        model, usage.promptTokens(), usage.completionTokens()));

        ChatCompletion.Choice choice = completion.choices().stream()
                .findFirst()
                .orElseThrow(() -> new LlmProviderException("LLM response has no choices"));

        if (ChatCompletion.Choice.FinishReason.CONTENT_FILTER.equals(choice.finishReason())) {
            throw new ContentBlockedException("Response withheld by content filter");
        }

        return choice.message().content()
                .orElseThrow(() -> new LlmProviderException("LLM response has no content"))
                .trim();
    }

    @Override
    public String modelName() {
        return model;
    }

    static boolean isSafetyRejection(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("content_policy")
                || lower.contains("content management policy")
                || lower.contains("content_filter")
                || lower.contains("safety");
    }
}
