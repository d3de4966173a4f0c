package dev.postify.rewrite;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.postify.entity.PostCandidate;
import dev.postify.entity.Tenant;
import dev.postify.model.RewrittenDraft;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Rewriter backed by an OpenAI-compatible chat completions API.
 * The tenant's tone and negative constraints go into the system prompt.
 */
@Slf4j
@Service
@ConditionalOnProperty(name = "app.ai.provider", havingValue = "openai")
public class OpenAiDraftRewriter implements DraftRewriter {

    static final String ATTR_TONE = "tone";
    static final String ATTR_NEGATIVE_CONSTRAINTS = "negative_constraints";

    private final WebClient webClient;
    private final String apiKey;
    private final String model;

    public OpenAiDraftRewriter(
            WebClient.Builder webClientBuilder,
            @Value("${app.ai.openai.api-key:}") String apiKey,
            @Value("${app.ai.openai.model:gpt-4o-mini}") String model,
            @Value("${app.ai.openai.base-url:https://api.openai.com/v1}") String baseUrl) {

        this.apiKey = apiKey;
        this.model = model;
        this.webClient = webClientBuilder
                .baseUrl(Objects.requireNonNull(baseUrl))
                .defaultHeader("Authorization", "Bearer " + apiKey)
                .defaultHeader("Content-Type", "application/json")
                .build();

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("OpenAI API key is missing! Rewrites will keep the original text.");
        } else {
            log.info("OpenAI rewrite enabled with model: {}", model);
        }
    }

    @Override
    public Mono<RewrittenDraft> rewrite(Tenant tenant, PostCandidate candidate, String instructions) {
        RewrittenDraft unchanged = new RewrittenDraft(candidate.getTextBody(), candidate.getTemplateKey());
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.just(unchanged);
        }

        ChatRequest request = new ChatRequest(model, List.of(
                new Message("system", systemPrompt(tenant)),
                new Message("user", userPrompt(candidate.getTextBody(), instructions))));

        return webClient.post()
                .uri("/chat/completions")
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError,
                        clientResponse -> clientResponse.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(errorBody -> {
                                    log.error("OpenAI API Error: {}", errorBody);
                                    return Mono.error(new IllegalStateException(
                                            "OpenAI error " + clientResponse.statusCode().value() + ": " + errorBody));
                                }))
                .bodyToMono(ChatResponse.class)
                .timeout(Duration.ofSeconds(60))
                .retryWhen(Retry.backoff(2, Duration.ofSeconds(2)).filter(this::isRetryableError))
                .map(response -> {
                    String content = extractContent(response);
                    if (content == null || content.isBlank()) {
                        log.warn("OpenAI returned no text for candidate {}", candidate.getId());
                        return unchanged;
                    }
                    return new RewrittenDraft(content.strip(), candidate.getTemplateKey());
                })
                .onErrorResume(e -> {
                    log.warn("OpenAI rewrite failed for candidate {}: {}", candidate.getId(), e.getMessage());
                    return Mono.just(unchanged);
                });
    }

    @Override
    public boolean isAiBacked() {
        return true;
    }

    String systemPrompt(Tenant tenant) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You write short social media posts for ").append(tenant.getName());
        if (tenant.getIndustry() != null) {
            prompt.append(", a ").append(tenant.getIndustry()).append(" business");
        }
        if (tenant.getCity() != null) {
            prompt.append(" in ").append(tenant.getCity());
        }
        prompt.append(".\n");

        String tone = tenant.attribute(ATTR_TONE);
        prompt.append("Tone: ").append(tone != null ? tone : "friendly and professional").append(".\n");

        String constraints = tenant.attribute(ATTR_NEGATIVE_CONSTRAINTS);
        if (constraints != null) {
            prompt.append("Never do the following: ").append(constraints).append(".\n");
        }
        prompt.append("Reply with the post text only, no quotes and no commentary.");
        return prompt.toString();
    }

    static String userPrompt(String text, String instructions) {
        if (instructions == null || instructions.isBlank()) {
            return "Write a fresh variant of this post with the same intent:\n\n" + text;
        }
        return "Rewrite this post following these instructions: " + instructions.strip() + "\n\n" + text;
    }

    private String extractContent(ChatResponse response) {
        if (response != null && response.choices() != null && !response.choices().isEmpty()
                && response.choices().get(0).message() != null) {
            return response.choices().get(0).message().content();
        }
        return null;
    }

    private boolean isRetryableError(Throwable e) {
        String message = e.getMessage();
        return message != null && (message.contains("429") || message.contains("503"));
    }

    // OpenAI compatible DTOs
    record ChatRequest(String model, List<Message> messages) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Message(String role, String content) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatResponse(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Choice(Message message) {
        }
    }
}
