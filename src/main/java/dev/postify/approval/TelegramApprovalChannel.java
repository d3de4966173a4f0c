package dev.postify.approval;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.postify.config.ApprovalProperties;
import dev.postify.exception.ApprovalChannelException;
import dev.postify.model.CandidateStatus;
import dev.postify.model.CandidateSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Approval through a Telegram bot: previews are sent with inline buttons and
 * edited in place when the text changes.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "approval.channel", havingValue = "telegram")
public class TelegramApprovalChannel implements ApprovalChannel {

    public static final String CB_APPROVE = "approve";
    public static final String CB_REJECT = "reject";
    public static final String CB_REGENERATE = "regen";
    public static final String CB_CUSTOMIZE = "custom";

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(15);

    private final WebClient webClient;
    private final ApprovalProperties.Telegram telegram;

    public TelegramApprovalChannel(WebClient.Builder webClientBuilder, ApprovalProperties approvalProperties) {
        this.telegram = approvalProperties.getTelegram();
        if (telegram.getBotToken() == null || telegram.getBotToken().isBlank()) {
            log.warn("Telegram bot token is missing! Approval previews will fail and fall back to direct publish.");
        }
        this.webClient = webClientBuilder
                .baseUrl(Objects.requireNonNull(telegram.getBaseUrl()) + "/bot" + telegram.getBotToken())
                .defaultHeader("Content-Type", "application/json")
                .build();
    }

    @Override
    public String getName() {
        return "telegram";
    }

    @Override
    public String notify(CandidateSummary summary) {
        if (telegram.getChatId() == null || telegram.getChatId().isBlank()) {
            throw new ApprovalChannelException("Telegram chat id not configured");
        }
        SendMessage request = new SendMessage(telegram.getChatId(), null, previewText(summary), keyboard());
        TgMessage message = call("sendMessage", request);
        String reference = reference(message.chat().id(), message.messageId());
        log.info("Sent preview for candidate {} to Telegram ({})", summary.candidateId(), reference);
        return reference;
    }

    @Override
    public void refresh(String reference, CandidateSummary summary) {
        String[] parts = splitReference(reference);
        call("editMessageText", new SendMessage(parts[0], Long.parseLong(parts[1]),
                previewText(summary), keyboard()));
    }

    @Override
    public void resolved(String reference, CandidateStatus status) {
        String[] parts = splitReference(reference);
        String label = switch (status) {
            case APPROVED -> "Published";
            case REJECTED -> "Rejected";
            case CANCELLED -> "Cancelled";
            case TIMEOUT -> "Timed out";
            case PENDING -> "Pending";
        };
        try {
            call("editMessageReplyMarkup", new SendMessage(parts[0], Long.parseLong(parts[1]), null,
                    Map.of("inline_keyboard", List.of())));
            sendText(parts[0], label + " (" + reference + ")");
        } catch (ApprovalChannelException e) {
            log.warn("Could not mark {} as {}: {}", reference, status, e.getMessage());
        }
    }

    /**
     * Long-poll for updates newer than {@code offset}.
     */
    public List<Update> getUpdates(long offset) {
        UpdatesResponse response = webClient.post()
                .uri("/getUpdates")
                .bodyValue(Map.of("offset", offset, "timeout", telegram.getPollTimeoutSeconds(),
                        "allowed_updates", List.of("message", "callback_query")))
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toChannelError)
                .bodyToMono(UpdatesResponse.class)
                .timeout(Duration.ofSeconds(telegram.getPollTimeoutSeconds() + 10L))
                .onErrorMap(e -> !(e instanceof ApprovalChannelException),
                        e -> new ApprovalChannelException("Telegram getUpdates failed: " + e.getMessage(), e))
                .block();
        if (response == null || !response.ok() || response.result() == null) {
            return List.of();
        }
        return response.result();
    }

    public void answerCallback(String callbackQueryId) {
        try {
            webClient.post()
                    .uri("/answerCallbackQuery")
                    .bodyValue(Map.of("callback_query_id", callbackQueryId))
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(REQUEST_TIMEOUT)
                    .block();
        } catch (RuntimeException e) {
            log.debug("answerCallbackQuery failed: {}", e.getMessage());
        }
    }

    public void sendText(String chatId, String text) {
        call("sendMessage", new SendMessage(chatId, null, text, null));
    }

    public static String reference(long chatId, long messageId) {
        return chatId + ":" + messageId;
    }

    static String previewText(CandidateSummary summary) {
        StringBuilder text = new StringBuilder();
        text.append("🏢 ").append(summary.tenantName());
        if (summary.industry() != null && !summary.industry().isBlank()) {
            text.append(" (").append(summary.industry()).append(")");
        }
        if (summary.city() != null && !summary.city().isBlank()) {
            text.append("\n📍 ").append(summary.city());
        }
        text.append("\n🗂 ").append(summary.templateKey()).append(" · ").append(summary.category())
                .append(" → ").append(String.join(", ", summary.platforms()));
        text.append("\n\n").append(summary.text());
        if (summary.mediaUrl() != null) {
            text.append("\n\n🖼 ").append(summary.mediaUrl());
        }
        return text.toString();
    }

    static Map<String, Object> keyboard() {
        return Map.of("inline_keyboard", List.of(List.of(
                Map.of("text", "Approve ✅", "callback_data", CB_APPROVE),
                Map.of("text", "Reject ❌", "callback_data", CB_REJECT),
                Map.of("text", "Regenerate 🔁", "callback_data", CB_REGENERATE),
                Map.of("text", "Customise ✏️", "callback_data", CB_CUSTOMIZE))));
    }

    private TgMessage call(String method, SendMessage request) {
        MessageResponse response = webClient.post()
                .uri("/" + method)
                .bodyValue(request)
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toChannelError)
                .bodyToMono(MessageResponse.class)
                .timeout(REQUEST_TIMEOUT)
                .onErrorMap(e -> !(e instanceof ApprovalChannelException),
                        e -> new ApprovalChannelException("Telegram " + method + " failed: " + e.getMessage(), e))
                .block();
        if (response == null || !response.ok()) {
            throw new ApprovalChannelException("Telegram " + method + " failed: "
                    + (response != null ? response.description() : "empty response"));
        }
        return response.result();
    }

    private Mono<? extends Throwable> toChannelError(ClientResponse response) {
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new ApprovalChannelException(
                        "Telegram API " + response.statusCode().value() + ": " + body));
    }

    private static String[] splitReference(String reference) {
        int colon = reference == null ? -1 : reference.lastIndexOf(':');
        if (colon <= 0 || colon == reference.length() - 1) {
            throw new ApprovalChannelException("Malformed Telegram reference: " + reference);
        }
        return new String[]{reference.substring(0, colon), reference.substring(colon + 1)};
    }

    // Telegram Bot API DTOs
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SendMessage(
            @JsonProperty("chat_id") String chatId,
            @JsonProperty("message_id") Long messageId,
            String text,
            @JsonProperty("reply_markup") Map<String, Object> replyMarkup) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record MessageResponse(boolean ok, TgMessage result, String description) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record UpdatesResponse(boolean ok, List<Update> result) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Update(
            @JsonProperty("update_id") long updateId,
            TgMessage message,
            @JsonProperty("callback_query") CallbackQuery callbackQuery) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CallbackQuery(String id, String data, TgMessage message) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TgMessage(
            @JsonProperty("message_id") long messageId,
            TgChat chat,
            String text,
            @JsonProperty("reply_to_message") TgMessage replyToMessage) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TgChat(long id) {
    }
}
