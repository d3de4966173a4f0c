package dev.postify.approval;

import dev.postify.approval.TelegramApprovalChannel.CallbackQuery;
import dev.postify.approval.TelegramApprovalChannel.TgMessage;
import dev.postify.approval.TelegramApprovalChannel.Update;
import dev.postify.config.ApprovalProperties;
import dev.postify.exception.ApprovalChannelException;
import dev.postify.model.Decision;
import dev.postify.service.RotationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pulls bot updates and turns them into decisions.
 * <ul>
 *   <li>Inline buttons: approve, reject, regenerate; customise asks for a reply.</li>
 *   <li>Reply to a preview: {@code reject <reason>} rejects, any other text customises.</li>
 *   <li>{@code /next-post <tenant id>} drafts a post for that tenant.</li>
 * </ul>
 * Updates from chats other than the configured one are ignored.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "approval.channel", havingValue = "telegram")
public class TelegramUpdatePoller {

    private final TelegramApprovalChannel channel;
    private final ApprovalCallbackHandler callbackHandler;
    private final RotationService rotationService;
    private final ApprovalProperties approvalProperties;

    private final AtomicLong offset = new AtomicLong(0);

    /**
     * Fetch and process one batch of updates.
     *
     * @return number of updates processed
     */
    public int pollOnce() {
        List<Update> updates;
        try {
            updates = channel.getUpdates(offset.get());
        } catch (ApprovalChannelException e) {
            log.warn("Telegram poll failed: {}", e.getMessage());
            return 0;
        }

        for (Update update : updates) {
            offset.accumulateAndGet(update.updateId() + 1, Math::max);
            try {
                process(update);
            } catch (RuntimeException e) {
                log.warn("Telegram update {} failed: {}", update.updateId(), e.getMessage(), e);
            }
        }
        return updates.size();
    }

    public Duration getPollInterval() {
        return approvalProperties.getTelegram().getPollInterval();
    }

    long getOffset() {
        return offset.get();
    }

    private void process(Update update) {
        if (update.callbackQuery() != null) {
            onCallback(update.callbackQuery());
        } else if (update.message() != null) {
            onMessage(update.message());
        }
    }

    private void onCallback(CallbackQuery callback) {
        channel.answerCallback(callback.id());
        TgMessage message = callback.message();
        if (message == null || !fromConfiguredChat(message)) {
            return;
        }
        String reference = TelegramApprovalChannel.reference(message.chat().id(), message.messageId());
        String data = callback.data() == null ? "" : callback.data();
        switch (data) {
            case TelegramApprovalChannel.CB_APPROVE -> callbackHandler.handle(reference, Decision.APPROVE, null);
            case TelegramApprovalChannel.CB_REJECT -> callbackHandler.handle(reference, Decision.REJECT, null);
            case TelegramApprovalChannel.CB_REGENERATE -> callbackHandler.handle(reference, Decision.REGENERATE, null);
            case TelegramApprovalChannel.CB_CUSTOMIZE -> channel.sendText(String.valueOf(message.chat().id()),
                    "Reply to the preview with your instructions, or with 'reject <reason>' to reject it.");
            default -> log.warn("Unknown Telegram callback '{}' for {}", data, reference);
        }
    }

    private void onMessage(TgMessage message) {
        String text = message.text();
        if (text == null || text.isBlank() || !fromConfiguredChat(message)) {
            return;
        }
        String chatId = String.valueOf(message.chat().id());

        if (text.startsWith("/")) {
            String[] parts = text.strip().split("\\s+", 2);
            String command = parts[0].split("@")[0].toLowerCase(Locale.ROOT);
            if (command.equals("/next-post") || command.equals("/next_post")) {
                requestDraft(chatId, parts.length > 1 ? parts[1].strip() : "");
                return;
            }
        }

        if (message.replyToMessage() == null) {
            log.debug("Ignoring Telegram message that is not a reply: {}", text);
            return;
        }
        String reference = TelegramApprovalChannel.reference(message.chat().id(),
                message.replyToMessage().messageId());
        String rejectReason = rejectReason(text);
        if (rejectReason != null) {
            callbackHandler.handle(reference, Decision.REJECT, rejectReason);
        } else {
            callbackHandler.handle(reference, Decision.CUSTOMIZE, text.strip());
        }
    }

    private void requestDraft(String chatId, String tenantId) {
        if (tenantId.isEmpty()) {
            channel.sendText(chatId, "Usage: /next-post <tenant id>");
            return;
        }
        try {
            rotationService.requestDraft(tenantId);
        } catch (IllegalArgumentException e) {
            channel.sendText(chatId, e.getMessage());
        }
    }

    private boolean fromConfiguredChat(TgMessage message) {
        String configured = approvalProperties.getTelegram().getChatId();
        boolean match = message.chat() != null && configured != null
                && configured.equals(String.valueOf(message.chat().id()));
        if (!match) {
            log.debug("Ignoring Telegram update from chat {}", message.chat() != null ? message.chat().id() : null);
        }
        return match;
    }

    /**
     * Reason text of a {@code reject ...} reply, "" for a bare reject, null if
     * the reply is not a rejection.
     */
    static String rejectReason(String text) {
        String trimmed = text.strip();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        String rest;
        if (lower.startsWith("/reject")) {
            rest = trimmed.substring("/reject".length());
        } else if (lower.startsWith("reject")) {
            rest = trimmed.substring("reject".length());
        } else {
            return null;
        }
        if (!rest.isEmpty() && Character.isLetterOrDigit(rest.charAt(0))) {
            // "rejected", "rejection" and the like are instructions, not commands
            return null;
        }
        return rest.replaceFirst("^[\\s:\\-]+", "").strip();
    }
}
