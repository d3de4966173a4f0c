package dev.postify.approval;

import dev.postify.approval.TelegramApprovalChannel.CallbackQuery;
import dev.postify.approval.TelegramApprovalChannel.TgChat;
import dev.postify.approval.TelegramApprovalChannel.TgMessage;
import dev.postify.approval.TelegramApprovalChannel.Update;
import dev.postify.config.ApprovalProperties;
import dev.postify.exception.ApprovalChannelException;
import dev.postify.model.Decision;
import dev.postify.service.RotationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TelegramUpdatePollerTest {

    private static final TgChat CHAT = new TgChat(100);
    private static final TgMessage PREVIEW = new TgMessage(55, CHAT, "preview", null);

    @Mock
    private TelegramApprovalChannel channel;

    @Mock
    private ApprovalCallbackHandler callbackHandler;

    @Mock
    private RotationService rotationService;

    private TelegramUpdatePoller poller;

    @BeforeEach
    void setUp() {
        ApprovalProperties properties = new ApprovalProperties();
        properties.getTelegram().setChatId("100");
        poller = new TelegramUpdatePoller(channel, callbackHandler, rotationService, properties);
    }

    private static Update callback(long updateId, String data, TgMessage message) {
        return new Update(updateId, null, new CallbackQuery("cb-" + updateId, data, message));
    }

    private static Update reply(long updateId, String text) {
        return new Update(updateId, new TgMessage(60, CHAT, text, PREVIEW), null);
    }

    @Nested
    @DisplayName("Button callbacks")
    class CallbackTests {

        @Test
        @DisplayName("Should map buttons to decisions and advance the offset")
        void shouldMapButtons() {
            when(channel.getUpdates(0)).thenReturn(List.of(
                    callback(10, "approve", PREVIEW),
                    callback(11, "regen", PREVIEW)));

            int processed = poller.pollOnce();

            assertThat(processed).isEqualTo(2);
            assertThat(poller.getOffset()).isEqualTo(12);
            verify(channel).answerCallback("cb-10");
            verify(callbackHandler).handle("100:55", Decision.APPROVE, null);
            verify(callbackHandler).handle("100:55", Decision.REGENERATE, null);
        }

        @Test
        @DisplayName("Should ask for a reply on customise")
        void shouldAskForReplyOnCustomise() {
            when(channel.getUpdates(0)).thenReturn(List.of(callback(10, "custom", PREVIEW)));

            poller.pollOnce();

            verify(channel).sendText(eq("100"), contains("Reply to the preview"));
            verify(callbackHandler, never()).handle(anyString(), any(), any());
        }

        @Test
        @DisplayName("Should ignore callbacks from other chats")
        void shouldIgnoreOtherChats() {
            TgMessage foreign = new TgMessage(55, new TgChat(999), "preview", null);
            when(channel.getUpdates(0)).thenReturn(List.of(callback(10, "approve", foreign)));

            poller.pollOnce();

            verify(callbackHandler, never()).handle(anyString(), any(), any());
        }
    }

    @Nested
    @DisplayName("Text messages")
    class MessageTests {

        @Test
        @DisplayName("Should reject with the reason from a reply")
        void shouldRejectFromReply() {
            when(channel.getUpdates(0)).thenReturn(List.of(reply(10, "reject: too salesy")));

            poller.pollOnce();

            verify(callbackHandler).handle("100:55", Decision.REJECT, "too salesy");
        }

        @Test
        @DisplayName("Should customise from any other reply")
        void shouldCustomiseFromReply() {
            when(channel.getUpdates(0)).thenReturn(List.of(reply(10, "  mention our winter special ")));

            poller.pollOnce();

            verify(callbackHandler).handle("100:55", Decision.CUSTOMIZE, "mention our winter special");
        }

        @Test
        @DisplayName("Should draft a post on /next-post")
        void shouldDraftOnNextPost() {
            Update update = new Update(10, new TgMessage(61, CHAT, "/next-post acme", null), null);
            when(channel.getUpdates(0)).thenReturn(List.of(update));

            poller.pollOnce();

            verify(rotationService).requestDraft("acme");
        }

        @Test
        @DisplayName("Should report an unknown tenant back to the chat")
        void shouldReportUnknownTenant() {
            Update update = new Update(10, new TgMessage(61, CHAT, "/next_post ghost", null), null);
            when(channel.getUpdates(0)).thenReturn(List.of(update));
            when(rotationService.requestDraft("ghost"))
                    .thenThrow(new IllegalArgumentException("Tenant 'ghost' not found"));

            poller.pollOnce();

            verify(channel).sendText("100", "Tenant 'ghost' not found");
        }

        @Test
        @DisplayName("Should ignore messages that are not replies")
        void shouldIgnorePlainMessages() {
            Update update = new Update(10, new TgMessage(61, CHAT, "hello", null), null);
            when(channel.getUpdates(0)).thenReturn(List.of(update));

            poller.pollOnce();

            verify(callbackHandler, never()).handle(anyString(), any(), any());
        }
    }

    @Test
    @DisplayName("Should survive a failed poll")
    void shouldSurviveFailedPoll() {
        when(channel.getUpdates(0)).thenThrow(new ApprovalChannelException("timeout"));

        assertThat(poller.pollOnce()).isZero();
        assertThat(poller.getOffset()).isZero();
    }

    @ParameterizedTest(name = "\"{0}\" -> \"{1}\"")
    @CsvSource(delimiter = '|', value = {
            "reject too salesy | too salesy",
            "Reject: wrong tone | wrong tone",
            "/reject - off topic | off topic",
            "reject | ''"
    })
    @DisplayName("Should extract the rejection reason")
    void shouldExtractRejectReason(String text, String expected) {
        assertThat(TelegramUpdatePoller.rejectReason(text)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"rejected offers are fine, keep them", "make it shorter", "rejection is not the goal"})
    @DisplayName("Should not treat ordinary instructions as a rejection")
    void shouldNotTreatInstructionsAsRejection(String text) {
        assertThat(TelegramUpdatePoller.rejectReason(text)).isNull();
    }
}
