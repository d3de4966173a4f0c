package dev.postify.publish;

import dev.postify.model.PublishReceipt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Writes posts to the application log. Always part of a candidate's platforms
 * so every approved post is visible somewhere.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "publish.console.enabled", havingValue = "true", matchIfMissing = true)
public class ConsolePublisher implements Publisher {

    public static final String NAME = "console";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public Mono<PublishReceipt> publish(String text, String mediaUrl) {
        return Mono.fromSupplier(() -> {
            log.info("[console] {}{}", text, mediaUrl != null ? " | media: " + mediaUrl : "");
            return new PublishReceipt(NAME, null);
        });
    }
}
