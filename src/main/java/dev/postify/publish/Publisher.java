package dev.postify.publish;

import dev.postify.model.PublishReceipt;
import reactor.core.publisher.Mono;

/**
 * Interface for social platform publishers.
 * Each supported network implements this interface.
 */
public interface Publisher {

    /**
     * Platform name as used in template and candidate platform lists (e.g. "x", "console").
     */
    String getName();

    /**
     * Publish a post.
     *
     * @param text     rendered post text
     * @param mediaUrl optional image url, may be null
     * @return receipt of the delivered post; errors are signalled as
     *         {@link dev.postify.exception.PublishException}
     */
    Mono<PublishReceipt> publish(String text, String mediaUrl);

    /**
     * Check if this publisher is configured and usable.
     */
    default boolean isEnabled() {
        return true;
    }
}
