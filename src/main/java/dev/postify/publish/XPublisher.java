package dev.postify.publish;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import dev.postify.config.RotationProperties;
import dev.postify.exception.PublishException;
import dev.postify.model.PublishReceipt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Publishes text posts through the X API v2 ({@code POST /2/tweets}).
 * Media is linked rather than uploaded.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "publish.x.enabled", havingValue = "true")
public class XPublisher implements Publisher {

    public static final String NAME = "x";
    static final int MAX_LENGTH = 280;

    private final WebClient webClient;
    private final String bearerToken;
    private final RotationProperties rotationProperties;

    public XPublisher(
            WebClient.Builder webClientBuilder,
            RotationProperties rotationProperties,
            @Value("${publish.x.bearer-token:}") String bearerToken,
            @Value("${publish.x.base-url:https://api.x.com}") String baseUrl) {

        this.bearerToken = bearerToken;
        this.rotationProperties = rotationProperties;
        this.webClient = webClientBuilder
                .baseUrl(Objects.requireNonNull(baseUrl))
                .defaultHeader("Authorization", "Bearer " + bearerToken)
                .defaultHeader("Content-Type", "application/json")
                .build();

        if (!isEnabled()) {
            log.warn("X bearer token is missing! Publishing to X will fail outside dry run.");
        }
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        return bearerToken != null && !bearerToken.isBlank();
    }

    @Override
    public Mono<PublishReceipt> publish(String text, String mediaUrl) {
        String body = compose(text, mediaUrl);
        if (rotationProperties.isDryRun()) {
            log.info("[dry-run] Would post to X: {}", body);
            return Mono.just(new PublishReceipt(NAME, null));
        }
        if (!isEnabled()) {
            return Mono.error(new PublishException(NAME, "X bearer token not configured"));
        }

        return webClient.post()
                .uri("/2/tweets")
                .bodyValue(new TweetRequest(body))
                .retrieve()
                .onStatus(HttpStatusCode::isError,
                        response -> response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(errorBody -> Mono.error(new PublishException(NAME,
                                        "X API " + response.statusCode().value() + ": " + errorBody))))
                .bodyToMono(TweetResponse.class)
                .timeout(Duration.ofSeconds(30))
                .retryWhen(Retry.backoff(2, Duration.ofSeconds(2)).filter(this::isRetryableError))
                .map(response -> {
                    if (response.data() == null || response.data().id() == null) {
                        throw new PublishException(NAME, "X API returned no post id");
                    }
                    return new PublishReceipt(NAME, response.data().id());
                })
                .onErrorMap(e -> !(e instanceof PublishException),
                        e -> new PublishException(NAME, "X publish failed: " + e.getMessage(), e));
    }

    /**
     * Text plus media link, trimmed to the X length limit.
     */
    static String compose(String text, String mediaUrl) {
        String body = mediaUrl != null && !mediaUrl.isBlank() ? text + "\n" + mediaUrl : text;
        if (body.length() <= MAX_LENGTH) {
            return body;
        }
        return text.length() > MAX_LENGTH ? text.substring(0, MAX_LENGTH - 3) + "..." : text;
    }

    private boolean isRetryableError(Throwable e) {
        String message = e.getMessage();
        return message != null && (message.contains("X API 429") || message.contains("X API 503"));
    }

    record TweetRequest(String text) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TweetResponse(TweetData data) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record TweetData(String id, String text) {
        }
    }
}
