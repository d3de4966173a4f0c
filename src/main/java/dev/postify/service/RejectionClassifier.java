package dev.postify.service;

import dev.postify.model.RejectionBucket;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Keyword bucketing of free-text rejection reasons. Buckets are checked in
 * taxonomy order and the first match wins. Keywords match at the start of a
 * word, so "tone" does not fire on "stone".
 */
@Component
public class RejectionClassifier {

    private static final Map<RejectionBucket, List<Pattern>> KEYWORDS = new LinkedHashMap<>();

    static {
        register(RejectionBucket.TOO_SALESY,
                "salesy", "pushy", "too much selling", "hard sell", "promotional", "spammy", "advert", "sales pitch");
        register(RejectionBucket.WRONG_TONE,
                "tone", "formal", "casual", "cheesy", "voice", "emoji", "cringe", "off-brand", "off brand");
        register(RejectionBucket.OFF_TOPIC,
                "off topic", "off-topic", "irrelevant", "not relevant", "no longer relevant", "unrelated",
                "wrong industry", "not about");
        register(RejectionBucket.TOO_LONG,
                "too long", "shorten", "shorter", "wordy", "lengthy", "verbose", "too much text");
        register(RejectionBucket.TOO_SHORT,
                "too short", "be longer", "make it longer", "more detail", "not enough", "too thin", "lacks detail");
        register(RejectionBucket.REPETITIVE,
                "repetitive", "repeat", "same as", "duplicate", "already posted", "seen this", "boring");
    }

    private static void register(RejectionBucket bucket, String... keywords) {
        KEYWORDS.put(bucket, Arrays.stream(keywords)
                .map(k -> Pattern.compile("\\b" + Pattern.quote(k)))
                .toList());
    }

    public RejectionBucket classify(String reason) {
        if (reason == null || reason.isBlank()) {
            return RejectionBucket.UNSPECIFIED;
        }
        String text = reason.toLowerCase(Locale.ROOT);
        for (Map.Entry<RejectionBucket, List<Pattern>> entry : KEYWORDS.entrySet()) {
            for (Pattern keyword : entry.getValue()) {
                if (keyword.matcher(text).find()) {
                    return entry.getKey();
                }
            }
        }
        return RejectionBucket.OTHER;
    }
}
