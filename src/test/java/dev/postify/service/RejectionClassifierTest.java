package dev.postify.service;

import dev.postify.model.RejectionBucket;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class RejectionClassifierTest {

    private final RejectionClassifier classifier = new RejectionClassifier();

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource(delimiter = '|', value = {
            "Too pushy, feels salesy | TOO_SALESY",
            "Way too long for X | TOO_LONG",
            "Please shorten it | TOO_LONG",
            "Needs more detail | TOO_SHORT",
            "This is off topic for a plumber | OFF_TOPIC",
            "We already posted this last week | REPETITIVE",
            "Tone is too formal | WRONG_TONE",
            "Could be longer, add an example | TOO_SHORT",
            "Offer is no longer relevant | OFF_TOPIC",
            "Photo of a stone wall, meh | OTHER",
            "I just don't like it | OTHER"
    })
    @DisplayName("Should bucket reasons by keyword")
    void shouldBucketReasons(String reason, RejectionBucket expected) {
        assertThat(classifier.classify(reason)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    @DisplayName("Should mark missing reasons as unspecified")
    void shouldMarkMissingAsUnspecified(String reason) {
        assertThat(classifier.classify(reason)).isEqualTo(RejectionBucket.UNSPECIFIED);
    }

    @Test
    @DisplayName("Should let the first matching bucket win")
    void shouldLetFirstBucketWin() {
        assertThat(classifier.classify("Salesy and too long")).isEqualTo(RejectionBucket.TOO_SALESY);
    }

    @Test
    @DisplayName("Should check tone before length")
    void shouldCheckToneBeforeLength() {
        assertThat(classifier.classify("Too long and the tone is off")).isEqualTo(RejectionBucket.WRONG_TONE);
    }

    @Test
    @DisplayName("Should ignore case")
    void shouldIgnoreCase() {
        assertThat(classifier.classify("WORDY")).isEqualTo(RejectionBucket.TOO_LONG);
    }
}
