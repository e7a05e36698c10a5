package de.bsommerfeld.channelstore.core.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ForbiddenWordsTest {

    private static final Channel CHANNEL = Channel.draft("news", "https://x", List.of(), List.of("spam", "ads"))
            .withId(1);

    @Test
    void effective_shouldUnionChannelAndSourceWords() {
        var source = Source.draft(1, "https://feed", false, List.of("crypto", "spam")).withId(10);

        Set<String> effective = ForbiddenWords.effective(CHANNEL, source);

        assertEquals(List.of("spam", "ads", "crypto"), new ArrayList<>(effective));
    }

    @Test
    void effective_shouldKeepChannelWordsWhenSourceHasNone() {
        var source = Source.draft(1, "https://feed", false, List.of()).withId(10);

        assertEquals(CHANNEL.forbiddenWords(), ForbiddenWords.effective(CHANNEL, source));
    }

    @Test
    void effective_shouldRejectForeignSource() {
        var source = Source.draft(2, "https://feed", false, List.of()).withId(10);

        assertThrows(IllegalArgumentException.class, () -> ForbiddenWords.effective(CHANNEL, source));
    }

    @Test
    void firstMatch_shouldReturnFirstContainedWord() {
        assertEquals("ads", ForbiddenWords.firstMatch(Set.of("ads"), "free ads inside"));
        assertNull(ForbiddenWords.firstMatch(Set.of("ads"), "clean text"));
    }

    @Test
    void firstMatch_shouldBeCaseSensitive() {
        assertNull(ForbiddenWords.firstMatch(Set.of("spam"), "SPAM"));
    }

    @Test
    void firstMatch_shouldHandleEmptyInput() {
        assertNull(ForbiddenWords.firstMatch(Set.of("spam"), null));
        assertNull(ForbiddenWords.firstMatch(Set.of("spam"), ""));
    }
}
