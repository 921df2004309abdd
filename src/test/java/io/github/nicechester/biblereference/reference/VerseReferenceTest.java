package io.github.nicechester.biblereference.reference;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("VerseReference")
class VerseReferenceTest {

    @Test
    void validVerse() {
        VerseReference verse = VerseReference.valid(16);

        assertThat(verse.isValidReference()).isTrue();
        assertThat(verse.getNumber()).isEqualTo(16);
        assertThat(verse.children()).isEmpty();
        assertThat(verse.clean()).isEmpty();
    }

    @Test
    void invalidVerse() {
        VerseReference verse = VerseReference.invalid("The verse number '0' is not valid");

        assertThat(verse.isValidReference()).isFalse();
        assertThat(verse.getNumber()).isNull();
        assertThat(verse.errors()).containsExactly("The verse number '0' is not valid");
    }

    @Test
    @DisplayName("a verse has no children, so both error views are the same")
    void errorsIgnoreChildrenFlag() {
        VerseReference verse = VerseReference.invalid("bad");

        assertThat(verse.errors(false)).isEqualTo(verse.errors(true));
    }
}
