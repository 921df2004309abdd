package io.github.nicechester.biblereference.parser;

import io.github.nicechester.biblereference.TestMetadata;
import io.github.nicechester.biblereference.metadata.BookMetadata;
import io.github.nicechester.biblereference.reference.ChapterReference;
import io.github.nicechester.biblereference.reference.ReferenceCollection;
import io.github.nicechester.biblereference.reference.VerseReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("VerseParser")
class VerseParserTest {

    private final VerseParser parser = new VerseParser();

    @Nested
    @DisplayName("parseVerses")
    class ParseVerses {

        @Test
        @DisplayName("expands ranges and keeps single verses in order")
        void rangesAndSingles() {
            ReferenceCollection<VerseReference> verses = parser.parseVerses("1-10, 15");

            assertThat(verses.size()).isEqualTo(11);
            assertThat(verses.first()).get().extracting(VerseReference::getNumber).isEqualTo(1);
            assertThat(verses.last()).get().extracting(VerseReference::getNumber).isEqualTo(15);
            assertThat(verses.noErrors()).isTrue();
        }

        @Test
        @DisplayName("treats semicolons like commas")
        void semicolons() {
            assertThat(parser.parseVerses("1;5;7").getReferences())
                .extracting(VerseReference::getNumber)
                .containsExactly(1, 5, 7);
        }

        @Test
        @DisplayName("ignores anything that is not a digit or separator")
        void ignoresNoise() {
            assertThat(parser.parseVerses(" vv. 3 - 5 , 9! ").getReferences())
                .extracting(VerseReference::getNumber)
                .containsExactly(3, 4, 5, 9);
        }

        @Test
        @DisplayName("keeps overlapping verses")
        void keepsOverlaps() {
            assertThat(parser.parseVerses("1-3,2").getReferences())
                .extracting(VerseReference::getNumber)
                .containsExactly(1, 2, 3, 2);
        }

        @Test
        @DisplayName("accepts a single number")
        void singleNumber() {
            assertThat(parser.parseVerses(5).getReferences())
                .extracting(VerseReference::getNumber)
                .containsExactly(5);
        }

        @Test
        @DisplayName("a range of one verse yields that verse")
        void oneVerseRange() {
            assertThat(parser.parseVerses("5-5").getReferences())
                .extracting(VerseReference::getNumber)
                .containsExactly(5);
        }

        @Test
        @DisplayName("null and blank input give an empty collection without errors")
        void emptyInput() {
            assertThat(parser.parseVerses((String) null).isEmpty()).isTrue();
            assertThat(parser.parseVerses("").isEmpty()).isTrue();
            assertThat(parser.parseVerses("abc").errors()).isEmpty();
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @Test
        @DisplayName("a reversed range adds no verses and a collection error")
        void reversedRange() {
            ReferenceCollection<VerseReference> verses = parser.parseVerses("2-1");

            assertThat(verses.isEmpty()).isTrue();
            assertThat(verses.errors()).containsExactly("'2-1' is an invalid range of verses");
        }

        @Test
        @DisplayName("scanning goes on after a reversed range")
        void continuesAfterReversedRange() {
            ReferenceCollection<VerseReference> verses = parser.parseVerses("2-1, 5");

            assertThat(verses.getReferences()).extracting(VerseReference::getNumber).containsExactly(5);
            assertThat(verses.errors()).containsExactly("'2-1' is an invalid range of verses");
        }

        @Test
        @DisplayName("verse 0 is kept as an invalid verse")
        void verseZero() {
            ReferenceCollection<VerseReference> verses = parser.parseVerses("0");

            assertThat(verses.size()).isEqualTo(1);
            assertThat(verses.get(0).isValidReference()).isFalse();
            assertThat(verses.errors()).containsExactly("The verse number '0' is not valid");
        }

        @Test
        @DisplayName("verses beyond the chapter are invalid")
        void beyondChapter() {
            ReferenceCollection<VerseReference> verses = parser.parseVerses("17-18", TestMetadata.book("Matthew"), 3);

            assertThat(verses.size()).isEqualTo(2);
            assertThat(verses.get(0).isValidReference()).isTrue();
            assertThat(verses.get(1).isValidReference()).isFalse();
            assertThat(verses.errors()).containsExactly("The verse '18' does not exist for Matthew 3");
        }

        @Test
        @DisplayName("the chapter number alone does not validate anything")
        void chapterWithoutMetadata() {
            assertThat(parser.parseVerses("500", null, 3).errors()).isEmpty();
        }

        @Test
        @DisplayName("numbers too large for an int are read as the largest int")
        void saturatesLargeNumbers() {
            assertThat(parser.parseVerses("99999999999").get(0).getNumber()).isEqualTo(Integer.MAX_VALUE);
            assertThat(parser.parseVerses("99999999999", TestMetadata.book("Jude"), 1).errors())
                .containsExactly("The verse '2147483647' does not exist for Jude 1");
        }
    }

    @Nested
    @DisplayName("range limit")
    class RangeLimit {

        @Test
        @DisplayName("rejects ranges longer than the limit")
        void rejectsLongRanges() {
            ReferenceCollection<VerseReference> verses = new VerseParser(100).parseVerses("1-101, 7");

            assertThat(verses.getReferences()).extracting(VerseReference::getNumber).containsExactly(7);
            assertThat(verses.errors()).containsExactly("'1-101' exceeds the maximum of 100 verses in a range");
        }

        @Test
        @DisplayName("accepts ranges at the limit")
        void acceptsRangeAtLimit() {
            assertThat(new VerseParser(100).parseVerses("1-100").size()).isEqualTo(100);
        }

        @Test
        @DisplayName("applies the default limit to huge ranges")
        void defaultLimit() {
            ReferenceCollection<VerseReference> verses = parser.parseVerses("1-999999999");

            assertThat(parser.getMaxRangeSize()).isEqualTo(VerseParser.DEFAULT_MAX_RANGE_SIZE);
            assertThat(verses.isEmpty()).isTrue();
            assertThat(verses.errors()).containsExactly("'1-999999999' exceeds the maximum of 10000 verses in a range");
        }

        @Test
        void limitMustBePositive() {
            assertThatThrownBy(() -> new VerseParser(0)).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("parseVersesFor")
    class ParseVersesFor {

        private final BookMetadata genesis = TestMetadata.book("Genesis");

        @Test
        @DisplayName("parses the chapter's own verse list")
        void usesRawContent() {
            ChapterReference chapter = ChapterReference.valid(1, "3-4", genesis, new ReferenceCollection<>());

            assertThat(parser.parseVersesFor(chapter).getReferences())
                .extracting(VerseReference::getNumber)
                .containsExactly(3, 4);
        }

        @Test
        @DisplayName("selects the whole chapter when no verses are listed")
        void wholeChapter() {
            ChapterReference chapter = ChapterReference.valid(1, null, genesis, new ReferenceCollection<>());

            ReferenceCollection<VerseReference> verses = parser.parseVersesFor(chapter);

            assertThat(verses.size()).isEqualTo(31);
            assertThat(verses.last()).get().extracting(VerseReference::getNumber).isEqualTo(31);
        }

        @Test
        @DisplayName("selects the first verse when the book is unknown")
        void firstVerseWithoutMetadata() {
            ChapterReference chapter = ChapterReference.valid(4, null, null, new ReferenceCollection<>());

            assertThat(parser.parseVersesFor(chapter).getReferences())
                .extracting(VerseReference::getNumber)
                .containsExactly(1);
        }
    }
}
