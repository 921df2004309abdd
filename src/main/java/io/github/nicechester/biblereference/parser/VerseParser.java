package io.github.nicechester.biblereference.parser;

import io.github.nicechester.biblereference.metadata.BookMetadata;
import io.github.nicechester.biblereference.reference.ChapterReference;
import io.github.nicechester.biblereference.reference.ReferenceCollection;
import io.github.nicechester.biblereference.reference.ReferenceErrors;
import io.github.nicechester.biblereference.reference.VerseReference;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses verse lists such as "1-10, 15" into {@link VerseReference} objects.
 *
 * <pre>
 * verses = parser.parseVerses("1-10, 15");
 * verses.size();                   // 11
 * verses.first().get().getNumber(); // 1
 * verses.last().get().getNumber();  // 15
 * </pre>
 *
 * Commas and semicolons both separate verses, so "1;5;7" is the same as "1,5,7". Given book
 * metadata and a chapter number, every verse is also checked against the chapter's verse count.
 */
@Slf4j
public class VerseParser {

    public static final int DEFAULT_MAX_RANGE_SIZE = 10_000;

    // Everything except digits and - , ; : is noise.
    private static final Pattern NOISE = Pattern.compile("[^0-9:;,\\-]");

    // A range first, then a single verse.
    private static final Pattern VERSE = Pattern.compile(
        "(?<first>[0-9]+)-(?<last>[0-9]+)|(?<single>[0-9]+)");

    @Getter
    private final int maxRangeSize;

    public VerseParser() {
        this(DEFAULT_MAX_RANGE_SIZE);
    }

    public VerseParser(int maxRangeSize) {
        if (maxRangeSize < 1) {
            throw new IllegalArgumentException("maxRangeSize must be positive: " + maxRangeSize);
        }
        this.maxRangeSize = maxRangeSize;
    }

    public ReferenceCollection<VerseReference> parseVerses(String verses) {
        return parseVerses(verses, null, null);
    }

    public ReferenceCollection<VerseReference> parseVerses(int verse) {
        return parseVerses(String.valueOf(verse), null, null);
    }

    public ReferenceCollection<VerseReference> parseVerses(int verse, BookMetadata metadata, Integer chapterNumber) {
        return parseVerses(String.valueOf(verse), metadata, chapterNumber);
    }

    /**
     * Parse the verses in a string.
     *
     * @param verses        the verse list, e.g. "1-5, 10, 15-20"
     * @param metadata      book to validate against, or {@code null}
     * @param chapterNumber chapter to validate against; only used together with {@code metadata}
     */
    public ReferenceCollection<VerseReference> parseVerses(String verses, BookMetadata metadata, Integer chapterNumber) {
        ReferenceCollection<VerseReference> result = new ReferenceCollection<>();
        String slim = NOISE.matcher(verses == null ? "" : verses).replaceAll("");

        Matcher matcher = VERSE.matcher(slim);
        while (matcher.find()) {
            String single = matcher.group("single");
            if (single != null) {
                result.add(createVerse(single, metadata, chapterNumber));
                continue;
            }

            String range = matcher.group();
            int first = ReferenceNumbers.toInt(matcher.group("first"));
            int last = ReferenceNumbers.toInt(matcher.group("last"));
            long size = ReferenceNumbers.rangeSize(first, last);

            if (last < first) {
                result.addError(ReferenceErrors.invalidVerseRange(range));
            } else if (size > maxRangeSize) {
                log.warn("Verse range '{}' rejected: {} verses exceed the limit of {}", range, size, maxRangeSize);
                result.addError(ReferenceErrors.verseRangeTooLarge(range, maxRangeSize));
            } else {
                for (long i = 0; i < size; i++) {
                    result.add(createVerse((int) (first + i), metadata, chapterNumber));
                }
            }
        }

        log.debug("Parsed {} verses from '{}' ({} errors)", result.size(), verses, result.errors(false).size());
        return result;
    }

    /**
     * Parse the verses selected by a chapter reference. A chapter without raw content selects
     * every verse of the chapter when its book is known, and only the first verse otherwise.
     */
    public ReferenceCollection<VerseReference> parseVersesFor(ChapterReference chapter) {
        return versesFor(chapter.getRawContent(), chapter.getMetadata(), chapter.getNumber());
    }

    ReferenceCollection<VerseReference> versesFor(String rawContent, BookMetadata metadata, Integer chapterNumber) {
        if (rawContent != null) {
            return parseVerses(rawContent, metadata, chapterNumber);
        }
        if (metadata != null && chapterNumber != null) {
            return parseVerses("1-" + metadata.verseCount(chapterNumber), metadata, chapterNumber);
        }
        return parseVerses(1);
    }

    public VerseReference createVerse(String number, BookMetadata metadata, Integer chapterNumber) {
        return createVerse(ReferenceNumbers.toInt(number), metadata, chapterNumber);
    }

    /**
     * Create a verse, validating it against the chapter's verse count when both the metadata
     * and the chapter number are given.
     */
    public VerseReference createVerse(int number, BookMetadata metadata, Integer chapterNumber) {
        if (number < 1) {
            return VerseReference.invalid(ReferenceErrors.invalidVerseNumber(number));
        }
        if (metadata != null && chapterNumber != null && number > metadata.verseCount(chapterNumber)) {
            return VerseReference.invalid(ReferenceErrors.verseNotFound(number, metadata.name(), chapterNumber));
        }
        return VerseReference.valid(number);
    }
}
