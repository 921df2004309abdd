package io.github.nicechester.biblereference.parser;

import io.github.nicechester.biblereference.metadata.BookMetadata;
import io.github.nicechester.biblereference.reference.BookReference;
import io.github.nicechester.biblereference.reference.ChapterReference;
import io.github.nicechester.biblereference.reference.ReferenceCollection;
import io.github.nicechester.biblereference.reference.ReferenceErrors;
import io.github.nicechester.biblereference.reference.VerseReference;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses chapter lists such as "1:1-10, 2:5-7; 4-6" into {@link ChapterReference} objects,
 * each holding the verses selected for it.
 *
 * <pre>
 * chapters = parser.parseChapters("1:1-10, 5:6");
 * chapters.get(0).getNumber(); // 1
 * chapters.get(1).getNumber(); // 5
 * </pre>
 *
 * Book names in the input are ignored, so the chapters of a whole passage can be parsed too:
 * "Genesis 1:1-10; Mark 1:5-7" yields chapters 1 and 1. Given book metadata, every chapter is
 * also checked against the book's chapter count.
 */
@Slf4j
public class ChapterParser {

    private static final Pattern LETTERS = Pattern.compile("[a-zA-Z]+");

    private static final Pattern NOISE = Pattern.compile("[^0-9:;,\\-]");

    private static final Pattern CHAPTER_BEFORE_COLON = Pattern.compile("[0-9]+:");

    // Tried in order at each position: chapter with verses, chapter range, single chapter.
    private static final Pattern CHAPTER = Pattern.compile(
        "(?<chapter>[0-9]+):(?<verses>[0-9,\\-]+)"
            + "|(?<first>[0-9]+)-(?<last>[0-9]+)"
            + "|(?<single>[0-9]+)[,;]?");

    private static final Pattern TRAILING_NON_DIGITS = Pattern.compile("[^0-9]+$");

    private final VerseParser verseParser;

    @Getter
    private final int maxRangeSize;

    public ChapterParser(VerseParser verseParser) {
        this(verseParser, verseParser.getMaxRangeSize());
    }

    public ChapterParser(VerseParser verseParser, int maxRangeSize) {
        this.verseParser = Objects.requireNonNull(verseParser, "verseParser");
        if (maxRangeSize < 1) {
            throw new IllegalArgumentException("maxRangeSize must be positive: " + maxRangeSize);
        }
        this.maxRangeSize = maxRangeSize;
    }

    public ReferenceCollection<ChapterReference> parseChapters(String chapters) {
        return parseChapters(chapters, null);
    }

    public ReferenceCollection<ChapterReference> parseChapters(int chapter) {
        return parseChapters(String.valueOf(chapter), null);
    }

    public ReferenceCollection<ChapterReference> parseChapters(int chapter, BookMetadata metadata) {
        return parseChapters(String.valueOf(chapter), metadata);
    }

    /**
     * Parse the chapters in a string.
     *
     * @param chapters the chapter list, e.g. "1:5,8,11; 2:10, 5-20"
     * @param metadata book to validate against, or {@code null}
     */
    public ReferenceCollection<ChapterReference> parseChapters(String chapters, BookMetadata metadata) {
        ReferenceCollection<ChapterReference> result = new ReferenceCollection<>();
        String slim = prepare(chapters == null ? "" : chapters);

        Matcher matcher = CHAPTER.matcher(slim);
        while (matcher.find()) {
            String withVerses = matcher.group("chapter");
            if (withVerses != null) {
                String verses = stripTrailing(matcher.group("verses"));
                result.add(createChapter(ReferenceNumbers.toInt(withVerses), verses, metadata));
                continue;
            }

            String single = matcher.group("single");
            if (single != null) {
                result.add(createChapter(ReferenceNumbers.toInt(single), null, metadata));
                continue;
            }

            String range = matcher.group();
            int first = ReferenceNumbers.toInt(matcher.group("first"));
            int last = ReferenceNumbers.toInt(matcher.group("last"));
            long size = ReferenceNumbers.rangeSize(first, last);

            // A reversed chapter range selects nothing and is not reported.
            if (size > maxRangeSize) {
                log.warn("Chapter range '{}' rejected: {} chapters exceed the limit of {}", range, size, maxRangeSize);
                result.addError(ReferenceErrors.chapterRangeTooLarge(range, maxRangeSize));
            } else {
                for (long i = 0; i < size; i++) {
                    result.add(createChapter((int) (first + i), null, metadata));
                }
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("Parsed {} chapters from '{}' ({} errors)", result.size(), chapters, result.errors().size());
        }
        return result;
    }

    /**
     * Parse the chapters selected by a book reference. A book without raw content selects
     * its first chapter.
     */
    public ReferenceCollection<ChapterReference> parseChaptersFor(BookReference book) {
        return chaptersFor(book.getRawContent(), book.getMetadata());
    }

    ReferenceCollection<ChapterReference> chaptersFor(String rawContent, BookMetadata metadata) {
        if (rawContent == null) {
            return parseChapters(1, metadata);
        }
        return parseChapters(rawContent, metadata);
    }

    public ChapterReference createChapter(String number, String rawContent, BookMetadata metadata) {
        return createChapter(ReferenceNumbers.toInt(number), rawContent, metadata);
    }

    /**
     * Create a chapter and parse its verses. An invalid chapter gets an error and no verses.
     *
     * @param rawContent the verses selected, e.g. "1-10"; {@code null} for the whole chapter
     */
    public ChapterReference createChapter(int number, String rawContent, BookMetadata metadata) {
        if (number < 1) {
            return ChapterReference.invalid(metadata, ReferenceErrors.invalidChapterNumber(number));
        }
        if (metadata != null && number > metadata.chapterCount()) {
            return ChapterReference.invalid(metadata, ReferenceErrors.chapterNotFound(number, metadata.name()));
        }
        ReferenceCollection<VerseReference> verses = verseParser.versesFor(rawContent, metadata, number);
        return ChapterReference.valid(number, rawContent, metadata, verses);
    }

    /**
     * Letters become separators so "Genesis 1 Exodus 1" does not collapse into "11"; everything
     * but digits and - , ; : is dropped; and a separator goes in front of each chapter that is
     * followed by a colon, so "1:5,10,5:10" reads as 1:5,10 then 5:10 rather than 1:5,10,5.
     */
    private String prepare(String chapters) {
        String slim = LETTERS.matcher(chapters).replaceAll(";");
        slim = NOISE.matcher(slim).replaceAll("");
        return CHAPTER_BEFORE_COLON.matcher(slim).replaceAll(";$0");
    }

    // "1:," keeps "" as its verse list, which selects no verses.
    private static String stripTrailing(String content) {
        return TRAILING_NON_DIGITS.matcher(content).replaceAll("");
    }
}
