package io.github.nicechester.biblereference.service;

import io.github.nicechester.biblereference.metadata.BookMetadata;
import io.github.nicechester.biblereference.model.BookResult;
import io.github.nicechester.biblereference.model.ChapterResult;
import io.github.nicechester.biblereference.model.ParseResponse;
import io.github.nicechester.biblereference.parser.BookParser;
import io.github.nicechester.biblereference.parser.ChapterParser;
import io.github.nicechester.biblereference.parser.VerseParser;
import io.github.nicechester.biblereference.reference.BookReference;
import io.github.nicechester.biblereference.reference.ChapterReference;
import io.github.nicechester.biblereference.reference.ReferenceCollection;
import io.github.nicechester.biblereference.reference.VerseReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry points for parsing passages.
 *
 * <p>Every parse method returns a populated collection and never throws for malformed input:
 * problems are recorded as errors on the reference that found them.
 * <pre>
 * books = service.parse("Gen. 1:15-18, 21; Matt 1");
 * books.get(0).getName();                                    // "Genesis"
 * books.get(0).getChapterReferences().get(1).getNumber();    // 21
 * books.get(1).getChapterReferences().get(0).verseNumbers(); // [1, 2, ..., 25]
 * </pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReferenceParserService {

    private final BookParser bookParser;
    private final ChapterParser chapterParser;
    private final VerseParser verseParser;

    public ReferenceCollection<BookReference> parse(String passage) {
        return parseBooks(passage);
    }

    public ReferenceCollection<BookReference> parseBooks(String passage) {
        return bookParser.parseBooks(passage);
    }

    public ReferenceCollection<ChapterReference> parseChapters(String chapters) {
        return chapterParser.parseChapters(chapters);
    }

    public ReferenceCollection<ChapterReference> parseChapters(int chapter) {
        return chapterParser.parseChapters(chapter);
    }

    public ReferenceCollection<ChapterReference> parseChapters(String chapters, BookMetadata metadata) {
        return chapterParser.parseChapters(chapters, metadata);
    }

    public ReferenceCollection<ChapterReference> parseChapters(int chapter, BookMetadata metadata) {
        return chapterParser.parseChapters(chapter, metadata);
    }

    public ReferenceCollection<ChapterReference> parseChaptersFor(BookReference book) {
        return chapterParser.parseChaptersFor(book);
    }

    public ReferenceCollection<VerseReference> parseVerses(String verses) {
        return verseParser.parseVerses(verses);
    }

    public ReferenceCollection<VerseReference> parseVerses(int verse) {
        return verseParser.parseVerses(verse);
    }

    public ReferenceCollection<VerseReference> parseVerses(String verses, BookMetadata metadata, Integer chapterNumber) {
        return verseParser.parseVerses(verses, metadata, chapterNumber);
    }

    public ReferenceCollection<VerseReference> parseVerses(int verse, BookMetadata metadata, Integer chapterNumber) {
        return verseParser.parseVerses(verse, metadata, chapterNumber);
    }

    public ReferenceCollection<VerseReference> parseVersesFor(ChapterReference chapter) {
        return verseParser.parseVersesFor(chapter);
    }

    /**
     * Parse a passage and render it for the REST API.
     *
     * @param clean whether to move invalid references out of the result first
     */
    public ParseResponse parseForResponse(String passage, boolean clean) {
        long startTime = System.currentTimeMillis();

        try {
            ReferenceCollection<BookReference> books = parseBooks(passage);
            // Collected before cleaning: cleaning moves references but the errors stay reachable.
            List<String> errors = books.errors();
            if (clean) {
                int removed = books.clean().size();
                log.debug("Cleaned {} invalid references from '{}'", removed, passage);
            }

            List<BookResult> bookResults = books.stream()
                .map(this::toBookResult)
                .toList();

            long duration = System.currentTimeMillis() - startTime;
            log.info("Parsed '{}' into {} books with {} errors in {}ms",
                passage, bookResults.size(), errors.size(), duration);

            return ParseResponse.success(passage, bookResults, books.getInvalidReferences().size(), errors, duration);

        } catch (Exception e) {
            log.error("Parsing failed for passage: {}", passage, e);
            return ParseResponse.error(passage, "Parsing failed: " + e.getMessage());
        }
    }

    BookResult toBookResult(BookReference book) {
        List<ChapterResult> chapters = book.getChapterReferences() == null
            ? List.of()
            : book.getChapterReferences().stream().map(this::toChapterResult).toList();

        return BookResult.builder()
            .name(book.getName())
            .shortName(book.getShortName())
            .token(book.getToken())
            .rawContent(book.getRawContent())
            .valid(book.isValidReference())
            .chapters(chapters)
            .errors(book.errors(false))
            .build();
    }

    ChapterResult toChapterResult(ChapterReference chapter) {
        return ChapterResult.builder()
            .number(chapter.getNumber())
            .rawContent(chapter.getRawContent())
            .valid(chapter.isValidReference())
            .verses(chapter.verseNumbers())
            .errors(chapter.errors(false))
            .build();
    }
}
