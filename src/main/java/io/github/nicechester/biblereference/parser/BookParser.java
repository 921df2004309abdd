package io.github.nicechester.biblereference.parser;

import io.github.nicechester.biblereference.metadata.BookMetadata;
import io.github.nicechester.biblereference.metadata.MetadataProvider;
import io.github.nicechester.biblereference.reference.BookReference;
import io.github.nicechester.biblereference.reference.ChapterReference;
import io.github.nicechester.biblereference.reference.ReferenceCollection;
import io.github.nicechester.biblereference.reference.ReferenceErrors;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a passage such as "Matt. 1:1-10, Revelation 5:6-11, Luke 7:7" into one
 * {@link BookReference} per book, each holding its chapters and verses.
 *
 * <p>Examples of what it accepts:
 * <ul>
 *   <li>"Gen. 1-5, Ex. 7:14"</li>
 *   <li>"Genesis 1:1-15, 2:12, Exod. 7:14"</li>
 *   <li>"gen 5, exodus" (a book without chapters means chapter 1)</li>
 *   <li>"gen. 1-5, gen 9:1" (two separate references to Genesis)</li>
 *   <li>"[rev1:15], [daniel  12: 1]" (whitespace and other punctuation are ignored)</li>
 * </ul>
 */
@Slf4j
public class BookParser {

    private static final Pattern NOISE = Pattern.compile("[^0-9a-zA-Z:;,\\-]");

    /*
     * name:    an optional digit ("1 Samuel") then letters.
     * content: everything up to the next letter, except a last character that is directly
     *          followed by a letter. In "Matt. 1:1, 2 Sam 1:1" the "2" belongs to the next book.
     *          Optional: "John" on its own means "John 1".
     */
    private static final Pattern BOOK = Pattern.compile(
        "(?<name>[0-9]?[a-zA-Z]+)(?<content>[^a-zA-Z]+(?![a-zA-Z]))?");

    private static final Pattern TRAILING_NON_DIGITS = Pattern.compile("[^0-9]+$");

    private final MetadataProvider metadataProvider;
    private final ChapterParser chapterParser;

    public BookParser(MetadataProvider metadataProvider, ChapterParser chapterParser) {
        this.metadataProvider = Objects.requireNonNull(metadataProvider, "metadataProvider");
        this.chapterParser = Objects.requireNonNull(chapterParser, "chapterParser");
    }

    /**
     * Parse the books in a passage. A passage without any book gets a collection-level error.
     */
    public ReferenceCollection<BookReference> parseBooks(String passage) {
        String text = passage == null ? "" : passage;
        ReferenceCollection<BookReference> books = new ReferenceCollection<>();
        String slim = NOISE.matcher(text).replaceAll("");

        Matcher matcher = BOOK.matcher(slim);
        while (matcher.find()) {
            String content = matcher.group("content");
            // "John;" keeps "" as its content, which selects no chapters.
            if (content != null) {
                content = TRAILING_NON_DIGITS.matcher(content).replaceAll("");
            }
            books.add(createBook(matcher.group("name"), content));
        }

        if (books.isEmpty()) {
            books.addError(ReferenceErrors.noBooks(text));
        }

        if (log.isDebugEnabled()) {
            log.debug("Parsed {} books from '{}' ({} errors)", books.size(), text, books.errors().size());
        }
        return books;
    }

    public BookReference createBook(String bookName) {
        return createBook(bookName, null);
    }

    /**
     * Look up a book and parse its chapters.
     *
     * @param bookName   full name or abbreviation, e.g. "Matthew" or "matt"
     * @param rawContent the chapters and verses selected, e.g. "1:1-10"; {@code null} for chapter 1
     */
    public BookReference createBook(String bookName, String rawContent) {
        Optional<BookMetadata> metadata = metadataProvider.lookup(bookName);
        if (metadata.isEmpty()) {
            return BookReference.unresolved(bookName);
        }
        ReferenceCollection<ChapterReference> chapters = chapterParser.chaptersFor(rawContent, metadata.get());
        return BookReference.resolved(bookName, metadata.get(), rawContent, chapters);
    }
}
