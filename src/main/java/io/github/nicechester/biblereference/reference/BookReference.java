package io.github.nicechester.biblereference.reference;

import io.github.nicechester.biblereference.metadata.BookMetadata;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A book found in a passage, with its name, short name and the chapters referenced in it.
 *
 * <p>When the book cannot be found the reference is still created, but only carries the token
 * that was looked up and a "could not be found" error: name, short name, raw content, metadata
 * and chapters are all {@code null}.
 *
 * <p>Instances are created by {@link io.github.nicechester.biblereference.parser.BookParser}.
 */
@Getter
public class BookReference implements Reference {

    /**
     * The book name as it appeared in the passage, e.g. "matt"
     */
    private final String token;

    /**
     * Canonical name, e.g. "Matthew"
     */
    private final String name;

    /**
     * Abbreviated name, e.g. "Matt."
     */
    private final String shortName;

    /**
     * The chapters and verses selected for this book, e.g. "1:1-10"
     */
    private final String rawContent;

    private final BookMetadata metadata;

    private final ReferenceCollection<ChapterReference> chapterReferences;

    @Getter(AccessLevel.NONE)
    private final ErrorLog errorLog = new ErrorLog();

    private BookReference(String token, BookMetadata metadata, String rawContent,
                          ReferenceCollection<ChapterReference> chapterReferences) {
        this.token = token;
        this.metadata = metadata;
        this.name = metadata != null ? metadata.name() : null;
        this.shortName = metadata != null ? metadata.shortName() : null;
        this.rawContent = rawContent;
        this.chapterReferences = chapterReferences;
    }

    public static BookReference resolved(String token, BookMetadata metadata, String rawContent,
                                         ReferenceCollection<ChapterReference> chapterReferences) {
        return new BookReference(token, metadata, rawContent, chapterReferences);
    }

    public static BookReference unresolved(String token) {
        BookReference book = new BookReference(token, null, null, null);
        book.addError(ReferenceErrors.bookNotFound(token));
        return book;
    }

    @Override
    public boolean isValidReference() {
        return name != null;
    }

    @Override
    public Optional<ReferenceCollection<? extends Reference>> children() {
        return Optional.ofNullable(chapterReferences);
    }

    @Override
    public void addError(String message) {
        errorLog.add(message);
    }

    @Override
    public void clearErrors() {
        errorLog.clear();
    }

    @Override
    public List<String> errors(boolean includeChildren) {
        List<String> errors = new ArrayList<>(errorLog.messages());
        if (includeChildren && chapterReferences != null) {
            errors.addAll(chapterReferences.errors(true));
        }
        return errors;
    }

    @Override
    public String toString() {
        return "BookReference(" + (name != null ? name : token)
            + (rawContent != null ? " " + rawContent : "") + ")";
    }
}
