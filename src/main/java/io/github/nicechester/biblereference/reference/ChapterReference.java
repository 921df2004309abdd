package io.github.nicechester.biblereference.reference;

import io.github.nicechester.biblereference.metadata.BookMetadata;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A chapter of a book, with the verses referenced in it.
 *
 * <p>An invalid chapter (number below 1, or beyond the book's last chapter) has no number,
 * raw content or verses; it keeps the book metadata it was validated against.
 *
 * <p>Instances are created by {@link io.github.nicechester.biblereference.parser.ChapterParser}.
 */
@Getter
public class ChapterReference implements Reference {

    private final Integer number;

    /**
     * The verses selected for this chapter, e.g. "1-10,15". {@code null} means the whole chapter.
     */
    private final String rawContent;

    private final BookMetadata metadata;

    private final ReferenceCollection<VerseReference> verseReferences;

    @Getter(AccessLevel.NONE)
    private final ErrorLog errorLog = new ErrorLog();

    private ChapterReference(Integer number, String rawContent, BookMetadata metadata,
                             ReferenceCollection<VerseReference> verseReferences) {
        this.number = number;
        this.rawContent = rawContent;
        this.metadata = metadata;
        this.verseReferences = verseReferences;
    }

    public static ChapterReference valid(int number, String rawContent, BookMetadata metadata,
                                         ReferenceCollection<VerseReference> verseReferences) {
        return new ChapterReference(number, rawContent, metadata, verseReferences);
    }

    public static ChapterReference invalid(BookMetadata metadata, String error) {
        ChapterReference chapter = new ChapterReference(null, null, metadata, null);
        chapter.addError(error);
        return chapter;
    }

    /**
     * Numbers of the valid verses currently in this chapter, in order.
     */
    public List<Integer> verseNumbers() {
        if (verseReferences == null) {
            return List.of();
        }
        return verseReferences.stream()
            .filter(VerseReference::isValidReference)
            .map(VerseReference::getNumber)
            .toList();
    }

    @Override
    public boolean isValidReference() {
        return number != null;
    }

    @Override
    public Optional<ReferenceCollection<? extends Reference>> children() {
        return Optional.ofNullable(verseReferences);
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
        if (includeChildren && verseReferences != null) {
            errors.addAll(verseReferences.errors(true));
        }
        return errors;
    }

    @Override
    public String toString() {
        return "ChapterReference(" + number + (rawContent != null ? ":" + rawContent : "") + ")";
    }
}
