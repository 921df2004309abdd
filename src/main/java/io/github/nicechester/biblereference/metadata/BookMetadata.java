package io.github.nicechester.biblereference.metadata;

import java.util.List;
import java.util.Objects;

/**
 * Canonical information about one book: its name, short name and the number of verses in
 * each chapter ({@code chapterVerseCounts.get(i)} is the verse count of chapter {@code i + 1}).
 */
public record BookMetadata(
    String name,
    String shortName,
    List<Integer> chapterVerseCounts
) {
    public BookMetadata {
        Objects.requireNonNull(name, "name");
        chapterVerseCounts = List.copyOf(chapterVerseCounts);
    }

    public int chapterCount() {
        return chapterVerseCounts.size();
    }

    public boolean hasChapter(int chapter) {
        return chapter >= 1 && chapter <= chapterCount();
    }

    /**
     * Number of verses in the given chapter, or 0 for a chapter the book does not have.
     */
    public int verseCount(int chapter) {
        return hasChapter(chapter) ? chapterVerseCounts.get(chapter - 1) : 0;
    }
}
