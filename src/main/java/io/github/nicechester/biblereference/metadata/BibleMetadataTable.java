package io.github.nicechester.biblereference.metadata;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Immutable table of book metadata, indexed by book name, short name and abbreviations.
 *
 * <p>Keys are normalized before indexing and before lookup: lowercase, with whitespace and
 * periods removed. "1 Sam.", "1sam" and "1 SAMUEL" therefore all resolve to 1 Samuel when the
 * table registers "1 Samuel" and "1 Sam.".
 *
 * <p>The table is never modified after {@link Builder#build()}, so one instance can be shared by
 * any number of parsers and threads.
 */
public final class BibleMetadataTable implements MetadataProvider {

    private static final Pattern IGNORED_KEY_CHARACTERS = Pattern.compile("[\\s.]+");

    private final String version;
    private final List<BookMetadata> books;
    private final Map<String, BookMetadata> booksByKey;

    private BibleMetadataTable(String version, List<BookMetadata> books, Map<String, BookMetadata> booksByKey) {
        this.version = version;
        this.books = List.copyOf(books);
        this.booksByKey = Collections.unmodifiableMap(new HashMap<>(booksByKey));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Make a key comparable: lowercase, no whitespace, no periods.
     */
    public static String normalize(String key) {
        return IGNORED_KEY_CHARACTERS.matcher(key.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    @Override
    public Optional<BookMetadata> lookup(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(booksByKey.get(normalize(key)));
    }

    public String version() {
        return version;
    }

    /**
     * All books in canonical order.
     */
    public List<BookMetadata> books() {
        return books;
    }

    public int size() {
        return books.size();
    }

    public int totalChapters() {
        return books.stream().mapToInt(BookMetadata::chapterCount).sum();
    }

    public static final class Builder {

        private String version;
        private final List<BookMetadata> books = new ArrayList<>();
        private final Map<String, BookMetadata> booksByKey = new HashMap<>();

        private Builder() {
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        /**
         * Register a book under its name, its short name and the given abbreviations.
         *
         * @throws IllegalStateException if one of the keys already belongs to another book
         */
        public Builder book(BookMetadata book, Collection<String> abbreviations) {
            books.add(book);
            register(book.name(), book);
            if (book.shortName() != null) {
                register(book.shortName(), book);
            }
            for (String abbreviation : abbreviations) {
                register(abbreviation, book);
            }
            return this;
        }

        private void register(String key, BookMetadata book) {
            String normalized = normalize(key);
            if (normalized.isEmpty()) {
                return;
            }
            BookMetadata existing = booksByKey.putIfAbsent(normalized, book);
            if (existing != null && existing != book) {
                throw new IllegalStateException(String.format(
                    "Metadata key '%s' is used by both %s and %s", normalized, existing.name(), book.name()));
            }
        }

        public BibleMetadataTable build() {
            return new BibleMetadataTable(version, books, booksByKey);
        }
    }
}
