package io.github.nicechester.biblereference.metadata;

import java.util.Optional;

/**
 * Looks up book metadata by name or abbreviation.
 *
 * <p>Implementations normalize the key themselves; callers pass the book name exactly as it
 * was found in the passage ("Matt.", "1 sam", "REVELATION").
 */
public interface MetadataProvider {

    Optional<BookMetadata> lookup(String key);
}
