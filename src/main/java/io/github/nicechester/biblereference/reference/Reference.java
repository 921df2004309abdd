package io.github.nicechester.biblereference.reference;

import java.util.List;
import java.util.Optional;

/**
 * A book, chapter or verse reference produced by the parsers.
 *
 * <p>A reference is always constructed, even when it is invalid; validity only means its
 * identifying field (book name, chapter number or verse number) is present.
 */
public interface Reference extends TracksErrors {

    /**
     * Whether this reference itself is valid. Child references are not considered.
     */
    boolean isValidReference();

    /**
     * The child collection of this reference. Empty for verses and for invalid books and chapters.
     */
    Optional<ReferenceCollection<? extends Reference>> children();

    /**
     * Move invalid child references into the child collection's invalid references.
     *
     * @return the references that were removed
     * @see ReferenceCollection#clean(boolean)
     */
    default List<Reference> clean(boolean chain) {
        return children()
            .<List<Reference>>map(collection -> collection.clean(chain))
            .orElse(List.of());
    }

    default List<Reference> clean() {
        return clean(true);
    }
}
