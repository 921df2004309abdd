package io.github.nicechester.biblereference.reference;

import java.util.List;

/**
 * Contract shared by everything that keeps track of parsing errors.
 *
 * <p>A {@link BookReference} records an error when its book cannot be found, a
 * {@link ChapterReference} when its chapter does not exist for the book, and so on.
 * Errors are never thrown: they are collected on the object that detected them and
 * surface through {@link #errors()} on every enclosing collection.
 */
public interface TracksErrors {

    /**
     * Add an error message.
     */
    void addError(String message);

    /**
     * Erase all error messages recorded directly on this object.
     */
    void clearErrors();

    /**
     * Get the error messages in the order they were recorded. When {@code includeChildren}
     * is true the errors of the child collection, if there is one, follow this object's own.
     */
    List<String> errors(boolean includeChildren);

    default List<String> errors() {
        return errors(true);
    }

    default boolean hasErrors() {
        return !errors().isEmpty();
    }

    default boolean noErrors() {
        return errors().isEmpty();
    }
}
