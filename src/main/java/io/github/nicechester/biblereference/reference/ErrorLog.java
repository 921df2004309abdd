package io.github.nicechester.biblereference.reference;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of error messages owned by a single reference or collection.
 * Duplicates are kept; de-duplication happens in {@link ReferenceCollection#errors(boolean)}.
 */
public final class ErrorLog {

    private final List<String> messages = new ArrayList<>();

    public void add(String message) {
        messages.add(Objects.requireNonNull(message, "message"));
    }

    public void clear() {
        messages.clear();
    }

    public List<String> messages() {
        return List.copyOf(messages);
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }
}
