package io.github.nicechester.biblereference.reference;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Ordered collection of references, split into the references still considered valid and
 * the references that {@link #clean(boolean)} moved out of them.
 *
 * <p>Every parse method returns one of these, and books and chapters keep their children in one:
 * <pre>
 * ReferenceCollection&lt;BookReference&gt; books = service.parse("Genthesis 1:1-10, Matthew 1:5, Rev. 5000");
 * books.size();      // 3
 * books.hasErrors(); // true
 * books.errors();    // ["The book 'Genthesis' could not be found",
 *                    //  "Chapter '5000' does not exist for the book Revelation"]
 * books.clean();
 * books.size();                       // 2 (Matthew 1:5, and Revelation without chapters)
 * books.getInvalidReferences().size(); // 2 (Genthesis, and Revelation 5000)
 * </pre>
 *
 * <p>A reference stays in the collection as long as it is valid itself, so a valid book may end
 * up holding only invalid chapters. References are never deleted: cleaning only moves them.
 *
 * @param <T> the reference type kept in the valid sequence
 */
public class ReferenceCollection<T extends Reference> implements TracksErrors, Iterable<T> {

    private final List<T> references;

    // Holds references of any level: cleaning with chain also collects invalid descendants here.
    private final List<Reference> invalidReferences;

    private final ErrorLog errorLog = new ErrorLog();

    public ReferenceCollection() {
        this(List.of(), List.of());
    }

    public ReferenceCollection(List<? extends T> initialReferences) {
        this(initialReferences, List.of());
    }

    public ReferenceCollection(List<? extends T> initialReferences, List<? extends Reference> initialInvalidReferences) {
        this.references = new ArrayList<>(initialReferences);
        this.invalidReferences = new ArrayList<>(initialInvalidReferences);
    }

    /**
     * Append a reference to the valid sequence, whether or not it is valid.
     */
    public void add(T reference) {
        references.add(reference);
    }

    @Override
    public void addError(String message) {
        errorLog.add(message);
    }

    @Override
    public void clearErrors() {
        errorLog.clear();
    }

    /**
     * Errors added directly to this collection, then the errors of every invalid reference,
     * then the errors of every reference still in the collection. Each message appears once.
     */
    @Override
    public List<String> errors(boolean includeChildren) {
        Set<String> all = new LinkedHashSet<>(errorLog.messages());
        for (Reference reference : invalidReferences) {
            all.addAll(reference.errors(includeChildren));
        }
        for (T reference : references) {
            all.addAll(reference.errors(includeChildren));
        }
        return new ArrayList<>(all);
    }

    /**
     * Move invalid references into {@link #getInvalidReferences()}.
     *
     * <p>When {@code chain} is true, every reference that stays also cleans its own children, and
     * whatever they remove is recorded in this collection's invalid references as well. The
     * parent itself is not demoted:
     * <pre>
     * books = service.parse("Genesis 51"); // Genesis is valid, chapter 51 is not
     * books.clean();
     * books.size();                                      // 1
     * books.first().get().getChapterReferences().size(); // 0
     * books.getInvalidReferences().size();               // 1 (chapter 51)
     * </pre>
     *
     * @return the references removed at this level followed by those removed from children
     */
    public List<Reference> clean(boolean chain) {
        List<T> removed = new ArrayList<>();
        List<Reference> removedThroughChain = new ArrayList<>();

        for (T reference : references) {
            if (!reference.isValidReference()) {
                removed.add(reference);
            } else if (chain) {
                removedThroughChain.addAll(reference.clean(true));
            }
        }

        Set<T> removedSet = Collections.newSetFromMap(new IdentityHashMap<>());
        removedSet.addAll(removed);
        references.removeIf(removedSet::contains);

        List<Reference> allRemoved = new ArrayList<>(removed);
        allRemoved.addAll(removedThroughChain);
        invalidReferences.addAll(allRemoved);
        return allRemoved;
    }

    public List<Reference> clean() {
        return clean(true);
    }

    /**
     * A new collection holding this collection's references followed by {@code other}'s.
     * The invalid references of this collection are carried over; those of {@code other} are not.
     */
    public ReferenceCollection<T> union(ReferenceCollection<? extends T> other) {
        return union(other.references);
    }

    public ReferenceCollection<T> union(List<? extends T> other) {
        List<T> combined = new ArrayList<>(references);
        combined.addAll(other);
        return new ReferenceCollection<>(combined, invalidReferences);
    }

    /**
     * A new collection holding this collection's references minus every occurrence of the
     * references in {@code other}. References are compared by identity.
     */
    public ReferenceCollection<T> difference(ReferenceCollection<? extends T> other) {
        return difference(other.references);
    }

    public ReferenceCollection<T> difference(List<? extends T> other) {
        Set<Reference> subtracted = Collections.newSetFromMap(new IdentityHashMap<>());
        subtracted.addAll(other);
        List<T> remaining = references.stream()
            .filter(reference -> !subtracted.contains(reference))
            .toList();
        return new ReferenceCollection<>(remaining, invalidReferences);
    }

    public T get(int index) {
        return references.get(index);
    }

    public int size() {
        return references.size();
    }

    public boolean isEmpty() {
        return references.isEmpty();
    }

    public Optional<T> first() {
        return references.isEmpty() ? Optional.empty() : Optional.of(references.get(0));
    }

    public Optional<T> last() {
        return references.isEmpty() ? Optional.empty() : Optional.of(references.get(references.size() - 1));
    }

    public Stream<T> stream() {
        return references.stream();
    }

    @Override
    public Iterator<T> iterator() {
        return Collections.unmodifiableList(references).iterator();
    }

    public List<T> getReferences() {
        return Collections.unmodifiableList(references);
    }

    public List<Reference> getInvalidReferences() {
        return Collections.unmodifiableList(invalidReferences);
    }

    @Override
    public String toString() {
        return "ReferenceCollection(references=" + references.size()
            + ", invalidReferences=" + invalidReferences.size() + ")";
    }
}
