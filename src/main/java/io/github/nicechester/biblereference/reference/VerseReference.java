package io.github.nicechester.biblereference.reference;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.List;
import java.util.Optional;

/**
 * A single verse. Verses are leaves: they have no children and cleaning them removes nothing.
 */
@Getter
public class VerseReference implements Reference {

    private final Integer number;

    @Getter(AccessLevel.NONE)
    private final ErrorLog errorLog = new ErrorLog();

    private VerseReference(Integer number) {
        this.number = number;
    }

    public static VerseReference valid(int number) {
        return new VerseReference(number);
    }

    public static VerseReference invalid(String error) {
        VerseReference verse = new VerseReference(null);
        verse.addError(error);
        return verse;
    }

    @Override
    public boolean isValidReference() {
        return number != null;
    }

    @Override
    public Optional<ReferenceCollection<? extends Reference>> children() {
        return Optional.empty();
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
        return errorLog.messages();
    }

    @Override
    public String toString() {
        return "VerseReference(" + number + ")";
    }
}
