package io.github.nicechester.biblereference.reference;

import io.github.nicechester.biblereference.TestMetadata;
import io.github.nicechester.biblereference.parser.BookParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BookReference")
class BookReferenceTest {

    private final BookParser bookParser = TestMetadata.bookParser();

    @Test
    @DisplayName("an unknown book keeps its token and nothing else")
    void unresolvedBook() {
        BookReference book = BookReference.unresolved("Genthesis");

        assertThat(book.isValidReference()).isFalse();
        assertThat(book.getToken()).isEqualTo("Genthesis");
        assertThat(book.getName()).isNull();
        assertThat(book.getShortName()).isNull();
        assertThat(book.getRawContent()).isNull();
        assertThat(book.getMetadata()).isNull();
        assertThat(book.getChapterReferences()).isNull();
        assertThat(book.children()).isEmpty();
        assertThat(book.errors()).containsExactly("The book 'Genthesis' could not be found");
    }

    @Test
    @DisplayName("a resolved book takes its names from the metadata")
    void resolvedBook() {
        BookReference book = bookParser.createBook("matt", "1:1-10");

        assertThat(book.isValidReference()).isTrue();
        assertThat(book.getToken()).isEqualTo("matt");
        assertThat(book.getName()).isEqualTo("Matthew");
        assertThat(book.getShortName()).isEqualTo("Matt.");
        assertThat(book.getRawContent()).isEqualTo("1:1-10");
        assertThat(book.children()).containsSame(book.getChapterReferences());
    }

    @Test
    @DisplayName("errors of chapters and verses are included unless only the book's own are asked for")
    void includesChildErrors() {
        BookReference book = bookParser.createBook("Exodus", "1:100");

        assertThat(book.errors()).containsExactly("The verse '100' does not exist for Exodus 1");
        assertThat(book.errors(false)).isEmpty();

        book.addError("own");
        assertThat(book.errors()).containsExactly("own", "The verse '100' does not exist for Exodus 1");
        assertThat(book.errors(false)).containsExactly("own");
    }

    @Test
    @DisplayName("clean delegates to the chapters")
    void cleanDelegatesToChapters() {
        BookReference book = bookParser.createBook("Numbers", "35-37");

        List<Reference> removed = book.clean();

        assertThat(removed).hasSize(1);
        assertThat(book.getChapterReferences().getReferences())
            .extracting(ChapterReference::getNumber)
            .containsExactly(35, 36);
        assertThat(book.getChapterReferences().getInvalidReferences()).containsExactlyElementsOf(removed);
    }

    @Test
    @DisplayName("cleaning an unknown book removes nothing")
    void cleanUnresolvedBook() {
        assertThat(BookReference.unresolved("anathema").clean()).isEmpty();
    }
}
