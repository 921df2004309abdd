package io.github.nicechester.biblereference.reference;

/**
 * Error messages recorded while parsing passages.
 *
 * <p>Numbers are reported as parsed, not as typed: a number too large for an {@code int} has been
 * read as {@link Integer#MAX_VALUE}, so "Genesis 99999999999" reports chapter '2147483647'.
 */
public final class ReferenceErrors {

    private ReferenceErrors() {
    }

    public static String bookNotFound(String bookName) {
        return "The book '" + bookName + "' could not be found";
    }

    public static String noBooks(String passage) {
        return "'" + passage + "' does not contain any books";
    }

    public static String invalidChapterNumber(int number) {
        return "The chapter number '" + number + "' is not valid";
    }

    public static String chapterNotFound(int number, String bookName) {
        return "Chapter '" + number + "' does not exist for the book " + bookName;
    }

    public static String invalidVerseNumber(int number) {
        return "The verse number '" + number + "' is not valid";
    }

    public static String verseNotFound(int number, String bookName, int chapterNumber) {
        return "The verse '" + number + "' does not exist for " + bookName + " " + chapterNumber;
    }

    public static String invalidVerseRange(String range) {
        return "'" + range + "' is an invalid range of verses";
    }

    public static String chapterRangeTooLarge(String range, int maxRangeSize) {
        return "'" + range + "' exceeds the maximum of " + maxRangeSize + " chapters in a range";
    }

    public static String verseRangeTooLarge(String range, int maxRangeSize) {
        return "'" + range + "' exceeds the maximum of " + maxRangeSize + " verses in a range";
    }
}
