package io.github.nicechester.biblereference.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Response model for a parsed passage.
 */
@Data
@Builder(toBuilder = true)
public class ParseResponse {
    
    /**
     * The passage as submitted
     */
    private String passage;
    
    /**
     * Books found in the passage, in order
     */
    private List<BookResult> books;
    
    private Integer totalBooks;
    
    /**
     * Number of references cleaning moved out of the result, counting books, chapters and verses alike
     */
    private Integer invalidCount;
    
    /**
     * All parsing errors, each message once
     */
    private List<String> errors;
    
    private Long parseTimeMs;
    
    /**
     * Whether the request could be processed; a passage with parsing errors still succeeds
     */
    private boolean success;
    
    /**
     * Error message if the request failed
     */
    private String error;
    
    /**
     * Create a successful response
     */
    public static ParseResponse success(String passage, List<BookResult> books, int invalidCount,
                                        List<String> errors, long parseTimeMs) {
        return ParseResponse.builder()
            .passage(passage)
            .books(books)
            .totalBooks(books.size())
            .invalidCount(invalidCount)
            .errors(errors)
            .parseTimeMs(parseTimeMs)
            .success(true)
            .build();
    }
    
    /**
     * Create an error response
     */
    public static ParseResponse error(String passage, String errorMessage) {
        return ParseResponse.builder()
            .passage(passage)
            .books(List.of())
            .totalBooks(0)
            .invalidCount(0)
            .errors(List.of())
            .success(false)
            .error(errorMessage)
            .build();
    }
}
