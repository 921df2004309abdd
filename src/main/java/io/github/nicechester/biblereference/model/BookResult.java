package io.github.nicechester.biblereference.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * A parsed book in an API response.
 */
@Data
@Builder(toBuilder = true)
public class BookResult {
    
    /**
     * Canonical book name (e.g., "Genesis"), null if the book was not found
     */
    private String name;
    
    /**
     * Short book name (e.g., "Gen.")
     */
    private String shortName;
    
    /**
     * The book name as written in the passage
     */
    private String token;
    
    /**
     * Chapters and verses as written, e.g. "1:1-10,25"
     */
    private String rawContent;
    
    private boolean valid;
    
    private List<ChapterResult> chapters;
    
    /**
     * Errors recorded on the book itself
     */
    private List<String> errors;
}
