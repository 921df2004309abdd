package io.github.nicechester.biblereference.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * A parsed chapter in an API response.
 */
@Data
@Builder(toBuilder = true)
public class ChapterResult {
    
    /**
     * Chapter number, null if the chapter is invalid
     */
    private Integer number;
    
    /**
     * Verse selection as written, e.g. "1-10,15"; null for the whole chapter
     */
    private String rawContent;
    
    private boolean valid;
    
    /**
     * Numbers of the valid verses
     */
    private List<Integer> verses;
    
    /**
     * Errors recorded on the chapter itself
     */
    private List<String> errors;
}
