package io.github.nicechester.biblereference.model;

/**
 * Request model for parsing a passage.
 */
public record ParseRequest(
    /**
     * The passage to parse, e.g. "Gen. 1:15-18, 21; Matt 1"
     */
    String passage,
    
    /**
     * Whether to move invalid references out of the result (default: false)
     */
    Boolean clean
) {
    public ParseRequest {
        if (clean == null) clean = false;
    }
}
