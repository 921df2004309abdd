package io.github.nicechester.biblereference.controller;

import io.github.nicechester.biblereference.metadata.BibleMetadataTable;
import io.github.nicechester.biblereference.metadata.BookMetadata;
import io.github.nicechester.biblereference.model.ParseRequest;
import io.github.nicechester.biblereference.model.ParseResponse;
import io.github.nicechester.biblereference.service.ReferenceParserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for parsing scripture passages.
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class ReferenceController {

    private final ReferenceParserService parserService;
    private final BibleMetadataTable metadataTable;

    /**
     * Parse a passage into books, chapters and verses.
     * 
     * POST /api/references
     * {
     *   "passage": "Gen. 1:15-18, 21; Matt 1",
     *   "clean": true  // optional: drop invalid references from the result
     * }
     */
    @PostMapping("/references")
    public ResponseEntity<ParseResponse> parse(@RequestBody ParseRequest request) {
        log.info("Parse request: passage='{}', clean={}", request.passage(), request.clean());

        if (request.passage() == null || request.passage().isBlank()) {
            return ResponseEntity.badRequest()
                .body(ParseResponse.error(request.passage(), "Passage cannot be empty"));
        }

        return ResponseEntity.ok(parserService.parseForResponse(request.passage(), request.clean()));
    }

    /**
     * Simple GET endpoint for quick lookups.
     * 
     * GET /api/references?q=John 3:16&clean=true
     */
    @GetMapping("/references")
    public ResponseEntity<ParseResponse> parseGet(
            @RequestParam(value = "q", required = false) String passage,
            @RequestParam(value = "clean", required = false, defaultValue = "false") boolean clean) {

        log.info("GET Parse: passage='{}', clean={}", passage, clean);

        if (passage == null || passage.isBlank()) {
            return ResponseEntity.badRequest()
                .body(ParseResponse.error(passage, "Passage cannot be empty"));
        }

        return ResponseEntity.ok(parserService.parseForResponse(passage, clean));
    }

    /**
     * Health check endpoint.
     * 
     * GET /api/references/health
     */
    @GetMapping("/references/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of(
            "status", "ok",
            "service", "bible-reference-parser"
        ));
    }

    // ==================== Metadata Endpoints ====================

    /**
     * List all books in canonical order.
     * 
     * GET /api/books
     */
    @GetMapping("/books")
    public ResponseEntity<List<Map<String, Object>>> getBooks() {
        List<Map<String, Object>> books = metadataTable.books().stream()
            .map(book -> Map.<String, Object>of(
                "name", book.name(),
                "shortName", book.shortName(),
                "chapters", book.chapterCount()
            ))
            .toList();
        return ResponseEntity.ok(books);
    }

    /**
     * Get a book by name or abbreviation, with the verse count of every chapter.
     * 
     * GET /api/books/{name}
     */
    @GetMapping("/books/{name}")
    public ResponseEntity<Map<String, Object>> getBook(@PathVariable String name) {
        return metadataTable.lookup(name)
            .map(this::toBookInfo)
            .map(ResponseEntity::ok)
            .orElseGet(() -> {
                log.debug("Unknown book requested: {}", name);
                return ResponseEntity.notFound().build();
            });
    }

    private Map<String, Object> toBookInfo(BookMetadata book) {
        return Map.of(
            "name", book.name(),
            "shortName", book.shortName(),
            "chapters", book.chapterCount(),
            "verseCounts", book.chapterVerseCounts()
        );
    }
}
