package io.github.nicechester.biblereference.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the book metadata table from a JSON resource.
 *
 * <p>Expected format:
 * <pre>
 * {
 *   "version": "KJV",
 *   "books": [
 *     {"bookNumber": 1, "name": "Genesis", "shortName": "Gen.", "abbreviations": ["gen", "ge"],
 *      "chapterVerseCounts": [31, 25, 24, ...]},
 *     ...
 *   ]
 * }
 * </pre>
 */
@Slf4j
@RequiredArgsConstructor
public class BibleMetadataLoader {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public BibleMetadataTable load(String jsonPath) throws IOException {
        Resource resource = resourceLoader.getResource(jsonPath);
        if (!resource.exists()) {
            throw new IOException("Bible metadata file not found: " + jsonPath);
        }

        try (InputStream inputStream = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(inputStream);

            String version = root.has("version") ? root.get("version").asText() : null;
            log.info("Loading {} book metadata from: {}", version != null ? version : "unversioned", jsonPath);

            JsonNode booksNode = root.get("books");
            if (booksNode == null || !booksNode.isArray()) {
                throw new IOException("No books found in metadata JSON: " + jsonPath);
            }

            BibleMetadataTable.Builder builder = BibleMetadataTable.builder().version(version);
            for (JsonNode bookNode : booksNode) {
                BookMetadata book = readBook(bookNode, jsonPath);
                try {
                    builder.book(book, readAbbreviations(bookNode));
                } catch (IllegalStateException e) {
                    throw new IOException("Invalid metadata in " + jsonPath + ": " + e.getMessage(), e);
                }
            }

            BibleMetadataTable table = builder.build();
            log.info("Loaded {} books, {} chapters from {}", table.size(), table.totalChapters(), jsonPath);
            return table;
        }
    }

    private BookMetadata readBook(JsonNode bookNode, String jsonPath) throws IOException {
        String name = bookNode.hasNonNull("name") ? bookNode.get("name").asText() : null;
        if (name == null || name.isBlank()) {
            throw new IOException("Book without a name in " + jsonPath);
        }
        String shortName = bookNode.hasNonNull("shortName") ? bookNode.get("shortName").asText() : name;

        JsonNode countsNode = bookNode.get("chapterVerseCounts");
        if (countsNode == null || !countsNode.isArray() || countsNode.isEmpty()) {
            throw new IOException("Book '" + name + "' has no chapters in " + jsonPath);
        }

        List<Integer> verseCounts = new ArrayList<>();
        for (JsonNode countNode : countsNode) {
            int count = countNode.asInt();
            if (count < 1) {
                throw new IOException(String.format("Book '%s' chapter %d has an invalid verse count: %s",
                    name, verseCounts.size() + 1, countNode.asText()));
            }
            verseCounts.add(count);
        }
        return new BookMetadata(name, shortName, verseCounts);
    }

    private List<String> readAbbreviations(JsonNode bookNode) {
        List<String> abbreviations = new ArrayList<>();
        JsonNode abbreviationsNode = bookNode.get("abbreviations");
        if (abbreviationsNode != null && abbreviationsNode.isArray()) {
            for (JsonNode abbreviation : abbreviationsNode) {
                abbreviations.add(abbreviation.asText());
            }
        }
        return abbreviations;
    }
}
