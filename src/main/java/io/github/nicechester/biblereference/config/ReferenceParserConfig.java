package io.github.nicechester.biblereference.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.nicechester.biblereference.metadata.BibleMetadataLoader;
import io.github.nicechester.biblereference.metadata.BibleMetadataTable;
import io.github.nicechester.biblereference.parser.BookParser;
import io.github.nicechester.biblereference.parser.ChapterParser;
import io.github.nicechester.biblereference.parser.VerseParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;

/**
 * Wires the metadata table and the three parsers.
 *
 * <p>The metadata table is loaded once at startup and handed to the book parser; nothing
 * else holds on to it, so tests can build their own parsers against any table.
 */
@Slf4j
@Configuration
public class ReferenceParserConfig {

    @Value("${bible.metadata.json-path:classpath:bible/metadata.json}")
    private String metadataPath;

    @Value("${bible.parser.max-range-size:" + VerseParser.DEFAULT_MAX_RANGE_SIZE + "}")
    private int maxRangeSize;

    /**
     * Book names, abbreviations and verse counts. Startup fails if they cannot be loaded.
     */
    @Bean
    public BibleMetadataTable bibleMetadataTable(ResourceLoader resourceLoader, ObjectMapper objectMapper)
            throws IOException {
        return new BibleMetadataLoader(resourceLoader, objectMapper).load(metadataPath);
    }

    @Bean
    public VerseParser verseParser() {
        log.info("Parsers limited to {} chapters or verses per range", maxRangeSize);
        return new VerseParser(maxRangeSize);
    }

    @Bean
    public ChapterParser chapterParser(VerseParser verseParser) {
        return new ChapterParser(verseParser, maxRangeSize);
    }

    @Bean
    public BookParser bookParser(BibleMetadataTable bibleMetadataTable, ChapterParser chapterParser) {
        return new BookParser(bibleMetadataTable, chapterParser);
    }
}
