package io.github.nicechester.biblereference;

import io.github.nicechester.biblereference.metadata.BibleMetadataTable;
import io.github.nicechester.biblereference.parser.ChapterParser;
import io.github.nicechester.biblereference.parser.VerseParser;
import io.github.nicechester.biblereference.service.ReferenceParserService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "bible.parser.max-range-size=500")
class BibleReferenceParserApplicationTest {

    @Autowired
    private BibleMetadataTable metadataTable;

    @Autowired
    private VerseParser verseParser;

    @Autowired
    private ChapterParser chapterParser;

    @Autowired
    private ReferenceParserService parserService;

    @Test
    void wiresParsersFromConfiguration() {
        assertThat(metadataTable.size()).isEqualTo(66);
        assertThat(verseParser.getMaxRangeSize()).isEqualTo(500);
        assertThat(chapterParser.getMaxRangeSize()).isEqualTo(500);
        assertThat(parserService.parse("Ps 119:1-501").errors())
            .containsExactly("'1-501' exceeds the maximum of 500 verses in a range");
    }
}
