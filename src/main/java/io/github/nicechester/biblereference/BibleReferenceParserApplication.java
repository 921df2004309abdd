package io.github.nicechester.biblereference;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BibleReferenceParserApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(BibleReferenceParserApplication.class, args);
    }
}
