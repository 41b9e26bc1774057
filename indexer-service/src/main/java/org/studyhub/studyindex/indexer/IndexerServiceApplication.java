package org.studyhub.studyindex.indexer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IndexerServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(IndexerServiceApplication.class, args);
    }
}
