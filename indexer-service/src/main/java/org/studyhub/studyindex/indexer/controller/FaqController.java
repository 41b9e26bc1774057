package org.studyhub.studyindex.indexer.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.studyhub.studyindex.indexer.model.FaqEntry;
import org.studyhub.studyindex.indexer.model.FaqRequest;
import org.studyhub.studyindex.indexer.model.SearchRequest;
import org.studyhub.studyindex.indexer.model.SearchResponse;
import org.studyhub.studyindex.indexer.service.FaqService;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/faqs")
@RequiredArgsConstructor
public class FaqController {

    private final FaqService faqService;

    @PostMapping
    public ResponseEntity<Map<String, String>> addFaq(@RequestBody FaqRequest request) {
        String faqId = faqService.addFaq(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("faqId", faqId));
    }

    @GetMapping("/{faqId}")
    public ResponseEntity<FaqEntry> getFaq(@PathVariable String faqId) {
        return faqService.getFaq(faqId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{faqId}")
    public Map<String, String> deleteFaq(@PathVariable String faqId) {
        faqService.deleteFaq(faqId);
        return Map.of("status", "deleted", "faqId", faqId);
    }

    @PostMapping("/search")
    public ResponseEntity<SearchResponse> search(@RequestBody SearchRequest request) {
        if (request.getQuery() == null || request.getQuery().isBlank()) {
            return ResponseEntity.badRequest().body(SearchResponse.empty(""));
        }

        log.debug("FAQ search request: query=\"{}\", topics={}", request.getQuery(), request.getScopeIds());
        return ResponseEntity.ok(faqService.search(request));
    }
}
