package com.example.RagChat.controller;

import com.example.RagChat.model.RagQueryRequest;
import com.example.RagChat.model.RagRetrievalResult;
import com.example.RagChat.service.RetrievalService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/rag")
@RequiredArgsConstructor
public class RetrievalController {

    private final RetrievalService retrievalService;

    /**
     * Simple mode, configured minScore:
     *   GET /api/rag/retrieve?q=xxx&k=3
     */
    @GetMapping("/retrieve")
    public RagRetrievalResult retrieveByQueryParam(
            @RequestParam("q") String question,
            @RequestParam(value = "k", required = false) Integer k
    ) {
        return retrievalService.retrieve(new RagQueryRequest(question, k, null));
    }

    /**
     * Advanced mode:
     *   POST /api/rag/retrieve
     *   {
     *     "question": "xxx",
     *     "topK": 8,
     *     "minScore": 0.65
     *   }
     */
    @PostMapping("/retrieve")
    public RagRetrievalResult retrieveByBody(@RequestBody RagQueryRequest request) {
        return retrievalService.retrieve(request);
    }
}
