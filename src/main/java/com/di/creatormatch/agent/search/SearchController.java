package com.di.creatormatch.agent.search;

import com.di.creatormatch.agent.campaign.CampaignQuery;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for searches.
 * Body: {@code { "query": { ... } }} or {@code { "briefText": "..." }}, optionally with {@code poolSize}
 * and {@code verifyCap}.
 */
@Slf4j
@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
public class SearchController {

    private final SearchPipelineService pipeline;
    private final BriefInterpreter briefInterpreter;
    private final PipelineProperties properties;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SearchOutcome> search(@Valid @RequestBody SearchRequest request) {
        CampaignQuery query = request.getQuery();
        if (query == null) {
            if (request.getBriefText() == null || request.getBriefText().isBlank()) {
                throw new IllegalArgumentException("Either query or briefText is required");
            }
            query = briefInterpreter.interpret(request.getBriefText());
        }
        int poolSize = request.getPoolSize() != null ? request.getPoolSize() : properties.getPoolSize();
        int verifyCap = request.getVerifyCap() != null ? request.getVerifyCap() : properties.getVerifyCap();
        return ResponseEntity.ok(pipeline.runSearch(query, poolSize, verifyCap));
    }
}
