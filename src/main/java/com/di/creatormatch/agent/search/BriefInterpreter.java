package com.di.creatormatch.agent.search;

import com.di.creatormatch.agent.campaign.CampaignQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Picks the brief parser for raw brief text. Any registered parser other than the keyword one is tried
 * first, in order; if none is registered or all fail, the keyword parser produces a low-confidence query.
 * Always returns a query.
 */
@Slf4j
@Service
public class BriefInterpreter {

    private final List<BriefParser> parsers;
    private final KeywordBriefParser keywordParser;

    public BriefInterpreter(List<BriefParser> parsers, KeywordBriefParser keywordParser) {
        List<BriefParser> primary = new ArrayList<>();
        for (BriefParser p : parsers) {
            if (p != keywordParser) primary.add(p);
        }
        this.parsers = primary;
        this.keywordParser = keywordParser;
    }

    public CampaignQuery interpret(String briefText) {
        String lastError = null;
        for (BriefParser parser : parsers) {
            try {
                CampaignQuery query = parser.parse(briefText);
                if (query != null) return query;
                lastError = parser.getClass().getSimpleName() + " returned no query";
            } catch (BriefParser.BriefParseException | RuntimeException e) {
                lastError = parser.getClass().getSimpleName() + ": " + e.getMessage();
                log.warn("[SEARCH] Brief parser {} failed: {}", parser.getClass().getSimpleName(), e.getMessage());
            }
        }
        String reason = lastError != null ? "Parser failed (" + lastError + "); keyword extraction only"
                : "Keyword extraction only";
        return keywordParser.fallback(briefText, reason);
    }
}
