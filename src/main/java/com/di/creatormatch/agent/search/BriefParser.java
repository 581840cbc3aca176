package com.di.creatormatch.agent.search;

import com.di.creatormatch.agent.campaign.CampaignQuery;

/**
 * Turns free-text campaign briefs into a {@link CampaignQuery}.
 */
public interface BriefParser {

    /**
     * @throws BriefParseException when the brief cannot be interpreted
     */
    CampaignQuery parse(String briefText) throws BriefParseException;

    class BriefParseException extends Exception {
        public BriefParseException(String message) {
            super(message);
        }

        public BriefParseException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
