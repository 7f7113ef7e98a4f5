package com.gamearena.decision;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;

import java.io.IOException;

/**
 * Adapts a text {@link DecisionOracle} to the provider contract.
 *
 * <p>Requests go out as snake_case JSON. Replies are parsed leniently:
 * surrounding Markdown code fences are stripped and unknown fields ignored.
 * Missing fields are left null for {@link DecisionValidator} to default.
 * An oracle error or a reply that is not a JSON object fails the decision.
 */
public class JsonDecisionProvider implements DecisionProvider {
    private final DecisionOracle oracle;
    private final ObjectMapper mapper;

    public JsonDecisionProvider(DecisionOracle oracle) {
        this.oracle = oracle;
        this.mapper = new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public PokerActionResponse decidePokerAction(PokerActionRequest request) throws DecisionException {
        return exchange("poker", request, PokerActionResponse.class);
    }

    @Override
    public AuctionBidResponse decideAuctionBid(AuctionBidRequest request) throws DecisionException {
        return exchange("auction", request, AuctionBidResponse.class);
    }

    @Override
    public CombatAbilityResponse decideCombatAbility(CombatAbilityRequest request) throws DecisionException {
        return exchange("combat", request, CombatAbilityResponse.class);
    }

    private <R> R exchange(String kind, Object request, Class<R> responseType) throws DecisionException {
        String requestJson;
        try {
            requestJson = mapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new DecisionException("Failed to encode " + kind + " request: " + e.getMessage(), e);
        }

        String reply;
        try {
            reply = oracle.ask(kind, requestJson);
        } catch (IOException e) {
            throw new DecisionException("Decision oracle failed for " + kind + ": " + e.getMessage(), e);
        }
        if (reply == null || reply.isBlank()) {
            throw new DecisionException("Decision oracle returned an empty " + kind + " reply");
        }

        try {
            R parsed = mapper.readValue(stripFences(reply), responseType);
            if (parsed == null) {
                throw new DecisionException("Decision oracle returned null for " + kind);
            }
            return parsed;
        } catch (JsonProcessingException e) {
            throw new DecisionException("Unparsable " + kind + " reply: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Remove a surrounding ```json ... ``` fence, if present.
     */
    static String stripFences(String text) {
        String cleaned = text.strip();
        if (!cleaned.startsWith("```")) {
            return cleaned;
        }
        StringBuilder sb = new StringBuilder();
        for (String line : cleaned.split("\n")) {
            if (!line.strip().startsWith("```")) {
                sb.append(line).append('\n');
            }
        }
        return sb.toString().strip();
    }
}
