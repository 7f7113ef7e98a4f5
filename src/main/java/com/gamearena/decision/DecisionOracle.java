package com.gamearena.decision;

import java.io.IOException;

/**
 * A text-in, text-out decision service, such as a language model endpoint.
 * Transport and prompting are the implementation's concern.
 */
@FunctionalInterface
public interface DecisionOracle {

    /**
     * @param kind        "poker", "auction" or "combat"
     * @param requestJson the request serialized as snake_case JSON
     * @return the reply text, expected to hold one JSON object
     */
    String ask(String kind, String requestJson) throws IOException;
}
