package com.shlawgathon.featuretracker.backend.oracle;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shlawgathon.featuretracker.backend.model.Taxonomy;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnthropicClassificationOracleTest {

    /**
     * Replays canned replies instead of calling the API. A null entry simulates a transport error.
     */
    private static class ScriptedOracle extends AnthropicClassificationOracle {

        private final Deque<String> replies;
        private int calls;

        ScriptedOracle(String apiKey, String... replies) {
            super(new ObjectMapper(), "http://localhost", apiKey, "test-model", 256,
                    Duration.ofSeconds(1), 3, Duration.ZERO, "Others");
            this.replies = new ArrayDeque<>();
            for (String reply : replies) {
                this.replies.add(reply == null ? "<io-error>" : reply);
            }
        }

        @Override
        protected String requestCompletion(String prompt) throws IOException {
            calls++;
            String reply = replies.poll();
            if (reply == null || reply.equals("<io-error>")) {
                throw new IOException("connection reset");
            }
            return reply;
        }
    }

    @Test
    void shouldReturnProposalFromFirstGoodReply() {
        ScriptedOracle oracle = new ScriptedOracle("key", "{\"subtags\": [\"OpenAI\"], \"primary_hint\": \"AI Model\"}");

        OracleResult result = oracle.classify("GPT-5", "New model", Taxonomy.empty());

        assertEquals(OracleResult.Outcome.PROPOSED, result.outcome());
        assertEquals(List.of("OpenAI"), result.proposedNames());
        assertEquals("AI Model", result.primaryHint());
        assertEquals(1, oracle.calls);
    }

    @Test
    void shouldRetryTransportErrorsAndUnparsableReplies() {
        ScriptedOracle oracle = new ScriptedOracle("key", null, "no json here", "{\"subtags\": [\"Figma\"]}");

        OracleResult result = oracle.classify("Figma import", "", Taxonomy.empty());

        assertEquals(OracleResult.Outcome.PROPOSED, result.outcome());
        assertEquals(3, oracle.calls);
    }

    @Test
    void shouldFailAfterMaxAttempts() {
        ScriptedOracle oracle = new ScriptedOracle("key", null, null, null, "{\"subtags\": [\"late\"]}");

        OracleResult result = oracle.classify("Anything", "", Taxonomy.empty());

        assertEquals(OracleResult.Outcome.FAILED, result.outcome());
        assertEquals("connection reset", result.failureReason());
        assertEquals(3, oracle.calls);
    }

    @Test
    void shouldReportEmptyListAsNotClassifiable() {
        ScriptedOracle oracle = new ScriptedOracle("key", "{\"subtags\": []}");

        assertEquals(OracleResult.Outcome.NOT_CLASSIFIABLE,
                oracle.classify("Bug fixes", "", Taxonomy.empty()).outcome());
    }

    @Test
    void shouldFailWithoutCallingWhenNoApiKey() {
        ScriptedOracle oracle = new ScriptedOracle("", "{\"subtags\": [\"OpenAI\"]}");

        OracleResult result = oracle.classify("GPT-5", "", Taxonomy.empty());

        assertEquals(OracleResult.Outcome.FAILED, result.outcome());
        assertEquals(0, oracle.calls);
    }
}
