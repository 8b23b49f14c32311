package io.sqlpulse.monitor.engine.recommendation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Advice items returned by the reasoning service, as parsed from the model's text
 */
public final class ReasoningResponse {

    public static final class Item {
        private final List<String> findingKeys;
        private final String priority;
        private final String advice;
        private final String command;

        public Item(List<String> findingKeys, String priority, String advice, String command) {
            this.findingKeys = List.copyOf(findingKeys);
            this.priority = priority;
            this.advice = advice;
            this.command = command;
        }

        public List<String> getFindingKeys() { return findingKeys; }
        public String getPriority() { return priority; }
        public String getAdvice() { return advice; }
        public String getCommand() { return command; }
    }

    private final List<Item> items;

    public ReasoningResponse(List<Item> items) {
        this.items = List.copyOf(items);
    }

    public List<Item> getItems() {
        return items;
    }

    /**
     * Parses {@code {"recommendations":[{"findings":[..],"priority":"..","advice":"..","command":".."}]}}
     * from the model output, tolerating text around the JSON object. Items without advice are dropped.
     *
     * @throws RecommendationServiceException when no JSON object with a recommendations array is found
     */
    public static ReasoningResponse parse(String text, ObjectMapper mapper) throws RecommendationServiceException {
        if (text == null) {
            throw new RecommendationServiceException("Empty response from reasoning service");
        }
        int start = text.indexOf('{');
        int end = text.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new RecommendationServiceException("Response contains no JSON object");
        }

        JsonNode root;
        try {
            root = mapper.readTree(text.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new RecommendationServiceException("Response is not valid JSON: " + e.getOriginalMessage(), e);
        }

        JsonNode recommendations = root.path("recommendations");
        if (!recommendations.isArray()) {
            throw new RecommendationServiceException("Response has no recommendations array");
        }

        List<Item> items = new ArrayList<>();
        for (JsonNode node : recommendations) {
            String advice = node.path("advice").asText("").trim();
            if (advice.isEmpty()) {
                continue;
            }
            List<String> keys = new ArrayList<>();
            node.path("findings").forEach(key -> keys.add(key.asText()));
            String command = node.path("command").asText("").trim();
            items.add(new Item(keys, node.path("priority").asText(""), advice, command.isEmpty() ? null : command));
        }
        return new ReasoningResponse(items);
    }
}
