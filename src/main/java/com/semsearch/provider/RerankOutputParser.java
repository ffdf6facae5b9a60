package com.semsearch.provider;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Turns free-form model output into a ranking. The expected answer is a JSON array of {@code {"id", "score"}}
 * objects, optionally wrapped in a markdown code fence. Anything else produces the uniform fallback ranking:
 * the first {@code topK} candidates in input order, scored {@code n - i}.
 */
public class RerankOutputParser {
    private static final Logger log = LoggerFactory.getLogger(RerankOutputParser.class);

    private final ObjectMapper mapper;

    public RerankOutputParser() {
        this(new ObjectMapper());
    }

    public RerankOutputParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public RerankOutcome parse(String content, List<RerankCandidate> candidates, int topK) {
        if (content == null || content.isBlank()) {
            return fallback(candidates, topK, "empty rerank response");
        }
        JsonNode root;
        try {
            root = mapper.readTree(stripCodeFence(content));
        } catch (JsonProcessingException e) {
            return fallback(candidates, topK, "rerank response is not JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isArray()) {
            return fallback(candidates, topK, "rerank response is not a JSON array");
        }

        List<RankedId> ranking = new ArrayList<>();
        for (JsonNode item : root) {
            JsonNode id = item.path("id");
            JsonNode score = item.path("score");
            if (!id.isValueNode() || id.asText().isBlank() || !score.isNumber()) {
                log.debug("Ignoring rerank entry without id/score: {}", item);
                continue;
            }
            ranking.add(new RankedId(id.asText(), clamp(score.asDouble())));
        }
        if (ranking.isEmpty() && !root.isEmpty()) {
            return fallback(candidates, topK, "rerank response has no usable {id, score} entries");
        }
        return RerankOutcome.parsed(ranking.stream()
                .sorted(Comparator.comparingDouble(RankedId::score).reversed())
                .limit(Math.max(0, topK))
                .toList());
    }

    public static List<RankedId> uniformRanking(List<RerankCandidate> candidates, int topK) {
        List<RankedId> ranking = new ArrayList<>();
        int limit = Math.min(Math.max(0, topK), candidates.size());
        for (int i = 0; i < limit; i++) {
            ranking.add(new RankedId(candidates.get(i).id(), candidates.size() - i));
        }
        return ranking;
    }

    private RerankOutcome fallback(List<RerankCandidate> candidates, int topK, String reason) {
        log.warn("Falling back to input-order ranking for {} candidates: {}", candidates.size(), reason);
        return RerankOutcome.fallbackUsed(uniformRanking(candidates, topK), reason);
    }

    static String stripCodeFence(String content) {
        String trimmed = content.strip();
        if (!trimmed.startsWith("```")) {
            return trimmed;
        }
        int firstNewline = trimmed.indexOf('\n');
        int closing = trimmed.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return trimmed;
        }
        return trimmed.substring(firstNewline + 1, closing).strip();
    }

    private static double clamp(double score) {
        return Math.max(0d, Math.min(100d, score));
    }
}
