package com.ace.eval.evaluator.backend;

import com.ace.eval.config.AceProperties;
import com.ace.eval.evaluator.EvaluationException;
import com.ace.eval.evaluator.EvaluatorModels.TextScore;
import com.ace.eval.evaluator.TextScoringModel;
import com.ace.eval.task.TaskModels.Dimension;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.*;

/**
 * Chat-completions backed scorer. The model answers 0-100 per dimension; scores are rescaled to the unit interval.
 */
@Component
@ConditionalOnProperty(prefix = "ace.scoring.text", name = "provider", havingValue = "openai")
public class OpenAiTextScoringModel implements TextScoringModel {
    private static final Logger log = LoggerFactory.getLogger(OpenAiTextScoringModel.class);

    private static final String SYSTEM_PROMPT = "You are an academic evaluator using the ACE model.";
    private static final Map<Dimension, String> GUIDANCE = Map.of(
            Dimension.ANALYSIS, "Analysis: depth of thinking and logic.",
            Dimension.COMMUNICATION, "Communication: clarity and coherence of expression.",
            Dimension.EVALUATION, "Evaluation: soundness of reasoning and judgment.");

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final AceProperties.Text settings;

    public OpenAiTextScoringModel(@Qualifier("scoringRestTemplate") RestTemplate restTemplate,
                                  ObjectMapper objectMapper, AceProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.settings = properties.getScoring().getText();
    }

    @Override
    public String name() {
        return "openai:" + settings.getModel();
    }

    @Override
    public TextScore score(String text, Set<Dimension> dimensions) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (settings.getApiKey() != null && !settings.getApiKey().isBlank()) {
            headers.setBearerAuth(settings.getApiKey());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", settings.getModel());
        body.put("temperature", 0);
        body.put("response_format", Map.of("type", "json_object"));
        body.put("messages", List.of(
                Map.of("role", "system", "content", SYSTEM_PROMPT),
                Map.of("role", "user", "content", prompt(text, dimensions))));

        String raw;
        try {
            ResponseEntity<String> response = restTemplate.exchange(settings.getBaseUrl() + "/v1/chat/completions",
                    HttpMethod.POST, new HttpEntity<>(body, headers), String.class);
            raw = response.getBody();
        } catch (HttpStatusCodeException e) {
            throw EvaluationException.upstreamFailure("Scoring provider answered " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw EvaluationException.upstreamTimeout("Scoring provider timed out: " + e.getMessage());
            }
            throw EvaluationException.upstreamFailure("Scoring provider unreachable: " + e.getMessage(), e);
        }
        return parse(raw, dimensions);
    }

    TextScore parse(String raw, Set<Dimension> dimensions) {
        try {
            JsonNode completion = objectMapper.readTree(raw == null ? "" : raw);
            String content = completion.path("choices").path(0).path("message").path("content").asText("");
            JsonNode answer = objectMapper.readTree(extractJson(content));

            Map<Dimension, Double> scores = new EnumMap<>(Dimension.class);
            for (Dimension d : dimensions) {
                JsonNode value = answer.get(d.name().toLowerCase(Locale.ROOT) + "_score");
                if (value != null && value.isNumber()) {
                    scores.put(d, value.asDouble() / 100.0);
                }
            }
            JsonNode confidence = answer.get("confidence");
            Double resolvedConfidence = confidence != null && confidence.isNumber()
                    ? confidence.asDouble() : settings.getDefaultConfidence();
            return new TextScore(scores, resolvedConfidence, answer.path("overall_feedback").asText(null));
        } catch (JsonProcessingException e) {
            log.warn("Scoring provider returned unparseable content: {}", e.getOriginalMessage());
            throw EvaluationException.upstreamFailure("Scoring provider returned malformed JSON", e);
        }
    }

    private static String extractJson(String content) {
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        return start >= 0 && end > start ? content.substring(start, end + 1) : content;
    }

    private static String prompt(String text, Set<Dimension> dimensions) {
        StringBuilder sb = new StringBuilder()
                .append("Assess the following student response with the ACE framework.\n\n---\n")
                .append(text)
                .append("\n---\n\nFor each dimension:\n");
        dimensions.forEach(d -> sb.append("- ").append(GUIDANCE.get(d)).append('\n'));
        sb.append("\nReturn a JSON object with these fields:\n");
        dimensions.forEach(d -> sb.append("  \"").append(d.name().toLowerCase(Locale.ROOT)).append("_score\": number 0-100,\n"));
        sb.append("  \"confidence\": number 0-1,\n  \"overall_feedback\": string\n")
                .append("Feedback must be concise and actionable.");
        return sb.toString();
    }
}
