package com.ace.eval.evaluator.backend;

import com.ace.eval.config.AceProperties;
import com.ace.eval.evaluator.EvaluationException;
import com.ace.eval.evaluator.EvaluatorModels.TextScore;
import com.ace.eval.task.TaskModels.Dimension;
import com.ace.eval.task.TaskModels.FailureType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class OpenAiTextScoringModelTest {
    private static final String URL = "http://llm.test/v1/chat/completions";
    private static final Set<Dimension> ACE = EnumSet.allOf(Dimension.class);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockRestServiceServer server;
    private OpenAiTextScoringModel model;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        AceProperties properties = new AceProperties();
        properties.getScoring().getText().setBaseUrl("http://llm.test");
        properties.getScoring().getText().setApiKey("test-key");
        model = new OpenAiTextScoringModel(restTemplate, objectMapper, properties);
    }

    @Test
    @DisplayName("sends a json-mode chat request and rescales the 0-100 answer")
    void scoresCompletion() throws Exception {
        String content = "Here you go: {\"analysis_score\": 80, \"communication_score\": 65, \"evaluation_score\": 90,"
                + " \"confidence\": 0.7, \"overall_feedback\": \"Tighten the conclusion.\"}";
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer test-key"))
                .andExpect(jsonPath("$.model").value("gpt-4o-mini"))
                .andExpect(jsonPath("$.response_format.type").value("json_object"))
                .andRespond(withSuccess(completion(content), MediaType.APPLICATION_JSON));

        TextScore score = model.score("An essay about trade.", ACE);

        server.verify();
        assertEquals(0.8, score.scores().get(Dimension.ANALYSIS), 1e-9);
        assertEquals(0.65, score.scores().get(Dimension.COMMUNICATION), 1e-9);
        assertEquals(0.9, score.scores().get(Dimension.EVALUATION), 1e-9);
        assertEquals(0.7, score.confidence());
        assertEquals("Tighten the conclusion.", score.feedback());
    }

    @Test
    void missingConfidenceFallsBackToDefault() throws Exception {
        server.expect(requestTo(URL))
                .andRespond(withSuccess(completion("{\"analysis_score\": 50}"), MediaType.APPLICATION_JSON));

        TextScore score = model.score("text", EnumSet.of(Dimension.ANALYSIS));

        assertEquals(0.5, score.scores().get(Dimension.ANALYSIS), 1e-9);
        assertEquals(0.8, score.confidence());
    }

    @Test
    void serverErrorIsRetryableFailure() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        EvaluationException e = assertThrows(EvaluationException.class, () -> model.score("text", ACE));

        assertEquals(FailureType.UPSTREAM_FAILURE, e.type());
    }

    @Test
    void socketTimeoutIsUpstreamTimeout() {
        server.expect(requestTo(URL)).andRespond(withException(new SocketTimeoutException("read timed out")));

        EvaluationException e = assertThrows(EvaluationException.class, () -> model.score("text", ACE));

        assertEquals(FailureType.UPSTREAM_TIMEOUT, e.type());
    }

    @Test
    void malformedContentIsUpstreamFailure() {
        EvaluationException e = assertThrows(EvaluationException.class,
                () -> model.parse("{\"choices\": [{\"message\": {\"content\": \"{not json\"}}]}", ACE));

        assertEquals(FailureType.UPSTREAM_FAILURE, e.type());
    }

    private String completion(String content) throws Exception {
        return objectMapper.writeValueAsString(Map.of("choices",
                List.of(Map.of("message", Map.of("role", "assistant", "content", content)))));
    }
}
