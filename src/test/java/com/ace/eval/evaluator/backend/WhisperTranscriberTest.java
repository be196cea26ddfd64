package com.ace.eval.evaluator.backend;

import com.ace.eval.config.AceProperties;
import com.ace.eval.evaluator.EvaluationException;
import com.ace.eval.evaluator.EvaluatorModels.Transcript;
import com.ace.eval.task.TaskModels.FailureType;
import com.ace.eval.task.TaskModels.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class WhisperTranscriberTest {
    private static final String AUDIO = "http://audio.test/recordings/o-1.mp3";
    private static final String TRANSCRIBE = "http://asr.test/v1/audio/transcriptions";
    private static final Task TASK = new Task("o-1", "l-1", "a-1", "AUDIO", Map.of("audioRef", AUDIO), "oral");

    private MockRestServiceServer server;
    private WhisperTranscriber transcriber;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        AceProperties properties = new AceProperties();
        properties.getScoring().getAudio().setBaseUrl("http://asr.test");
        properties.getScoring().getAudio().setApiKey("asr-key");
        transcriber = new WhisperTranscriber(restTemplate, properties);
    }

    @Test
    void downloadsAndTranscribes() {
        server.expect(requestTo(AUDIO)).andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(new byte[]{1, 2, 3}, MediaType.APPLICATION_OCTET_STREAM));
        server.expect(requestTo(TRANSCRIBE)).andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer asr-key"))
                .andRespond(withSuccess("{\"text\": \"I would argue that\"}", MediaType.APPLICATION_JSON));

        Transcript transcript = transcriber.transcribe(TASK, AUDIO, "mp3");

        server.verify();
        assertEquals("I would argue that", transcript.text());
        assertEquals(0.9, transcript.confidence());
    }

    @Test
    void missingRecordingIsASchemaError() {
        server.expect(requestTo(AUDIO)).andRespond(withStatus(HttpStatus.NOT_FOUND));

        EvaluationException e = assertThrows(EvaluationException.class, () -> transcriber.transcribe(TASK, AUDIO, "mp3"));

        assertEquals(FailureType.SCHEMA_ERROR, e.type());
    }

    @Test
    void throttledDownloadIsRetryable() {
        server.expect(requestTo(AUDIO)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        EvaluationException e = assertThrows(EvaluationException.class, () -> transcriber.transcribe(TASK, AUDIO, "mp3"));

        assertEquals(FailureType.UPSTREAM_FAILURE, e.type());
    }

    @Test
    void providerRejectionIsASchemaError() {
        server.expect(requestTo(AUDIO)).andRespond(withSuccess(new byte[]{1}, MediaType.APPLICATION_OCTET_STREAM));
        server.expect(requestTo(TRANSCRIBE)).andRespond(withBadRequest().body("{\"error\":\"invalid file\"}"));

        EvaluationException e = assertThrows(EvaluationException.class, () -> transcriber.transcribe(TASK, AUDIO, "mp3"));

        assertEquals(FailureType.SCHEMA_ERROR, e.type());
    }

    @Test
    void providerOutageIsRetryable() {
        server.expect(requestTo(AUDIO)).andRespond(withSuccess(new byte[]{1}, MediaType.APPLICATION_OCTET_STREAM));
        server.expect(requestTo(TRANSCRIBE)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        EvaluationException e = assertThrows(EvaluationException.class, () -> transcriber.transcribe(TASK, AUDIO, "mp3"));

        assertTrue(e.retryable());
    }

    @Test
    void invalidReferenceIsASchemaError() {
        EvaluationException e = assertThrows(EvaluationException.class,
                () -> transcriber.transcribe(TASK, "not a uri", "mp3"));

        assertEquals(FailureType.SCHEMA_ERROR, e.type());
    }

    @Test
    void storageKeyReferenceIsASchemaErrorWithoutAnyDownload() {
        EvaluationException e = assertThrows(EvaluationException.class,
                () -> transcriber.transcribe(TASK, "recordings/o-1.wav", "wav"));

        assertEquals(FailureType.SCHEMA_ERROR, e.type());
        server.verify();
    }
}
