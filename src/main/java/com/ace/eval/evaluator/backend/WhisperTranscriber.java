package com.ace.eval.evaluator.backend;

import com.ace.eval.config.AceProperties;
import com.ace.eval.evaluator.EvaluationException;
import com.ace.eval.evaluator.EvaluatorModels.Transcript;
import com.ace.eval.evaluator.Transcriber;
import com.ace.eval.task.TaskModels.Task;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.Locale;

/**
 * Fetches the recording and sends it to a Whisper-compatible transcription endpoint.
 * Audio the provider rejects as unreadable is a schema error; transport trouble is retryable.
 */
@Component
@ConditionalOnProperty(prefix = "ace.scoring.audio", name = "provider", havingValue = "whisper")
public class WhisperTranscriber implements Transcriber {
    private final RestTemplate restTemplate;
    private final AceProperties.Audio settings;

    public WhisperTranscriber(@Qualifier("scoringRestTemplate") RestTemplate restTemplate, AceProperties properties) {
        this.restTemplate = restTemplate;
        this.settings = properties.getScoring().getAudio();
    }

    @Override
    public String name() {
        return "whisper:" + settings.getModel();
    }

    @Override
    public Transcript transcribe(Task task, String audioRef, String format) {
        byte[] audio = download(audioRef);
        if (audio == null || audio.length == 0) {
            throw EvaluationException.schemaError("Audio at " + audioRef + " is empty");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        if (settings.getApiKey() != null && !settings.getApiKey().isBlank()) {
            headers.setBearerAuth(settings.getApiKey());
        }
        String filename = task.taskId() + "." + (format == null ? "wav" : format);
        MultiValueMap<String, Object> form = new LinkedMultiValueMap<>();
        form.add("model", settings.getModel());
        form.add("response_format", "json");
        form.add("file", new ByteArrayResource(audio) {
            @Override
            public String getFilename() {
                return filename;
            }
        });

        try {
            JsonNode body = restTemplate.postForObject(settings.getBaseUrl() + "/v1/audio/transcriptions",
                    new HttpEntity<>(form, headers), JsonNode.class);
            String text = body == null ? null : body.path("text").asText(null);
            return new Transcript(text, settings.getDefaultConfidence());
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().value() == 400) {
                throw EvaluationException.schemaError("Transcription provider rejected audio " + audioRef + ": " + e.getResponseBodyAsString());
            }
            throw EvaluationException.upstreamFailure("Transcription provider answered " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            throw transportFailure("Transcription provider", e);
        }
    }

    private byte[] download(String audioRef) {
        URI location;
        try {
            location = URI.create(audioRef);
        } catch (IllegalArgumentException e) {
            throw EvaluationException.schemaError("Audio reference is not a URI: " + audioRef);
        }
        String scheme = location.getScheme() == null ? "" : location.getScheme().toLowerCase(Locale.ROOT);
        if (!location.isAbsolute() || !(scheme.equals("http") || scheme.equals("https"))) {
            throw EvaluationException.schemaError("Audio reference is not an http(s) URL: " + audioRef);
        }
        try {
            return restTemplate.getForObject(location, byte[].class);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            if (e.getStatusCode().is4xxClientError() && status != 408 && status != 429) {
                throw EvaluationException.schemaError("Audio " + audioRef + " could not be fetched: " + status);
            }
            throw EvaluationException.upstreamFailure("Audio store answered " + status + " for " + audioRef, e);
        } catch (ResourceAccessException e) {
            throw transportFailure("Audio store", e);
        }
    }

    private static EvaluationException transportFailure(String what, ResourceAccessException e) {
        if (e.getCause() instanceof SocketTimeoutException) {
            return EvaluationException.upstreamTimeout(what + " timed out: " + e.getMessage());
        }
        return EvaluationException.upstreamFailure(what + " unreachable: " + e.getMessage(), e);
    }
}
