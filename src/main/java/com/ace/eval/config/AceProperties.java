package com.ace.eval.config;

import com.ace.eval.task.TaskKinds;
import com.ace.eval.task.TaskModels.Dimension;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.*;

@Component
@ConfigurationProperties(prefix = "ace")
public class AceProperties {
    public static final String STANDARD_LANE = "standard";
    public static final String AUDIO_LANE = "audio";

    private static final Map<String, Duration> BUILT_IN_TIMEOUTS = Map.of(
            TaskKinds.MCQ, Duration.ofSeconds(2),
            TaskKinds.TEXT, Duration.ofSeconds(20),
            TaskKinds.AUDIO, Duration.ofSeconds(180));

    private Execution execution = new Execution();
    private Dispatch dispatch = new Dispatch();
    private Scoring scoring = new Scoring();
    private Map<String, Map<String, Double>> rubrics = new LinkedHashMap<>();

    public Execution getExecution() { return execution; }
    public void setExecution(Execution execution) { this.execution = execution; }
    public Dispatch getDispatch() { return dispatch; }
    public void setDispatch(Dispatch dispatch) { this.dispatch = dispatch; }
    public Scoring getScoring() { return scoring; }
    public void setScoring(Scoring scoring) { this.scoring = scoring; }
    public Map<String, Map<String, Double>> getRubrics() { return rubrics; }
    public void setRubrics(Map<String, Map<String, Double>> rubrics) { this.rubrics = rubrics; }

    /**
     * Per-kind evaluation timeout. Configured values win over the built-in ones; unknown kinds get the default.
     */
    public Duration timeoutFor(String kind) {
        String normalized = TaskKinds.normalize(kind);
        for (var entry : execution.timeouts.entrySet()) {
            if (TaskKinds.normalize(entry.getKey()).equals(normalized)) {
                return entry.getValue();
            }
        }
        return BUILT_IN_TIMEOUTS.getOrDefault(normalized, execution.defaultTimeout);
    }

    public Map<String, Lane> lanes() {
        if (!dispatch.lanes.isEmpty()) {
            return dispatch.lanes;
        }
        Map<String, Lane> defaults = new LinkedHashMap<>();
        defaults.put(STANDARD_LANE, new Lane(4, 10_000, List.of(TaskKinds.MCQ, TaskKinds.TEXT)));
        defaults.put(AUDIO_LANE, new Lane(2, 1_000, List.of(TaskKinds.AUDIO)));
        return defaults;
    }

    public String laneFor(String kind) {
        String normalized = TaskKinds.normalize(kind);
        for (var entry : lanes().entrySet()) {
            boolean served = entry.getValue().getKinds().stream()
                    .map(TaskKinds::normalize)
                    .anyMatch(k -> k.equals(normalized));
            if (served) {
                return entry.getKey();
            }
        }
        return dispatch.defaultLane;
    }

    public Map<Dimension, Double> dimensionWeights() {
        Map<Dimension, Double> weights = new EnumMap<>(Dimension.class);
        scoring.dimensionWeights.forEach((name, weight) -> weights.put(Dimension.parse(name), weight));
        return weights;
    }

    public static class Execution {
        private int maxAttempts = 5;
        private Duration backoffBase = Duration.ofMillis(500);
        private Duration backoffCap = Duration.ofSeconds(30);
        private Long backoffSeed;
        private Duration sweepGrace = Duration.ofSeconds(10);
        private Duration defaultTimeout = Duration.ofSeconds(30);
        private Map<String, Duration> timeouts = new LinkedHashMap<>();

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getBackoffBase() { return backoffBase; }
        public void setBackoffBase(Duration backoffBase) { this.backoffBase = backoffBase; }
        public Duration getBackoffCap() { return backoffCap; }
        public void setBackoffCap(Duration backoffCap) { this.backoffCap = backoffCap; }
        public Long getBackoffSeed() { return backoffSeed; }
        public void setBackoffSeed(Long backoffSeed) { this.backoffSeed = backoffSeed; }
        public Duration getSweepGrace() { return sweepGrace; }
        public void setSweepGrace(Duration sweepGrace) { this.sweepGrace = sweepGrace; }
        public Duration getDefaultTimeout() { return defaultTimeout; }
        public void setDefaultTimeout(Duration defaultTimeout) { this.defaultTimeout = defaultTimeout; }
        public Map<String, Duration> getTimeouts() { return timeouts; }
        public void setTimeouts(Map<String, Duration> timeouts) { this.timeouts = timeouts; }
    }

    public static class Dispatch {
        private String defaultLane = STANDARD_LANE;
        private Map<String, Lane> lanes = new LinkedHashMap<>();

        public String getDefaultLane() { return defaultLane; }
        public void setDefaultLane(String defaultLane) { this.defaultLane = defaultLane; }
        public Map<String, Lane> getLanes() { return lanes; }
        public void setLanes(Map<String, Lane> lanes) { this.lanes = lanes; }
    }

    public static class Lane {
        private int workers = 1;
        private int capacity = 1_000;
        private List<String> kinds = new ArrayList<>();

        public Lane() {
        }

        public Lane(int workers, int capacity, List<String> kinds) {
            this.workers = workers;
            this.capacity = capacity;
            this.kinds = new ArrayList<>(kinds);
        }

        public int getWorkers() { return workers; }
        public void setWorkers(int workers) { this.workers = workers; }
        public int getCapacity() { return capacity; }
        public void setCapacity(int capacity) { this.capacity = capacity; }
        public List<String> getKinds() { return kinds; }
        public void setKinds(List<String> kinds) { this.kinds = kinds; }
    }

    public static class Scoring {
        private Map<String, Double> dimensionWeights = new LinkedHashMap<>(Map.of(
                "analysis", 0.4, "communication", 0.3, "evaluation", 0.3));
        private double passingThreshold = 0.70;
        private double excellenceThreshold = 0.90;
        private Duration httpTimeout = Duration.ofSeconds(30);
        private Text text = new Text();
        private Audio audio = new Audio();

        public Map<String, Double> getDimensionWeights() { return dimensionWeights; }
        public void setDimensionWeights(Map<String, Double> dimensionWeights) { this.dimensionWeights = dimensionWeights; }
        public double getPassingThreshold() { return passingThreshold; }
        public void setPassingThreshold(double passingThreshold) { this.passingThreshold = passingThreshold; }
        public double getExcellenceThreshold() { return excellenceThreshold; }
        public void setExcellenceThreshold(double excellenceThreshold) { this.excellenceThreshold = excellenceThreshold; }
        public Duration getHttpTimeout() { return httpTimeout; }
        public void setHttpTimeout(Duration httpTimeout) { this.httpTimeout = httpTimeout; }
        public Text getText() { return text; }
        public void setText(Text text) { this.text = text; }
        public Audio getAudio() { return audio; }
        public void setAudio(Audio audio) { this.audio = audio; }
    }

    public static class Text {
        private String provider = "heuristic";
        private String baseUrl = "https://api.openai.com";
        private String apiKey;
        private String model = "gpt-4o-mini";
        private double defaultConfidence = 0.8;

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public double getDefaultConfidence() { return defaultConfidence; }
        public void setDefaultConfidence(double defaultConfidence) { this.defaultConfidence = defaultConfidence; }
    }

    public static class Audio {
        private String provider = "payload";
        private String baseUrl = "https://api.openai.com";
        private String apiKey;
        private String model = "whisper-1";
        private double defaultConfidence = 0.9;

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
        public double getDefaultConfidence() { return defaultConfidence; }
        public void setDefaultConfidence(double defaultConfidence) { this.defaultConfidence = defaultConfidence; }
    }
}
