package com.extractpilot.orchestrator.config;

import com.extractpilot.orchestrator.retry.EscalationPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All tunables of the reflective execution engine, bound from the
 * {@code extractpilot.*} section of application.yml.
 *
 * Read-only once the context has started: the same instance is shared by
 * every document pipeline running in the worker pool.
 *
 * Every field has a default so tests can construct the class directly
 * and override only what they exercise.
 */
@ConfigurationProperties(prefix = "extractpilot")
public class ExtractPilotProperties {

    private final Claude     claude     = new Claude();
    private final Retry      retry      = new Retry();
    private final Confidence confidence = new Confidence();
    private final Validation validation = new Validation();
    private final Scheduler  scheduler  = new Scheduler();

    // Keyed by StepKind.key(): "parse", "retrieve", "generate".
    private Map<String, StepSettings>    steps   = new LinkedHashMap<>();
    private Map<String, RubricSettings>  rubrics = new LinkedHashMap<>();

    public Claude     getClaude()     { return claude; }
    public Retry      getRetry()      { return retry; }
    public Confidence getConfidence() { return confidence; }
    public Validation getValidation() { return validation; }
    public Scheduler  getScheduler()  { return scheduler; }

    public Map<String, StepSettings>   getSteps()   { return steps; }
    public Map<String, RubricSettings> getRubrics() { return rubrics; }

    public void setSteps(Map<String, StepSettings> steps)       { this.steps = steps; }
    public void setRubrics(Map<String, RubricSettings> rubrics) { this.rubrics = rubrics; }

    // ------------------------------------------------------------------
    // Nested sections
    // ------------------------------------------------------------------

    public static class Claude {
        private String   apiKey;
        private String   baseUrl      = "https://api.anthropic.com";
        private String   workerModel  = "claude-sonnet-4-6";
        private String   judgeModel   = "claude-sonnet-4-6";
        private int      maxTokens    = 4096;
        private Duration timeout      = Duration.ofSeconds(120);
        // Attempts per HTTP call on 429/5xx before the error is surfaced.
        private int      maxAttempts  = 3;
        private Duration backoff      = Duration.ofSeconds(2);

        public String   getApiKey()      { return apiKey; }
        public String   getBaseUrl()     { return baseUrl; }
        public String   getWorkerModel() { return workerModel; }
        public String   getJudgeModel()  { return judgeModel; }
        public int      getMaxTokens()   { return maxTokens; }
        public Duration getTimeout()     { return timeout; }
        public int      getMaxAttempts() { return maxAttempts; }
        public Duration getBackoff()     { return backoff; }

        public void setApiKey(String v)      { this.apiKey = v; }
        public void setBaseUrl(String v)     { this.baseUrl = v; }
        public void setWorkerModel(String v) { this.workerModel = v; }
        public void setJudgeModel(String v)  { this.judgeModel = v; }
        public void setMaxTokens(int v)      { this.maxTokens = v; }
        public void setTimeout(Duration v)   { this.timeout = v; }
        public void setMaxAttempts(int v)    { this.maxAttempts = v; }
        public void setBackoff(Duration v)   { this.backoff = v; }
    }

    public static class Retry {
        // Attempts per step (not retries on top of the first attempt).
        private int maxStepRetries     = 3;
        // Retries (attempts beyond the first) summed over a whole run.
        private int maxGlobalRetries   = 5;
        private int feedbackCapacity   = 10;
        private int stagnationRepeats  = 2;

        public int getMaxStepRetries()    { return maxStepRetries; }
        public int getMaxGlobalRetries()  { return maxGlobalRetries; }
        public int getFeedbackCapacity()  { return feedbackCapacity; }
        public int getStagnationRepeats() { return stagnationRepeats; }

        public void setMaxStepRetries(int v)    { this.maxStepRetries = v; }
        public void setMaxGlobalRetries(int v)  { this.maxGlobalRetries = v; }
        public void setFeedbackCapacity(int v)  { this.feedbackCapacity = v; }
        public void setStagnationRepeats(int v) { this.stagnationRepeats = v; }
    }

    public static class Confidence {
        private double reviewThreshold       = 0.75;
        private double validationPassTarget  = 0.8;
        private Map<String, Double> weights  = defaultWeights();

        private static Map<String, Double> defaultWeights() {
            Map<String, Double> w = new LinkedHashMap<>();
            w.put("judge",      0.5);
            w.put("structural", 0.3);
            w.put("validation", 0.2);
            return w;
        }

        public double              getReviewThreshold()      { return reviewThreshold; }
        public double              getValidationPassTarget() { return validationPassTarget; }
        public Map<String, Double> getWeights()              { return weights; }

        public void setReviewThreshold(double v)       { this.reviewThreshold = v; }
        public void setValidationPassTarget(double v)  { this.validationPassTarget = v; }
        public void setWeights(Map<String, Double> v)  { this.weights = v; }
    }

    public static class Validation {
        // Field names the final metadata must contain; a missing one is an error.
        private List<String> requiredFields = new ArrayList<>();

        public List<String> getRequiredFields()        { return requiredFields; }
        public void setRequiredFields(List<String> v)  { this.requiredFields = v; }
    }

    public static class Scheduler {
        private boolean  enabled      = true;
        private int      workers      = 4;
        private Duration stallTimeout = Duration.ofMinutes(15);

        public boolean  isEnabled()       { return enabled; }
        public int      getWorkers()      { return workers; }
        public Duration getStallTimeout() { return stallTimeout; }

        public void setEnabled(boolean v)       { this.enabled = v; }
        public void setWorkers(int v)           { this.workers = v; }
        public void setStallTimeout(Duration v) { this.stallTimeout = v; }
    }

    /** Per step-kind worker settings. */
    public static class StepSettings {
        private String  goal       = "";
        // Overrides retry.max-step-retries for this step when set.
        private Integer maxRetries;

        public String  getGoal()       { return goal; }
        public Integer getMaxRetries() { return maxRetries; }

        public void setGoal(String v)        { this.goal = v; }
        public void setMaxRetries(Integer v) { this.maxRetries = v; }
    }

    /** Per step-kind judge rubric. */
    public static class RubricSettings {
        private String description = "";
        private double acceptThreshold = 0.8;
        private double reviseMin       = 0.5;
        private EscalationPolicy escalation = EscalationPolicy.RETRY;
        // Dimension name -> list of checks the judge applies.
        private Map<String, List<String>> criteria = new LinkedHashMap<>();

        public String                    getDescription()     { return description; }
        public double                    getAcceptThreshold() { return acceptThreshold; }
        public double                    getReviseMin()       { return reviseMin; }
        public EscalationPolicy          getEscalation()      { return escalation; }
        public Map<String, List<String>> getCriteria()        { return criteria; }

        public void setDescription(String v)                 { this.description = v; }
        public void setAcceptThreshold(double v)             { this.acceptThreshold = v; }
        public void setReviseMin(double v)                   { this.reviseMin = v; }
        public void setEscalation(EscalationPolicy v)        { this.escalation = v; }
        public void setCriteria(Map<String, List<String>> v) { this.criteria = v; }
    }
}
