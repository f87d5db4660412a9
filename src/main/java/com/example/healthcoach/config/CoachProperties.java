package com.example.healthcoach.config;

import com.example.healthcoach.model.HealthMetric;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Binds the {@code coach.*} properties.
 */
@Data
@ConfigurationProperties(prefix = "coach")
public class CoachProperties {

    /** Longest question accepted before truncation. */
    private int maxQueryChars = 2000;

    private Profile profile = new Profile();
    private Retrieval retrieval = new Retrieval();
    private Router router = new Router();
    private Backends backends = new Backends();
    private Scenario scenario = new Scenario();

    @Data
    public static class Profile {
        private String name = "the user";

        /** Days averaged into the baselines. */
        private int baselineDays = 90;

        /** How long a loaded profile is served before it is re-read. */
        private Duration ttl = Duration.ofHours(1);

        private Map<HealthMetric, Double> goals = defaultGoals();

        private static Map<HealthMetric, Double> defaultGoals() {
            Map<HealthMetric, Double> goals = new EnumMap<>(HealthMetric.class);
            goals.put(HealthMetric.SYSTOLIC, 130.0);
            goals.put(HealthMetric.SLEEP_HOURS, 7.0);
            goals.put(HealthMetric.STEPS, 10000.0);
            goals.put(HealthMetric.VO2_MAX, 43.0);
            return goals;
        }
    }

    @Data
    public static class Retrieval {
        /** Similar days per query, between 3 and 5. */
        private int similarDays = 3;
        private double minSimilarity = 0.0;
        private int historyTurns = 10;
        /** Wider window for trend and comparison questions. */
        private int supportingDays = 30;
        private int predictionDays = 14;
    }

    @Data
    public static class Router {
        /** Routes medium-complexity questions to the local backend. */
        private boolean costConstrained = false;
    }

    @Data
    public static class Backends {
        private Backend reasoning = new Backend("https://api.openai.com/v1", "gpt-4o", 0.015);
        private Backend validation = new Backend("https://api.openai.com/v1", "gpt-4o-mini", 0.03);
        private Backend local = new Backend("http://localhost:11434/v1", "llama3.1", 0.0);
    }

    @Data
    public static class Backend {
        private boolean enabled = true;
        private String baseUrl;
        private String apiKey;
        private String model;
        private double temperature = 0.2;
        private int maxTokens = 1024;
        private Duration timeout = Duration.ofSeconds(30);
        private double costPer1kTokens;

        public Backend() {
        }

        public Backend(String baseUrl, String model, double costPer1kTokens) {
            this.baseUrl = baseUrl;
            this.model = model;
            this.costPer1kTokens = costPer1kTokens;
        }
    }

    @Data
    public static class Scenario {
        private int trials = 1000;
        private long seed = 42L;
        private int horizonDays = 90;
        private double diastolicRatio = 0.5;
        private DiastolicMode diastolicMode = DiastolicMode.FIXED;
    }

    public enum DiastolicMode {
        /** Fixed {@code diastolicRatio} for every user. */
        FIXED,
        /** Ratio of the user's baseline diastolic to systolic, falling back to the fixed ratio. */
        PROFILE
    }
}
