package com.clinicalguard.config;

import java.util.LinkedHashSet;
import java.util.Set;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

@Data
@ConfigurationProperties(prefix = "guard")
public class GuardProperties {

    private Snapshot snapshot = new Snapshot();
    private Fields fields = new Fields();
    private Aggregator aggregator = new Aggregator();
    private Decisions decisions = new Decisions();

    @Data
    public static class Snapshot {
        /** Delay between knowledge/rule reloads. */
        private long refreshIntervalMs = 60_000;
    }

    /**
     * Names of the structured fields read from an evaluation request.
     */
    @Data
    public static class Fields {
        private String medication = "medicationField";
        private String diagnosis = "diagnosisField";
        private String allergies = "allergiesField";
        private String currentMedications = "currentMedicationsField";
        private String listSeparator = "[,;\\n]";
    }

    @Data
    public static class Aggregator {
        /** Rule categories whose findings need supervisory sign-off. */
        private Set<String> supervisorCategories = new LinkedHashSet<>(Set.of("supervisory"));
    }

    @Data
    public static class Decisions {
        private int minJustificationLength = 10;
    }
}
