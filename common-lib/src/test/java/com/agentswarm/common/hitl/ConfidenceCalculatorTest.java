package com.agentswarm.common.hitl;

import com.agentswarm.common.model.ActionCategory;
import com.agentswarm.common.model.ActionRecord;
import com.agentswarm.common.model.PendingAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceCalculatorTest {

    private static ActionRecord decision(Boolean approved) {
        return new ActionRecord("custom_action", null, null, List.of(), approved, null, 0.6, Instant.EPOCH);
    }

    @Nested
    @DisplayName("calculate()")
    class Calculate {

        @Test
        @DisplayName("base prior per category without history")
        void basePrior() {
            PendingAction action = PendingAction.of("file_read");
            assertEquals(0.9, ConfidenceCalculator.calculate(action, ActionCategory.SAFE, OptionalDouble.empty(), null), 1e-9);
            assertEquals(0.1, ConfidenceCalculator.calculate(action, ActionCategory.CRITICAL, OptionalDouble.empty(), null), 1e-9);
        }

        @Test
        @DisplayName("learned confidence blended 0.3 base / 0.7 learned")
        void blended() {
            double result = ConfidenceCalculator.calculate(PendingAction.of("custom_action"),
                ActionCategory.MODERATE, OptionalDouble.of(1.0), null);

            assertEquals(0.3 * 0.6 + 0.7 * 1.0, result, 1e-9);
        }

        @Test
        @DisplayName("production and sensitive target both scale down")
        void productionSensitiveTarget() {
            PendingAction action = new PendingAction("git_push", "origin/main", "production", null, null);

            double result = ConfidenceCalculator.calculate(action, ActionCategory.MODERATE,
                OptionalDouble.empty(), "production");

            assertEquals(0.6 * 0.7 * 0.8, result, 1e-9);
        }

        @Test
        @DisplayName("production is strictly below development for the same action")
        void productionBelowDevelopment() {
            PendingAction action = PendingAction.of("custom_action", "feature/login");
            for (ActionCategory category : ActionCategory.values()) {
                for (OptionalDouble learned : List.of(OptionalDouble.empty(), OptionalDouble.of(0.0),
                                                      OptionalDouble.of(0.5), OptionalDouble.of(1.0))) {
                    double production = ConfidenceCalculator.calculate(action, category, learned, "production");
                    double development = ConfidenceCalculator.calculate(action, category, learned, "development");

                    assertTrue(production < development, category + " learned=" + learned);
                }
            }
        }

        @Test
        @DisplayName("development scales up but stays clamped to 1")
        void developmentClamped() {
            double result = ConfidenceCalculator.calculate(PendingAction.of("file_read"), ActionCategory.SAFE,
                OptionalDouble.of(1.0), "development");

            assertEquals(1.0, result, 1e-9);
        }

        @Test
        @DisplayName("override wins over everything")
        void override() {
            PendingAction action = new PendingAction("database_drop", "prod_db", "production", null, 0.95);

            assertEquals(0.95, ConfidenceCalculator.calculate(action, ActionCategory.CRITICAL,
                OptionalDouble.of(0.0), "production"), 1e-9);
        }
    }

    @Nested
    @DisplayName("learnedConfidence()")
    class Learned {

        @Test
        @DisplayName("no history → empty")
        void empty() {
            assertTrue(ConfidenceCalculator.learnedConfidence(List.of()).isEmpty());
            assertTrue(ConfidenceCalculator.learnedConfidence(List.of(decision(null))).isEmpty());
        }

        @Test
        @DisplayName("approvals push above 0.5, rejections below")
        void direction() {
            List<ActionRecord> approvals = List.of(decision(true), decision(true), decision(true),
                decision(true), decision(true));
            List<ActionRecord> rejections = List.of(decision(false), decision(false), decision(false),
                decision(false), decision(false));

            assertTrue(ConfidenceCalculator.learnedConfidence(approvals).getAsDouble() > 0.5);
            assertTrue(ConfidenceCalculator.learnedConfidence(rejections).getAsDouble() < 0.5);
        }

        @Test
        @DisplayName("newest decision weighs most")
        void recencyWeighted() {
            // newest first: one approval after one rejection
            double value = ConfidenceCalculator.learnedConfidence(List.of(decision(true), decision(false))).getAsDouble();

            assertEquals(1.0 / (1.0 + ConfidenceCalculator.LEARNING_DECAY), value, 1e-9);
        }

        @Test
        @DisplayName("only the newest 50 resolved records count")
        void historyLimit() {
            List<ActionRecord> newestFirst = new ArrayList<>();
            for (int i = 0; i < ConfidenceCalculator.LEARNING_HISTORY; i++) {
                newestFirst.add(decision(true));
            }
            for (int i = 0; i < 200; i++) {
                newestFirst.add(decision(false));
            }

            assertEquals(1.0, ConfidenceCalculator.learnedConfidence(newestFirst).getAsDouble(), 1e-9);
        }
    }

    @Test
    @DisplayName("sensitive target markers")
    void sensitiveTarget() {
        assertTrue(ConfidenceCalculator.isSensitiveTarget("prod_db"));
        assertTrue(ConfidenceCalculator.isSensitiveTarget("refs/heads/master"));
        assertFalse(ConfidenceCalculator.isSensitiveTarget("feature/login"));
        assertFalse(ConfidenceCalculator.isSensitiveTarget(null));
    }
}
