package com.iimsoft.planner.optimization;

import com.iimsoft.planner.error.ErrorCode;
import com.iimsoft.planner.error.InvalidInputException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OptimizationParametersTest {

    @Test
    void defaults_areValid() {
        OptimizationParameters p = new OptimizationParameters();
        assertThatCode(p::validate).doesNotThrowAnyException();
        assertThat(p.algorithm).isEqualTo(OptimizationAlgorithm.GREEDY);
        assertThat(p.maxIterations).isEqualTo(1000);
    }

    @Test
    void weightsNotSummingToOne_areRejected() {
        OptimizationParameters p = OptimizationParameters.of(OptimizationAlgorithm.GENETIC).withWeights(0.5, 0.5, 0.5);
        assertInvalid(p);
    }

    @Test
    void weightSum_toleratesRounding() {
        OptimizationParameters p = new OptimizationParameters().withWeights(0.1, 0.2, 0.7000001);
        assertThatCode(p::validate).doesNotThrowAnyException();
    }

    @Test
    void negativeWeight_isRejected() {
        assertInvalid(new OptimizationParameters().withWeights(1.2, -0.2, 0.0));
    }

    @Test
    void nonPositiveIterationsOrTolerance_areRejected() {
        OptimizationParameters noIterations = new OptimizationParameters();
        noIterations.maxIterations = 0;
        assertInvalid(noIterations);

        OptimizationParameters noTolerance = new OptimizationParameters();
        noTolerance.tolerance = 0.0;
        assertInvalid(noTolerance);

        OptimizationParameters noAlgorithm = new OptimizationParameters();
        noAlgorithm.algorithm = null;
        assertInvalid(noAlgorithm);
    }

    @Test
    void algorithmLabels() {
        assertThat(OptimizationAlgorithm.fromString("simulated_annealing")).isEqualTo(OptimizationAlgorithm.SIMULATED_ANNEALING);
        assertThat(OptimizationAlgorithm.fromString("nope")).isEqualTo(OptimizationAlgorithm.GREEDY);
    }

    private static void assertInvalid(OptimizationParameters p) {
        assertThatThrownBy(p::validate)
                .isInstanceOfSatisfying(InvalidInputException.class,
                        e -> assertThat(e.getCode()).isEqualTo(ErrorCode.INVALID_PARAMETERS));
    }
}
