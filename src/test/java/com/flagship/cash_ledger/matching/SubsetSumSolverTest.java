package com.flagship.cash_ledger.matching;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Subset sum tests.
 *
 * These tests verify that:
 * - Exact decimal subsets are found, including negative fees and refunds
 * - Several solutions are all reported up to the cap
 * - No solution yields an empty result, never the empty subset
 */
class SubsetSumSolverTest {

    private static List<BigDecimal> amounts(String... values) {
        return java.util.Arrays.stream(values).map(BigDecimal::new).toList();
    }

    @Test
    @DisplayName("Finds the unique subset with signed amounts")
    void uniqueSubsetWithFees() {
        List<List<Integer>> solutions = SubsetSumSolver.solve(
            amounts("100.00", "-2.90", "57.25", "33.10"), new BigDecimal("154.35"), 5);

        assertEquals(1, solutions.size());
        assertEquals(List.of(0, 1, 2), solutions.get(0));
    }

    @Test
    @DisplayName("Reports every subset up to the cap")
    void multipleSubsets() {
        List<BigDecimal> candidates = amounts("10", "10", "10", "20");

        List<List<Integer>> all = SubsetSumSolver.solve(candidates, new BigDecimal("20"), 10);
        List<List<Integer>> capped = SubsetSumSolver.solve(candidates, new BigDecimal("20"), 2);

        assertEquals(4, all.size(), "three pairs of tens plus the single twenty");
        assertEquals(2, capped.size());
    }

    @Test
    @DisplayName("No subset sums to the target")
    void noSolution() {
        assertTrue(SubsetSumSolver.solve(amounts("5.00", "7.00"), new BigDecimal("3.00"), 5).isEmpty());
        assertTrue(SubsetSumSolver.solve(List.of(), BigDecimal.ZERO, 5).isEmpty(),
            "The empty subset never counts");
    }

    @Test
    @DisplayName("Scale differences do not matter")
    void exactDecimalComparison() {
        List<List<Integer>> solutions = SubsetSumSolver.solve(amounts("0.1", "0.2"), new BigDecimal("0.3000"), 5);
        assertEquals(List.of(List.of(0, 1)), solutions);
    }
}
