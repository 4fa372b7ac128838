package com.flagship.cash_ledger.matching;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Exact subset sum over signed decimal amounts.
 *
 * Amounts are scaled to integers (4 decimal places) so equality is exact.
 * Depth-first search prunes a branch as soon as the remaining positive and
 * negative amounts can no longer reach the target. Only non-empty subsets
 * are reported.
 */
public final class SubsetSumSolver {

    private static final int SCALE = 4;

    private SubsetSumSolver() {
    }

    /**
     * @param amounts      signed candidate amounts
     * @param target       signed target sum
     * @param maxSolutions stop after this many solutions
     * @return index lists of matching subsets, ascending indices, at most {@code maxSolutions}
     */
    public static List<List<Integer>> solve(List<BigDecimal> amounts, BigDecimal target, int maxSolutions) {
        int n = amounts.size();
        long[] values = new long[n];
        for (int i = 0; i < n; i++) {
            values[i] = toUnits(amounts.get(i));
        }
        long[] suffixPositive = new long[n + 1];
        long[] suffixNegative = new long[n + 1];
        for (int i = n - 1; i >= 0; i--) {
            suffixPositive[i] = suffixPositive[i + 1] + Math.max(values[i], 0);
            suffixNegative[i] = suffixNegative[i + 1] + Math.min(values[i], 0);
        }

        List<List<Integer>> solutions = new ArrayList<>();
        search(values, toUnits(target), 0, 0L, new ArrayList<>(), suffixPositive, suffixNegative, solutions, maxSolutions);
        return solutions;
    }

    private static void search(long[] values, long target, int index, long sum, List<Integer> chosen,
                               long[] suffixPositive, long[] suffixNegative,
                               List<List<Integer>> solutions, int maxSolutions) {
        if (solutions.size() >= maxSolutions) {
            return;
        }
        if (index == values.length) {
            if (sum == target && !chosen.isEmpty()) {
                solutions.add(List.copyOf(chosen));
            }
            return;
        }
        if (sum + suffixPositive[index] < target || sum + suffixNegative[index] > target) {
            return;
        }

        chosen.add(index);
        search(values, target, index + 1, sum + values[index], chosen, suffixPositive, suffixNegative, solutions, maxSolutions);
        chosen.remove(chosen.size() - 1);

        search(values, target, index + 1, sum, chosen, suffixPositive, suffixNegative, solutions, maxSolutions);
    }

    private static long toUnits(BigDecimal amount) {
        return amount.setScale(SCALE, RoundingMode.UNNECESSARY).unscaledValue().longValueExact();
    }
}
