package com.github.asymptotic.dp;

import java.util.List;

import com.github.asymptotic.cost.CostExpression;

/**
 * A dynamic-programming table found in a function.
 *
 * @param dimensions number of indices the table is addressed with
 * @param fillPattern how the cells get filled
 * @param indexVariables the variables used as indices where the table is written or guarded
 * @param tableName the table's name
 * @param cellCount growth of the number of cells
 */
public record DpSignature(int dimensions, FillPattern fillPattern, List<String> indexVariables, String tableName,
        CostExpression cellCount) {

    public enum FillPattern {
        LOOP_FILLED,
        MEMO_GUARDED_RECURSIVE
    }

    public DpSignature {
        indexVariables = List.copyOf(indexVariables);
    }

    /** Total work when every cell is computed once at {@code perCell} cost. */
    public CostExpression cost(CostExpression perCell) {
        return cellCount.times(perCell);
    }

    @Override
    public String toString() {
        return dimensions + "D table " + tableName + indexVariables + " " + fillPattern + " with " + cellCount.describe() + " cells";
    }

}
