package com.sysmuse.math.solve;

import com.sysmuse.math.expr.Expr;
import com.sysmuse.math.expr.IntExpr;
import com.sysmuse.math.expr.ProdExpr;
import com.sysmuse.math.expr.SumExpr;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive cofactor expansion along the first row, numeric and symbolic.
 */
final class Determinants {

    private Determinants() {
    }

    static double of(double[][] matrix) {
        int n = matrix.length;
        if (n == 1) return matrix[0][0];
        if (n == 2) {
            return matrix[0][0] * matrix[1][1] - matrix[0][1] * matrix[1][0];
        }

        double det = 0;
        for (int i = 0; i < n; i++) {
            double[][] minor = new double[n - 1][];
            for (int j = 1; j < n; j++) {
                minor[j - 1] = withoutColumn(matrix[j], i);
            }
            det += (i % 2 == 0 ? 1 : -1) * matrix[0][i] * of(minor);
        }
        return det;
    }

    private static double[] withoutColumn(double[] row, int column) {
        double[] result = new double[row.length - 1];
        for (int k = 0, m = 0; k < row.length; k++) {
            if (k != column) {
                result[m++] = row[k];
            }
        }
        return result;
    }

    /**
     * Unsimplified determinant expression; callers simplify the result.
     */
    static Expr of(List<List<Expr>> matrix) {
        int n = matrix.size();
        if (n == 1) return matrix.get(0).get(0);
        if (n == 2) {
            return new SumExpr(List.of(
                    new ProdExpr(List.of(matrix.get(0).get(0), matrix.get(1).get(1))),
                    new ProdExpr(List.of(IntExpr.NEG_ONE, matrix.get(0).get(1), matrix.get(1).get(0)))));
        }

        List<Expr> terms = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            List<List<Expr>> minor = new ArrayList<>();
            for (int j = 1; j < n; j++) {
                List<Expr> row = new ArrayList<>(matrix.get(j));
                row.remove(i);
                minor.add(row);
            }
            Expr term = new ProdExpr(List.of(matrix.get(0).get(i), of(minor)));
            terms.add(i % 2 == 0 ? term : term.negate());
        }
        return new SumExpr(terms);
    }
}
