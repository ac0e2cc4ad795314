package com.chicu.causalimpact.estimation;

import lombok.experimental.UtilityClass;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

/**
 * Мелкие операции над малыми симметричными матрицами (размер = 1 + число ковариат).
 */
@UtilityClass
public class Matrices {

    public RealMatrix symmetrize(RealMatrix m) {
        return m.add(m.transpose()).scalarMultiply(0.5);
    }

    /** Псевдообратная через SVD: устойчива к почти вырожденным ковариациям. */
    public RealMatrix pseudoInverse(RealMatrix m) {
        return new SingularValueDecomposition(m).getSolver().getInverse();
    }

    /**
     * L такая, что L L' = m для симметричной неотрицательно определённой m.
     * Отрицательные собственные значения (численный шум) обнуляются.
     */
    public RealMatrix psdFactor(RealMatrix m) {
        int n = m.getRowDimension();
        if (n == 1) {
            return MatrixUtils.createRealMatrix(new double[][]{{Math.sqrt(Math.max(0.0, m.getEntry(0, 0)))}});
        }

        EigenDecomposition eig = new EigenDecomposition(symmetrize(m));
        double[] lambda = eig.getRealEigenvalues();
        RealMatrix v = eig.getV();

        double[] sqrt = new double[n];
        for (int i = 0; i < n; i++) {
            sqrt[i] = Math.sqrt(Math.max(0.0, lambda[i]));
        }
        return v.multiply(MatrixUtils.createRealDiagonalMatrix(sqrt));
    }
}
