package com.chicu.causalimpact.estimation;

import com.chicu.causalimpact.model.ModelHyperparameters;
import com.chicu.causalimpact.model.StructuralTimeSeriesModel;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.random.RandomGenerator;
import org.springframework.stereotype.Component;

/**
 * Симуляционный сглаживатель (forward filtering, backward sampling).
 * <p>
 * Матрицы обратного прохода не зависят от конкретной выборки, поэтому считаются один раз
 * в {@link #prepare}; сама выборка траектории - только умножения на готовые матрицы.
 */
@Component
public class SimulationSmoother {

    public Plan prepare(FilterResult fr, StructuralTimeSeriesModel model, ModelHyperparameters h) {
        int m = fr.length();
        RealMatrix q = model.stateNoise(h);

        RealMatrix[] gains = new RealMatrix[m];
        RealMatrix[] factors = new RealMatrix[m];

        factors[m - 1] = Matrices.psdFactor(fr.filteredCovariances()[m - 1]);

        for (int t = m - 2; t >= 0; t--) {
            RealMatrix pF = fr.filteredCovariances()[t];
            RealMatrix pNext = pF.add(q);
            RealMatrix j = pF.multiply(Matrices.pseudoInverse(pNext));

            // Var[alpha_t | alpha_{t+1}, y_1..t] = P_t|t - J P_t|t
            RealMatrix v = Matrices.symmetrize(pF.subtract(j.multiply(pF)));

            gains[t] = j;
            factors[t] = Matrices.psdFactor(v);
        }

        return new Plan(fr.filteredStates(), gains, factors, model.stateDimension());
    }

    /**
     * Неизменяемый план выборки; безопасен для одновременного использования из нескольких потоков.
     */
    public static final class Plan {

        private final RealVector[] filtered;
        private final RealMatrix[] gains;
        private final RealMatrix[] factors;
        private final int dimension;

        private Plan(RealVector[] filtered, RealMatrix[] gains, RealMatrix[] factors, int dimension) {
            this.filtered = filtered;
            this.gains = gains;
            this.factors = factors;
            this.dimension = dimension;
        }

        public int length() {
            return filtered.length;
        }

        /**
         * Одна траектория состояний pre-периода: states[t][j].
         */
        public double[][] draw(RandomGenerator rng) {
            int m = filtered.length;
            double[][] out = new double[m][];

            RealVector next = filtered[m - 1].add(factors[m - 1].operate(normals(rng)));
            out[m - 1] = next.toArray();

            for (int t = m - 2; t >= 0; t--) {
                RealVector aF = filtered[t];
                RealVector mean = aF.add(gains[t].operate(next.subtract(aF)));
                RealVector cur = mean.add(factors[t].operate(normals(rng)));
                out[t] = cur.toArray();
                next = cur;
            }
            return out;
        }

        private RealVector normals(RandomGenerator rng) {
            double[] z = new double[dimension];
            for (int i = 0; i < dimension; i++) z[i] = rng.nextGaussian();
            return new ArrayRealVector(z, false);
        }
    }
}
