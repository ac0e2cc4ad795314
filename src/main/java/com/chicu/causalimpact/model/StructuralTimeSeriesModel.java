package com.chicu.causalimpact.model;

import com.chicu.causalimpact.series.Observation;
import com.chicu.causalimpact.series.PreparedSeries;
import com.chicu.causalimpact.series.TimeSeries;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.Arrays;

/**
 * Local level + регрессия в форме пространства состояний.
 *
 * <pre>
 *   y_t     = level_t + x_t' beta_t + eps_t,      eps_t ~ N(0, obs)
 *   level_t = level_{t-1} + eta_t,                eta_t ~ N(0, level)
 *   beta_t  = beta_{t-1}            (STATIC)
 *   beta_t  = beta_{t-1} + zeta_t   (DYNAMIC),    zeta_t ~ N(0, coef * I)
 * </pre>
 *
 * Состояние: [level, beta_1 .. beta_k], матрица перехода единичная.
 * Окно модели начинается с первой точки pre и идёт до конца post;
 * отклик виден фильтру только на pre-участке (fitLength первых точек).
 */
public final class StructuralTimeSeriesModel {

    /** Множитель диффузной априорной дисперсии состояния. */
    public static final double DIFFUSE_PRIOR_SCALE = 1e6;

    private final RegressionMode regressionMode;
    private final DataScaling scaling;
    private final double[] response;
    private final double[][] covariates;
    private final int fitLength;
    private final double initialLevel;
    private final double diffuseVariance;

    private StructuralTimeSeriesModel(RegressionMode regressionMode,
                                      DataScaling scaling,
                                      double[] response,
                                      double[][] covariates,
                                      int fitLength) {
        this.regressionMode = regressionMode;
        this.scaling = scaling;
        this.response = response;
        this.covariates = covariates;
        this.fitLength = fitLength;

        double first = Double.NaN;
        double sumSq = 0;
        double sum = 0;
        int n = 0;
        for (int t = 0; t < fitLength; t++) {
            if (Double.isNaN(response[t])) continue;
            if (Double.isNaN(first)) first = response[t];
            sum += response[t];
            sumSq += response[t] * response[t];
            n++;
        }
        double var = n > 1 ? (sumSq - sum * sum / n) / (n - 1) : 1.0;

        this.initialLevel = Double.isNaN(first) ? 0.0 : first;
        this.diffuseVariance = DIFFUSE_PRIOR_SCALE * Math.max(1.0, var);
    }

    /**
     * Строит модель по подготовленному ряду. Отклик пост-периода скрыт (NaN):
     * модель описывает только динамику до вмешательства.
     */
    public static StructuralTimeSeriesModel of(PreparedSeries prepared, RegressionMode mode, DataScaling scaling) {
        TimeSeries series = prepared.series();
        int n = prepared.modelLength();
        int k = series.covariateCount();
        int offset = prepared.preStartIndex();

        double[] y = new double[n];
        double[][] x = new double[n][k];

        for (int t = 0; t < n; t++) {
            int i = offset + t;
            Observation o = series.get(i);
            boolean visible = prepared.isPre(i) && o.hasResponse();
            y[t] = visible ? scaling.response().apply(o.response()) : Double.NaN;
            for (int j = 0; j < k; j++) {
                x[t][j] = scaling.covariate(j).apply(o.covariate(j));
            }
        }

        return new StructuralTimeSeriesModel(mode, scaling, y, x, prepared.preLength());
    }

    /** Число свободных параметров: компоненты состояния + дисперсии шумов. */
    public static int freeParameters(int covariateCount, RegressionMode mode) {
        return 1 + covariateCount + ModelHyperparameters.count(mode);
    }

    public RegressionMode regressionMode() {
        return regressionMode;
    }

    public DataScaling scaling() {
        return scaling;
    }

    public int covariateCount() {
        return covariates.length == 0 ? 0 : covariates[0].length;
    }

    public int stateDimension() {
        return 1 + covariateCount();
    }

    /** Полная длина окна (pre + возможный разрыв + post). */
    public int length() {
        return response.length;
    }

    public int fitLength() {
        return fitLength;
    }

    public boolean isObserved(int t) {
        return t < fitLength && !Double.isNaN(response[t]);
    }

    public double response(int t) {
        return response[t];
    }

    /** Z_t = [1, x_t]. */
    public RealVector observationVector(int t) {
        double[] z = new double[stateDimension()];
        z[0] = 1.0;
        System.arraycopy(covariates[t], 0, z, 1, covariateCount());
        return new ArrayRealVector(z, false);
    }

    /** Z_t · alpha: ожидаемый отклик без шума наблюдения. */
    public double signal(RealVector state, int t) {
        double s = state.getEntry(0);
        double[] x = covariates[t];
        for (int j = 0; j < x.length; j++) {
            s += x[j] * state.getEntry(j + 1);
        }
        return s;
    }

    /** Ковариация шума состояния Q (диагональная). */
    public RealMatrix stateNoise(ModelHyperparameters h) {
        double[] d = new double[stateDimension()];
        d[0] = h.levelVariance();
        double coef = regressionMode == RegressionMode.DYNAMIC ? h.coefficientVariance() : 0.0;
        for (int j = 1; j < d.length; j++) d[j] = coef;
        return MatrixUtils.createRealDiagonalMatrix(d);
    }

    public RealVector initialState() {
        RealVector a = new ArrayRealVector(stateDimension());
        a.setEntry(0, initialLevel);
        return a;
    }

    public RealMatrix initialCovariance() {
        double[] d = new double[stateDimension()];
        Arrays.fill(d, diffuseVariance);
        return MatrixUtils.createRealDiagonalMatrix(d);
    }

    /** Сколько первых наблюдений не входят в правдоподобие (диффузная инициализация). */
    public int diffuseObservations() {
        return stateDimension();
    }

    /** Дисперсия pre-отклика в единицах модели (для стартовой точки оптимизатора). */
    public double observedVariance() {
        return diffuseVariance / DIFFUSE_PRIOR_SCALE;
    }
}
