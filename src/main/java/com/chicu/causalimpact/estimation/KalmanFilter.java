package com.chicu.causalimpact.estimation;

import com.chicu.causalimpact.model.ModelHyperparameters;
import com.chicu.causalimpact.model.StructuralTimeSeriesModel;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.springframework.stereotype.Component;

/**
 * Прямой проход: фильтр Калмана с разложением правдоподобия по ошибкам прогноза.
 * Пропуски отклика в pre-периоде просто не обновляют состояние.
 */
@Component
public class KalmanFilter {

    private static final double LOG_2PI = Math.log(2.0 * Math.PI);

    public FilterResult filter(StructuralTimeSeriesModel model, ModelHyperparameters h) {
        int m = model.fitLength();
        int dim = model.stateDimension();

        RealMatrix q = model.stateNoise(h);
        double r = h.observationVariance();
        RealMatrix identity = MatrixUtils.createRealIdentityMatrix(dim);

        RealVector[] aPred = new RealVector[m];
        RealMatrix[] pPred = new RealMatrix[m];
        RealVector[] aFilt = new RealVector[m];
        RealMatrix[] pFilt = new RealMatrix[m];
        double[] f = new double[m];
        double[] fVar = new double[m];

        RealVector a = model.initialState();
        RealMatrix p = model.initialCovariance();

        double logLik = 0.0;
        int terms = 0;
        int seen = 0;

        for (int t = 0; t < m; t++) {
            if (t > 0) {
                a = aFilt[t - 1];
                p = pFilt[t - 1].add(q);
            }
            aPred[t] = a;
            pPred[t] = p;

            RealVector z = model.observationVector(t);
            RealVector pz = p.operate(z);
            double mean = z.dotProduct(a);
            double var = Math.max(z.dotProduct(pz) + r, ModelHyperparameters.VARIANCE_FLOOR);
            f[t] = mean;
            fVar[t] = var;

            if (!model.isObserved(t)) {
                aFilt[t] = a;
                pFilt[t] = p;
                continue;
            }

            double v = model.response(t) - mean;
            RealVector k = pz.mapDivide(var);

            aFilt[t] = a.add(k.mapMultiply(v));

            // форма Джозефа: сохраняет симметрию и положительную определённость
            RealMatrix ikz = identity.subtract(k.outerProduct(z));
            RealMatrix pNew = ikz.multiply(p).multiply(ikz.transpose())
                    .add(k.outerProduct(k).scalarMultiply(r));
            pFilt[t] = Matrices.symmetrize(pNew);

            seen++;
            if (seen > model.diffuseObservations()) {
                logLik += -0.5 * (LOG_2PI + Math.log(var) + v * v / var);
                terms++;
            }
        }

        return new FilterResult(aPred, pPred, aFilt, pFilt, f, fVar, logLik, terms);
    }

    public double logLikelihood(StructuralTimeSeriesModel model, ModelHyperparameters h) {
        return filter(model, h).logLikelihood();
    }
}
