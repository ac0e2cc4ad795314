package com.chicu.causalimpact.estimation;

import com.chicu.causalimpact.model.ModelHyperparameters;
import com.chicu.causalimpact.model.StructuralTimeSeriesModel;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.springframework.stereotype.Component;

/**
 * Обратный проход Rauch–Tung–Striebel поверх результата фильтра.
 */
@Component
public class KalmanSmoother {

    public SmoothedStates smooth(FilterResult fr, StructuralTimeSeriesModel model, ModelHyperparameters h) {
        int m = fr.length();
        RealMatrix q = model.stateNoise(h);

        RealVector[] means = new RealVector[m];
        RealMatrix[] covs = new RealMatrix[m];

        means[m - 1] = fr.filteredStates()[m - 1];
        covs[m - 1] = fr.filteredCovariances()[m - 1];

        for (int t = m - 2; t >= 0; t--) {
            RealVector aF = fr.filteredStates()[t];
            RealMatrix pF = fr.filteredCovariances()[t];
            RealMatrix pNext = pF.add(q);

            RealMatrix j = pF.multiply(Matrices.pseudoInverse(pNext));

            means[t] = aF.add(j.operate(means[t + 1].subtract(aF)));
            covs[t] = Matrices.symmetrize(
                    pF.add(j.multiply(covs[t + 1].subtract(pNext)).multiply(j.transpose())));
        }

        return new SmoothedStates(means, covs);
    }
}
