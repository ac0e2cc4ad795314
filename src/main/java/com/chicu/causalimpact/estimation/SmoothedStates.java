package com.chicu.causalimpact.estimation;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * E[alpha_t | y_pre] и Var[alpha_t | y_pre] для каждой точки pre-периода.
 */
public record SmoothedStates(RealVector[] means, RealMatrix[] covariances) {

    public int length() {
        return means.length;
    }

    public double level(int t) {
        return means[t].getEntry(0);
    }

    public double levelVariance(int t) {
        return covariances[t].getEntry(0, 0);
    }

    public double coefficient(int t, int j) {
        return means[t].getEntry(j + 1);
    }
}
