package com.counterfactual.engine.domain.model;

import java.util.Arrays;

/**
 * Fitted {@code y_t = c + sum(phi_i * y_{t-i})}. Coefficient i applies to lag i + 1.
 */
public final class ArModel {

    private final double[] coefficients;
    private final double intercept;
    private final double residualStd;
    private final boolean degenerate;

    public ArModel(double[] coefficients, double intercept, double residualStd, boolean degenerate) {
        this.coefficients = coefficients.clone();
        this.intercept = intercept;
        this.residualStd = residualStd;
        this.degenerate = degenerate;
    }

    public int order() {
        return coefficients.length;
    }

    public double[] coefficients() {
        return coefficients.clone();
    }

    public double intercept() {
        return intercept;
    }

    public double residualStd() {
        return residualStd;
    }

    /**
     * True when the design was rank-deficient and the model fell back to a constant mean.
     */
    public boolean degenerate() {
        return degenerate;
    }

    /**
     * @param history most recent residual last; must hold at least {@link #order()} values
     */
    public double predict(double[] history, int newest) {
        double value = intercept;
        int n = history.length;
        for (int i = 0; i < coefficients.length; i++) {
            value += coefficients[i] * history[Math.floorMod(newest - i, n)];
        }
        return value;
    }

    @Override
    public String toString() {
        return "ArModel{phi=" + Arrays.toString(coefficients) + ", c=" + intercept
                + ", residualStd=" + residualStd + ", degenerate=" + degenerate + "}";
    }
}
