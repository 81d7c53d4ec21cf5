package com.counterfactual.engine.domain.service.model;

import com.counterfactual.engine.domain.exception.InsufficientDataException;
import com.counterfactual.engine.domain.model.ArModel;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.springframework.stereotype.Component;

/**
 * Ordinary least squares fit of an AR(p) model with intercept on de-seasonalized residuals.
 *
 * <p>The regression runs on residuals divided by their sample standard deviation, so the
 * rank tolerance of the QR solve does not depend on the units of the target column.
 */
@Slf4j
@Component
public class AutoregressiveEstimator {

    /** Lagged residuals with a population std below this are treated as constant. */
    static final double MIN_LAG_STD = 1e-10;
    static final double RANK_TOLERANCE = 1e-10;

    public ArModel fit(double[] residuals, int order, String entityId) {
        if (order < 0) {
            throw new IllegalArgumentException("AR order must not be negative");
        }
        if (residuals.length < order + 1) {
            throw new InsufficientDataException(entityId, residuals.length, order + 1,
                    "AR(" + order + ") needs at least " + (order + 1) + " residuals, got " + residuals.length);
        }

        if (order == 0) {
            return new ArModel(new double[0], 0.0, spreadAround(residuals, 0.0), false);
        }

        int rows = residuals.length - order;
        if (rows < order + 1 || lagStd(residuals, order) < MIN_LAG_STD) {
            return meanFallback(residuals, order, entityId);
        }

        double scale = sampleStd(residuals);
        double[] y = new double[rows];
        double[][] x = new double[rows][order];
        for (int t = order; t < residuals.length; t++) {
            y[t - order] = residuals[t] / scale;
            for (int lag = 1; lag <= order; lag++) {
                x[t - order][lag - 1] = residuals[t - lag] / scale;
            }
        }

        OLSMultipleLinearRegression regression = new OLSMultipleLinearRegression(RANK_TOLERANCE);
        regression.newSampleData(y, x);
        double[] beta;
        try {
            beta = regression.estimateRegressionParameters();
        } catch (SingularMatrixException e) {
            log.debug("[AR] singular design for entity={}: {}", entityId, e.getMessage());
            return meanFallback(residuals, order, entityId);
        }
        for (double b : beta) {
            if (!Double.isFinite(b)) return meanFallback(residuals, order, entityId);
        }

        double[] phi = new double[order];
        System.arraycopy(beta, 1, phi, 0, order);
        double intercept = beta[0] * scale;
        double std = sampleStd(regression.estimateResiduals()) * scale;

        log.debug("[AR] entity={}, p={}, rows={}, c={}, residualStd={}", entityId, order, rows, intercept, std);
        return new ArModel(phi, intercept, std, false);
    }

    private ArModel meanFallback(double[] residuals, int order, String entityId) {
        double mean = StatUtils.mean(residuals);
        log.debug("[AR] rank-deficient design, falling back to mean: entity={}, p={}, n={}",
                entityId, order, residuals.length);
        return new ArModel(new double[order], mean, sampleStd(residuals), true);
    }

    private static double lagStd(double[] residuals, int order) {
        return Math.sqrt(StatUtils.populationVariance(residuals, 0, residuals.length - order));
    }

    private static double spreadAround(double[] values, double center) {
        if (values.length < 2) return 0.0;
        double sumSq = 0.0;
        for (double v : values) {
            double d = v - center;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / (values.length - 1));
    }

    private static double sampleStd(double[] values) {
        return values.length < 2 ? 0.0 : Math.sqrt(StatUtils.variance(values));
    }
}
