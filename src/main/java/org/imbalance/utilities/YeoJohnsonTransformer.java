package org.imbalance.utilities;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.univariate.BrentOptimizer;
import org.apache.commons.math3.optim.univariate.SearchInterval;
import org.apache.commons.math3.optim.univariate.UnivariateObjectiveFunction;
import org.apache.commons.math3.optim.univariate.UnivariatePointValuePair;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.moment.Variance;

/**
 * Yeo-Johnson power transform with maximum likelihood lambda, followed by
 * standardization to zero mean and unit variance.
 */
public class YeoJohnsonTransformer {

    private static final double LAMBDA_MIN = -5.0;
    private static final double LAMBDA_MAX = 5.0;
    private static final double EPSILON = 1e-12;

    private double lambda = 1.0;
    private double mean = 0.0;
    private double scale = 1.0;
    private boolean fitted = false;

    public YeoJohnsonTransformer fit(double[] values) {
        if (isConstant(values)) {
            // nothing to estimate, the column is only centered
            lambda = 1.0;
        } else {
            BrentOptimizer optimizer = new BrentOptimizer(1e-10, 1e-14);
            UnivariateFunction likelihood = l -> logLikelihood(values, l);
            UnivariatePointValuePair optimum = optimizer.optimize(
                    new MaxEval(500),
                    new UnivariateObjectiveFunction(likelihood),
                    GoalType.MAXIMIZE,
                    new SearchInterval(LAMBDA_MIN, LAMBDA_MAX, 1.0));
            lambda = optimum.getPoint();
        }

        double[] transformed = apply(values, lambda);
        mean = new Mean().evaluate(transformed);
        double std = new StandardDeviation(false).evaluate(transformed);
        scale = std < EPSILON ? 1.0 : std;
        fitted = true;
        return this;
    }

    public double[] transform(double[] values) {
        if (!fitted) {
            throw new IllegalStateException("Transformer not fitted");
        }
        double[] transformed = apply(values, lambda);
        for (int i = 0; i < transformed.length; i++) {
            transformed[i] = (transformed[i] - mean) / scale;
        }
        return transformed;
    }

    public double[] fitTransform(double[] values) {
        return fit(values).transform(values);
    }

    public double getLambda() {
        return lambda;
    }

    static double transform(double x, double lambda) {
        if (x >= 0) {
            return Math.abs(lambda) < EPSILON ? Math.log1p(x) : (Math.pow(x + 1, lambda) - 1) / lambda;
        }
        return Math.abs(lambda - 2) < EPSILON
                ? -Math.log1p(-x)
                : -(Math.pow(1 - x, 2 - lambda) - 1) / (2 - lambda);
    }

    private static double[] apply(double[] values, double lambda) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = transform(values[i], lambda);
        }
        return out;
    }

    static double logLikelihood(double[] values, double lambda) {
        double[] transformed = apply(values, lambda);
        double variance = new Variance(false).evaluate(transformed);
        if (variance <= 0 || Double.isNaN(variance) || Double.isInfinite(variance)) {
            return Double.NEGATIVE_INFINITY;
        }
        double sum = 0;
        for (double x : values) {
            sum += Math.signum(x) * Math.log1p(Math.abs(x));
        }
        return -values.length / 2.0 * Math.log(variance) + (lambda - 1) * sum;
    }

    private static boolean isConstant(double[] values) {
        for (double value : values) {
            if (value != values[0]) {
                return false;
            }
        }
        return true;
    }
}
