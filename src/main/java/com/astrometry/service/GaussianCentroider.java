package com.astrometry.service;

import com.astrometry.model.Cutout;
import com.astrometry.model.PixelPoint;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;

/**
 * Least-squares fit of an axis-aligned 2D Gaussian plus constant background to the valid
 * samples of a cutout. Parameters: amplitude, x0, y0, sigma x, sigma y, background.
 */
class GaussianCentroider {

    private static final int PARAMETERS = 6;
    private static final int MAX_EVALUATIONS = 2000;

    PixelPoint fit(Cutout cutout) throws CentroidException {
        if (cutout.isEmpty()) throw new CentroidException("Cannot fit a Gaussian to an empty cutout");

        int n = cutout.countValid();
        if (n <= PARAMETERS) {
            throw new CentroidException("Not enough valid pixels for a Gaussian fit (" + n + ")");
        }

        final double[] px = new double[n];
        final double[] py = new double[n];
        double[] values = new double[n];
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        int k = 0;
        for (int y = 0; y < cutout.getHeight(); y++) {
            for (int x = 0; x < cutout.getWidth(); x++) {
                if (!cutout.isValid(x, y)) continue;
                double v = cutout.getValue(x, y);
                px[k] = x;
                py[k] = y;
                values[k] = v;
                min = Math.min(min, v);
                max = Math.max(max, v);
                k++;
            }
        }
        if (max - min <= 1e-12 * Math.max(1.0, Math.abs(max))) {
            throw new CentroidException("Cannot fit a Gaussian to flat data");
        }

        double[] start = initialGuess(px, py, values, min, max, cutout.getWidth(), cutout.getHeight());

        MultivariateJacobianFunction model = point -> {
            double amp = point.getEntry(0), x0 = point.getEntry(1), y0 = point.getEntry(2);
            double sx = point.getEntry(3), sy = point.getEntry(4), bg = point.getEntry(5);
            RealVector value = new ArrayRealVector(px.length);
            RealMatrix jacobian = new Array2DRowRealMatrix(px.length, PARAMETERS);
            for (int i = 0; i < px.length; i++) {
                double dx = px[i] - x0, dy = py[i] - y0;
                double e = Math.exp(-0.5 * (dx * dx / (sx * sx) + dy * dy / (sy * sy)));
                value.setEntry(i, bg + amp * e);
                jacobian.setEntry(i, 0, e);
                jacobian.setEntry(i, 1, amp * e * dx / (sx * sx));
                jacobian.setEntry(i, 2, amp * e * dy / (sy * sy));
                jacobian.setEntry(i, 3, amp * e * dx * dx / (sx * sx * sx));
                jacobian.setEntry(i, 4, amp * e * dy * dy / (sy * sy * sy));
                jacobian.setEntry(i, 5, 1.0);
            }
            return new Pair<>(value, jacobian);
        };

        LeastSquaresProblem problem = new LeastSquaresBuilder()
                .start(start)
                .model(model)
                .target(values)
                .maxEvaluations(MAX_EVALUATIONS)
                .maxIterations(MAX_EVALUATIONS)
                .build();

        RealVector solution;
        try {
            LeastSquaresOptimizer.Optimum optimum = new LevenbergMarquardtOptimizer().optimize(problem);
            solution = optimum.getPoint();
        } catch (MathIllegalStateException | MathArithmeticException e) {
            throw new CentroidException("Gaussian fit did not converge: " + e.getMessage(), e);
        }

        double x0 = solution.getEntry(1);
        double y0 = solution.getEntry(2);
        if (!Double.isFinite(x0) || !Double.isFinite(y0)
                || solution.getEntry(3) == 0 || solution.getEntry(4) == 0) {
            throw new CentroidException("Gaussian fit did not converge to a finite center");
        }
        return new PixelPoint(x0, y0);
    }

    // moments of the background-subtracted samples
    private static double[] initialGuess(double[] px, double[] py, double[] values, double min, double max,
                                         int width, int height) {
        double sum = 0, sx = 0, sy = 0;
        for (int i = 0; i < values.length; i++) {
            double w = values[i] - min;
            sum += w;
            sx += w * px[i];
            sy += w * py[i];
        }
        double x0 = sx / sum;
        double y0 = sy / sum;
        double vx = 0, vy = 0;
        for (int i = 0; i < values.length; i++) {
            double w = values[i] - min;
            vx += w * (px[i] - x0) * (px[i] - x0);
            vy += w * (py[i] - y0) * (py[i] - y0);
        }
        double sigmaX = clamp(Math.sqrt(vx / sum), 0.5, Math.max(0.5, width));
        double sigmaY = clamp(Math.sqrt(vy / sum), 0.5, Math.max(0.5, height));
        return new double[]{max - min, x0, y0, sigmaX, sigmaY, min};
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
