package com.advisorplatform.specialist.indicator;

/**
 * Least-squares fit {@code y = intercept + slope × x} over {@code points} closes.
 * x = 0 is the oldest close in the window, x = points − 1 the newest.
 */
public record Trendline(double slope, double intercept, double rSquared, int points) {

    /** Projected close {@code stepsAhead} bars after the newest one. */
    public double project(int stepsAhead) {
        return intercept + slope * (points - 1 + stepsAhead);
    }
}
