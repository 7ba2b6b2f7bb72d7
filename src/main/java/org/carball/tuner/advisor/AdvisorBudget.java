package org.carball.tuner.advisor;

/**
 * Space budget per replica in bytes, and the widest index an advisor may propose.
 */
public record AdvisorBudget(long spaceBudgetBytes, int maxIndexWidth) {

    public AdvisorBudget {
        if (spaceBudgetBytes < 0) {
            throw new IllegalArgumentException("Space budget must not be negative: " + spaceBudgetBytes);
        }
        if (maxIndexWidth < 1) {
            throw new IllegalArgumentException("Maximum index width must be at least 1: " + maxIndexWidth);
        }
    }
}
