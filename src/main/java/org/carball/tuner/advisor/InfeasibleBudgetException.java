package org.carball.tuner.advisor;

public class InfeasibleBudgetException extends RuntimeException {

    public InfeasibleBudgetException(String message) {
        super(message);
    }
}
