package com.easybuild.core.model;

/**
 * Ordered steps of the release pipeline. {@link #step()} is the numbered step the
 * stage belongs to; checkout and pull of one branch share a step.
 */
public enum ReleaseStage {
    ENSURE_REPOSITORY(1, "Ensure repository"),
    CHECKOUT_DEV(2, "Checkout dev branch"),
    PULL_DEV(2, "Pull dev branch"),
    CHECKOUT_RELEASE(3, "Checkout release branch"),
    PULL_RELEASE(3, "Pull release branch"),
    MERGE(4, "Merge dev into release"),
    DETERMINE_VERSION(5, "Determine current version"),
    COMPUTE_VERSION(6, "Compute next version"),
    APPLY_VERSION(7, "Apply version"),
    COMMIT(8, "Stage and commit"),
    PUSH(9, "Push release branch"),
    SUMMARIZE(10, "Summarize");

    private final int step;
    private final String label;

    ReleaseStage(int step, String label) {
        this.step = step;
        this.label = label;
    }

    public int step() {
        return step;
    }

    public String label() {
        return label;
    }
}
