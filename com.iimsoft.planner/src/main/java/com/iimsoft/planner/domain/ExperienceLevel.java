package com.iimsoft.planner.domain;

/**
 * Experience level of a human resource.
 */
public enum ExperienceLevel {
    /** 0-2 years */
    JUNIOR,
    /** 2-5 years */
    INTERMEDIATE,
    /** 5-10 years */
    SENIOR,
    /** 10+ years */
    EXPERT;

    public boolean isExperienced() {
        return this == SENIOR || this == EXPERT;
    }
}
