package com.partner.match.dto.enums;

public enum AcademicLevel {
    BEGINNER(1),
    INTERMEDIATE(2),
    ADVANCED(3),
    EXPERT(4);

    private final int rating;

    AcademicLevel(int rating) {
        this.rating = rating;
    }

    /**
     * Numeric rating used by the recommenders, Beginner=1 through Expert=4.
     */
    public int rating() {
        return rating;
    }

    public static AcademicLevel orDefault(AcademicLevel level) {
        return level != null ? level : BEGINNER;
    }
}
