package io.swimset.workout.model;

/**
 * Common view over strokes and modes used when yardage is rolled up per category.
 */
public interface StrokeCategory {

    String displayName();
}
