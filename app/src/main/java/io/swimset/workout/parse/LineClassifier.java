package io.swimset.workout.parse;

import java.util.List;

/**
 * Classifies the physical lines of a workout before they are folded into sections.
 */
public interface LineClassifier {

    List<ClassifiedLine> classify(List<String> lines);
}
