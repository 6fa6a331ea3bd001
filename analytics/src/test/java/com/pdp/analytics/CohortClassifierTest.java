package com.pdp.analytics;

import com.pdp.common.FeatureVector;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CohortClassifierTest {

    private final CohortClassifier classifier = new CohortClassifier(0.5);

    @Test
    void primaryShareMustExceedThreshold() {
        assertTrue(classifier.isPrimarilyCategoryA(new FeatureVector(10, 6, 0, 0)));
        assertFalse(classifier.isPrimarilyCategoryA(new FeatureVector(10, 5, 0, 0)));
        assertFalse(classifier.isPrimarilyCategoryA(new FeatureVector(0, 0, 0, 0)));
    }

    @Test
    void patternNeedsOneTransition() {
        assertTrue(classifier.exhibitsTransitionPattern(new FeatureVector(2, 1, 1, 1)));
        assertFalse(classifier.exhibitsTransitionPattern(new FeatureVector(2, 1, 1, 0)));
    }

    @Test
    void tallyMergesAndGuardsPercentages() {
        CohortTally t1 = classifier.tally(CohortTally.EMPTY, new FeatureVector(4, 3, 1, 1));
        CohortTally t2 = classifier.tally(CohortTally.EMPTY, new FeatureVector(4, 0, 1, 0));
        CohortTally merged = t1.merge(t2);

        assertEquals(new CohortTally(2, 1, 1), merged);
        assertEquals(50.0, merged.primarilyCategoryAPercentage());
        assertEquals(50.0, merged.transitionPatternPercentage());
        assertEquals(0.0, CohortTally.EMPTY.primarilyCategoryAPercentage());
    }

    @Test
    void thresholdOutsideUnitIntervalIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CohortClassifier(1.5));
        assertThrows(IllegalArgumentException.class, () -> new CohortClassifier(Double.NaN));
    }
}
