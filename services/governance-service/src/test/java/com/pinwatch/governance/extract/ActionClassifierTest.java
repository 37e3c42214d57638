package com.pinwatch.governance.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class ActionClassifierTest {

    private final ActionClassifier classifier = new ActionClassifier(List.of("InternalOrg", " platform-team "));

    @Test
    void onlyFullFortyCharacterHexShasArePinned() {
        assertTrue(classifier.isPinned("8e5e7e5ab8b370d6c329ec480221332ada57f0ab"));
        assertTrue(classifier.isPinned("8E5E7E5AB8B370D6C329EC480221332ADA57F0AB"));

        assertFalse(classifier.isPinned("v4"));
        assertFalse(classifier.isPinned("main"));
        assertFalse(classifier.isPinned("8e5e7e5"));
        assertFalse(classifier.isPinned("8e5e7e5ab8b370d6c329ec480221332ada57f0ab1"));
        assertFalse(classifier.isPinned("ge5e7e5ab8b370d6c329ec480221332ada57f0ab"));
        assertFalse(classifier.isPinned(null));
    }

    @Test
    void ownerIsMatchedCaseInsensitivelyAgainstAllowlist() {
        assertTrue(classifier.isInternal("internalorg/build-tools"));
        assertTrue(classifier.isInternal("INTERNALORG/deploy/sub-action"));
        assertTrue(classifier.isInternal("platform-team/lint"));

        assertFalse(classifier.isInternal("actions/checkout"));
        assertFalse(classifier.isInternal("internalorg-fork/build-tools"));
        assertFalse(classifier.isInternal(null));
    }

    @Test
    void emptyAllowlistMarksNothingInternal() {
        ActionClassifier strict = new ActionClassifier(List.of());

        assertFalse(strict.isInternal("internalorg/build-tools"));
    }

    @Test
    void ownerOfTakesSegmentBeforeFirstSlash() {
        assertEquals("actions", ActionClassifier.ownerOf("actions/cache/restore"));
        assertEquals("solo", ActionClassifier.ownerOf("solo"));
        assertEquals("", ActionClassifier.ownerOf(null));
    }
}
