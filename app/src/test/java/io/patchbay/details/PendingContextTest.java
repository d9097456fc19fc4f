package io.patchbay.details;

import static org.junit.jupiter.api.Assertions.*;

import io.patchbay.patch.LocalPatch;
import java.net.URI;
import org.junit.jupiter.api.Test;

class PendingContextTest {

    static final Preferences PREFS =
            new Preferences(true, "MMMM Do, YYYY h:mma", new FilesPreferences("auto", true, "type", 5), "onHover", true);

    private final LocalPatch first = new LocalPatch(URI.create("file:///a.diff"), "a");
    private final LocalPatch second = new LocalPatch(URI.create("file:///b.diff"), "b");

    @Test
    void laterWritesWinPerField() {
        var merged = PendingContext.ofPatch(first)
                .merge(PendingContext.ofVisible(false))
                .merge(PendingContext.ofPatch(second))
                .merge(PendingContext.ofVisible(true));

        assertTrue(merged.hasPatch());
        assertSame(second, merged.patch());
        assertEquals(Boolean.TRUE, merged.visible());
        assertNull(merged.preferences());
    }

    @Test
    void untouchedFieldsSurviveMerge() {
        var merged = PendingContext.ofPreferences(PREFS).merge(PendingContext.ofVisible(false));

        assertEquals(PREFS, merged.preferences());
        assertFalse(merged.hasPatch());
    }

    @Test
    void clearingThePatchIsDistinctFromNotTouchingIt() {
        var committed = new ViewContext(first, PREFS, true);

        assertNull(PendingContext.ofPatch(null).applyTo(committed).patch());
        assertSame(first, PendingContext.ofVisible(false).applyTo(committed).patch());
        assertSame(first, PendingContext.ofPatch(null).merge(PendingContext.ofPatch(first)).applyTo(committed).patch());
    }

    @Test
    void emptyOverlayChangesNothing() {
        var committed = new ViewContext(first, PREFS, true);

        assertTrue(PendingContext.EMPTY.isEmpty());
        assertEquals(committed, PendingContext.EMPTY.applyTo(committed));
        assertFalse(PendingContext.ofVisible(true).isEmpty());
    }
}
