package io.fullerstack.eseries.core.mel;

import io.fullerstack.eseries.core.model.MelQuery;
import org.junit.jupiter.api.Test;

import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class MelCursorTrackerTest {

    @Test
    void nextQuery_shouldStartFromBeginningWithoutCursor() {
        MelCursorTracker tracker = new MelCursorTracker(8192);

        MelQuery query = tracker.nextQuery("wwn1");

        assertThat(query.startSequence()).isEqualTo(MelQuery.FROM_BEGINNING);
        assertThat(query.fromBeginning()).isTrue();
        assertThat(query.count()).isEqualTo(8192);
    }

    @Test
    void nextQuery_shouldStartAfterCursor() {
        MelCursorTracker tracker = new MelCursorTracker(100);
        tracker.advance("wwn1", 41);

        assertThat(tracker.nextQuery("wwn1").startSequence()).isEqualTo(42);
    }

    @Test
    void advance_shouldRejectRegression() {
        MelCursorTracker tracker = new MelCursorTracker(100);

        assertThat(tracker.advance("wwn1", 100)).isTrue();
        assertThat(tracker.advance("wwn1", 50)).isFalse();
        assertThat(tracker.advance("wwn1", 100)).isFalse();

        assertThat(tracker.cursor("wwn1")).hasValue(100);
    }

    @Test
    void nextQuery_shouldSeedFromStoreOnce() {
        MelCursorStore store = mock(MelCursorStore.class);
        when(store.lastSequence("wwn1")).thenReturn(OptionalLong.of(500));
        MelCursorTracker tracker = new MelCursorTracker(store, 100);

        assertThat(tracker.nextQuery("wwn1").startSequence()).isEqualTo(501);
        assertThat(tracker.nextQuery("wwn1").startSequence()).isEqualTo(501);

        verify(store, times(1)).lastSequence("wwn1");
    }

    @Test
    void nextQuery_shouldNotRequeryEmptyStore() {
        MelCursorStore store = mock(MelCursorStore.class);
        when(store.lastSequence("wwn1")).thenReturn(OptionalLong.empty());
        MelCursorTracker tracker = new MelCursorTracker(store, 100);

        tracker.nextQuery("wwn1");
        tracker.nextQuery("wwn1");

        verify(store, times(1)).lastSequence("wwn1");
    }

    @Test
    void nextQuery_shouldRetryStoreAfterFailure() {
        MelCursorStore store = mock(MelCursorStore.class);
        when(store.lastSequence("wwn1"))
                .thenThrow(new IllegalStateException("backend down"))
                .thenReturn(OptionalLong.of(7));
        MelCursorTracker tracker = new MelCursorTracker(store, 100);

        assertThatThrownBy(() -> tracker.nextQuery("wwn1")).isInstanceOf(IllegalStateException.class);
        assertThat(tracker.nextQuery("wwn1").startSequence()).isEqualTo(8);
    }

    @Test
    void cursors_shouldBeTrackedPerSystem() {
        MelCursorTracker tracker = new MelCursorTracker(100);
        tracker.advance("wwn1", 10);

        assertThat(tracker.nextQuery("wwn2").fromBeginning()).isTrue();
        assertThat(tracker.cursor("wwn2")).isEmpty();
    }

    @Test
    void melQuery_shouldValidateArguments() {
        assertThatThrownBy(() -> new MelQuery(-2, 10)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MelQuery(0, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
