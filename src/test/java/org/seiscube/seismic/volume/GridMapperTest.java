package org.seiscube.seismic.volume;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GridMapperTest {

    @Test
    void map_buildsSortedDenseIndexFromHeaders() {
        List<TraceHeader> headers = List.of(
                TraceHeader.withoutPosition(120, 7),
                TraceHeader.withoutPosition(100, 5),
                TraceHeader.withoutPosition(110, 9),
                TraceHeader.withoutPosition(100, 7)
        );

        GridMapping mapping = new GridMapper().map(headers);

        assertThat(mapping.index().inlineValues()).containsExactly(100, 110, 120);
        assertThat(mapping.index().crosslineValues()).containsExactly(5, 7, 9);
        assertThat(mapping.index().rowOf(110)).isEqualTo(1);
        assertThat(mapping.index().columnOf(9)).isEqualTo(2);
        assertThat(mapping.index().rowOf(105)).isEqualTo(-1);
        assertThat(mapping.fallbackTraces()).isZero();
        assertThat(mapping.duplicateTraces()).isZero();
        assertThat(mapping.positions()).noneMatch(GridPosition::synthetic);
    }

    @Test
    void map_zeroOrMissingHeadersUseSyntheticGrid() {
        List<TraceHeader> headers = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            headers.add(TraceHeader.withoutPosition(0, 0));
        }
        headers.set(4, null);

        GridMapping mapping = new GridMapper().map(headers);

        // gridSize = floor(sqrt(10)) = 3
        assertThat(mapping.fallbackTraces()).isEqualTo(10);
        assertThat(mapping.positions().get(0)).isEqualTo(new GridPosition(1, 1, true));
        assertThat(mapping.positions().get(4)).isEqualTo(new GridPosition(2, 2, true));
        assertThat(mapping.positions().get(9)).isEqualTo(new GridPosition(4, 1, true));
        assertThat(mapping.index().inlineValues()).containsExactly(1, 2, 3, 4);
        assertThat(mapping.index().crosslineValues()).containsExactly(1, 2, 3);
    }

    @Test
    void map_syntheticAssignmentIsDeterministic() {
        List<TraceHeader> headers = Arrays.asList(
                TraceHeader.withoutPosition(0, 3),
                TraceHeader.withoutPosition(5, 5),
                null,
                TraceHeader.withoutPosition(7, 0),
                TraceHeader.withoutPosition(6, 6)
        );

        GridMapping first = new GridMapper().map(headers);
        GridMapping second = new GridMapper().map(headers);

        assertThat(second.positions()).isEqualTo(first.positions());
        assertThat(second.index().inlineValues()).isEqualTo(first.index().inlineValues());
        assertThat(second.index().crosslineValues()).isEqualTo(first.index().crosslineValues());
    }

    @Test
    void map_validHeadersNeverTakeFallbackPath() {
        List<Integer> fallbackCalls = new ArrayList<>();
        HeaderFallbackPolicy recording = (traceIndex, traceCount, header) -> {
            fallbackCalls.add(traceIndex);
            return new GridPosition(900 + traceIndex, 900, true);
        };
        List<TraceHeader> headers = Arrays.asList(
                TraceHeader.withoutPosition(1, 1),
                TraceHeader.withoutPosition(0, 2),
                TraceHeader.withoutPosition(2, 2),
                null
        );

        GridMapping mapping = new GridMapper(recording).map(headers);

        assertThat(fallbackCalls).containsExactly(1, 3);
        assertThat(mapping.positions().get(1)).isEqualTo(new GridPosition(901, 900, true));
        assertThat(mapping.positions().get(2)).isEqualTo(new GridPosition(2, 2, false));
        assertThat(mapping.resolvedHeaders().get(3)).isEqualTo(TraceHeader.withoutPosition(903, 900));
    }

    @Test
    void map_countsDuplicatePairs() {
        List<TraceHeader> headers = List.of(
                TraceHeader.withoutPosition(1, 1),
                TraceHeader.withoutPosition(1, 2),
                TraceHeader.withoutPosition(1, 1),
                TraceHeader.withoutPosition(1, 1)
        );

        GridMapping mapping = new GridMapper().map(headers);

        assertThat(mapping.duplicateTraces()).isEqualTo(2);
        assertThat(mapping.index().inlineCount()).isEqualTo(1);
        assertThat(mapping.index().crosslineCount()).isEqualTo(2);
    }
}
