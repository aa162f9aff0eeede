// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.library;

import io.pfive.speclib.exception.RangeException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class WavelengthAxisTest {

    private final WavelengthAxis axis = WavelengthAxis.of(5000, 5001, 5002, 5003, 5004, 5005);

    @Test
    void window_excludesSamplesOnTheLimits () {
        SampleWindow window = axis.window(new WavelengthLimits(5001, 5004));

        assertThat(window).isEqualTo(new SampleWindow(2, 4));
        assertThat(axis.slice(window).toArray()).containsExactly(5002, 5003);
    }

    @Test
    void window_coveringWholeAxis_selectsEverything () {
        SampleWindow window = axis.window(new WavelengthLimits(4000, 6000));

        assertThat(window).isEqualTo(new SampleWindow(0, 6));
    }

    @Test
    void window_withNoSamplesInside_throwsRangeException () {
        assertThatThrownBy(() -> axis.window(new WavelengthLimits(5002, 5003)))
              .isInstanceOf(RangeException.class)
              .hasMessageContaining("No wavelength samples");
        assertThatThrownBy(() -> axis.window(new WavelengthLimits(6000, 7000)))
              .isInstanceOf(RangeException.class);
    }

    @Test
    void limits_mustBeOrdered () {
        assertThatThrownBy(() -> new WavelengthLimits(5005, 5000))
              .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WavelengthLimits(Double.NaN, 5000))
              .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toArray_returnsCopy () {
        double[] samples = axis.toArray();
        samples[0] = -1;

        assertThat(axis.get(0)).isEqualTo(5000);
    }
}
