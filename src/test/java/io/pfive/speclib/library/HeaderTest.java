// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.library;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class HeaderTest {

    @Test
    void put_widensBoxedNumbers () {
        Header header = new Header().put("nstars", 404).put("resolution", 6.0e4f).put("normalized", true);

        assertThat(header.get("nstars")).isEqualTo(404L);
        assertThat(header.get("resolution")).isEqualTo(60000.0);
        assertThat(header.get("normalized")).isEqualTo(true);
    }

    @Test
    void put_rejectsNonScalars () {
        Header header = new Header();

        assertThatThrownBy(() -> header.put("stars", List.of("a", "b")))
              .isInstanceOf(IllegalArgumentException.class)
              .hasMessageContaining("stars");
        assertThatThrownBy(() -> header.put("nothing", null))
              .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void copy_isIndependent () {
        Header original = Header.of(Map.of("a", "1"));
        Header copy = original.copy();

        copy.put("b", "2");

        assertThat(original.keys()).containsExactly("a");
        assertThat(copy.keys()).containsExactlyInAnyOrder("a", "b");
    }

    @Test
    void stampCreated_usesIsoDate () {
        Header header = new Header();

        header.stampCreated(LocalDate.of(2016, 3, 9));

        assertThat(header.getString(Header.DATE_CREATED)).isEqualTo("2016-03-09");
    }
}
