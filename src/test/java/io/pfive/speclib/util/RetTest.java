// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.util;

import io.pfive.speclib.exception.EntryNotFoundException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class RetTest {

    @Test
    void ok_returnsValue () {
        Ret<String> ret = Ret.ok("HD 10700");

        assertThat(ret.isOk()).isTrue();
        assertThat(ret.get()).isEqualTo("HD 10700");
        assertThatThrownBy(ret::errorMessage).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void err_throwsRequestedException () {
        Ret<String> ret = Ret.err("No library entry with index 9.");

        assertThat(ret.isErr()).isTrue();
        assertThatThrownBy(ret::get)
              .isInstanceOf(MissingReturnValueException.class)
              .hasMessage("No library entry with index 9.");
        assertThatThrownBy(() -> ret.getOrThrow(EntryNotFoundException::new))
              .isInstanceOf(EntryNotFoundException.class);
    }

    @Test
    void nullValues_areRejected () {
        assertThatThrownBy(() -> Ret.ok(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void human_usesDecimalUnits () {
        assertThat(ByteSizeUtil.human(999)).isEqualTo("999 B");
        assertThat(ByteSizeUtil.human(1_240_000)).isEqualTo("1.2 MB");
    }
}
