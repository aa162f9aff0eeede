// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.store;

import io.pfive.speclib.exception.LibraryIOException;
import io.pfive.speclib.exception.RangeException;
import io.pfive.speclib.exception.ShapeException;
import io.pfive.speclib.library.Header;
import io.pfive.speclib.library.LibraryEntry;
import io.pfive.speclib.library.SampleWindow;
import io.pfive.speclib.library.SpectralLibrary;
import io.pfive.speclib.library.WavelengthLimits;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.stream.Stream;

import static io.pfive.speclib.library.LibraryFixtures.*;
import static org.assertj.core.api.Assertions.*;

class LibraryStoreTest {

    private static final int W = 300;

    @TempDir
    Path tempDir;

    private Path paramPath () {
        return tempDir.resolve("library_params.bin");
    }

    private Path specPath () {
        return tempDir.resolve("library_spectra.bin");
    }

    @Test
    void save_thenLoad_restoresEveryEntry () {
        SpectralLibrary library = library(4, W);
        library.header().put("source_list", "spocs+mann").put("nstars", 4L).put("resolution", 6.0e4).put("normalized", true);

        library.save(paramPath(), specPath());
        SpectralLibrary loaded = SpectralLibrary.load(paramPath(), specPath());

        assertThat(loaded.length()).isEqualTo(4);
        assertThat(loaded.wavelengths()).isEqualTo(library.wavelengths());
        assertThat(loaded.spectra()).isEqualTo(library.spectra());
        assertThat(loaded.parameterTable()).isEqualTo(library.parameterTable());
        assertThat(loaded.header()).isEqualTo(library.header());
        assertThat(loaded.header().get("normalized")).isEqualTo(true);
        assertThat(loaded.header().getString(Header.DATE_CREATED)).isEqualTo(LocalDate.now().toString());
        assertThat(loaded.wavelengthLimits()).isEmpty();
        assertThat(loaded.stream().map(LibraryEntry::libIndex)).containsExactly(0, 1, 2, 3);
    }

    @Test
    void load_restampsCreationDate () {
        SpectralLibrary library = library(1, W);
        library.header().put(Header.DATE_CREATED, "2016-03-09");
        library.save(paramPath(), specPath());

        SpectralLibrary loaded = SpectralLibrary.load(paramPath(), specPath());

        assertThat(loaded.header().getString(Header.DATE_CREATED)).isEqualTo(LocalDate.now().toString());
    }

    @Test
    void load_withLimits_readsOnlyInsideSamples () {
        SpectralLibrary library = library(3, W);
        library.save(paramPath(), specPath());
        // Axis runs from 5000.0 in steps of 0.5, so 5010 and 5020 are samples 20 and 40.
        WavelengthLimits limits = new WavelengthLimits(5010, 5020);

        SpectralLibrary loaded = SpectralLibrary.load(paramPath(), specPath(), limits);

        SampleWindow inside = new SampleWindow(21, 40);
        assertThat(loaded.wavelengths()).isEqualTo(library.wavelengths().slice(inside));
        assertThat(loaded.spectra()).isEqualTo(library.spectra().sliceSamples(inside));
        assertThat(loaded.spectra().shape()).containsExactly(3, 2, 19);
        assertThat(loaded.wavelengthLimits()).contains(limits);
    }

    @Test
    void load_withLimitsAcrossSmallChunks_matchesFullRead () {
        SpectralLibrary library = library(5, W);
        LibraryStore.save(library, paramPath(), specPath(), new SpectrumFile.Options(800, 1, true), true);
        WavelengthLimits limits = new WavelengthLimits(5003.2, 5091.7);

        SpectralLibrary loaded = LibraryStore.load(paramPath(), specPath(), limits);

        SampleWindow inside = library.wavelengths().window(limits);
        assertThat(inside).isEqualTo(new SampleWindow(7, 184));
        assertThat(loaded.spectra()).isEqualTo(library.spectra().sliceSamples(inside));
    }

    @Test
    void load_withLimitsOutsideAxis_throwsRangeException () {
        library(2, W).save(paramPath(), specPath());

        assertThatThrownBy(() -> SpectralLibrary.load(paramPath(), specPath(), new WavelengthLimits(6000, 6100)))
              .isInstanceOf(RangeException.class);
    }

    @Test
    void emptyLibrary_roundTrips () {
        SpectralLibrary library = SpectralLibrary.empty(axis(W));

        library.save(paramPath(), specPath());
        SpectralLibrary loaded = SpectralLibrary.load(paramPath(), specPath());

        assertThat(loaded.length()).isZero();
        assertThat(loaded.spectra().shape()).containsExactly(0, 2, W);
        assertThat(loaded.wavelengths()).isEqualTo(library.wavelengths());
    }

    @Test
    void save_replacesExistingFilesAndLeavesNoTemporaries () throws IOException {
        library(2, W).save(paramPath(), specPath());

        library(5, W).save(paramPath(), specPath());

        assertThat(SpectralLibrary.load(paramPath(), specPath()).length()).isEqualTo(5);
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                  .containsExactlyInAnyOrder("library_params.bin", "library_spectra.bin");
        }
    }

    @Test
    void save_intoMissingDirectory_leavesNothingBehind () {
        Path missing = tempDir.resolve("missing");

        assertThatThrownBy(() -> library(1, W).save(missing.resolve("p.bin"), missing.resolve("s.bin")))
              .isInstanceOf(LibraryIOException.class);
        assertThat(missing).doesNotExist();
    }

    @Test
    void nonAtomicSave_writesDestinationsDirectly () {
        SpectralLibrary library = library(2, W);

        LibraryStore.save(library, paramPath(), specPath(), SpectrumFile.Options.defaults(), false);

        assertThat(SpectralLibrary.load(paramPath(), specPath()).spectra()).isEqualTo(library.spectra());
    }

    @Test
    void load_mismatchedFiles_throwsShapeException () {
        library(2, W).save(paramPath(), tempDir.resolve("unused.bin"));
        library(3, W).save(tempDir.resolve("unused_params.bin"), specPath());

        assertThatThrownBy(() -> SpectralLibrary.load(paramPath(), specPath()))
              .isInstanceOf(ShapeException.class)
              .hasMessageContaining("(2)")
              .hasMessageContaining("(3)");
    }
}
