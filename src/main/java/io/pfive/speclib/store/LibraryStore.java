// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.store;

import io.pfive.speclib.Configuration;
import io.pfive.speclib.exception.RangeException;
import io.pfive.speclib.library.Header;
import io.pfive.speclib.library.ParameterTable;
import io.pfive.speclib.library.SampleWindow;
import io.pfive.speclib.library.SpectralLibrary;
import io.pfive.speclib.library.SpectrumTensor;
import io.pfive.speclib.library.WavelengthAxis;
import io.pfive.speclib.library.WavelengthLimits;
import io.pfive.speclib.util.MilliTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.file.Path;

/// Saves and loads a whole SpectralLibrary as a pair of files: a ParameterFile holding the
/// parameter table and a SpectrumFile holding the wavelength axis, spectra and header.
///
/// With atomic saving enabled (the default) both files are written completely under temporary
/// names before either destination is touched, then moved into place one after the other. A
/// failure while writing leaves the previous pair of files intact. The two moves are not one
/// transaction: a crash between them leaves a new parameter file next to an old spectrum file.
/// The parameter file is moved first, and a mismatch in entry count is reported on load.
public abstract class LibraryStore {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static void save (SpectralLibrary library, Path parameterPath, Path spectrumPath) {
        save(library, parameterPath, spectrumPath, SpectrumFile.Options.defaults(), Configuration.ATOMIC_SAVE);
    }

    public static void save (
          SpectralLibrary library, Path parameterPath, Path spectrumPath, SpectrumFile.Options options, boolean atomic
    ) {
        MilliTimer timer = new MilliTimer();
        if (!atomic) {
            writeFiles(library, parameterPath, spectrumPath, options);
        } else {
            Path tempParameters = AtomicFiles.tempSibling(parameterPath);
            Path tempSpectra = AtomicFiles.tempSibling(spectrumPath);
            try {
                writeFiles(library, tempParameters, tempSpectra, options);
                AtomicFiles.moveIntoPlace(tempParameters, parameterPath);
                AtomicFiles.moveIntoPlace(tempSpectra, spectrumPath);
            } finally {
                AtomicFiles.deleteIfExists(tempParameters);
                AtomicFiles.deleteIfExists(tempSpectra);
            }
        }
        LOG.info("Saved library of {} spectra to {} and {} in {}.",
              library.length(), parameterPath, spectrumPath, timer.getElapsedString());
    }

    private static void writeFiles (SpectralLibrary library, Path parameterPath, Path spectrumPath, SpectrumFile.Options options) {
        ParameterFile.write(parameterPath, library.parameterTable());
        SpectrumFile.write(spectrumPath, library.wavelengths(), library.spectra(), library.header(), options);
    }

    /// Load a library. If wavelength limits are given, only the samples strictly inside them are
    /// read, both from the axis and from the spectra, and the limits are recorded on the library.
    /// @throws RangeException if no sample lies inside the limits
    public static SpectralLibrary load (Path parameterPath, Path spectrumPath, WavelengthLimits wavelengthLimits) {
        MilliTimer timer = new MilliTimer();
        ParameterTable parameters = ParameterFile.read(parameterPath);
        Header header;
        WavelengthAxis wavelengths;
        SpectrumTensor spectra;
        try (SpectrumFile.Reader reader = SpectrumFile.open(spectrumPath)) {
            header = reader.header();
            wavelengths = reader.wavelengths();
            if (wavelengthLimits == null) {
                spectra = reader.readSpectra();
            } else {
                SampleWindow window = wavelengths.window(wavelengthLimits);
                spectra = reader.readSpectra(window);
                wavelengths = wavelengths.slice(window);
            }
        }
        SpectralLibrary library = SpectralLibrary.create(wavelengths, spectra, parameters, header, wavelengthLimits);
        LOG.info("Loaded library of {} spectra with {} samples from {} in {}.",
              library.length(), wavelengths.length(), spectrumPath, timer.getElapsedString());
        return library;
    }
}
