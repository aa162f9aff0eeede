// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.library;

import com.google.common.base.MoreObjects;
import io.pfive.speclib.exception.RangeException;
import io.pfive.speclib.exception.SchemaException;
import io.pfive.speclib.exception.ShapeException;
import io.pfive.speclib.store.LibraryStore;
import io.pfive.speclib.util.ByteSize;
import io.pfive.speclib.util.Ret;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.OptionalInt;

import static com.google.common.base.Preconditions.checkState;
import static io.pfive.speclib.util.ByteSizeUtil.OBJECT_BYTES;

/// A library of stellar spectra on a common wavelength axis, each paired with a row of stellar
/// parameters. Entry i of the library is row i of the parameter table together with slab i of the
/// spectrum tensor, and its library index is i. Libraries only grow, by appending entries with
/// insert(), so library indexes are dense and start at zero.
///
/// Spectra must already be shifted and interpolated onto the library wavelength axis before they
/// are inserted. Only shapes, lengths and the presence of required columns are checked here.
/// Instances are not threadsafe.
public class SpectralLibrary implements SpectrumContainer, ByteSize {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final String DATE_CREATED = Header.DATE_CREATED;

    // Table and tensor are immutable and replaced together on insert.
    private ParameterTable parameters;
    private SpectrumTensor spectra;
    private final WavelengthAxis wavelengths;
    private final Header header;
    private final WavelengthLimits wavelengthLimits;

    private SpectralLibrary (
          ParameterTable parameters,
          SpectrumTensor spectra,
          WavelengthAxis wavelengths,
          Header header,
          WavelengthLimits wavelengthLimits
    ) {
        this.parameters = parameters;
        this.spectra = spectra;
        this.wavelengths = wavelengths;
        this.header = header;
        this.wavelengthLimits = wavelengthLimits;
    }

    /// A library with no entries. The header holds only the creation date.
    public static SpectralLibrary empty (WavelengthAxis wavelengths) {
        return empty(wavelengths, null);
    }

    /// A library with no entries. The wavelength limits are only recorded, there is nothing to
    /// restrict yet.
    public static SpectralLibrary empty (WavelengthAxis wavelengths, WavelengthLimits wavelengthLimits) {
        if (wavelengths == null) throw new NullPointerException("wavelength axis");
        Header header = new Header();
        header.stampCreated(LocalDate.now());
        return new SpectralLibrary(
              ParameterTable.empty(),
              SpectrumTensor.empty(wavelengths.length()),
              wavelengths,
              header,
              wavelengthLimits
        );
    }

    public static SpectralLibrary create (WavelengthAxis wavelengths, SpectrumTensor spectra, ParameterTable parameters) {
        return create(wavelengths, spectra, parameters, Map.of(), null);
    }

    public static SpectralLibrary create (
          WavelengthAxis wavelengths, SpectrumTensor spectra, ParameterTable parameters, Map<String, ?> header
    ) {
        return create(wavelengths, spectra, parameters, header, null);
    }

    public static SpectralLibrary create (
          WavelengthAxis wavelengths,
          SpectrumTensor spectra,
          ParameterTable parameters,
          Map<String, ?> header,
          WavelengthLimits wavelengthLimits
    ) {
        Header copied = header == null ? new Header() : Header.of(header);
        return create(wavelengths, spectra, parameters, copied, wavelengthLimits);
    }

    /// Create a library from existing data. If either the spectra or the parameters are null, this
    /// returns an empty library on the given axis, ignoring the other arguments except the limits.
    /// The header is copied, and its creation date is always set to today even if it had one.
    /// @throws SchemaException if the table lacks a required column
    /// @throws ShapeException if the table and tensor lengths differ, or the tensor is not (N, 2, W)
    /// @throws RangeException if a row library index lies outside [0, N)
    public static SpectralLibrary create (
          WavelengthAxis wavelengths,
          SpectrumTensor spectra,
          ParameterTable parameters,
          Header header,
          WavelengthLimits wavelengthLimits
    ) {
        if (spectra == null || parameters == null) {
            return empty(wavelengths, wavelengthLimits);
        }
        if (wavelengths == null) throw new NullPointerException("wavelength axis");
        validate(wavelengths, spectra, parameters);
        Header ownHeader = header == null ? new Header() : header.copy();
        ownHeader.stampCreated(LocalDate.now());
        return new SpectralLibrary(parameters, spectra, wavelengths, ownHeader, wavelengthLimits);
    }

    private static void validate (WavelengthAxis wavelengths, SpectrumTensor spectra, ParameterTable parameters) {
        Optional<String> missing = LibraryColumns.firstMissing(parameters.columns());
        if (missing.isPresent()) {
            throw new SchemaException(missing.get(), "parameter table");
        }
        int nSpectra = spectra.nEntries();
        if (parameters.size() != nSpectra) {
            var message = String.format("Length of parameter table (%d) and library spectra (%d) are not equal.",
                  parameters.size(), nSpectra);
            throw new ShapeException(message);
        }
        for (int i = 0; i < parameters.size(); i++) {
            OptionalInt libIndex = parameters.row(i).libIndex();
            if (libIndex.isEmpty()) {
                throw new RangeException(String.format("Row %d has no library index.", i));
            }
            if (libIndex.getAsInt() < 0 || libIndex.getAsInt() >= nSpectra) {
                var message = String.format("Index %d is out of bounds in library spectra of length %d.",
                      libIndex.getAsInt(), nSpectra);
                throw new RangeException(message);
            }
        }
        if (spectra.depth() != SpectrumTensor.PAIR_DEPTH || spectra.nSamples() != wavelengths.length()) {
            var message = String.format("Library spectra should have shape (%d, 2, %d) but have shape %s.",
                  nSpectra, wavelengths.length(), spectra.shapeString());
            throw new ShapeException(message);
        }
    }

    /// Append a star to the library. The row is stored as a copy with its library index set to the
    /// current number of entries; the caller's row is unchanged. Everything is checked before the
    /// library is modified.
    /// @return the library index assigned to the new entry
    /// @throws SchemaException if the row lacks a required column
    /// @throws ShapeException if the spectrum or uncertainty length differs from the wavelength axis
    /// @throws ColumnTypeException if a value does not fit the type of its column
    public int insert (ParameterRow row, double[] spectrum, double[] spectrumUncertainty) {
        checkState(parameters.size() == spectra.nEntries(),
              "Length of parameter table (%s) and library spectra (%s) are not equal.",
              parameters.size(), spectra.nEntries());
        Optional<String> missing = LibraryColumns.firstMissing(row.columns());
        if (missing.isPresent()) {
            throw new SchemaException(missing.get(), "parameter specification");
        }
        if (spectrum.length != wavelengths.length()) {
            var message = String.format("Spectrum length (%d) is not the same as library wavelength array length (%d).",
                  spectrum.length, wavelengths.length());
            throw new ShapeException(message);
        }
        int libIndex = spectra.nEntries();
        // Both new structures are built before either is swapped in.
        SpectrumTensor newSpectra = spectra.appended(new SpectrumPair(spectrum.clone(), spectrumUncertainty.clone()));
        ParameterTable newParameters = parameters.appended(row.withLibIndex(libIndex));
        spectra = newSpectra;
        parameters = newParameters;
        LOG.debug("Inserted {} into library at index {}.", row.getString(LibraryColumns.CPS_NAME), libIndex);
        return libIndex;
    }

    public int insert (ParameterRow row, SpectrumPair spectrum) {
        return insert(row, spectrum.flux(), spectrum.uncertainty());
    }

    /// Write the parameter table and the spectra to a pair of files, replacing any existing ones.
    /// See [LibraryStore#save] for the file formats.
    public void save (Path parameterPath, Path spectrumPath) {
        LibraryStore.save(this, parameterPath, spectrumPath);
    }

    public static SpectralLibrary load (Path parameterPath, Path spectrumPath) {
        return LibraryStore.load(parameterPath, spectrumPath, null);
    }

    /// Load a library, reading only the wavelength samples strictly inside the given limits.
    /// @throws RangeException if no wavelength sample lies inside the limits
    public static SpectralLibrary load (Path parameterPath, Path spectrumPath, WavelengthLimits wavelengthLimits) {
        return LibraryStore.load(parameterPath, spectrumPath, wavelengthLimits);
    }

    public ParameterTable parameterTable () {
        return parameters;
    }

    public SpectrumTensor spectra () {
        return spectra;
    }

    public WavelengthAxis wavelengths () {
        return wavelengths;
    }

    /// The metadata owned by this library. Callers may add entries to it before saving.
    public Header header () {
        return header;
    }

    public Optional<WavelengthLimits> wavelengthLimits () {
        return Optional.ofNullable(wavelengthLimits);
    }

    @Override
    public int length () {
        return spectra.nEntries();
    }

    @Override
    public boolean contains (int index) {
        return index >= 0 && index < parameters.size();
    }

    @Override
    public Ret<LibraryEntry> lookup (int index) {
        if (!contains(index)) {
            return Ret.err(String.format("No library entry with index %d, library has %d entries.", index, length()));
        }
        return Ret.ok(new LibraryEntry(parameters.row(index), spectra.pair(index)));
    }

    /// Iterates over the entries present when iteration begins. Entries inserted during iteration
    /// are not visited.
    @Override
    public Iterator<LibraryEntry> iterator () {
        final ParameterTable table = parameters;
        final SpectrumTensor tensor = spectra;
        return new Iterator<>() {
            private int next = 0;

            @Override
            public boolean hasNext () {
                return next < tensor.nEntries();
            }

            @Override
            public LibraryEntry next () {
                if (!hasNext()) throw new NoSuchElementException();
                int index = next++;
                return new LibraryEntry(table.row(index), tensor.pair(index));
            }
        };
    }

    @Override
    public long byteSize () {
        return OBJECT_BYTES + parameters.byteSize() + spectra.byteSize() + (long) wavelengths.length() * Double.BYTES;
    }

    /// Short summary for logs and debugging, unlike toString() which lists the header.
    public String describe () {
        return MoreObjects.toStringHelper(this)
              .add("nEntries", length())
              .add("nSamples", wavelengths.length())
              .add("wavelengthLimits", wavelengthLimits)
              .add("memBytes", humanByteSize())
              .toString();
    }

    @Override
    public String toString () {
        StringBuilder out = new StringBuilder("<").append(SpectralLibrary.class.getName()).append(">\n");
        for (Map.Entry<String, Object> entry : header.asMap().entrySet()) {
            out.append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
        }
        return out.toString();
    }
}
