// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.store;

import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.google.common.collect.ImmutableMap;
import io.pfive.speclib.Configuration;
import io.pfive.speclib.exception.LibraryFormatException;
import io.pfive.speclib.exception.LibraryIOException;
import io.pfive.speclib.exception.RangeException;
import io.pfive.speclib.library.Header;
import io.pfive.speclib.library.SampleWindow;
import io.pfive.speclib.library.SpectrumTensor;
import io.pfive.speclib.library.WavelengthAxis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.IntFunction;
import java.util.zip.DataFormatException;

/// Saves and loads the wavelength axis, spectra and header of a library as a binary array
/// container: named, chunked, optionally compressed datasets of doubles plus file-level
/// attributes. Two datasets are stored. "wav" is the one-dimensional wavelength axis in a single
/// uncompressed chunk. "library_spectra" is the (N, 2, W) tensor of flux and uncertainty, cut into
/// chunks of shape (N, 2, C) along the wavelength axis so that a wavelength window can be read
/// without reading the rest. Those chunks are byte-shuffled and deflated.
///
/// Layout, using Kryo Output encodings:
/// - magic bytes "SPECLIB1"
/// - the header attributes as a JSON object
/// - the stored bytes of every chunk of every dataset
/// - a directory: attributes offset and length, then per dataset its name, element type, rank,
///   chunk layout, filters, and per chunk its offset, stored length and CRC32
/// - the offset of the directory as a fixed-width long, which is always the last 8 bytes
public abstract class SpectrumFile {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final String WAVELENGTH_DATASET = "wav";
    public static final String SPECTRA_DATASET = "library_spectra";

    private static final byte[] MAGIC = "SPECLIB1".getBytes(StandardCharsets.US_ASCII);
    private static final byte FLOAT64 = 8;
    // Fixed long offset, int checksum and at least one byte of varint length.
    private static final int MIN_CHUNK_ENTRY_BYTES = Long.BYTES + Integer.BYTES + 1;

    // Allow NaN and infinite header values to survive a round trip as numbers.
    private static final ObjectMapper objectMapper = JsonMapper.builder()
          .addModule(new GuavaModule())
          .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
          .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
          .build();

    private static final TypeReference<ImmutableMap<String, Object>> ATTRIBUTES_TYPE = new TypeReference<>() { };

    /// Storage settings for the spectra dataset.
    public record Options (int chunkTargetBytes, int compressionLevel, boolean shuffle) {

        public Options {
            if (chunkTargetBytes < 1) {
                throw new IllegalArgumentException("Chunk target size must be positive, was " + chunkTargetBytes);
            }
        }

        public static Options defaults () {
            return new Options(Configuration.CHUNK_TARGET_BYTES, Configuration.COMPRESSION_LEVEL, Configuration.SHUFFLE);
        }

        ChunkCodec codec () {
            return new ChunkCodec(shuffle, compressionLevel);
        }
    }

    public static void write (Path path, WavelengthAxis wavelengths, SpectrumTensor spectra, Header header) {
        write(path, wavelengths, spectra, header, Options.defaults());
    }

    /// Write a spectrum file, replacing any existing file at the path.
    public static void write (Path path, WavelengthAxis wavelengths, SpectrumTensor spectra, Header header, Options options) {
        ChunkLayout spectraLayout = ChunkLayout.forTargetBytes(
              spectra.nEntries(), spectra.depth(), spectra.nSamples(), options.chunkTargetBytes());
        LOG.info("Storing library spectra with chunks of size {}", spectraLayout);
        try (Output out = new Output(Files.newOutputStream(path))) {
            out.writeBytes(MAGIC);
            long attributesOffset = out.total();
            byte[] attributes = objectMapper.writeValueAsBytes(ImmutableMap.copyOf(header.asMap()));
            out.writeBytes(attributes);
            double[] wav = wavelengths.toArray();
            Dataset wavDataset = writeChunks(out, WAVELENGTH_DATASET, 1, ChunkLayout.single(wav.length),
                  ChunkCodec.RAW, chunk -> wav);
            Dataset spectraDataset = writeChunks(out, SPECTRA_DATASET, 3, spectraLayout, options.codec(),
                  chunk -> spectra.copySamples(spectraLayout.chunkStart(chunk), spectraLayout.chunkEnd(chunk)));
            long directoryOffset = out.total();
            out.writeLong(attributesOffset);
            out.writeVarInt(attributes.length, true);
            out.writeVarInt(2, true);
            wavDataset.write(out);
            spectraDataset.write(out);
            out.writeLong(directoryOffset);
        } catch (IOException e) {
            throw new LibraryIOException(path, e);
        } catch (KryoException e) {
            throw FileBlocks.translate(path, e);
        }
    }

    private static Dataset writeChunks (
          Output out, String name, int rank, ChunkLayout layout, ChunkCodec codec, IntFunction<double[]> chunkValues
    ) {
        int nChunks = layout.chunkCount();
        long[] offsets = new long[nChunks];
        int[] lengths = new int[nChunks];
        int[] checksums = new int[nChunks];
        for (int c = 0; c < nChunks; c++) {
            byte[] stored = codec.encode(chunkValues.apply(c));
            offsets[c] = out.total();
            lengths[c] = stored.length;
            checksums[c] = ChunkCodec.checksum(stored);
            out.writeBytes(stored);
            LOG.debug("Chunk {} of {}: samples [{}, {}) in {} bytes.", c, name,
                  layout.chunkStart(c), layout.chunkEnd(c), stored.length);
        }
        return new Dataset(name, rank, layout, codec, offsets, lengths, checksums);
    }

    public static Reader open (Path path) {
        return new Reader(path);
    }

    /// Location and encoding of one stored array. Rank 1 arrays use only the sample axis of the
    /// layout.
    private record Dataset (
          String name, int rank, ChunkLayout layout, ChunkCodec codec,
          long[] chunkOffsets, int[] chunkLengths, int[] chunkChecksums
    ) {
        void write (Output out) {
            out.writeString(name);
            out.writeByte(FLOAT64);
            out.writeVarInt(rank, true);
            out.writeVarInt(layout.nEntries(), true);
            out.writeVarInt(layout.depth(), true);
            out.writeVarInt(layout.nSamples(), true);
            out.writeVarInt(layout.chunkSamples(), true);
            out.writeBoolean(codec.shuffle());
            out.writeVarInt(codec.compressionLevel() + 1, true);
            out.writeVarInt(chunkOffsets.length, true);
            for (int c = 0; c < chunkOffsets.length; c++) {
                out.writeLong(chunkOffsets[c]);
                out.writeVarInt(chunkLengths[c], true);
                out.writeInt(chunkChecksums[c]);
            }
        }

        static Dataset read (Input in, Path path) {
            String name = in.readString();
            byte type = in.readByte();
            if (type != FLOAT64) {
                throw new LibraryFormatException(path, String.format("Dataset '%s' has unsupported element type %d.", name, type));
            }
            int rank = in.readVarInt(true);
            ChunkLayout layout;
            ChunkCodec codec;
            try {
                layout = new ChunkLayout(in.readVarInt(true), in.readVarInt(true), in.readVarInt(true), in.readVarInt(true));
                boolean shuffle = in.readBoolean();
                codec = new ChunkCodec(shuffle, in.readVarInt(true) - 1);
            } catch (IllegalArgumentException e) {
                throw new LibraryFormatException(path, String.format("Dataset '%s': %s", name, e.getMessage()), e);
            }
            long nValues = (long) layout.nEntries() * layout.depth() * layout.nSamples();
            if (nValues > Integer.MAX_VALUE - 8) {
                var message = String.format("Dataset '%s' has shape (%d, %d, %d), too large to hold in one array.",
                      name, layout.nEntries(), layout.depth(), layout.nSamples());
                throw new LibraryFormatException(path, message);
            }
            int nChunks = in.readVarInt(true);
            if ((long) nChunks * MIN_CHUNK_ENTRY_BYTES > in.limit() - in.position()) {
                var message = String.format("Dataset '%s' lists %d chunks, more than its directory can describe.", name, nChunks);
                throw new LibraryFormatException(path, message);
            }
            if (nChunks != layout.chunkCount()) {
                var message = String.format("Dataset '%s' has %d chunks, its layout needs %d.", name, nChunks, layout.chunkCount());
                throw new LibraryFormatException(path, message);
            }
            long[] offsets = new long[nChunks];
            int[] lengths = new int[nChunks];
            int[] checksums = new int[nChunks];
            for (int c = 0; c < nChunks; c++) {
                offsets[c] = in.readLong();
                lengths[c] = in.readVarInt(true);
                checksums[c] = in.readInt();
            }
            return new Dataset(name, rank, layout, codec, offsets, lengths, checksums);
        }
    }

    /// An open spectrum file. The directory is read on opening; the attributes and datasets are
    /// read on request, and a window of the spectra reads only the chunks that overlap it.
    public static class Reader implements Closeable {

        private final Path path;
        private final FileChannel channel;
        private final long attributesOffset;
        private final int attributesLength;
        private final Map<String, Dataset> datasets = new LinkedHashMap<>();

        private Reader (Path path) {
            this.path = path;
            try {
                channel = FileChannel.open(path, StandardOpenOption.READ);
            } catch (IOException e) {
                throw new LibraryIOException(path, e);
            }
            try {
                long size = channel.size();
                if (size < MAGIC.length + Long.BYTES) {
                    throw new LibraryFormatException(path, "File too short to be a library spectrum file.");
                }
                if (!Arrays.equals(FileBlocks.readFully(channel, path, 0, MAGIC.length), MAGIC)) {
                    throw new LibraryFormatException(path, "Not a library spectrum file.");
                }
                long directoryOffset = new Input(FileBlocks.readFully(channel, path, size - Long.BYTES, Long.BYTES)).readLong();
                if (directoryOffset < MAGIC.length || directoryOffset > size - Long.BYTES) {
                    throw new LibraryFormatException(path, "Invalid directory offset " + directoryOffset);
                }
                byte[] directory = FileBlocks.readFully(channel, path, directoryOffset,
                      (int) (size - Long.BYTES - directoryOffset));
                Input in = new Input(directory);
                attributesOffset = in.readLong();
                attributesLength = in.readVarInt(true);
                int nDatasets = in.readVarInt(true);
                for (int d = 0; d < nDatasets; d++) {
                    Dataset dataset = Dataset.read(in, path);
                    datasets.put(dataset.name(), dataset);
                }
                dataset(WAVELENGTH_DATASET);
                dataset(SPECTRA_DATASET);
            } catch (IOException e) {
                closeAfterFailure();
                throw new LibraryIOException(path, e);
            } catch (KryoException e) {
                closeAfterFailure();
                throw FileBlocks.translate(path, e);
            } catch (RuntimeException e) {
                closeAfterFailure();
                throw e;
            }
        }

        private void closeAfterFailure () {
            try {
                channel.close();
            } catch (IOException e) {
                LOG.warn("Could not close {} after failing to open it.", path, e);
            }
        }

        private Dataset dataset (String name) {
            Dataset dataset = datasets.get(name);
            if (dataset == null) {
                throw new LibraryFormatException(path, String.format("Dataset '%s' not found.", name));
            }
            return dataset;
        }

        /// The file-level attributes.
        public Header header () {
            byte[] json;
            try {
                json = FileBlocks.readFully(channel, path, attributesOffset, attributesLength);
            } catch (IOException e) {
                throw new LibraryIOException(path, e);
            }
            try {
                Map<String, Object> attributes = objectMapper.readValue(json, ATTRIBUTES_TYPE);
                return Header.of(attributes);
            } catch (IOException e) {
                throw new LibraryFormatException(path, "Unreadable attributes: " + e.getMessage(), e);
            } catch (IllegalArgumentException e) {
                throw new LibraryFormatException(path, e.getMessage(), e);
            }
        }

        public WavelengthAxis wavelengths () {
            Dataset wav = dataset(WAVELENGTH_DATASET);
            if (wav.rank() != 1) {
                throw new LibraryFormatException(path, "Wavelength dataset must be one-dimensional.");
            }
            int n = wav.layout().nSamples();
            return WavelengthAxis.of(readWindow(wav, new SampleWindow(0, n)));
        }

        /// Shape (N, 2, W) of the stored spectra.
        public int[] spectraShape () {
            ChunkLayout layout = dataset(SPECTRA_DATASET).layout();
            return new int[] {layout.nEntries(), layout.depth(), layout.nSamples()};
        }

        /// Layout of the stored spectra chunks.
        public ChunkLayout spectraChunks () {
            return dataset(SPECTRA_DATASET).layout();
        }

        public SpectrumTensor readSpectra () {
            return readSpectra(new SampleWindow(0, dataset(SPECTRA_DATASET).layout().nSamples()));
        }

        /// Read samples [window.from, window.to) of every entry and plane.
        /// @throws RangeException if the window extends past the stored samples
        public SpectrumTensor readSpectra (SampleWindow window) {
            Dataset spectra = dataset(SPECTRA_DATASET);
            if (spectra.rank() != 3) {
                throw new LibraryFormatException(path, "Spectra dataset must be three-dimensional.");
            }
            ChunkLayout layout = spectra.layout();
            double[] values = readWindow(spectra, window);
            return SpectrumTensor.of(layout.nEntries(), layout.depth(), window.length(), values);
        }

        private double[] readWindow (Dataset dataset, SampleWindow window) {
            ChunkLayout layout = dataset.layout();
            if (window.to() > layout.nSamples()) {
                var message = String.format("Sample window [%d, %d) extends past the %d samples of dataset '%s'.",
                      window.from(), window.to(), layout.nSamples(), dataset.name());
                throw new RangeException(message);
            }
            int rows = layout.nEntries() * layout.depth();
            int width = window.length();
            double[] out = new double[rows * width];
            if (width == 0) return out;
            int firstChunk = layout.chunkForSample(window.from());
            int lastChunk = layout.chunkForSample(window.to() - 1);
            for (int c = firstChunk; c <= lastChunk; c++) {
                double[] chunk = readChunk(dataset, c);
                int chunkStart = layout.chunkStart(c);
                int chunkWidth = layout.chunkEnd(c) - chunkStart;
                int from = Math.max(window.from(), chunkStart);
                int to = Math.min(window.to(), layout.chunkEnd(c));
                for (int r = 0; r < rows; r++) {
                    System.arraycopy(chunk, r * chunkWidth + (from - chunkStart), out, r * width + (from - window.from()), to - from);
                }
            }
            return out;
        }

        private double[] readChunk (Dataset dataset, int chunk) {
            try {
                byte[] stored = FileBlocks.readFully(channel, path, dataset.chunkOffsets()[chunk], dataset.chunkLengths()[chunk]);
                if (ChunkCodec.checksum(stored) != dataset.chunkChecksums()[chunk]) {
                    throw new LibraryFormatException(path, String.format("Checksum mismatch in chunk %d of '%s'.", chunk, dataset.name()));
                }
                return dataset.codec().decode(stored, dataset.layout().chunkValues(chunk));
            } catch (IOException e) {
                throw new LibraryIOException(path, e);
            } catch (DataFormatException e) {
                throw new LibraryFormatException(path, String.format("Chunk %d of '%s': %s", chunk, dataset.name(), e.getMessage()), e);
            }
        }

        @Override
        public void close () {
            try {
                channel.close();
            } catch (IOException e) {
                throw new LibraryIOException(path, e);
            }
        }
    }
}
