// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// Persistence of spectral libraries as a pair of files: a table of stellar parameters with per-row
/// random access, and a chunked, compressed array container holding the wavelength axis and spectra
/// so that a wavelength window can be loaded without reading the whole file.
package io.pfive.speclib.store;
