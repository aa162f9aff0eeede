// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// A library of stellar spectra sharing one wavelength axis, each spectrum paired with a row of
/// stellar parameters. Libraries are built by inserting stars one at a time or from existing arrays,
/// and are accessed by library index like a read-only sequence.
package io.pfive.speclib.library;
