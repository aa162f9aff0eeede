// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.library;

import io.pfive.speclib.exception.EntryNotFoundException;
import io.pfive.speclib.util.Ret;

import java.util.Iterator;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/// Read access to library entries by their dense, zero-based library index.
public interface SpectrumContainer extends Iterable<LibraryEntry> {

    /// Number of entries.
    int length ();

    /// True if an entry exists at the given library index.
    boolean contains (int index);

    /// The entry at the given library index, or an Err explaining why there is none.
    Ret<LibraryEntry> lookup (int index);

    /// The entry at the given library index.
    /// @throws EntryNotFoundException if there is no such entry
    default LibraryEntry get (int index) {
        return lookup(index).getOrThrow(EntryNotFoundException::new);
    }

    /// Each call starts again from index 0 and visits entries in ascending index order.
    @Override
    Iterator<LibraryEntry> iterator ();

    default Stream<LibraryEntry> stream () {
        return StreamSupport.stream(spliterator(), false);
    }
}
