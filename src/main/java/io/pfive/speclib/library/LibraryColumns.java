// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.speclib.library;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Collection;
import java.util.Optional;

/// The fixed set of columns every library parameter table must have. Values may be missing in any
/// of them, but the columns themselves must be present. Physical quantities are paired with an
/// uncertainty column prefixed "u_", except the projected rotation velocity vsini.
public abstract class LibraryColumns {

    public static final String LIB_INDEX = "lib_index";
    public static final String CPS_NAME = "cps_name";
    public static final String OBS = "obs";
    public static final String LIB_OBS = "lib_obs";
    public static final String TEFF = "Teff";
    public static final String U_TEFF = "u_Teff";
    public static final String RADIUS = "radius";
    public static final String U_RADIUS = "u_radius";
    public static final String LOGG = "logg";
    public static final String U_LOGG = "u_logg";
    public static final String FEH = "feh";
    public static final String U_FEH = "u_feh";
    public static final String MASS = "mass";
    public static final String U_MASS = "u_mass";
    public static final String AGE = "age";
    public static final String U_AGE = "u_age";
    public static final String VSINI = "vsini";
    public static final String SOURCE = "source";
    public static final String SOURCE_NAME = "source_name";

    /// Required columns in the order they are laid out in a new table.
    public static final ImmutableMap<String, ColumnType> REQUIRED = ImmutableMap.<String, ColumnType>builder()
          .put(LIB_INDEX, ColumnType.INTEGER)
          .put(CPS_NAME, ColumnType.STRING)
          .put(OBS, ColumnType.STRING)
          .put(LIB_OBS, ColumnType.STRING)
          .put(TEFF, ColumnType.REAL)
          .put(U_TEFF, ColumnType.REAL)
          .put(RADIUS, ColumnType.REAL)
          .put(U_RADIUS, ColumnType.REAL)
          .put(LOGG, ColumnType.REAL)
          .put(U_LOGG, ColumnType.REAL)
          .put(FEH, ColumnType.REAL)
          .put(U_FEH, ColumnType.REAL)
          .put(MASS, ColumnType.REAL)
          .put(U_MASS, ColumnType.REAL)
          .put(AGE, ColumnType.REAL)
          .put(U_AGE, ColumnType.REAL)
          .put(VSINI, ColumnType.REAL)
          .put(SOURCE, ColumnType.STRING)
          .put(SOURCE_NAME, ColumnType.STRING)
          .build();

    public static final ImmutableList<String> NAMES = REQUIRED.keySet().asList();

    /// Returns the first required column, in schema order, that is absent from the given names.
    public static Optional<String> firstMissing (Collection<String> columns) {
        for (String name : NAMES) {
            if (!columns.contains(name)) return Optional.of(name);
        }
        return Optional.empty();
    }
}
