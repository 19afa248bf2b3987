/*
 * Copyright 2021 University of California, Riverside
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package edu.ucr.cs.bdlab.demindex.raster;

/**
 * The raster file formats that can be described by a {@link DEMFileMetadata}.
 */
public enum DEMFileFormat {
  SRTM_HGT("SRTM HGT", ".hgt", RegistrationMode.GRID),
  GEOTIFF("GeoTIFF", ".tif", RegistrationMode.CELL),
  NETCDF("netCDF", ".nc", RegistrationMode.GRID),
  ASCII_GRID("ESRI ASCII Grid", ".asc", RegistrationMode.CELL);

  /**
   * How sample values are registered against the raster grid. Grid registered samples sit on the grid
   * line intersections so a tile repeats its edge samples with its neighbors. Cell registered samples
   * represent the center of a cell, which shifts the physical image by half a pixel from the data bounds.
   */
  public enum RegistrationMode {CELL, GRID}

  private final String displayName;

  /**The extension including the dot*/
  private final String extension;

  private final RegistrationMode registration;

  DEMFileFormat(String displayName, String extension, RegistrationMode registration) {
    this.displayName = displayName;
    this.extension = extension;
    this.registration = registration;
  }

  public String getDisplayName() {
    return displayName;
  }

  public String getExtension() {
    return extension;
  }

  public RegistrationMode getRegistration() {
    return registration;
  }

  /**
   * Finds the format that uses the given file extension
   * @param extension the extension with or without the leading dot, case insensitive
   * @return the matching format
   * @throws IllegalArgumentException if no format uses this extension
   */
  public static DEMFileFormat fromExtension(String extension) {
    if (extension != null) {
      String ext = extension.startsWith(".") ? extension : "." + extension;
      switch (ext.toLowerCase()) {
        case ".hgt": return SRTM_HGT;
        case ".tif":
        case ".tiff":
        case ".geotiff":
          return GEOTIFF;
        case ".nc": return NETCDF;
        case ".asc": return ASCII_GRID;
      }
    }
    throw new IllegalArgumentException(String.format("Unrecognized extension '%s'", extension));
  }

  /**
   * Resolves the persisted name of a format as returned by {@link #name()}
   * @param name the persisted name
   * @return the format or {@code null} if the name is {@code null}
   * @throws IllegalArgumentException if the name is not a known format
   */
  public static DEMFileFormat fromName(String name) {
    return name == null ? null : valueOf(name);
  }
}
