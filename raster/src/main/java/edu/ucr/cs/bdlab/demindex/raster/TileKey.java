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

import edu.ucr.cs.bdlab.demindex.util.IOUtil;

import java.util.Objects;

/**
 * The identity of a tile in a metadata index. Only the base name of the tile file is considered, i.e.,
 * the part after the last '/' or '\'. Two tiles with the same base name in different directories
 * have the same key, so a data directory must not contain two tiles with the same base name.
 *
 * Base names are compared with {@link String#equals(Object)} and hashed with {@link String#hashCode()}
 * which makes the key case sensitive on all platforms, even on file systems that are not.
 */
public final class TileKey {

  /**The key of a descriptor that has no file name yet*/
  public static final TileKey NONE = new TileKey(null);

  private final String baseName;

  private TileKey(String baseName) {
    this.baseName = baseName;
  }

  /**
   * Creates the key of the tile stored at the given path
   * @param filename the path of the tile file, relative or absolute
   * @return the key of the tile
   */
  public static TileKey of(String filename) {
    return filename == null ? NONE : new TileKey(IOUtil.getFileName(filename));
  }

  /**
   * @return the base name of the tile file or {@code null} for {@link #NONE}
   */
  public String getBaseName() {
    return baseName;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (!(o instanceof TileKey))
      return false;
    return Objects.equals(baseName, ((TileKey) o).baseName);
  }

  @Override
  public int hashCode() {
    return baseName == null ? 0 : baseName.hashCode();
  }

  @Override
  public String toString() {
    return String.valueOf(baseName);
  }
}
