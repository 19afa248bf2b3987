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
 * The known versions of the {@link DEMFileMetadata} layout. The version is stored with every descriptor
 * so that a reader can tell which build produced a metadata index.
 *
 * History:
 * <ul>
 *   <li>2.0: initial layout</li>
 *   <li>2.1: file names are relative to the data directory</li>
 *   <li>2.2: the file format is a (name, extension) definition and the lat/lon bounds were renamed to
 *   data start/end and physical start/end</li>
 * </ul>
 *
 * There is no migration between versions. A descriptor with any version other than {@link #CURRENT}
 * means that the whole metadata index has to be regenerated from the raster files.
 * When changing the layout, add a new constant here and point {@link #CURRENT} to it.
 */
public enum MetadataVersion {
  V2_0("2.0"),
  V2_1("2.1"),
  V2_2("2.2");

  /**The version written with every new descriptor*/
  public static final MetadataVersion CURRENT = V2_2;

  private final String tag;

  MetadataVersion(String tag) {
    this.tag = tag;
  }

  /**
   * @return the version string as stored in descriptors
   */
  public String getTag() {
    return tag;
  }

  /**
   * Finds the version with the given tag
   * @param tag the stored version string
   * @return the version or {@code null} if the tag is not a known version
   */
  public static MetadataVersion fromTag(String tag) {
    for (MetadataVersion version : values()) {
      if (version.tag.equals(tag))
        return version;
    }
    return null;
  }

  /**
   * Tests whether a stored version string is the current version
   * @param tag the stored version string, possibly {@code null}
   * @return {@code true} if descriptors with this version can be used as-is
   */
  public static boolean isCurrent(String tag) {
    return fromTag(tag) == CURRENT;
  }

  /**
   * Makes sure that the given descriptor was written with the current version
   * @param metadata the descriptor as read from a metadata index
   * @throws OutdatedMetadataException if the version is unknown or older than the current version
   */
  public static void checkCurrent(DEMFileMetadata metadata) throws OutdatedMetadataException {
    if (!isCurrent(metadata.getVersion()))
      throw new OutdatedMetadataException(metadata.getFilename(), metadata.getVersion());
  }

  @Override
  public String toString() {
    return tag;
  }
}
