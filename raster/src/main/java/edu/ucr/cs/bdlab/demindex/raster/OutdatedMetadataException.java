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

import java.io.IOException;

/**
 * Thrown when a stored tile descriptor was written with a layout version other than
 * {@link MetadataVersion#CURRENT}. Descriptors are never upgraded in place. The only way to recover
 * is to regenerate the metadata index from the raster files.
 */
public final class OutdatedMetadataException extends IOException {

  private static final long serialVersionUID = -3180736264152210947L;

  /**The file name stored in the outdated descriptor*/
  private final String filename;

  /**The version found in the descriptor, possibly {@code null}*/
  private final String foundVersion;

  public OutdatedMetadataException(String filename, String foundVersion) {
    super(String.format("Metadata of '%s' has version '%s' but version '%s' is required. " +
        "The metadata index must be regenerated", filename, foundVersion, MetadataVersion.CURRENT.getTag()));
    this.filename = filename;
    this.foundVersion = foundVersion;
  }

  public String getFilename() {
    return filename;
  }

  public String getFoundVersion() {
    return foundVersion;
  }

  /**
   * @return the parsed version or {@code null} if the version is not known to this build
   */
  public MetadataVersion getFoundMetadataVersion() {
    return MetadataVersion.fromTag(foundVersion);
  }
}
