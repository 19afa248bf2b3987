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
import org.apache.hadoop.fs.Path;
import org.locationtech.jts.geom.Envelope;

/**
 * Describes one elevation raster (DEM) tile so that a directory of tiles can be indexed and queried
 * without opening and decoding each file.
 *
 * The descriptor has two derived values, the bounding box and the numeric no-data value. Both are computed
 * on first access and never recomputed, so all the fields must be set before the descriptor is published
 * or queried. Setting a field afterwards does not update a value that was already computed.
 *
 * Identity is the {@link TileKey} of the file name which ignores the directory part.
 */
public class DEMFileMetadata {

  /**The layout version written with new descriptors*/
  public static final String FILEMETADATA_VERSION = MetadataVersion.CURRENT.getTag();

  /**Path of the raster file relative to the data directory, or a synthetic id for virtual tiles*/
  private String filename;

  private DEMFileFormat fileFormat;

  private String version;

  /**Marks a synthetic tile with no backing file. Never persisted.*/
  private final boolean virtualMetadata;

  private int height;
  private int width;

  private double pixelScaleX;
  private double pixelScaleY;
  private double pixelSizeX;
  private double pixelSizeY;

  /**
   * Bounds of the data points. The image may be cell centered which puts its physical origin half a
   * pixel before the data start, but that data resides in the overlapping neighbor tile.
   */
  private double dataStartLat;
  private double dataStartLon;
  private double dataEndLat;
  private double dataEndLon;

  /**Bounds of the physical image, off by up to one pixel from the data bounds for cell centered images*/
  private double physicalStartLat;
  private double physicalStartLon;
  private double physicalEndLat;
  private double physicalEndLon;

  private int bitsPerSample;
  private int scanlineSize;
  private String worldUnits;
  private String sampleFormat;
  private String noDataValue;

  private float minimumAltitude;
  private float maximumAltitude;

  private volatile Envelope boundingBox;

  private float noDataValueNumber;
  private volatile boolean noDataValueNumberSet;

  /**Default constructor is necessary to be able to deserialize it*/
  DEMFileMetadata() {
    this.virtualMetadata = false;
  }

  public DEMFileMetadata(String filename, DEMFileFormat fileFormat) {
    this(filename, fileFormat, FILEMETADATA_VERSION);
  }

  public DEMFileMetadata(String filename, DEMFileFormat fileFormat, String version) {
    this.filename = filename;
    this.fileFormat = fileFormat;
    this.version = version;
    this.virtualMetadata = false;
  }

  /**
   * Copies all the fields of the given descriptor except for its identity and its bounding box.
   * @param source the descriptor to copy
   * @param filename the file name of the copy
   * @param virtualMetadata whether the copy is a virtual tile
   */
  protected DEMFileMetadata(DEMFileMetadata source, String filename, boolean virtualMetadata) {
    this.filename = filename;
    this.virtualMetadata = virtualMetadata;
    this.fileFormat = source.fileFormat;
    this.version = source.version;
    this.height = source.height;
    this.width = source.width;
    this.pixelScaleX = source.pixelScaleX;
    this.pixelScaleY = source.pixelScaleY;
    this.pixelSizeX = source.pixelSizeX;
    this.pixelSizeY = source.pixelSizeY;
    this.dataStartLat = source.dataStartLat;
    this.dataStartLon = source.dataStartLon;
    this.dataEndLat = source.dataEndLat;
    this.dataEndLon = source.dataEndLon;
    this.physicalStartLat = source.physicalStartLat;
    this.physicalStartLon = source.physicalStartLon;
    this.physicalEndLat = source.physicalEndLat;
    this.physicalEndLon = source.physicalEndLon;
    this.bitsPerSample = source.bitsPerSample;
    this.scanlineSize = source.scanlineSize;
    this.worldUnits = source.worldUnits;
    this.sampleFormat = source.sampleFormat;
    this.noDataValue = source.noDataValue;
    this.minimumAltitude = source.minimumAltitude;
    this.maximumAltitude = source.maximumAltitude;
    synchronized (source) {
      this.noDataValueNumber = source.noDataValueNumber;
      this.noDataValueNumberSet = source.noDataValueNumberSet;
    }
    this.boundingBox = null;
  }

  /**
   * Creates an empty descriptor for a raster file found under a data directory. The file name is stored
   * relative to the data directory and the format is detected from the file extension.
   * @param dataDirectory the root directory of the raster files
   * @param rasterFile the raster file
   * @return a descriptor with the current version that still needs to be filled from the raster header
   * @throws IllegalArgumentException if the extension is not a known raster format
   */
  public static DEMFileMetadata forRasterFile(Path dataDirectory, Path rasterFile) {
    DEMFileFormat format = DEMFileFormat.fromExtension(IOUtil.getExtension(rasterFile.getName()));
    return new DEMFileMetadata(IOUtil.relativize(rasterFile, dataDirectory), format);
  }

  /**
   * Creates a virtual copy of this tile named with a random UUID.
   * @return a virtual tile with the same layout and geometry
   * @see #cloneAsVirtual(TileIdGenerator)
   */
  public DEMFileMetadata cloneAsVirtual() {
    return cloneAsVirtual(TileIdGenerator.RANDOM_UUID);
  }

  /**
   * Creates a virtual copy of this tile. Virtual tiles stand for areas that are not covered by any raster
   * file so that heightmap assembly gets a descriptor for every cell of the requested area.
   * The copy has a new identity and recomputes its own bounding box on first access.
   * @param idGenerator generates the synthetic file name of the copy
   * @return a virtual tile with the same layout and geometry
   */
  public DEMFileMetadata cloneAsVirtual(TileIdGenerator idGenerator) {
    return new DEMFileMetadata(this, idGenerator.nextId(this), true);
  }

  public String getFilename() {
    return filename;
  }

  /**Only used by deserializers*/
  void setFilename(String filename) {
    this.filename = filename;
  }

  public DEMFileFormat getFileFormat() {
    return fileFormat;
  }

  /**Only used by deserializers*/
  void setFileFormat(DEMFileFormat fileFormat) {
    this.fileFormat = fileFormat;
  }

  public String getVersion() {
    return version;
  }

  /**Only used by deserializers*/
  void setVersion(String version) {
    this.version = version;
  }

  /**
   * Marks this metadata as virtual. Virtual tiles are generated when a requested area is not fully
   * covered by raster files and are used to generate the missing parts of a heightmap.
   * @return {@code true} if this descriptor is not backed by a file
   */
  public boolean isVirtualMetadata() {
    return virtualMetadata;
  }

  /**
   * The identity of this tile in an index
   * @return the key made of the base name of the file
   */
  public TileKey getTileKey() {
    return TileKey.of(filename);
  }

  public int getHeight() {
    return height;
  }

  public void setHeight(int height) {
    this.height = height;
  }

  public int getWidth() {
    return width;
  }

  public void setWidth(int width) {
    this.width = width;
  }

  public double getPixelScaleX() {
    return pixelScaleX;
  }

  public void setPixelScaleX(double pixelScaleX) {
    this.pixelScaleX = pixelScaleX;
  }

  public double getPixelScaleY() {
    return pixelScaleY;
  }

  public void setPixelScaleY(double pixelScaleY) {
    this.pixelScaleY = pixelScaleY;
  }

  public double getPixelSizeX() {
    return pixelSizeX;
  }

  public void setPixelSizeX(double pixelSizeX) {
    this.pixelSizeX = pixelSizeX;
  }

  public double getPixelSizeY() {
    return pixelSizeY;
  }

  public void setPixelSizeY(double pixelSizeY) {
    this.pixelSizeY = pixelSizeY;
  }

  public double getDataStartLat() {
    return dataStartLat;
  }

  public void setDataStartLat(double dataStartLat) {
    this.dataStartLat = dataStartLat;
  }

  public double getDataStartLon() {
    return dataStartLon;
  }

  public void setDataStartLon(double dataStartLon) {
    this.dataStartLon = dataStartLon;
  }

  public double getDataEndLat() {
    return dataEndLat;
  }

  public void setDataEndLat(double dataEndLat) {
    this.dataEndLat = dataEndLat;
  }

  public double getDataEndLon() {
    return dataEndLon;
  }

  public void setDataEndLon(double dataEndLon) {
    this.dataEndLon = dataEndLon;
  }

  public double getPhysicalStartLat() {
    return physicalStartLat;
  }

  public void setPhysicalStartLat(double physicalStartLat) {
    this.physicalStartLat = physicalStartLat;
  }

  public double getPhysicalStartLon() {
    return physicalStartLon;
  }

  public void setPhysicalStartLon(double physicalStartLon) {
    this.physicalStartLon = physicalStartLon;
  }

  public double getPhysicalEndLat() {
    return physicalEndLat;
  }

  public void setPhysicalEndLat(double physicalEndLat) {
    this.physicalEndLat = physicalEndLat;
  }

  public double getPhysicalEndLon() {
    return physicalEndLon;
  }

  public void setPhysicalEndLon(double physicalEndLon) {
    this.physicalEndLon = physicalEndLon;
  }

  public int getBitsPerSample() {
    return bitsPerSample;
  }

  public void setBitsPerSample(int bitsPerSample) {
    this.bitsPerSample = bitsPerSample;
  }

  public int getScanlineSize() {
    return scanlineSize;
  }

  public void setScanlineSize(int scanlineSize) {
    this.scanlineSize = scanlineSize;
  }

  public String getWorldUnits() {
    return worldUnits;
  }

  public void setWorldUnits(String worldUnits) {
    this.worldUnits = worldUnits;
  }

  public String getSampleFormat() {
    return sampleFormat;
  }

  public void setSampleFormat(String sampleFormat) {
    this.sampleFormat = sampleFormat;
  }

  /**
   * The no-data value as found in the raster file. It is kept as text since formats store it
   * with different numeric types.
   * @return the textual no-data value
   */
  public String getNoDataValue() {
    return noDataValue;
  }

  public void setNoDataValue(String noDataValue) {
    this.noDataValue = noDataValue;
  }

  public float getMinimumAltitude() {
    return minimumAltitude;
  }

  public void setMinimumAltitude(float minimumAltitude) {
    this.minimumAltitude = minimumAltitude;
  }

  public float getMaximumAltitude() {
    return maximumAltitude;
  }

  public void setMaximumAltitude(float maximumAltitude) {
    this.maximumAltitude = maximumAltitude;
  }

  /**
   * Parses the no-data value on the first call and returns the parsed value on later calls.
   * @return the no-data value as a number
   * @throws NumberFormatException if the no-data value is missing or is not a number
   */
  public float getNoDataValueAsNumber() {
    if (!noDataValueNumberSet) {
      synchronized (this) {
        if (!noDataValueNumberSet) {
          if (noDataValue == null)
            throw new NumberFormatException("No-data value is not set for " + filename);
          noDataValueNumber = Float.parseFloat(noDataValue);
          noDataValueNumberSet = true;
        }
      }
    }
    return noDataValueNumber;
  }

  /**
   * Sets the numeric no-data value directly. The textual value is left untouched and will not be parsed.
   * @param value the no-data value
   */
  public synchronized void setNoDataValueAsNumber(float value) {
    this.noDataValueNumber = value;
    this.noDataValueNumberSet = true;
  }

  /**
   * The bounding box of the data points. Tiles may store their bounds in either direction,
   * e.g., north-up tiles have a start latitude larger than the end latitude, so the bounds are normalized.
   * The box is computed on the first call and the same instance is returned afterwards. Callers must
   * not modify it, e.g., with {@link Envelope#expandToInclude(Envelope)}, because the change becomes the
   * cached geometry of this descriptor for every later caller. Copy it first with
   * {@code new Envelope(getBoundingBox())} to get a box that can be modified.
   * @return the box with x = longitude and y = latitude
   */
  public Envelope getBoundingBox() {
    Envelope box = boundingBox;
    if (box == null) {
      synchronized (this) {
        box = boundingBox;
        if (box == null) {
          box = new Envelope(
              Math.min(dataStartLon, dataEndLon),
              Math.max(dataStartLon, dataEndLon),
              Math.min(dataStartLat, dataEndLat),
              Math.max(dataStartLat, dataEndLat));
          boundingBox = box;
        }
      }
    }
    return box;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof DEMFileMetadata))
      return false;
    return getTileKey().equals(((DEMFileMetadata) obj).getTileKey());
  }

  @Override
  public int hashCode() {
    return getTileKey().hashCode();
  }

  @Override
  public String toString() {
    return IOUtil.getFileName(filename) + ": " + getBoundingBox();
  }
}
