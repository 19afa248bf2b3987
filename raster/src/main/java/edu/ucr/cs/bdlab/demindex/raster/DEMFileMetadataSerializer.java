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

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.Serializer;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

/**
 * A Kryo serializer for {@link DEMFileMetadata}. Each field is written as a var-int tag followed by
 * its value and the record ends with tag 0. Tags are part of the stored format and must never be
 * reassigned. String fields that are {@code null} are not written.
 * The virtual flag and the bounding box are not stored.
 */
public class DEMFileMetadataSerializer extends Serializer<DEMFileMetadata> {

  static final int END = 0;
  static final int VERSION = 2;
  static final int FILENAME = 3;
  static final int HEIGHT = 4;
  static final int WIDTH = 5;
  static final int PIXEL_SCALE_X = 6;
  static final int PIXEL_SCALE_Y = 7;
  static final int DATA_START_LAT = 8;
  static final int DATA_START_LON = 9;
  static final int DATA_END_LAT = 10;
  static final int DATA_END_LON = 11;
  static final int BITS_PER_SAMPLE = 12;
  static final int WORLD_UNITS = 13;
  static final int SAMPLE_FORMAT = 14;
  static final int NO_DATA_VALUE = 15;
  static final int SCANLINE_SIZE = 16;
  static final int PHYSICAL_START_LON = 17;
  static final int PHYSICAL_START_LAT = 18;
  static final int PHYSICAL_END_LON = 19;
  static final int PHYSICAL_END_LAT = 20;
  static final int PIXEL_SIZE_X = 21;
  static final int PIXEL_SIZE_Y = 22;
  static final int FILE_FORMAT = 23;
  static final int MINIMUM_ALTITUDE = 24;
  static final int MAXIMUM_ALTITUDE = 25;

  /**
   * Registers this serializer for {@link DEMFileMetadata} in the given Kryo instance
   * @param kryo the Kryo instance to configure
   */
  public static void register(Kryo kryo) {
    kryo.register(DEMFileMetadata.class, new DEMFileMetadataSerializer());
  }

  @Override
  public void write(Kryo kryo, Output output, DEMFileMetadata metadata) {
    writeString(output, VERSION, metadata.getVersion());
    writeString(output, FILENAME, metadata.getFilename());
    writeTag(output, HEIGHT);
    output.writeInt(metadata.getHeight());
    writeTag(output, WIDTH);
    output.writeInt(metadata.getWidth());
    writeDouble(output, PIXEL_SCALE_X, metadata.getPixelScaleX());
    writeDouble(output, PIXEL_SCALE_Y, metadata.getPixelScaleY());
    writeDouble(output, DATA_START_LAT, metadata.getDataStartLat());
    writeDouble(output, DATA_START_LON, metadata.getDataStartLon());
    writeDouble(output, DATA_END_LAT, metadata.getDataEndLat());
    writeDouble(output, DATA_END_LON, metadata.getDataEndLon());
    writeTag(output, BITS_PER_SAMPLE);
    output.writeInt(metadata.getBitsPerSample());
    writeString(output, WORLD_UNITS, metadata.getWorldUnits());
    writeString(output, SAMPLE_FORMAT, metadata.getSampleFormat());
    writeString(output, NO_DATA_VALUE, metadata.getNoDataValue());
    writeTag(output, SCANLINE_SIZE);
    output.writeInt(metadata.getScanlineSize());
    writeDouble(output, PHYSICAL_START_LON, metadata.getPhysicalStartLon());
    writeDouble(output, PHYSICAL_START_LAT, metadata.getPhysicalStartLat());
    writeDouble(output, PHYSICAL_END_LON, metadata.getPhysicalEndLon());
    writeDouble(output, PHYSICAL_END_LAT, metadata.getPhysicalEndLat());
    writeDouble(output, PIXEL_SIZE_X, metadata.getPixelSizeX());
    writeDouble(output, PIXEL_SIZE_Y, metadata.getPixelSizeY());
    if (metadata.getFileFormat() != null)
      writeString(output, FILE_FORMAT, metadata.getFileFormat().name());
    writeTag(output, MINIMUM_ALTITUDE);
    output.writeFloat(metadata.getMinimumAltitude());
    writeTag(output, MAXIMUM_ALTITUDE);
    output.writeFloat(metadata.getMaximumAltitude());
    writeTag(output, END);
  }

  @Override
  public DEMFileMetadata read(Kryo kryo, Input input, Class<DEMFileMetadata> aClass) {
    DEMFileMetadata metadata = new DEMFileMetadata();
    int tag;
    while ((tag = input.readVarInt(true)) != END) {
      switch (tag) {
        case VERSION: metadata.setVersion(input.readString()); break;
        case FILENAME: metadata.setFilename(input.readString()); break;
        case HEIGHT: metadata.setHeight(input.readInt()); break;
        case WIDTH: metadata.setWidth(input.readInt()); break;
        case PIXEL_SCALE_X: metadata.setPixelScaleX(input.readDouble()); break;
        case PIXEL_SCALE_Y: metadata.setPixelScaleY(input.readDouble()); break;
        case DATA_START_LAT: metadata.setDataStartLat(input.readDouble()); break;
        case DATA_START_LON: metadata.setDataStartLon(input.readDouble()); break;
        case DATA_END_LAT: metadata.setDataEndLat(input.readDouble()); break;
        case DATA_END_LON: metadata.setDataEndLon(input.readDouble()); break;
        case BITS_PER_SAMPLE: metadata.setBitsPerSample(input.readInt()); break;
        case WORLD_UNITS: metadata.setWorldUnits(input.readString()); break;
        case SAMPLE_FORMAT: metadata.setSampleFormat(input.readString()); break;
        case NO_DATA_VALUE: metadata.setNoDataValue(input.readString()); break;
        case SCANLINE_SIZE: metadata.setScanlineSize(input.readInt()); break;
        case PHYSICAL_START_LON: metadata.setPhysicalStartLon(input.readDouble()); break;
        case PHYSICAL_START_LAT: metadata.setPhysicalStartLat(input.readDouble()); break;
        case PHYSICAL_END_LON: metadata.setPhysicalEndLon(input.readDouble()); break;
        case PHYSICAL_END_LAT: metadata.setPhysicalEndLat(input.readDouble()); break;
        case PIXEL_SIZE_X: metadata.setPixelSizeX(input.readDouble()); break;
        case PIXEL_SIZE_Y: metadata.setPixelSizeY(input.readDouble()); break;
        case FILE_FORMAT:
          try {
            metadata.setFileFormat(DEMFileFormat.fromName(input.readString()));
          } catch (IllegalArgumentException e) {
            throw new KryoException("Unknown file format in metadata of " + metadata.getFilename(), e);
          }
          break;
        case MINIMUM_ALTITUDE: metadata.setMinimumAltitude(input.readFloat()); break;
        case MAXIMUM_ALTITUDE: metadata.setMaximumAltitude(input.readFloat()); break;
        default:
          throw new KryoException(String.format("Unknown metadata field tag %d", tag));
      }
    }
    return metadata;
  }

  private static void writeTag(Output output, int tag) {
    output.writeVarInt(tag, true);
  }

  private static void writeDouble(Output output, int tag, double value) {
    writeTag(output, tag);
    output.writeDouble(value);
  }

  private static void writeString(Output output, int tag, String value) {
    if (value != null) {
      writeTag(output, tag);
      output.writeString(value);
    }
  }
}
