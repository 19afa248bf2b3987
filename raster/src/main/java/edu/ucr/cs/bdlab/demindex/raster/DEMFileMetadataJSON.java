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

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hadoop.conf.Configuration;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Reads and writes {@link DEMFileMetadata} as a JSON object with one attribute per stored field.
 * The virtual flag and the bounding box are not part of the JSON form.
 */
public class DEMFileMetadataJSON {
  /**Logger for this class*/
  private static final Log LOG = LogFactory.getLog(DEMFileMetadataJSON.class);

  /**Whether to print the output using the pretty printer or not*/
  public static final String UsePrettyPrinter = "DEMFileMetadataJSON.UsePrettyPrinter";

  private static final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Writes the descriptor as a single JSON object. The output stream is not closed.
   * @param out the stream to write to
   * @param metadata the descriptor to write
   * @param conf the configuration that contains the output options
   * @throws IOException if an error happens while writing the output
   */
  public static void write(OutputStream out, DEMFileMetadata metadata, Configuration conf) throws IOException {
    JsonGenerator jsonGenerator = jsonFactory.createGenerator(out);
    jsonGenerator.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    if (conf.getBoolean(UsePrettyPrinter, true))
      jsonGenerator.setPrettyPrinter(new DefaultPrettyPrinter());
    writeMetadata(jsonGenerator, metadata);
    jsonGenerator.close();
  }

  public static void writeMetadata(JsonGenerator jsonGenerator, DEMFileMetadata metadata) throws IOException {
    jsonGenerator.writeStartObject();
    jsonGenerator.writeStringField("version", metadata.getVersion());
    jsonGenerator.writeStringField("filename", metadata.getFilename());
    jsonGenerator.writeStringField("fileFormat",
        metadata.getFileFormat() == null ? null : metadata.getFileFormat().name());
    jsonGenerator.writeNumberField("height", metadata.getHeight());
    jsonGenerator.writeNumberField("width", metadata.getWidth());
    jsonGenerator.writeNumberField("pixelScaleX", metadata.getPixelScaleX());
    jsonGenerator.writeNumberField("pixelScaleY", metadata.getPixelScaleY());
    jsonGenerator.writeNumberField("pixelSizeX", metadata.getPixelSizeX());
    jsonGenerator.writeNumberField("pixelSizeY", metadata.getPixelSizeY());
    jsonGenerator.writeNumberField("dataStartLat", metadata.getDataStartLat());
    jsonGenerator.writeNumberField("dataStartLon", metadata.getDataStartLon());
    jsonGenerator.writeNumberField("dataEndLat", metadata.getDataEndLat());
    jsonGenerator.writeNumberField("dataEndLon", metadata.getDataEndLon());
    jsonGenerator.writeNumberField("physicalStartLat", metadata.getPhysicalStartLat());
    jsonGenerator.writeNumberField("physicalStartLon", metadata.getPhysicalStartLon());
    jsonGenerator.writeNumberField("physicalEndLat", metadata.getPhysicalEndLat());
    jsonGenerator.writeNumberField("physicalEndLon", metadata.getPhysicalEndLon());
    jsonGenerator.writeNumberField("bitsPerSample", metadata.getBitsPerSample());
    jsonGenerator.writeNumberField("scanlineSize", metadata.getScanlineSize());
    jsonGenerator.writeStringField("worldUnits", metadata.getWorldUnits());
    jsonGenerator.writeStringField("sampleFormat", metadata.getSampleFormat());
    jsonGenerator.writeStringField("noDataValue", metadata.getNoDataValue());
    jsonGenerator.writeNumberField("minimumAltitude", metadata.getMinimumAltitude());
    jsonGenerator.writeNumberField("maximumAltitude", metadata.getMaximumAltitude());
    jsonGenerator.writeEndObject();
  }

  /**
   * Reads one descriptor regardless of its version. Unknown attributes are skipped.
   * @param in the stream that contains the JSON object
   * @return the descriptor
   * @throws IOException if the input is not a valid descriptor
   */
  public static DEMFileMetadata read(InputStream in) throws IOException {
    try (JsonParser jsonParser = jsonFactory.createParser(in)) {
      return readMetadata(jsonParser);
    }
  }

  /**
   * Reads one descriptor and makes sure it was written with the current version.
   * @param in the stream that contains the JSON object
   * @return the descriptor
   * @throws OutdatedMetadataException if the descriptor has an old or unknown version
   * @throws IOException if the input is not a valid descriptor
   */
  public static DEMFileMetadata readChecked(InputStream in) throws IOException {
    DEMFileMetadata metadata = read(in);
    MetadataVersion.checkCurrent(metadata);
    return metadata;
  }

  public static DEMFileMetadata readMetadata(JsonParser jsonParser) throws IOException {
    consumeAndCheckToken(jsonParser, JsonToken.START_OBJECT);
    DEMFileMetadata metadata = new DEMFileMetadata();
    JsonToken token;
    while ((token = jsonParser.nextToken()) != JsonToken.END_OBJECT) {
      if (token != JsonToken.FIELD_NAME)
        throw new JsonParseException(jsonParser, "Expected an attribute name but found " + token);
      String fieldName = jsonParser.getCurrentName();
      jsonParser.nextToken();
      switch (fieldName) {
        case "version": metadata.setVersion(textValue(jsonParser)); break;
        case "filename": metadata.setFilename(textValue(jsonParser)); break;
        case "fileFormat":
          try {
            metadata.setFileFormat(DEMFileFormat.fromName(textValue(jsonParser)));
          } catch (IllegalArgumentException e) {
            throw new JsonParseException(jsonParser, "Unknown file format " + jsonParser.getText(), e);
          }
          break;
        case "height": metadata.setHeight(jsonParser.getIntValue()); break;
        case "width": metadata.setWidth(jsonParser.getIntValue()); break;
        case "pixelScaleX": metadata.setPixelScaleX(doubleValue(jsonParser)); break;
        case "pixelScaleY": metadata.setPixelScaleY(doubleValue(jsonParser)); break;
        case "pixelSizeX": metadata.setPixelSizeX(doubleValue(jsonParser)); break;
        case "pixelSizeY": metadata.setPixelSizeY(doubleValue(jsonParser)); break;
        case "dataStartLat": metadata.setDataStartLat(doubleValue(jsonParser)); break;
        case "dataStartLon": metadata.setDataStartLon(doubleValue(jsonParser)); break;
        case "dataEndLat": metadata.setDataEndLat(doubleValue(jsonParser)); break;
        case "dataEndLon": metadata.setDataEndLon(doubleValue(jsonParser)); break;
        case "physicalStartLat": metadata.setPhysicalStartLat(doubleValue(jsonParser)); break;
        case "physicalStartLon": metadata.setPhysicalStartLon(doubleValue(jsonParser)); break;
        case "physicalEndLat": metadata.setPhysicalEndLat(doubleValue(jsonParser)); break;
        case "physicalEndLon": metadata.setPhysicalEndLon(doubleValue(jsonParser)); break;
        case "bitsPerSample": metadata.setBitsPerSample(jsonParser.getIntValue()); break;
        case "scanlineSize": metadata.setScanlineSize(jsonParser.getIntValue()); break;
        case "worldUnits": metadata.setWorldUnits(textValue(jsonParser)); break;
        case "sampleFormat": metadata.setSampleFormat(textValue(jsonParser)); break;
        case "noDataValue": metadata.setNoDataValue(textValue(jsonParser)); break;
        case "minimumAltitude": metadata.setMinimumAltitude(floatValue(jsonParser)); break;
        case "maximumAltitude": metadata.setMaximumAltitude(floatValue(jsonParser)); break;
        default:
          LOG.debug(String.format("Skipping unknown attribute '%s'", fieldName));
          jsonParser.skipChildren();
      }
    }
    return metadata;
  }

  private static String textValue(JsonParser jsonParser) throws IOException {
    return jsonParser.getCurrentToken() == JsonToken.VALUE_NULL ? null : jsonParser.getText();
  }

  /**
   * The generator writes NaN and infinite values as the strings "NaN", "Infinity" and "-Infinity"
   * so numeric attributes are accepted in both forms.
   */
  private static double doubleValue(JsonParser jsonParser) throws IOException {
    if (jsonParser.getCurrentToken() != JsonToken.VALUE_STRING)
      return jsonParser.getDoubleValue();
    try {
      return Double.parseDouble(jsonParser.getText());
    } catch (NumberFormatException e) {
      throw new JsonParseException(jsonParser, "Expected a number but found '" + jsonParser.getText() + "'", e);
    }
  }

  private static float floatValue(JsonParser jsonParser) throws IOException {
    if (jsonParser.getCurrentToken() != JsonToken.VALUE_STRING)
      return jsonParser.getFloatValue();
    try {
      return Float.parseFloat(jsonParser.getText());
    } catch (NumberFormatException e) {
      throw new JsonParseException(jsonParser, "Expected a number but found '" + jsonParser.getText() + "'", e);
    }
  }

  private static void consumeAndCheckToken(JsonParser jsonParser, JsonToken expected) throws IOException {
    JsonToken actual = jsonParser.nextToken();
    if (actual != expected)
      throw new JsonParseException(jsonParser, String.format("Expected %s but found %s", expected, actual));
  }
}
