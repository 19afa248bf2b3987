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

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Finds the tiles needed to assemble a heightmap over a query area and fills the parts that no
 * raster file covers with virtual tiles.
 *
 * The tiles are assumed to form a regular grid. The grid is anchored at the bounding box of the tile
 * with the smallest corner, lowest longitude first then lowest latitude, and its cell size is the size
 * of that box. The result does not depend on the iteration order of the given tiles except for the order
 * of the real tiles in it.
 */
public class TileCoverage {
  /**Logger for this class*/
  private static final Log LOG = LogFactory.getLog(TileCoverage.class);

  private final TileIdGenerator idGenerator;

  public TileCoverage() {
    this(TileIdGenerator.RANDOM_UUID);
  }

  public TileCoverage(TileIdGenerator idGenerator) {
    this.idGenerator = idGenerator;
  }

  /**
   * Returns the tiles that overlap the query followed by one virtual tile for each grid cell
   * that overlaps the query but is not covered by any of the given tiles.
   * @param tiles the real tiles to choose from
   * @param query the area to cover with x = longitude and y = latitude
   * @return the overlapping real tiles and the virtual tiles for the gaps, or an empty list if
   * no tiles are given
   */
  public List<DEMFileMetadata> fillGaps(Collection<DEMFileMetadata> tiles, Envelope query) {
    List<DEMFileMetadata> result = new ArrayList<>();
    if (tiles.isEmpty())
      return result;
    for (DEMFileMetadata tile : tiles) {
      if (overlaps(tile.getBoundingBox(), query))
        result.add(tile);
    }

    DEMFileMetadata reference = selectReference(tiles);
    Envelope referenceBox = reference.getBoundingBox();
    double cellWidth = referenceBox.getWidth();
    double cellHeight = referenceBox.getHeight();
    if (cellWidth <= 0 || cellHeight <= 0) {
      LOG.warn(String.format("Cannot fill gaps using the degenerate tile '%s'", reference));
      return result;
    }

    int iMin = (int) Math.floor((query.getMinX() - referenceBox.getMinX()) / cellWidth);
    int iMax = Math.max(iMin, (int) Math.ceil((query.getMaxX() - referenceBox.getMinX()) / cellWidth) - 1);
    int jMin = (int) Math.floor((query.getMinY() - referenceBox.getMinY()) / cellHeight);
    int jMax = Math.max(jMin, (int) Math.ceil((query.getMaxY() - referenceBox.getMinY()) / cellHeight) - 1);
    int numVirtualTiles = 0;
    for (int j = jMin; j <= jMax; j++) {
      for (int i = iMin; i <= iMax; i++) {
        // Center of the part of the cell inside the query, on the cell edge for a point or line query
        double cellMinX = referenceBox.getMinX() + i * cellWidth;
        double cellMinY = referenceBox.getMinY() + j * cellHeight;
        double centerX = (Math.max(query.getMinX(), cellMinX) + Math.min(query.getMaxX(), cellMinX + cellWidth)) / 2;
        double centerY = (Math.max(query.getMinY(), cellMinY) + Math.min(query.getMaxY(), cellMinY + cellHeight)) / 2;
        if (!isCovered(tiles, centerX, centerY)) {
          result.add(createVirtualTile(reference, i * cellWidth, j * cellHeight));
          numVirtualTiles++;
        }
      }
    }
    if (LOG.isDebugEnabled())
      LOG.debug(String.format("Query %s overlaps %d tiles and needs %d virtual tiles",
          query, result.size() - numVirtualTiles, numVirtualTiles));
    return result;
  }

  /**
   * Creates a virtual copy of the reference tile shifted by the given offset
   * @param reference the tile to copy the layout from
   * @param dx the longitude offset
   * @param dy the latitude offset
   * @return the virtual tile
   */
  protected DEMFileMetadata createVirtualTile(DEMFileMetadata reference, double dx, double dy) {
    DEMFileMetadata tile = reference.cloneAsVirtual(idGenerator);
    tile.setDataStartLon(reference.getDataStartLon() + dx);
    tile.setDataEndLon(reference.getDataEndLon() + dx);
    tile.setDataStartLat(reference.getDataStartLat() + dy);
    tile.setDataEndLat(reference.getDataEndLat() + dy);
    tile.setPhysicalStartLon(reference.getPhysicalStartLon() + dx);
    tile.setPhysicalEndLon(reference.getPhysicalEndLon() + dx);
    tile.setPhysicalStartLat(reference.getPhysicalStartLat() + dy);
    tile.setPhysicalEndLat(reference.getPhysicalEndLat() + dy);
    return tile;
  }

  /**
   * The tile whose bounding box has the smallest minimum longitude, ties broken by the smallest minimum latitude
   */
  static DEMFileMetadata selectReference(Collection<DEMFileMetadata> tiles) {
    DEMFileMetadata reference = null;
    for (DEMFileMetadata tile : tiles) {
      if (reference == null) {
        reference = tile;
      } else {
        Envelope box = tile.getBoundingBox();
        Envelope referenceBox = reference.getBoundingBox();
        if (box.getMinX() < referenceBox.getMinX() ||
            (box.getMinX() == referenceBox.getMinX() && box.getMinY() < referenceBox.getMinY()))
          reference = tile;
      }
    }
    return reference;
  }

  private static boolean isCovered(Collection<DEMFileMetadata> tiles, double x, double y) {
    for (DEMFileMetadata tile : tiles) {
      if (tile.getBoundingBox().contains(x, y))
        return true;
    }
    return false;
  }

  /**
   * Tests whether the tile shares an area with the query. Tiles that only touch the query on an edge
   * do not overlap it unless the query is a line or a point.
   */
  static boolean overlaps(Envelope tile, Envelope query) {
    boolean xOverlap = query.getWidth() == 0 ?
        tile.getMinX() <= query.getMinX() && query.getMinX() <= tile.getMaxX() :
        tile.getMinX() < query.getMaxX() && query.getMinX() < tile.getMaxX();
    boolean yOverlap = query.getHeight() == 0 ?
        tile.getMinY() <= query.getMinY() && query.getMinY() <= tile.getMaxY() :
        tile.getMinY() < query.getMaxY() && query.getMinY() < tile.getMaxY();
    return xOverlap && yOverlap;
  }
}
