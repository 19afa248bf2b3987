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

import junit.framework.TestCase;
import org.locationtech.jts.geom.Envelope;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class TileCoverageTest extends TestCase {

  private static List<DEMFileMetadata> virtualTiles(List<DEMFileMetadata> tiles) {
    List<DEMFileMetadata> virtualTiles = new ArrayList<>();
    for (DEMFileMetadata tile : tiles) {
      if (tile.isVirtualMetadata())
        virtualTiles.add(tile);
    }
    return virtualTiles;
  }

  public void testFullyCoveredQuery() {
    DEMFileMetadata t1 = DEMFileMetadataTest.createSRTMTile("N45E005.hgt", 45, 5);
    DEMFileMetadata t2 = DEMFileMetadataTest.createSRTMTile("N45E006.hgt", 45, 6);
    DEMFileMetadata t3 = DEMFileMetadataTest.createSRTMTile("N47E005.hgt", 47, 5);
    List<DEMFileMetadata> result = new TileCoverage().fillGaps(Arrays.asList(t1, t2, t3),
        new Envelope(5.2, 6.8, 45.1, 45.9));
    assertEquals(Arrays.asList(t1, t2), result);
  }

  public void testGapsAreFilledWithVirtualTiles() {
    DEMFileMetadata t1 = DEMFileMetadataTest.createSRTMTile("N45E005.hgt", 45, 5);
    DEMFileMetadata t2 = DEMFileMetadataTest.createSRTMTile("N46E006.hgt", 46, 6);
    List<DEMFileMetadata> result = new TileCoverage().fillGaps(Arrays.asList(t1, t2),
        new Envelope(5.5, 6.5, 45.5, 46.5));
    assertEquals(4, result.size());
    assertEquals(t1, result.get(0));
    assertEquals(t2, result.get(1));

    List<DEMFileMetadata> virtualTiles = virtualTiles(result);
    assertEquals(2, virtualTiles.size());
    Set<Envelope> boxes = new HashSet<>();
    for (DEMFileMetadata tile : virtualTiles) {
      boxes.add(tile.getBoundingBox());
      assertEquals(t1.getWidth(), tile.getWidth());
      assertEquals(t1.getNoDataValue(), tile.getNoDataValue());
    }
    assertTrue(boxes.contains(new Envelope(6, 7, 45, 46)));
    assertTrue(boxes.contains(new Envelope(5, 6, 46, 47)));
    // The reference tile is not modified
    assertEquals(new Envelope(5, 6, 45, 46), t1.getBoundingBox());
  }

  public void testVirtualTileKeepsOrientationAndPhysicalOffset() {
    DEMFileMetadata t1 = DEMFileMetadataTest.createSRTMTile("N45E005.hgt", 45, 5);
    List<DEMFileMetadata> result = new TileCoverage().fillGaps(Collections.singletonList(t1),
        new Envelope(7.5, 7.6, 44.5, 44.6));
    assertEquals(1, result.size());
    DEMFileMetadata virtual = result.get(0);
    assertTrue(virtual.isVirtualMetadata());
    assertEquals(45.0, virtual.getDataStartLat(), 1E-9);
    assertEquals(44.0, virtual.getDataEndLat(), 1E-9);
    assertEquals(7.0, virtual.getDataStartLon(), 1E-9);
    assertEquals(8.0, virtual.getDataEndLon(), 1E-9);
    assertEquals(virtual.getDataStartLat() + 0.5 / 3600, virtual.getPhysicalStartLat(), 1E-9);
    assertEquals(virtual.getDataStartLon() - 0.5 / 3600, virtual.getPhysicalStartLon(), 1E-9);
  }

  public void testVirtualTileIdentities() {
    DEMFileMetadata t1 = DEMFileMetadataTest.createSRTMTile("N45E005.hgt", 45, 5);
    int[] counter = {0};
    TileCoverage coverage = new TileCoverage(source -> "virtual-" + (counter[0]++));
    List<DEMFileMetadata> result = coverage.fillGaps(Collections.singletonList(t1), new Envelope(5.5, 7.5, 45.5, 45.6));
    assertEquals(3, result.size());
    assertEquals("virtual-0", result.get(1).getFilename());
    assertEquals("virtual-1", result.get(2).getFilename());
    assertEquals(3, new HashSet<>(result).size());
  }

  public void testPointQuery() {
    DEMFileMetadata t1 = DEMFileMetadataTest.createSRTMTile("N45E005.hgt", 45, 5);
    List<DEMFileMetadata> result = new TileCoverage().fillGaps(Collections.singletonList(t1),
        new Envelope(5.5, 5.5, 45.5, 45.5));
    assertEquals(Collections.singletonList(t1), result);
  }

  public void testPointOnTileEdge() {
    DEMFileMetadata t1 = DEMFileMetadataTest.createSRTMTile("N45E005.hgt", 45, 5);
    List<DEMFileMetadata> result = new TileCoverage().fillGaps(Collections.singletonList(t1),
        new Envelope(6, 6, 45.5, 45.5));
    assertEquals(Collections.singletonList(t1), result);

    // A point on the corner of the tile
    result = new TileCoverage().fillGaps(Collections.singletonList(t1), new Envelope(6, 6, 46, 46));
    assertEquals(Collections.singletonList(t1), result);

    // A vertical line along the east edge
    result = new TileCoverage().fillGaps(Collections.singletonList(t1), new Envelope(6, 6, 45.2, 45.8));
    assertEquals(Collections.singletonList(t1), result);
  }

  public void testPointOnEdgeBetweenTiles() {
    DEMFileMetadata t1 = DEMFileMetadataTest.createSRTMTile("N45E005.hgt", 45, 5);
    DEMFileMetadata t2 = DEMFileMetadataTest.createSRTMTile("N45E006.hgt", 45, 6);
    List<DEMFileMetadata> result = new TileCoverage().fillGaps(Arrays.asList(t1, t2),
        new Envelope(6, 6, 45.5, 45.5));
    assertEquals(Arrays.asList(t1, t2), result);
  }

  public void testPointOnEdgeOfMissingTile() {
    DEMFileMetadata t1 = DEMFileMetadataTest.createSRTMTile("N45E005.hgt", 45, 5);
    List<DEMFileMetadata> result = new TileCoverage().fillGaps(Collections.singletonList(t1),
        new Envelope(7, 7, 45.5, 45.5));
    assertEquals(1, result.size());
    assertTrue(result.get(0).isVirtualMetadata());
    assertEquals(new Envelope(7, 8, 45, 46), result.get(0).getBoundingBox());
  }

  public void testReferenceTileDoesNotDependOnOrder() {
    DEMFileMetadata t1 = DEMFileMetadataTest.createSRTMTile("N45E005.hgt", 45, 5);
    // Not aligned with the grid of t1
    DEMFileMetadata t2 = DEMFileMetadataTest.createSRTMTile("shifted.hgt", 45, 6.5);
    Envelope query = new Envelope(7.4, 7.7, 45.5, 45.6);
    for (List<DEMFileMetadata> tiles : Arrays.asList(Arrays.asList(t1, t2), Arrays.asList(t2, t1))) {
      assertSame(t1, TileCoverage.selectReference(tiles));
      List<DEMFileMetadata> result = new TileCoverage().fillGaps(tiles, query);
      assertEquals(2, result.size());
      assertSame(t2, result.get(0));
      assertEquals(new Envelope(7, 8, 45, 46), result.get(1).getBoundingBox());
      assertEquals(t1.getWidth(), result.get(1).getWidth());
    }
  }

  public void testReferenceTileTieBrokenByLatitude() {
    DEMFileMetadata north = DEMFileMetadataTest.createSRTMTile("N46E005.hgt", 46, 5);
    DEMFileMetadata south = DEMFileMetadataTest.createSRTMTile("N45E005.hgt", 45, 5);
    assertSame(south, TileCoverage.selectReference(new HashSet<>(Arrays.asList(north, south))));
  }

  public void testTouchingTilesAreNotIncluded() {
    DEMFileMetadata t1 = DEMFileMetadataTest.createSRTMTile("N45E005.hgt", 45, 5);
    DEMFileMetadata t2 = DEMFileMetadataTest.createSRTMTile("N45E006.hgt", 45, 6);
    List<DEMFileMetadata> result = new TileCoverage().fillGaps(Arrays.asList(t1, t2),
        new Envelope(6, 7, 45, 46));
    assertEquals(Collections.singletonList(t2), result);
  }

  public void testEmptyInput() {
    assertTrue(new TileCoverage().fillGaps(Collections.<DEMFileMetadata>emptyList(),
        new Envelope(0, 1, 0, 1)).isEmpty());
  }

  public void testDegenerateReferenceTile() {
    DEMFileMetadata empty = new DEMFileMetadata("empty.tif", DEMFileFormat.GEOTIFF);
    List<DEMFileMetadata> result = new TileCoverage().fillGaps(Collections.singletonList(empty),
        new Envelope(-1, 1, -1, 1));
    assertEquals(Collections.singletonList(empty), result);
  }
}
