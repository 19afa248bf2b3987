/*
 * Copyright 2018 University of California, Riverside
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
package edu.ucr.cs.bdlab.demindex.util;

import junit.framework.TestCase;
import org.apache.hadoop.fs.Path;

public class IOUtilTest extends TestCase {

  public void testGetFileName() {
    assertEquals("N45E005.hgt", IOUtil.getFileName("srtm/N45E005.hgt"));
    assertEquals("N45E005.hgt", IOUtil.getFileName("srtm\\gl1\\N45E005.hgt"));
    assertEquals("N45E005.hgt", IOUtil.getFileName("N45E005.hgt"));
    assertEquals("", IOUtil.getFileName("srtm/"));
    assertNull(IOUtil.getFileName(null));
  }

  public void testGetExtension() {
    assertEquals(".hgt", IOUtil.getExtension("srtm/N45E005.hgt"));
    assertEquals(".tif", IOUtil.getExtension("aw3d30/tiles.v1/N045E005.tif"));
    assertNull(IOUtil.getExtension("data.dir/README"));
    assertNull(IOUtil.getExtension(null));
  }

  public void testRelativize() {
    Path dataDir = new Path("/data/dem");
    assertEquals("srtm/N45E005.hgt", IOUtil.relativize(new Path("/data/dem/srtm/N45E005.hgt"), dataDir));
    assertEquals("N45E005.hgt", IOUtil.relativize(new Path("/data/dem/N45E005.hgt"), new Path("/data/dem/")));
    // Not under the directory
    assertEquals("/other/N45E005.hgt", IOUtil.relativize(new Path("/other/N45E005.hgt"), dataDir));
  }
}
