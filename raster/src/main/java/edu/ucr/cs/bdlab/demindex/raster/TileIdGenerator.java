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

import java.util.UUID;

/**
 * Generates the synthetic file names of virtual tiles. Every generated name must be unique and must
 * not be the base name of any real tile file.
 */
@FunctionalInterface
public interface TileIdGenerator {

  /**Random UUIDs. They have no extension so they never collide with a raster file name.*/
  TileIdGenerator RANDOM_UUID = source -> UUID.randomUUID().toString();

  /**
   * Generates a new identifier for a virtual copy of the given tile
   * @param source the descriptor being copied
   * @return the synthetic file name of the copy
   */
  String nextId(DEMFileMetadata source);
}
