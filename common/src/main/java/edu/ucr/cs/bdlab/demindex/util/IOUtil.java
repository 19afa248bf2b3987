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

import org.apache.hadoop.fs.Path;

import java.net.URI;

public class IOUtil {

  /**
   * Returns the extension of the given file name including the dot, e.g., ".hgt"
   * @param filename the name or path of the file
   * @return the extension or {@code null} if the file has no extension
   */
  public static String getExtension(String filename) {
    String name = getFileName(filename);
    if (name == null)
      return null;
    int i = name.lastIndexOf('.');
    return i == -1 ? null : name.substring(i);
  }

  /**
   * Returns the last component of the given path. Both forward slash and backslash are treated as
   * separators regardless of the platform so that paths written on one system resolve the same on another.
   * @param path a relative or absolute path
   * @return the file name part of the path or {@code null} if the path is {@code null}
   */
  public static String getFileName(String path) {
    if (path == null)
      return null;
    int i = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
    return path.substring(i + 1);
  }

  /**
   * Expresses a file path relative to a directory. If the file is not contained in the directory,
   * its path is returned as-is.
   * @param file the file to relativize
   * @param directory the reference directory
   * @return the path of the file relative to the directory
   */
  public static String relativize(Path file, Path directory) {
    URI fileURI = file.toUri();
    URI relative = directory.toUri().relativize(fileURI);
    if (relative == fileURI || relative.isAbsolute())
      return file.toString();
    return relative.getPath();
  }
}
