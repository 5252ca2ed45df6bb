/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */

package exm.sdg.render;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import com.google.common.collect.Lists;

import exm.sdg.common.Logging;
import exm.sdg.node.Node;

/**
 * Write rendered documents to character streams and files
 */
public class DocumentWriter {
  private static final Logger logger = Logging.getSDGLogger();

  /**
   * Write every rendered line followed by a newline
   */
  public static void write(Node node, String format, Writer out)
      throws IOException {
    for (String line: Renderer.render(node, format)) {
      out.write(line);
      out.write('\n');
    }
    out.flush();
  }

  /**
   * Write to file in UTF-8, creating parent directories as needed
   */
  public static void writeToFile(Node node, String format, File file)
      throws IOException {
    logger.debug("Writing " + node.getName() + " as " + format + " to " +
                 file);
    Writer out = new BufferedWriter(new OutputStreamWriter(
                  FileUtils.openOutputStream(file), StandardCharsets.UTF_8));
    try {
      write(node, format, out);
    } finally {
      out.close();
    }
  }

  public static List<String> lines(Node node, String format) {
    return Lists.newArrayList(Renderer.render(node, format));
  }

  public static String toString(Node node, String format) {
    return StringUtils.join(lines(node, format), "\n");
  }
}
