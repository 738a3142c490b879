/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 * <p>
 * http://www.apache.org/licenses/LICENSE-2.0
 * <p>
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.brus.branch.updater.layout;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;

import dev.brus.branch.updater.UpdaterException;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The branch layout file stored inside the git directory.
 */
public class LayoutFile {
   public static final String FILE_NAME = "branch-layout";
   public static final String BACKUP_SUFFIX = "~";

   private final static Logger logger = LoggerFactory.getLogger(LayoutFile.class);

   private final File file;
   private final LayoutParser parser;

   public LayoutFile(File gitDirectory) {
      this.file = new File(gitDirectory, FILE_NAME);
      this.parser = new LayoutParser();
   }

   public File getFile() {
      return file;
   }

   public BranchLayout load() throws IOException, UpdaterException {
      if (file.isDirectory()) {
         throw new UpdaterException(file.getPath() + " is a directory rather than a regular file, aborting");
      }
      if (!file.exists()) {
         logger.debug("Creating empty branch layout file " + file.getPath());
         FileUtils.writeStringToFile(file, "", StandardCharsets.UTF_8, true);
      }

      return parser.parse(FileUtils.readFileToString(file, StandardCharsets.UTF_8));
   }

   public void save(BranchLayout layout) throws IOException, UpdaterException {
      layout.verify();

      File temporaryFile = new File(file.getParentFile(), FILE_NAME + ".tmp");
      FileUtils.writeStringToFile(temporaryFile, layout.serialize(), StandardCharsets.UTF_8);
      Files.move(temporaryFile.toPath(), file.toPath(), StandardCopyOption.REPLACE_EXISTING);

      logger.debug("Saved branch layout to " + file.getPath());
   }

   public File backup() throws IOException {
      File backupFile = new File(file.getParentFile(), FILE_NAME + BACKUP_SUFFIX);
      if (file.exists()) {
         FileUtils.copyFile(file, backupFile);
      }
      return backupFile;
   }
}
