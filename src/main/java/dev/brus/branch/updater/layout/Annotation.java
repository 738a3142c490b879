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

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

/**
 * The free text following a branch name in the layout, split into the visible text
 * and the {@link Qualifiers} tokens found anywhere in it.
 */
public class Annotation {
   public static final Annotation EMPTY = new Annotation("", "", Qualifiers.DEFAULT);

   private final String rawText;
   private final String text;
   private final Qualifiers qualifiers;

   private Annotation(String rawText, String text, Qualifiers qualifiers) {
      this.rawText = rawText;
      this.text = text;
      this.qualifiers = qualifiers;
   }

   public static Annotation parse(String annotation) {
      if (StringUtils.isBlank(annotation)) {
         return EMPTY;
      }

      String remainingText = annotation;

      boolean rebase = true;
      if (containsToken(annotation, Qualifiers.NO_REBASE_TOKEN)) {
         rebase = false;
         remainingText = removeToken(remainingText, Qualifiers.NO_REBASE_TOKEN);
      }
      boolean push = true;
      if (containsToken(annotation, Qualifiers.NO_PUSH_TOKEN)) {
         push = false;
         remainingText = removeToken(remainingText, Qualifiers.NO_PUSH_TOKEN);
      }
      boolean slideOut = true;
      if (containsToken(annotation, Qualifiers.NO_SLIDE_OUT_TOKEN)) {
         slideOut = false;
         remainingText = removeToken(remainingText, Qualifiers.NO_SLIDE_OUT_TOKEN);
      }
      boolean updateWithMerge = false;
      if (containsToken(annotation, Qualifiers.UPDATE_WITH_MERGE_TOKEN)) {
         updateWithMerge = true;
         remainingText = removeToken(remainingText, Qualifiers.UPDATE_WITH_MERGE_TOKEN);
      }

      return new Annotation(annotation.strip(), remainingText.strip(),
         new Qualifiers(rebase, push, slideOut, updateWithMerge));
   }

   public static Annotation of(String text, Qualifiers qualifiers) {
      String strippedText = text == null ? "" : text.strip();
      String qualifiersText = qualifiers.getText();

      String rawText;
      if (strippedText.isEmpty()) {
         rawText = qualifiersText;
      } else if (qualifiersText.isEmpty()) {
         rawText = strippedText;
      } else {
         rawText = strippedText + " " + qualifiersText;
      }

      return new Annotation(rawText, strippedText, qualifiers);
   }

   private static boolean containsToken(String annotation, String token) {
      return Pattern.compile("\\b" + Pattern.quote(token) + "\\b").matcher(annotation).find();
   }

   private static String removeToken(String annotation, String token) {
      return Pattern.compile("[ ]?\\b" + Pattern.quote(token) + "\\b[ ]?").matcher(annotation).replaceAll(Matcher.quoteReplacement(" "));
   }

   /**
    * The annotation as it appears in the layout file.
    */
   public String getRawText() {
      return rawText;
   }

   /**
    * The annotation without qualifier tokens.
    */
   public String getText() {
      return text;
   }

   public Qualifiers getQualifiers() {
      return qualifiers;
   }

   public boolean isEmpty() {
      return rawText.isEmpty();
   }

   public Annotation withText(String newText) {
      return of(newText, qualifiers);
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) {
         return true;
      }
      if (o == null || getClass() != o.getClass()) {
         return false;
      }
      Annotation that = (Annotation) o;
      return rawText.equals(that.rawText);
   }

   @Override
   public int hashCode() {
      return Objects.hash(rawText);
   }

   @Override
   public String toString() {
      return rawText;
   }
}
