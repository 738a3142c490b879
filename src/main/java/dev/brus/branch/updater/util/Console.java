package dev.brus.branch.updater.util;

import java.io.EOFException;

/**
 * User-facing output and prompts, kept apart from logging.
 */
public interface Console {

   void println(String message);

   void warn(String message);

   void error(String message);

   /**
    * Prints the question and reads one answer line.
    *
    * @throws EOFException if the input is closed before an answer is given
    */
   String ask(String question) throws EOFException;
}
