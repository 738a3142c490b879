package dev.brus.branch.updater.util;

import java.io.BufferedReader;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

public class StandardConsole implements Console {

   private final PrintStream out;
   private final PrintStream err;
   private final BufferedReader in;

   public StandardConsole() {
      this.out = System.out;
      this.err = System.err;
      this.in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
   }

   @Override
   public void println(String message) {
      out.println(message);
   }

   @Override
   public void warn(String message) {
      err.println("Warn: " + message);
   }

   @Override
   public void error(String message) {
      err.println("Error: " + message);
   }

   @Override
   public String ask(String question) throws EOFException {
      out.print(question + " ");
      out.flush();
      try {
         String answer = in.readLine();
         if (answer == null) {
            throw new EOFException("No answer for: " + question);
         }
         return answer.trim();
      } catch (EOFException e) {
         throw e;
      } catch (IOException e) {
         throw new UncheckedIOException(e);
      }
   }
}
