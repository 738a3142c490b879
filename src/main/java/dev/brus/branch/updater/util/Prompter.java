package dev.brus.branch.updater.util;

import java.io.EOFException;
import java.util.List;

import dev.brus.branch.updater.UpdaterException;

/**
 * Asks the user through a {@link Console}, or answers yes on its own when confirmations are
 * turned off.
 */
public class Prompter {

   private final Console console;
   private final boolean yes;

   public Prompter(Console console, boolean yes) {
      this.console = console;
      this.yes = yes;
   }

   public Console getConsole() {
      return console;
   }

   public boolean isYes() {
      return yes;
   }

   public static String formatChoices(Answer... choices) {
      StringBuilder builder = new StringBuilder(" (");
      for (int i = 0; i < choices.length; i++) {
         if (i > 0) {
            builder.append(", ");
         }
         builder.append(choices[i].getChoice());
      }
      return builder.append(")").toString();
   }

   /**
    * @param yesMessage printed instead of asking when confirmations are off, null to ask anyway
    * @return the answer, {@link Answer#NO} for a reply that is not one of the choices
    */
   public Answer ask(String question, String yesMessage, Answer... choices) throws EOFException {
      if (yes && yesMessage != null) {
         console.println(yesMessage);
         return Answer.YES;
      }
      Answer answer = Answer.fromReply(console.ask(question + formatChoices(choices)));
      for (Answer choice : choices) {
         if (choice == answer) {
            return answer;
         }
      }
      return Answer.NO;
   }

   public boolean confirm(String question, String yesMessage) throws EOFException {
      return ask(question, yesMessage, Answer.YES, Answer.NO).isYes();
   }

   /**
    * Lets the user pick one of the given values by number.
    *
    * @return the picked value, null if the user skipped
    */
   public String pick(List<String> choices, String name) throws EOFException, UpdaterException {
      StringBuilder builder = new StringBuilder();
      for (int i = 0; i < choices.size(); i++) {
         builder.append('[').append(i + 1).append("] ").append(choices.get(i)).append('\n');
      }
      builder.append("Specify ").append(name).append(" or hit <return> to skip:");

      String reply = console.ask(builder.toString());
      if (reply.isEmpty()) {
         return null;
      }
      int index;
      try {
         index = Integer.parseInt(reply) - 1;
      } catch (NumberFormatException e) {
         throw new UpdaterException("Invalid index: " + reply, e);
      }
      if (index < 0 || index >= choices.size()) {
         throw new UpdaterException("Invalid index: " + (index + 1));
      }
      return choices.get(index);
   }
}
