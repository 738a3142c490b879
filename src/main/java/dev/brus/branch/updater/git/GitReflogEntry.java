package dev.brus.branch.updater.git;

/**
 * A reflog line: the commit a ref moved to and the reason git recorded for the move.
 */
public class GitReflogEntry {
   private final String newName;
   private final String subject;

   public GitReflogEntry(String newName, String subject) {
      this.newName = newName;
      this.subject = subject;
   }

   public String getNewName() {
      return newName;
   }

   public String getSubject() {
      return subject;
   }

   @Override
   public String toString() {
      return newName + " " + subject;
   }
}
