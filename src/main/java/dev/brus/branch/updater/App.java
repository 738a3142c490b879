package dev.brus.branch.updater;

import java.io.EOFException;
import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import dev.brus.branch.updater.forkpoint.ForkPoint;
import dev.brus.branch.updater.forkpoint.ForkPointResolver;
import dev.brus.branch.updater.git.GitRepository;
import dev.brus.branch.updater.git.JGitRepository;
import dev.brus.branch.updater.layout.BranchLayout;
import dev.brus.branch.updater.merge.SquashMergeDetection;
import dev.brus.branch.updater.ops.Discovery;
import dev.brus.branch.updater.ops.ParentSync;
import dev.brus.branch.updater.ops.TreeMutationOps;
import dev.brus.branch.updater.status.StatusPrinter;
import dev.brus.branch.updater.traverse.ReturnTo;
import dev.brus.branch.updater.traverse.StartFrom;
import dev.brus.branch.updater.traverse.TraversalEngine;
import dev.brus.branch.updater.traverse.TraversalOutcome;
import dev.brus.branch.updater.util.CommandLine;
import dev.brus.branch.updater.util.CommandLineParser;
import dev.brus.branch.updater.util.Console;
import dev.brus.branch.updater.util.StandardConsole;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class App {
   public static final int EXIT_SUCCESS = 0;
   public static final int EXIT_UPDATER_ERROR = 1;
   public static final int EXIT_ARGUMENT_ERROR = 2;
   public static final int EXIT_INTERRUPTED = 3;
   public static final int EXIT_END_OF_INPUT = 4;

   private static final String DEFAULT_LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

   private static final String STATUS_COMMAND = "status";
   private static final String TRAVERSE_COMMAND = "traverse";
   private static final String FORK_POINT_COMMAND = "fork-point";
   private static final String SLIDE_OUT_COMMAND = "slide-out";
   private static final String ADVANCE_COMMAND = "advance";
   private static final String ADD_COMMAND = "add";
   private static final String UPDATE_COMMAND = "update";
   private static final String DISCOVER_COMMAND = "discover";
   private static final String DELETE_UNMANAGED_COMMAND = "delete-unmanaged";
   private static final String GO_COMMAND = "go";
   private static final String SHOW_COMMAND = "show";
   private static final String ANNO_COMMAND = "anno";
   private static final String LIST_COMMAND = "list";

   private static final List<String> COMMANDS = Arrays.asList(STATUS_COMMAND, TRAVERSE_COMMAND, FORK_POINT_COMMAND,
      SLIDE_OUT_COMMAND, ADVANCE_COMMAND, ADD_COMMAND, UPDATE_COMMAND, DISCOVER_COMMAND, DELETE_UNMANAGED_COMMAND,
      GO_COMMAND, SHOW_COMMAND, ANNO_COMMAND, LIST_COMMAND);

   private static final String HELP_OPTION = "help";
   private static final String DEBUG_OPTION = "debug";
   private static final String YES_OPTION = "yes";
   private static final String LIST_COMMITS_OPTION = "list-commits";
   private static final String SQUASH_MERGE_DETECTION_OPTION = "squash-merge-detection";
   private static final String FETCH_OPTION = "fetch";
   private static final String MERGE_OPTION = "merge";
   private static final String NO_EDIT_MERGE_OPTION = "no-edit-merge";
   private static final String INTERACTIVE_REBASE_OPTION = "interactive-rebase";
   private static final String PUSH_OPTION = "push";
   private static final String NO_PUSH_OPTION = "no-push";
   private static final String PUSH_UNTRACKED_OPTION = "push-untracked";
   private static final String NO_PUSH_UNTRACKED_OPTION = "no-push-untracked";
   private static final String START_FROM_OPTION = "start-from";
   private static final String RETURN_TO_OPTION = "return-to";
   private static final String STOP_AFTER_OPTION = "stop-after";
   private static final String INFERRED_OPTION = "inferred";
   private static final String OVERRIDE_TO_OPTION = "override-to";
   private static final String OVERRIDE_TO_INFERRED_OPTION = "override-to-inferred";
   private static final String OVERRIDE_TO_PARENT_OPTION = "override-to-parent";
   private static final String UNSET_OVERRIDE_OPTION = "unset-override";
   private static final String DOWN_FORK_POINT_OPTION = "down-fork-point";
   private static final String DELETE_OPTION = "delete";
   private static final String REMOVED_FROM_REMOTE_OPTION = "removed-from-remote";
   private static final String ONTO_OPTION = "onto";
   private static final String AS_ROOT_OPTION = "as-root";
   private static final String AS_FIRST_CHILD_OPTION = "as-first-child";
   private static final String FORK_POINT_OPTION = "fork-point";
   private static final String ROOTS_OPTION = "roots";
   private static final String MAX_BRANCHES_OPTION = "max-branches";
   private static final String BRANCH_OPTION = "branch";

   private final Logger logger = LoggerFactory.getLogger(App.class);

   private final Console console;

   public App(Console console) {
      this.console = console;
   }

   public static void main(String[] args) {
      // The level of slf4j-simple is read once, when the first logger is created.
      if (Arrays.asList(args).contains("--" + DEBUG_OPTION)) {
         System.setProperty(DEFAULT_LOG_LEVEL_PROPERTY, "debug");
      }

      System.exit(new App(new StandardConsole()).run(args, new File(System.getProperty("user.dir"))));
   }

   public int run(String[] args, File directory) {
      if (args.length == 0 || !COMMANDS.contains(args[0])) {
         if (args.length > 0 && !args[0].equals("--" + HELP_OPTION)) {
            console.error("Unknown command: " + args[0]);
         }
         console.println("usage: branch-updater <command> [options] [args]\ncommands: " + String.join(", ", COMMANDS));
         return args.length > 0 && args[0].equals("--" + HELP_OPTION) ? EXIT_SUCCESS : EXIT_ARGUMENT_ERROR;
      }

      String command = args[0];
      CommandLineParser parser = createParser(command);

      CommandLine line;
      try {
         line = parser.parse(Arrays.copyOfRange(args, 1, args.length));
      } catch (ParseException e) {
         console.error(e.getMessage());
         console.println(parser.getHelp("branch-updater " + command));
         return EXIT_ARGUMENT_ERROR;
      }

      if (line.hasOption(HELP_OPTION)) {
         console.println(parser.getHelp("branch-updater " + command));
         return EXIT_SUCCESS;
      }

      try (GitRepository repository = new JGitRepository().open(directory)) {
         return execute(command, line, repository);
      } catch (ParseException e) {
         console.error(e.getMessage());
         console.println(parser.getHelp("branch-updater " + command));
         return EXIT_ARGUMENT_ERROR;
      } catch (EOFException e) {
         logger.debug("Input closed while prompting", e);
         return EXIT_END_OF_INPUT;
      } catch (InterruptedException e) {
         Thread.currentThread().interrupt();
         console.error("Interrupted");
         return EXIT_INTERRUPTED;
      } catch (UpdaterException e) {
         logger.debug("Error executing " + command, e);
         console.error(e.getMessage());
         return EXIT_UPDATER_ERROR;
      } catch (Exception e) {
         logger.error("Error executing " + command, e);
         console.error(e.getMessage());
         return EXIT_UPDATER_ERROR;
      }
   }

   private CommandLineParser createParser(String command) {
      CommandLineParser parser = new CommandLineParser();
      parser.addFlag("h", HELP_OPTION, "print the help of the command");
      parser.addFlag(null, DEBUG_OPTION, "log debug messages to the standard error");

      switch (command) {
         case STATUS_COMMAND:
            parser.addFlag("l", LIST_COMMITS_OPTION, "list the commits of each branch after its fork point");
            parser.addOption(null, SQUASH_MERGE_DETECTION_OPTION, false, true, false, "none, simple or exact");
            break;
         case TRAVERSE_COMMAND:
            parser.addFlag("F", FETCH_OPTION, "fetch all the remotes before the traversal");
            parser.addFlag("l", LIST_COMMITS_OPTION, "list the commits of each branch after its fork point");
            parser.addFlag("M", MERGE_OPTION, "merge the parent instead of rebasing onto it");
            parser.addFlag(null, NO_EDIT_MERGE_OPTION, "merge without editing the merge commit message");
            parser.addFlag(null, INTERACTIVE_REBASE_OPTION, "rebase interactively");
            parser.addFlag(null, PUSH_OPTION, "push branches ahead of or diverged from their remote counterparts");
            parser.addFlag(null, NO_PUSH_OPTION, "never push branches with a remote counterpart");
            parser.addFlag(null, PUSH_UNTRACKED_OPTION, "push branches without a remote counterpart");
            parser.addFlag(null, NO_PUSH_UNTRACKED_OPTION, "never push branches without a remote counterpart");
            parser.addOption(null, START_FROM_OPTION, false, true, false, "here, root, first-root or a branch");
            parser.addOption(null, RETURN_TO_OPTION, false, true, false, "here, nearest-remaining or stay");
            parser.addOption(null, STOP_AFTER_OPTION, false, true, false, "the branch after which the traversal stops");
            parser.addOption(null, SQUASH_MERGE_DETECTION_OPTION, false, true, false, "none, simple or exact");
            parser.addFlag("y", YES_OPTION, "take every action without asking");
            break;
         case FORK_POINT_COMMAND:
            parser.addFlag(null, INFERRED_OPTION, "print the inferred fork point, ignoring the overrides");
            parser.addOption(null, OVERRIDE_TO_OPTION, false, true, false, "override the fork point to a revision");
            parser.addFlag(null, OVERRIDE_TO_INFERRED_OPTION, "override the fork point to the inferred one");
            parser.addFlag(null, OVERRIDE_TO_PARENT_OPTION, "override the fork point to the tip of the parent");
            parser.addFlag(null, UNSET_OVERRIDE_OPTION, "remove the fork point override");
            break;
         case SLIDE_OUT_COMMAND:
            parser.addOption("d", DOWN_FORK_POINT_OPTION, false, true, false, "the fork point of the child of the last branch");
            parser.addFlag(null, DELETE_OPTION, "delete the slid out branches");
            parser.addFlag("M", MERGE_OPTION, "merge the new parent instead of rebasing onto it");
            parser.addFlag(null, NO_EDIT_MERGE_OPTION, "merge without editing the merge commit message");
            parser.addFlag(null, INTERACTIVE_REBASE_OPTION, "rebase interactively");
            parser.addFlag(null, REMOVED_FROM_REMOTE_OPTION, "slide out the branches deleted on their remote");
            break;
         case ADVANCE_COMMAND:
         case DELETE_UNMANAGED_COMMAND:
            parser.addFlag("y", YES_OPTION, "take every action without asking");
            break;
         case ADD_COMMAND:
            parser.addOption("o", ONTO_OPTION, false, true, false, "the parent branch");
            parser.addFlag("R", AS_ROOT_OPTION, "add the branch as a new root");
            parser.addFlag("f", AS_FIRST_CHILD_OPTION, "add the branch as the first child of its parent");
            parser.addFlag("y", YES_OPTION, "take every action without asking");
            break;
         case UPDATE_COMMAND:
            parser.addFlag("M", MERGE_OPTION, "merge the parent instead of rebasing onto it");
            parser.addFlag(null, NO_EDIT_MERGE_OPTION, "merge without editing the merge commit message");
            parser.addFlag(null, INTERACTIVE_REBASE_OPTION, "rebase interactively");
            parser.addOption("f", FORK_POINT_OPTION, false, true, false, "the commit to rebase from");
            break;
         case DISCOVER_COMMAND:
            parser.addOption("r", ROOTS_OPTION, false, true, false, "comma-separated list of root branches");
            parser.addOption(null, MAX_BRANCHES_OPTION, false, true, false,
               "how many recently checked out branches are included, 0 for all (default " + Discovery.DEFAULT_FRESH_BRANCH_COUNT + ")");
            parser.addFlag("l", LIST_COMMITS_OPTION, "list the commits of each branch after its fork point");
            parser.addFlag("y", YES_OPTION, "save without asking");
            break;
         case ANNO_COMMAND:
            parser.addOption("b", BRANCH_OPTION, false, true, false, "the branch to annotate");
            break;
         default:
            break;
      }

      return parser;
   }

   private int execute(String command, CommandLine line, GitRepository repository) throws Exception {
      RunConfig runConfig = createRunConfig(line, repository);

      switch (command) {
         case STATUS_COMMAND: {
            UpdaterSession session = UpdaterSession.open(repository, runConfig, console, true);
            new StatusPrinter(session).print(runConfig.isListCommits());
            return EXIT_SUCCESS;
         }
         case TRAVERSE_COMMAND: {
            UpdaterSession session = UpdaterSession.open(repository, runConfig, console, true);
            TraversalOutcome outcome = new TraversalEngine(session).traverse();
            logger.debug("Traversal outcome: " + outcome);
            return outcome.getState() == TraversalOutcome.State.FAILED ? EXIT_UPDATER_ERROR : EXIT_SUCCESS;
         }
         case FORK_POINT_COMMAND:
            return executeForkPoint(line, UpdaterSession.open(repository, runConfig, console, true));
         case SLIDE_OUT_COMMAND: {
            UpdaterSession session = UpdaterSession.open(repository, runConfig, console, true);
            TreeMutationOps ops = new TreeMutationOps(session);
            if (line.hasOption(REMOVED_FROM_REMOTE_OPTION)) {
               ops.slideOutRemovedFromRemote(line.hasOption(DELETE_OPTION));
            } else {
               List<String> branches = line.getArgs().isEmpty() ? List.of(session.getCurrentBranch()) : line.getArgs();
               ops.slideOut(branches, line.getOptionValue(DOWN_FORK_POINT_OPTION), line.hasOption(DELETE_OPTION));
            }
            return EXIT_SUCCESS;
         }
         case ADVANCE_COMMAND:
            new TreeMutationOps(UpdaterSession.open(repository, runConfig, console, true)).advance();
            return EXIT_SUCCESS;
         case ADD_COMMAND: {
            UpdaterSession session = UpdaterSession.open(repository, runConfig, console, true);
            String branch = line.getArg(0, null);
            new TreeMutationOps(session).add(branch != null ? branch : session.getCurrentBranch(),
               line.getOptionValue(ONTO_OPTION), line.hasOption(AS_ROOT_OPTION), line.hasOption(AS_FIRST_CHILD_OPTION));
            return EXIT_SUCCESS;
         }
         case UPDATE_COMMAND:
            new ParentSync(UpdaterSession.open(repository, runConfig, console, true)).update(line.getOptionValue(FORK_POINT_OPTION));
            return EXIT_SUCCESS;
         case DISCOVER_COMMAND: {
            UpdaterSession session = UpdaterSession.open(repository, runConfig, console, false);
            List<String> roots = new ArrayList<>();
            for (String root : StringUtils.split(line.getOptionValue(ROOTS_OPTION, ""), ',')) {
               roots.add(root.trim());
            }
            int maxBranches;
            try {
               maxBranches = Integer.parseInt(line.getOptionValue(MAX_BRANCHES_OPTION, String.valueOf(Discovery.DEFAULT_FRESH_BRANCH_COUNT)));
            } catch (NumberFormatException e) {
               throw new ParseException("Invalid value for --" + MAX_BRANCHES_OPTION + ": " + e.getMessage());
            }
            new Discovery(session).discover(roots, maxBranches, runConfig.isListCommits());
            return EXIT_SUCCESS;
         }
         case DELETE_UNMANAGED_COMMAND:
            new TreeMutationOps(UpdaterSession.open(repository, runConfig, console, true)).deleteUnmanaged();
            return EXIT_SUCCESS;
         case GO_COMMAND:
         case SHOW_COMMAND:
            return executeGoOrShow(command, line, UpdaterSession.open(repository, runConfig, console, true));
         case ANNO_COMMAND: {
            UpdaterSession session = UpdaterSession.open(repository, runConfig, console, false);
            String branch = line.getOptionValue(BRANCH_OPTION, session.getCurrentBranch());
            if (line.getArgs().isEmpty()) {
               session.expectManaged(branch);
               String annotation = session.getLayout().getAnnotation(branch).getRawText();
               if (!annotation.isEmpty()) {
                  console.println(annotation);
               }
            } else {
               new TreeMutationOps(session).annotate(branch, String.join(" ", line.getArgs()));
            }
            return EXIT_SUCCESS;
         }
         case LIST_COMMAND:
            return executeList(line, UpdaterSession.open(repository, runConfig, console, false));
         default:
            throw new ParseException("Unknown command: " + command);
      }
   }

   private RunConfig createRunConfig(CommandLine line, GitRepository repository) throws Exception {
      RunConfig runConfig = RunConfig.fromGitConfig(repository);

      if (line.hasOption(SQUASH_MERGE_DETECTION_OPTION)) {
         try {
            runConfig.setSquashMergeDetection(SquashMergeDetection.fromString(line.getOptionValue(SQUASH_MERGE_DETECTION_OPTION)));
         } catch (IllegalArgumentException e) {
            throw new ParseException(e.getMessage());
         }
      }
      if (line.hasOption(PUSH_OPTION)) {
         runConfig.setPushTracked(true);
      }
      if (line.hasOption(NO_PUSH_OPTION)) {
         runConfig.setPushTracked(false);
      }
      if (line.hasOption(PUSH_UNTRACKED_OPTION)) {
         runConfig.setPushUntracked(true);
      }
      if (line.hasOption(NO_PUSH_UNTRACKED_OPTION)) {
         runConfig.setPushUntracked(false);
      }
      if (line.hasOption(START_FROM_OPTION)) {
         runConfig.setStartFrom(StartFrom.fromString(line.getOptionValue(START_FROM_OPTION)));
      }
      if (line.hasOption(RETURN_TO_OPTION)) {
         try {
            runConfig.setReturnTo(ReturnTo.fromString(line.getOptionValue(RETURN_TO_OPTION)));
         } catch (IllegalArgumentException e) {
            throw new ParseException(e.getMessage());
         }
      }

      return runConfig
         .setYes(line.hasOption(YES_OPTION))
         .setMerge(line.hasOption(MERGE_OPTION))
         .setNoEditMerge(line.hasOption(NO_EDIT_MERGE_OPTION))
         .setInteractiveRebase(line.hasOption(INTERACTIVE_REBASE_OPTION))
         .setFetch(line.hasOption(FETCH_OPTION))
         .setListCommits(line.hasOption(LIST_COMMITS_OPTION))
         .setStopAfter(line.getOptionValue(STOP_AFTER_OPTION));
   }

   private int executeForkPoint(CommandLine line, UpdaterSession session) throws Exception {
      ForkPointResolver forkPointResolver = session.getForkPointResolver();
      String branch = line.getArg(0, null);
      if (branch == null) {
         branch = session.getCurrentBranch();
      }

      if (line.hasOption(UNSET_OVERRIDE_OPTION)) {
         forkPointResolver.unsetOverride(branch);
      } else if (line.hasOption(OVERRIDE_TO_OPTION)) {
         forkPointResolver.overrideTo(branch, line.getOptionValue(OVERRIDE_TO_OPTION));
      } else if (line.hasOption(OVERRIDE_TO_INFERRED_OPTION)) {
         String inferredForkPoint = forkPointResolver.inferForkPoint(branch);
         if (inferredForkPoint == null) {
            throw new UpdaterException("Cannot infer the fork point of " + branch);
         }
         forkPointResolver.overrideTo(branch, inferredForkPoint);
      } else if (line.hasOption(OVERRIDE_TO_PARENT_OPTION)) {
         String parent = session.getLayout().getParent(branch);
         if (parent == null) {
            throw new UpdaterException("Branch " + branch + " does not have a parent branch in the tree of branch dependencies");
         }
         forkPointResolver.overrideTo(branch, parent);
      } else if (line.hasOption(INFERRED_OPTION)) {
         String inferredForkPoint = forkPointResolver.inferForkPoint(branch);
         if (inferredForkPoint == null) {
            throw new UpdaterException("Cannot infer the fork point of " + branch);
         }
         console.println(inferredForkPoint);
      } else {
         ForkPoint forkPoint = forkPointResolver.getForkPoint(branch, true);
         console.println(forkPoint.getHash());
      }
      return EXIT_SUCCESS;
   }

   private int executeGoOrShow(String command, CommandLine line, UpdaterSession session) throws Exception {
      String direction = line.getArg(0, null);
      if (direction == null) {
         throw new ParseException("Missing direction: up, down, next, prev, first, last or root");
      }
      String branch = line.getArg(1, null);
      if (branch == null || command.equals(GO_COMMAND)) {
         branch = session.getCurrentBranch();
      }
      session.expectManaged(branch);

      BranchLayout layout = session.getLayout();
      List<String> targets = new ArrayList<>();
      switch (direction) {
         case "u":
         case "up":
            if (layout.getParent(branch) == null) {
               throw new UpdaterException("Branch " + branch + " has no upstream branch");
            }
            targets.add(layout.getParent(branch));
            break;
         case "d":
         case "down":
            if (layout.getChildren(branch).isEmpty()) {
               throw new UpdaterException("Branch " + branch + " has no downstream branch");
            }
            targets.addAll(layout.getChildren(branch));
            break;
         case "n":
         case "next":
            if (layout.getNext(branch) == null) {
               throw new UpdaterException("Branch " + branch + " has no successor");
            }
            targets.add(layout.getNext(branch));
            break;
         case "p":
         case "prev":
            if (layout.getPrevious(branch) == null) {
               throw new UpdaterException("Branch " + branch + " has no predecessor");
            }
            targets.add(layout.getPrevious(branch));
            break;
         case "f":
         case "first":
            targets.add(layout.getFirst(branch));
            break;
         case "l":
         case "last":
            targets.add(layout.getLast(branch));
            break;
         case "r":
         case "root":
            targets.add(layout.getRootOf(branch));
            break;
         default:
            throw new ParseException("Invalid direction: " + direction + "; expected up, down, next, prev, first, last or root");
      }

      if (command.equals(SHOW_COMMAND)) {
         for (String target : targets) {
            console.println(target);
         }
         return EXIT_SUCCESS;
      }

      String target = targets.size() == 1 ? targets.get(0) : session.getPrompter().pick(targets, "downstream branch");
      if (target != null && !target.equals(branch)) {
         session.getRepository().checkout(target);
      }
      return EXIT_SUCCESS;
   }

   private int executeList(CommandLine line, UpdaterSession session) throws Exception {
      String category = line.getArg(0, null);
      if (category == null) {
         throw new ParseException("Missing category: managed, unmanaged, childless, slidable, slidable-after or with-overridden-fork-point");
      }

      BranchLayout layout = session.getLayout();
      List<String> branches = new ArrayList<>();
      switch (category) {
         case "managed":
            branches.addAll(layout.getManagedBranches());
            break;
         case "unmanaged":
            for (String branch : session.getRepository().getLocalBranches()) {
               if (!layout.contains(branch)) {
                  branches.add(branch);
               }
            }
            break;
         case "childless":
            branches.addAll(layout.getChildlessBranches());
            break;
         case "slidable":
            for (String branch : layout.getManagedBranches()) {
               if (layout.getParent(branch) != null) {
                  branches.add(branch);
               }
            }
            break;
         case "slidable-after": {
            String branch = line.getArg(1, null);
            if (branch == null) {
               throw new ParseException("Missing branch for category slidable-after");
            }
            session.expectManaged(branch);
            if (layout.getParent(branch) != null && layout.getChildren(branch).size() == 1) {
               branches.addAll(layout.getChildren(branch));
            }
            break;
         }
         case "with-overridden-fork-point":
            for (String branch : layout.getManagedBranches()) {
               if (session.getForkPointResolver().getOverride().get(branch) != null) {
                  branches.add(branch);
               }
            }
            break;
         default:
            throw new ParseException("Invalid category: " + category);
      }

      for (String branch : branches) {
         console.println(branch);
      }
      return EXIT_SUCCESS;
   }
}
