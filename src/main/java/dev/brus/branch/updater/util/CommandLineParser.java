package dev.brus.branch.updater.util;

import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.PrintWriter;
import java.io.StringWriter;

public class CommandLineParser {

   private Options options;
   private org.apache.commons.cli.CommandLineParser parser;

   public CommandLineParser() {
      this.options = new Options();
      this.parser = new DefaultParser();
   }

   public CommandLine parse(String[] args) throws ParseException {
      return new CommandLine(parser.parse(options, args));
   }

   public CommandLineParser addOption(String opt, String longOpt, boolean required, boolean hasArg, boolean hasOptionalArg, String description) {
      Option option = new Option(opt, longOpt, hasArg, description);
      option.setRequired(required);
      option.setOptionalArg(hasOptionalArg);

      options.addOption(option);

      return this;
   }

   public CommandLineParser addFlag(String opt, String longOpt, String description) {
      return addOption(opt, longOpt, false, false, false, description);
   }

   public String getHelp(String syntax) {
      StringWriter helpWriter = new StringWriter();
      try (PrintWriter helpPrintWriter = new PrintWriter(helpWriter)) {
         HelpFormatter formatter = new HelpFormatter();
         formatter.printHelp(helpPrintWriter, formatter.getWidth(), syntax, null, options,
            formatter.getLeftPadding(), formatter.getDescPadding(), null);
      }
      return helpWriter.toString();
   }

   public void clearOptions() {
      options = new Options();
   }
}
