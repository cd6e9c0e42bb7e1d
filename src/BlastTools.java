import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.*;

public class BlastTools{

  static ArgumentParser buildParser(){
    ArgumentParser parser = ArgumentParsers.newFor("java -jar BlastTools.jar").build()
        .description("Tools for tabular BLAST (-m8, -outfmt 6) reports");
    Subparsers subparsers = parser.addSubparsers().title("subcommands").help("description:").dest("command").metavar("COMMAND");

    HSPChainer.addParameters(subparsers.addParser("chain").help("chain adjacent HSPs together"));
    CScoreCalculator.addParameters(subparsers.addParser("cscore").help("calculate C-score for BLAST pairs"));
    MatePairAnalyzer.addParameters(subparsers.addParser("pairs").help("print paired-end read statistics"));
    BestHitSelector.addParameters(subparsers.addParser("best").help("get best BLAST hit per query"));
    BlastFilter.addParameters(subparsers.addParser("filter").help("filter BLAST file (based on score, id%, " +
        "alignlen, e-value)"));
    BlastConverter.addSwapParameters(subparsers.addParser("swap").help("swap query and subjects in BLAST " +
        "tabular file"));
    BlastConverter.addBedParameters(subparsers.addParser("bed").help("get bed file from BLAST tabular file"));
    BlastConverter.addSortParameters(subparsers.addParser("sort").help("sort lines so that query grouped " +
        "together and scores desc"));
    BlastSummary.addSummaryParameters(subparsers.addParser("summary").help("provide summary on id% and cov%"));
    BlastSummary.addCompletenessParameters(subparsers.addParser("completeness").help("print completeness " +
        "statistics for each query"));
    return parser;
  }

  static void run(Namespace parsedArgs) throws Exception{
    String command = parsedArgs.getString("command");
    switch(command){
      case "chain":
        HSPChainer.run(parsedArgs);
        break;
      case "cscore":
        CScoreCalculator.run(parsedArgs);
        break;
      case "pairs":
        MatePairAnalyzer.run(parsedArgs);
        break;
      case "best":
        BestHitSelector.run(parsedArgs);
        break;
      case "filter":
        BlastFilter.run(parsedArgs);
        break;
      case "swap":
        BlastConverter.runSwap(parsedArgs);
        break;
      case "bed":
        BlastConverter.runBed(parsedArgs);
        break;
      case "sort":
        BlastConverter.runSort(parsedArgs);
        break;
      case "summary":
        BlastSummary.runSummary(parsedArgs);
        break;
      case "completeness":
        BlastSummary.runCompleteness(parsedArgs);
        break;
      default:
        throw new IllegalArgumentException("Unknown command " + command);
    }
  }

  public static void main(String[] args){
    ArgumentParser parser = buildParser();
    if(args.length == 0){
      parser.printUsage();
      return;
    }
    try{
      run(parser.parseArgs(args));
    }catch(ArgumentParserException e){
      parser.handleError(e);
      System.exit(2);
    }catch(Exception e){
      e.printStackTrace();
      System.exit(1);
    }
  }

}
