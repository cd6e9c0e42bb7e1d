import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.Namespace;
import org.jdom2.Document;
import org.jdom2.JDOMException;

import java.io.BufferedWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Coverage and identity summaries of a BLAST file.
 */
class BlastSummary extends Constants{

  long queryCovered;
  long subjectCovered;
  double identity;

  /**
   * Bases covered on query and subject and identity weighted by subject span.
   * No hits, or hits of zero subject span only, leave the identity undefined.
   */
  static BlastSummary summarize(List<HSP> hsps){
    ArrayList<Interval> queryRanges = new ArrayList<>(hsps.size());
    ArrayList<Interval> subjectRanges = new ArrayList<>(hsps.size());
    double identicals = 0;
    long alignLen = 0;
    for(HSP hsp: hsps){
      int startQ = Math.min(hsp.startQ, hsp.endQ);
      int endQ = Math.max(hsp.startQ, hsp.endQ);
      queryRanges.add(new Interval(hsp.query, startQ, endQ, hsp.orientation()));
      subjectRanges.add(new Interval(hsp.subject, hsp.startS, hsp.endS, hsp.orientation()));
      int aLen = hsp.endS - hsp.startS;
      alignLen += aLen;
      identicals += hsp.identity / 100 * aLen;
    }
    BlastSummary summary = new BlastSummary();
    summary.queryCovered = Interval.unionLength(queryRanges);
    summary.subjectCovered = Interval.unionLength(subjectRanges);
    summary.identity = identicals * 100 / alignLen;
    return summary;
  }

  /**
   * For each query: its first subject, bases before the leftmost hit and after the rightmost
   * hit on that subject.
   */
  static ArrayList<String> completeness(HitStore store, SequenceSizes sizes){
    ArrayList<String> res = new ArrayList<>();
    for(Iterator<BlastHit> iter = store.iterHits(); iter.hasNext();){
      BlastHit hit = iter.next();
      HSP first = hit.hsps.get(0);
      int min = first.startS;
      int max = first.endS;
      for(HSP hsp: hit.hsps){
        min = Math.min(min, hsp.startS);
        max = Math.max(max, hsp.endS);
      }
      int subjectLen = sizes.getSize(first.subject);
      int nTerminalDist = min - 1;
      int cTerminalDist = subjectLen - max + 1;
      res.add(first.query + '\t' + first.subject + '\t' + nTerminalDist + '\t' + cTerminalDist);
    }
    return res;
  }

  static void addSummaryParameters(ArgumentParser parser){
    parser.description("Provides summary on identity and coverage, for both query and reference.");
    parser.addArgument("blastfile").help("tabular BLAST file");
    parser.addArgument("-c").dest("config_file").help("path to config file, the bundled one is used if omitted");
  }

  static void addCompletenessParameters(ArgumentParser parser){
    parser.description("Prints for each query the distance of its hits to both ends of the subject, " +
        "an indicator of the completeness of the gene model.");
    parser.addArgument("blastfile").help("tabular BLAST file");
    parser.addArgument("fastafile").help("FASTA file with the subject sequences");
    parser.addArgument("-c").dest("config_file").help("path to config file, the bundled one is used if omitted");
    parser.addArgument("-o").dest("output").help("output file, default standard output");
  }

  static void runSummary(Namespace parsedArgs) throws IOException, JDOMException{
    Document config = loadConfig(parsedArgs.getString("config_file"));
    Logger logger = Logger.getInstance(config);
    String blastPath = parsedArgs.getString("blastfile");
    logger.println("Report stats on " + blastPath);
    BlastSummary summary = summarize(EagerHitStore.load(blastPath).getHSPs());
    logger.printf("Query coverage: %,d bp\n", summary.queryCovered);
    logger.printf("Reference coverage: %,d bp\n", summary.subjectCovered);
    logger.printf("Identity: %.2f%%\n", summary.identity);
  }

  static void runCompleteness(Namespace parsedArgs) throws IOException, JDOMException{
    Document config = loadConfig(parsedArgs.getString("config_file"));
    SequenceSizes sizes = SequenceSizes.load(parsedArgs.getString("fastafile"));
    Logger.getInstance(config).printf("Read sizes of %d sequences\n", sizes.size());
    ArrayList<String> lines = completeness(EagerHitStore.load(parsedArgs.getString("blastfile")), sizes);
    try(BufferedWriter writer = DataReader.openWriter(parsedArgs.getString("output"))){
      for(String line: lines){
        writer.write(line);
        writer.newLine();
      }
    }
  }

}
