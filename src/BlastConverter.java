import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.Namespace;
import org.jdom2.Document;
import org.jdom2.JDOMException;

import java.io.BufferedWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rewrites BLAST files: swapped query and subject, BED projection, sorted lines.
 */
class BlastConverter extends Constants{

  private static class QueryScoreComparator implements Comparator<HSP>{

    @Override
    public int compare(HSP a, HSP b){
      int res = a.query.compareTo(b.query);
      return res != 0 ? res : Double.compare(b.score, a.score);
    }

  }

  private static class QueryPositionComparator implements Comparator<HSP>{

    @Override
    public int compare(HSP a, HSP b){
      int res = a.query.compareTo(b.query);
      return res != 0 ? res : Integer.compare(a.startQ, b.startQ);
    }

  }

  private static class SubjectPositionComparator implements Comparator<HSP>{

    @Override
    public int compare(HSP a, HSP b){
      int res = a.subject.compareTo(b.subject);
      return res != 0 ? res : Integer.compare(a.startS, b.startS);
    }

  }

  // query, then score descending
  static final Comparator<HSP> BY_QUERY_SCORE = new QueryScoreComparator();
  static final Comparator<HSP> BY_QUERY_POSITION = new QueryPositionComparator();
  static final Comparator<HSP> BY_SUBJECT_POSITION = new SubjectPositionComparator();

  static ArrayList<HSP> swap(List<HSP> hsps){
    ArrayList<HSP> res = new ArrayList<>(hsps.size());
    for(HSP hsp: hsps){
      res.add(hsp.swapped());
    }
    res.sort(BY_QUERY_SCORE);
    return res;
  }

  static ArrayList<HSP> sort(List<HSP> hsps, Comparator<HSP> comparator){
    ArrayList<HSP> res = new ArrayList<>(hsps);
    res.sort(comparator);
    return res;
  }

  static ArrayList<String> toBed(List<HSP> hsps){
    ArrayList<String> res = new ArrayList<>(hsps.size());
    for(HSP hsp: hsps){
      res.add(hsp.projection().toBedLine(hsp.scoreText()));
    }
    return res;
  }

  private static void write(List<?> lines, String outPath) throws IOException{
    try(BufferedWriter writer = DataReader.openWriter(outPath)){
      for(Object line: lines){
        writer.write(line.toString());
        writer.newLine();
      }
    }
  }

  private static void addCommonParameters(ArgumentParser parser){
    parser.addArgument("blastfile").help("tabular BLAST file");
    parser.addArgument("-c").dest("config_file").help("path to config file, the bundled one is used if omitted");
    parser.addArgument("-o").dest("output").help("output file, default standard output");
  }

  static void addSwapParameters(ArgumentParser parser){
    parser.description("Prints a new BLAST file with query and subject swapped, sorted by query " +
        "and descending score.");
    addCommonParameters(parser);
  }

  static void addBedParameters(ArgumentParser parser){
    parser.description("Prints a BED file based on the subject coordinates in the BLAST report.");
    addCommonParameters(parser);
  }

  static void addSortParameters(ArgumentParser parser){
    parser.description("Sorts lines so that the same query is grouped together with scores descending.");
    addCommonParameters(parser);
    parser.addArgument("-query").dest("by_query").action(Arguments.storeTrue())
        .help("sort by query position");
    parser.addArgument("-ref").dest("by_ref").action(Arguments.storeTrue())
        .help("sort by reference position");
  }

  static void runSwap(Namespace parsedArgs) throws IOException, JDOMException{
    Document config = loadConfig(parsedArgs.getString("config_file"));
    EagerHitStore store = EagerHitStore.load(parsedArgs.getString("blastfile"));
    write(swap(store.getHSPs()), parsedArgs.getString("output"));
    Logger.getInstance(config).printf("%d hits swapped\n", store.size());
  }

  static void runBed(Namespace parsedArgs) throws IOException, JDOMException{
    Document config = loadConfig(parsedArgs.getString("config_file"));
    EagerHitStore store = EagerHitStore.load(parsedArgs.getString("blastfile"));
    write(toBed(store.getHSPs()), parsedArgs.getString("output"));
    Logger.getInstance(config).printf("%d BED lines written\n", store.size());
  }

  static void runSort(Namespace parsedArgs) throws IOException, JDOMException{
    Document config = loadConfig(parsedArgs.getString("config_file"));
    EagerHitStore store = EagerHitStore.load(parsedArgs.getString("blastfile"));
    Comparator<HSP> comparator = BY_QUERY_SCORE;
    if(parsedArgs.getBoolean("by_query")){
      comparator = BY_QUERY_POSITION;
    }else if(parsedArgs.getBoolean("by_ref")){
      comparator = BY_SUBJECT_POSITION;
    }
    write(sort(store.getHSPs(), comparator), parsedArgs.getString("output"));
    Logger.getInstance(config).printf("%d hits sorted\n", store.size());
  }

}
