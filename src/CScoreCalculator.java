import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.Namespace;
import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.JDOMException;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * C-score of BLAST pairs:
 * <pre>
 *   cscore(A, B) = score(A, B) / max(best score for A, best score for B)
 * </pre>
 * A C-score of one marks a reciprocal best hit. The denominator takes the larger of the two
 * best scores, so a pair that is the best hit of only one of its members scores below one.
 */
class CScoreCalculator extends Constants{

  private double cutoff;

  CScoreCalculator(double cutoff){
    this.cutoff = cutoff;
  }

  CScoreCalculator(Document document){
    Element element = document.getRootElement().getChild("CScore");
    cutoff = Double.parseDouble(element.getChildText("Cutoff"));
  }

  double getCutoff(){
    return cutoff;
  }

  /**
   * Pairs scoring above the cutoff ordered by query and subject; a pair seen several times keeps
   * its highest C-score.
   */
  ArrayList<ScoredPair> computeCScores(List<HSP> hsps){
    BestScoreIndex index = BestScoreIndex.build(hsps.iterator());
    TreeMap<String, TreeMap<String, Double>> pairs = new TreeMap<>();
    for(HSP hsp: hsps){
      double cScore = hsp.score / Math.max(index.getBestScore(hsp.query), index.getBestScore(hsp.subject));
      if(!(cScore > cutoff)){
        continue;
      }
      TreeMap<String, Double> subjects = pairs.get(hsp.query);
      if(subjects == null){
        subjects = new TreeMap<>();
        pairs.put(hsp.query, subjects);
      }
      Double prev = subjects.get(hsp.subject);
      if(prev == null || cScore > prev){
        subjects.put(hsp.subject, cScore);
      }
    }
    ArrayList<ScoredPair> res = new ArrayList<>();
    for(Map.Entry<String, TreeMap<String, Double>> entry: pairs.entrySet()){
      for(Map.Entry<String, Double> subject: entry.getValue().entrySet()){
        res.add(new ScoredPair(entry.getKey(), subject.getKey(), subject.getValue()));
      }
    }
    return res;
  }

  static void addParameters(ArgumentParser parser){
    parser.description("Calculates C-score for BLAST pairs. A C-score of one is the same as " +
        "reciprocal best hit. Output is 3-column: query, subject, cscore.");
    parser.addArgument("blastfile").help("tabular BLAST file");
    parser.addArgument("-c").dest("config_file").help("path to config file, the bundled one is used if omitted");
    parser.addArgument("-cutoff").dest("cutoff").help("minimum C-score to report, " +
        "overrides CScore/Cutoff from config, default 0.9999");
    parser.addArgument("-o").dest("output").help("output file, default standard output");
  }

  static void run(Namespace parsedArgs) throws IOException, JDOMException{
    Document config = loadConfig(parsedArgs.getString("config_file"));
    CScoreCalculator calculator = new CScoreCalculator(config);
    if(parsedArgs.getString("cutoff") != null){
      calculator = new CScoreCalculator(Double.parseDouble(parsedArgs.getString("cutoff")));
    }
    Logger logger = Logger.getInstance(config);
    ArrayList<HSP> hsps;
    try(BufferedReader reader = DataReader.openReader(parsedArgs.getString("blastfile"))){
      hsps = BlastParser.parseBlast(reader);
    }
    logger.println("Register best scores ..");
    ArrayList<ScoredPair> pairs = calculator.computeCScores(hsps);
    logger.printf("%d pairs with C-score above %s\n", pairs.size(), calculator.getCutoff());
    try(BufferedWriter writer = DataReader.openWriter(parsedArgs.getString("output"))){
      for(ScoredPair pair: pairs){
        writer.write(pair.toString());
        writer.newLine();
      }
    }
  }

}
